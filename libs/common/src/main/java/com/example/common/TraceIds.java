/*
 * どこで: 共通ユーティリティ
 * 何を: trace_id の採番と MDC への設定を行う
 * なぜ: 1 回の処理に属するログ行を trace_id で束ねるため
 */
package com.example.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // close() で MDC から trace_id を取り除く。try-with-resources で使う前提
  public static MDC.MDCCloseable openScope() {
    return MDC.putCloseable(MDC_KEY, newTraceId());
  }
}
