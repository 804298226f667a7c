/*
 * どこで: Registration サービス層
 * 何を: 登録結果ごとの件数メトリクスを記録する
 * なぜ: 入力不備と保存失敗の発生状況を Micrometer から観測するため
 */
package com.example.registration.service;

import com.example.registration.model.RegistrationOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class RegistrationMetrics {

  private static final String METRIC_REGISTRATION_TOTAL = "registration.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<RegistrationOutcome, Counter> outcomeCounters =
      new ConcurrentHashMap<>();

  public RegistrationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordOutcome(RegistrationOutcome outcome) {
    outcomeCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_REGISTRATION_TOTAL)
                    .description("User registration outcomes")
                    .tags(Tags.of("result", outcome.tag()))
                    .register(meterRegistry))
        .increment();
  }
}
