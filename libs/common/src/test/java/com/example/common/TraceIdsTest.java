package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceIdsTest {

  @Test
  void newTraceIdIsUnique() {
    assertThat(TraceIds.newTraceId()).isNotBlank().isNotEqualTo(TraceIds.newTraceId());
  }

  @Test
  void openScopePutsTraceIdAndRemovesItOnClose() {
    try (MDC.MDCCloseable ignored = TraceIds.openScope()) {
      assertThat(MDC.get(TraceIds.MDC_KEY)).isNotBlank();
    }
    assertThat(MDC.get(TraceIds.MDC_KEY)).isNull();
  }
}
