/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TraceMetricsValidatorTest {
  static final long SEED = 1_700_000_010_000L;

  TraceInfo info = TraceInfo.create(SEED, 0, "test-org");
  FakeBackend backend = new FakeBackend();
  TraceMetricsValidator validator = new TraceMetricsValidator(backend, backend, 15_000L);

  @BeforeEach void writeTrace() throws IOException {
    new TraceEmitter(backend.writer()).emitAllBatches(TraceInfo.create(SEED, 0, "test-org"));
  }

  @Test void agreesWithSearch() {
    Outcome outcome = validator.validate(info);

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(backend.requests()).hasSize(2);
    assertThat(backend.requests().get(1)).startsWith("queryRange:{.vulture-")
      .endsWith("\"} | count_over_time()");
  }

  @Test void noSeries() {
    backend.series(List.of());

    Outcome outcome = validator.validate(info);

    assertThat(outcome.metrics().count(ErrorCategory.NOT_FOUND_METRICS)).isOne();
    assertThat(outcome.error())
      .hasMessage("expected trace " + info.hexTraceId() + " not found in metrics");
  }

  @Test void tooManySeries() {
    MetricSeries series = MetricSeries.create(Map.of(), List.of(MetricSeries.Sample.create(1L, 1)));
    backend.series(List.of(series, series));

    Outcome outcome = validator.validate(info);

    assertThat(outcome.metrics().count(ErrorCategory.INCORRECT_METRICS_RESULT)).isOne();
    assertThat(outcome.error()).hasMessage("expected exactly 1 series, got 2");
  }

  @Test void inaccurate() {
    backend.searchResults(List.of(TraceSummary.create(info.hexTraceId(), 4)));
    backend.series(List.of(MetricSeries.create(Map.of(), List.of(
      MetricSeries.Sample.create(1L, 1), MetricSeries.Sample.create(2L, 1)))));

    Outcome outcome = validator.validate(info);

    assertThat(outcome.metrics().count(ErrorCategory.INACCURATE_METRICS)).isOne();
    assertThat(outcome.error())
      .hasMessageEndingWith("metric count sum=2.000000, actual span count=4");
  }

  @Test void requestFailed() {
    backend.metricsError(new IOException("bad gateway"));

    Outcome outcome = validator.validate(info);

    assertThat(outcome.metrics().count(ErrorCategory.REQUEST_FAILED)).isOne();
  }
}
