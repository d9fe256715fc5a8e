/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryVultureMetricsTest {
  InMemoryVultureMetrics metrics = new InMemoryVultureMetrics();

  @Test void record() {
    metrics.record(new TraceMetrics()
      .incrementRequested()
      .increment(ErrorCategory.MISSING_SPANS)
      .increment(ErrorCategory.NOT_FOUND_SEARCH_ATTRIBUTE));

    assertThat(metrics.tracesInspected()).isOne();
    assertThat(metrics.traceErrors(ErrorCategory.MISSING_SPANS)).isOne();
    assertThat(metrics.traceErrors(ErrorCategory.NOT_FOUND_SEARCH_ATTRIBUTE)).isOne();
    assertThat(metrics.errors()).isOne(); // skip isn't an error
  }

  @Test void record_success() {
    metrics.record(new TraceMetrics().incrementRequested());

    assertThat(metrics.tracesInspected()).isOne();
    assertThat(metrics.errors()).isZero();
  }

  @Test void concurrentIncrements() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        futures.add(executor.submit(() -> {
          for (int j = 0; j < 1000; j++) {
            metrics.record(new TraceMetrics().incrementRequested()
              .increment(ErrorCategory.REQUEST_FAILED));
          }
        }));
      }
      for (Future<?> future : futures) future.get();
    } finally {
      executor.shutdownNow();
    }

    assertThat(metrics.tracesInspected()).isEqualTo(4000);
    assertThat(metrics.traceErrors(ErrorCategory.REQUEST_FAILED)).isEqualTo(4000);
    assertThat(metrics.errors()).isEqualTo(4000);
  }

  @Test void clear() {
    metrics.incrementErrors(2);
    metrics.clear();

    assertThat(metrics.errors()).isZero();
  }

  @Test void labels() {
    assertThat(ErrorCategory.NOT_FOUND_BY_ID.label()).isEqualTo("not_found_by_id");
    assertThat(ErrorCategory.WRITE_FAILED.label()).isEqualTo("write_failed");
  }
}
