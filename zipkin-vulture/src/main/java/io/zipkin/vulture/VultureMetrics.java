/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

/**
 * Instrumented by the write, read, search and metrics loops. These loops report concurrently, so
 * implementations must be thread-safe.
 *
 * <p>Implementations expose three counters: traces inspected, total errors and trace errors
 * labeled by {@link ErrorCategory#label()}.
 */
public interface VultureMetrics {

  /** Increments the count of traces read, searched or written. */
  void incrementTracesInspected(int quantity);

  /** Increments the count of failures, regardless of category. */
  void incrementErrors(int quantity);

  /** Increments the count of failures or skips in the given category. */
  void incrementTraceErrors(ErrorCategory category, int quantity);

  /** Adds the tally of one operation to these metrics. */
  default void record(TraceMetrics metrics) {
    incrementTracesInspected(metrics.requested());
    for (ErrorCategory category : ErrorCategory.values()) {
      int count = metrics.count(category);
      if (count > 0) incrementTraceErrors(category, count);
    }
    int errors = metrics.errorTotal();
    if (errors > 0) incrementErrors(errors);
  }

  VultureMetrics NOOP_METRICS = new VultureMetrics() {
    @Override public void incrementTracesInspected(int quantity) {
    }

    @Override public void incrementErrors(int quantity) {
    }

    @Override public void incrementTraceErrors(ErrorCategory category, int quantity) {
    }

    @Override public String toString() {
      return "NoOpVultureMetrics";
    }
  };
}
