/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.server;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.zipkin.vulture.ErrorCategory;
import io.zipkin.vulture.VultureMetrics;
import java.util.EnumMap;
import java.util.Map;

/**
 * Registers counters named like Zipkin's collector metrics. Scraped through Prometheus, these
 * appear as {@code zipkin_vulture_trace_total}, {@code zipkin_vulture_error_total} and
 * {@code zipkin_vulture_trace_errors_total{error="..."}}.
 */
final class MicrometerVultureMetrics implements VultureMetrics {
  final Counter traces, errors;
  final Map<ErrorCategory, Counter> traceErrors = new EnumMap<>(ErrorCategory.class);

  MicrometerVultureMetrics(MeterRegistry registry) {
    traces = Counter.builder("zipkin_vulture.trace.total")
      .description("cumulative amount of traces read, searched or written")
      .register(registry);
    errors = Counter.builder("zipkin_vulture.error.total")
      .description("cumulative amount of failed checks, excluding skips")
      .register(registry);
    // eagerly registered so that every category is scraped as zero before it happens
    for (ErrorCategory category : ErrorCategory.values()) {
      traceErrors.put(category, Counter.builder("zipkin_vulture.trace.errors")
        .description("cumulative amount of failed or skipped checks by category")
        .tag("error", category.label())
        .register(registry));
    }
  }

  @Override public void incrementTracesInspected(int quantity) {
    traces.increment(quantity);
  }

  @Override public void incrementErrors(int quantity) {
    errors.increment(quantity);
  }

  @Override public void incrementTraceErrors(ErrorCategory category, int quantity) {
    traceErrors.get(category).increment(quantity);
  }

  @Override public String toString() {
    return "MicrometerVultureMetrics{}";
  }
}
