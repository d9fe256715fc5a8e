/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Backs validation mode and tests. */
public final class InMemoryVultureMetrics implements VultureMetrics {
  static final String TRACES_INSPECTED = "traces";
  static final String ERRORS = "errors";

  final ConcurrentHashMap<String, AtomicInteger> metrics = new ConcurrentHashMap<>();

  @Override public void incrementTracesInspected(int quantity) {
    increment(TRACES_INSPECTED, quantity);
  }

  public int tracesInspected() {
    return get(TRACES_INSPECTED);
  }

  @Override public void incrementErrors(int quantity) {
    increment(ERRORS, quantity);
  }

  public int errors() {
    return get(ERRORS);
  }

  @Override public void incrementTraceErrors(ErrorCategory category, int quantity) {
    increment(scope(category), quantity);
  }

  public int traceErrors(ErrorCategory category) {
    return get(scope(category));
  }

  public void clear() {
    metrics.clear();
  }

  int get(String key) {
    AtomicInteger atomic = metrics.get(key);
    return atomic == null ? 0 : atomic.get();
  }

  void increment(String key, int quantity) {
    if (quantity == 0) return;
    metrics.computeIfAbsent(key, k -> new AtomicInteger()).addAndGet(quantity);
  }

  static String scope(ErrorCategory category) {
    return ERRORS + "." + category.label();
  }
}
