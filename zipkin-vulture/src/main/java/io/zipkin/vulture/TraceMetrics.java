/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tally of a single read, search or write operation. Instances are confined to the thread doing
 * the operation and are later {@link VultureMetrics#record(TraceMetrics) recorded} into the shared
 * sink.
 */
public final class TraceMetrics {
  int requested;
  final EnumMap<ErrorCategory, Integer> counts = new EnumMap<>(ErrorCategory.class);

  public TraceMetrics incrementRequested() {
    requested++;
    return this;
  }

  public TraceMetrics increment(ErrorCategory category) {
    if (category == null) throw new NullPointerException("category == null");
    counts.merge(category, 1, Integer::sum);
    return this;
  }

  /** Number of traces inspected by this operation. */
  public int requested() {
    return requested;
  }

  public int count(ErrorCategory category) {
    Integer count = counts.get(category);
    return count != null ? count : 0;
  }

  /** Sum of counts in categories that are {@link ErrorCategory#isError() errors}. */
  public int errorTotal() {
    int result = 0;
    for (Map.Entry<ErrorCategory, Integer> entry : counts.entrySet()) {
      if (entry.getKey().isError()) result += entry.getValue();
    }
    return result;
  }

  public boolean hasErrors() {
    return errorTotal() > 0;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceMetrics)) return false;
    TraceMetrics that = (TraceMetrics) o;
    return requested == that.requested && counts.equals(that.counts);
  }

  @Override public int hashCode() {
    return 31 * requested + counts.hashCode();
  }

  @Override public String toString() {
    return "TraceMetrics{requested=" + requested + ", counts=" + counts + "}";
  }
}
