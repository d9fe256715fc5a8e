/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

/** A search hit: the trace ID and how many of its spans matched the search. */
public final class TraceSummary {
  public static TraceSummary create(String traceId, int matchedSpans) {
    return new TraceSummary(traceId, matchedSpans);
  }

  final String traceId;
  final int matchedSpans;

  TraceSummary(String traceId, int matchedSpans) {
    if (traceId == null) throw new NullPointerException("traceId == null");
    this.traceId = traceId;
    this.matchedSpans = matchedSpans;
  }

  /** The ID as returned by the backend. Compare with {@link TraceIds#equalHex}. */
  public String traceId() {
    return traceId;
  }

  /** Zero when the backend doesn't report matches. */
  public int matchedSpans() {
    return matchedSpans;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof TraceSummary)) return false;
    TraceSummary that = (TraceSummary) o;
    return traceId.equals(that.traceId) && matchedSpans == that.matchedSpans;
  }

  @Override public int hashCode() {
    return 31 * traceId.hashCode() + matchedSpans;
  }

  @Override public String toString() {
    return "TraceSummary{traceId=" + traceId + ", matchedSpans=" + matchedSpans + "}";
  }
}
