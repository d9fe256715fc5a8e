/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import zipkin2.Endpoint;
import zipkin2.Span;

/**
 * Writes one trace per tick with a service name, span name and attribute unique to this tracker,
 * and remembers how many spans of each {@link Scenario} every tick wrote. Searches and metrics
 * over a range of ticks then have an exact expected answer.
 *
 * <p>Not thread-safe: an instance is confined to the loop that writes with it.
 */
public final class SpanTracker {
  /** Past this many ticks, a tracker is replaced so that old data doesn't accumulate. */
  public static final int MAX_ENTRIES = 500;
  /** Searches begin once this many writes succeeded. */
  public static final int MIN_WRITES = 30;
  /** Ticks at the end of the tracker that are never searched, as they may not be visible yet. */
  static final int RECENT_ENTRIES = 3;
  /** Searches cover this many ticks after the first, so 21 in total. */
  static final int WINDOW_ENTRIES = 20;
  static final String ATTRIBUTE_KEY = "vulture.tracked";

  /** What the spans of a scenario have in common, and so what a search for them filters on. */
  public enum Scenario {
    /** Every span of the trace has the tracker's service name. */
    SERVICE_NAME,
    SPAN_NAME,
    ATTRIBUTE
  }

  public static SpanTracker create(long createdAt) {
    return new SpanTracker(createdAt);
  }

  final String serviceName, spanName, attributeValue;
  final Endpoint localEndpoint;
  final List<Long> timestamps = new ArrayList<>();
  // per tick, the span counts indexed by Scenario.ordinal()
  final List<int[]> spanCounts = new ArrayList<>();
  int successfulWrites;

  SpanTracker(long createdAt) {
    serviceName = "vulture-tracked-service-" + createdAt;
    spanName = "vulture-tracked-span-" + createdAt;
    attributeValue = "vulture-tracked-value-" + createdAt;
    localEndpoint = Endpoint.newBuilder().serviceName(serviceName).build();
  }

  /** Number of ticks recorded, including those whose write failed. */
  public int size() {
    return timestamps.size();
  }

  /** Number of ticks whose write succeeded. */
  public int successfulWrites() {
    return successfulWrites;
  }

  /** Epoch milliseconds of the tick at the given position. */
  public long timestamp(int position) {
    return timestamps.get(position);
  }

  /**
   * Records a tick at the given time and returns the trace to write for it. The trace has 1-4
   * spans of each scenario after 1-4 spans of none but the service name.
   */
  public List<Span> nextBatch(long timestamp, Random random) {
    if (random == null) throw new NullPointerException("random == null");
    long traceIdHigh = TraceInfo.nonZeroLong(random), traceIdLow = TraceInfo.nonZeroLong(random);
    long timestampMicros = TimeUnit.MILLISECONDS.toMicros(timestamp);
    int plain = 1 + random.nextInt(4);
    int sameName = 1 + random.nextInt(4);
    int sameAttribute = 1 + random.nextInt(4);

    List<Span> result = new ArrayList<>();
    long rootId = 0L;
    for (int i = 0; i < plain + sameName + sameAttribute; i++) {
      long id = TraceInfo.nonZeroLong(random);
      Span.Builder span = Span.newBuilder()
        .traceId(traceIdHigh, traceIdLow)
        .id(id)
        .name("vulture-tracked")
        .localEndpoint(localEndpoint)
        .timestamp(timestampMicros)
        .duration(1 + random.nextInt(100));
      if (rootId == 0L) {
        rootId = id;
      } else {
        span.parentId(rootId);
      }
      if (i >= plain && i < plain + sameName) {
        span.name(spanName);
      } else if (i >= plain + sameName) {
        span.putTag(ATTRIBUTE_KEY, attributeValue);
      }
      result.add(span.build());
    }

    timestamps.add(timestamp);
    spanCounts.add(new int[] {result.size(), sameName, sameAttribute});
    successfulWrites++;
    return Collections.unmodifiableList(result);
  }

  /**
   * Call when the last batch couldn't be written. Its timestamp is kept so that positions stay
   * aligned with metrics steps.
   */
  public void lastWriteFailed() {
    if (spanCounts.isEmpty()) throw new IllegalStateException("nothing written");
    int[] last = spanCounts.get(spanCounts.size() - 1);
    if (last[0] == 0) return;
    for (int i = 0; i < last.length; i++) last[i] = 0;
    successfulWrites--;
  }

  /** The filter that matches exactly the spans of the scenario. */
  public String traceQL(Scenario scenario) {
    switch (scenario) {
      case SERVICE_NAME:
        return "{resource.service.name = \"" + serviceName + "\"}";
      case SPAN_NAME:
        return "{name = \"" + spanName + "\"}";
      case ATTRIBUTE:
        return "{span." + ATTRIBUTE_KEY + " = \"" + attributeValue + "\"}";
      default:
        throw new AssertionError(scenario);
    }
  }

  /** Span counts of the scenario for each tick from start to end, inclusive. */
  public int[] spanCounts(Scenario scenario, int start, int end) {
    checkRange(start, end);
    int[] result = new int[end - start + 1];
    for (int i = start; i <= end; i++) result[i - start] = spanCounts.get(i)[scenario.ordinal()];
    return result;
  }

  /** Total span count of the scenario from start to end, inclusive. */
  public int spanCount(Scenario scenario, int start, int end) {
    int result = 0;
    for (int count : spanCounts(scenario, start, end)) result += count;
    return result;
  }

  /** Number of traces written from start to end, inclusive. Failed ticks wrote none. */
  public int traceCount(int start, int end) {
    int result = 0;
    for (int count : spanCounts(Scenario.SERVICE_NAME, start, end)) {
      if (count > 0) result++;
    }
    return result;
  }

  /**
   * Returns the inclusive start and end positions of a random range of ticks to search. The last
   * few ticks are never chosen.
   *
   * @throws IllegalStateException if too few ticks have been recorded
   */
  public int[] randomWindow(Random random) {
    int bound = size() - RECENT_ENTRIES - WINDOW_ENTRIES;
    if (bound <= 0) throw new IllegalStateException("too few entries: " + size());
    int start = random.nextInt(bound);
    return new int[] {start, start + WINDOW_ENTRIES};
  }

  void checkRange(int start, int end) {
    if (start < 0 || end >= size() || start > end) {
      throw new IndexOutOfBoundsException("[" + start + ", " + end + "] of " + size());
    }
  }

  @Override public String toString() {
    return "SpanTracker{serviceName=" + serviceName + ", size=" + size() + "}";
  }
}
