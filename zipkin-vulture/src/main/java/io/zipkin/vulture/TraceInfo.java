/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import zipkin2.Endpoint;
import zipkin2.Span;
import zipkin2.internal.Nullable;

/**
 * Derives a synthetic trace from a seed: a timestamp in whole seconds and a tenant.
 *
 * <p>Everything random, from the trace ID to each tag value, is drawn from one {@link Random}
 * seeded only with the seed's epoch seconds. The draws happen in a fixed order, so a writer and a
 * reader that never talk to each other agree on the trace. Never draw from wall-clock time or a
 * shared random here: the validators re-create the trace later, often in another process.
 *
 * <p>An instance is stateful. Each call to {@link #nextBatches()} advances the generator by one
 * emission round, and must happen-before the next. Use {@link #constructTraceFromEpoch()} to get
 * the complete expected trace from a fresh generator.
 */
public final class TraceInfo {
  public static final int DEFAULT_MAX_LONG_WRITES = 3;
  static final String SERVICE_NAME = "zipkin-vulture";
  static final Endpoint LOCAL_ENDPOINT = Endpoint.newBuilder().serviceName(SERVICE_NAME).build();
  static final char[] LETTERS =
    "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();

  public static TraceInfo create(long timestamp, String tenant) {
    return create(timestamp, DEFAULT_MAX_LONG_WRITES, tenant);
  }

  /**
   * @param timestamp epoch milliseconds of the seed. Sub-second precision is dropped.
   * @param maxLongWrites exclusive upper bound of continuation rounds. Zero means every batch is
   * written at once.
   * @param tenant the organization the trace is written to and read from.
   * @throws IllegalArgumentException if the timestamp or long write bound is negative
   */
  public static TraceInfo create(long timestamp, int maxLongWrites, String tenant) {
    if (tenant == null) throw new NullPointerException("tenant == null");
    if (timestamp < 0) throw new IllegalArgumentException("timestamp < 0: " + timestamp);
    if (maxLongWrites < 0) {
      throw new IllegalArgumentException("maxLongWrites < 0: " + maxLongWrites);
    }
    return new TraceInfo(timestamp - timestamp % 1000L, maxLongWrites, tenant);
  }

  final long timestamp;
  final int maxLongWrites;
  final String tenant;
  final Random random;
  final long traceIdHigh, traceIdLow;
  final int totalLongWrites;
  int longWritesRemaining;

  TraceInfo(long timestamp, int maxLongWrites, String tenant) {
    this.timestamp = timestamp;
    this.maxLongWrites = maxLongWrites;
    this.tenant = tenant;
    this.random = new Random(epochSeconds());
    this.traceIdHigh = nonZeroLong(random);
    this.traceIdLow = nonZeroLong(random);
    this.totalLongWrites = maxLongWrites > 0 ? random.nextInt(maxLongWrites) : 0;
    this.longWritesRemaining = totalLongWrites;
  }

  /** Epoch milliseconds of the seed, always a whole second. */
  public long timestamp() {
    return timestamp;
  }

  public String tenant() {
    return tenant;
  }

  public long epochSeconds() {
    return TimeUnit.MILLISECONDS.toSeconds(timestamp);
  }

  /** The 32 character lower-hex trace ID, as used in API calls. */
  public String hexTraceId() {
    return toLowerHex(traceIdHigh) + toLowerHex(traceIdLow);
  }

  /** Continuation rounds written after the initial one, regardless of progress. */
  public int totalLongWrites() {
    return totalLongWrites;
  }

  public int longWritesRemaining() {
    return longWritesRemaining;
  }

  /** Marks one continuation round as written. */
  public void done() {
    if (longWritesRemaining > 0) longWritesRemaining--;
  }

  /**
   * Returns true when all rounds of this trace should have been written, given the write cadence.
   *
   * @param now epoch milliseconds
   * @param writeBackoff milliseconds between write ticks
   * @param longWriteBackoff milliseconds between continuation rounds
   */
  public boolean ready(long now, long writeBackoff, long longWriteBackoff) {
    if (timestamp > now - writeBackoff) return false;
    long lastWrite = timestamp + totalLongWrites * longWriteBackoff;
    return now >= lastWrite + longWriteBackoff;
  }

  /** Generates the batches of the next emission round. */
  public List<List<Span>> nextBatches() {
    int batchCount = randomInt(1, 5);
    List<List<Span>> result = new ArrayList<>(batchCount);
    for (int i = 0; i < batchCount; i++) {
      result.add(nextBatch());
    }
    return result;
  }

  /** Returns every span the backend should hold for this seed once all rounds are written. */
  public List<Span> constructTraceFromEpoch() {
    TraceInfo fresh = new TraceInfo(timestamp, maxLongWrites, tenant);
    List<Span> result = new ArrayList<>();
    for (int round = 0; round <= fresh.totalLongWrites; round++) {
      for (List<Span> batch : fresh.nextBatches()) result.addAll(batch);
    }
    return result;
  }

  /**
   * Picks a tag of the trace to search for. The pick depends only on the seed and the trace, so
   * a failing search can be replayed.
   *
   * @return null if no span in the trace has tags
   */
  @Nullable public Attribute randomAttribute(List<Span> trace) {
    List<Attribute> attributes = new ArrayList<>();
    for (Span span : TraceDiff.sorted(trace)) {
      for (Map.Entry<String, String> tag : span.tags().entrySet()) {
        attributes.add(new Attribute(tag.getKey(), tag.getValue()));
      }
    }
    if (attributes.isEmpty()) return null;
    Random pick = new Random(~epochSeconds());
    return attributes.get(pick.nextInt(attributes.size()));
  }

  List<Span> nextBatch() {
    int spanCount = randomInt(1, 5);
    List<Span> batch = new ArrayList<>(spanCount);
    long parentId = 0L;
    for (int i = 0; i < spanCount; i++) {
      long id = nonZeroLong(random);
      batch.add(nextSpan(id, parentId));
      // the first span is the root. later spans hang off their predecessor or its parent
      if (i == 0 || random.nextBoolean()) parentId = id;
    }
    return Collections.unmodifiableList(batch);
  }

  Span nextSpan(long id, long parentId) {
    long timestampMicros = TimeUnit.MILLISECONDS.toMicros(timestamp);
    Span.Builder result = Span.newBuilder()
      .traceId(traceIdHigh, traceIdLow)
      .id(id)
      .name("vulture-" + randomInt(0, 100))
      .localEndpoint(LOCAL_ENDPOINT)
      .timestamp(timestampMicros)
      .duration(randomInt(0, 100));
    if (parentId != 0L) result.parentId(parentId);

    int tagCount = randomInt(1, 5);
    for (int i = 0; i < tagCount; i++) {
      result.putTag("vulture-" + i, randomString(randomInt(5, 20)));
    }

    int eventCount = randomInt(1, 5);
    for (int i = 0; i < eventCount; i++) {
      String value = "vulture-event-" + i + "=" + randomString(randomInt(5, 20));
      result.addAnnotation(timestampMicros, value);
    }
    return result.build();
  }

  /** Returns a value in (min, max), exclusive on both ends. */
  int randomInt(int min, int max) {
    min++;
    if (max <= min) return min;
    return min + random.nextInt(max - min);
  }

  String randomString(int length) {
    char[] result = new char[length];
    for (int i = 0; i < length; i++) {
      result[i] = LETTERS[random.nextInt(LETTERS.length)];
    }
    return new String(result);
  }

  static long nonZeroLong(Random random) {
    long result;
    do {
      result = random.nextLong() & Long.MAX_VALUE;
    } while (result == 0L);
    return result;
  }

  static String toLowerHex(long v) {
    String hex = Long.toHexString(v);
    if (hex.length() == 16) return hex;
    StringBuilder result = new StringBuilder(16);
    for (int i = hex.length(); i < 16; i++) result.append('0');
    return result.append(hex).toString();
  }

  @Override public String toString() {
    return "TraceInfo{traceId=" + hexTraceId() + ", timestamp=" + timestamp
      + ", tenant=" + tenant + ", longWritesRemaining=" + longWritesRemaining + "}";
  }

  /** A tag key and value present somewhere in a generated trace. */
  public static final class Attribute {
    final String key, value;

    public Attribute(String key, String value) {
      if (key == null) throw new NullPointerException("key == null");
      if (value == null) throw new NullPointerException("value == null");
      this.key = key;
      this.value = value;
    }

    public String key() {
      return key;
    }

    public String value() {
      return value;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof Attribute)) return false;
      Attribute that = (Attribute) o;
      return key.equals(that.key) && value.equals(that.value);
    }

    @Override public int hashCode() {
      return 31 * key.hashCode() + value.hashCode();
    }

    @Override public String toString() {
      return key + "=" + value;
    }
  }
}
