/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.MINUTES;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class VultureTest {
  static final long SEED = 1_700_000_010_000L; // aligned to 15s
  static final long WRITE_BACKOFF = SECONDS.toMillis(15);
  static final long LONG_WRITE_BACKOFF = MINUTES.toMillis(1);
  static final long SPAN_COUNT_BACKOFF = SECONDS.toMillis(30);

  /** Always picks the oldest candidate. */
  static final Random OLDEST = new Random() {
    @Override public long nextLong() {
      return 0L;
    }
  };

  FakeBackend backend = new FakeBackend();
  InMemoryVultureMetrics metrics = new InMemoryVultureMetrics();
  Vulture vulture;

  @AfterEach void close() {
    if (vulture != null) vulture.close();
  }

  Vulture.Builder builder(long startTime) {
    return Vulture.newBuilder()
      .writer(backend.writer())
      .querier(backend)
      .searcher(backend)
      .metricsQuerier(backend)
      .metrics(metrics)
      .clock(Clock.fixed(Instant.ofEpochMilli(startTime), ZoneOffset.UTC))
      .tenant("test-org");
  }

  /** Writes a trace at {@link #SEED} and returns a vulture started long enough before it. */
  Vulture seededVulture(long now) throws IOException {
    new TraceEmitter(backend.writer()).emitAllBatches(TraceInfo.create(SEED, 0, "test-org"));
    return vulture = builder(SEED - 2 * WRITE_BACKOFF)
      .random(OLDEST)
      .retention(now - SEED)
      .maxLongWrites(0)
      .build();
  }

  @Test void doRead() throws IOException {
    long now = SEED + WRITE_BACKOFF + LONG_WRITE_BACKOFF;
    seededVulture(now).doRead(now);

    assertThat(backend.requests())
      .containsExactly("getTrace:" + TraceInfo.create(SEED, "test-org").hexTraceId());
    assertThat(metrics.tracesInspected()).isOne();
    assertThat(metrics.errors()).isZero();
  }

  @Test void doSearch_tagAndTraceQL() throws IOException {
    long now = SEED + WRITE_BACKOFF + LONG_WRITE_BACKOFF;
    seededVulture(now).doSearch(now);

    assertThat(backend.requests()).hasSize(2);
    assertThat(backend.requests().get(0)).startsWith("searchTag:");
    assertThat(backend.requests().get(1)).startsWith("searchTraceQL:");
    assertThat(metrics.tracesInspected()).isEqualTo(2);
    assertThat(metrics.errors()).isZero();
  }

  @Test void doMetrics() throws IOException {
    long now = SEED + WRITE_BACKOFF + LONG_WRITE_BACKOFF;
    seededVulture(now).doMetrics(now);

    assertThat(metrics.tracesInspected()).isOne();
    assertThat(metrics.errors()).isZero();
  }

  @Test void doRead_countsErrors() throws IOException {
    long now = SEED + WRITE_BACKOFF + LONG_WRITE_BACKOFF;
    seededVulture(now);
    backend.queryError(new IOException("connection reset"));

    vulture.doRead(now);

    assertThat(metrics.traceErrors(ErrorCategory.REQUEST_FAILED)).isOne();
    assertThat(metrics.errors()).isOne();
  }

  @Test void doRead_skipsTraceNotReady() throws IOException {
    long now = SEED + WRITE_BACKOFF - 1;
    seededVulture(now).doRead(now);

    assertThat(backend.requests()).isEmpty();
    assertThat(metrics.tracesInspected()).isZero();
  }

  @Test void doRead_skipsRightAfterStart() {
    vulture = builder(SEED).build();

    vulture.doRead(SEED + WRITE_BACKOFF);

    assertThat(backend.requests()).isEmpty();
  }

  @Test void traceIsReady() {
    vulture = builder(SEED).maxLongWrites(0).build();

    // written before this process started writing
    assertThat(vulture.traceIsReady(TraceInfo.create(SEED + WRITE_BACKOFF, 0, "test-org"),
      SEED + MINUTES.toMillis(10))).isFalse();

    TraceInfo info = TraceInfo.create(SEED + 2 * WRITE_BACKOFF, 0, "test-org");
    assertThat(vulture.traceIsReady(info, info.timestamp())).isFalse();
    assertThat(vulture.traceIsReady(info, info.timestamp() + LONG_WRITE_BACKOFF)).isTrue();
  }

  @Test void doWrite_failureCountedOnce() {
    backend.writer().failWith(new IOException("connection refused"));
    vulture = builder(SEED).build();

    vulture.doWrite(SEED + WRITE_BACKOFF);

    assertThat(backend.writer().batches()).isEmpty();
    assertThat(metrics.traceErrors(ErrorCategory.WRITE_FAILED)).isOne();
    assertThat(metrics.errors()).isOne();
    assertThat(vulture.pendingLongWrites()).isZero();
  }

  @Test void doWrite_invalidTenant() {
    vulture = builder(SEED).tenant("a/b").build();

    vulture.doWrite(SEED + WRITE_BACKOFF);

    assertThat(backend.writer().calls()).isZero();
    assertThat(metrics.traceErrors(ErrorCategory.WRITE_FAILED)).isOne();
  }

  @Test void doWrite_roundsSeed() {
    vulture = builder(SEED).maxLongWrites(0).build();

    vulture.doWrite(SEED + WRITE_BACKOFF + 7_000L);

    TraceInfo expected = TraceInfo.create(SEED + WRITE_BACKOFF, 0, "test-org");
    assertThat(backend.writer().spans())
      .containsExactlyElementsOf(expected.constructTraceFromEpoch());
  }

  Vulture spanCountVulture() {
    return vulture = builder(SEED)
      .spanCountBackoff(SPAN_COUNT_BACKOFF)
      .random(new Random(1L))
      .build();
  }

  /** Runs the span count loop for the given number of ticks and returns the time of the last. */
  long spanCountTicks(int ticks) {
    long now = SEED;
    for (int i = 0; i < ticks; i++) {
      now += SPAN_COUNT_BACKOFF;
      vulture.doSpanCount(now);
    }
    return now;
  }

  @Test void doSpanCount_onlyWritesUntilEnoughTraces() {
    spanCountVulture();

    spanCountTicks(SpanTracker.MIN_WRITES - 1);

    assertThat(backend.writer().batches()).hasSize(SpanTracker.MIN_WRITES - 1);
    assertThat(backend.requests()).isEmpty();
    assertThat(metrics.tracesInspected()).isZero();
  }

  @Test void doSpanCount_searchesAndRatesAgree() {
    spanCountVulture();

    spanCountTicks(SpanTracker.MIN_WRITES);

    assertThat(backend.requests()).hasSize(6);
    assertThat(backend.requests().get(0))
      .startsWith("searchTraceQL:{resource.service.name = \"vulture-tracked-service-");
    assertThat(backend.requests().get(3)).startsWith("queryRange:").endsWith(" | rate()");
    assertThat(metrics.tracesInspected()).isEqualTo(6);
    assertThat(metrics.errors()).isZero();
  }

  @Test void doSpanCount_missingTraces() {
    spanCountVulture();
    backend.searchResults(Collections.emptyList());

    spanCountTicks(SpanTracker.MIN_WRITES);

    assertThat(metrics.traceErrors(ErrorCategory.TRACEQL_INCORRECT_RESULT)).isEqualTo(3);
    assertThat(metrics.traceErrors(ErrorCategory.METRICS_QUERY_INCORRECT_RESULT)).isZero();
  }

  @Test void doSpanCount_writeFailureKeepsTimestamp() {
    backend.writer().failWith(new IOException("connection refused"));
    spanCountVulture();

    spanCountTicks(1);

    assertThat(metrics.traceErrors(ErrorCategory.WRITE_FAILED)).isOne();
    assertThat(vulture.spanTracker.size()).isOne();
    assertThat(vulture.spanTracker.successfulWrites()).isZero();
  }

  @Test void doSpanCount_replacesFullTracker() {
    spanCountVulture();
    SpanTracker full = SpanTracker.create(SEED);
    for (int i = 0; i < SpanTracker.MAX_ENTRIES; i++) full.nextBatch(SEED + i, new Random(i));
    vulture.spanTracker = full;

    vulture.doSpanCount(SEED + SPAN_COUNT_BACKOFF);

    assertThat(vulture.spanTracker).isNotSameAs(full);
    assertThat(vulture.spanTracker.size()).isOne();
  }

  @Test void longWrites_completeTrace() {
    TraceInfo info = TraceInfoTest.longTrace();
    vulture = builder(info.timestamp())
      .writeBackoff(TimeUnit.HOURS.toMillis(1))
      .readBackoff(TimeUnit.HOURS.toMillis(1))
      .longWriteBackoff(10L)
      .build()
      .start();

    assertThat(vulture.emit(info)).isTrue();
    vulture.queueFutureBatches(info);

    await().untilAsserted(() -> assertThat(vulture.pendingLongWrites()).isZero());
    assertThat(info.longWritesRemaining()).isZero();
    assertThat(backend.writer().spans())
      .containsExactlyElementsOf(info.constructTraceFromEpoch());
  }

  @Test void longWrites_stopOnFailure() {
    TraceInfo info = TraceInfoTest.longTrace();
    vulture = builder(info.timestamp())
      .writeBackoff(TimeUnit.HOURS.toMillis(1))
      .readBackoff(TimeUnit.HOURS.toMillis(1))
      .longWriteBackoff(10L)
      .build()
      .start();
    vulture.emit(info);
    backend.writer().failWith(new IOException("connection refused"));

    vulture.queueFutureBatches(info);

    await().untilAsserted(() -> assertThat(vulture.pendingLongWrites()).isZero());
    assertThat(metrics.traceErrors(ErrorCategory.WRITE_FAILED)).isOne();
    assertThat(info.longWritesRemaining()).isEqualTo(info.totalLongWrites());
  }

  @Test void start_writesUntilClosed() {
    vulture = Vulture.newBuilder()
      .writer(backend.writer())
      .querier(backend)
      .searchBackoff(0)
      .readBackoff(TimeUnit.HOURS.toMillis(1))
      .writeBackoff(10L)
      .maxLongWrites(0)
      .build()
      .start();

    await().untilAsserted(() -> assertThat(backend.writer().calls()).isGreaterThan(1));
    vulture.close();
    int calls = backend.writer().calls();

    await().during(50, TimeUnit.MILLISECONDS).atMost(1, SECONDS)
      .untilAsserted(() -> assertThat(backend.writer().calls()).isEqualTo(calls));
  }

  @Test void start_afterClose() {
    vulture = builder(SEED).build();
    vulture.close();

    assertThatThrownBy(vulture::start).isInstanceOf(IllegalStateException.class);
  }

  @Test void start_idempotent() {
    vulture = builder(SEED).metricsBackoff(MINUTES.toMillis(1)).build();

    assertThat(vulture.start()).isSameAs(vulture.start());
    assertThat(vulture.loops).hasSize(4);
  }

  @Test void build_requiresPositiveWriteBackoff() {
    assertThatThrownBy(() -> builder(SEED).writeBackoff(0).build())
      .hasMessage("write backoff must be positive");
  }

  @Test void build_requiresACheck() {
    assertThatThrownBy(() -> builder(SEED).readBackoff(0).searchBackoff(0).build())
      .hasMessage("at least one of read, search or metrics backoff must be positive");
  }

  @Test void build_rejectsNegativeBackoff() {
    assertThatThrownBy(() -> builder(SEED).searchBackoff(-1).build())
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void build_requiresClientOfEnabledLoop() {
    assertThatThrownBy(() -> Vulture.newBuilder().writer(backend.writer()).build())
      .hasMessage("querier is required to read traces");
    assertThatThrownBy(() -> Vulture.newBuilder().writer(backend.writer()).querier(backend)
      .metricsBackoff(1000).build())
      .hasMessage("searcher is required to search traces");
    assertThatThrownBy(() -> Vulture.newBuilder().writer(backend.writer()).querier(backend)
      .spanCountBackoff(1000).build())
      .hasMessage("searcher is required to search traces");
  }

  @Test void selectPastTimestamp_withinRetentionAndAligned() {
    Random random = new Random(1L);
    long now = SEED + TimeUnit.HOURS.toMillis(5) + 123;
    long retention = TimeUnit.HOURS.toMillis(1);
    for (int i = 0; i < 1000; i++) {
      long seed = Vulture.selectPastTimestamp(0L, now, WRITE_BACKOFF, retention, random);
      assertThat(seed).isBetween(now - retention, now);
      assertThat(seed % WRITE_BACKOFF).isZero();
    }
  }

  @Test void selectPastTimestamp_notBeforeStart() {
    Random random = new Random(1L);
    long start = SEED + 1;
    for (int i = 0; i < 1000; i++) {
      long seed = Vulture.selectPastTimestamp(start, SEED + MINUTES.toMillis(5), WRITE_BACKOFF,
        TimeUnit.HOURS.toMillis(1), random);
      assertThat(seed).isGreaterThanOrEqualTo(start);
    }
  }

  @Test void selectPastTimestamp_noCandidates() {
    assertThat(Vulture.selectPastTimestamp(SEED + 1, SEED + 2, WRITE_BACKOFF,
      TimeUnit.HOURS.toMillis(1), OLDEST)).isEqualTo(SEED + WRITE_BACKOFF);
  }

  @Test void round() {
    assertThat(Vulture.round(SEED + 7_499L, WRITE_BACKOFF)).isEqualTo(SEED);
    assertThat(Vulture.round(SEED + 7_500L, WRITE_BACKOFF)).isEqualTo(SEED + WRITE_BACKOFF);
  }

  @Test void threadFactory_namesDaemonThreads() {
    Thread thread = Vulture.threadFactory("read").newThread(() -> {
    });

    assertThat(thread.getName()).isEqualTo("zipkin-vulture-read-1");
    assertThat(thread.isDaemon()).isTrue();
  }
}
