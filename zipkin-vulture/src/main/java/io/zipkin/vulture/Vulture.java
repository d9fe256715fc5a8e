/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import zipkin2.Call;
import zipkin2.Span;
import zipkin2.internal.Nullable;

import static io.zipkin.vulture.VultureMetrics.NOOP_METRICS;

/**
 * Soak mode: writes a trace every write interval and, on independent intervals, reads, searches
 * and checks metrics of traces written earlier.
 *
 * <p>Each loop has its own thread, so a slow backend call delays only the loop that made it.
 * Continuation rounds of long traces run on a separate pool, each trace on its own fixed-delay
 * schedule. Failures are tallied into {@link VultureMetrics} and never stop a loop.
 *
 * <p>Call {@link #start()} to begin and {@link #close()} to stop.
 */
public final class Vulture implements Closeable {
  static final Logger LOG = LoggerFactory.getLogger(Vulture.class);

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    TraceWriter writer;
    TraceQuerier querier;
    TraceSearcher searcher;
    MetricsQuerier metricsQuerier;
    VultureMetrics metrics = NOOP_METRICS;
    Clock clock = Clock.systemUTC();
    Random random = new Random();
    String tenant = "";
    long writeBackoff = TimeUnit.SECONDS.toMillis(15);
    long longWriteBackoff = TimeUnit.MINUTES.toMillis(1);
    long readBackoff = TimeUnit.SECONDS.toMillis(30);
    long searchBackoff = TimeUnit.MINUTES.toMillis(1);
    long metricsBackoff = 0;
    long spanCountBackoff = 0;
    long retention = TimeUnit.HOURS.toMillis(336);
    long readWindow = TraceRetrievalValidator.SOAK_WINDOW;
    int maxLongWrites = TraceInfo.DEFAULT_MAX_LONG_WRITES;
    int longWriteThreads = 4;

    /** Required. Receives every generated batch. */
    public Builder writer(TraceWriter writer) {
      if (writer == null) throw new NullPointerException("writer == null");
      this.writer = writer;
      return this;
    }

    /** Required when {@link #readBackoff(long)} is positive. */
    public Builder querier(TraceQuerier querier) {
      if (querier == null) throw new NullPointerException("querier == null");
      this.querier = querier;
      return this;
    }

    /**
     * Required when {@link #searchBackoff(long)}, {@link #metricsBackoff(long)} or
     * {@link #spanCountBackoff(long)} is positive.
     */
    public Builder searcher(TraceSearcher searcher) {
      if (searcher == null) throw new NullPointerException("searcher == null");
      this.searcher = searcher;
      return this;
    }

    /** Required when {@link #metricsBackoff(long)} is positive. */
    public Builder metricsQuerier(MetricsQuerier metricsQuerier) {
      if (metricsQuerier == null) throw new NullPointerException("metricsQuerier == null");
      this.metricsQuerier = metricsQuerier;
      return this;
    }

    /** Defaults to no-op. */
    public Builder metrics(VultureMetrics metrics) {
      if (metrics == null) throw new NullPointerException("metrics == null");
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      if (clock == null) throw new NullPointerException("clock == null");
      this.clock = clock;
      return this;
    }

    /** Chooses which past seeds to read and search. Doesn't affect generated traces. */
    public Builder random(Random random) {
      if (random == null) throw new NullPointerException("random == null");
      this.random = random;
      return this;
    }

    /** Empty means the backend is single-tenant. */
    public Builder tenant(String tenant) {
      if (tenant == null) throw new NullPointerException("tenant == null");
      this.tenant = tenant;
      return this;
    }

    /** Milliseconds between writes, and the granularity of seeds. Defaults to 15s. */
    public Builder writeBackoff(long writeBackoff) {
      this.writeBackoff = writeBackoff;
      return this;
    }

    /** Milliseconds between continuation rounds of a long trace. Defaults to 1m. */
    public Builder longWriteBackoff(long longWriteBackoff) {
      this.longWriteBackoff = longWriteBackoff;
      return this;
    }

    /** Milliseconds between reads. Zero disables reads. Defaults to 30s. */
    public Builder readBackoff(long readBackoff) {
      this.readBackoff = readBackoff;
      return this;
    }

    /** Milliseconds between searches. Zero disables search. Defaults to 1m. */
    public Builder searchBackoff(long searchBackoff) {
      this.searchBackoff = searchBackoff;
      return this;
    }

    /** Milliseconds between metrics checks. Zero, the default, disables them. */
    public Builder metricsBackoff(long metricsBackoff) {
      this.metricsBackoff = metricsBackoff;
      return this;
    }

    /**
     * Milliseconds between writes of tracked traces, each followed by a check that searches and
     * rates over a range of them count exactly what was written. Zero, the default, disables this.
     * Requires a {@link #searcher(TraceSearcher)}. Rates are checked when there's also a
     * {@link #metricsQuerier(MetricsQuerier)}.
     */
    public Builder spanCountBackoff(long spanCountBackoff) {
      this.spanCountBackoff = spanCountBackoff;
      return this;
    }

    /** How far back to look for traces, in milliseconds. Defaults to 14 days. */
    public Builder retention(long retention) {
      this.retention = retention;
      return this;
    }

    /** Milliseconds on either side of the seed a read is bounded by. Defaults to 30m. */
    public Builder readWindow(long readWindow) {
      this.readWindow = readWindow;
      return this;
    }

    /** Exclusive bound of continuation rounds per trace. Zero writes every trace at once. */
    public Builder maxLongWrites(int maxLongWrites) {
      this.maxLongWrites = maxLongWrites;
      return this;
    }

    /** Threads shared by the continuation rounds of all long traces. Defaults to 4. */
    public Builder longWriteThreads(int longWriteThreads) {
      this.longWriteThreads = longWriteThreads;
      return this;
    }

    /**
     * @throws IllegalArgumentException if the write backoff isn't positive, no read, search or
     * metrics loop is enabled, or an enabled loop lacks its client
     */
    public Vulture build() {
      if (writer == null) throw new NullPointerException("writer == null");
      if (writeBackoff <= 0) throw new IllegalArgumentException("write backoff must be positive");
      if (readBackoff < 0 || searchBackoff < 0 || metricsBackoff < 0) {
        throw new IllegalArgumentException("read, search and metrics backoff can't be negative");
      }
      if (readBackoff == 0 && searchBackoff == 0 && metricsBackoff == 0) {
        throw new IllegalArgumentException(
          "at least one of read, search or metrics backoff must be positive");
      }
      if (spanCountBackoff < 0) {
        throw new IllegalArgumentException("span count backoff can't be negative");
      }
      if (longWriteBackoff <= 0) {
        throw new IllegalArgumentException("long write backoff must be positive");
      }
      if (retention <= 0) throw new IllegalArgumentException("retention must be positive");
      if (maxLongWrites < 0) throw new IllegalArgumentException("maxLongWrites < 0");
      if (longWriteThreads <= 0) throw new IllegalArgumentException("longWriteThreads <= 0");
      if (readBackoff > 0 && querier == null) {
        throw new IllegalArgumentException("querier is required to read traces");
      }
      if ((searchBackoff > 0 || metricsBackoff > 0 || spanCountBackoff > 0) && searcher == null) {
        throw new IllegalArgumentException("searcher is required to search traces");
      }
      if (metricsBackoff > 0 && metricsQuerier == null) {
        throw new IllegalArgumentException("metricsQuerier is required to check metrics");
      }
      return new Vulture(this);
    }

    Builder() {
    }
  }

  final VultureMetrics metrics;
  final Clock clock;
  final Random random;
  final String tenant;
  final long writeBackoff, longWriteBackoff, readBackoff, searchBackoff, metricsBackoff;
  final long spanCountBackoff;
  final long retention;
  final int maxLongWrites, longWriteThreads;
  final TraceWriter writer;
  final TraceEmitter emitter;
  @Nullable final TraceRetrievalValidator retrievalValidator;
  @Nullable final TraceSearchValidator searchValidator;
  @Nullable final TraceMetricsValidator metricsValidator;
  @Nullable final SpanCountValidator spanCountValidator;
  final Set<LongWrite> longWrites = ConcurrentHashMap.newKeySet();
  final List<ScheduledExecutorService> loops = new ArrayList<>();

  volatile long startTime;
  volatile ScheduledExecutorService longWriteExecutor;
  volatile boolean closeCalled;
  // confined to the span count loop
  @Nullable SpanTracker spanTracker;

  Vulture(Builder builder) {
    metrics = builder.metrics;
    clock = builder.clock;
    random = builder.random;
    tenant = builder.tenant;
    writeBackoff = builder.writeBackoff;
    longWriteBackoff = builder.longWriteBackoff;
    readBackoff = builder.readBackoff;
    searchBackoff = builder.searchBackoff;
    metricsBackoff = builder.metricsBackoff;
    spanCountBackoff = builder.spanCountBackoff;
    retention = builder.retention;
    maxLongWrites = builder.maxLongWrites;
    longWriteThreads = builder.longWriteThreads;
    writer = builder.writer;
    emitter = new TraceEmitter(builder.writer);
    retrievalValidator = builder.querier != null
      ? new TraceRetrievalValidator(builder.querier, builder.readWindow) : null;
    searchValidator = builder.searcher != null ? new TraceSearchValidator(builder.searcher) : null;
    metricsValidator = builder.metricsQuerier != null && builder.searcher != null
      ? new TraceMetricsValidator(builder.searcher, builder.metricsQuerier, writeBackoff) : null;
    spanCountValidator = builder.searcher != null && spanCountBackoff > 0
      ? new SpanCountValidator(builder.searcher, builder.metricsQuerier, spanCountBackoff) : null;
    startTime = clock.millis();
  }

  /** Starts all enabled loops. Each fires first after its interval elapses. */
  public synchronized Vulture start() {
    if (closeCalled) throw new IllegalStateException("closed");
    if (!loops.isEmpty()) return this;
    startTime = clock.millis();
    LOG.info("starting with tenant '{}': write every {}ms, read every {}ms, search every {}ms, "
        + "check metrics every {}ms, count spans every {}ms, retention {}ms", tenant, writeBackoff,
      readBackoff, searchBackoff, metricsBackoff, spanCountBackoff, retention);

    longWriteExecutor =
      Executors.newScheduledThreadPool(longWriteThreads, threadFactory("long-write"));
    schedule("write", writeBackoff, this::doWrite);
    if (readBackoff > 0) schedule("read", readBackoff, this::doRead);
    if (searchBackoff > 0) schedule("search", searchBackoff, this::doSearch);
    if (metricsBackoff > 0) schedule("metrics", metricsBackoff, this::doMetrics);
    if (spanCountBackoff > 0) schedule("span-count", spanCountBackoff, this::doSpanCount);
    return this;
  }

  /** Stops scheduling ticks. Ticks in flight are given a few seconds to complete. */
  @Override public synchronized void close() {
    if (closeCalled) return;
    closeCalled = true;
    for (LongWrite longWrite : longWrites) longWrite.finish();
    List<ScheduledExecutorService> executors = new ArrayList<>(loops);
    if (longWriteExecutor != null) executors.add(longWriteExecutor);
    for (ScheduledExecutorService executor : executors) executor.shutdown();
    try {
      for (ScheduledExecutorService executor : executors) {
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
          LOG.warn("gave up waiting for an in-flight tick to complete");
          executor.shutdownNow();
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOG.info("stopped");
  }

  /** Epoch milliseconds when {@link #start()} was called. */
  public long startTime() {
    return startTime;
  }

  /** Number of long traces still receiving continuation rounds. */
  public int pendingLongWrites() {
    return longWrites.size();
  }

  void schedule(String name, long interval, LongConsumer tick) {
    ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(threadFactory(name));
    loops.add(loop);
    loop.scheduleAtFixedRate(() -> {
      try {
        tick.accept(clock.millis());
      } catch (Throwable t) {
        Call.propagateIfFatal(t);
        // a thrown exception would cancel the loop
        LOG.error("unexpected error in {} loop: {}", name, t.getMessage(), t);
        metrics.incrementErrors(1);
      }
    }, interval, interval, TimeUnit.MILLISECONDS);
  }

  void doWrite(long now) {
    TraceInfo info = TraceInfo.create(round(now, writeBackoff), maxLongWrites, tenant);
    LOG.info("sending trace {} seeded at {} with {} continuation rounds", info.hexTraceId(),
      info.timestamp(), info.totalLongWrites());
    if (!emit(info)) return;
    queueFutureBatches(info);
  }

  /** Schedules the continuation rounds of a long trace, one round per long write backoff. */
  void queueFutureBatches(TraceInfo info) {
    if (info.longWritesRemaining() == 0) return;
    ScheduledExecutorService executor = longWriteExecutor;
    if (executor == null || closeCalled) return;
    LongWrite longWrite = new LongWrite(info);
    longWrites.add(longWrite);
    longWrite.future = executor.scheduleWithFixedDelay(longWrite, longWriteBackoff,
      longWriteBackoff, TimeUnit.MILLISECONDS);
    // covers finishing before the future was assigned
    if (longWrite.finished) longWrite.future.cancel(false);
  }

  /** Returns false after counting a failure. */
  boolean emit(TraceInfo info) {
    try {
      emitter.emitBatches(info);
      return true;
    } catch (InvalidTenantException e) {
      LOG.error("error propagating tenant of trace {}: {}", info.hexTraceId(), e.getMessage());
    } catch (IOException | RuntimeException e) {
      LOG.error("error writing trace {}: {}", info.hexTraceId(), e.getMessage(), e);
    }
    metrics.record(new TraceMetrics().increment(ErrorCategory.WRITE_FAILED));
    return false;
  }

  /** One continuation chain. Rounds never overlap as the schedule has a fixed delay. */
  final class LongWrite implements Runnable {
    final TraceInfo info;
    volatile Future<?> future;
    volatile boolean finished;

    LongWrite(TraceInfo info) {
      this.info = info;
    }

    @Override public void run() {
      if (finished) return;
      LOG.info("sending continuation round of trace {}, {} remaining", info.hexTraceId(),
        info.longWritesRemaining());
      if (!emit(info)) {
        finish();
        return;
      }
      info.done();
      if (info.longWritesRemaining() == 0) finish();
    }

    void finish() {
      finished = true;
      longWrites.remove(this);
      Future<?> future = this.future;
      if (future != null) future.cancel(false);
    }
  }

  void doRead(long now) {
    TraceInfo info = selectTrace(now);
    if (info == null) return;
    metrics.record(retrievalValidator.validate(info).metrics());
  }

  void doSearch(long now) {
    TraceInfo info = selectTrace(now);
    if (info == null) return;
    metrics.record(searchValidator.searchTag(info).metrics());
    metrics.record(searchValidator.searchTraceQL(info).metrics());
  }

  void doMetrics(long now) {
    TraceInfo info = selectTrace(now);
    if (info == null) return;
    metrics.record(metricsValidator.validate(info).metrics());
  }

  /**
   * Writes the next tracked trace. Once enough have been written, checks searches and rates over a
   * random range of them.
   */
  void doSpanCount(long now) {
    SpanTracker tracker = spanTracker;
    if (tracker == null || tracker.size() >= SpanTracker.MAX_ENTRIES) {
      spanTracker = tracker = SpanTracker.create(now);
    }
    List<Span> batch = tracker.nextBatch(now, random);
    try {
      writer.emitBatch(InvalidTenantException.validate(tenant), batch).execute();
    } catch (IOException | RuntimeException e) {
      LOG.error("error writing tracked trace: {}", e.getMessage(), e);
      tracker.lastWriteFailed();
      metrics.record(new TraceMetrics().increment(ErrorCategory.WRITE_FAILED));
      return;
    }
    if (tracker.successfulWrites() < SpanTracker.MIN_WRITES) {
      LOG.debug("wrote {} tracked traces, not yet enough to search", tracker.successfulWrites());
      return;
    }
    int[] window = tracker.randomWindow(random);
    LOG.info("checking span counts of tracked positions {} to {}", window[0], window[1]);
    metrics.record(spanCountValidator.validateSearches(tracker, window[0], window[1]).metrics());
    metrics.record(
      spanCountValidator.validateRates(tracker, window[0], window[1], now).metrics());
  }

  /** Returns a past trace that should be completely written, or null to skip this tick. */
  @Nullable TraceInfo selectTrace(long now) {
    long seed = selectPastTimestamp(startTime, now, writeBackoff, retention, random);
    TraceInfo info = TraceInfo.create(seed, maxLongWrites, tenant);
    if (!traceIsReady(info, now)) {
      LOG.debug("skipping trace {} seeded at {} as it isn't ready", info.hexTraceId(), seed);
      return null;
    }
    return info;
  }

  /**
   * Returns true if the trace was written after this process started writing and should be
   * completely visible by now.
   */
  boolean traceIsReady(TraceInfo info, long now) {
    // the first write happens one interval after start, and needs time to land
    if (info.timestamp() < startTime + 2 * writeBackoff) return false;
    return info.ready(now, writeBackoff, longWriteBackoff);
  }

  /**
   * Returns a seed, aligned to the interval, chosen at random between the start time and now.
   * The seed is never older than the retention allows.
   */
  static long selectPastTimestamp(long start, long now, long interval, long retention,
    Random random) {
    long oldest = Math.max(now - retention, start);
    long first = Math.floorDiv(oldest + interval - 1, interval) * interval;
    long last = Math.floorDiv(now, interval) * interval;
    if (first >= last) return first;
    long buckets = (last - first) / interval + 1;
    return first + Math.floorMod(random.nextLong(), buckets) * interval;
  }

  /** Rounds to the nearest multiple of the interval. */
  static long round(long timestamp, long interval) {
    return Math.floorDiv(timestamp + interval / 2, interval) * interval;
  }

  static ThreadFactory threadFactory(String name) {
    AtomicInteger count = new AtomicInteger();
    return r -> {
      Thread result = new Thread(r, "zipkin-vulture-" + name + "-" + count.incrementAndGet());
      result.setDaemon(true);
      return result;
    };
  }

  @Override public String toString() {
    return "Vulture{tenant=" + tenant + ", writeBackoff=" + writeBackoff + "}";
  }
}
