/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import zipkin2.internal.Nullable;

/**
 * Checks searches and rate queries over a range of ticks of a {@link SpanTracker} against the
 * counts it recorded. Each {@link SpanTracker.Scenario} is checked separately and counts at most
 * one error.
 */
public final class SpanCountValidator {
  static final Logger LOG = LoggerFactory.getLogger(SpanCountValidator.class);

  /** Large enough that no trace in a window is cut off. */
  static final int SEARCH_LIMIT = 5000;
  /** Slack around the first and last tick of a window. */
  static final long MARGIN = TimeUnit.SECONDS.toMillis(1);
  static final double TOLERANCE = 1e-9;

  final TraceSearcher searcher;
  @Nullable final MetricsQuerier metricsQuerier;
  final long step;

  /**
   * @param metricsQuerier null skips rate queries
   * @param step milliseconds between ticks, and so between samples of rate queries
   */
  public SpanCountValidator(TraceSearcher searcher, @Nullable MetricsQuerier metricsQuerier,
    long step) {
    if (searcher == null) throw new NullPointerException("searcher == null");
    if (step <= 0) throw new IllegalArgumentException("step <= 0");
    this.searcher = searcher;
    this.metricsQuerier = metricsQuerier;
    this.step = step;
  }

  /** Searches each scenario from start to end, inclusive, expecting every trace and span. */
  public Outcome validateSearches(SpanTracker tracker, int start, int end) {
    TraceMetrics metrics = new TraceMetrics();
    long startTs = tracker.timestamp(start) - MARGIN, endTs = tracker.timestamp(end) + MARGIN;
    int expectedTraces = tracker.traceCount(start, end);
    Throwable error = null;
    for (SpanTracker.Scenario scenario : SpanTracker.Scenario.values()) {
      metrics.incrementRequested();
      String query = tracker.traceQL(scenario);
      int expectedSpans = tracker.spanCount(scenario, start, end);
      List<TraceSummary> traces;
      try {
        traces = searcher.searchTraceQL(query, startTs, endTs, SEARCH_LIMIT).execute();
      } catch (IOException | RuntimeException e) {
        LOG.error("search {} failed: {}", query, e.getMessage(), e);
        metrics.increment(ErrorCategory.REQUEST_FAILED);
        error = e;
        continue;
      }
      int traceCount = 0, spanCount = 0;
      if (traces != null) {
        traceCount = traces.size();
        for (TraceSummary trace : traces) spanCount += trace.matchedSpans();
      }
      if (traceCount != expectedTraces || spanCount != expectedSpans) {
        String message = String.format(Locale.ROOT,
          "%s: expected %d traces and %d spans, got %d traces and %d spans",
          query, expectedTraces, expectedSpans, traceCount, spanCount);
        error = fail(metrics, ErrorCategory.TRACEQL_INCORRECT_RESULT, message);
        continue;
      }
      LOG.info("search {} found all {} traces and {} spans", query, traceCount, spanCount);
    }
    return error != null ? Outcome.failure(metrics, error) : Outcome.success(metrics);
  }

  /**
   * Runs a {@code rate()} query of each scenario from start to end, inclusive. Sample i must be
   * the span count of tick start + i divided by the step in seconds. A scenario that returns no
   * series passes only if nothing was written.
   */
  public Outcome validateRates(SpanTracker tracker, int start, int end, long now) {
    TraceMetrics metrics = new TraceMetrics();
    if (metricsQuerier == null) return Outcome.success(metrics);
    long startTs = tracker.timestamp(start) - MARGIN;
    long endTs = Math.min(tracker.timestamp(end) + MARGIN, now);
    double stepSeconds = step / 1000d;
    Throwable error = null;
    for (SpanTracker.Scenario scenario : SpanTracker.Scenario.values()) {
      metrics.incrementRequested();
      String query = tracker.traceQL(scenario) + " | rate()";
      int[] expected = tracker.spanCounts(scenario, start, end);
      List<MetricSeries> series;
      try {
        series = metricsQuerier.queryRange(query, startTs, endTs, step).execute();
      } catch (IOException | RuntimeException e) {
        LOG.error("metrics query {} failed: {}", query, e.getMessage(), e);
        metrics.increment(ErrorCategory.REQUEST_FAILED);
        error = e;
        continue;
      }
      String mismatch = mismatch(series, expected, stepSeconds);
      if (mismatch != null) {
        error =
          fail(metrics, ErrorCategory.METRICS_QUERY_INCORRECT_RESULT, query + ": " + mismatch);
        continue;
      }
      LOG.info("metrics query {} agrees with {} ticks", query, expected.length);
    }
    return error != null ? Outcome.failure(metrics, error) : Outcome.success(metrics);
  }

  /** Returns a description of the first sample that disagrees, or null if all agree. */
  @Nullable static String mismatch(@Nullable List<MetricSeries> series, int[] expected,
    double stepSeconds) {
    if (series == null || series.isEmpty()) {
      for (int count : expected) {
        if (count != 0) return "no series, but spans were written";
      }
      return null;
    }
    if (series.size() != 1) return "expected exactly 1 series, got " + series.size();
    List<MetricSeries.Sample> samples = series.get(0).samples();
    int length = Math.min(samples.size(), expected.length);
    for (int i = 0; i < length; i++) {
      double value = samples.get(i).value();
      double expectedValue = expected[i] / stepSeconds;
      if (Math.abs(value - expectedValue) > TOLERANCE) {
        return String.format(Locale.ROOT, "sample %d: expected %f, got %f", i, expectedValue,
          value);
      }
    }
    return null;
  }

  static TraceCheckException fail(TraceMetrics metrics, ErrorCategory category, String message) {
    LOG.error(message);
    metrics.increment(category);
    return new TraceCheckException(category, message);
  }
}
