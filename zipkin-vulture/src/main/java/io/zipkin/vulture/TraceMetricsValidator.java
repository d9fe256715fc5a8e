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

/**
 * Checks that span metrics agree with search. A structured search for one tag of the seed's trace
 * counts the matching spans. A {@code count_over_time()} query over the same window must add up to
 * the same number.
 */
public final class TraceMetricsValidator {
  static final Logger LOG = LoggerFactory.getLogger(TraceMetricsValidator.class);

  public static final long WINDOW = TimeUnit.MINUTES.toMillis(30);

  final TraceSearcher searcher;
  final MetricsQuerier querier;
  final long step;

  /**
   * @param step milliseconds between samples of the metrics query
   */
  public TraceMetricsValidator(TraceSearcher searcher, MetricsQuerier querier, long step) {
    if (searcher == null) throw new NullPointerException("searcher == null");
    if (querier == null) throw new NullPointerException("querier == null");
    if (step <= 0) throw new IllegalArgumentException("step <= 0");
    this.searcher = searcher;
    this.querier = querier;
    this.step = step;
  }

  public Outcome validate(TraceInfo info) {
    TraceMetrics metrics = new TraceMetrics().incrementRequested();
    String traceId = info.hexTraceId();
    TraceInfo.Attribute attribute = info.randomAttribute(info.constructTraceFromEpoch());
    if (attribute == null) return TraceSearchValidator.skip(info, metrics);

    String filter = TraceSearchValidator.traceQL(attribute);
    String query = filter + " | count_over_time()";
    long startTs = info.timestamp() - WINDOW, endTs = info.timestamp() + WINDOW;

    int spanCount = 0;
    List<MetricSeries> series;
    try {
      List<TraceSummary> traces = searcher.searchTraceQL(filter, startTs, endTs).execute();
      if (traces != null) {
        for (TraceSummary trace : traces) spanCount += trace.matchedSpans();
      }
      series = querier.queryRange(query, startTs, endTs, step).execute();
    } catch (IOException | RuntimeException e) {
      LOG.error("metrics query {} failed: {}", query, e.getMessage(), e);
      return Outcome.failure(metrics.increment(ErrorCategory.REQUEST_FAILED), e);
    }

    if (series == null || series.isEmpty()) {
      return fail(metrics, ErrorCategory.NOT_FOUND_METRICS,
        "expected trace " + traceId + " not found in metrics");
    }
    if (series.size() != 1) {
      return fail(metrics, ErrorCategory.INCORRECT_METRICS_RESULT,
        "expected exactly 1 series, got " + series.size());
    }
    double sum = series.get(0).sum();
    if (sum != spanCount) {
      return fail(metrics, ErrorCategory.INACCURATE_METRICS,
        String.format(Locale.ROOT, "trace %s: metric count sum=%f, actual span count=%d",
          traceId, sum, spanCount));
    }
    LOG.info("metrics of trace {} agree with search: {} spans", traceId, spanCount);
    return Outcome.success(metrics);
  }

  static Outcome fail(TraceMetrics metrics, ErrorCategory category, String message) {
    LOG.error(message);
    return Outcome.failure(metrics.increment(category), new TraceCheckException(category, message));
  }
}
