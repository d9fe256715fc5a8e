/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import zipkin2.Call;

/**
 * Searches for a tag of the seed's trace and expects the trace in the results. The tag search and
 * the structured search are separate checks: one failing doesn't stop the other from running.
 *
 * <p>When the trace has no tag to search on, the check is skipped and tallied as
 * {@link ErrorCategory#NOT_FOUND_SEARCH_ATTRIBUTE}.
 */
public final class TraceSearchValidator {
  static final Logger LOG = LoggerFactory.getLogger(TraceSearchValidator.class);

  public static final long WINDOW = TimeUnit.MINUTES.toMillis(30);

  /** Returns a structured query that matches spans with the given tag. */
  public static String traceQL(TraceInfo.Attribute attribute) {
    return "{." + attribute.key() + " = \"" + escape(attribute.value()) + "\"}";
  }

  static String escape(String value) {
    return value.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  final TraceSearcher searcher;

  public TraceSearchValidator(TraceSearcher searcher) {
    if (searcher == null) throw new NullPointerException("searcher == null");
    this.searcher = searcher;
  }

  public Outcome searchTag(TraceInfo info) {
    TraceMetrics metrics = new TraceMetrics().incrementRequested();
    TraceInfo.Attribute attribute = info.randomAttribute(info.constructTraceFromEpoch());
    if (attribute == null) return skip(info, metrics);

    Call<List<TraceSummary>> call = searcher.searchTag(attribute.key(), attribute.value(),
      info.timestamp() - WINDOW, info.timestamp() + WINDOW);
    return check(info, metrics, call, "tag " + attribute, ErrorCategory.NOT_FOUND_SEARCH);
  }

  public Outcome searchTraceQL(TraceInfo info) {
    TraceMetrics metrics = new TraceMetrics().incrementRequested();
    TraceInfo.Attribute attribute = info.randomAttribute(info.constructTraceFromEpoch());
    if (attribute == null) return skip(info, metrics);

    String query = traceQL(attribute);
    Call<List<TraceSummary>> call =
      searcher.searchTraceQL(query, info.timestamp() - WINDOW, info.timestamp() + WINDOW);
    return check(info, metrics, call, "query " + query, ErrorCategory.NOT_FOUND_TRACEQL);
  }

  Outcome check(TraceInfo info, TraceMetrics metrics, Call<List<TraceSummary>> call,
    String search, ErrorCategory notFound) {
    String traceId = info.hexTraceId();
    List<TraceSummary> results;
    try {
      results = call.execute();
    } catch (IOException | RuntimeException e) {
      LOG.error("search by {} failed: {}", search, e.getMessage(), e);
      return Outcome.failure(metrics.increment(ErrorCategory.REQUEST_FAILED), e);
    }

    if (!containsTrace(results, traceId)) {
      LOG.error("trace {} was not found searching by {}", traceId, search);
      return Outcome.failure(metrics.increment(notFound), new TraceCheckException(notFound,
        "trace " + traceId + " not found searching by " + search));
    }
    LOG.info("trace {} was found searching by {}", traceId, search);
    return Outcome.success(metrics);
  }

  static boolean containsTrace(List<TraceSummary> results, String traceId) {
    if (results == null) return false;
    for (TraceSummary result : results) {
      if (TraceIds.equalHex(result.traceId(), traceId)) return true;
    }
    return false;
  }

  static Outcome skip(TraceInfo info, TraceMetrics metrics) {
    LOG.info("trace {} has no attribute to search for", info.hexTraceId());
    return Outcome.success(metrics.increment(ErrorCategory.NOT_FOUND_SEARCH_ATTRIBUTE));
  }
}
