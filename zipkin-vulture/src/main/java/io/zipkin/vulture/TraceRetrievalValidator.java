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
import zipkin2.Span;

/**
 * Reads a trace by ID and compares it with the trace its seed generates.
 *
 * <p>Checks run in order, and the first failure wins:
 * <ol>
 *   <li>The backend must return the trace: {@link ErrorCategory#NOT_FOUND_BY_ID} or
 *   {@link ErrorCategory#REQUEST_FAILED}</li>
 *   <li>Every parent must be present: {@link ErrorCategory#MISSING_SPANS}</li>
 *   <li>The spans must equal the expected ones: {@link ErrorCategory#INCORRECT_RESULT}</li>
 * </ol>
 */
public final class TraceRetrievalValidator {
  static final Logger LOG = LoggerFactory.getLogger(TraceRetrievalValidator.class);

  public static final long SOAK_WINDOW = TimeUnit.MINUTES.toMillis(30);
  public static final long VALIDATION_WINDOW = TimeUnit.MINUTES.toMillis(10);

  final TraceQuerier querier;
  final long window;

  /**
   * @param window milliseconds on either side of the seed to bound the query with
   */
  public TraceRetrievalValidator(TraceQuerier querier, long window) {
    if (querier == null) throw new NullPointerException("querier == null");
    if (window <= 0) throw new IllegalArgumentException("window <= 0");
    this.querier = querier;
    this.window = window;
  }

  public Outcome validate(TraceInfo info) {
    TraceMetrics metrics = new TraceMetrics().incrementRequested();
    String traceId = info.hexTraceId();
    LOG.info("querying trace {} of tenant {} seeded at {}", traceId, info.tenant(),
      info.timestamp());

    List<Span> actual;
    try {
      actual = querier.getTrace(traceId, info.timestamp() - window, info.timestamp() + window)
        .execute();
    } catch (TraceNotFoundException e) {
      LOG.error("trace {} was not found", traceId);
      return Outcome.failure(metrics.increment(ErrorCategory.NOT_FOUND_BY_ID), e);
    } catch (IOException | RuntimeException e) {
      LOG.error("query of trace {} failed: {}", traceId, e.getMessage(), e);
      return Outcome.failure(metrics.increment(ErrorCategory.REQUEST_FAILED), e);
    }

    if (actual == null || actual.isEmpty()) {
      LOG.error("trace {} was returned without spans", traceId);
      return Outcome.failure(metrics.increment(ErrorCategory.NOT_FOUND_BY_ID),
        new TraceNotFoundException(traceId));
    }

    if (TraceDiff.hasMissingSpans(actual)) {
      LOG.error("trace {} has spans whose parent is missing", traceId);
      return Outcome.failure(metrics.increment(ErrorCategory.MISSING_SPANS),
        new TraceCheckException(ErrorCategory.MISSING_SPANS, "trace " + traceId + " has gaps"));
    }

    List<Span> expected = info.constructTraceFromEpoch();
    if (!TraceDiff.equal(expected, actual)) {
      List<String> diff = TraceDiff.diff(expected, actual);
      LOG.error("trace {} doesn't match what was written", traceId);
      LOG.warn("trace {} differences:\n{}", traceId, String.join("\n", diff));
      return Outcome.failure(metrics.increment(ErrorCategory.INCORRECT_RESULT),
        new TraceCheckException(ErrorCategory.INCORRECT_RESULT,
          "trace " + traceId + " has " + diff.size() + " differences"));
    }
    return Outcome.success(metrics);
  }
}
