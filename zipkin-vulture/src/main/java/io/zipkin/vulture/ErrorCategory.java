/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.Locale;

/** Classifies why a written, read or searched trace did not check out. */
public enum ErrorCategory {
  /** The backend reported the trace absent, or returned no spans for it. */
  NOT_FOUND_BY_ID,
  /** A span references a parent that isn't in the returned trace. */
  MISSING_SPANS,
  /** The trace is complete, but differs from what the seed generates. */
  INCORRECT_RESULT,
  /** Transport or backend failure not indicating absence. */
  REQUEST_FAILED,
  NOT_FOUND_SEARCH,
  NOT_FOUND_TRACEQL,
  /**
   * The expected trace had nothing to search on. This is a skip: it is tallied for visibility,
   * but isn't an error.
   */
  NOT_FOUND_SEARCH_ATTRIBUTE(false),
  NOT_FOUND_METRICS,
  INCORRECT_METRICS_RESULT,
  INACCURATE_METRICS,
  WRITE_FAILED,
  /** A search over tracked ticks returned a different number of traces or spans than written. */
  TRACEQL_INCORRECT_RESULT,
  /** A rate over tracked ticks disagrees with the spans written in some step. */
  METRICS_QUERY_INCORRECT_RESULT;

  final boolean error;
  final String label;

  ErrorCategory() {
    this(true);
  }

  ErrorCategory(boolean error) {
    this.error = error;
    this.label = name().toLowerCase(Locale.ROOT);
  }

  /** Returns false for categories which record a skip as opposed to a failure. */
  public boolean isError() {
    return error;
  }

  /** The metric label value, ex. "missing_spans". */
  public String label() {
    return label;
  }
}
