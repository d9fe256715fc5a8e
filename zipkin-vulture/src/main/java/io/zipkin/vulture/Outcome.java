/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import zipkin2.internal.Nullable;

/** The tally of one check, and the error that failed it, if any. */
public final class Outcome {
  public static Outcome success(TraceMetrics metrics) {
    return new Outcome(metrics, null);
  }

  public static Outcome failure(TraceMetrics metrics, Throwable error) {
    if (error == null) throw new NullPointerException("error == null");
    return new Outcome(metrics, error);
  }

  final TraceMetrics metrics;
  @Nullable final Throwable error;

  Outcome(TraceMetrics metrics, @Nullable Throwable error) {
    if (metrics == null) throw new NullPointerException("metrics == null");
    this.metrics = metrics;
    this.error = error;
  }

  public TraceMetrics metrics() {
    return metrics;
  }

  /** Null when the check passed or was skipped. */
  @Nullable public Throwable error() {
    return error;
  }

  public boolean isSuccess() {
    return error == null;
  }

  @Override public String toString() {
    return "Outcome{metrics=" + metrics + ", error=" + error + "}";
  }
}
