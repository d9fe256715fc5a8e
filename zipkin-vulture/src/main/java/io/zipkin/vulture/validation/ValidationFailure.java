/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.validation;

import zipkin2.internal.Nullable;

public final class ValidationFailure {
  public static ValidationFailure create(@Nullable String traceId, int cycle,
    ValidationPhase phase, Throwable error, long timestamp) {
    return new ValidationFailure(traceId, cycle, phase, error, timestamp);
  }

  @Nullable final String traceId;
  final int cycle;
  final ValidationPhase phase;
  final Throwable error;
  final long timestamp;

  ValidationFailure(@Nullable String traceId, int cycle, ValidationPhase phase, Throwable error,
    long timestamp) {
    if (phase == null) throw new NullPointerException("phase == null");
    if (error == null) throw new NullPointerException("error == null");
    this.traceId = traceId;
    this.cycle = cycle;
    this.phase = phase;
    this.error = error;
    this.timestamp = timestamp;
  }

  /** Null when the failure isn't about a trace, such as a timeout. */
  @Nullable public String traceId() {
    return traceId;
  }

  /** Zero-based index of the cycle that wrote the trace. */
  public int cycle() {
    return cycle;
  }

  public ValidationPhase phase() {
    return phase;
  }

  public Throwable error() {
    return error;
  }

  /** Epoch milliseconds when the failure was recorded. */
  public long timestamp() {
    return timestamp;
  }

  @Override public String toString() {
    return "ValidationFailure{traceId=" + traceId + ", cycle=" + cycle + ", phase=" + phase
      + ", error=" + error + ", timestamp=" + timestamp + "}";
  }
}
