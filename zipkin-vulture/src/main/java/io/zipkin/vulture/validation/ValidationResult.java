/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Summary of a validation run. The process exit code derives from it. */
public final class ValidationResult {
  public static ValidationResult create(int totalTraces, List<ValidationFailure> failures,
    long duration) {
    return new ValidationResult(totalTraces, failures, duration);
  }

  final int totalTraces;
  final List<ValidationFailure> failures;
  final long duration;

  ValidationResult(int totalTraces, List<ValidationFailure> failures, long duration) {
    if (failures == null) throw new NullPointerException("failures == null");
    this.totalTraces = totalTraces;
    this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    this.duration = duration;
  }

  public int totalTraces() {
    return totalTraces;
  }

  /** Traces not accounted for by a failure. */
  public int successCount() {
    return Math.max(0, totalTraces - failures.size());
  }

  public List<ValidationFailure> failures() {
    return failures;
  }

  /** Milliseconds the run took. */
  public long duration() {
    return duration;
  }

  public Map<ValidationPhase, Integer> failuresByPhase() {
    Map<ValidationPhase, Integer> result = new EnumMap<>(ValidationPhase.class);
    for (ValidationFailure failure : failures) result.merge(failure.phase(), 1, Integer::sum);
    return result;
  }

  /** Zero when nothing failed, otherwise one. */
  public int exitCode() {
    return failures.isEmpty() ? 0 : 1;
  }

  @Override public String toString() {
    return "ValidationResult{totalTraces=" + totalTraces + ", successCount=" + successCount()
      + ", failures=" + failuresByPhase() + ", duration=" + duration + "}";
  }
}
