/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.validation;

import java.util.Locale;

/** The step of a validation run that failed. */
public enum ValidationPhase {
  WRITE,
  READ,
  SEARCH,
  /** The run's deadline passed before all steps ran. */
  TIMEOUT;

  @Override public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
