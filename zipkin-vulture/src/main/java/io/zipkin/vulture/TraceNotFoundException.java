/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.io.IOException;

/** Raised when the backend answers that a trace doesn't exist, as opposed to failing. */
public final class TraceNotFoundException extends IOException {
  static final long serialVersionUID = 0L;

  public TraceNotFoundException(String traceId) {
    super("trace " + traceId + " not found");
  }
}
