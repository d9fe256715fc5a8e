/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

/** Raised when the backend answered, but the answer doesn't match the seed's trace. */
public final class TraceCheckException extends RuntimeException {
  static final long serialVersionUID = 0L;

  final ErrorCategory category;

  public TraceCheckException(ErrorCategory category, String message) {
    super(message);
    if (category == null) throw new NullPointerException("category == null");
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}
