/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

/**
 * Raised before any request when the tenant cannot be propagated to the backend. This is a
 * configuration problem, distinct from a backend error.
 */
public final class InvalidTenantException extends IllegalArgumentException {
  static final long serialVersionUID = 0L;

  /** Tenants are sent as an HTTP header value. */
  static final int MAX_LENGTH = 150;

  /**
   * Returns the tenant if it can be sent as an organization ID. Empty means single-tenant.
   *
   * @throws InvalidTenantException if the tenant is null, too long or has unsupported characters
   */
  public static String validate(String tenant) {
    if (tenant == null) throw new InvalidTenantException("tenant == null");
    if (tenant.length() > MAX_LENGTH) {
      throw new InvalidTenantException("tenant longer than " + MAX_LENGTH + " characters");
    }
    if (tenant.equals(".") || tenant.equals("..")) {
      throw new InvalidTenantException("tenant " + tenant + " is not allowed");
    }
    for (int i = 0; i < tenant.length(); i++) {
      char c = tenant.charAt(i);
      if (!isSupported(c)) {
        throw new InvalidTenantException("unsupported character '" + c + "' in tenant " + tenant);
      }
    }
    return tenant;
  }

  static boolean isSupported(char c) {
    if (c >= 'a' && c <= 'z') return true;
    if (c >= 'A' && c <= 'Z') return true;
    if (c >= '0' && c <= '9') return true;
    switch (c) {
      case '!':
      case '-':
      case '_':
      case '.':
      case '*':
      case '\'':
      case '(':
      case ')':
        return true;
      default:
        return false;
    }
  }

  InvalidTenantException(String message) {
    super(message);
  }
}
