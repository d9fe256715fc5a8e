/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.Locale;
import zipkin2.internal.Nullable;

/**
 * Compares trace IDs as numbers rather than strings. Backends differ in case, and some return
 * 64-bit IDs or drop leading zeros.
 */
public final class TraceIds {

  /** Returns true if both are valid hex IDs of the same 128-bit value. */
  public static boolean equalHex(@Nullable String a, @Nullable String b) {
    String left = normalize(a), right = normalize(b);
    return left != null && left.equals(right);
  }

  /** Returns the 32 character lower-hex form, or null if the input isn't a hex ID. */
  @Nullable static String normalize(@Nullable String hex) {
    if (hex == null) return null;
    int length = hex.length();
    if (length == 0 || length > 32) return null;
    String lower = hex.toLowerCase(Locale.ROOT);
    for (int i = 0; i < length; i++) {
      char c = lower.charAt(i);
      if ((c < '0' || c > '9') && (c < 'a' || c > 'f')) return null;
    }
    if (length == 32) return lower;
    StringBuilder result = new StringBuilder(32);
    for (int i = length; i < 32; i++) result.append('0');
    return result.append(lower).toString();
  }

  TraceIds() {
  }
}
