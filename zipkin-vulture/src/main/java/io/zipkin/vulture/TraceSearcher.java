/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.List;
import zipkin2.Call;

/** Finds traces in the backend under test. */
public interface TraceSearcher {

  /** Searches for traces with a span tagged {@code key=value} in the given epoch milliseconds. */
  Call<List<TraceSummary>> searchTag(String key, String value, long startTs, long endTs);

  /** Searches with a structured query, such as <code>{.key = "value"}</code>. */
  Call<List<TraceSummary>> searchTraceQL(String query, long startTs, long endTs);

  /**
   * Like {@link #searchTraceQL(String, long, long)}, except returning up to {@code limit} traces.
   * Implementations without a limit of their own needn't override this.
   */
  default Call<List<TraceSummary>> searchTraceQL(String query, long startTs, long endTs,
    int limit) {
    return searchTraceQL(query, startTs, endTs);
  }
}
