/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.List;
import zipkin2.Call;
import zipkin2.Span;

/** Reads a trace back from the backend under test. */
public interface TraceQuerier {

  /**
   * Returns a call that fetches every span of the trace. The time range is a hint to the backend,
   * which may ignore it.
   *
   * <p>The call fails with {@link TraceNotFoundException} when the backend reports the trace
   * absent.
   *
   * @param startTs epoch milliseconds lower bound, or zero for none
   * @param endTs epoch milliseconds upper bound, or zero for none
   */
  Call<List<Span>> getTrace(String traceId, long startTs, long endTs);
}
