/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.List;
import zipkin2.Call;

/** Evaluates span metrics queries, like <code>{.key = "value"} | count_over_time()</code>. */
public interface MetricsQuerier {

  /**
   * @param startTs epoch milliseconds
   * @param endTs epoch milliseconds
   * @param step milliseconds between samples
   */
  Call<List<MetricSeries>> queryRange(String query, long startTs, long endTs, long step);
}
