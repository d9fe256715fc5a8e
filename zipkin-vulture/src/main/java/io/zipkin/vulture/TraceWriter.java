/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.List;
import zipkin2.Call;
import zipkin2.Span;

/** Pushes spans into the backend under test. */
public interface TraceWriter {

  /**
   * Returns a call that sends the batch on behalf of the given tenant.
   *
   * @throws InvalidTenantException if the tenant cannot be propagated
   */
  Call<Void> emitBatch(String tenant, List<Span> batch);
}
