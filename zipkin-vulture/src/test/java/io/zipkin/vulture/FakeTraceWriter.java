/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.util.ArrayList;
import java.util.List;
import zipkin2.Call;
import zipkin2.Span;

/** Records batches under a lock, as loops emit concurrently. */
public final class FakeTraceWriter implements TraceWriter {
  final Object lock = new Object();
  final List<List<Span>> batches = new ArrayList<>();
  final List<String> tenants = new ArrayList<>();
  Throwable error;
  int failAfter = -1;
  int calls;

  /** Every emit fails with this error. */
  public FakeTraceWriter failWith(Throwable error) {
    synchronized (lock) {
      this.error = error;
      this.failAfter = 0;
    }
    return this;
  }

  /** Emits after the first {@code count} fail with this error. */
  public FakeTraceWriter failAfter(int count, Throwable error) {
    synchronized (lock) {
      this.error = error;
      this.failAfter = count;
    }
    return this;
  }

  @Override public Call<Void> emitBatch(String tenant, List<Span> batch) {
    synchronized (lock) {
      calls++;
      if (failAfter >= 0 && calls > failAfter) return FakeCall.failed(error);
      batches.add(batch);
      tenants.add(tenant);
      return FakeCall.of(null);
    }
  }

  public int calls() {
    synchronized (lock) {
      return calls;
    }
  }

  public List<List<Span>> batches() {
    synchronized (lock) {
      return new ArrayList<>(batches);
    }
  }

  public List<Span> spans() {
    List<Span> result = new ArrayList<>();
    for (List<Span> batch : batches()) result.addAll(batch);
    return result;
  }

  public List<String> tenants() {
    synchronized (lock) {
      return new ArrayList<>(tenants);
    }
  }
}
