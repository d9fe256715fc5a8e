/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import zipkin2.Span;

/**
 * Writes the batches of a {@link TraceInfo} through a {@link TraceWriter}. The first failing batch
 * aborts the round and is thrown to the caller. Batches already sent stay sent.
 */
public final class TraceEmitter {
  static final Logger LOG = LoggerFactory.getLogger(TraceEmitter.class);

  final TraceWriter writer;

  public TraceEmitter(TraceWriter writer) {
    if (writer == null) throw new NullPointerException("writer == null");
    this.writer = writer;
  }

  /**
   * Writes the next round of the trace.
   *
   * @throws InvalidTenantException before anything is written, if the tenant is unusable
   */
  public void emitBatches(TraceInfo info) throws IOException {
    String tenant = InvalidTenantException.validate(info.tenant());
    List<List<Span>> batches = info.nextBatches();
    LOG.debug("emitting {} batches of trace {}", batches.size(), info.hexTraceId());
    for (List<Span> batch : batches) {
      writer.emitBatch(tenant, batch).execute();
    }
  }

  /** Writes the initial round and every continuation round of the trace, back to back. */
  public void emitAllBatches(TraceInfo info) throws IOException {
    emitBatches(info);
    while (info.longWritesRemaining() > 0) {
      emitBatches(info);
      info.done();
    }
  }
}
