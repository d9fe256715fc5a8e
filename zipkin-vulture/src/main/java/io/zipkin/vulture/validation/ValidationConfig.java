/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.validation;

import io.zipkin.vulture.TraceRetrievalValidator;
import java.util.concurrent.TimeUnit;

public final class ValidationConfig {
  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    int cycles = 3;
    long timeout = TimeUnit.MINUTES.toMillis(5);
    String tenant = "";
    long searchBackoff = TimeUnit.MINUTES.toMillis(1);
    long searchDelay = TimeUnit.SECONDS.toMillis(60);
    long cycleDelay = TimeUnit.SECONDS.toMillis(1);
    long readWindow = TraceRetrievalValidator.VALIDATION_WINDOW;

    /** Traces to write and read back. Defaults to 3. */
    public Builder cycles(int cycles) {
      this.cycles = cycles;
      return this;
    }

    /** Milliseconds the whole run may take. Defaults to 5 minutes. */
    public Builder timeout(long timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder tenant(String tenant) {
      if (tenant == null) throw new NullPointerException("tenant == null");
      this.tenant = tenant;
      return this;
    }

    /** Zero skips the search phase. */
    public Builder searchBackoff(long searchBackoff) {
      this.searchBackoff = searchBackoff;
      return this;
    }

    /** Milliseconds to wait after the last write for traces to become searchable. */
    public Builder searchDelay(long searchDelay) {
      this.searchDelay = searchDelay;
      return this;
    }

    /** Milliseconds between cycles, ensuring each trace has a different seed. */
    public Builder cycleDelay(long cycleDelay) {
      this.cycleDelay = cycleDelay;
      return this;
    }

    public Builder readWindow(long readWindow) {
      this.readWindow = readWindow;
      return this;
    }

    public ValidationConfig build() {
      if (cycles <= 0) throw new IllegalArgumentException("cycles must be positive");
      if (timeout <= 0) throw new IllegalArgumentException("timeout must be positive");
      if (searchBackoff < 0) throw new IllegalArgumentException("searchBackoff < 0");
      if (searchDelay < 0) throw new IllegalArgumentException("searchDelay < 0");
      if (cycleDelay < 1000) {
        throw new IllegalArgumentException("cycleDelay must be at least a second");
      }
      if (readWindow <= 0) throw new IllegalArgumentException("readWindow <= 0");
      return new ValidationConfig(this);
    }

    Builder() {
    }
  }

  final int cycles;
  final long timeout, searchBackoff, searchDelay, cycleDelay, readWindow;
  final String tenant;

  ValidationConfig(Builder builder) {
    cycles = builder.cycles;
    timeout = builder.timeout;
    tenant = builder.tenant;
    searchBackoff = builder.searchBackoff;
    searchDelay = builder.searchDelay;
    cycleDelay = builder.cycleDelay;
    readWindow = builder.readWindow;
  }

  public int cycles() {
    return cycles;
  }

  public long timeout() {
    return timeout;
  }

  public String tenant() {
    return tenant;
  }

  public long searchBackoff() {
    return searchBackoff;
  }

  public long searchDelay() {
    return searchDelay;
  }

  public long cycleDelay() {
    return cycleDelay;
  }

  public long readWindow() {
    return readWindow;
  }
}
