/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.validation;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/** A clock that only moves when something sleeps on it. */
final class FakeTime extends Clock implements Sleeper {
  final AtomicLong millis;
  final List<Long> sleeps = new ArrayList<>();

  FakeTime(long millis) {
    this.millis = new AtomicLong(millis);
  }

  void advance(long amount) {
    millis.addAndGet(amount);
  }

  @Override public void sleep(long amount) {
    sleeps.add(amount);
    advance(amount);
  }

  @Override public long millis() {
    return millis.get();
  }

  @Override public Instant instant() {
    return Instant.ofEpochMilli(millis());
  }

  @Override public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override public Clock withZone(ZoneId zone) {
    throw new UnsupportedOperationException();
  }
}
