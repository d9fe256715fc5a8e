/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture;

import java.io.IOException;
import zipkin2.Call;
import zipkin2.Callback;

/** Returns a value or throws an error, without I/O. */
public final class FakeCall<V> extends Call<V> {
  public static <V> FakeCall<V> of(V value) {
    return new FakeCall<>(value, null);
  }

  public static <V> FakeCall<V> failed(Throwable error) {
    return new FakeCall<>(null, error);
  }

  final V value;
  final Throwable error;
  volatile boolean canceled;

  FakeCall(V value, Throwable error) {
    this.value = value;
    this.error = error;
  }

  @Override public V execute() throws IOException {
    if (error instanceof IOException) throw (IOException) error;
    if (error instanceof RuntimeException) throw (RuntimeException) error;
    if (error instanceof Error) throw (Error) error;
    return value;
  }

  @Override public void enqueue(Callback<V> callback) {
    if (error != null) {
      callback.onError(error);
    } else {
      callback.onSuccess(value);
    }
  }

  @Override public void cancel() {
    canceled = true;
  }

  @Override public boolean isCanceled() {
    return canceled;
  }

  @Override public Call<V> clone() {
    return new FakeCall<>(value, error);
  }
}
