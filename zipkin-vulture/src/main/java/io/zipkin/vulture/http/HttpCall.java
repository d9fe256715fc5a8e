/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.http;

import com.linecorp.armeria.client.UnprocessedRequestException;
import com.linecorp.armeria.client.WebClient;
import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.AggregatedHttpResponse;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpStatus;
import com.linecorp.armeria.common.HttpStatusClass;
import com.linecorp.armeria.common.util.Exceptions;
import io.netty.util.concurrent.EventExecutor;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import zipkin2.Call;
import zipkin2.Callback;

/** Adapts an Armeria request to a {@link Call}, parsing the response body on success. */
public final class HttpCall<V> extends Call.Base<V> {

  public interface BodyConverter<V> {
    /** Called only for successful responses. The content may be empty. */
    V convert(HttpData content) throws IOException;
  }

  /** Creates the exception raised when the response status is 404. */
  public interface NotFound {
    NotFound FILE_NOT_FOUND = FileNotFoundException::new;

    IOException notFound(String path);
  }

  public static final class Factory {
    final WebClient webClient;

    public Factory(WebClient webClient) {
      if (webClient == null) throw new NullPointerException("webClient == null");
      this.webClient = webClient;
    }

    public <V> HttpCall<V> newCall(
      AggregatedHttpRequest request, BodyConverter<V> bodyConverter, String name) {
      return newCall(request, bodyConverter, NotFound.FILE_NOT_FOUND, name);
    }

    public <V> HttpCall<V> newCall(AggregatedHttpRequest request,
      BodyConverter<V> bodyConverter, NotFound notFound, String name) {
      if (notFound == null) throw new NullPointerException("notFound == null");
      return new HttpCall<>(webClient, request, bodyConverter, notFound, name);
    }
  }

  final WebClient webClient;
  final AggregatedHttpRequest request;
  final BodyConverter<V> bodyConverter;
  final NotFound notFound;
  final String name;

  volatile CompletableFuture<AggregatedHttpResponse> responseFuture;

  HttpCall(WebClient webClient, AggregatedHttpRequest request, BodyConverter<V> bodyConverter,
    NotFound notFound, String name) {
    this.webClient = webClient;
    this.request = request;
    this.bodyConverter = bodyConverter;
    this.notFound = notFound;
    this.name = name;
  }

  @Override protected V doExecute() throws IOException {
    for (EventExecutor eventLoop : webClient.options().factory().eventLoopGroup()) {
      if (eventLoop.inEventLoop()) {
        throw new RuntimeException("Attempting to make a blocking request from an event loop. "
          + "Either use doEnqueue() or run this in a separate thread.");
      }
    }
    final AggregatedHttpResponse response;
    try {
      response = sendRequest().join();
    } catch (CompletionException e) {
      propagateIfFatal(e);
      Exceptions.throwUnsafely(e.getCause());
      return null; // Unreachable
    }
    return parseResponse(response);
  }

  @Override protected void doEnqueue(Callback<V> callback) {
    sendRequest().handle((response, t) -> {
      if (t != null) {
        callback.onError(Exceptions.peel(t));
      } else {
        try {
          callback.onSuccess(parseResponse(response));
        } catch (Throwable t1) {
          propagateIfFatal(t1);
          callback.onError(t1);
        }
      }
      return null;
    });
  }

  @Override protected void doCancel() {
    CompletableFuture<AggregatedHttpResponse> responseFuture = this.responseFuture;
    if (responseFuture != null) responseFuture.cancel(false);
  }

  @Override public HttpCall<V> clone() {
    return new HttpCall<>(webClient, request, bodyConverter, notFound, name);
  }

  @Override public String toString() {
    return "HttpCall(" + name + " " + request.method() + " " + request.path() + ")";
  }

  CompletableFuture<AggregatedHttpResponse> sendRequest() {
    CompletableFuture<AggregatedHttpResponse> responseFuture =
      webClient.execute(request.toHttpRequest()).aggregate().exceptionally(t -> {
        Throwable cause = Exceptions.peel(t);
        if (cause instanceof UnprocessedRequestException) {
          Throwable unprocessed = cause.getCause() != null ? cause.getCause() : cause;
          // Usually a configuration or infrastructure issue. Armeria's stack won't help with that.
          Exceptions.clearTrace(unprocessed);
          String message = unprocessed.getMessage();
          if (message == null) message = unprocessed.getClass().getSimpleName();
          throw new RejectedExecutionException(message, unprocessed);
        }
        return Exceptions.throwUnsafely(cause);
      });
    this.responseFuture = responseFuture;
    return responseFuture;
  }

  V parseResponse(AggregatedHttpResponse response) throws IOException {
    HttpStatus status = response.status();
    if (status.code() == 404) throw notFound.notFound(request.path());
    if (!status.codeClass().equals(HttpStatusClass.SUCCESS)) {
      // armeria fills an empty error response with the status text
      String body = response.contentUtf8().trim();
      boolean noDetail = body.isEmpty() || body.equals(status.toString());
      throw new RuntimeException("response for " + name + " " + request.path() + " failed: "
        + (noDetail ? status.toString() : status + " " + body));
    }
    return bodyConverter.convert(response.content());
  }
}
