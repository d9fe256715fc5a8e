/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.http;

import com.linecorp.armeria.client.ClientOptions;
import com.linecorp.armeria.client.WebClient;
import com.linecorp.armeria.client.WebClientBuilder;
import com.linecorp.armeria.common.AggregatedHttpRequest;
import com.linecorp.armeria.common.HttpData;
import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.HttpMethod;
import com.linecorp.armeria.common.MediaType;
import com.linecorp.armeria.common.QueryParams;
import com.linecorp.armeria.common.QueryParamsBuilder;
import com.linecorp.armeria.common.RequestHeaders;
import com.linecorp.armeria.common.RequestHeadersBuilder;
import io.netty.util.AsciiString;
import io.zipkin.vulture.InvalidTenantException;
import io.zipkin.vulture.MetricSeries;
import io.zipkin.vulture.MetricsQuerier;
import io.zipkin.vulture.TraceNotFoundException;
import io.zipkin.vulture.TraceQuerier;
import io.zipkin.vulture.TraceSearcher;
import io.zipkin.vulture.TraceSummary;
import io.zipkin.vulture.TraceWriter;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.TimeUnit;
import zipkin2.Call;
import zipkin2.Span;
import zipkin2.codec.SpanBytesEncoder;
import zipkin2.internal.Nullable;
import zipkin2.storage.QueryRequest;

/**
 * Talks to a Zipkin-compatible backend over HTTP.
 *
 * <p>Spans are posted in JSON v2 format to {@code /api/v2/spans} of the push URL. Traces are read
 * with the Zipkin v2 query API of the query URL, except structured searches and metrics, which use
 * {@code /api/search} and {@code /api/metrics/query_range}.
 *
 * <p>Each request carries the tenant in the {@link #ORG_ID} header, unless the tenant is empty.
 */
public final class HttpBackend {
  public static final AsciiString ORG_ID = AsciiString.cached("X-Scope-OrgID");
  static final int SEARCH_LIMIT = 20;
  static final int SPANS_PER_SPAN_SET = 100;

  public static Builder newBuilder() {
    return new Builder();
  }

  public static final class Builder {
    String queryUrl = "http://localhost:9411", pushUrl = "http://localhost:9411";
    String tenant = "";
    @Nullable String accessToken;
    long timeout = TimeUnit.SECONDS.toMillis(10);
    ClientOptions clientOptions = ClientOptions.of();

    /** Base URL of the read APIs. Defaults to "http://localhost:9411" */
    public Builder queryUrl(String queryUrl) {
      if (queryUrl == null) throw new NullPointerException("queryUrl == null");
      this.queryUrl = queryUrl;
      return this;
    }

    /** Base URL of the span ingestion API. Defaults to "http://localhost:9411" */
    public Builder pushUrl(String pushUrl) {
      if (pushUrl == null) throw new NullPointerException("pushUrl == null");
      this.pushUrl = pushUrl;
      return this;
    }

    /** Tenant of reads. Writes use the tenant of each batch. */
    public Builder tenant(String tenant) {
      if (tenant == null) throw new NullPointerException("tenant == null");
      this.tenant = tenant;
      return this;
    }

    /**
     * When set with a non-empty tenant, requests are authorized with basic auth of the tenant and
     * this token.
     */
    public Builder accessToken(@Nullable String accessToken) {
      this.accessToken = accessToken;
      return this;
    }

    /** Milliseconds to wait for each response. Defaults to 10 seconds. */
    public Builder timeout(long timeout) {
      if (timeout <= 0) throw new IllegalArgumentException("timeout <= 0");
      this.timeout = timeout;
      return this;
    }

    /** Options such as decorators for logging or metrics. */
    public Builder clientOptions(ClientOptions clientOptions) {
      if (clientOptions == null) throw new NullPointerException("clientOptions == null");
      this.clientOptions = clientOptions;
      return this;
    }

    /** @throws InvalidTenantException if the tenant can't be sent in a header */
    public HttpBackend build() {
      InvalidTenantException.validate(tenant);
      return new HttpBackend(this);
    }

    Builder() {
    }
  }

  /** Returns the value of the authorization header for the tenant and token. */
  public static String basicAuth(String tenant, String accessToken) {
    String credentials = tenant + ":" + accessToken;
    return "Basic " + Base64.getEncoder()
      .encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }

  final String tenant;
  final HttpCall.Factory push, query;
  final TraceWriter traceWriter = new HttpTraceWriter();
  final TraceQuerier traceQuerier = new HttpTraceQuerier();
  final TraceSearcher traceSearcher = new HttpTraceSearcher();
  final MetricsQuerier metricsQuerier = new HttpMetricsQuerier();

  HttpBackend(Builder builder) {
    tenant = builder.tenant;
    push = new HttpCall.Factory(newClient(builder, builder.pushUrl));
    query = new HttpCall.Factory(newClient(builder, builder.queryUrl));
  }

  static WebClient newClient(Builder builder, String url) {
    WebClientBuilder result = WebClient.builder(url)
      .options(builder.clientOptions)
      .responseTimeoutMillis(builder.timeout)
      .writeTimeoutMillis(builder.timeout);
    String accessToken = builder.accessToken;
    // credentials are only sent for a tenant
    if (!builder.tenant.isEmpty() && accessToken != null && !accessToken.isEmpty()) {
      result.addHeader(HttpHeaderNames.AUTHORIZATION, basicAuth(builder.tenant, accessToken));
    }
    return result.build();
  }

  public TraceWriter traceWriter() {
    return traceWriter;
  }

  public TraceQuerier traceQuerier() {
    return traceQuerier;
  }

  public TraceSearcher traceSearcher() {
    return traceSearcher;
  }

  public MetricsQuerier metricsQuerier() {
    return metricsQuerier;
  }

  @Override public String toString() {
    return "HttpBackend{tenant=" + tenant + "}";
  }

  RequestHeaders get(String path, QueryParamsBuilder params) {
    return withTenant(RequestHeaders.builder(HttpMethod.GET,
      path + "?" + params.build().toQueryString()), tenant).build();
  }

  static RequestHeadersBuilder withTenant(RequestHeadersBuilder headers, String tenant) {
    if (!tenant.isEmpty()) headers.set(ORG_ID, tenant);
    return headers;
  }

  final class HttpTraceWriter implements TraceWriter {
    @Override public Call<Void> emitBatch(String tenant, List<Span> batch) {
      InvalidTenantException.validate(tenant);
      RequestHeaders headers = withTenant(
        RequestHeaders.builder(HttpMethod.POST, "/api/v2/spans").contentType(MediaType.JSON),
        tenant).build();
      HttpData body = HttpData.wrap(SpanBytesEncoder.JSON_V2.encodeList(batch));
      return push.newCall(AggregatedHttpRequest.of(headers, body), BodyConverters.NULL,
        "emit-batch");
    }

    @Override public String toString() {
      return "HttpTraceWriter{}";
    }
  }

  final class HttpTraceQuerier implements TraceQuerier {
    @Override public Call<List<Span>> getTrace(String traceId, long startTs, long endTs) {
      if (traceId == null) throw new NullPointerException("traceId == null");
      QueryParamsBuilder params = QueryParams.builder();
      if (startTs > 0) params.add("startTs", String.valueOf(startTs));
      if (endTs > 0) params.add("endTs", String.valueOf(endTs));
      RequestHeaders headers = get("/api/v2/trace/" + traceId, params);
      return query.newCall(AggregatedHttpRequest.of(headers), BodyConverters.SPANS,
        path -> new TraceNotFoundException(traceId), "get-trace");
    }

    @Override public String toString() {
      return "HttpTraceQuerier{}";
    }
  }

  final class HttpTraceSearcher implements TraceSearcher {
    @Override public Call<List<TraceSummary>> searchTag(String key, String value, long startTs,
      long endTs) {
      // validates the range and the tag before any request
      QueryRequest request = QueryRequest.newBuilder()
        .parseAnnotationQuery(key + "=" + value)
        .endTs(endTs)
        .lookback(endTs - startTs)
        .limit(SEARCH_LIMIT)
        .build();
      QueryParamsBuilder params = QueryParams.builder()
        .add("annotationQuery", request.annotationQueryString())
        .add("endTs", String.valueOf(request.endTs()))
        .add("lookback", String.valueOf(request.lookback()))
        .add("limit", String.valueOf(request.limit()));
      RequestHeaders headers = get("/api/v2/traces", params);
      return query.newCall(AggregatedHttpRequest.of(headers), BodyConverters.TRACES,
        "search-tag");
    }

    @Override public Call<List<TraceSummary>> searchTraceQL(String traceQL, long startTs,
      long endTs) {
      return searchTraceQL(traceQL, startTs, endTs, SEARCH_LIMIT);
    }

    @Override public Call<List<TraceSummary>> searchTraceQL(String traceQL, long startTs,
      long endTs, int limit) {
      if (traceQL == null) throw new NullPointerException("traceQL == null");
      if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
      QueryParamsBuilder params = QueryParams.builder()
        .add("q", traceQL)
        .add("start", String.valueOf(TimeUnit.MILLISECONDS.toSeconds(startTs)))
        .add("end", String.valueOf(TimeUnit.MILLISECONDS.toSeconds(endTs)))
        .add("limit", String.valueOf(limit))
        .add("spss", String.valueOf(SPANS_PER_SPAN_SET));
      RequestHeaders headers = get("/api/search", params);
      return query.newCall(AggregatedHttpRequest.of(headers), BodyConverters.SEARCH,
        "search-traceql");
    }

    @Override public String toString() {
      return "HttpTraceSearcher{}";
    }
  }

  final class HttpMetricsQuerier implements MetricsQuerier {
    @Override public Call<List<MetricSeries>> queryRange(String metricsQuery, long startTs,
      long endTs, long step) {
      if (metricsQuery == null) throw new NullPointerException("metricsQuery == null");
      QueryParamsBuilder params = QueryParams.builder()
        .add("q", metricsQuery)
        .add("start", String.valueOf(TimeUnit.MILLISECONDS.toSeconds(startTs)))
        .add("end", String.valueOf(TimeUnit.MILLISECONDS.toSeconds(endTs)))
        .add("step", TimeUnit.MILLISECONDS.toSeconds(step) + "s");
      RequestHeaders headers = get("/api/metrics/query_range", params);
      return query.newCall(AggregatedHttpRequest.of(headers), BodyConverters.SERIES,
        "query-range");
    }

    @Override public String toString() {
      return "HttpMetricsQuerier{}";
    }
  }
}
