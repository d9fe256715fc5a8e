/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.server;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the load generator and checker
 * <pre>{@code
 * zipkin.vulture:
 *   mode: soak
 *   query-url: http://localhost:9411
 *   push-url: http://localhost:9411
 *   tenant: my-org
 *   access-policy-token: changeme
 *   write-backoff: 15s
 *   long-write-backoff: 1m
 *   read-backoff: 30s
 *   search-backoff: 1m
 *   metrics-backoff: 0
 *   span-count-backoff: 0
 *   retention: 336h
 *   max-long-writes: 3
 *   long-write-threads: 4
 *   timeout: 10s
 *   http-logging: NONE
 *   prometheus-path: /metrics
 *   validation:
 *     cycles: 3
 *     timeout: 5m
 *     search-delay: 60s
 *     cycle-delay: 1s
 * }</pre>
 */
@ConfigurationProperties("zipkin.vulture")
class ZipkinVultureProperties {
  enum Mode {
    /** Writes and checks traces until stopped. */
    SOAK,
    /** Writes and checks a few traces, then exits with a status reflecting the result. */
    VALIDATION
  }

  /** Sets the level of logging for HTTP requests made to the backend. */
  enum HttpLogging {
    NONE,
    BASIC,
    HEADERS,
    BODY
  }

  public static class Validation {
    /** Traces to write and read back. */
    private int cycles = 3;
    /** Deadline of the whole run. */
    private Duration timeout = Duration.ofMinutes(5);
    /** How long to wait after the last write before searching. */
    private Duration searchDelay = Duration.ofSeconds(60);
    /** Pause between cycles. At least a second, so that each trace has its own seed. */
    private Duration cycleDelay = Duration.ofSeconds(1);

    public int getCycles() {
      return cycles;
    }

    public void setCycles(int cycles) {
      this.cycles = cycles;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public Duration getSearchDelay() {
      return searchDelay;
    }

    public void setSearchDelay(Duration searchDelay) {
      this.searchDelay = searchDelay;
    }

    public Duration getCycleDelay() {
      return cycleDelay;
    }

    public void setCycleDelay(Duration cycleDelay) {
      this.cycleDelay = cycleDelay;
    }
  }

  private Mode mode = Mode.SOAK;
  private String queryUrl = "http://localhost:9411";
  private String pushUrl = "http://localhost:9411";
  /** Empty when the backend is single-tenant. */
  private String tenant = "";
  /** When set, requests are sent with basic auth of the tenant and this token. */
  private String accessPolicyToken;
  private Duration writeBackoff = Duration.ofSeconds(15);
  private Duration longWriteBackoff = Duration.ofMinutes(1);
  private Duration readBackoff = Duration.ofSeconds(30);
  private Duration searchBackoff = Duration.ofMinutes(1);
  private Duration metricsBackoff = Duration.ZERO;
  /** Interval of tracked writes whose searches and rates are checked. Zero disables them. */
  private Duration spanCountBackoff = Duration.ZERO;
  private Duration retention = Duration.ofHours(336);
  private int maxLongWrites = 3;
  private int longWriteThreads = 4;
  /** Timeout of each backend request. */
  private Duration timeout = Duration.ofSeconds(10);
  private HttpLogging httpLogging = HttpLogging.NONE;
  private String prometheusPath = "/metrics";
  private Validation validation = new Validation();

  public Mode getMode() {
    return mode;
  }

  public void setMode(Mode mode) {
    this.mode = mode;
  }

  public String getQueryUrl() {
    return queryUrl;
  }

  public void setQueryUrl(String queryUrl) {
    this.queryUrl = queryUrl;
  }

  public String getPushUrl() {
    return pushUrl;
  }

  public void setPushUrl(String pushUrl) {
    this.pushUrl = pushUrl;
  }

  public String getTenant() {
    return tenant;
  }

  public void setTenant(String tenant) {
    this.tenant = tenant != null ? tenant : "";
  }

  public String getAccessPolicyToken() {
    return accessPolicyToken;
  }

  public void setAccessPolicyToken(String accessPolicyToken) {
    this.accessPolicyToken = emptyToNull(accessPolicyToken);
  }

  public Duration getWriteBackoff() {
    return writeBackoff;
  }

  public void setWriteBackoff(Duration writeBackoff) {
    this.writeBackoff = writeBackoff;
  }

  public Duration getLongWriteBackoff() {
    return longWriteBackoff;
  }

  public void setLongWriteBackoff(Duration longWriteBackoff) {
    this.longWriteBackoff = longWriteBackoff;
  }

  public Duration getReadBackoff() {
    return readBackoff;
  }

  public void setReadBackoff(Duration readBackoff) {
    this.readBackoff = readBackoff;
  }

  public Duration getSearchBackoff() {
    return searchBackoff;
  }

  public void setSearchBackoff(Duration searchBackoff) {
    this.searchBackoff = searchBackoff;
  }

  public Duration getMetricsBackoff() {
    return metricsBackoff;
  }

  public void setMetricsBackoff(Duration metricsBackoff) {
    this.metricsBackoff = metricsBackoff;
  }

  public Duration getSpanCountBackoff() {
    return spanCountBackoff;
  }

  public void setSpanCountBackoff(Duration spanCountBackoff) {
    this.spanCountBackoff = spanCountBackoff;
  }

  public Duration getRetention() {
    return retention;
  }

  public void setRetention(Duration retention) {
    this.retention = retention;
  }

  public int getMaxLongWrites() {
    return maxLongWrites;
  }

  public void setMaxLongWrites(int maxLongWrites) {
    this.maxLongWrites = maxLongWrites;
  }

  public int getLongWriteThreads() {
    return longWriteThreads;
  }

  public void setLongWriteThreads(int longWriteThreads) {
    this.longWriteThreads = longWriteThreads;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public HttpLogging getHttpLogging() {
    return httpLogging;
  }

  public void setHttpLogging(HttpLogging httpLogging) {
    this.httpLogging = httpLogging;
  }

  public String getPrometheusPath() {
    return prometheusPath;
  }

  public void setPrometheusPath(String prometheusPath) {
    this.prometheusPath = prometheusPath;
  }

  public Validation getValidation() {
    return validation;
  }

  public void setValidation(Validation validation) {
    this.validation = validation;
  }

  static String emptyToNull(String s) {
    return "".equals(s) ? null : s;
  }
}
