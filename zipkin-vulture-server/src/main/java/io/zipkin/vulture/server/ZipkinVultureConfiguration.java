/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.server;

import com.linecorp.armeria.client.ClientFactory;
import com.linecorp.armeria.client.ClientOptions;
import com.linecorp.armeria.client.ClientOptionsBuilder;
import com.linecorp.armeria.client.encoding.DecodingClient;
import com.linecorp.armeria.client.logging.ContentPreviewingClient;
import com.linecorp.armeria.client.logging.LoggingClient;
import com.linecorp.armeria.client.logging.LoggingClientBuilder;
import com.linecorp.armeria.client.metric.MetricCollectingClient;
import com.linecorp.armeria.common.HttpHeaderNames;
import com.linecorp.armeria.common.HttpHeaders;
import com.linecorp.armeria.common.logging.LogLevel;
import com.linecorp.armeria.common.metric.MeterIdPrefixFunction;
import io.micrometer.core.instrument.MeterRegistry;
import io.zipkin.vulture.Vulture;
import io.zipkin.vulture.VultureMetrics;
import io.zipkin.vulture.http.HttpBackend;
import io.zipkin.vulture.server.ZipkinVultureProperties.HttpLogging;
import io.zipkin.vulture.validation.Sleeper;
import io.zipkin.vulture.validation.ValidationConfig;
import io.zipkin.vulture.validation.ValidationService;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(ZipkinVultureProperties.class)
public class ZipkinVultureConfiguration {
  static final String MODE = "zipkin.vulture.mode";

  @Bean(destroyMethod = "close") ClientFactory vultureClientFactory(MeterRegistry registry) {
    return ClientFactory.builder().meterRegistry(registry).build();
  }

  @Bean HttpBackend httpBackend(ZipkinVultureProperties vulture, ClientFactory clientFactory) {
    ClientOptionsBuilder options = ClientOptions.builder()
      .factory(clientFactory)
      .decorator(MetricCollectingClient.newDecorator(
        MeterIdPrefixFunction.ofDefault("zipkin_vulture.client")))
      .decorator(DecodingClient.newDecorator());
    configureHttpLogging(vulture.getHttpLogging(), options);

    return HttpBackend.newBuilder()
      .queryUrl(vulture.getQueryUrl())
      .pushUrl(vulture.getPushUrl())
      .tenant(vulture.getTenant())
      .accessToken(vulture.getAccessPolicyToken())
      .timeout(vulture.getTimeout().toMillis())
      .clientOptions(options.build())
      .build();
  }

  static void configureHttpLogging(HttpLogging httpLogging, ClientOptionsBuilder options) {
    if (httpLogging == HttpLogging.NONE) return;
    LoggingClientBuilder loggingBuilder = LoggingClient.builder()
      .requestLogLevel(LogLevel.INFO)
      .successfulResponseLogLevel(LogLevel.INFO)
      .requestHeadersSanitizer((ctx, headers) -> {
        if (!headers.contains(HttpHeaderNames.AUTHORIZATION)) return headers;
        return headers.toBuilder().set(HttpHeaderNames.AUTHORIZATION, "****").build();
      });
    switch (httpLogging) {
      case HEADERS:
        loggingBuilder.contentSanitizer((ctx, unused) -> "");
        break;
      case BASIC:
        loggingBuilder.contentSanitizer((ctx, unused) -> "");
        loggingBuilder.headersSanitizer((ctx, unused) -> HttpHeaders.of());
        break;
      case BODY:
      default:
        break;
    }
    options.decorator(loggingBuilder.newDecorator());
    if (httpLogging == HttpLogging.BODY) {
      options.decorator(ContentPreviewingClient.newDecorator(Integer.MAX_VALUE));
    }
  }

  @Bean VultureMetrics vultureMetrics(MeterRegistry registry) {
    return new MicrometerVultureMetrics(registry);
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(name = MODE, havingValue = "soak", matchIfMissing = true)
  static class SoakConfiguration {
    @Bean(initMethod = "start", destroyMethod = "close") Vulture vulture(
      ZipkinVultureProperties vulture, HttpBackend backend, VultureMetrics metrics) {
      return Vulture.newBuilder()
        .writer(backend.traceWriter())
        .querier(backend.traceQuerier())
        .searcher(backend.traceSearcher())
        .metricsQuerier(backend.metricsQuerier())
        .metrics(metrics)
        .tenant(vulture.getTenant())
        .writeBackoff(vulture.getWriteBackoff().toMillis())
        .longWriteBackoff(vulture.getLongWriteBackoff().toMillis())
        .readBackoff(vulture.getReadBackoff().toMillis())
        .searchBackoff(vulture.getSearchBackoff().toMillis())
        .metricsBackoff(vulture.getMetricsBackoff().toMillis())
        .spanCountBackoff(vulture.getSpanCountBackoff().toMillis())
        .retention(vulture.getRetention().toMillis())
        .maxLongWrites(vulture.getMaxLongWrites())
        .longWriteThreads(vulture.getLongWriteThreads())
        .build();
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(name = MODE, havingValue = "validation")
  static class ValidationConfiguration {
    @Bean ValidationService validationService(
      ZipkinVultureProperties vulture, HttpBackend backend, VultureMetrics metrics) {
      if (vulture.getAccessPolicyToken() == null) {
        throw new IllegalArgumentException(
          "zipkin.vulture.access-policy-token is required in validation mode");
      }
      ZipkinVultureProperties.Validation validation = vulture.getValidation();
      ValidationConfig config = ValidationConfig.newBuilder()
        .cycles(validation.getCycles())
        .timeout(validation.getTimeout().toMillis())
        .tenant(vulture.getTenant())
        .searchBackoff(vulture.getSearchBackoff().toMillis())
        .searchDelay(validation.getSearchDelay().toMillis())
        .cycleDelay(validation.getCycleDelay().toMillis())
        .build();
      return new ValidationService(config, backend.traceWriter(), backend.traceQuerier(),
        backend.traceSearcher(), metrics, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    @Bean ZipkinVultureValidation zipkinVultureValidation(ValidationService validationService) {
      return new ZipkinVultureValidation(validationService);
    }
  }
}
