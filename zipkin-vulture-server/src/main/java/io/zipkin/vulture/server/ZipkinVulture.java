/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.server;

import com.linecorp.armeria.spring.ArmeriaAutoConfiguration;
import org.slf4j.bridge.SLF4JBridgeHandler;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Import;

/**
 * Runs the load generator and checker against a Zipkin-compatible backend, configured by
 * {@code zipkin-vulture.yml}.
 *
 * <p>In soak mode, the process writes and checks traces until stopped. In validation mode, it
 * exits once validation completes, with status zero only if every check passed.
 *
 * <p>Auto-configuration is disabled by default to save startup time. The Armeria server, which
 * serves metrics, is imported explicitly.
 */
@SpringBootConfiguration
@EnableAutoConfiguration
@Import({
  ArmeriaAutoConfiguration.class,
  ZipkinVultureConfiguration.class,
  ZipkinVulturePrometheusConfiguration.class
})
public class ZipkinVulture {
  static {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
  }

  public static void main(String[] args) {
    ConfigurableApplicationContext context = new SpringApplicationBuilder(ZipkinVulture.class)
      .logStartupInfo(false)
      .properties(
        EnableAutoConfiguration.ENABLED_OVERRIDE_PROPERTY + "=false",
        "spring.config.name=zipkin-vulture").run(args);
    if (context.getBeanNamesForType(ZipkinVultureValidation.class).length > 0) {
      System.exit(SpringApplication.exit(context));
    }
  }
}
