/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.server;

import io.zipkin.vulture.validation.ValidationResult;
import io.zipkin.vulture.validation.ValidationService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

/** Runs validation once the application has started, and exits with its result. */
final class ZipkinVultureValidation implements ApplicationRunner, ExitCodeGenerator {
  final ValidationService validationService;
  volatile ValidationResult result;

  ZipkinVultureValidation(ValidationService validationService) {
    this.validationService = validationService;
  }

  @Override public void run(ApplicationArguments args) {
    result = validationService.run();
  }

  /** Fails unless validation ran without failures. */
  @Override public int getExitCode() {
    ValidationResult result = this.result;
    return result != null ? result.exitCode() : 1;
  }
}
