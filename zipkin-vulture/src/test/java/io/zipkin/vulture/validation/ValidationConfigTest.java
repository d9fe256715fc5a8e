/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.validation;

import io.zipkin.vulture.TraceRetrievalValidator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationConfigTest {
  @Test void defaults() {
    ValidationConfig config = ValidationConfig.newBuilder().build();

    assertThat(config.cycles()).isEqualTo(3);
    assertThat(config.timeout()).isEqualTo(300_000L);
    assertThat(config.tenant()).isEmpty();
    assertThat(config.searchBackoff()).isEqualTo(60_000L);
    assertThat(config.searchDelay()).isEqualTo(60_000L);
    assertThat(config.cycleDelay()).isEqualTo(1000L);
    assertThat(config.readWindow()).isEqualTo(TraceRetrievalValidator.VALIDATION_WINDOW);
  }

  @Test void cycleDelayMustSeparateSeeds() {
    assertThatThrownBy(() -> ValidationConfig.newBuilder().cycleDelay(999).build())
      .hasMessage("cycleDelay must be at least a second");
  }

  @Test void cyclesMustBePositive() {
    assertThatThrownBy(() -> ValidationConfig.newBuilder().cycles(0).build())
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test void timeoutMustBePositive() {
    assertThatThrownBy(() -> ValidationConfig.newBuilder().timeout(0).build())
      .isInstanceOf(IllegalArgumentException.class);
  }
}
