/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package io.zipkin.vulture.validation;

import io.zipkin.vulture.Outcome;
import io.zipkin.vulture.TraceEmitter;
import io.zipkin.vulture.TraceInfo;
import io.zipkin.vulture.TraceQuerier;
import io.zipkin.vulture.TraceRetrievalValidator;
import io.zipkin.vulture.TraceSearchValidator;
import io.zipkin.vulture.TraceSearcher;
import io.zipkin.vulture.TraceWriter;
import io.zipkin.vulture.VultureMetrics;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.zipkin.vulture.VultureMetrics.NOOP_METRICS;

/**
 * One-shot check of a backend. Each cycle writes a trace and reads it back immediately. Once all
 * cycles ran, and after giving the backend time to index, each trace is searched for.
 *
 * <p>A failed write ends the run, as there's nothing to validate. Read and search failures are
 * collected so one run reports every problem. Passing the deadline is itself a failure.
 */
public final class ValidationService {
  static final Logger LOG = LoggerFactory.getLogger(ValidationService.class);

  final ValidationConfig config;
  final TraceEmitter emitter;
  final TraceRetrievalValidator retrievalValidator;
  final TraceSearchValidator searchValidator;
  final VultureMetrics metrics;
  final Clock clock;
  final Sleeper sleeper;

  public ValidationService(ValidationConfig config, TraceWriter writer, TraceQuerier querier,
    TraceSearcher searcher) {
    this(config, writer, querier, searcher, NOOP_METRICS, Clock.systemUTC(), Sleeper.SYSTEM);
  }

  public ValidationService(ValidationConfig config, TraceWriter writer, TraceQuerier querier,
    TraceSearcher searcher, VultureMetrics metrics, Clock clock, Sleeper sleeper) {
    if (config == null) throw new NullPointerException("config == null");
    if (metrics == null) throw new NullPointerException("metrics == null");
    if (clock == null) throw new NullPointerException("clock == null");
    if (sleeper == null) throw new NullPointerException("sleeper == null");
    this.config = config;
    this.emitter = new TraceEmitter(writer);
    this.retrievalValidator = new TraceRetrievalValidator(querier, config.readWindow());
    this.searchValidator = new TraceSearchValidator(searcher);
    this.metrics = metrics;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public ValidationResult run() {
    long start = clock.millis();
    long deadline = start + config.timeout();
    List<ValidationFailure> failures = new ArrayList<>();
    List<TraceInfo> written = new ArrayList<>();

    LOG.info("validating {} cycles of tenant '{}' within {}ms", config.cycles(), config.tenant(),
      config.timeout());

    for (int cycle = 0; cycle < config.cycles(); cycle++) {
      TraceInfo trace = TraceInfo.create(clock.millis(), 0, config.tenant());
      try {
        emitter.emitAllBatches(trace);
      } catch (IOException | RuntimeException e) {
        LOG.error("failed to write trace {}: {}", trace.hexTraceId(), e.getMessage(), e);
        failures.add(failure(trace.hexTraceId(), cycle, ValidationPhase.WRITE, e));
        return result(start, failures);
      }
      LOG.info("wrote trace {}", trace.hexTraceId());
      written.add(trace);
      if (expired(deadline, cycle, failures)) return result(start, failures);

      Outcome read = retrievalValidator.validate(trace);
      metrics.record(read.metrics());
      if (!read.isSuccess()) {
        failures.add(failure(trace.hexTraceId(), cycle, ValidationPhase.READ, read.error()));
      }
      if (expired(deadline, cycle, failures)) return result(start, failures);

      if (!sleep(config.cycleDelay(), deadline, cycle, failures)) return result(start, failures);
    }

    if (config.searchBackoff() > 0) {
      if (!sleep(config.searchDelay(), deadline, config.cycles(), failures)) {
        return result(start, failures);
      }
      for (int cycle = 0; cycle < written.size(); cycle++) {
        TraceInfo trace = written.get(cycle);
        search(trace, cycle, searchValidator.searchTag(trace), failures);
        if (expired(deadline, cycle, failures)) return result(start, failures);
        search(trace, cycle, searchValidator.searchTraceQL(trace), failures);
        if (expired(deadline, cycle, failures)) return result(start, failures);
      }
    }
    return result(start, failures);
  }

  void search(TraceInfo trace, int cycle, Outcome outcome, List<ValidationFailure> failures) {
    metrics.record(outcome.metrics());
    if (!outcome.isSuccess()) {
      failures.add(failure(trace.hexTraceId(), cycle, ValidationPhase.SEARCH, outcome.error()));
    }
  }

  /** Returns true after recording a timeout failure, when a call ended past the deadline. */
  boolean expired(long deadline, int cycle, List<ValidationFailure> failures) {
    if (clock.millis() <= deadline) return false;
    failures.add(timeout(cycle));
    return true;
  }

  /** Returns false after recording a timeout failure. */
  boolean sleep(long millis, long deadline, int cycle, List<ValidationFailure> failures) {
    long remaining = deadline - clock.millis();
    if (remaining < millis) {
      failures.add(timeout(cycle));
      return false;
    }
    try {
      sleeper.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failures.add(failure(null, cycle, ValidationPhase.TIMEOUT, e));
      return false;
    }
  }

  ValidationFailure timeout(int cycle) {
    return failure(null, cycle, ValidationPhase.TIMEOUT,
      new TimeoutException("deadline exceeded before all phases completed"));
  }

  ValidationFailure failure(String traceId, int cycle, ValidationPhase phase, Throwable error) {
    return ValidationFailure.create(traceId, cycle, phase, error, clock.millis());
  }

  ValidationResult result(long start, List<ValidationFailure> failures) {
    ValidationResult result =
      ValidationResult.create(config.cycles(), failures, clock.millis() - start);
    LOG.info("validation completed: {} traces, {} passed, {} failed in {}ms",
      result.totalTraces(), result.successCount(), failures.size(), result.duration());
    for (ValidationFailure failure : failures) {
      LOG.error("validation failure in phase {} of cycle {} for trace {}: {}", failure.phase(),
        failure.cycle(), failure.traceId(), failure.error().getMessage());
    }
    return result;
  }
}
