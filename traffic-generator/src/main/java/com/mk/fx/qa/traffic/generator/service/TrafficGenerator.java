package com.mk.fx.qa.traffic.generator.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.traffic.generator.catalog.Endpoint;
import com.mk.fx.qa.traffic.generator.executors.PacingExecutor;
import com.mk.fx.qa.traffic.generator.executors.PacingParameters;
import com.mk.fx.qa.traffic.generator.executors.PacingResult;
import com.mk.fx.qa.traffic.generator.executors.RequestExecutor;
import com.mk.fx.qa.traffic.generator.metrics.SummaryReporter;
import com.mk.fx.qa.traffic.generator.metrics.TrafficMetrics;
import com.mk.fx.qa.traffic.generator.metrics.TrafficSummary;
import com.mk.fx.qa.traffic.generator.model.CycleOutcome;
import com.mk.fx.qa.traffic.generator.model.ExceptionKind;
import com.mk.fx.qa.traffic.generator.model.RunState;
import com.mk.fx.qa.traffic.generator.model.SummaryMode;
import com.mk.fx.qa.traffic.generator.model.TrafficConfig;
import com.mk.fx.qa.traffic.generator.rest.HttpTransport;
import com.mk.fx.qa.traffic.generator.selection.TrafficPlan;
import java.time.Duration;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives the request cycle: choose an endpoint, decide whether to corrupt it, build and send the
 * request, record the outcome, then pace to the configured rate.
 *
 * <p>Lifecycle is {@code IDLE -> RUNNING -> STOPPING -> STOPPED}. {@link #run(Duration)} may be
 * called once per instance and blocks the calling thread until the duration expires or {@link
 * #stop()} is called. Whatever ends the run, the transport is closed and exactly one final
 * cumulative summary is reported.
 *
 * <p>Configuration may be replaced while running with {@link #updateConfig(TrafficConfig)}. Each
 * cycle reads the configuration once, so a cycle never mixes two versions. The transport and its
 * timeouts are fixed for the lifetime of the run.
 */
@Slf4j
public class TrafficGenerator {

  private static final String RUN_NAME = "traffic";

  private final Function<TrafficConfig, HttpTransport> transportFactory;
  private final SummaryReporter reporter;
  private final Random random;
  private final TrafficMetrics metrics;
  private final AtomicReference<TrafficPlan> plan;
  private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  private final CountDownLatch stopped = new CountDownLatch(1);

  /** Nanos at which the next periodic summary is due; only touched by the pacing thread. */
  private long nextSummaryAtNanos;

  private long windowStartNanos;

  /**
   * @param config initial configuration; its seed, if any, makes the request sequence
   *     reproducible
   * @param transportFactory opens the transport when the run starts
   * @param reporter receives periodic and final summaries
   */
  public TrafficGenerator(
      TrafficConfig config,
      Function<TrafficConfig, HttpTransport> transportFactory,
      SummaryReporter reporter) {
    this(config, transportFactory, reporter, randomFor(config));
  }

  @VisibleForTesting
  TrafficGenerator(
      TrafficConfig config,
      Function<TrafficConfig, HttpTransport> transportFactory,
      SummaryReporter reporter,
      Random random) {
    Objects.requireNonNull(config, "config");
    this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
    this.random = Objects.requireNonNull(random, "random");
    this.metrics = new TrafficMetrics(config.topStatusCodes(), config.topExceptionKinds());
    this.plan = new AtomicReference<>(TrafficPlan.of(config, random));
  }

  private static Random randomFor(TrafficConfig config) {
    Objects.requireNonNull(config, "config");
    return config.seed() != null ? new Random(config.seed()) : new Random();
  }

  /**
   * Generates traffic until {@code duration} expires or {@link #stop()} is called. Interrupting
   * the calling thread also stops the run; the interrupt flag is left set.
   *
   * @param duration how long to run; null or zero runs until stopped
   * @return the final cumulative summary
   * @throws IllegalArgumentException if {@code duration} is negative
   * @throws IllegalStateException if this generator has already been started or stopped
   */
  public TrafficSummary run(Duration duration) {
    if (duration != null && duration.isNegative()) {
      throw new IllegalArgumentException("duration must not be negative, got " + duration);
    }
    if (!state.compareAndSet(RunState.IDLE, RunState.RUNNING)) {
      throw new IllegalStateException("Generator cannot be started from state " + state.get());
    }

    var config = plan.get().config();
    long startNanos = System.nanoTime();
    windowStartNanos = startNanos;
    nextSummaryAtNanos = nextSummaryAt(startNanos, config.summaryInterval());

    log.info(
        "Starting {} traffic against {} at {} rps (weights={}, errorRates={}, maxInFlight={},"
            + " duration={})",
        config.trafficType(),
        config.baseUrl(),
        config.rps(),
        config.weights(),
        config.errorRates(),
        config.maxInFlight(),
        duration == null || duration.isZero() ? "until stopped" : duration);

    HttpTransport transport = null;
    TrafficSummary finalSummary;
    try {
      transport = transportFactory.apply(config);
      var executor = new RequestExecutor(transport);
      var parameters =
          new PacingParameters(() -> plan.get().config().rps(), config.maxInFlight(), duration);

      PacingResult result =
          PacingExecutor.execute(
              RUN_NAME,
              parameters,
              stopRequested::get,
              () -> runCycle(executor),
              () -> maybeReport(startNanos));

      log.info(
          "Traffic loop finished: launched={} completed={} skipped={} cancelled={}",
          result.launched(),
          result.completed(),
          result.skipped(),
          result.cancelled());
    } finally {
      state.set(RunState.STOPPING);
      closeQuietly(transport);
      finalSummary = metrics.summarize(Duration.ofNanos(System.nanoTime() - startNanos));
      emit(finalSummary, true);
      state.set(RunState.STOPPED);
      stopped.countDown();
    }
    return finalSummary;
  }

  /**
   * Requests a stop. The loop notices within one cycle plus one sleep slice. Calling this before
   * {@link #run(Duration)} moves the generator straight to STOPPED.
   */
  public void stop() {
    stopRequested.set(true);
    if (state.compareAndSet(RunState.IDLE, RunState.STOPPED)) {
      stopped.countDown();
      return;
    }
    if (state.compareAndSet(RunState.RUNNING, RunState.STOPPING)) {
      log.info("Stop requested; finishing in-flight cycles");
    }
  }

  /**
   * Waits for the run to reach STOPPED.
   *
   * @return true if stopped within the timeout
   */
  public boolean awaitStopped(Duration timeout) {
    try {
      return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  /** Replaces the configuration; the next cycle and the next pacing interval use it. */
  public void updateConfig(TrafficConfig config) {
    Objects.requireNonNull(config, "config");
    plan.set(TrafficPlan.of(config, random));
    log.info(
        "Configuration updated: rps={} weights={} errorRates={} headers={}",
        config.rps(),
        config.weights(),
        config.errorRates(),
        config.extraHeaders().keySet());
  }

  public TrafficConfig currentConfig() {
    return plan.get().config();
  }

  public RunState state() {
    return state.get();
  }

  public TrafficMetrics metrics() {
    return metrics;
  }

  private void runCycle(RequestExecutor executor) {
    var current = plan.get();
    Endpoint endpoint = null;
    boolean injected = false;
    try {
      endpoint = current.selector().choose();
      var inject = current.injector().shouldInject(endpoint);
      var request = endpoint.build(current.requestContext(), inject);
      injected = request.injected();

      var outcome = executor.send(request);
      metrics.record(outcome, endpoint, injected);

      if (log.isDebugEnabled()) {
        log.debug(
            "endpoint={} injected={} variant={} {}={}",
            endpoint.key(),
            injected,
            request.variant(),
            outcome.hasStatus() ? "status" : "exception",
            outcome.label());
      }
    } catch (RuntimeException ex) {
      log.error(
          "Cycle for endpoint {} failed: {}",
          endpoint != null ? endpoint.key() : "<none>",
          ex.getMessage(),
          ex);
      metrics.record(CycleOutcome.exception(ExceptionKind.UNEXPECTED), endpoint, injected);
    }
  }

  private void maybeReport(long startNanos) {
    var config = plan.get().config();
    if (config.summaryInterval().isZero()) {
      return;
    }
    long now = System.nanoTime();
    if (now - nextSummaryAtNanos < 0) {
      return;
    }
    nextSummaryAtNanos = nextSummaryAt(now, config.summaryInterval());
    TrafficSummary summary;
    if (config.summaryMode() == SummaryMode.WINDOWED) {
      summary = metrics.drainWindow(Duration.ofNanos(now - windowStartNanos));
      windowStartNanos = now;
    } else {
      summary = metrics.summarize(Duration.ofNanos(now - startNanos));
    }
    emit(summary, false);
  }

  private static long nextSummaryAt(long fromNanos, Duration interval) {
    return interval.isZero() ? Long.MAX_VALUE : fromNanos + interval.toNanos();
  }

  private void emit(TrafficSummary summary, boolean finalReport) {
    try {
      reporter.report(summary, finalReport);
    } catch (RuntimeException ex) {
      log.error("Summary reporter failed: {}", ex.getMessage(), ex);
    }
  }

  private static void closeQuietly(HttpTransport transport) {
    if (transport == null) {
      return;
    }
    try {
      transport.close();
    } catch (RuntimeException ex) {
      log.warn("Failed to close transport: {}", ex.getMessage(), ex);
    }
  }
}
