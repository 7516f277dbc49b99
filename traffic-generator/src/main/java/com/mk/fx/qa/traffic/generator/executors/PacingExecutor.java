package com.mk.fx.qa.traffic.generator.executors;

import static java.util.concurrent.Executors.newFixedThreadPool;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Fires cycles at a target rate until the duration expires or a stop is requested.
 *
 * <p>Each tick starts one cycle and then sleeps for {@code max(0, interval - tickDuration)}. A
 * tick that overruns the interval is followed immediately by the next one; missed ticks are not
 * made up. Sleeps are sliced so a stop request is seen within {@link #SLEEP_SLICE_NANOS}.
 *
 * <p>With {@code maxInFlight == 1} cycles run inline on the calling thread. With a higher limit
 * cycles run on a bounded pool and a tick that finds every slot busy is skipped. Either way every
 * launched cycle has completed when this method returns.
 */
@Slf4j
public final class PacingExecutor {

  static final long SLEEP_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(100);
  private static final long DRAIN_TIMEOUT_SECONDS = 30;
  private static final double MIN_RATE = 0.00001;

  private PacingExecutor() {
    throw new UnsupportedOperationException("PacingExecutor cannot be instantiated");
  }

  /**
   * Runs cycles until expiry or stop.
   *
   * @param runName name used in thread names and logs
   * @param parameters rate, in-flight limit and duration
   * @param stopRequested polled before every tick and during sleeps
   * @param cycleTask one cycle; exceptions are logged and counted, never fatal
   * @param afterTick runs on the pacing thread after each tick, before the sleep
   * @return counts for the run; an interrupted run returns normally with {@code cancelled} set and
   *     the interrupt flag restored
   */
  public static PacingResult execute(
      String runName,
      PacingParameters parameters,
      BooleanSupplier stopRequested,
      Runnable cycleTask,
      Runnable afterTick) {

    validate(runName, parameters, stopRequested, cycleTask, afterTick);

    int maxInFlight = Math.max(1, parameters.maxInFlight());
    Duration duration = parameters.duration() != null ? parameters.duration() : Duration.ZERO;
    long durationNanos = duration.isZero() || duration.isNegative() ? Long.MAX_VALUE : duration.toNanos();

    long startNanos = System.nanoTime();
    long deadlineNanos =
        durationNanos == Long.MAX_VALUE ? Long.MAX_VALUE : startNanos + durationNanos;

    AtomicLong launched = new AtomicLong();
    AtomicLong completed = new AtomicLong();
    AtomicLong failed = new AtomicLong();
    long skipped = 0;
    boolean cancelled = false;
    boolean interrupted = false;

    Semaphore permits = new Semaphore(maxInFlight);
    ExecutorService workers = maxInFlight > 1 ? newWorkerPool(runName, maxInFlight) : null;

    try {
      while (true) {
        if (shouldStop(stopRequested)) {
          cancelled = true;
          break;
        }
        long tickStart = System.nanoTime();
        if (tickStart - startNanos >= durationNanos) {
          break;
        }

        if (workers == null) {
          launched.incrementAndGet();
          runCycle(runName, cycleTask, completed, failed);
        } else if (permits.tryAcquire()) {
          launched.incrementAndGet();
          workers.execute(
              () -> {
                try {
                  runCycle(runName, cycleTask, completed, failed);
                } finally {
                  permits.release();
                }
              });
        } else {
          skipped++;
        }

        runAfterTick(runName, afterTick);

        long intervalNanos = intervalNanos(parameters);
        long wakeAt = Math.min(tickStart + intervalNanos, deadlineNanos);
        if (!sleepUntil(wakeAt, stopRequested)) {
          cancelled = true;
          break;
        }
      }
    } catch (InterruptedException e) {
      interrupted = true;
      cancelled = true;
    } finally {
      if (workers != null) {
        interrupted |= drain(runName, workers);
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    var elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    return new PacingResult(
        launched.get(), completed.get(), failed.get(), skipped, cancelled, elapsed);
  }

  private static void validate(
      String runName,
      PacingParameters parameters,
      BooleanSupplier stopRequested,
      Runnable cycleTask,
      Runnable afterTick) {
    Objects.requireNonNull(runName, "runName");
    Objects.requireNonNull(parameters, "parameters");
    Objects.requireNonNull(parameters.ratePerSec(), "parameters.ratePerSec");
    Objects.requireNonNull(stopRequested, "stopRequested");
    Objects.requireNonNull(cycleTask, "cycleTask");
    Objects.requireNonNull(afterTick, "afterTick");
  }

  private static long intervalNanos(PacingParameters parameters) {
    double rate = Math.max(MIN_RATE, parameters.ratePerSec().getAsDouble());
    return (long) Math.max(1, 1_000_000_000L / rate);
  }

  private static void runCycle(
      String runName, Runnable cycleTask, AtomicLong completed, AtomicLong failed) {
    try {
      cycleTask.run();
    } catch (RuntimeException ex) {
      failed.incrementAndGet();
      log.error("Run {} cycle failed: {}", runName, ex.getMessage(), ex);
    } finally {
      completed.incrementAndGet();
    }
  }

  private static void runAfterTick(String runName, Runnable afterTick) {
    try {
      afterTick.run();
    } catch (RuntimeException ex) {
      log.error("Run {} post-tick hook failed: {}", runName, ex.getMessage(), ex);
    }
  }

  /**
   * Sleeps until {@code wakeAtNanos} in slices, returning false as soon as a stop is requested.
   */
  private static boolean sleepUntil(long wakeAtNanos, BooleanSupplier stopRequested)
      throws InterruptedException {
    while (true) {
      if (shouldStop(stopRequested)) {
        return false;
      }
      long remaining = wakeAtNanos - System.nanoTime();
      if (remaining <= 0) {
        return true;
      }
      TimeUnit.NANOSECONDS.sleep(Math.min(SLEEP_SLICE_NANOS, remaining));
    }
  }

  /** Waits for in-flight cycles; returns true if the wait was interrupted. */
  private static boolean drain(String runName, ExecutorService workers) {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        log.warn(
            "Run {} in-flight cycles did not finish within {}s; abandoning them",
            runName,
            DRAIN_TIMEOUT_SECONDS);
        workers.shutdownNow();
      }
      return false;
    } catch (InterruptedException interrupted) {
      workers.shutdownNow();
      return true;
    }
  }

  private static ExecutorService newWorkerPool(String runName, int maxInFlight) {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("traffic-cycle-" + runName + "-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    return newFixedThreadPool(maxInFlight, threadFactory);
  }

  private static boolean shouldStop(BooleanSupplier stopRequested) {
    return Thread.currentThread().isInterrupted() || stopRequested.getAsBoolean();
  }
}
