package com.mk.fx.qa.traffic.generator.executors;

import java.time.Duration;

/**
 * Result of a paced run.
 *
 * @param launched cycles started
 * @param completed cycles that finished, normally or not
 * @param failed cycles that threw out of the cycle task
 * @param skipped ticks dropped because every in-flight slot was busy
 * @param cancelled true if the run ended on a stop request or interruption rather than expiry
 * @param elapsed wall-clock run time
 */
public record PacingResult(
    long launched, long completed, long failed, long skipped, boolean cancelled, Duration elapsed) {}
