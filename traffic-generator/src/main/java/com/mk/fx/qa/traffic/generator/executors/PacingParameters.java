package com.mk.fx.qa.traffic.generator.executors;

import java.time.Duration;
import java.util.function.DoubleSupplier;

/**
 * Parameters for a paced run.
 *
 * @param ratePerSec target cycle rate, read again before every sleep so a reloaded rate applies
 *     from the next cycle
 * @param maxInFlight maximum number of concurrently running cycles; 1 runs cycles inline
 * @param duration total run time, or null/zero to run until stopped
 */
public record PacingParameters(DoubleSupplier ratePerSec, int maxInFlight, Duration duration) {}
