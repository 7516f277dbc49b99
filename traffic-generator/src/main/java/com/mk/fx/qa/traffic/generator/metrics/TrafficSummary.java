package com.mk.fx.qa.traffic.generator.metrics;

import java.time.Duration;
import java.util.Map;

/**
 * Point-in-time report of recorded outcomes. The maps iterate in report order: status codes and
 * exception kinds by descending count, endpoints in catalog order.
 *
 * @param elapsed run time the summary covers
 * @param windowed true if counts cover only the interval since the previous periodic summary
 * @param totalCycles cycles recorded
 * @param successCount cycles answered with a 2xx status
 * @param nonSuccessCount every other cycle, exceptions included
 * @param httpNonSuccessCount cycles answered with a non-2xx status
 * @param exceptionCount cycles that got no response
 * @param throughputPerSec cycles per second over {@code elapsed}
 * @param topStatusCodes most frequent status codes
 * @param topExceptionKinds most frequent exception kinds
 * @param endpointCounts cycles per endpoint key
 * @param injectedCounts malformed cycles per endpoint key
 */
public record TrafficSummary(
    Duration elapsed,
    boolean windowed,
    long totalCycles,
    long successCount,
    long nonSuccessCount,
    long httpNonSuccessCount,
    long exceptionCount,
    double throughputPerSec,
    Map<String, Long> topStatusCodes,
    Map<String, Long> topExceptionKinds,
    Map<String, Long> endpointCounts,
    Map<String, Long> injectedCounts) {}
