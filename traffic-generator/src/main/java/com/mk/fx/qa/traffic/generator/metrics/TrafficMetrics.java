package com.mk.fx.qa.traffic.generator.metrics;

import com.mk.fx.qa.traffic.generator.catalog.Endpoint;
import com.mk.fx.qa.traffic.generator.model.CycleOutcome;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Aggregates cycle outcomes for one generator run. Counts are cumulative for the whole run; a
 * separate window tally backs {@link #drainWindow(Duration)} for windowed periodic summaries.
 * Safe for concurrent {@link #record} calls.
 */
public class TrafficMetrics {

  private static final Comparator<Map.Entry<String, Long>> BY_COUNT_DESC =
      Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey());

  private final int topStatusCodes;
  private final int topExceptionKinds;
  private final Tally cumulative = new Tally();
  private final AtomicReference<Tally> window = new AtomicReference<>(new Tally());

  public TrafficMetrics(int topStatusCodes, int topExceptionKinds) {
    if (topStatusCodes < 1 || topExceptionKinds < 1) {
      throw new IllegalArgumentException("top-N limits must be at least 1");
    }
    this.topStatusCodes = topStatusCodes;
    this.topExceptionKinds = topExceptionKinds;
  }

  /**
   * Records one cycle: exactly one status or exception counter, the endpoint counter and the
   * total.
   *
   * @param endpoint the endpoint hit, or null if the cycle failed before one was chosen
   */
  public void record(CycleOutcome outcome, Endpoint endpoint, boolean injected) {
    Objects.requireNonNull(outcome, "outcome");
    cumulative.record(outcome, endpoint, injected);
    window.get().record(outcome, endpoint, injected);
  }

  /** Cumulative snapshot; does not change any state. */
  public TrafficSummary summarize(Duration elapsed) {
    return summaryOf(cumulative, elapsed, false);
  }

  /**
   * Snapshot of the outcomes recorded since the previous call, then starts a new window. A
   * record racing with the swap may land in the window being closed after it was read; the
   * cumulative counts are unaffected.
   */
  public TrafficSummary drainWindow(Duration elapsed) {
    var closed = window.getAndSet(new Tally());
    return summaryOf(closed, elapsed, true);
  }

  public long totalCycles() {
    return cumulative.total();
  }

  public Map<String, Long> statusCounts() {
    return cumulative.statusCounts();
  }

  public Map<String, Long> exceptionCounts() {
    return cumulative.exceptionCounts();
  }

  public Map<String, Long> endpointCounts() {
    return cumulative.endpointCounts();
  }

  public Map<String, Long> injectedCounts() {
    return cumulative.injectedCounts();
  }

  private TrafficSummary summaryOf(Tally tally, Duration elapsed, boolean windowed) {
    Objects.requireNonNull(elapsed, "elapsed");
    var statuses = tally.statusCounts();
    var exceptions = tally.exceptionCounts();

    long success = 0;
    long httpTotal = 0;
    for (var e : statuses.entrySet()) {
      httpTotal += e.getValue();
      if (isSuccess(e.getKey())) {
        success += e.getValue();
      }
    }
    long exceptionTotal = exceptions.values().stream().mapToLong(Long::longValue).sum();
    long total = httpTotal + exceptionTotal;

    double seconds = elapsed.toNanos() / 1_000_000_000.0;
    double throughput = seconds > 0 ? total / seconds : 0.0;

    return new TrafficSummary(
        elapsed,
        windowed,
        total,
        success,
        total - success,
        httpTotal - success,
        exceptionTotal,
        throughput,
        top(statuses, topStatusCodes),
        top(exceptions, topExceptionKinds),
        inCatalogOrder(tally.endpointCounts()),
        inCatalogOrder(tally.injectedCounts()));
  }

  private static boolean isSuccess(String statusCode) {
    return statusCode.length() == 3 && statusCode.charAt(0) == '2';
  }

  private static Map<String, Long> top(Map<String, Long> counts, int limit) {
    var ordered = new LinkedHashMap<String, Long>();
    counts.entrySet().stream()
        .sorted(BY_COUNT_DESC)
        .limit(limit)
        .forEach(e -> ordered.put(e.getKey(), e.getValue()));
    return Collections.unmodifiableMap(ordered);
  }

  private static Map<String, Long> inCatalogOrder(Map<String, Long> counts) {
    var ordered = new LinkedHashMap<String, Long>();
    for (Endpoint endpoint : Endpoint.values()) {
      var count = counts.get(endpoint.key());
      if (count != null) {
        ordered.put(endpoint.key(), count);
      }
    }
    return Collections.unmodifiableMap(ordered);
  }
}
