package com.mk.fx.qa.traffic.generator.metrics;

import com.mk.fx.qa.traffic.generator.catalog.Endpoint;
import com.mk.fx.qa.traffic.generator.model.CycleOutcome;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Thread-safe outcome counters. */
final class Tally {

  private final AtomicLong total = new AtomicLong();
  private final Map<String, AtomicLong> statusCounts = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> exceptionCounts = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> endpointCounts = new ConcurrentHashMap<>();
  private final Map<String, AtomicLong> injectedCounts = new ConcurrentHashMap<>();

  void record(CycleOutcome outcome, Endpoint endpoint, boolean injected) {
    if (outcome.hasStatus()) {
      increment(statusCounts, String.valueOf(outcome.statusCode()));
    } else {
      increment(exceptionCounts, outcome.exceptionKind().label());
    }
    if (endpoint != null) {
      increment(endpointCounts, endpoint.key());
      if (injected) {
        increment(injectedCounts, endpoint.key());
      }
    }
    total.incrementAndGet();
  }

  long total() {
    return total.get();
  }

  Map<String, Long> statusCounts() {
    return snapshot(statusCounts);
  }

  Map<String, Long> exceptionCounts() {
    return snapshot(exceptionCounts);
  }

  Map<String, Long> endpointCounts() {
    return snapshot(endpointCounts);
  }

  Map<String, Long> injectedCounts() {
    return snapshot(injectedCounts);
  }

  private static void increment(Map<String, AtomicLong> counters, String key) {
    counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
  }

  private static Map<String, Long> snapshot(Map<String, AtomicLong> counters) {
    Map<String, Long> map = new HashMap<>();
    for (var e : counters.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }
}
