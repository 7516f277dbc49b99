package com.mk.fx.qa.traffic.generator.metrics;

/** Destination for periodic and final summaries. */
@FunctionalInterface
public interface SummaryReporter {

  void report(TrafficSummary summary, boolean finalReport);
}
