package com.mk.fx.qa.traffic.generator.metrics;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each summary as one log line, e.g.
 *
 * <pre>
 * SUMMARY 30.0s total=90 | 2xx=81 | non2xx=9 | errors=0 | rps=3.00 | status_breakdown=[200:81, 404:9] | endpoints=[get_root:9, get_list:36]
 * </pre>
 */
@Slf4j
public class LoggingSummaryReporter implements SummaryReporter {

  @Override
  public void report(TrafficSummary summary, boolean finalReport) {
    log.info("{}", format(summary, finalReport));
  }

  static String format(TrafficSummary summary, boolean finalReport) {
    var parts = new ArrayList<String>();
    parts.add("total=" + summary.totalCycles());
    parts.add("2xx=" + summary.successCount());
    parts.add("non2xx=" + summary.httpNonSuccessCount());
    parts.add("errors=" + summary.exceptionCount());
    parts.add(String.format(Locale.ROOT, "rps=%.2f", summary.throughputPerSec()));
    if (!summary.topStatusCodes().isEmpty()) {
      parts.add("status_breakdown=[" + join(summary.topStatusCodes()) + "]");
    }
    if (!summary.topExceptionKinds().isEmpty()) {
      parts.add("errors=[" + join(summary.topExceptionKinds()) + "]");
    }
    if (!summary.endpointCounts().isEmpty()) {
      parts.add("endpoints=[" + join(summary.endpointCounts()) + "]");
    }
    if (!summary.injectedCounts().isEmpty()) {
      parts.add("injected=[" + join(summary.injectedCounts()) + "]");
    }

    var label = finalReport ? "FINAL" : summary.windowed() ? "WINDOW" : "SUMMARY";
    var elapsedSeconds = summary.elapsed().toMillis() / 1000.0;
    return String.format(Locale.ROOT, "%s %.1fs %s", label, elapsedSeconds, String.join(" | ", parts));
  }

  private static String join(Map<String, Long> counts) {
    return counts.entrySet().stream()
        .map(e -> e.getKey() + ":" + e.getValue())
        .collect(Collectors.joining(", "));
  }
}
