package com.mk.fx.qa.traffic.generator.metrics;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.traffic.generator.catalog.Endpoint;
import com.mk.fx.qa.traffic.generator.model.CycleOutcome;
import com.mk.fx.qa.traffic.generator.model.ExceptionKind;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LoggingSummaryReporterTest {

  @Test
  void format_periodicLine() {
    var metrics = new TrafficMetrics(5, 3);
    for (int i = 0; i < 30; i++) {
      metrics.record(CycleOutcome.status(200), Endpoint.GET_LIST, false);
    }
    for (int i = 0; i < 6; i++) {
      metrics.record(CycleOutcome.status(404), Endpoint.BOGUS, false);
    }
    var line = LoggingSummaryReporter.format(metrics.summarize(Duration.ofSeconds(12)), false);
    assertEquals(
        "SUMMARY 12.0s total=36 | 2xx=30 | non2xx=6 | errors=0 | rps=3.00"
            + " | status_breakdown=[200:30, 404:6] | endpoints=[get_list:30, bogus:6]",
        line);
  }

  @Test
  void format_finalLineListsExceptionsAndInjected() {
    var metrics = new TrafficMetrics(5, 3);
    metrics.record(CycleOutcome.exception(ExceptionKind.TIMEOUT), Endpoint.POST_ORDER, true);
    var line = LoggingSummaryReporter.format(metrics.summarize(Duration.ofMillis(500)), true);
    assertTrue(line.startsWith("FINAL 0.5s total=1 | 2xx=0 | non2xx=0 | errors=1 | rps=2.00"), line);
    assertTrue(line.contains("errors=[timeout:1]"), line);
    assertTrue(line.contains("injected=[post_order:1]"), line);
  }

  @Test
  void format_windowedLineIsLabelled() {
    var metrics = new TrafficMetrics(5, 3);
    var line = LoggingSummaryReporter.format(metrics.drainWindow(Duration.ofSeconds(30)), false);
    assertEquals(
        "WINDOW 30.0s total=0 | 2xx=0 | non2xx=0 | errors=0 | rps=0.00", line);
  }
}
