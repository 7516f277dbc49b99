package com.mk.fx.qa.traffic.generator.cfg;

import com.mk.fx.qa.traffic.generator.metrics.LoggingSummaryReporter;
import com.mk.fx.qa.traffic.generator.metrics.SummaryReporter;
import com.mk.fx.qa.traffic.generator.model.TrafficConfig;
import com.mk.fx.qa.traffic.generator.rest.TrafficHttpClient;
import com.mk.fx.qa.traffic.generator.service.TrafficGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class TrafficGeneratorCfg {

  @Bean
  public TrafficConfig trafficConfig(TrafficProperties properties) {
    var config = properties.toConfig();
    config.errorRates().keySet().stream()
        .filter(endpoint -> !endpoint.isInjectable())
        .forEach(
            endpoint ->
                log.warn(
                    "Error rate for {} has no effect: it has no malformed variant",
                    endpoint.key()));
    return config;
  }

  @Bean
  public SummaryReporter summaryReporter() {
    return new LoggingSummaryReporter();
  }

  @Bean
  public TrafficGenerator trafficGenerator(TrafficConfig config, SummaryReporter reporter) {
    return new TrafficGenerator(
        config,
        cfg -> new TrafficHttpClient(cfg.connectTimeout(), cfg.requestTimeout()),
        reporter);
  }
}
