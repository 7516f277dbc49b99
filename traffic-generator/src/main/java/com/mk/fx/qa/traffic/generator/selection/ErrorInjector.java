package com.mk.fx.qa.traffic.generator.selection;

import com.mk.fx.qa.traffic.generator.catalog.Endpoint;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Per-cycle Bernoulli decision whether to send an endpoint's malformed variant. One random draw
 * is consumed per call whatever the configured rate.
 */
public final class ErrorInjector {

  private final Map<Endpoint, Double> errorRates;
  private final Random random;

  public ErrorInjector(Map<Endpoint, Double> errorRates, Random random) {
    this.errorRates = errorRates != null ? Map.copyOf(errorRates) : Map.of();
    this.random = Objects.requireNonNull(random, "random");
  }

  public boolean shouldInject(Endpoint endpoint) {
    double draw = random.nextDouble();
    return draw < errorRates.getOrDefault(endpoint, 0.0);
  }
}
