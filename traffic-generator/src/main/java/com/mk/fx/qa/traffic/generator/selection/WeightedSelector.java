package com.mk.fx.qa.traffic.generator.selection;

import com.mk.fx.qa.traffic.generator.catalog.Endpoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Draws one endpoint per call with probability {@code weight / sum(weights)}. Draws are
 * independent and with replacement; zero-weight endpoints are never returned. The weights are
 * validated by {@link com.mk.fx.qa.traffic.generator.model.TrafficConfig} and fixed at
 * construction.
 */
public final class WeightedSelector {

  private final Random random;
  private final Endpoint[] endpoints;
  private final double[] cumulative;
  private final double total;

  public WeightedSelector(Map<Endpoint, Double> weights, Random random) {
    Objects.requireNonNull(weights, "weights");
    this.random = Objects.requireNonNull(random, "random");

    List<Endpoint> names = new ArrayList<>();
    List<Double> bounds = new ArrayList<>();
    double running = 0;
    for (var entry : weights.entrySet()) {
      double weight = entry.getValue() != null ? entry.getValue() : 0.0;
      if (weight <= 0) {
        continue;
      }
      running += weight;
      names.add(entry.getKey());
      bounds.add(running);
    }
    if (names.isEmpty()) {
      throw new IllegalArgumentException("weights must contain a positive entry");
    }

    this.endpoints = names.toArray(new Endpoint[0]);
    this.cumulative = bounds.stream().mapToDouble(Double::doubleValue).toArray();
    this.total = running;
  }

  public Endpoint choose() {
    double point = random.nextDouble() * total;
    for (int i = 0; i < cumulative.length; i++) {
      if (point < cumulative[i]) {
        return endpoints[i];
      }
    }
    // rounding can leave point == total
    return endpoints[endpoints.length - 1];
  }

  /** Probability of drawing {@code endpoint}. */
  public double probability(Endpoint endpoint) {
    double previous = 0;
    for (int i = 0; i < endpoints.length; i++) {
      if (endpoints[i] == endpoint) {
        return (cumulative[i] - previous) / total;
      }
      previous = cumulative[i];
    }
    return 0.0;
  }
}
