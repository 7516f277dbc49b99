package com.mk.fx.qa.traffic.generator.selection;

import com.mk.fx.qa.traffic.generator.catalog.RequestContext;
import com.mk.fx.qa.traffic.generator.model.TrafficConfig;
import java.util.Objects;
import java.util.Random;

/**
 * Everything a cycle reads from configuration, built once per configuration so that a cycle
 * never sees selector and injector from different versions.
 */
public record TrafficPlan(
    TrafficConfig config,
    WeightedSelector selector,
    ErrorInjector injector,
    RequestContext requestContext) {

  public static TrafficPlan of(TrafficConfig config, Random random) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(random, "random");
    return new TrafficPlan(
        config,
        new WeightedSelector(config.weights(), random),
        new ErrorInjector(config.errorRates(), random),
        new RequestContext(config.baseUrl(), config.headers(), random));
  }
}
