package com.mk.fx.qa.traffic.generator.reload;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.mk.fx.qa.traffic.generator.model.TrafficConfig;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Contents of the reload file. Every field is optional; a present field replaces the matching
 * part of the running configuration as a whole.
 *
 * <pre>{@code
 * {
 *   "rps": 5,
 *   "weights": {"get_list": 40, "post_order": 60},
 *   "error_rates": {"post_order": 0.25},
 *   "headers": {"X-Run": "night"}
 * }
 * }</pre>
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfigOverrides {

  private Double rps;

  @JsonAlias({"traffic_type", "traffic-type"})
  private String trafficType;

  private Map<String, Double> weights;

  @JsonAlias({"error_rates", "error-rates"})
  private Map<String, Double> errorRates;

  private Map<String, String> headers;

  /**
   * Applies these overrides to {@code base}.
   *
   * @throws IllegalArgumentException if the merged configuration is invalid or names an unknown
   *     endpoint
   */
  public TrafficConfig applyTo(TrafficConfig base) {
    var builder = base.toBuilder();
    if (rps != null) {
      builder.rps(rps);
    }
    if (trafficType != null) {
      builder.trafficType(trafficType);
    }
    if (weights != null) {
      builder.namedWeights(weights);
    }
    if (errorRates != null) {
      builder.namedErrorRates(errorRates);
    }
    if (headers != null) {
      builder.headers(headers);
    }
    return builder.build();
  }

  public boolean isEmpty() {
    return rps == null
        && trafficType == null
        && weights == null
        && errorRates == null
        && headers == null;
  }
}
