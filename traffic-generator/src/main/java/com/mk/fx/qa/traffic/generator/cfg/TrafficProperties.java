package com.mk.fx.qa.traffic.generator.cfg;

import com.mk.fx.qa.traffic.generator.model.SummaryMode;
import com.mk.fx.qa.traffic.generator.model.TrafficConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * {@code traffic.*} properties. Endpoint keys in {@code weights} and {@code error-rates} match
 * regardless of case, underscores and dashes, so {@code post_order} and {@code post-order} both
 * work.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "traffic")
public class TrafficProperties {

  /** Starts the generator when the application starts. */
  private boolean enabled = true;

  /** {@code host:port} or full base URL of the API under test. */
  @NotBlank private String target;

  @Positive private double rps = 1.0;

  @NotBlank private String trafficType = "mixed";

  @NotEmpty private Map<String, Double> weights = new LinkedHashMap<>();

  private Map<String, Double> errorRates = new LinkedHashMap<>();

  @NotNull private Duration timeout = Duration.ofSeconds(5);

  @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

  /** Zero disables periodic summaries. */
  @NotNull private Duration summaryInterval = Duration.ofSeconds(30);

  @NotNull private SummaryMode summaryMode = SummaryMode.CUMULATIVE;

  @Min(1)
  @Max(256)
  private int maxInFlight = 1;

  @Min(1)
  private int topStatusCodes = 5;

  @Min(1)
  private int topExceptionKinds = 3;

  private Long seed;

  private Map<String, String> headers = new LinkedHashMap<>();

  /** Absent or zero runs until the process is stopped. */
  private Duration duration;

  @Valid private Reload reload = new Reload();

  @Data
  public static class Reload {

    /** JSON override file; absent disables reloading. */
    private Path file;

    @NotNull private Duration pollInterval = Duration.ofSeconds(5);
  }

  @AssertTrue(message = "traffic.duration must not be negative")
  public boolean isDurationValid() {
    return duration == null || !duration.isNegative();
  }

  /**
   * @throws IllegalArgumentException if the values do not form a valid configuration
   */
  public TrafficConfig toConfig() {
    return TrafficConfig.builder()
        .target(target)
        .rps(rps)
        .trafficType(trafficType)
        .namedWeights(weights)
        .namedErrorRates(errorRates)
        .requestTimeout(timeout)
        .connectTimeout(connectTimeout)
        .summaryInterval(summaryInterval)
        .summaryMode(summaryMode)
        .maxInFlight(maxInFlight)
        .topStatusCodes(topStatusCodes)
        .topExceptionKinds(topExceptionKinds)
        .seed(seed)
        .headers(headers)
        .build();
  }
}
