package com.mk.fx.qa.traffic.generator.model;

import com.mk.fx.qa.traffic.generator.catalog.Endpoint;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable traffic configuration. Every invariant is checked in the constructor, so an instance
 * that exists is runnable.
 *
 * @param baseUrl normalised target base URL ({@code http://} prepended when no scheme was given)
 * @param rps target cycles per second, strictly positive
 * @param trafficType free-form label used in the default tracing headers
 * @param weights endpoint weights, non-negative with a positive sum
 * @param errorRates per-endpoint error injection probability in [0, 1]; absent means 0
 * @param requestTimeout per-request timeout
 * @param connectTimeout connection establishment timeout
 * @param summaryInterval period between summaries; zero disables periodic summaries
 * @param summaryMode cumulative or windowed periodic summaries
 * @param maxInFlight maximum concurrently running cycles; 1 runs cycles sequentially
 * @param topStatusCodes how many status codes a summary lists
 * @param topExceptionKinds how many exception kinds a summary lists
 * @param seed random seed, or null for a non-reproducible run
 * @param extraHeaders headers merged over the defaults
 */
public record TrafficConfig(
    String baseUrl,
    double rps,
    String trafficType,
    Map<Endpoint, Double> weights,
    Map<Endpoint, Double> errorRates,
    Duration requestTimeout,
    Duration connectTimeout,
    Duration summaryInterval,
    SummaryMode summaryMode,
    int maxInFlight,
    int topStatusCodes,
    int topExceptionKinds,
    Long seed,
    Map<String, String> extraHeaders) {

  public static final String USER_AGENT = "User-Agent";
  public static final String TRAFFIC_TYPE_HEADER = "X-Traffic-Type";

  /** Headers the JDK HTTP client refuses to set; lower case. */
  private static final Set<String> RESTRICTED_HEADERS =
      Set.of("connection", "content-length", "expect", "host", "upgrade");

  public TrafficConfig {
    baseUrl = normaliseTarget(baseUrl);
    if (!(rps > 0) || Double.isInfinite(rps)) {
      throw new IllegalArgumentException("rps must be a positive number, got " + rps);
    }
    if (trafficType == null || trafficType.isBlank()) {
      throw new IllegalArgumentException("trafficType must not be blank");
    }
    weights = validateWeights(weights);
    errorRates = validateErrorRates(errorRates);
    requirePositive(requestTimeout, "requestTimeout");
    requirePositive(connectTimeout, "connectTimeout");
    Objects.requireNonNull(summaryInterval, "summaryInterval");
    if (summaryInterval.isNegative()) {
      throw new IllegalArgumentException("summaryInterval cannot be negative");
    }
    Objects.requireNonNull(summaryMode, "summaryMode");
    if (maxInFlight < 1) {
      throw new IllegalArgumentException("maxInFlight must be at least 1, got " + maxInFlight);
    }
    if (topStatusCodes < 1 || topExceptionKinds < 1) {
      throw new IllegalArgumentException("summary top-N limits must be at least 1");
    }
    extraHeaders = validateHeaders(extraHeaders);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .target(baseUrl)
        .rps(rps)
        .trafficType(trafficType)
        .weights(weights)
        .errorRates(errorRates)
        .requestTimeout(requestTimeout)
        .connectTimeout(connectTimeout)
        .summaryInterval(summaryInterval)
        .summaryMode(summaryMode)
        .maxInFlight(maxInFlight)
        .topStatusCodes(topStatusCodes)
        .topExceptionKinds(topExceptionKinds)
        .seed(seed)
        .headers(extraHeaders);
  }

  /** Default tracing headers with the extra headers applied on top. */
  public Map<String, String> headers() {
    var merged = new LinkedHashMap<String, String>();
    merged.put(USER_AGENT, "foodme-" + trafficType + "-load");
    merged.put(TRAFFIC_TYPE_HEADER, trafficType);
    merged.putAll(extraHeaders);
    return Collections.unmodifiableMap(merged);
  }

  public double errorRate(Endpoint endpoint) {
    return errorRates.getOrDefault(endpoint, 0.0);
  }

  /** Target spacing between cycle starts. */
  public Duration interval() {
    return Duration.ofNanos(Math.max(1L, (long) (1_000_000_000L / rps)));
  }

  private static String normaliseTarget(String target) {
    Objects.requireNonNull(target, "target cannot be null");
    var trimmed = target.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("target cannot be empty");
    }
    var base =
        trimmed.startsWith("http://") || trimmed.startsWith("https://")
            ? trimmed
            : "http://" + trimmed;
    while (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return base;
  }

  private static Map<Endpoint, Double> validateWeights(Map<Endpoint, Double> weights) {
    if (weights == null || weights.isEmpty()) {
      throw new IllegalArgumentException("weights must contain at least one endpoint");
    }
    var copy = new EnumMap<Endpoint, Double>(Endpoint.class);
    double total = 0;
    for (var entry : weights.entrySet()) {
      var endpoint = Objects.requireNonNull(entry.getKey(), "weights key");
      var weight = entry.getValue();
      if (weight == null || weight < 0 || weight.isNaN() || weight.isInfinite()) {
        throw new IllegalArgumentException(
            "weight for " + endpoint.key() + " must be a non-negative number, got " + weight);
      }
      copy.put(endpoint, weight);
      total += weight;
    }
    if (total <= 0) {
      throw new IllegalArgumentException("weights must sum to a positive number");
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Map<Endpoint, Double> validateErrorRates(Map<Endpoint, Double> errorRates) {
    var copy = new EnumMap<Endpoint, Double>(Endpoint.class);
    if (errorRates != null) {
      for (var entry : errorRates.entrySet()) {
        var endpoint = Objects.requireNonNull(entry.getKey(), "errorRates key");
        var rate = entry.getValue();
        if (rate == null || rate.isNaN() || rate < 0.0 || rate > 1.0) {
          throw new IllegalArgumentException(
              "error rate for " + endpoint.key() + " must be within [0, 1], got " + rate);
        }
        copy.put(endpoint, rate);
      }
    }
    return Collections.unmodifiableMap(copy);
  }

  private static Map<String, String> validateHeaders(Map<String, String> headers) {
    if (headers == null) {
      return Map.of();
    }
    var copy = new LinkedHashMap<String, String>();
    for (var entry : headers.entrySet()) {
      var name = entry.getKey();
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("header names must not be blank");
      }
      if (entry.getValue() == null) {
        throw new IllegalArgumentException("header " + name + " has no value");
      }
      if (RESTRICTED_HEADERS.contains(name.trim().toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException(
            "header " + name + " is managed by the HTTP client and cannot be overridden");
      }
      copy.put(name, entry.getValue());
    }
    return Collections.unmodifiableMap(copy);
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  /** Builder; unset fields keep the generator defaults (1 rps, 5s timeouts, 30s summaries). */
  public static final class Builder {
    private String target;
    private double rps = 1.0;
    private String trafficType = "mixed";
    private final Map<Endpoint, Double> weights = new EnumMap<>(Endpoint.class);
    private final Map<Endpoint, Double> errorRates = new EnumMap<>(Endpoint.class);
    private Duration requestTimeout = Duration.ofSeconds(5);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration summaryInterval = Duration.ofSeconds(30);
    private SummaryMode summaryMode = SummaryMode.CUMULATIVE;
    private int maxInFlight = 1;
    private int topStatusCodes = 5;
    private int topExceptionKinds = 3;
    private Long seed;
    private final Map<String, String> headers = new LinkedHashMap<>();

    private Builder() {}

    public Builder target(String target) {
      this.target = target;
      return this;
    }

    public Builder rps(double rps) {
      this.rps = rps;
      return this;
    }

    public Builder trafficType(String trafficType) {
      this.trafficType = trafficType;
      return this;
    }

    public Builder weight(Endpoint endpoint, double weight) {
      weights.put(Objects.requireNonNull(endpoint, "endpoint"), weight);
      return this;
    }

    /** Replaces all weights. */
    public Builder weights(Map<Endpoint, Double> weights) {
      this.weights.clear();
      if (weights != null) {
        this.weights.putAll(weights);
      }
      return this;
    }

    /**
     * Replaces all weights from configuration keys.
     *
     * @throws IllegalArgumentException if a key names no known endpoint
     */
    public Builder namedWeights(Map<String, ? extends Number> weights) {
      this.weights.clear();
      if (weights != null) {
        weights.forEach((name, weight) -> this.weights.put(Endpoint.fromKey(name), toDouble(weight)));
      }
      return this;
    }

    public Builder errorRate(Endpoint endpoint, double rate) {
      errorRates.put(Objects.requireNonNull(endpoint, "endpoint"), rate);
      return this;
    }

    /** Replaces all error rates. */
    public Builder errorRates(Map<Endpoint, Double> errorRates) {
      this.errorRates.clear();
      if (errorRates != null) {
        this.errorRates.putAll(errorRates);
      }
      return this;
    }

    /**
     * Replaces all error rates from configuration keys.
     *
     * @throws IllegalArgumentException if a key names no known endpoint
     */
    public Builder namedErrorRates(Map<String, ? extends Number> errorRates) {
      this.errorRates.clear();
      if (errorRates != null) {
        errorRates.forEach(
            (name, rate) -> this.errorRates.put(Endpoint.fromKey(name), toDouble(rate)));
      }
      return this;
    }

    public Builder requestTimeout(Duration requestTimeout) {
      this.requestTimeout = requestTimeout;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder summaryInterval(Duration summaryInterval) {
      this.summaryInterval = summaryInterval;
      return this;
    }

    public Builder summaryMode(SummaryMode summaryMode) {
      this.summaryMode = summaryMode;
      return this;
    }

    public Builder maxInFlight(int maxInFlight) {
      this.maxInFlight = maxInFlight;
      return this;
    }

    public Builder topStatusCodes(int topStatusCodes) {
      this.topStatusCodes = topStatusCodes;
      return this;
    }

    public Builder topExceptionKinds(int topExceptionKinds) {
      this.topExceptionKinds = topExceptionKinds;
      return this;
    }

    public Builder seed(Long seed) {
      this.seed = seed;
      return this;
    }

    /** Replaces all extra headers. */
    public Builder headers(Map<String, String> headers) {
      this.headers.clear();
      if (headers != null) {
        this.headers.putAll(headers);
      }
      return this;
    }

    public Builder header(String name, String value) {
      headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    /**
     * @throws IllegalArgumentException if any value violates the configuration invariants
     */
    public TrafficConfig build() {
      return new TrafficConfig(
          target,
          rps,
          trafficType,
          weights,
          errorRates,
          requestTimeout,
          connectTimeout,
          summaryInterval,
          summaryMode,
          maxInFlight,
          topStatusCodes,
          topExceptionKinds,
          seed,
          headers);
    }

    private static Double toDouble(Number value) {
      return value != null ? value.doubleValue() : null;
    }
  }
}
