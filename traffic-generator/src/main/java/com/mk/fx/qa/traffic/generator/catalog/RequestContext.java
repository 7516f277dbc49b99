package com.mk.fx.qa.traffic.generator.catalog;

import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Inputs an endpoint needs to materialise a request.
 *
 * @param baseUrl normalised base URL without trailing slash
 * @param headers merged default and extra headers
 * @param random random source for payload and identifier choices
 */
public record RequestContext(String baseUrl, Map<String, String> headers, Random random) {

  public RequestContext {
    Objects.requireNonNull(baseUrl, "baseUrl");
    Objects.requireNonNull(random, "random");
    headers = headers != null ? Map.copyOf(headers) : Map.of();
  }
}
