package com.mk.fx.qa.traffic.generator.catalog;

import com.mk.fx.qa.traffic.generator.rest.HttpMethod;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Logical operations against the FoodMe API. Each constant knows how to build its well-formed
 * request and, where one exists, its malformed variant.
 */
public enum Endpoint {
  GET_ROOT("get_root", false) {
    @Override
    EndpointRequest good(RequestContext ctx) {
      return get(ctx, "/", false, "good");
    }
  },

  GET_LIST("get_list", false) {
    @Override
    EndpointRequest good(RequestContext ctx) {
      return get(ctx, "/api/restaurant", false, "good");
    }
  },

  GET_ONE("get_one", true) {
    @Override
    EndpointRequest good(RequestContext ctx) {
      return get(
          ctx, "/api/restaurant/" + RestaurantCatalog.randomId(ctx.random()), false, "good");
    }

    @Override
    EndpointRequest bad(RequestContext ctx) {
      return get(ctx, "/api/restaurant/" + RestaurantCatalog.INVALID_ID, true, "invalid_id");
    }
  },

  POST_ORDER("post_order", true) {
    @Override
    EndpointRequest good(RequestContext ctx) {
      var body = OrderPayloads.toBodyText(OrderPayloads.validOrder(ctx.random()));
      return post(ctx, body, false, "good");
    }

    @Override
    EndpointRequest bad(RequestContext ctx) {
      var shape = OrderPayloads.malformedShape(ctx.random());
      return post(ctx, shape.bodyText(), true, shape.name().toLowerCase(Locale.ROOT));
    }
  },

  BOGUS("bogus", true) {
    @Override
    EndpointRequest good(RequestContext ctx) {
      return get(ctx, "/api/nope", false, "mild");
    }

    @Override
    EndpointRequest bad(RequestContext ctx) {
      return get(ctx, "/totally-invalid", true, "severe");
    }
  };

  private static final String ORDER_PATH = "/api/order";
  private static final String CONTENT_TYPE = "Content-Type";
  private static final String APPLICATION_JSON = "application/json";

  private static final Map<String, Endpoint> BY_NORMALISED_KEY =
      Arrays.stream(values())
          .collect(
              Collectors.toMap(
                  e -> normalise(e.key), e -> e, (a, b) -> a, LinkedHashMap::new));

  private final String key;
  private final boolean injectable;

  Endpoint(String key, boolean injectable) {
    this.key = key;
    this.injectable = injectable;
  }

  /** Configuration key, e.g. {@code post_order}. */
  public String key() {
    return key;
  }

  /** Whether this endpoint has a malformed variant. */
  public boolean isInjectable() {
    return injectable;
  }

  /**
   * Builds the request for this cycle. Endpoints without a malformed variant ignore {@code
   * inject} and always build the good request.
   */
  public EndpointRequest build(RequestContext ctx, boolean inject) {
    return inject && injectable ? bad(ctx) : good(ctx);
  }

  abstract EndpointRequest good(RequestContext ctx);

  EndpointRequest bad(RequestContext ctx) {
    return good(ctx);
  }

  /**
   * Resolves a configuration key. Matching ignores case, underscores and dashes, so {@code
   * post_order}, {@code post-order} and {@code postorder} are the same endpoint.
   *
   * @throws IllegalArgumentException if no endpoint matches
   */
  public static Endpoint fromKey(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Endpoint name must not be blank");
    }
    var endpoint = BY_NORMALISED_KEY.get(normalise(value));
    if (endpoint == null) {
      throw new IllegalArgumentException(
          "Unknown endpoint '" + value + "', expected one of " + keys());
    }
    return endpoint;
  }

  public static Set<String> keys() {
    return Arrays.stream(values())
        .map(Endpoint::key)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  private static String normalise(String value) {
    return value.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
  }

  EndpointRequest get(RequestContext ctx, String path, boolean injected, String variant) {
    return new EndpointRequest(
        this, HttpMethod.GET, ctx.baseUrl() + path, ctx.headers(), null, injected, variant);
  }

  EndpointRequest post(RequestContext ctx, String body, boolean injected, String variant) {
    var headers = new LinkedHashMap<>(ctx.headers());
    if (headers.keySet().stream().noneMatch(CONTENT_TYPE::equalsIgnoreCase)) {
      headers.put(CONTENT_TYPE, APPLICATION_JSON);
    }
    return new EndpointRequest(
        this, HttpMethod.POST, ctx.baseUrl() + ORDER_PATH, headers, body, injected, variant);
  }
}
