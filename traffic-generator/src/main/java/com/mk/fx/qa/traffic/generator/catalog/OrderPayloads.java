package com.mk.fx.qa.traffic.generator.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mk.fx.qa.traffic.generator.rest.JsonUtil;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;

/** Builders for order payloads posted to {@code /api/order}. */
@Slf4j
public final class OrderPayloads {

  private static final List<OrderShape> MALFORMED_SHAPES = List.of(OrderShape.values());

  private OrderPayloads() {
    throw new UnsupportedOperationException("OrderPayloads cannot be instantiated");
  }

  /** A realistic order: two items with quantities, a delivery target and a restaurant. */
  public static Map<String, Object> validOrder(Random random) {
    var pizza = new LinkedHashMap<String, Object>();
    pizza.put("name", "Pizza");
    pizza.put("qty", 1 + random.nextInt(3));
    var salad = new LinkedHashMap<String, Object>();
    salad.put("name", "Salad");
    salad.put("qty", 1);

    var order = new LinkedHashMap<String, Object>();
    order.put("items", List.of(pizza, salad));
    order.put("deliverTo", Map.of("name", "Test User"));
    order.put("restaurant", Map.of("name", "Demo"));
    return order;
  }

  /** Uniform draw from {@link OrderShape}. */
  public static OrderShape malformedShape(Random random) {
    return MALFORMED_SHAPES.get(random.nextInt(MALFORMED_SHAPES.size()));
  }

  /**
   * Serialises a payload for the wire. Strings pass through untouched, null stays null, anything
   * else becomes JSON; if JSON serialisation fails the payload's {@code toString()} is used.
   */
  public static String toBodyText(Object payload) {
    if (payload == null) {
      return null;
    }
    if (payload instanceof CharSequence) {
      return payload.toString();
    }
    try {
      return JsonUtil.toJson(payload);
    } catch (JsonProcessingException | RuntimeException e) {
      log.debug("Falling back to plain text for payload: {}", e.getMessage());
      return String.valueOf(payload);
    }
  }
}
