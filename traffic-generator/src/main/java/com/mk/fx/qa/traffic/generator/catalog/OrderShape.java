package com.mk.fx.qa.traffic.generator.catalog;

import java.util.List;
import java.util.Map;

/** The fixed set of malformed order payloads sent when an order is corrupted. */
public enum OrderShape {
  /** Structurally valid JSON with no items; fails validation. */
  EMPTY_ITEMS(Map.of("items", List.of())),
  /** Delivery target present but empty, everything else missing. */
  MISSING_DELIVERY(Map.of("deliverTo", Map.of())),
  /** Text that no JSON parser accepts; sent verbatim. */
  INVALID_JSON("{ this is not valid json }"),
  /** Item quantity with the wrong type. */
  WRONG_TYPE(Map.of("items", List.of(Map.of("qty", "not-an-int")))),
  /** No request body at all. */
  NO_BODY(null);

  private final Object payload;

  OrderShape(Object payload) {
    this.payload = payload;
  }

  public Object payload() {
    return payload;
  }

  /** Body text for this shape, or null for {@link #NO_BODY}. Never throws. */
  public String bodyText() {
    return OrderPayloads.toBodyText(payload);
  }
}
