package com.mk.fx.qa.traffic.generator.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class OrderPayloadsTest {

  @Test
  @SuppressWarnings("unchecked")
  void validOrder_hasPizzaQtyOneToThree_andSingleSalad() {
    var random = new Random(5);
    for (int i = 0; i < 100; i++) {
      var order = OrderPayloads.validOrder(random);
      var items = (List<Map<String, Object>>) order.get("items");
      assertEquals("Pizza", items.get(0).get("name"));
      int qty = (Integer) items.get(0).get("qty");
      assertTrue(qty >= 1 && qty <= 3);
      assertEquals(1, items.get(1).get("qty"));
      assertEquals(Map.of("name", "Test User"), order.get("deliverTo"));
    }
  }

  @Test
  void malformedShape_coversEveryShape() {
    var random = new Random(2);
    var seen = EnumSet.noneOf(OrderShape.class);
    for (int i = 0; i < 200; i++) {
      seen.add(OrderPayloads.malformedShape(random));
    }
    assertEquals(EnumSet.allOf(OrderShape.class), seen);
  }

  @Test
  void bodyText_ofEveryShapeNeverThrows() {
    for (OrderShape shape : OrderShape.values()) {
      assertDoesNotThrow(shape::bodyText);
    }
    assertNull(OrderShape.NO_BODY.bodyText());
    assertEquals("{ this is not valid json }", OrderShape.INVALID_JSON.bodyText());
    assertEquals("{\"items\":[]}", OrderShape.EMPTY_ITEMS.bodyText());
  }

  @Test
  void toBodyText_fallsBackToToStringWhenNotSerialisable() {
    var unserialisable =
        new Object() {
          @SuppressWarnings("unused")
          public Object getSelf() {
            return this;
          }

          @Override
          public String toString() {
            return "self-referencing";
          }
        };
    assertEquals("self-referencing", OrderPayloads.toBodyText(unserialisable));
    assertNull(OrderPayloads.toBodyText(null));
    assertEquals("raw", OrderPayloads.toBodyText("raw"));
  }
}
