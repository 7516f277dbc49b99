package com.mk.fx.qa.traffic.generator.catalog;

import java.util.List;
import java.util.Random;

/** Restaurant identifiers known to the FoodMe demo API. */
public final class RestaurantCatalog {

  /** Plausible-looking identifier that no restaurant uses. */
  public static final String INVALID_ID = "invalid_restaurant";

  public static final List<String> KNOWN_IDS =
      List.of(
          "esthers", "robatayaki", "tofuparadise", "bateaurouge", "khartoum", "sallys", "saucy",
          "czechpoint", "speisewagen", "beijing", "satay", "cancun", "curryup", "carthage",
          "burgerama", "littlepigs", "littleprague", "kohlhaus", "dragon", "babythai",
          "wholetamale", "bhangra", "taqueria", "pedros", "superwonton", "naansequitur", "sakura",
          "shandong", "currygalore", "north", "beans", "jeeves", "zardoz", "angular", "flavia",
          "luigis", "thick", "wheninrome", "pizza76");

  private RestaurantCatalog() {
    throw new UnsupportedOperationException("RestaurantCatalog cannot be instantiated");
  }

  public static String randomId(Random random) {
    return KNOWN_IDS.get(random.nextInt(KNOWN_IDS.size()));
  }
}
