package com.mk.fx.qa.traffic.generator.model;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.traffic.generator.catalog.Endpoint;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TrafficConfigTest {

  private static TrafficConfig.Builder base() {
    return TrafficConfig.builder().target("localhost:3000").weight(Endpoint.GET_LIST, 1);
  }

  @Test
  void target_withoutScheme_getsHttpPrefix_andTrailingSlashStripped() {
    assertEquals("http://localhost:3000", base().target("localhost:3000/").build().baseUrl());
    assertEquals("https://api.example.com", base().target("https://api.example.com//").build().baseUrl());
  }

  @Test
  void headers_defaultsDerivedFromTrafficType_extrasOverride() {
    var config = base().trafficType("chaos").header("X-Run", "7").build();
    var headers = config.headers();
    assertEquals("foodme-chaos-load", headers.get(TrafficConfig.USER_AGENT));
    assertEquals("chaos", headers.get(TrafficConfig.TRAFFIC_TYPE_HEADER));
    assertEquals("7", headers.get("X-Run"));

    var overridden = base().header(TrafficConfig.USER_AGENT, "probe/1.0").build();
    assertEquals("probe/1.0", overridden.headers().get(TrafficConfig.USER_AGENT));
  }

  @Test
  void invalidValues_failAtBuild() {
    assertThrows(IllegalArgumentException.class, () -> base().rps(0).build());
    assertThrows(IllegalArgumentException.class, () -> base().rps(Double.NaN).build());
    assertThrows(IllegalArgumentException.class, () -> base().target("  ").build());
    assertThrows(NullPointerException.class, () -> base().target(null).build());
    assertThrows(IllegalArgumentException.class, () -> base().weights(Map.of()).build());
    assertThrows(
        IllegalArgumentException.class, () -> base().weights(Map.of(Endpoint.GET_ROOT, 0.0)).build());
    assertThrows(
        IllegalArgumentException.class, () -> base().weight(Endpoint.BOGUS, -1).build());
    assertThrows(
        IllegalArgumentException.class, () -> base().errorRate(Endpoint.BOGUS, 1.5).build());
    assertThrows(
        IllegalArgumentException.class, () -> base().requestTimeout(Duration.ZERO).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> base().summaryInterval(Duration.ofSeconds(-1)).build());
    assertThrows(IllegalArgumentException.class, () -> base().maxInFlight(0).build());
    assertThrows(IllegalArgumentException.class, () -> base().topStatusCodes(0).build());
  }

  @Test
  void headers_nullValuesAndClientManagedNamesRejected() {
    var withNull = new HashMap<String, String>();
    withNull.put("X-Run", null);
    assertThrows(IllegalArgumentException.class, () -> base().headers(withNull).build());

    for (String name : List.of("Host", "connection", "Content-Length", "EXPECT", "Upgrade")) {
      var ex =
          assertThrows(IllegalArgumentException.class, () -> base().header(name, "x").build());
      assertTrue(ex.getMessage().contains(name), ex.getMessage());
    }
    assertEquals("qa", base().header("X-Env", "qa").build().headers().get("X-Env"));
  }

  @Test
  void namedWeights_resolveConfigurationKeys_andRejectUnknownNames() {
    var config =
        base().namedWeights(Map.of("post_order", 2, "getone", 1.5, "GET-LIST", 0)).build();
    assertEquals(2.0, config.weights().get(Endpoint.POST_ORDER));
    assertEquals(1.5, config.weights().get(Endpoint.GET_ONE));
    assertEquals(0.0, config.weights().get(Endpoint.GET_LIST));

    var ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> base().namedErrorRates(Map.of("get_restaurant_id", 0.5)));
    assertTrue(ex.getMessage().contains("get_restaurant_id"));
  }

  @Test
  void errorRate_absentEndpointIsZero() {
    var config = base().errorRate(Endpoint.POST_ORDER, 0.25).build();
    assertEquals(0.25, config.errorRate(Endpoint.POST_ORDER));
    assertEquals(0.0, config.errorRate(Endpoint.GET_ONE));
  }

  @Test
  void toBuilder_roundTripsEveryField() {
    var config =
        base()
            .rps(7.5)
            .trafficType("good")
            .errorRate(Endpoint.GET_ONE, 0.1)
            .summaryMode(SummaryMode.WINDOWED)
            .maxInFlight(4)
            .seed(42L)
            .header("X-A", "b")
            .build();
    assertEquals(config, config.toBuilder().build());
  }

  @Test
  void interval_isInverseOfRate() {
    assertEquals(Duration.ofMillis(250), base().rps(4).build().interval());
  }

  @Test
  void collections_areImmutableCopies() {
    var config = base().build();
    assertThrows(
        UnsupportedOperationException.class, () -> config.weights().put(Endpoint.BOGUS, 1.0));
    assertThrows(UnsupportedOperationException.class, () -> config.headers().put("a", "b"));
  }
}
