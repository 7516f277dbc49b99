package com.mk.fx.qa.traffic.generator.catalog;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.traffic.generator.rest.HttpMethod;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class EndpointTest {

  private static final String BASE = "http://localhost:3000";

  private static RequestContext ctx(long seed) {
    return new RequestContext(BASE, Map.of("X-Traffic-Type", "test"), new Random(seed));
  }

  @Test
  void getRootAndList_haveNoBadVariant() {
    for (Endpoint endpoint : EnumSet.of(Endpoint.GET_ROOT, Endpoint.GET_LIST)) {
      assertFalse(endpoint.isInjectable());
      var good = endpoint.build(ctx(1), false);
      var bad = endpoint.build(ctx(1), true);
      assertEquals(good.url(), bad.url());
      assertFalse(bad.injected());
      assertEquals(HttpMethod.GET, bad.method());
    }
    assertEquals(BASE + "/", Endpoint.GET_ROOT.build(ctx(1), false).url());
    assertEquals(BASE + "/api/restaurant", Endpoint.GET_LIST.build(ctx(1), false).url());
  }

  @Test
  void getOne_goodUsesKnownId_badUsesInvalidId() {
    var random = new Random(7);
    var context = new RequestContext(BASE, Map.of(), random);
    for (int i = 0; i < 100; i++) {
      var url = Endpoint.GET_ONE.build(context, false).url();
      var id = url.substring((BASE + "/api/restaurant/").length());
      assertTrue(RestaurantCatalog.KNOWN_IDS.contains(id), id);
    }
    var bad = Endpoint.GET_ONE.build(context, true);
    assertEquals(BASE + "/api/restaurant/invalid_restaurant", bad.url());
    assertTrue(bad.injected());
  }

  @Test
  void postOrder_goodBodyIsValidOrderJson_withJsonContentType() {
    var request = Endpoint.POST_ORDER.build(ctx(3), false);
    assertEquals(HttpMethod.POST, request.method());
    assertEquals(BASE + "/api/order", request.url());
    assertEquals("application/json", request.headers().get("Content-Type"));
    assertEquals("test", request.headers().get("X-Traffic-Type"));
    assertTrue(request.body().startsWith("{\"items\":[{\"name\":\"Pizza\",\"qty\":"));
    assertTrue(request.body().contains("\"deliverTo\":{\"name\":\"Test User\"}"));
    assertFalse(request.injected());
  }

  @Test
  void postOrder_badBodyIsAlwaysOneOfTheMalformedShapes_sameMethodAndHeaders() {
    var context = new RequestContext(BASE, Map.of(), new Random(11));
    Set<String> allowed = Set.of(
        "{\"items\":[]}",
        "{\"deliverTo\":{}}",
        "{ this is not valid json }",
        "{\"items\":[{\"qty\":\"not-an-int\"}]}");
    Set<String> seenVariants = new HashSet<>();
    for (int i = 0; i < 200; i++) {
      var bad = Endpoint.POST_ORDER.build(context, true);
      assertTrue(bad.injected());
      assertEquals(HttpMethod.POST, bad.method());
      assertEquals("application/json", bad.headers().get("Content-Type"));
      assertTrue(bad.body() == null || allowed.contains(bad.body()), bad.body());
      seenVariants.add(bad.variant());
    }
    assertEquals(5, seenVariants.size());
  }

  @Test
  void postOrder_keepsContentTypeFromExtraHeaders() {
    var context = new RequestContext(BASE, Map.of("content-type", "text/plain"), new Random(1));
    var request = Endpoint.POST_ORDER.build(context, false);
    assertEquals("text/plain", request.headers().get("content-type"));
    assertFalse(request.headers().containsKey("Content-Type"));
  }

  @Test
  void bogus_goodIsMild_badIsSevere() {
    assertEquals(BASE + "/api/nope", Endpoint.BOGUS.build(ctx(1), false).url());
    var severe = Endpoint.BOGUS.build(ctx(1), true);
    assertEquals(BASE + "/totally-invalid", severe.url());
    assertEquals("severe", severe.variant());
  }

  @Test
  void fromKey_ignoresCaseUnderscoresAndDashes() {
    assertEquals(Endpoint.POST_ORDER, Endpoint.fromKey("post_order"));
    assertEquals(Endpoint.POST_ORDER, Endpoint.fromKey("POST-ORDER"));
    assertEquals(Endpoint.GET_ROOT, Endpoint.fromKey("getroot"));
    assertThrows(IllegalArgumentException.class, () -> Endpoint.fromKey("get_restaurants"));
    assertThrows(IllegalArgumentException.class, () -> Endpoint.fromKey(" "));
  }

  @Test
  void sameSeed_buildsSameRequests() {
    var a = new RequestContext(BASE, Map.of(), new Random(99));
    var b = new RequestContext(BASE, Map.of(), new Random(99));
    for (int i = 0; i < 20; i++) {
      assertEquals(Endpoint.POST_ORDER.build(a, i % 2 == 0), Endpoint.POST_ORDER.build(b, i % 2 == 0));
    }
  }
}
