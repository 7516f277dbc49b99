package com.mk.fx.qa.traffic.generator.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrafficHttpClientTest {

  private HttpServer server;
  private ExecutorService serverExecutor;
  private String baseUrl;
  private final AtomicReference<String> lastBody = new AtomicReference<>();
  private final AtomicReference<String> lastContentType = new AtomicReference<>();
  private final AtomicReference<String> lastUserAgent = new AtomicReference<>();

  @BeforeEach
  void setUp() throws Exception {
    server = HttpServer.create(new InetSocketAddress(0), 0);
    serverExecutor = Executors.newCachedThreadPool();
    server.setExecutor(serverExecutor);
    server.createContext("/ok", exchange -> respond(exchange, 200, "OK"));
    server.createContext("/missing", exchange -> respond(exchange, 404, "nope"));
    server.createContext("/boom", exchange -> respond(exchange, 500, "ERR"));
    server.createContext(
        "/echo",
        exchange -> {
          lastBody.set(
              new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
          lastContentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
          lastUserAgent.set(exchange.getRequestHeaders().getFirst("User-Agent"));
          respond(exchange, 201, "{}");
        });
    server.createContext(
        "/slow",
        exchange -> {
          try {
            TimeUnit.MILLISECONDS.sleep(1_500);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          respond(exchange, 200, "late");
        });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void tearDown() {
    if (server != null) server.stop(0);
    if (serverExecutor != null) serverExecutor.shutdownNow();
  }

  private static void respond(HttpExchange exchange, int status, String text) throws IOException {
    byte[] body = text.getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }

  private static Request request(HttpMethod method, String url) {
    var request = new Request();
    request.setMethod(method);
    request.setUrl(url);
    return request;
  }

  @Test
  void execute_returnsStatusCodes_includingClientAndServerErrors() {
    try (var client = new TrafficHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(2))) {
      assertEquals(200, client.execute(request(HttpMethod.GET, baseUrl + "/ok")).getStatusCode());
      assertEquals(
          404, client.execute(request(HttpMethod.GET, baseUrl + "/missing")).getStatusCode());
      assertEquals(500, client.execute(request(HttpMethod.GET, baseUrl + "/boom")).getStatusCode());
    }
  }

  @Test
  void execute_sendsBodyVerbatim_andOnlyTheGivenHeaders() {
    try (var client = new TrafficHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(2))) {
      var request = request(HttpMethod.POST, baseUrl + "/echo");
      request.setBody("{ this is not valid json }");
      request.setHeaders(Map.of("Content-Type", "application/json", "User-Agent", "foodme-test-load"));

      var response = client.execute(request);

      assertEquals(201, response.getStatusCode());
      assertEquals("{ this is not valid json }", lastBody.get());
      assertEquals("application/json", lastContentType.get());
      assertEquals("foodme-test-load", lastUserAgent.get());
    }
  }

  @Test
  void execute_withoutBody_sendsEmptyPayload() {
    try (var client = new TrafficHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(2))) {
      var response = client.execute(request(HttpMethod.POST, baseUrl + "/echo"));

      assertEquals(201, response.getStatusCode());
      assertEquals("", lastBody.get());
      assertNull(lastContentType.get());
    }
  }

  @Test
  void execute_measuresResponseTime() {
    try (var client = new TrafficHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(5))) {
      var response = client.execute(request(HttpMethod.GET, baseUrl + "/slow"));

      assertEquals(200, response.getStatusCode());
      assertThat(response.getResponseTimeMs()).isBetween(1_400L, 5_000L);
    }
  }

  @Test
  void execute_timeout_wrapsHttpTimeoutException() {
    try (var client = new TrafficHttpClient(Duration.ofSeconds(2), Duration.ofMillis(200))) {
      var ex =
          assertThrows(
              RuntimeException.class, () -> client.execute(request(HttpMethod.GET, baseUrl + "/slow")));
      assertInstanceOf(HttpTimeoutException.class, ex.getCause());
    }
  }

  @Test
  void execute_connectionRefused_wrapsConnectException() {
    try (var client = new TrafficHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(2))) {
      var ex =
          assertThrows(
              RuntimeException.class,
              () -> client.execute(request(HttpMethod.GET, "http://127.0.0.1:1/ok")));
      assertThat(causalChain(ex)).hasAtLeastOneElementOfType(ConnectException.class);
    }
  }

  @Test
  void execute_unresolvableHost_keepsResolutionFailureInCauseChain() {
    try (var client = new TrafficHttpClient(Duration.ofSeconds(2), Duration.ofSeconds(2))) {
      var ex =
          assertThrows(
              RuntimeException.class,
              () -> client.execute(request(HttpMethod.GET, "http://no-such-host.invalid/")));
      assertThat(causalChain(ex))
          .anyMatch(
              cause ->
                  cause instanceof UnresolvedAddressException
                      || cause instanceof UnknownHostException);
    }
  }

  @Test
  void close_isIdempotent_andRejectsFurtherRequests() {
    var client = new TrafficHttpClient(Duration.ofSeconds(1), Duration.ofSeconds(1));
    client.close();
    client.close();

    assertTrue(client.isClosed());
    assertThrows(
        IllegalStateException.class, () -> client.execute(request(HttpMethod.GET, baseUrl + "/ok")));
  }

  @Test
  void constructor_rejectsNonPositiveTimeouts() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new TrafficHttpClient(Duration.ZERO, Duration.ofSeconds(1)));
    assertThrows(
        IllegalArgumentException.class,
        () -> new TrafficHttpClient(Duration.ofSeconds(1), Duration.ofMillis(-1)));
  }

  private static List<Throwable> causalChain(Throwable t) {
    List<Throwable> chain = new ArrayList<>();
    for (Throwable cur = t; cur != null && !chain.contains(cur); cur = cur.getCause()) {
      chain.add(cur);
    }
    return chain;
  }
}
