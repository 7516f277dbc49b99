package com.mk.fx.qa.traffic.generator.rest;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link HttpTransport} on top of {@link HttpClient}. Every request is bounded by the configured
 * request timeout; response bodies are discarded so connections can be reused. Requests go out as
 * plain HTTP/1.1 without an h2c upgrade attempt. This implementation does not retry.
 *
 * <p>The client owns the executor its {@link HttpClient} runs on, so {@link #close()} actually
 * releases the connection pool threads.
 */
@Slf4j
public class TrafficHttpClient implements HttpTransport {

  private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

  /** The underlying Java HTTP client. */
  private final HttpClient httpClient;

  /** Threads backing the HTTP client; shut down on close. */
  private final ExecutorService executor;

  /** Timeout duration for requests. */
  private final Duration requestTimeout;

  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * Constructs a client with explicit connection and request timeouts.
   *
   * @param connectTimeout connection timeout
   * @param requestTimeout per-request timeout, measured until response headers arrive
   */
  public TrafficHttpClient(Duration connectTimeout, Duration requestTimeout) {
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    if (connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("Connection timeout must be positive");
    }
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("Request timeout must be positive");
    }

    this.executor =
        Executors.newCachedThreadPool(
            runnable -> {
              Thread thread = new Thread(runnable);
              thread.setName("traffic-http-" + thread.getId());
              thread.setDaemon(true);
              return thread;
            });
    this.httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NEVER)
            .executor(executor)
            .build();

    log.info(
        "TrafficHttpClient initialised - Connection timeout: {}ms, Request timeout: {}ms",
        connectTimeout.toMillis(),
        requestTimeout.toMillis());
  }

  /**
   * Executes a synchronous request and discards the response body.
   *
   * @param request the request to execute
   * @return the response status and elapsed time
   * @throws RuntimeException wrapping the transport failure if no response was received
   */
  @Override
  public RestResponseData execute(Request request) {
    Objects.requireNonNull(request, "Request cannot be null");
    if (closed.get()) {
      throw new IllegalStateException("TrafficHttpClient is closed");
    }

    var httpRequest = buildHttpRequest(request);
    var startTime = System.nanoTime();
    try {
      log.debug("Executing {} request to {}", request.getMethod(), httpRequest.uri());

      var response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.discarding());
      var duration = (System.nanoTime() - startTime) / 1_000_000;

      var result = new RestResponseData();
      result.setStatusCode(response.statusCode());
      result.setResponseTimeMs(duration);

      log.debug("Request completed in {} ms with status {}", duration, response.statusCode());
      return result;

    } catch (HttpTimeoutException e) {
      log.debug("Request timed out after {} ms: {}", requestTimeout.toMillis(), e.getMessage());
      throw new RuntimeException(
          "Request timed out after " + requestTimeout.toMillis() + "ms: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("Request interrupted", e);
    } catch (Exception e) {
      log.debug("Error executing request: {}", e.toString());
      throw new RuntimeException("Error executing request: " + e.getMessage(), e);
    }
  }

  /**
   * Builds an HTTP request. Headers are applied exactly as given and the body, if any, is sent as
   * literal text.
   */
  private HttpRequest buildHttpRequest(Request request) {
    Objects.requireNonNull(request.getMethod(), "Request method cannot be null");
    Objects.requireNonNull(request.getUrl(), "Request URL cannot be null");

    var requestBuilder =
        HttpRequest.newBuilder().uri(URI.create(request.getUrl())).timeout(requestTimeout);

    if (request.getHeaders() != null) {
      request.getHeaders().forEach(requestBuilder::setHeader);
    }

    var publisher =
        request.getBody() != null
            ? HttpRequest.BodyPublishers.ofString(request.getBody())
            : HttpRequest.BodyPublishers.noBody();
    requestBuilder.method(request.getMethod().name(), publisher);

    return requestBuilder.build();
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("TrafficHttpClient closed");
  }

  public boolean isClosed() {
    return closed.get();
  }
}
