package com.mk.fx.qa.traffic.generator.rest;

/**
 * Black-box HTTP transport. Implementations bound every call by their request timeout and report
 * failures as a {@link RuntimeException} whose cause chain carries the underlying JDK exception
 * (for example {@link java.net.http.HttpTimeoutException} or {@link java.net.ConnectException}).
 */
public interface HttpTransport extends AutoCloseable {

  /**
   * Sends one request and drains the response.
   *
   * @param request the request to send
   * @return status code and elapsed time of the exchange
   * @throws RuntimeException if no response was received
   */
  RestResponseData execute(Request request);

  @Override
  void close();
}
