package com.mk.fx.qa.traffic.generator.executors;

import com.mk.fx.qa.traffic.generator.catalog.EndpointRequest;
import com.mk.fx.qa.traffic.generator.model.CycleOutcome;
import com.mk.fx.qa.traffic.generator.model.ExceptionKind;
import com.mk.fx.qa.traffic.generator.rest.HttpTransport;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Sends one request and turns whatever happens into a {@link CycleOutcome}. Any received response
 * is an outcome, 4xx and 5xx included; only a missing response becomes an exception kind. Nothing
 * thrown by the transport escapes.
 */
@Slf4j
public class RequestExecutor {

  private final HttpTransport transport;

  public RequestExecutor(HttpTransport transport) {
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  public CycleOutcome send(EndpointRequest request) {
    Objects.requireNonNull(request, "request");
    try {
      var response = transport.execute(request.toRequest());
      log.debug(
          "{} {} answered {} in {}ms",
          request.method(),
          request.url(),
          response.getStatusCode(),
          response.getResponseTimeMs());
      return CycleOutcome.status(response.getStatusCode());
    } catch (RuntimeException ex) {
      var kind = OutcomeClassifier.classify(ex);
      if (kind == ExceptionKind.UNEXPECTED) {
        log.warn(
            "Unexpected failure sending {} {}: {}",
            request.method(),
            request.url(),
            ex.getMessage(),
            ex);
      } else {
        log.debug(
            "{} {} failed with {}: {}", request.method(), request.url(), kind.label(), ex.getMessage());
      }
      return CycleOutcome.exception(kind);
    }
  }
}
