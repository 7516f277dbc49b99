package com.mk.fx.qa.traffic.generator.catalog;

import com.mk.fx.qa.traffic.generator.rest.HttpMethod;
import com.mk.fx.qa.traffic.generator.rest.Request;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A concrete request built by an {@link Endpoint}.
 *
 * @param endpoint the endpoint that built it
 * @param method HTTP method
 * @param url absolute URL
 * @param headers headers to send, exactly
 * @param body body text sent verbatim, or null for no body
 * @param injected true when a malformed variant was built
 * @param variant short label of the variant, used in debug logs
 */
public record EndpointRequest(
    Endpoint endpoint,
    HttpMethod method,
    String url,
    Map<String, String> headers,
    String body,
    boolean injected,
    String variant) {

  public EndpointRequest {
    headers = headers != null ? Map.copyOf(headers) : Map.of();
  }

  public Request toRequest() {
    var request = new Request();
    request.setMethod(method);
    request.setUrl(url);
    request.setHeaders(new LinkedHashMap<>(headers));
    request.setBody(body);
    return request;
  }
}
