package com.mk.fx.qa.traffic.generator.rest;

import java.util.Map;
import lombok.Data;

/**
 * A fully materialised request. The body, when present, is sent byte-for-byte as given; the
 * transport adds no headers of its own.
 */
@Data
public class Request {
  private HttpMethod method;
  private String url;
  private Map<String, String> headers;
  private String body;
}
