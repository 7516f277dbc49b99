package com.mk.fx.qa.traffic.generator.rest;

import lombok.Data;

/** Transport-level result of one exchange. The response body is drained, never kept. */
@Data
public class RestResponseData {
  private int statusCode;
  private long responseTimeMs;
}
