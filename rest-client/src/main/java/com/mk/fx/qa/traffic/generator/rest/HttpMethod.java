package com.mk.fx.qa.traffic.generator.rest;

public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE,
  PATCH,
  HEAD,
  OPTIONS
}
