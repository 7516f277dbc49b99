package com.mk.fx.qa.traffic.generator.model;

/** Failure categories for a cycle that produced no HTTP response. */
public enum ExceptionKind {
  TIMEOUT("timeout"),
  CONNECTION_REFUSED("connection_refused"),
  CONNECTION_RESET("connection_reset"),
  CONNECTION_ERROR("connection_error"),
  UNKNOWN_HOST("unknown_host"),
  SSL_ERROR("ssl_error"),
  PROTOCOL_ERROR("protocol_error"),
  INTERRUPTED("interrupted"),
  UNEXPECTED("unexpected");

  private final String label;

  ExceptionKind(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
