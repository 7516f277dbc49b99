package com.mk.fx.qa.traffic.generator.model;

import java.util.Objects;

/**
 * Classified result of one request attempt: either the HTTP status code or the exception kind,
 * never both and never neither.
 *
 * @param statusCode status code of the response, or null when no response was received
 * @param exceptionKind failure category, or null when a response was received
 */
public record CycleOutcome(Integer statusCode, ExceptionKind exceptionKind) {

  public CycleOutcome {
    if ((statusCode == null) == (exceptionKind == null)) {
      throw new IllegalArgumentException(
          "Exactly one of statusCode or exceptionKind must be set, got "
              + statusCode
              + "/"
              + exceptionKind);
    }
  }

  public static CycleOutcome status(int statusCode) {
    return new CycleOutcome(statusCode, null);
  }

  public static CycleOutcome exception(ExceptionKind kind) {
    return new CycleOutcome(null, Objects.requireNonNull(kind, "kind"));
  }

  public boolean hasStatus() {
    return statusCode != null;
  }

  /** True only for 2xx responses. */
  public boolean isSuccess() {
    return statusCode != null && statusCode >= 200 && statusCode < 300;
  }

  /** Status code as text, or the exception kind label. */
  public String label() {
    return hasStatus() ? String.valueOf(statusCode) : exceptionKind.label();
  }
}
