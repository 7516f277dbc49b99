package com.mk.fx.qa.traffic.generator.model;

/** Lifecycle of a traffic generator: IDLE → RUNNING → STOPPING → STOPPED. */
public enum RunState {
  IDLE,
  RUNNING,
  STOPPING,
  STOPPED
}
