package com.mk.fx.qa.traffic.generator.model;

/** Whether periodic summaries report the whole run or only the interval since the last one. */
public enum SummaryMode {
  CUMULATIVE,
  WINDOWED
}
