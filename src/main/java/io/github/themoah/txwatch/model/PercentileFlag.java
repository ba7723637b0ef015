package io.github.themoah.txwatch.model;

/**
 * Which historical percentile an observation exceeded.
 */
public enum PercentileFlag {
  NONE,
  ABOVE_P95,
  ABOVE_P99;

  public boolean isSet() {
    return this != NONE;
  }
}
