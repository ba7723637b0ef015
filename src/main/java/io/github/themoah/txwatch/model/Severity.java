package io.github.themoah.txwatch.model;

/**
 * Verdict severity, ordered from least to most severe.
 */
public enum Severity {
  OK("ok"),
  WARNING("warning"),
  CRITICAL("critical");

  private final String value;

  Severity(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public boolean isAlert() {
    return this != OK;
  }
}
