package io.github.themoah.txwatch.model;

/**
 * Transaction outcome reported with every observation.
 */
public enum TransactionStatus {
  APPROVED("approved", false),
  DENIED("denied", true),
  REVERSED("reversed", true),
  BACKEND_REVERSED("backend_reversed", true),
  FAILED("failed", true),
  PROCESSING("processing", false),
  REFUNDED("refunded", false);

  private final String value;
  private final boolean unfavorable;

  TransactionStatus(String value, boolean unfavorable) {
    this.value = value;
    this.unfavorable = unfavorable;
  }

  /**
   * Returns the wire value used in JSON and CSV input.
   *
   * @return the lowercase status name
   */
  public String getValue() {
    return value;
  }

  /**
   * Returns true for statuses counted as "bad" by the feature builder.
   *
   * @return true for denied, reversed, backend_reversed and failed
   */
  public boolean isUnfavorable() {
    return unfavorable;
  }

  /**
   * Parses a wire value.
   *
   * @param value the status as sent by clients, case-insensitive
   * @return the matching status
   * @throws IllegalArgumentException if the value is unknown
   */
  public static TransactionStatus fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase();
      for (TransactionStatus status : values()) {
        if (status.value.equals(normalized)) {
          return status;
        }
      }
    }
    throw new IllegalArgumentException("Unknown transaction status: " + value);
  }
}
