package io.github.themoah.txwatch.model;

/**
 * Baseline lookup key: hour of day and status.
 *
 * @param hour hour of day, 0-23
 * @param status the transaction status
 */
public record BaselineKey(int hour, TransactionStatus status) {

  @Override
  public String toString() {
    return String.format("%02dh/%s", hour, status.getValue());
  }
}
