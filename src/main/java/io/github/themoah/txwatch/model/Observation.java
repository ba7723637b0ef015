package io.github.themoah.txwatch.model;

import java.util.Objects;

/**
 * One recorded transaction count for a time bucket and status.
 *
 * @param bucket the time bucket the count belongs to
 * @param status the transaction status
 * @param count the number of transactions, never negative
 */
public record Observation(
  TimeBucket bucket,
  TransactionStatus status,
  long count
) {

  public Observation {
    Objects.requireNonNull(bucket, "bucket");
    Objects.requireNonNull(status, "status");
    if (count < 0) {
      throw new IllegalArgumentException("Count must not be negative: " + count);
    }
  }

  public static Observation of(String time, TransactionStatus status, long count) {
    return new Observation(TimeBucket.parse(time), status, count);
  }

  public BaselineKey baselineKey() {
    return new BaselineKey(bucket.hour(), status);
  }
}
