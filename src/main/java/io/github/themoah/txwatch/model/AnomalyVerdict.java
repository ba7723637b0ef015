package io.github.themoah.txwatch.model;

import java.util.Objects;

/**
 * Final classification of one (time bucket, status) group.
 *
 * @param bucket the time bucket
 * @param status the transaction status
 * @param count the observed count
 * @param severity the assigned severity
 * @param reason human-readable evidence behind the severity
 * @param scores the scores the decision was based on
 * @param snapshotVersion version of the baseline/model snapshot used
 */
public record AnomalyVerdict(
  TimeBucket bucket,
  TransactionStatus status,
  long count,
  Severity severity,
  String reason,
  ScoreResult scores,
  long snapshotVersion
) {

  public AnomalyVerdict {
    Objects.requireNonNull(bucket, "bucket");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(scores, "scores");
  }
}
