package io.github.themoah.txwatch.engine;

import io.github.themoah.txwatch.model.AnomalyVerdict;
import io.github.themoah.txwatch.notification.NotificationSummary;
import java.util.List;

/**
 * Verdicts of one batch together with their notification summary.
 *
 * @param verdicts one verdict per (time bucket, status) group, in time order
 * @param summary non-ok verdicts grouped by severity
 * @param snapshotVersion the snapshot every verdict was scored against
 */
public record IngestResult(
  List<AnomalyVerdict> verdicts,
  NotificationSummary summary,
  long snapshotVersion
) {

  public IngestResult {
    verdicts = List.copyOf(verdicts);
  }
}
