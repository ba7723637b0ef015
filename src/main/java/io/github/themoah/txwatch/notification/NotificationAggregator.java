package io.github.themoah.txwatch.notification;

import io.github.themoah.txwatch.model.AnomalyVerdict;
import io.github.themoah.txwatch.model.Severity;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups the non-ok verdicts of a batch by severity. Sends nothing.
 */
public class NotificationAggregator {

  private static final Comparator<AnomalyVerdict> TIME_ORDER =
    Comparator.comparing(AnomalyVerdict::bucket).thenComparing(AnomalyVerdict::status);

  private final Clock clock;

  public NotificationAggregator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Builds the summary. OK verdicts are dropped; each severity group is
   * sorted by time bucket, then status.
   *
   * @param verdicts the verdicts of one batch
   * @return the summary, possibly empty
   */
  public NotificationSummary aggregate(List<AnomalyVerdict> verdicts) {
    Map<Severity, List<AnomalyVerdict>> groups = new EnumMap<>(Severity.class);
    for (AnomalyVerdict verdict : verdicts) {
      if (verdict.severity().isAlert()) {
        groups.computeIfAbsent(verdict.severity(), k -> new ArrayList<>()).add(verdict);
      }
    }
    groups.values().forEach(group -> group.sort(TIME_ORDER));
    return new NotificationSummary(clock.instant(), groups);
  }
}
