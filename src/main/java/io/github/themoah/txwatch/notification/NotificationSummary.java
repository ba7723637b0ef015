package io.github.themoah.txwatch.notification;

import io.github.themoah.txwatch.model.AnomalyVerdict;
import io.github.themoah.txwatch.model.Severity;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Alert-worthy verdicts of one batch, grouped by severity.
 *
 * <p>An empty summary means nothing needs to be sent; it is not an error.
 */
public final class NotificationSummary {

  private final Instant generatedAt;
  private final Map<Severity, List<AnomalyVerdict>> groups;

  NotificationSummary(Instant generatedAt, Map<Severity, List<AnomalyVerdict>> groups) {
    this.generatedAt = generatedAt;
    EnumMap<Severity, List<AnomalyVerdict>> copy = new EnumMap<>(Severity.class);
    groups.forEach((severity, verdicts) -> {
      if (!verdicts.isEmpty()) {
        copy.put(severity, List.copyOf(verdicts));
      }
    });
    this.groups = Collections.unmodifiableMap(copy);
  }

  public Instant generatedAt() {
    return generatedAt;
  }

  /**
   * Returns the verdicts of one severity in time order; empty for OK.
   */
  public List<AnomalyVerdict> verdicts(Severity severity) {
    return groups.getOrDefault(severity, List.of());
  }

  /**
   * Severity groups present in this summary, most severe first.
   */
  public List<Severity> severities() {
    return groups.keySet().stream()
      .sorted(Collections.reverseOrder())
      .toList();
  }

  public int count(Severity severity) {
    return verdicts(severity).size();
  }

  public int totalAlerts() {
    return groups.values().stream().mapToInt(List::size).sum();
  }

  public boolean isEmpty() {
    return groups.isEmpty();
  }

  /**
   * Mail subject line.
   */
  public String subject() {
    return String.format("Transaction Anomalies Detected - %d Critical, %d Warnings",
      count(Severity.CRITICAL), count(Severity.WARNING));
  }

  @Override
  public String toString() {
    return "NotificationSummary{generatedAt=" + generatedAt
      + ", critical=" + count(Severity.CRITICAL)
      + ", warning=" + count(Severity.WARNING) + "}";
  }
}
