package io.github.themoah.txwatch.notification;

import io.github.themoah.txwatch.model.AnomalyVerdict;
import io.github.themoah.txwatch.model.Severity;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Renders a {@link NotificationSummary} in the plain-text alert layout
 * consumed by the mailer.
 */
public class AlertFormatter {

  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final ZoneId zone;

  public AlertFormatter(ZoneId zone) {
    this.zone = zone;
  }

  public String format(NotificationSummary summary) {
    StringBuilder text = new StringBuilder()
      .append("Transaction Anomaly Alert\n")
      .append("Generated at: ").append(TIMESTAMP.format(summary.generatedAt().atZone(zone))).append('\n');

    for (Severity severity : summary.severities()) {
      List<AnomalyVerdict> verdicts = summary.verdicts(severity);
      text.append('\n')
        .append(heading(severity)).append(": ").append(verdicts.size()).append('\n');
      for (AnomalyVerdict verdict : verdicts) {
        text.append("  - Time: ").append(verdict.bucket().label()).append('\n')
          .append("  - Status: ").append(verdict.status().name()).append('\n')
          .append("  - Count: ").append(verdict.count()).append('\n')
          .append("  - Score: ").append(formatScore(verdict.scores().reportedScore())).append('\n')
          .append("  - Reason: ").append(verdict.reason()).append('\n');
      }
    }
    return text.toString();
  }

  private static String heading(Severity severity) {
    return switch (severity) {
      case CRITICAL -> "Critical Anomalies";
      case WARNING -> "Warning Anomalies";
      case OK -> "Normal";
    };
  }

  static String formatScore(OptionalDouble score) {
    return score.isPresent() ? String.format(Locale.ROOT, "%.2f", score.getAsDouble()) : "n/a";
  }
}
