package io.github.themoah.txwatch.notification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.txwatch.model.AnomalyVerdict;
import io.github.themoah.txwatch.model.OutlierScore;
import io.github.themoah.txwatch.model.PercentileFlag;
import io.github.themoah.txwatch.model.ScoreResult;
import io.github.themoah.txwatch.model.Severity;
import io.github.themoah.txwatch.model.TimeBucket;
import io.github.themoah.txwatch.model.TransactionStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for NotificationAggregator.
 */
public class NotificationAggregatorTest {

  private static final Instant NOW = Instant.parse("2024-03-01T10:15:30Z");

  private final NotificationAggregator aggregator = new NotificationAggregator(Clock.fixed(NOW, ZoneOffset.UTC));

  static AnomalyVerdict verdict(String time, TransactionStatus status, long count, Severity severity) {
    ScoreResult scores = new ScoreResult(OptionalDouble.of(1.5), OptionalDouble.empty(),
      PercentileFlag.NONE, OutlierScore.untrained());
    return new AnomalyVerdict(TimeBucket.parse(time), status, count, severity, "reason " + count, scores, 1);
  }

  @Test
  void noVerdicts_emptySummary() {
    NotificationSummary summary = aggregator.aggregate(List.of());

    assertTrue(summary.isEmpty());
    assertEquals(0, summary.totalAlerts());
    assertEquals(NOW, summary.generatedAt());
  }

  @Test
  void okOnly_emptySummary() {
    NotificationSummary summary = aggregator.aggregate(List.of(
      verdict("08h 00", TransactionStatus.APPROVED, 10, Severity.OK),
      verdict("09h 00", TransactionStatus.APPROVED, 11, Severity.OK)
    ));

    assertTrue(summary.isEmpty());
    assertTrue(summary.severities().isEmpty());
    assertTrue(summary.verdicts(Severity.OK).isEmpty());
  }

  @Test
  void groups_areExhaustiveAndDisjoint() {
    List<AnomalyVerdict> verdicts = new ArrayList<>();
    Severity[] cycle = {Severity.OK, Severity.WARNING, Severity.CRITICAL};
    for (int i = 0; i < 30; i++) {
      String time = String.format("%02dh 00", i % 24);
      verdicts.add(verdict(time, TransactionStatus.values()[i % 7], i, cycle[i % 3]));
    }

    NotificationSummary summary = aggregator.aggregate(verdicts);

    Set<AnomalyVerdict> seen = new HashSet<>();
    for (Severity severity : summary.severities()) {
      for (AnomalyVerdict v : summary.verdicts(severity)) {
        assertEquals(severity, v.severity());
        assertTrue(seen.add(v), "verdict in more than one group: " + v);
      }
    }
    long alerts = verdicts.stream().filter(v -> v.severity().isAlert()).count();
    assertEquals(alerts, seen.size());
    assertEquals(alerts, summary.totalAlerts());
    assertFalse(seen.stream().anyMatch(v -> v.severity() == Severity.OK));
  }

  @Test
  void groups_orderedByTimeThenStatus_criticalFirst() {
    NotificationSummary summary = aggregator.aggregate(List.of(
      verdict("10h 00", TransactionStatus.DENIED, 1, Severity.WARNING),
      verdict("08h 30", TransactionStatus.FAILED, 2, Severity.WARNING),
      verdict("08h 30", TransactionStatus.DENIED, 3, Severity.WARNING),
      verdict("09h 00", TransactionStatus.APPROVED, 4, Severity.CRITICAL)
    ));

    assertEquals(List.of(Severity.CRITICAL, Severity.WARNING), summary.severities());
    List<AnomalyVerdict> warnings = summary.verdicts(Severity.WARNING);
    assertEquals(List.of(3L, 2L, 1L), warnings.stream().map(AnomalyVerdict::count).toList());
    assertEquals("Transaction Anomalies Detected - 1 Critical, 3 Warnings", summary.subject());
  }
}
