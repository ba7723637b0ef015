package io.github.themoah.txwatch.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.txwatch.config.DetectionConfig;
import io.github.themoah.txwatch.model.BaselineStats;
import io.github.themoah.txwatch.model.OutlierScore;
import io.github.themoah.txwatch.model.ScoreResult;
import io.github.themoah.txwatch.model.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DecisionCombiner.
 */
public class DecisionCombinerTest {

  private static final OutlierScore MODEL_ANOMALOUS = OutlierScore.scored(0.72, 0.60);
  private static final OutlierScore MODEL_NORMAL = OutlierScore.scored(0.41, 0.60);

  private final StatisticalScorer scorer = new StatisticalScorer();
  private final DecisionCombiner combiner = new DecisionCombiner(DetectionConfig.defaults());

  private Decision decide(long count, BaselineStats stats, OutlierScore outlier) {
    ScoreResult scores = scorer.score(count, stats).withOutlier(outlier);
    return combiner.decide(count, stats, scores);
  }

  @Test
  void largeSpike_withModelAgreement_isCritical() {
    BaselineStats stats = new BaselineStats(3.71, 2.0, 3, 1.5, 7, 8, 24, true);

    Decision decision = decide(25, stats, MODEL_ANOMALOUS);

    assertEquals(Severity.CRITICAL, decision.severity());
    assertTrue(decision.reason().contains("exceeds p99"), decision.reason());
    assertTrue(decision.reason().contains("+574% vs mean"), decision.reason());
    assertTrue(decision.reason().contains("isolation forest agrees"), decision.reason());
  }

  @Test
  void smallDeviation_isOk() {
    BaselineStats stats = new BaselineStats(20, 5, 20, 5, 28, 31, 30, true);

    Decision decision = decide(19, stats, MODEL_NORMAL);

    assertEquals(Severity.OK, decision.severity());
    assertTrue(decision.reason().contains("within expected range"), decision.reason());
  }

  @Test
  void constantBaseline_anyDeviationIsCritical() {
    BaselineStats zeros = new BaselineStats(0, 0, 0, 0, 0, 0, 10, true);

    assertEquals(Severity.CRITICAL, decide(1, zeros, MODEL_NORMAL).severity());
    assertEquals(Severity.CRITICAL, decide(1, zeros, OutlierScore.untrained()).severity());
    assertEquals(Severity.OK, decide(0, zeros, MODEL_ANOMALOUS).severity());
  }

  @Test
  void constantBaseline_deviationBelowIsCritical() {
    BaselineStats fives = new BaselineStats(5, 0, 5, 0, 5, 5, 10, true);

    Decision decision = decide(3, fives, MODEL_NORMAL);

    assertEquals(Severity.CRITICAL, decision.severity());
    assertTrue(decision.reason().contains("constant baseline"), decision.reason());
  }

  @Test
  void strongSignal_untrainedModel_cappedAtWarning() {
    BaselineStats stats = new BaselineStats(20, 4, 20, 4, 30, 40, 30, true);

    // z = (34 - 20) / 4 = 3.5
    Decision decision = decide(34, stats, OutlierScore.untrained());

    assertEquals(Severity.WARNING, decision.severity());
    assertTrue(decision.reason().contains("isolation forest unavailable (not trained)"), decision.reason());
    assertTrue(decision.reason().contains("capped at warning"), decision.reason());
  }

  @Test
  void extremeSignal_untrainedModel_isCritical() {
    BaselineStats stats = new BaselineStats(20, 4, 20, 4, 30, 40, 30, true);

    // z = 7.5 and above p99
    Decision decision = decide(50, stats, OutlierScore.untrained());

    assertEquals(Severity.CRITICAL, decision.severity());
    assertTrue(decision.reason().contains("deviation is extreme"), decision.reason());
  }

  @Test
  void strongSignal_modelDisagrees_isWarning() {
    BaselineStats stats = new BaselineStats(20, 4, 20, 4, 30, 40, 30, true);

    Decision decision = decide(34, stats, MODEL_NORMAL);

    assertEquals(Severity.WARNING, decision.severity());
    assertTrue(decision.reason().contains("isolation forest disagrees"), decision.reason());
  }

  @Test
  void modelOnly_isWarning() {
    BaselineStats stats = new BaselineStats(20, 4, 20, 4, 30, 40, 30, true);

    Decision decision = decide(21, stats, MODEL_ANOMALOUS);

    assertEquals(Severity.WARNING, decision.severity());
    assertTrue(decision.reason().contains("isolation forest flags the window"), decision.reason());
  }

  @Test
  void dropBelowMean_isScoredToo() {
    BaselineStats stats = new BaselineStats(20, 4, 20, 4, 30, 40, 30, true);

    // z = -5
    assertEquals(Severity.CRITICAL, decide(0, stats, MODEL_ANOMALOUS).severity());
    assertEquals(Severity.WARNING, decide(0, stats, MODEL_NORMAL).severity());
  }

  @Test
  void thinBaseline_neverAboveWarning() {
    BaselineStats thin = new BaselineStats(10, 2, 10, 1, 12, 13, 3, false);

    Decision huge = decide(10_000, thin, OutlierScore.skipped());
    assertEquals(Severity.WARNING, huge.severity());
    assertTrue(huge.reason().contains("thin baseline (3 of 5 required samples)"), huge.reason());
    assertTrue(huge.reason().contains("model not consulted"), huge.reason());

    assertEquals(Severity.OK, decide(11, thin, OutlierScore.skipped()).severity());
  }

  @Test
  void thinConstantBaseline_explainsWhyNotCritical() {
    BaselineStats thinConstant = new BaselineStats(4, 0, 4, 0, 4, 4, 2, false);

    Decision above = decide(9, thinConstant, OutlierScore.skipped());
    assertEquals(Severity.WARNING, above.severity());
    assertTrue(above.reason().contains("not treated as critical because the baseline is too thin"), above.reason());

    Decision below = decide(1, thinConstant, OutlierScore.skipped());
    assertEquals(Severity.OK, below.severity());
    assertTrue(below.reason().contains("constant baseline 4.00"), below.reason());

    Decision same = decide(4, thinConstant, OutlierScore.skipped());
    assertFalse(same.reason().contains("not treated as critical"), same.reason());
  }

  @Test
  void noHistory_isOkAndNotScored() {
    Decision decision = decide(500, BaselineStats.none(), OutlierScore.skipped());

    assertEquals(Severity.OK, decision.severity());
    assertTrue(decision.reason().contains("not scored"), decision.reason());
  }

  @Test
  void severity_isMonotonicInCount() {
    BaselineStats stats = new BaselineStats(20, 4, 20, 4, 28, 32, 30, true);

    for (OutlierScore outlier : List.of(MODEL_ANOMALOUS, MODEL_NORMAL, OutlierScore.untrained())) {
      Severity previous = Severity.OK;
      for (long count = 20; count <= 80; count++) {
        Severity current = decide(count, stats, outlier).severity();
        assertTrue(current.compareTo(previous) >= 0,
          "severity dropped at count " + count + " with model " + outlier.status());
        previous = current;
      }
    }
  }

  @Test
  void severity_isMonotonicInModelAgreement() {
    BaselineStats stats = new BaselineStats(20, 4, 20, 4, 28, 32, 30, true);

    for (long count = 0; count <= 80; count++) {
      Severity normal = decide(count, stats, MODEL_NORMAL).severity();
      Severity anomalous = decide(count, stats, MODEL_ANOMALOUS).severity();
      assertTrue(anomalous.compareTo(normal) >= 0, "model agreement lowered severity at count " + count);
    }
  }

  @Test
  void reasons_areNeverBlank() {
    BaselineStats stats = new BaselineStats(20, 4, 20, 4, 28, 32, 30, true);

    for (long count = 0; count <= 80; count += 5) {
      assertFalse(decide(count, stats, MODEL_NORMAL).reason().isBlank());
    }
  }
}
