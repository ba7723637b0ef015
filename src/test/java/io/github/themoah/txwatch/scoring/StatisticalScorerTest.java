package io.github.themoah.txwatch.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import io.github.themoah.txwatch.model.BaselineStats;
import io.github.themoah.txwatch.model.OutlierScore;
import io.github.themoah.txwatch.model.PercentileFlag;
import io.github.themoah.txwatch.model.ScoreResult;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StatisticalScorer.
 */
public class StatisticalScorerTest {

  private final StatisticalScorer scorer = new StatisticalScorer();

  private static BaselineStats stats(double mean, double stdDev, double median, double mad) {
    return new BaselineStats(mean, stdDev, median, mad, mean + 2 * stdDev, mean + 3 * stdDev, 30, true);
  }

  @Test
  void zScore_isExactlyDeviationOverStdDev() {
    long[] counts = {0, 7, 19, 20, 21, 33, 1000};
    BaselineStats baseline = stats(20, 5, 20, 4);

    for (long count : counts) {
      ScoreResult result = scorer.score(count, baseline);
      assertEquals((count - 20.0) / 5.0, result.zScore().getAsDouble(), 0.0);
    }
  }

  @Test
  void smallDeviation_belowMean() {
    ScoreResult result = scorer.score(19, stats(20, 5, 20, 5));

    assertEquals(-0.2, result.zScore().getAsDouble(), 1e-12);
    assertEquals(-0.2, result.madScore().getAsDouble(), 1e-12);
    assertEquals(PercentileFlag.NONE, result.percentileFlag());
    assertEquals(OutlierScore.skipped(), result.outlier());
  }

  @Test
  void scoring_isDeterministic() {
    BaselineStats baseline = stats(3.71, 2.0, 3, 1.5);

    ScoreResult first = scorer.score(25, baseline);
    for (int i = 0; i < 100; i++) {
      assertEquals(first, scorer.score(25, baseline));
    }
  }

  @Test
  void madScore_centredOnMedian() {
    ScoreResult result = scorer.score(12, stats(10, 4, 8, 2));

    assertEquals(0.5, result.zScore().getAsDouble(), 1e-12);
    assertEquals(2.0, result.madScore().getAsDouble(), 1e-12);
  }

  @Test
  void zeroMad_fallsBackToStdDev() {
    ScoreResult result = scorer.score(14, stats(10, 4, 10, 0));

    assertEquals(1.0, result.madScore().getAsDouble(), 1e-12);
  }

  @Test
  void constantBaseline_hasNoRatioScores() {
    BaselineStats constant = new BaselineStats(0, 0, 0, 0, 0, 0, 10, true);

    ScoreResult result = scorer.score(1, constant);

    assertFalse(result.zScore().isPresent());
    assertFalse(result.madScore().isPresent());
    assertEquals(PercentileFlag.ABOVE_P99, result.percentileFlag());
  }

  @Test
  void insufficientBaseline_percentileOnly() {
    BaselineStats thin = new BaselineStats(10, 2, 10, 1, 12, 13, 3, false);

    ScoreResult result = scorer.score(13, thin);

    assertFalse(result.zScore().isPresent());
    assertFalse(result.madScore().isPresent());
    assertEquals(PercentileFlag.ABOVE_P95, result.percentileFlag());
  }

  @Test
  void percentileFlag_strictlyAbove() {
    BaselineStats baseline = new BaselineStats(10, 2, 10, 1, 12, 14, 30, true);

    assertEquals(PercentileFlag.NONE, StatisticalScorer.percentileFlag(12, baseline));
    assertEquals(PercentileFlag.ABOVE_P95, StatisticalScorer.percentileFlag(13, baseline));
    assertEquals(PercentileFlag.ABOVE_P95, StatisticalScorer.percentileFlag(14, baseline));
    assertEquals(PercentileFlag.ABOVE_P99, StatisticalScorer.percentileFlag(15, baseline));
    assertEquals(PercentileFlag.NONE, StatisticalScorer.percentileFlag(100, BaselineStats.none()));
  }
}
