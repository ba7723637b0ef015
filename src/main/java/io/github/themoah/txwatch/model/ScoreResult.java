package io.github.themoah.txwatch.model;

import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Statistical and multivariate scores of one (time bucket, status) group.
 *
 * @param zScore (count - mean) / stdDev, empty when undefined or untrusted
 * @param madScore (count - median) / mad, empty when undefined or untrusted
 * @param percentileFlag highest historical percentile exceeded
 * @param outlier the multivariate model result
 */
public record ScoreResult(
  OptionalDouble zScore,
  OptionalDouble madScore,
  PercentileFlag percentileFlag,
  OutlierScore outlier
) {

  public ScoreResult {
    Objects.requireNonNull(zScore, "zScore");
    Objects.requireNonNull(madScore, "madScore");
    Objects.requireNonNull(percentileFlag, "percentileFlag");
    Objects.requireNonNull(outlier, "outlier");
  }

  public ScoreResult withOutlier(OutlierScore outlierScore) {
    return new ScoreResult(zScore, madScore, percentileFlag, outlierScore);
  }

  /**
   * The score quoted in alerts: z-score when defined, otherwise the MAD score.
   */
  public OptionalDouble reportedScore() {
    return zScore.isPresent() ? zScore : madScore;
  }
}
