package io.github.themoah.txwatch.scoring;

import io.github.themoah.txwatch.baseline.StatisticalUtils;
import io.github.themoah.txwatch.model.BaselineStats;
import io.github.themoah.txwatch.model.OutlierScore;
import io.github.themoah.txwatch.model.PercentileFlag;
import io.github.themoah.txwatch.model.ScoreResult;
import java.util.OptionalDouble;

/**
 * Scores a count against its baseline with the z-score, the MAD score and a
 * percentile flag.
 *
 * <p>Stateless: the result depends only on the count and the statistics.
 * The outlier part of the result is left as {@link OutlierScore#skipped()};
 * the engine fills it in.
 */
public class StatisticalScorer {

  /**
   * Scores one count.
   *
   * <ul>
   *   <li>Insufficient baseline: only the percentile flag is computed.</li>
   *   <li>Constant baseline (stdDev 0): both scores are empty.</li>
   *   <li>MAD of 0 with stdDev above 0: the MAD score uses stdDev as its scale.</li>
   * </ul>
   *
   * @param count the observed count
   * @param stats the baseline for the observation's (hour, status)
   * @return the score result
   */
  public ScoreResult score(long count, BaselineStats stats) {
    PercentileFlag flag = percentileFlag(count, stats);

    if (!stats.sufficient() || stats.isConstant()) {
      return new ScoreResult(OptionalDouble.empty(), OptionalDouble.empty(), flag, OutlierScore.skipped());
    }

    OptionalDouble zScore = toOptional(StatisticalUtils.guardedRatio(count - stats.mean(), stats.stdDev()));

    double madScale = StatisticalUtils.isZero(stats.mad()) ? stats.stdDev() : stats.mad();
    OptionalDouble madScore = toOptional(StatisticalUtils.guardedRatio(count - stats.median(), madScale));

    return new ScoreResult(zScore, madScore, flag, OutlierScore.skipped());
  }

  static PercentileFlag percentileFlag(long count, BaselineStats stats) {
    if (!stats.hasHistory()) {
      return PercentileFlag.NONE;
    }
    if (count > stats.p99()) {
      return PercentileFlag.ABOVE_P99;
    }
    if (count > stats.p95()) {
      return PercentileFlag.ABOVE_P95;
    }
    return PercentileFlag.NONE;
  }

  private static OptionalDouble toOptional(Double value) {
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }
}
