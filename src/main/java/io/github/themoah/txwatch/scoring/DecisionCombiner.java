package io.github.themoah.txwatch.scoring;

import io.github.themoah.txwatch.config.DetectionConfig;
import io.github.themoah.txwatch.model.BaselineStats;
import io.github.themoah.txwatch.model.OutlierScore;
import io.github.themoah.txwatch.model.PercentileFlag;
import io.github.themoah.txwatch.model.ScoreResult;
import io.github.themoah.txwatch.model.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fuses the statistical and multivariate signals into a severity.
 *
 * <p>The statistical signal is <em>strong</em> when |z| exceeds the critical
 * bound or the count exceeds p99, and <em>moderate</em> when |z| exceeds the
 * warning bound or the count exceeds p95. Severity:
 * <ul>
 *   <li>strong and model anomalous: critical</li>
 *   <li>strong and model unavailable: critical only when the count is above
 *       p99 and |z| exceeds the extreme bound, otherwise warning</li>
 *   <li>any other single signal: warning</li>
 *   <li>no signal: ok</li>
 * </ul>
 * A constant baseline makes any deviation critical. A baseline below the
 * minimum sample count is checked against its percentiles only and never
 * rises above warning.
 */
public class DecisionCombiner {

  private final DetectionConfig config;

  public DecisionCombiner(DetectionConfig config) {
    this.config = config;
  }

  /**
   * Decides the severity of one group.
   *
   * @param count the observed count
   * @param stats the baseline used for scoring
   * @param scores statistical scores, including the model result
   * @return the severity and its reason
   */
  public Decision decide(long count, BaselineStats stats, ScoreResult scores) {
    if (!stats.hasHistory()) {
      return new Decision(Severity.OK, "no baseline history for this hour and status; not scored");
    }
    if (!stats.sufficient()) {
      return decideThinBaseline(count, stats, scores.percentileFlag());
    }
    if (stats.isConstant()) {
      return decideConstantBaseline(count, stats);
    }

    double z = scores.zScore().orElse(0.0);
    PercentileFlag flag = scores.percentileFlag();
    boolean strong = Math.abs(z) > config.zScoreCritical() || flag == PercentileFlag.ABOVE_P99;
    boolean moderate = Math.abs(z) > config.zScoreWarning() || flag.isSet();
    OutlierScore outlier = scores.outlier();

    List<String> evidence = new ArrayList<>();
    if (strong || moderate) {
      evidence.add(statisticalEvidence(count, stats, scores, strong));
    }

    if (strong && outlier.isAvailable() && outlier.anomalous()) {
      evidence.add(String.format(Locale.ROOT, "isolation forest agrees (score %.2f >= %.2f)",
        outlier.score(), outlier.threshold()));
      return new Decision(Severity.CRITICAL, join(evidence));
    }

    if (strong && !outlier.isAvailable()) {
      boolean extreme = flag == PercentileFlag.ABOVE_P99 && Math.abs(z) > config.zScoreExtreme();
      if (extreme) {
        evidence.add(String.format(Locale.ROOT,
          "isolation forest unavailable (%s); deviation is extreme (above p99 and |z| > %.2f), critical on statistics alone",
          unavailableReason(outlier), config.zScoreExtreme()));
        return new Decision(Severity.CRITICAL, join(evidence));
      }
      evidence.add(String.format(Locale.ROOT,
        "isolation forest unavailable (%s); capped at warning without model agreement",
        unavailableReason(outlier)));
      return new Decision(Severity.WARNING, join(evidence));
    }

    if (strong || moderate) {
      evidence.add(modelEvidence(outlier));
      return new Decision(Severity.WARNING, join(evidence));
    }

    if (outlier.isAvailable() && outlier.anomalous()) {
      evidence.add(String.format(Locale.ROOT,
        "isolation forest flags the window (score %.2f >= %.2f) while the count is within its baseline (z-score %.2f)",
        outlier.score(), outlier.threshold(), z));
      return new Decision(Severity.WARNING, join(evidence));
    }

    return new Decision(Severity.OK, String.format(Locale.ROOT,
      "within expected range (z-score %.2f, p95 %.2f); %s", z, stats.p95(), modelEvidence(outlier)));
  }

  private Decision decideThinBaseline(long count, BaselineStats stats, PercentileFlag flag) {
    String thin = String.format(Locale.ROOT,
      "thin baseline (%d of %d required samples), percentile-only check, model not consulted",
      stats.sampleCount(), config.minSamples());
    if (stats.isConstant() && count != stats.mean()) {
      thin += String.format(Locale.ROOT,
        "; deviation from constant baseline %.2f not treated as critical because the baseline is too thin",
        stats.mean());
    }
    return switch (flag) {
      case ABOVE_P99 -> new Decision(Severity.WARNING, String.format(Locale.ROOT,
        "count %d exceeds p99 (%.2f); %s; capped at warning", count, stats.p99(), thin));
      case ABOVE_P95 -> new Decision(Severity.WARNING, String.format(Locale.ROOT,
        "count %d exceeds p95 (%.2f); %s", count, stats.p95(), thin));
      case NONE -> new Decision(Severity.OK, String.format(Locale.ROOT,
        "count %d within p95 (%.2f); %s", count, stats.p95(), thin));
    };
  }

  private Decision decideConstantBaseline(long count, BaselineStats stats) {
    if (count == stats.mean()) {
      return new Decision(Severity.OK, String.format(Locale.ROOT,
        "count %d matches constant baseline %.2f", count, stats.mean()));
    }
    return new Decision(Severity.CRITICAL, String.format(Locale.ROOT,
      "count %d deviates from constant baseline %.2f (std_dev 0 over %d samples); any deviation is critical",
      count, stats.mean(), stats.sampleCount()));
  }

  private String statisticalEvidence(long count, BaselineStats stats, ScoreResult scores, boolean strong) {
    List<String> parts = new ArrayList<>();
    switch (scores.percentileFlag()) {
      case ABOVE_P99 -> parts.add(String.format(Locale.ROOT, "count %d exceeds p99 (%.2f)", count, stats.p99()));
      case ABOVE_P95 -> parts.add(String.format(Locale.ROOT, "count %d exceeds p95 (%.2f)", count, stats.p95()));
      case NONE -> parts.add(String.format(Locale.ROOT, "count %d", count));
    }

    double z = scores.zScore().orElse(0.0);
    double bound = strong ? config.zScoreCritical() : config.zScoreWarning();
    String zText = Math.abs(z) > bound
      ? String.format(Locale.ROOT, "z-score %+.2f beyond ±%.2f", z, bound)
      : String.format(Locale.ROOT, "z-score %+.2f", z);
    parts.add(zText);

    if (stats.mean() > 0) {
      double pct = (count - stats.mean()) / stats.mean() * 100.0;
      parts.add(String.format(Locale.ROOT, "%+.0f%% vs mean %.2f", pct, stats.mean()));
    }
    scores.madScore().ifPresent(mad -> parts.add(String.format(Locale.ROOT, "MAD score %+.2f", mad)));
    return String.join(", ", parts);
  }

  private static String modelEvidence(OutlierScore outlier) {
    if (!outlier.isAvailable()) {
      return "isolation forest unavailable (" + unavailableReason(outlier) + ")";
    }
    if (outlier.anomalous()) {
      return String.format(Locale.ROOT, "isolation forest flags the window (score %.2f >= %.2f)",
        outlier.score(), outlier.threshold());
    }
    return String.format(Locale.ROOT, "isolation forest disagrees (score %.2f < %.2f)",
      outlier.score(), outlier.threshold());
  }

  private static String unavailableReason(OutlierScore outlier) {
    return outlier.status() == OutlierScore.Status.UNTRAINED ? "not trained" : "not consulted";
  }

  private static String join(List<String> evidence) {
    return String.join("; ", evidence);
  }
}
