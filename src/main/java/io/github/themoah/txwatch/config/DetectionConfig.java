package io.github.themoah.txwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thresholds of the baseline store, statistical scorer and decision combiner.
 *
 * @param minSamples minimum historical samples for a trusted baseline (default 5)
 * @param zScoreWarning |z| above which the statistical signal is moderate (default 2.0)
 * @param zScoreCritical |z| above which the statistical signal is strong (default 3.0)
 * @param zScoreExtreme |z| that, together with count above p99, is critical without the model (default 6.0)
 * @param warningPercentile percentile level stored as p95 (default 95)
 * @param criticalPercentile percentile level stored as p99 (default 99)
 */
public record DetectionConfig(
  int minSamples,
  double zScoreWarning,
  double zScoreCritical,
  double zScoreExtreme,
  double warningPercentile,
  double criticalPercentile
) {

  private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

  private static final int DEFAULT_MIN_SAMPLES = 5;
  private static final double DEFAULT_Z_SCORE_WARNING = 2.0;
  private static final double DEFAULT_Z_SCORE_CRITICAL = 3.0;
  private static final double DEFAULT_Z_SCORE_EXTREME = 6.0;
  private static final double DEFAULT_WARNING_PERCENTILE = 95.0;
  private static final double DEFAULT_CRITICAL_PERCENTILE = 99.0;

  public DetectionConfig {
    if (minSamples < 1) {
      throw new IllegalArgumentException("minSamples must be at least 1");
    }
    if (zScoreWarning > zScoreCritical || zScoreCritical > zScoreExtreme) {
      throw new IllegalArgumentException("z-score thresholds must satisfy warning <= critical <= extreme");
    }
    if (warningPercentile <= 0 || criticalPercentile > 100 || warningPercentile > criticalPercentile) {
      throw new IllegalArgumentException("percentiles must satisfy 0 < warning <= critical <= 100");
    }
  }

  public static DetectionConfig defaults() {
    return new DetectionConfig(
      DEFAULT_MIN_SAMPLES,
      DEFAULT_Z_SCORE_WARNING,
      DEFAULT_Z_SCORE_CRITICAL,
      DEFAULT_Z_SCORE_EXTREME,
      DEFAULT_WARNING_PERCENTILE,
      DEFAULT_CRITICAL_PERCENTILE
    );
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>BASELINE_MIN_SAMPLES - Samples required for a trusted baseline (default: 5)</li>
   *   <li>Z_SCORE_WARNING - Moderate deviation bound (default: 2.0)</li>
   *   <li>Z_SCORE_CRITICAL - Strong deviation bound (default: 3.0)</li>
   *   <li>Z_SCORE_EXTREME - Bound for critical without model agreement (default: 6.0)</li>
   *   <li>PERCENTILE_WARNING - Warning percentile level (default: 95)</li>
   *   <li>PERCENTILE_CRITICAL - Critical percentile level (default: 99)</li>
   * </ul>
   */
  public static DetectionConfig fromEnvironment() {
    return fromEnv(EnvVars.system());
  }

  static DetectionConfig fromEnv(EnvVars env) {
    DetectionConfig config = new DetectionConfig(
      env.getInt("BASELINE_MIN_SAMPLES", DEFAULT_MIN_SAMPLES),
      env.getDouble("Z_SCORE_WARNING", DEFAULT_Z_SCORE_WARNING),
      env.getDouble("Z_SCORE_CRITICAL", DEFAULT_Z_SCORE_CRITICAL),
      env.getDouble("Z_SCORE_EXTREME", DEFAULT_Z_SCORE_EXTREME),
      env.getDouble("PERCENTILE_WARNING", DEFAULT_WARNING_PERCENTILE),
      env.getDouble("PERCENTILE_CRITICAL", DEFAULT_CRITICAL_PERCENTILE)
    );
    log.info("Detection config: minSamples={}, z(warning/critical/extreme)={}/{}/{}, percentiles={}/{}",
      config.minSamples, config.zScoreWarning, config.zScoreCritical, config.zScoreExtreme,
      config.warningPercentile, config.criticalPercentile);
    return config;
  }
}
