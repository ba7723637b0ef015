package io.github.themoah.txwatch.model;

/**
 * Historical descriptive statistics for one (hour, status) key.
 *
 * <p>Entries are built in one pass by the baseline store and never modified.
 * An entry whose sample count is below the configured minimum is marked
 * insufficient: only its percentiles may be used.
 *
 * @param mean arithmetic mean of the historical counts
 * @param stdDev population standard deviation
 * @param median median of the historical counts
 * @param mad median absolute deviation, scaled by 1.4826
 * @param p95 the warning percentile (95th by default)
 * @param p99 the critical percentile (99th by default)
 * @param sampleCount number of historical observations
 * @param sufficient whether sampleCount reaches the configured minimum
 */
public record BaselineStats(
  double mean,
  double stdDev,
  double median,
  double mad,
  double p95,
  double p99,
  int sampleCount,
  boolean sufficient
) {

  private static final BaselineStats NONE = new BaselineStats(0, 0, 0, 0, 0, 0, 0, false);

  public BaselineStats {
    if (sampleCount < 0) {
      throw new IllegalArgumentException("Sample count must not be negative: " + sampleCount);
    }
  }

  /**
   * Sentinel returned for keys without any history.
   */
  public static BaselineStats none() {
    return NONE;
  }

  public boolean hasHistory() {
    return sampleCount > 0;
  }

  /**
   * Returns true when every historical count was identical.
   */
  public boolean isConstant() {
    return hasHistory() && stdDev < 1e-10;
  }
}
