package io.github.themoah.txwatch.model;

/**
 * Multivariate features of one time window.
 *
 * @param totalCount sum of all counts in the window
 * @param badCount sum of counts with an unfavorable status
 * @param badRate badCount / totalCount, 0 when the window is empty
 * @param rollingDeltaTotal totalCount minus the previous window's total
 * @param rollingDeltaBadRate badRate minus the previous window's bad rate
 */
public record FeatureVector(
  long totalCount,
  long badCount,
  double badRate,
  double rollingDeltaTotal,
  double rollingDeltaBadRate
) {

  public static final String SCHEMA =
    "[totalCount,badCount,badRate,rollingDeltaTotal,rollingDeltaBadRate]";

  public double[] toArray() {
    return new double[] {totalCount, badCount, badRate, rollingDeltaTotal, rollingDeltaBadRate};
  }
}
