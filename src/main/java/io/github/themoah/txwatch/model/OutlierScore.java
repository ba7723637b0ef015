package io.github.themoah.txwatch.model;

/**
 * Result of the multivariate outlier model for one feature vector.
 *
 * @param status whether the model produced a score
 * @param score isolation score in [0, 1], higher is more anomalous (0 when not scored)
 * @param threshold the calibrated label threshold (0 when not scored)
 * @param anomalous whether the score reached the threshold
 */
public record OutlierScore(
  Status status,
  double score,
  double threshold,
  boolean anomalous
) {

  private static final OutlierScore UNTRAINED = new OutlierScore(Status.UNTRAINED, 0.0, 0.0, false);
  private static final OutlierScore SKIPPED = new OutlierScore(Status.SKIPPED, 0.0, 0.0, false);

  /**
   * Model availability for a single scoring call.
   */
  public enum Status {
    /** A trained model scored the vector. */
    SCORED,
    /** No model has been trained yet. */
    UNTRAINED,
    /** The model was not consulted because the baseline is too thin. */
    SKIPPED
  }

  public static OutlierScore scored(double score, double threshold) {
    return new OutlierScore(Status.SCORED, score, threshold, score >= threshold);
  }

  public static OutlierScore untrained() {
    return UNTRAINED;
  }

  public static OutlierScore skipped() {
    return SKIPPED;
  }

  public boolean isAvailable() {
    return status == Status.SCORED;
  }
}
