package io.github.themoah.txwatch.scoring;

import io.github.themoah.txwatch.model.FeatureVector;
import io.github.themoah.txwatch.model.TimeBucket;
import io.github.themoah.txwatch.model.TransactionStatus;
import java.util.Map;

/**
 * One time window: its merged per-status counts and its feature vector.
 *
 * @param bucket the window's time bucket
 * @param counts summed count per status, in status order
 * @param features the window's feature vector
 */
public record WindowFeatures(
  TimeBucket bucket,
  Map<TransactionStatus, Long> counts,
  FeatureVector features
) {

  /**
   * Totals of a window, used as the rolling reference for the next one.
   *
   * @param totalCount total count of the window
   * @param badRate bad rate of the window
   */
  public record Totals(long totalCount, double badRate) {}

  public Totals totals() {
    return new Totals(features.totalCount(), features.badRate());
  }
}
