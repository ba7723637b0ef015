package io.github.themoah.txwatch.scoring;

import io.github.themoah.txwatch.model.FeatureVector;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.model.TimeBucket;
import io.github.themoah.txwatch.model.TransactionStatus;
import io.github.themoah.txwatch.scoring.WindowFeatures.Totals;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns observations into per-window feature vectors.
 *
 * <p>A window is all observations of one time bucket. The bad rate of an
 * empty window is defined as 0. Rolling deltas compare a window with the
 * window before it; the first window compares with the supplied previous
 * totals, or gets zero deltas when there are none.
 */
public class FeatureBuilder {

  /**
   * Builds windows for a scoring batch. Observations of the same
   * (bucket, status) are summed and windows are ordered by bucket.
   *
   * @param batch the observations to score
   * @param previous totals of the window preceding the batch, or null
   * @return windows in time order
   */
  public List<WindowFeatures> buildWindows(List<Observation> batch, Totals previous) {
    Map<TimeBucket, Map<TransactionStatus, Long>> byBucket = new TreeMap<>();
    for (Observation observation : batch) {
      byBucket.computeIfAbsent(observation.bucket(), k -> new EnumMap<>(TransactionStatus.class))
        .merge(observation.status(), observation.count(), Long::sum);
    }

    List<WindowFeatures> windows = new ArrayList<>(byBucket.size());
    Totals reference = previous;
    for (Map.Entry<TimeBucket, Map<TransactionStatus, Long>> entry : byBucket.entrySet()) {
      WindowFeatures window = toWindow(entry.getKey(), entry.getValue(), reference);
      windows.add(window);
      reference = window.totals();
    }
    return windows;
  }

  /**
   * Builds training vectors from a history. Windows are consecutive runs of
   * the same time label in input order, so repeated days stay separate.
   *
   * @param history historical observations in recorded order
   * @return one feature vector per window
   */
  public List<FeatureVector> trainingVectors(List<Observation> history) {
    List<FeatureVector> vectors = new ArrayList<>();
    TimeBucket currentBucket = null;
    Map<TransactionStatus, Long> currentCounts = null;
    Totals reference = null;

    for (Observation observation : history) {
      if (!observation.bucket().equals(currentBucket)) {
        if (currentBucket != null) {
          WindowFeatures window = toWindow(currentBucket, currentCounts, reference);
          vectors.add(window.features());
          reference = window.totals();
        }
        currentBucket = observation.bucket();
        currentCounts = new EnumMap<>(TransactionStatus.class);
      }
      currentCounts.merge(observation.status(), observation.count(), Long::sum);
    }
    if (currentBucket != null) {
      vectors.add(toWindow(currentBucket, currentCounts, reference).features());
    }
    return vectors;
  }

  /**
   * Computes the feature vector of one window.
   */
  static FeatureVector features(Map<TransactionStatus, Long> counts, Totals previous) {
    long total = 0;
    long bad = 0;
    for (Map.Entry<TransactionStatus, Long> entry : counts.entrySet()) {
      total += entry.getValue();
      if (entry.getKey().isUnfavorable()) {
        bad += entry.getValue();
      }
    }
    double badRate = total == 0 ? 0.0 : (double) bad / total;

    double deltaTotal = previous == null ? 0.0 : total - previous.totalCount();
    double deltaBadRate = previous == null ? 0.0 : badRate - previous.badRate();

    return new FeatureVector(total, bad, badRate, deltaTotal, deltaBadRate);
  }

  private static WindowFeatures toWindow(
      TimeBucket bucket,
      Map<TransactionStatus, Long> counts,
      Totals previous
  ) {
    return new WindowFeatures(bucket, Collections.unmodifiableMap(counts), features(counts, previous));
  }
}
