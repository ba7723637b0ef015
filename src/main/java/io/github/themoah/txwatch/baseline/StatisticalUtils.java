package io.github.themoah.txwatch.baseline;

import java.util.Arrays;
import java.util.Collection;

/**
 * Descriptive statistics used to build baselines.
 */
public final class StatisticalUtils {

  /**
   * Scale factor that makes the MAD a consistent estimator of the standard
   * deviation for normally distributed data.
   */
  public static final double MAD_SCALE = 1.4826;

  private static final double EPSILON = 1e-10;

  private StatisticalUtils() {}

  /**
   * Calculates mean and population standard deviation (divide by n).
   *
   * @param values the values to analyze
   * @return statistics containing mean and standard deviation, zeros when empty
   */
  public static Stats calculateStats(Collection<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return new Stats(0.0, 0.0);
    }

    int n = values.size();
    double sum = 0.0;
    for (Number value : values) {
      sum += value.doubleValue();
    }
    double mean = sum / n;

    double sumSquaredDiffs = 0.0;
    for (Number value : values) {
      double diff = value.doubleValue() - mean;
      sumSquaredDiffs += diff * diff;
    }
    double stdDev = Math.sqrt(sumSquaredDiffs / n);

    return new Stats(mean, stdDev);
  }

  /**
   * Returns the median of an ascending-sorted array.
   */
  public static double median(double[] sorted) {
    return percentile(sorted, 50.0);
  }

  /**
   * Median absolute deviation around the median, multiplied by {@link #MAD_SCALE}.
   *
   * @param sorted values sorted ascending
   * @return the scaled MAD, 0 for empty input
   */
  public static double scaledMad(double[] sorted) {
    if (sorted.length == 0) {
      return 0.0;
    }
    double median = median(sorted);
    double[] deviations = new double[sorted.length];
    for (int i = 0; i < sorted.length; i++) {
      deviations[i] = Math.abs(sorted[i] - median);
    }
    Arrays.sort(deviations);
    return median(deviations) * MAD_SCALE;
  }

  /**
   * Percentile with linear interpolation between closest ranks, the same
   * definition as numpy's default.
   *
   * @param sorted values sorted ascending
   * @param percentile percentile in [0, 100]
   * @return the interpolated percentile, 0 for empty input
   */
  public static double percentile(double[] sorted, double percentile) {
    if (sorted.length == 0) {
      return 0.0;
    }
    double index = percentile / 100.0 * (sorted.length - 1);
    int lower = (int) Math.floor(index);
    int upper = (int) Math.ceil(index);
    if (lower == upper) {
      return sorted[lower];
    }
    double weight = index - lower;
    return sorted[lower] + (sorted[upper] - sorted[lower]) * weight;
  }

  /**
   * Divides a deviation by a scale, returning null instead of dividing by
   * (near) zero.
   */
  public static Double guardedRatio(double deviation, double scale) {
    if (Math.abs(scale) < EPSILON) {
      return null;
    }
    return deviation / scale;
  }

  public static boolean isZero(double value) {
    return Math.abs(value) < EPSILON;
  }

  /**
   * Mean and standard deviation pair.
   *
   * @param mean the arithmetic mean
   * @param stdDev the population standard deviation
   */
  public record Stats(double mean, double stdDev) {}
}
