package io.github.themoah.txwatch.outlier;

import io.github.themoah.txwatch.model.FeatureVector;
import io.github.themoah.txwatch.model.OutlierScore;

/**
 * A trained, immutable multivariate outlier model.
 *
 * <p>Implementations must be safe for concurrent {@link #score} calls and
 * must not change after construction.
 */
public interface OutlierModel {

  /**
   * Scores a feature vector.
   *
   * @param vector the vector to score
   * @return a {@link OutlierScore.Status#SCORED} result
   */
  OutlierScore score(FeatureVector vector);

  /**
   * Number of feature vectors the model was trained on.
   */
  int trainedRows();

  /**
   * Short description for logs.
   */
  String describe();
}
