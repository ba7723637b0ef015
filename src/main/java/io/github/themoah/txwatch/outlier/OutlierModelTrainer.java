package io.github.themoah.txwatch.outlier;

import io.github.themoah.txwatch.model.FeatureVector;
import java.util.List;

/**
 * Trains outlier models. Training may be randomized; scoring with the
 * resulting model may not.
 */
public interface OutlierModelTrainer {

  /**
   * Minimum number of vectors {@link #fit} accepts.
   */
  int minTrainingVectors();

  /**
   * Trains a new model.
   *
   * @param vectors historical feature vectors
   * @return the trained model
   * @throws IllegalArgumentException if fewer than {@link #minTrainingVectors()} vectors are given
   */
  OutlierModel fit(List<FeatureVector> vectors);
}
