package io.github.themoah.txwatch.outlier;

import io.github.themoah.txwatch.model.FeatureVector;
import io.github.themoah.txwatch.model.OutlierScore;
import java.util.Locale;
import smile.anomaly.IsolationForest;

/**
 * Isolation forest with its calibrated label threshold.
 */
public final class IsolationForestModel implements OutlierModel {

  private final IsolationForest forest;
  private final double threshold;
  private final int trainedRows;
  private final int trees;

  IsolationForestModel(IsolationForest forest, double threshold, int trainedRows, int trees) {
    this.forest = forest;
    this.threshold = threshold;
    this.trainedRows = trainedRows;
    this.trees = trees;
  }

  @Override
  public OutlierScore score(FeatureVector vector) {
    return OutlierScore.scored(forest.score(vector.toArray()), threshold);
  }

  public double threshold() {
    return threshold;
  }

  @Override
  public int trainedRows() {
    return trainedRows;
  }

  @Override
  public String describe() {
    return String.format(Locale.ROOT, "isolation forest (%d trees, %d rows, threshold %.3f, schema %s)",
      trees, trainedRows, threshold, FeatureVector.SCHEMA);
  }
}
