package io.github.themoah.txwatch.outlier;

import io.github.themoah.txwatch.baseline.StatisticalUtils;
import io.github.themoah.txwatch.config.ModelConfig;
import io.github.themoah.txwatch.model.FeatureVector;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import smile.anomaly.IsolationForest;

/**
 * Trains Smile isolation forests on window feature vectors.
 *
 * <p>Each tree sees {@code min(subsampleSize, 0.9 n)} vectors. The label
 * threshold is the {@code 1 - contamination} quantile of the training scores,
 * raised to the configured floor when lower.
 */
public class IsolationForestTrainer implements OutlierModelTrainer {

  private static final Logger log = LoggerFactory.getLogger(IsolationForestTrainer.class);

  // Smile requires a sampling rate strictly below 1
  private static final double MAX_SAMPLING_RATE = 0.9;

  private final ModelConfig config;

  public IsolationForestTrainer(ModelConfig config) {
    this.config = config;
  }

  @Override
  public int minTrainingVectors() {
    return config.minTrainingVectors();
  }

  @Override
  public OutlierModel fit(List<FeatureVector> vectors) {
    if (vectors.size() < config.minTrainingVectors() || vectors.size() < 2) {
      throw new IllegalArgumentException("Need at least " + config.minTrainingVectors()
        + " feature vectors to train, got " + vectors.size());
    }

    double[][] data = vectors.stream().map(FeatureVector::toArray).toArray(double[][]::new);

    double samplingRate = Math.min(MAX_SAMPLING_RATE, config.subsampleSize() / (double) data.length);
    int perTree = Math.max(2, (int) Math.round(samplingRate * data.length));
    int maxDepth = (int) Math.ceil(Math.log(perTree) / Math.log(2));

    log.info("Training isolation forest: rows={}, trees={}, samplingRate={}, maxDepth={}",
      data.length, config.trees(), String.format("%.3f", samplingRate), maxDepth);
    IsolationForest forest = IsolationForest.fit(data, config.trees(), maxDepth, samplingRate, 0);

    double[] scores = new double[data.length];
    for (int i = 0; i < data.length; i++) {
      scores[i] = forest.score(data[i]);
    }
    Arrays.sort(scores);
    double calibrated = StatisticalUtils.percentile(scores, (1.0 - config.contamination()) * 100.0);
    double threshold = Math.max(config.scoreFloor(), calibrated);

    log.info("Calibrated isolation forest threshold: quantile={}, floor={}, threshold={}",
      String.format("%.3f", calibrated), config.scoreFloor(), String.format("%.3f", threshold));

    return new IsolationForestModel(forest, threshold, data.length, config.trees());
  }
}
