package io.github.themoah.txwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the isolation forest.
 *
 * @param enabled whether the multivariate model is trained at all
 * @param trees number of isolation trees (default 100)
 * @param subsampleSize target number of vectors per tree (default 256)
 * @param minTrainingVectors minimum feature vectors needed to (re)train (default 24)
 * @param contamination expected share of anomalous training windows, sets the label threshold (default 0.05)
 * @param scoreFloor lowest label threshold regardless of calibration (default 0.55)
 */
public record ModelConfig(
  boolean enabled,
  int trees,
  int subsampleSize,
  int minTrainingVectors,
  double contamination,
  double scoreFloor
) {

  private static final Logger log = LoggerFactory.getLogger(ModelConfig.class);

  private static final boolean DEFAULT_ENABLED = true;
  private static final int DEFAULT_TREES = 100;
  private static final int DEFAULT_SUBSAMPLE_SIZE = 256;
  private static final int DEFAULT_MIN_TRAINING_VECTORS = 24;
  private static final double DEFAULT_CONTAMINATION = 0.05;
  private static final double DEFAULT_SCORE_FLOOR = 0.55;

  public ModelConfig {
    if (trees < 1) {
      throw new IllegalArgumentException("trees must be positive");
    }
    if (subsampleSize < 2) {
      throw new IllegalArgumentException("subsampleSize must be at least 2");
    }
    if (minTrainingVectors < 2) {
      throw new IllegalArgumentException("minTrainingVectors must be at least 2");
    }
    if (contamination <= 0 || contamination >= 0.5) {
      throw new IllegalArgumentException("contamination must be in (0, 0.5)");
    }
  }

  public static ModelConfig defaults() {
    return new ModelConfig(
      DEFAULT_ENABLED,
      DEFAULT_TREES,
      DEFAULT_SUBSAMPLE_SIZE,
      DEFAULT_MIN_TRAINING_VECTORS,
      DEFAULT_CONTAMINATION,
      DEFAULT_SCORE_FLOOR
    );
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables: MODEL_ENABLED, MODEL_TREES, MODEL_SUBSAMPLE,
   * MODEL_MIN_TRAINING_VECTORS, MODEL_CONTAMINATION, MODEL_SCORE_FLOOR.
   */
  public static ModelConfig fromEnvironment() {
    return fromEnv(EnvVars.system());
  }

  static ModelConfig fromEnv(EnvVars env) {
    ModelConfig config = new ModelConfig(
      env.getBoolean("MODEL_ENABLED", DEFAULT_ENABLED),
      env.getInt("MODEL_TREES", DEFAULT_TREES),
      env.getInt("MODEL_SUBSAMPLE", DEFAULT_SUBSAMPLE_SIZE),
      env.getInt("MODEL_MIN_TRAINING_VECTORS", DEFAULT_MIN_TRAINING_VECTORS),
      env.getDouble("MODEL_CONTAMINATION", DEFAULT_CONTAMINATION),
      env.getDouble("MODEL_SCORE_FLOOR", DEFAULT_SCORE_FLOOR)
    );
    log.info("Model config: enabled={}, trees={}, subsample={}, minTrainingVectors={}, contamination={}, scoreFloor={}",
      config.enabled, config.trees, config.subsampleSize, config.minTrainingVectors,
      config.contamination, config.scoreFloor);
    return config;
  }
}
