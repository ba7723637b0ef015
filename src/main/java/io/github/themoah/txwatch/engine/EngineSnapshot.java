package io.github.themoah.txwatch.engine;

import io.github.themoah.txwatch.baseline.BaselineTable;
import io.github.themoah.txwatch.model.FeatureVector;
import io.github.themoah.txwatch.model.OutlierScore;
import io.github.themoah.txwatch.outlier.OutlierModel;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable bundle of a baseline table and the outlier model, published as
 * one unit.
 */
public final class EngineSnapshot {

  private final long version;
  private final BaselineTable baseline;
  private final OutlierModel model;
  private final long modelVersion;
  private final Instant createdAt;

  /**
   * @param version snapshot version, incremented on every published rebuild
   * @param baseline the baseline table
   * @param model the trained model, or null when none has been trained
   * @param modelVersion snapshot version the model was trained in, 0 when untrained
   * @param createdAt publication time
   */
  public EngineSnapshot(
      long version,
      BaselineTable baseline,
      OutlierModel model,
      long modelVersion,
      Instant createdAt
  ) {
    this.version = version;
    this.baseline = Objects.requireNonNull(baseline, "baseline");
    this.model = model;
    this.modelVersion = modelVersion;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * The snapshot in effect before the first rebuild: empty baseline, no model.
   */
  public static EngineSnapshot initial(Instant now) {
    return new EngineSnapshot(0L, BaselineTable.empty(), null, 0L, now);
  }

  /**
   * Scores a vector with this snapshot's model, or reports it as untrained.
   */
  public OutlierScore scoreOutlier(FeatureVector vector) {
    if (model == null) {
      return OutlierScore.untrained();
    }
    return model.score(vector);
  }

  public long version() {
    return version;
  }

  public BaselineTable baseline() {
    return baseline;
  }

  public Optional<OutlierModel> model() {
    return Optional.ofNullable(model);
  }

  public boolean hasModel() {
    return model != null;
  }

  public long modelVersion() {
    return modelVersion;
  }

  public Instant createdAt() {
    return createdAt;
  }

  @Override
  public String toString() {
    return "EngineSnapshot{version=" + version
      + ", baselineKeys=" + baseline.size()
      + ", model=" + (model == null ? "none" : model.describe())
      + ", modelVersion=" + modelVersion
      + ", createdAt=" + createdAt + "}";
  }
}
