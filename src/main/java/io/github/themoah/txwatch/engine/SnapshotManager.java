package io.github.themoah.txwatch.engine;

import io.github.themoah.txwatch.baseline.BaselineStore;
import io.github.themoah.txwatch.baseline.BaselineTable;
import io.github.themoah.txwatch.model.FeatureVector;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.outlier.OutlierModel;
import io.github.themoah.txwatch.outlier.OutlierModelTrainer;
import io.github.themoah.txwatch.scoring.FeatureBuilder;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the published {@link EngineSnapshot}.
 *
 * <p>The snapshot pointer is the only shared mutable state of the engine.
 * Readers take the current snapshot once and use it for a whole batch.
 * Rebuilds are single-flight: a call made while another rebuild runs returns
 * {@link RebuildResult.Outcome#COALESCED} immediately.
 */
public class SnapshotManager {

  private static final Logger log = LoggerFactory.getLogger(SnapshotManager.class);

  private final BaselineStore baselineStore;
  private final FeatureBuilder featureBuilder;
  private final OutlierModelTrainer trainer;
  private final Clock clock;
  private final AtomicReference<EngineSnapshot> current;
  private final AtomicBoolean rebuilding = new AtomicBoolean(false);

  /**
   * @param baselineStore builds baseline tables
   * @param featureBuilder builds training vectors
   * @param trainer model trainer, or null to run statistics-only
   * @param clock clock for snapshot timestamps
   */
  public SnapshotManager(
      BaselineStore baselineStore,
      FeatureBuilder featureBuilder,
      OutlierModelTrainer trainer,
      Clock clock
  ) {
    this.baselineStore = baselineStore;
    this.featureBuilder = featureBuilder;
    this.trainer = trainer;
    this.clock = clock;
    this.current = new AtomicReference<>(EngineSnapshot.initial(clock.instant()));
  }

  public EngineSnapshot current() {
    return current.get();
  }

  public boolean isRebuilding() {
    return rebuilding.get();
  }

  /**
   * Rebuilds the baseline from the given history and, when enough feature
   * vectors are available, retrains the model; then publishes the result as
   * a new snapshot. With too few vectors the previous model is carried over.
   *
   * @param historical the complete history to build from
   * @return the rebuild outcome
   */
  public RebuildResult rebuild(List<Observation> historical) {
    if (historical == null || historical.isEmpty()) {
      long version = current.get().version();
      log.warn("Rebuild rejected: no historical observations, keeping snapshot v{}", version);
      return RebuildResult.rejected(version, "no historical observations; previous snapshot remains active");
    }

    if (!rebuilding.compareAndSet(false, true)) {
      long version = current.get().version();
      log.info("Rebuild already in progress, coalescing request (active snapshot v{})", version);
      return RebuildResult.coalesced(version);
    }

    EngineSnapshot previous = current.get();
    try {
      long nextVersion = previous.version() + 1;
      BaselineTable table = baselineStore.buildTable(historical);

      OutlierModel model = previous.model().orElse(null);
      long modelVersion = previous.modelVersion();
      boolean retrained = false;

      if (trainer != null) {
        List<FeatureVector> vectors = featureBuilder.trainingVectors(historical);
        if (vectors.size() >= trainer.minTrainingVectors()) {
          model = trainer.fit(vectors);
          modelVersion = nextVersion;
          retrained = true;
        } else {
          log.info("Only {} feature vectors (need {}), keeping model from snapshot v{}",
            vectors.size(), trainer.minTrainingVectors(), previous.modelVersion());
        }
      }

      EngineSnapshot next = new EngineSnapshot(nextVersion, table, model, modelVersion, clock.instant());
      current.set(next);
      log.info("Published {}", next);

      String message = String.format("baseline rebuilt from %d observations (%d keys); %s",
        historical.size(), table.size(),
        retrained ? "model retrained" : (model == null ? "no model" : "model kept from v" + modelVersion));
      return RebuildResult.applied(nextVersion, retrained, message);
    } catch (RuntimeException e) {
      log.error("Rebuild failed, keeping snapshot v{}", previous.version(), e);
      return RebuildResult.rejected(previous.version(), "rebuild failed: " + e.getMessage());
    } finally {
      rebuilding.set(false);
    }
  }
}
