package io.github.themoah.txwatch.engine;

import io.github.themoah.txwatch.baseline.BaselineStore;
import io.github.themoah.txwatch.config.DetectionConfig;
import io.github.themoah.txwatch.config.ModelConfig;
import io.github.themoah.txwatch.metrics.EngineMetrics;
import io.github.themoah.txwatch.model.AnomalyVerdict;
import io.github.themoah.txwatch.model.BaselineStats;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.model.OutlierScore;
import io.github.themoah.txwatch.model.ScoreResult;
import io.github.themoah.txwatch.model.TransactionStatus;
import io.github.themoah.txwatch.notification.NotificationAggregator;
import io.github.themoah.txwatch.notification.NotificationSummary;
import io.github.themoah.txwatch.outlier.IsolationForestTrainer;
import io.github.themoah.txwatch.scoring.Decision;
import io.github.themoah.txwatch.scoring.DecisionCombiner;
import io.github.themoah.txwatch.scoring.FeatureBuilder;
import io.github.themoah.txwatch.scoring.StatisticalScorer;
import io.github.themoah.txwatch.scoring.WindowFeatures;
import io.github.themoah.txwatch.scoring.WindowFeatures.Totals;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores observation batches and rebuilds the baseline/model snapshot.
 *
 * <p>{@link #rebuild(List)} is the only mutation entry point. Scoring reads
 * the current snapshot once per batch, so a rebuild published mid-batch does
 * not affect the batch in flight.
 */
public class AnomalyEngine {

  private static final Logger log = LoggerFactory.getLogger(AnomalyEngine.class);

  private final SnapshotManager snapshots;
  private final FeatureBuilder featureBuilder;
  private final StatisticalScorer scorer;
  private final DecisionCombiner combiner;
  private final NotificationAggregator aggregator;
  private final EngineMetrics metrics;

  public AnomalyEngine(
      SnapshotManager snapshots,
      FeatureBuilder featureBuilder,
      StatisticalScorer scorer,
      DecisionCombiner combiner,
      NotificationAggregator aggregator,
      EngineMetrics metrics
  ) {
    this.snapshots = snapshots;
    this.featureBuilder = featureBuilder;
    this.scorer = scorer;
    this.combiner = combiner;
    this.aggregator = aggregator;
    this.metrics = metrics;
    metrics.bindSnapshotGauges(snapshots::current);
  }

  /**
   * Wires an engine with the isolation forest trainer (unless disabled).
   */
  public static AnomalyEngine create(
      DetectionConfig detectionConfig,
      ModelConfig modelConfig,
      EngineMetrics metrics,
      Clock clock
  ) {
    FeatureBuilder featureBuilder = new FeatureBuilder();
    SnapshotManager snapshots = new SnapshotManager(
      new BaselineStore(detectionConfig),
      featureBuilder,
      modelConfig.enabled() ? new IsolationForestTrainer(modelConfig) : null,
      clock
    );
    return new AnomalyEngine(
      snapshots,
      featureBuilder,
      new StatisticalScorer(),
      new DecisionCombiner(detectionConfig),
      new NotificationAggregator(clock),
      metrics
    );
  }

  public IngestResult ingest(List<Observation> batch) {
    return ingest(batch, null);
  }

  /**
   * Scores a batch against the current snapshot.
   *
   * @param batch observations to score
   * @param previous totals of the window preceding the batch, or null
   * @return verdicts and their summary
   */
  public IngestResult ingest(List<Observation> batch, Totals previous) {
    return metrics.timeIngest(() -> score(batch, snapshots.current(), previous));
  }

  /**
   * Scores a batch against a given snapshot.
   *
   * @param batch observations to score
   * @param snapshot the snapshot to score against
   * @param previous totals of the window preceding the batch, or null
   * @return verdicts tagged with the snapshot's version
   */
  public IngestResult score(List<Observation> batch, EngineSnapshot snapshot, Totals previous) {
    List<WindowFeatures> windows = featureBuilder.buildWindows(batch, previous);
    List<AnomalyVerdict> verdicts = new ArrayList<>();

    for (WindowFeatures window : windows) {
      OutlierScore windowOutlier = null;

      for (Map.Entry<TransactionStatus, Long> entry : window.counts().entrySet()) {
        TransactionStatus status = entry.getKey();
        long count = entry.getValue();
        BaselineStats stats = snapshot.baseline().get(window.bucket().hour(), status);

        ScoreResult scores = scorer.score(count, stats);
        if (stats.sufficient()) {
          if (windowOutlier == null) {
            windowOutlier = snapshot.scoreOutlier(window.features());
          }
          scores = scores.withOutlier(windowOutlier);
        }

        Decision decision = combiner.decide(count, stats, scores);
        verdicts.add(new AnomalyVerdict(
          window.bucket(),
          status,
          count,
          decision.severity(),
          decision.reason(),
          scores,
          snapshot.version()
        ));

        log.debug("Scored {} {}: count={}, severity={}, reason={}",
          window.bucket(), status.getValue(), count, decision.severity().getValue(), decision.reason());
      }
    }

    NotificationSummary summary = aggregator.aggregate(verdicts);
    metrics.recordVerdicts(verdicts);
    if (!summary.isEmpty()) {
      log.info("Batch of {} observations scored against snapshot v{}: {}",
        batch.size(), snapshot.version(), summary.subject());
    }
    return new IngestResult(verdicts, summary, snapshot.version());
  }

  /**
   * Rebuilds the baseline and, when possible, retrains the model.
   *
   * @param historical the complete history to build from
   * @return the rebuild outcome
   */
  public RebuildResult rebuild(List<Observation> historical) {
    RebuildResult result = snapshots.rebuild(historical);
    metrics.recordRebuild(result);
    return result;
  }

  public EngineSnapshot currentSnapshot() {
    return snapshots.current();
  }
}
