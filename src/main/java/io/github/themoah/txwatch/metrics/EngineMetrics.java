package io.github.themoah.txwatch.metrics;

import io.github.themoah.txwatch.engine.EngineSnapshot;
import io.github.themoah.txwatch.engine.RebuildResult;
import io.github.themoah.txwatch.model.AnomalyVerdict;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import java.util.List;
import java.util.function.Supplier;

/**
 * Micrometer meters of the scoring engine.
 *
 * <ul>
 *   <li>txwatch.verdicts{severity} - verdicts produced</li>
 *   <li>txwatch.rebuilds{outcome} - rebuild requests by outcome</li>
 *   <li>txwatch.snapshot.version - active snapshot version</li>
 *   <li>txwatch.model.available - 1 when the active snapshot has a model</li>
 *   <li>txwatch.ingest.duration - batch scoring time</li>
 * </ul>
 */
public class EngineMetrics {

  private final MeterRegistry registry;
  private final Timer ingestTimer;

  public EngineMetrics(MeterRegistry registry) {
    this.registry = registry;
    this.ingestTimer = Timer.builder("txwatch.ingest.duration")
      .description("Time to score one observation batch")
      .register(registry);
  }

  /**
   * Metrics that are recorded nowhere, for when reporting is disabled.
   */
  public static EngineMetrics noop() {
    return new EngineMetrics(new CompositeMeterRegistry());
  }

  public void bindSnapshotGauges(Supplier<EngineSnapshot> snapshot) {
    Gauge.builder("txwatch.snapshot.version", snapshot, s -> s.get().version())
      .strongReference(true)
      .register(registry);
    Gauge.builder("txwatch.model.available", snapshot, s -> s.get().hasModel() ? 1 : 0)
      .strongReference(true)
      .register(registry);
  }

  public <T> T timeIngest(Supplier<T> work) {
    return ingestTimer.record(work);
  }

  public void recordVerdicts(List<AnomalyVerdict> verdicts) {
    for (AnomalyVerdict verdict : verdicts) {
      registry.counter("txwatch.verdicts", "severity", verdict.severity().getValue()).increment();
    }
  }

  public void recordRebuild(RebuildResult result) {
    registry.counter("txwatch.rebuilds", "outcome", result.outcome().toValue()).increment();
  }

  public MeterRegistry registry() {
    return registry;
  }
}
