package io.github.themoah.txwatch.baseline;

import io.github.themoah.txwatch.baseline.StatisticalUtils.Stats;
import io.github.themoah.txwatch.config.DetectionConfig;
import io.github.themoah.txwatch.model.BaselineKey;
import io.github.themoah.txwatch.model.BaselineStats;
import io.github.themoah.txwatch.model.Observation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes per-(hour, status) baseline statistics.
 *
 * <p>The store keeps no state of its own: every call to
 * {@link #buildTable(List)} produces a complete, immutable
 * {@link BaselineTable}, which the engine publishes inside its snapshot
 * together with the model.
 */
public class BaselineStore {

  private static final Logger log = LoggerFactory.getLogger(BaselineStore.class);

  private final DetectionConfig config;

  public BaselineStore(DetectionConfig config) {
    this.config = config;
  }

  /**
   * Recomputes every entry from the given history.
   *
   * @param historicalObservations observations to group by (hour, status)
   * @return a new immutable table
   * @throws IllegalArgumentException if the history is null or empty
   */
  public BaselineTable buildTable(List<Observation> historicalObservations) {
    if (historicalObservations == null || historicalObservations.isEmpty()) {
      throw new IllegalArgumentException("no historical observations");
    }
    Map<BaselineKey, List<Long>> countsByKey = new HashMap<>();
    for (Observation observation : historicalObservations) {
      countsByKey.computeIfAbsent(observation.baselineKey(), k -> new ArrayList<>())
        .add(observation.count());
    }

    Map<BaselineKey, BaselineStats> entries = new HashMap<>();
    int insufficient = 0;
    for (Map.Entry<BaselineKey, List<Long>> entry : countsByKey.entrySet()) {
      BaselineStats stats = computeStats(entry.getValue());
      if (!stats.sufficient()) {
        insufficient++;
      }
      entries.put(entry.getKey(), stats);
    }

    log.info("Built baseline table: {} keys from {} observations ({} below {} samples)",
      entries.size(), historicalObservations.size(), insufficient, config.minSamples());
    return new BaselineTable(entries, historicalObservations.size());
  }

  BaselineStats computeStats(List<Long> counts) {
    Stats stats = StatisticalUtils.calculateStats(counts);

    double[] sorted = counts.stream().mapToDouble(Long::doubleValue).toArray();
    Arrays.sort(sorted);

    return new BaselineStats(
      stats.mean(),
      stats.stdDev(),
      StatisticalUtils.median(sorted),
      StatisticalUtils.scaledMad(sorted),
      StatisticalUtils.percentile(sorted, config.warningPercentile()),
      StatisticalUtils.percentile(sorted, config.criticalPercentile()),
      counts.size(),
      counts.size() >= config.minSamples()
    );
  }
}
