package io.github.themoah.txwatch.baseline;

import io.github.themoah.txwatch.model.BaselineKey;
import io.github.themoah.txwatch.model.BaselineStats;
import io.github.themoah.txwatch.model.TransactionStatus;
import java.util.Map;

/**
 * Immutable (hour, status) to statistics table. A table is built once and
 * published as a whole; readers never see a partially built table.
 */
public final class BaselineTable {

  private static final BaselineTable EMPTY = new BaselineTable(Map.of(), 0);

  private final Map<BaselineKey, BaselineStats> entries;
  private final int observationCount;

  BaselineTable(Map<BaselineKey, BaselineStats> entries, int observationCount) {
    this.entries = Map.copyOf(entries);
    this.observationCount = observationCount;
  }

  public static BaselineTable empty() {
    return EMPTY;
  }

  /**
   * Returns the statistics for a key, or {@link BaselineStats#none()} when
   * there is no history for it. Entries below the minimum sample count are
   * already marked insufficient.
   */
  public BaselineStats get(int hour, TransactionStatus status) {
    return get(new BaselineKey(hour, status));
  }

  public BaselineStats get(BaselineKey key) {
    return entries.getOrDefault(key, BaselineStats.none());
  }

  public Map<BaselineKey, BaselineStats> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Number of historical observations the table was built from.
   */
  public int observationCount() {
    return observationCount;
  }
}
