package io.github.themoah.txwatch.history;

import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.model.TimeBucket;
import io.github.themoah.txwatch.model.TransactionStatus;
import io.github.themoah.txwatch.scoring.WindowFeatures.Totals;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded record of ingested observations, the input of periodic rebuilds.
 *
 * <p>Keeps at most {@code capacity} observations in arrival order and evicts
 * the oldest first. Tracks how many observations arrived since the last
 * rebuild was claimed. All methods are synchronized on the instance.
 */
public class ObservationHistory {

  private static final Logger log = LoggerFactory.getLogger(ObservationHistory.class);

  private final ArrayDeque<Observation> observations;
  private final int capacity;
  private final int rebuildThreshold;
  private int pending = 0;
  private boolean hasLoggedEviction = false;

  public ObservationHistory(int capacity, int rebuildThreshold) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    if (rebuildThreshold <= 0) {
      throw new IllegalArgumentException("rebuildThreshold must be positive");
    }
    this.capacity = capacity;
    this.rebuildThreshold = rebuildThreshold;
    this.observations = new ArrayDeque<>(Math.min(capacity, 1024));
  }

  /**
   * Replaces the whole history with the observations a rebuild was applied
   * from. The pending counter is reset; the replacement does not count
   * towards the next rebuild.
   */
  public synchronized void replace(List<Observation> historical) {
    observations.clear();
    pending = 0;
    historical.forEach(this::add);
  }

  /**
   * Appends freshly ingested observations.
   *
   * @return observations pending since the last claimed rebuild
   */
  public synchronized int append(List<Observation> batch) {
    batch.forEach(this::add);
    pending += batch.size();
    return pending;
  }

  private void add(Observation observation) {
    if (observations.size() >= capacity) {
      observations.removeFirst();
      if (!hasLoggedEviction) {
        log.info("Observation history reached capacity {}, evicting oldest entries", capacity);
        hasLoggedEviction = true;
      }
    }
    observations.addLast(observation);
  }

  public synchronized boolean shouldRebuild() {
    return pending >= rebuildThreshold;
  }

  /**
   * Claims a rebuild when the pending volume reached the threshold. The
   * pending counter is reset, so concurrent callers claim at most once.
   *
   * @return the history to rebuild from, or empty when below the threshold
   */
  public synchronized Optional<List<Observation>> claimRebuild() {
    if (pending < rebuildThreshold) {
      return Optional.empty();
    }
    log.debug("Claiming rebuild after {} new observations", pending);
    pending = 0;
    return Optional.of(new ArrayList<>(observations));
  }

  public synchronized List<Observation> snapshot() {
    return new ArrayList<>(observations);
  }

  /**
   * Recorded observations matching all given filters, in recorded order.
   *
   * @param start earliest bucket, inclusive, or null
   * @param end latest bucket, inclusive, or null
   * @param status status to match, or null for all
   */
  public synchronized List<Observation> query(TimeBucket start, TimeBucket end, TransactionStatus status) {
    return observations.stream()
      .filter(o -> start == null || o.bucket().compareTo(start) >= 0)
      .filter(o -> end == null || o.bucket().compareTo(end) <= 0)
      .filter(o -> status == null || o.status() == status)
      .toList();
  }

  /**
   * Totals of the most recent window, when it precedes {@code firstBucket}.
   * A window is the run of observations with the same bucket at the tail of
   * the history. A later or equal bucket means a new day started, so there
   * is no previous window.
   *
   * @param firstBucket earliest bucket of the batch about to be scored
   * @return the previous window's totals, or null
   */
  public synchronized Totals previousWindowTotals(TimeBucket firstBucket) {
    if (observations.isEmpty()) {
      return null;
    }
    TimeBucket last = observations.peekLast().bucket();
    if (last.compareTo(firstBucket) >= 0) {
      return null;
    }

    long total = 0;
    long bad = 0;
    Iterator<Observation> it = observations.descendingIterator();
    while (it.hasNext()) {
      Observation observation = it.next();
      if (!observation.bucket().equals(last)) {
        break;
      }
      total += observation.count();
      if (observation.status().isUnfavorable()) {
        bad += observation.count();
      }
    }
    return new Totals(total, total == 0 ? 0.0 : (double) bad / total);
  }

  public synchronized int size() {
    return observations.size();
  }

  public synchronized int pending() {
    return pending;
  }

  public int capacity() {
    return capacity;
  }
}
