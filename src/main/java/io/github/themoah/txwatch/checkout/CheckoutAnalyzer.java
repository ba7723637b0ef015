package io.github.themoah.txwatch.checkout;

import io.github.themoah.txwatch.config.CheckoutConfig;
import io.github.themoah.txwatch.model.CheckoutComparison;
import io.github.themoah.txwatch.model.CheckoutComparison.Flag;
import io.github.themoah.txwatch.model.CheckoutRow;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares today's hourly checkout volume with yesterday, last week and the
 * weekly/monthly averages, and flags spikes and drops.
 *
 * <p>A spike needs today at or above {@code spikeRatio} times both averages;
 * a drop needs today at or below {@code dropRatio} times both averages.
 */
public class CheckoutAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(CheckoutAnalyzer.class);

  private final CheckoutConfig config;

  public CheckoutAnalyzer(CheckoutConfig config) {
    this.config = config;
  }

  /**
   * @param rows hourly checkout rows, any order
   * @return one comparison per row, ordered by hour
   */
  public List<CheckoutComparison> analyze(List<CheckoutRow> rows) {
    List<CheckoutComparison> result = rows.stream()
      .sorted(Comparator.comparing(CheckoutRow::time))
      .map(this::compare)
      .toList();

    long spikes = result.stream().filter(c -> c.flag() == Flag.SPIKE).count();
    long drops = result.stream().filter(c -> c.flag() == Flag.DROP).count();
    log.debug("Checkout analysis of {} rows: {} spikes, {} drops", rows.size(), spikes, drops);
    return result;
  }

  CheckoutComparison compare(CheckoutRow row) {
    return new CheckoutComparison(
      row.time().hour(),
      row,
      percentChange(row.today(), row.yesterday()),
      percentChange(row.today(), row.sameDayLastWeek()),
      percentChange(row.today(), row.avgLastWeek()),
      percentChange(row.today(), row.avgLastMonth()),
      flag(row)
    );
  }

  private Flag flag(CheckoutRow row) {
    double today = row.today();
    if (today >= config.spikeRatio() * row.avgLastWeek()
        && today >= config.spikeRatio() * row.avgLastMonth()) {
      return Flag.SPIKE;
    }
    if (today <= config.dropRatio() * row.avgLastWeek()
        && today <= config.dropRatio() * row.avgLastMonth()) {
      return Flag.DROP;
    }
    return Flag.OK;
  }

  /**
   * Percent change rounded half-up to 2 decimals; empty when the reference is 0.
   */
  static OptionalDouble percentChange(double value, double reference) {
    if (reference == 0.0) {
      return OptionalDouble.empty();
    }
    double pct = 100.0 * (value - reference) / reference;
    return OptionalDouble.of(BigDecimal.valueOf(pct).setScale(2, RoundingMode.HALF_UP).doubleValue());
  }
}
