package io.github.themoah.txwatch.model;

import java.util.OptionalDouble;

/**
 * Outcome of the checkout spike/drop comparison for one hour.
 *
 * @param hour hour of day
 * @param row the input row
 * @param pctVsYesterday percent change vs yesterday, empty when yesterday is 0
 * @param pctVsSameDayLastWeek percent change vs the same weekday last week
 * @param pctVsAvgLastWeek percent change vs the last-week average
 * @param pctVsAvgLastMonth percent change vs the last-month average
 * @param flag spike, drop or ok
 */
public record CheckoutComparison(
  int hour,
  CheckoutRow row,
  OptionalDouble pctVsYesterday,
  OptionalDouble pctVsSameDayLastWeek,
  OptionalDouble pctVsAvgLastWeek,
  OptionalDouble pctVsAvgLastMonth,
  Flag flag
) {

  /**
   * Checkout anomaly flag.
   */
  public enum Flag {
    SPIKE,
    DROP,
    OK;

    public String toValue() {
      return name().toLowerCase();
    }
  }
}
