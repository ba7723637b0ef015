package io.github.themoah.txwatch.model;

/**
 * Checkout volume for one hour compared with its historical references.
 *
 * @param time the "HHh MM" label
 * @param today today's count
 * @param yesterday yesterday's count at the same time
 * @param sameDayLastWeek count on the same weekday last week
 * @param avgLastWeek average over the last week
 * @param avgLastMonth average over the last month
 */
public record CheckoutRow(
  TimeBucket time,
  double today,
  double yesterday,
  double sameDayLastWeek,
  double avgLastWeek,
  double avgLastMonth
) {}
