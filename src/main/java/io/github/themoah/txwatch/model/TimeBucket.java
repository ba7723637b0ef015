package io.github.themoah.txwatch.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hour-of-day bucket in the {@code "HHh MM"} notation used by the transaction feed.
 *
 * @param hour hour of day, 0-23
 * @param minute minute of hour, 0-59
 */
public record TimeBucket(int hour, int minute) implements Comparable<TimeBucket> {

  private static final Pattern LABEL = Pattern.compile("^(\\d{2})h(?: (\\d{2}))?$");

  public TimeBucket {
    if (hour < 0 || hour > 23) {
      throw new IllegalArgumentException("Hour out of range: " + hour);
    }
    if (minute < 0 || minute > 59) {
      throw new IllegalArgumentException("Minute out of range: " + minute);
    }
  }

  /**
   * Parses a label such as {@code "08h 15"}. The checkout feed uses whole
   * hours ({@code "08h"}), read as minute 0.
   *
   * @param label the time label
   * @return the parsed bucket
   * @throws IllegalArgumentException if the label is not in "HHh MM" form
   */
  public static TimeBucket parse(String label) {
    if (label == null) {
      throw new IllegalArgumentException("Time is required");
    }
    Matcher matcher = LABEL.matcher(label.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid time '" + label + "', expected HHh MM");
    }
    int minute = matcher.group(2) == null ? 0 : Integer.parseInt(matcher.group(2));
    return new TimeBucket(Integer.parseInt(matcher.group(1)), minute);
  }

  public String label() {
    return String.format("%02dh %02d", hour, minute);
  }

  @Override
  public int compareTo(TimeBucket other) {
    int byHour = Integer.compare(hour, other.hour);
    return byHour != 0 ? byHour : Integer.compare(minute, other.minute);
  }

  @Override
  public String toString() {
    return label();
  }
}
