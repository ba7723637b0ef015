package io.github.themoah.txwatch.http;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import io.github.themoah.txwatch.model.CheckoutRow;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.model.TimeBucket;
import io.github.themoah.txwatch.model.TransactionStatus;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses request payloads and CSV files into model objects.
 *
 * <p>Every parse method throws {@link IllegalArgumentException} naming the
 * offending item or line, so bad input never reaches the engine.
 */
public final class ObservationParser {

  private static final String[] CSV_COLUMNS = {"time", "status", "count"};
  private static final String BOM = "\uFEFF";

  private ObservationParser() {}

  /**
   * Parses a JSON array of {@code {time, status, count}} objects.
   */
  public static List<Observation> parseObservations(JsonArray items) {
    List<Observation> observations = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      JsonObject item = objectAt(items, i);
      try {
        observations.add(new Observation(
          TimeBucket.parse(item.getString("time")),
          TransactionStatus.fromValue(item.getString("status")),
          parseCount(item.getValue("count"))
        ));
      } catch (IllegalArgumentException | ClassCastException e) {
        throw new IllegalArgumentException("Item " + i + ": " + e.getMessage(), e);
      }
    }
    return observations;
  }

  /**
   * Parses CSV text with a {@code time,status,count} header. Column order is
   * taken from the header, quoted fields are unquoted, a leading byte order
   * mark is dropped and blank lines are skipped.
   */
  public static List<Observation> parseCsv(String content) {
    String text = content.startsWith(BOM) ? content.substring(1) : content;
    try (CSVReader reader = new CSVReaderBuilder(new StringReader(text))
        .withCSVParser(new RFC4180ParserBuilder().build())
        .build()) {
      String[] headerRecord = nextNonBlank(reader);
      if (headerRecord == null) {
        return List.of();
      }

      List<String> header = Arrays.stream(headerRecord)
        .map(column -> column.trim().toLowerCase())
        .toList();
      int[] index = new int[CSV_COLUMNS.length];
      for (int c = 0; c < CSV_COLUMNS.length; c++) {
        index[c] = header.indexOf(CSV_COLUMNS[c]);
        if (index[c] < 0) {
          throw new IllegalArgumentException("CSV header is missing column '" + CSV_COLUMNS[c] + "'");
        }
      }

      List<Observation> observations = new ArrayList<>();
      String[] fields;
      while ((fields = nextNonBlank(reader)) != null) {
        try {
          if (fields.length < header.size()) {
            throw new IllegalArgumentException("expected " + header.size() + " fields, got " + fields.length);
          }
          observations.add(new Observation(
            TimeBucket.parse(fields[index[0]].trim()),
            TransactionStatus.fromValue(fields[index[1]].trim()),
            parseCount(fields[index[2]].trim())
          ));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException("Line " + reader.getLinesRead() + ": " + e.getMessage(), e);
        }
      }
      return observations;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read CSV content", e);
    }
  }

  private static String[] nextNonBlank(CSVReader reader) throws IOException {
    String[] record;
    while ((record = readRecord(reader)) != null) {
      if (record.length > 1 || (record.length == 1 && !record[0].isBlank())) {
        return record;
      }
    }
    return null;
  }

  private static String[] readRecord(CSVReader reader) throws IOException {
    try {
      return reader.readNext();
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Line " + reader.getLinesRead() + ": " + e.getMessage(), e);
    }
  }

  /**
   * Parses checkout rows: {@code {time, today, yesterday, same_day_last_week,
   * avg_last_week, avg_last_month}}.
   */
  public static List<CheckoutRow> parseCheckoutRows(JsonArray items) {
    List<CheckoutRow> rows = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      JsonObject item = objectAt(items, i);
      try {
        rows.add(new CheckoutRow(
          TimeBucket.parse(item.getString("time")),
          volume(item, "today"),
          volume(item, "yesterday"),
          volume(item, "same_day_last_week"),
          volume(item, "avg_last_week"),
          volume(item, "avg_last_month")
        ));
      } catch (IllegalArgumentException | ClassCastException e) {
        throw new IllegalArgumentException("Item " + i + ": " + e.getMessage(), e);
      }
    }
    return rows;
  }

  /**
   * Parses an optional "HHh MM" filter value.
   *
   * @return the bucket, or null when the value is absent
   */
  public static TimeBucket optionalBucket(JsonObject filter, String field) {
    String value = filter.getString(field);
    return (value == null || value.isBlank()) ? null : TimeBucket.parse(value);
  }

  private static JsonObject objectAt(JsonArray items, int i) {
    Object value = items.getValue(i);
    if (!(value instanceof JsonObject object)) {
      throw new IllegalArgumentException("Item " + i + ": expected a JSON object");
    }
    return object;
  }

  static long parseCount(Object raw) {
    if (raw == null) {
      throw new IllegalArgumentException("Count is required");
    }
    long count;
    if (raw instanceof Number number) {
      if (number.doubleValue() != Math.rint(number.doubleValue())) {
        throw new IllegalArgumentException("Count must be a whole number: " + raw);
      }
      count = number.longValue();
    } else {
      try {
        count = Long.parseLong(raw.toString().trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid count: '" + raw + "'");
      }
    }
    if (count < 0) {
      throw new IllegalArgumentException("Count must not be negative: " + count);
    }
    return count;
  }

  private static double volume(JsonObject item, String field) {
    Object raw = item.getValue(field);
    if (!(raw instanceof Number number)) {
      throw new IllegalArgumentException("Field '" + field + "' must be a number");
    }
    double value = number.doubleValue();
    if (value < 0 || Double.isNaN(value)) {
      throw new IllegalArgumentException("Field '" + field + "' must not be negative");
    }
    return value;
  }
}
