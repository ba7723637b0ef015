package io.github.themoah.txwatch.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.txwatch.model.CheckoutRow;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.model.TimeBucket;
import io.github.themoah.txwatch.model.TransactionStatus;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ObservationParser.
 */
public class ObservationParserTest {

  private static JsonObject item(Object time, Object status, Object count) {
    return new JsonObject().put("time", time).put("status", status).put("count", count);
  }

  @Test
  void parseObservations_valid() {
    JsonArray items = new JsonArray()
      .add(item("08h 15", "approved", 25))
      .add(item("08h 15", "BACKEND_REVERSED", 3L))
      .add(item("23h 59", "refunded", 0));

    List<Observation> observations = ObservationParser.parseObservations(items);

    assertEquals(3, observations.size());
    assertEquals(new Observation(TimeBucket.parse("08h 15"), TransactionStatus.APPROVED, 25), observations.get(0));
    assertEquals(TransactionStatus.BACKEND_REVERSED, observations.get(1).status());
    assertEquals(0, observations.get(2).count());
  }

  @Test
  void parseObservations_rejectsMalformedItems() {
    assertRejected(new JsonArray().add(item("8h 15", "approved", 1)), "Item 0");
    assertRejected(new JsonArray().add(item("08h 15", "chargeback", 1)), "Unknown transaction status");
    assertRejected(new JsonArray().add(new JsonObject().put("time", "08h 15").put("status", "approved")),
      "Count is required");
    assertRejected(new JsonArray().add(item("08h 15", "approved", -1)), "must not be negative");
    assertRejected(new JsonArray().add(item("08h 15", "approved", 1.5)), "whole number");
    assertRejected(new JsonArray().add(item("08h 15", "approved", 1)).add("oops"), "Item 1");
    assertRejected(new JsonArray().add(item("24h 00", "approved", 1)), "Hour out of range");
  }

  private static void assertRejected(JsonArray items, String expectedMessage) {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
      () -> ObservationParser.parseObservations(items));
    assertTrue(e.getMessage().contains(expectedMessage), e.getMessage());
  }

  @Test
  void parseCsv_headerOrderAndBlankLines() {
    String csv = "status,time,count\n"
      + "approved,08h 00,10\r\n"
      + "\n"
      + "denied,08h 00,2\n";

    List<Observation> observations = ObservationParser.parseCsv(csv);

    assertEquals(2, observations.size());
    assertEquals(Observation.of("08h 00", TransactionStatus.DENIED, 2), observations.get(1));
  }

  @Test
  void parseCsv_quotedFields() {
    String csv = "\"time\",\"status\",\"count\"\n"
      + "\"08h 00\",approved,5\n"
      + "\"09h 30\",\"backend_reversed\",\"7\"\n";

    List<Observation> observations = ObservationParser.parseCsv(csv);

    assertEquals(List.of(
      Observation.of("08h 00", TransactionStatus.APPROVED, 5),
      Observation.of("09h 30", TransactionStatus.BACKEND_REVERSED, 7)), observations);
  }

  @Test
  void parseCsv_leadingByteOrderMark() {
    List<Observation> observations = ObservationParser.parseCsv("\uFEFFtime,status,count\n08h 00,approved,5\n");

    assertEquals(List.of(Observation.of("08h 00", TransactionStatus.APPROVED, 5)), observations);
  }

  @Test
  void parseCsv_emptyContent() {
    assertTrue(ObservationParser.parseCsv("").isEmpty());
    assertTrue(ObservationParser.parseCsv("time,status,count\n").isEmpty());
  }

  @Test
  void parseCsv_reportsLineNumber() {
    IllegalArgumentException missingColumn = assertThrows(IllegalArgumentException.class,
      () -> ObservationParser.parseCsv("time,count\n08h 00,1\n"));
    assertTrue(missingColumn.getMessage().contains("status"));

    IllegalArgumentException badCount = assertThrows(IllegalArgumentException.class,
      () -> ObservationParser.parseCsv("time,status,count\n08h 00,approved,1\n08h 00,approved,x\n"));
    assertTrue(badCount.getMessage().startsWith("Line 3"), badCount.getMessage());
  }

  @Test
  void parseCheckoutRows_wholeHourLabels() {
    JsonArray items = new JsonArray().add(new JsonObject()
      .put("time", "07h")
      .put("today", 120)
      .put("yesterday", 100.5)
      .put("same_day_last_week", 90)
      .put("avg_last_week", 95)
      .put("avg_last_month", 97));

    CheckoutRow row = ObservationParser.parseCheckoutRows(items).get(0);

    assertEquals(new TimeBucket(7, 0), row.time());
    assertEquals(100.5, row.yesterday());
  }

  @Test
  void parseCheckoutRows_missingFieldRejected() {
    JsonArray items = new JsonArray().add(new JsonObject().put("time", "07h").put("today", 1));

    assertThrows(IllegalArgumentException.class, () -> ObservationParser.parseCheckoutRows(items));
  }
}
