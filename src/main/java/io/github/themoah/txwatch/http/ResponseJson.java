package io.github.themoah.txwatch.http;

import io.github.themoah.txwatch.engine.IngestResult;
import io.github.themoah.txwatch.engine.RebuildResult;
import io.github.themoah.txwatch.model.AnomalyVerdict;
import io.github.themoah.txwatch.model.CheckoutComparison;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.model.OutlierScore;
import io.github.themoah.txwatch.model.ScoreResult;
import io.github.themoah.txwatch.model.Severity;
import io.github.themoah.txwatch.notification.NotificationSummary;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.OptionalDouble;

/**
 * JSON views of engine results. Absent scores are written as null.
 */
final class ResponseJson {

  static final String INGEST_MESSAGE = "Transactions processed successfully";

  private ResponseJson() {}

  static JsonObject ingest(IngestResult result) {
    JsonArray verdicts = new JsonArray();
    result.verdicts().forEach(v -> verdicts.add(verdict(v)));
    return new JsonObject()
      .put("message", INGEST_MESSAGE)
      .put("snapshotVersion", result.snapshotVersion())
      .put("verdicts", verdicts)
      .put("alerts", alerts(result.summary()));
  }

  static JsonObject verdict(AnomalyVerdict verdict) {
    JsonObject json = new JsonObject()
      .put("time", verdict.bucket().label())
      .put("status", verdict.status().getValue())
      .put("count", verdict.count())
      .put("severity", verdict.severity().getValue())
      .put("reason", verdict.reason())
      .put("snapshotVersion", verdict.snapshotVersion());
    putOptional(json, "score", verdict.scores().reportedScore());
    return json.put("scores", scores(verdict.scores()));
  }

  private static JsonObject scores(ScoreResult scores) {
    JsonObject json = new JsonObject();
    putOptional(json, "zScore", scores.zScore());
    putOptional(json, "madScore", scores.madScore());
    json.put("percentile", scores.percentileFlag().name().toLowerCase());

    OutlierScore outlier = scores.outlier();
    JsonObject model = new JsonObject().put("status", outlier.status().name().toLowerCase());
    if (outlier.isAvailable()) {
      model.put("score", outlier.score())
        .put("threshold", outlier.threshold())
        .put("anomalous", outlier.anomalous());
    }
    return json.put("model", model);
  }

  static JsonObject alerts(NotificationSummary summary) {
    JsonObject json = new JsonObject()
      .put("critical", summary.count(Severity.CRITICAL))
      .put("warning", summary.count(Severity.WARNING));
    if (!summary.isEmpty()) {
      json.put("subject", summary.subject());
    }
    return json;
  }

  static JsonObject rebuild(RebuildResult result) {
    return new JsonObject()
      .put("outcome", result.outcome().toValue())
      .put("snapshotVersion", result.snapshotVersion())
      .put("modelRetrained", result.modelRetrained())
      .put("message", result.message());
  }

  static JsonArray checkout(List<CheckoutComparison> comparisons) {
    JsonArray rows = new JsonArray();
    for (CheckoutComparison c : comparisons) {
      JsonObject row = new JsonObject()
        .put("hour", c.hour())
        .put("time", c.row().time().label())
        .put("today", c.row().today())
        .put("yesterday", c.row().yesterday())
        .put("same_day_last_week", c.row().sameDayLastWeek())
        .put("avg_last_week", c.row().avgLastWeek())
        .put("avg_last_month", c.row().avgLastMonth());
      putOptional(row, "pct_vs_yesterday", c.pctVsYesterday());
      putOptional(row, "pct_vs_same_day_last_week", c.pctVsSameDayLastWeek());
      putOptional(row, "pct_vs_avg_last_week", c.pctVsAvgLastWeek());
      putOptional(row, "pct_vs_avg_last_month", c.pctVsAvgLastMonth());
      rows.add(row.put("flag", c.flag().toValue()));
    }
    return rows;
  }

  static JsonArray observations(List<Observation> observations) {
    JsonArray items = new JsonArray();
    for (Observation o : observations) {
      items.add(new JsonObject()
        .put("time", o.bucket().label())
        .put("status", o.status().getValue())
        .put("count", o.count()));
    }
    return items;
  }

  static JsonObject error(String message) {
    return new JsonObject().put("error", message);
  }

  private static void putOptional(JsonObject json, String key, OptionalDouble value) {
    if (value.isPresent()) {
      json.put(key, value.getAsDouble());
    } else {
      json.putNull(key);
    }
  }
}
