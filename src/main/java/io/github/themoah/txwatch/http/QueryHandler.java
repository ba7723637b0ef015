package io.github.themoah.txwatch.http;

import io.github.themoah.txwatch.history.ObservationHistory;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.model.TimeBucket;
import io.github.themoah.txwatch.model.TransactionStatus;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * POST /query: recorded observations filtered by {@code start_hour},
 * {@code end_hour} and {@code status}, all optional.
 */
public class QueryHandler {

  private static final Logger log = LoggerFactory.getLogger(QueryHandler.class);

  private final ObservationHistory history;

  public QueryHandler(ObservationHistory history) {
    this.history = history;
  }

  public void registerRoutes(Router router) {
    router.post("/query").handler(BodyHandler.create()).handler(this::handleQuery);
    log.info("Registered query endpoint at /query");
  }

  private void handleQuery(RoutingContext ctx) {
    List<Observation> matches;
    try {
      JsonObject filter = JsonBodies.optionalObject(ctx);
      TimeBucket start = ObservationParser.optionalBucket(filter, "start_hour");
      TimeBucket end = ObservationParser.optionalBucket(filter, "end_hour");
      String statusValue = filter.getString("status");
      TransactionStatus status = statusValue == null ? null : TransactionStatus.fromValue(statusValue);
      matches = history.query(start, end, status);
    } catch (IllegalArgumentException | ClassCastException e) {
      JsonBodies.badRequest(ctx, e.getMessage());
      return;
    }
    JsonBodies.reply(ctx, 200, ResponseJson.observations(matches));
  }
}
