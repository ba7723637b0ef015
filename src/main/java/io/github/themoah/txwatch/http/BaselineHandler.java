package io.github.themoah.txwatch.http;

import io.github.themoah.txwatch.engine.AnomalyEngine;
import io.github.themoah.txwatch.engine.RebuildResult;
import io.github.themoah.txwatch.history.ObservationHistory;
import io.github.themoah.txwatch.model.Observation;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * POST /baseline/rebuild: rebuilds the snapshot from the posted history.
 * Answers 200 when applied, 409 when coalesced into a running rebuild and
 * 422 when rejected.
 */
public class BaselineHandler {

  private static final Logger log = LoggerFactory.getLogger(BaselineHandler.class);

  private final Vertx vertx;
  private final AnomalyEngine engine;
  private final ObservationHistory history;

  public BaselineHandler(Vertx vertx, AnomalyEngine engine, ObservationHistory history) {
    this.vertx = vertx;
    this.engine = engine;
    this.history = history;
  }

  public void registerRoutes(Router router) {
    router.post("/baseline/rebuild").handler(BodyHandler.create()).handler(this::handleRebuild);
    log.info("Registered rebuild endpoint at /baseline/rebuild");
  }

  private void handleRebuild(RoutingContext ctx) {
    List<Observation> historical;
    try {
      historical = ObservationParser.parseObservations(JsonBodies.requireArray(ctx));
    } catch (IllegalArgumentException e) {
      log.warn("Rejected rebuild payload: {}", e.getMessage());
      JsonBodies.badRequest(ctx, e.getMessage());
      return;
    }

    vertx.executeBlocking(() -> engine.rebuild(historical), false)
      .onSuccess(result -> {
        if (result.isApplied()) {
          history.replace(historical);
        }
        JsonBodies.reply(ctx, statusCode(result), ResponseJson.rebuild(result));
      })
      .onFailure(err -> JsonBodies.internalError(ctx, log, "Baseline rebuild", err));
  }

  static int statusCode(RebuildResult result) {
    return switch (result.outcome()) {
      case APPLIED -> 200;
      case COALESCED -> 409;
      case REJECTED -> 422;
    };
  }
}
