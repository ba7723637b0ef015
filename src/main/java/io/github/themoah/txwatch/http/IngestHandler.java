package io.github.themoah.txwatch.http;

import io.github.themoah.txwatch.engine.AnomalyEngine;
import io.github.themoah.txwatch.engine.IngestResult;
import io.github.themoah.txwatch.history.ObservationHistory;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.notification.AlertNotifier;
import io.github.themoah.txwatch.scoring.WindowFeatures.Totals;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * POST /transactions: scores a batch, hands alerts to the notifier, records
 * the batch and triggers a background rebuild once enough new data arrived.
 */
public class IngestHandler {

  private static final Logger log = LoggerFactory.getLogger(IngestHandler.class);

  private final Vertx vertx;
  private final AnomalyEngine engine;
  private final ObservationHistory history;
  private final AlertNotifier notifier;

  public IngestHandler(Vertx vertx, AnomalyEngine engine, ObservationHistory history, AlertNotifier notifier) {
    this.vertx = vertx;
    this.engine = engine;
    this.history = history;
    this.notifier = notifier;
  }

  public void registerRoutes(Router router) {
    router.post("/transactions").handler(BodyHandler.create()).handler(this::handleIngest);
    log.info("Registered ingest endpoint at /transactions");
  }

  private void handleIngest(RoutingContext ctx) {
    List<Observation> batch;
    try {
      batch = ObservationParser.parseObservations(JsonBodies.requireArray(ctx));
    } catch (IllegalArgumentException e) {
      log.warn("Rejected transaction batch: {}", e.getMessage());
      JsonBodies.badRequest(ctx, e.getMessage());
      return;
    }

    vertx.executeBlocking(() -> process(batch), false)
      .onSuccess(result -> {
        notifier.deliver(result.summary())
          .onFailure(err -> log.error("Alert delivery failed for {}", result.summary(), err));
        JsonBodies.reply(ctx, 200, ResponseJson.ingest(result));
      })
      .onFailure(err -> JsonBodies.internalError(ctx, log, "Transaction scoring", err));
  }

  private IngestResult process(List<Observation> batch) {
    Totals previous = batch.stream()
      .map(Observation::bucket)
      .min(Comparator.naturalOrder())
      .map(history::previousWindowTotals)
      .orElse(null);

    IngestResult result = engine.ingest(batch, previous);
    history.append(batch);
    history.claimRebuild().ifPresent(this::rebuildInBackground);
    return result;
  }

  private void rebuildInBackground(List<Observation> snapshot) {
    log.info("Rebuild volume threshold reached, rebuilding from {} observations", snapshot.size());
    vertx.executeBlocking(() -> engine.rebuild(snapshot), false)
      .onSuccess(result -> log.info("Background rebuild {}: v{} ({})",
        result.outcome().toValue(), result.snapshotVersion(), result.message()))
      .onFailure(err -> log.error("Background rebuild failed", err));
  }
}
