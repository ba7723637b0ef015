package io.github.themoah.txwatch.http;

import io.github.themoah.txwatch.checkout.CheckoutAnalyzer;
import io.github.themoah.txwatch.model.CheckoutRow;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * POST /checkout/analyze: hourly checkout spike/drop comparison.
 */
public class CheckoutHandler {

  private static final Logger log = LoggerFactory.getLogger(CheckoutHandler.class);

  private final CheckoutAnalyzer analyzer;

  public CheckoutHandler(CheckoutAnalyzer analyzer) {
    this.analyzer = analyzer;
  }

  public void registerRoutes(Router router) {
    router.post("/checkout/analyze").handler(BodyHandler.create()).handler(this::handleAnalyze);
    log.info("Registered checkout analysis endpoint at /checkout/analyze");
  }

  private void handleAnalyze(RoutingContext ctx) {
    List<CheckoutRow> rows;
    try {
      rows = ObservationParser.parseCheckoutRows(JsonBodies.requireArray(ctx));
    } catch (IllegalArgumentException e) {
      log.warn("Rejected checkout rows: {}", e.getMessage());
      JsonBodies.badRequest(ctx, e.getMessage());
      return;
    }
    JsonBodies.reply(ctx, 200, ResponseJson.checkout(analyzer.analyze(rows)));
  }
}
