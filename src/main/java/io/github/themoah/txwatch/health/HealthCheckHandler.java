package io.github.themoah.txwatch.health;

import io.github.themoah.txwatch.engine.EngineSnapshot;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final Supplier<EngineSnapshot> snapshots;

  public HealthCheckHandler(Supplier<EngineSnapshot> snapshots) {
    this.snapshots = snapshots;
  }

  /**
   * Registers health check routes on the router.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  /**
   * Liveness probe. Always 200 while the server responds.
   */
  private void handleLiveness(RoutingContext ctx) {
    HealthCheckResponse response = HealthCheckResponse.liveness();
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(200)
      .end(response.toJson().encode());
  }

  /**
   * Readiness probe. 200 once a baseline snapshot is published, 503 before.
   */
  private void handleReadiness(RoutingContext ctx) {
    HealthCheckResponse response = HealthCheckResponse.readiness(snapshots.get());
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.isUp() ? 200 : 503)
      .end(response.toJson().encode());
  }
}
