package io.github.themoah.txwatch.health;

import io.github.themoah.txwatch.engine.EngineSnapshot;
import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param baseline "loaded" or "empty" (null for liveness check)
 * @param snapshotVersion active snapshot version (null for liveness check)
 * @param model "trained" or "untrained" (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String baseline,
  Long snapshotVersion,
  String model
) {
  /**
   * Creates a liveness response (HTTP server only).
   *
   * @return HealthCheckResponse with UP status
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null, null);
  }

  /**
   * Creates a readiness response. The service is ready once a baseline
   * snapshot has been published; a missing model only degrades scoring.
   *
   * @param snapshot the active engine snapshot
   * @return HealthCheckResponse with appropriate status
   */
  public static HealthCheckResponse readiness(EngineSnapshot snapshot) {
    boolean ready = snapshot.version() > 0;
    return new HealthCheckResponse(
      HealthStatus.of(ready),
      ready ? "loaded" : "empty",
      snapshot.version(),
      snapshot.hasModel() ? "trained" : "untrained"
    );
  }

  public boolean isUp() {
    return status == HealthStatus.UP;
  }

  /**
   * Converts to JSON for HTTP response.
   *
   * @return JsonObject representation
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (baseline != null) {
      json.put("baseline", baseline);
    }
    if (snapshotVersion != null) {
      json.put("snapshotVersion", snapshotVersion);
    }
    if (model != null) {
      json.put("model", model);
    }
    return json;
  }
}
