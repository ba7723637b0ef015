package io.github.themoah.txwatch;

import io.github.themoah.txwatch.checkout.CheckoutAnalyzer;
import io.github.themoah.txwatch.config.AppConfig;
import io.github.themoah.txwatch.config.CheckoutConfig;
import io.github.themoah.txwatch.config.DetectionConfig;
import io.github.themoah.txwatch.config.ModelConfig;
import io.github.themoah.txwatch.engine.AnomalyEngine;
import io.github.themoah.txwatch.engine.RebuildResult;
import io.github.themoah.txwatch.health.HealthCheckHandler;
import io.github.themoah.txwatch.history.ObservationHistory;
import io.github.themoah.txwatch.http.BaselineHandler;
import io.github.themoah.txwatch.http.CheckoutHandler;
import io.github.themoah.txwatch.http.IngestHandler;
import io.github.themoah.txwatch.http.ObservationParser;
import io.github.themoah.txwatch.http.QueryHandler;
import io.github.themoah.txwatch.metrics.EngineMetrics;
import io.github.themoah.txwatch.metrics.MetricsConfig;
import io.github.themoah.txwatch.metrics.MicrometerConfig;
import io.github.themoah.txwatch.metrics.PrometheusHandler;
import io.github.themoah.txwatch.model.Observation;
import io.github.themoah.txwatch.notification.AlertFormatter;
import io.github.themoah.txwatch.notification.LoggingAlertNotifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for txwatch.
 * Wires the anomaly engine, loads the startup baseline and starts the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private AnomalyEngine engine;
  private ObservationHistory history;
  private MeterRegistry meterRegistry;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting txwatch MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    DetectionConfig detectionConfig = DetectionConfig.fromEnvironment();
    ModelConfig modelConfig = ModelConfig.fromEnvironment();
    CheckoutConfig checkoutConfig = CheckoutConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();

    Router router = Router.router(vertx);

    EngineMetrics metrics = createMetrics(metricsConfig, router);
    Clock clock = Clock.systemUTC();
    engine = AnomalyEngine.create(detectionConfig, modelConfig, metrics, clock);
    history = new ObservationHistory(appConfig.historyCapacity(), appConfig.rebuildVolumeThreshold());

    new HealthCheckHandler(engine::currentSnapshot).registerRoutes(router);
    new IngestHandler(vertx, engine, history, new LoggingAlertNotifier(new AlertFormatter(ZoneId.systemDefault())))
      .registerRoutes(router);
    new BaselineHandler(vertx, engine, history).registerRoutes(router);
    new CheckoutHandler(new CheckoutAnalyzer(checkoutConfig)).registerRoutes(router);
    new QueryHandler(history).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    loadStartupBaseline(appConfig.baselineCsvPath())
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("txwatch started successfully on port {}", appConfig.httpPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start txwatch", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping txwatch MainVerticle");

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopHttpServer
      .onSuccess(v -> {
        if (meterRegistry != null) {
          meterRegistry.close();
        }
        log.info("txwatch stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during txwatch shutdown", err);
        stopPromise.fail(err);
      });
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", port))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  /**
   * Reads the baseline CSV, if configured, and publishes the first snapshot.
   * An unreadable or malformed file fails startup; an unusable one only
   * leaves the service unready.
   */
  private Future<Void> loadStartupBaseline(String csvPath) {
    if (csvPath == null) {
      log.info("No BASELINE_CSV_PATH configured, waiting for POST /baseline/rebuild");
      return Future.succeededFuture();
    }

    log.info("Loading startup baseline from {}", csvPath);
    return vertx.fileSystem().readFile(csvPath)
      .compose(buffer -> vertx.<Void>executeBlocking(() -> {
        List<Observation> historical = ObservationParser.parseCsv(buffer.toString());
        RebuildResult result = engine.rebuild(historical);
        if (result.isApplied()) {
          history.replace(historical);
          log.info("Startup baseline loaded: {}", result.message());
        } else {
          log.warn("Startup baseline not applied ({}): {}", result.outcome().toValue(), result.message());
        }
        return null;
      }, false));
  }

  private EngineMetrics createMetrics(MetricsConfig config, Router router) {
    if (!config.enabled()) {
      log.info("Metrics reporting is disabled");
      return EngineMetrics.noop();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return EngineMetrics.noop();
    }
    meterRegistry = registry;

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    // Prometheus is pull-based and needs the scrape route
    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new EngineMetrics(registry);
  }
}
