package io.github.themoah.txwatch.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";
  private static final Duration DEFAULT_OTLP_STEP = Duration.ofSeconds(60);

  private MicrometerConfig() {}

  /**
   * Creates a Prometheus meter registry, scraped through {@link PrometheusHandler}.
   */
  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP (HTTP, cumulative) registry. Endpoint from OTLP_ENDPOINT or
   * OTEL_EXPORTER_OTLP_METRICS_ENDPOINT, push interval from OTLP_STEP_MS.
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        String url = System.getenv("OTLP_ENDPOINT");
        if (url == null || url.isBlank()) {
          url = System.getenv("OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
        }
        return (url != null && !url.isBlank()) ? url : DEFAULT_OTLP_URL;
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        String stepMs = System.getenv("OTLP_STEP_MS");
        if (stepMs != null && !stepMs.isBlank()) {
          try {
            return Duration.ofMillis(Long.parseLong(stepMs));
          } catch (NumberFormatException e) {
            log.warn("Invalid OTLP_STEP_MS: {}, using default 60s", stepMs);
          }
        }
        return DEFAULT_OTLP_STEP;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        String serviceName = System.getenv("OTEL_SERVICE_NAME");
        return Map.of("service.name", serviceName != null && !serviceName.isBlank() ? serviceName : "txwatch");
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}", config.url());
    return registry;
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType "prometheus" or "otlp"
   * @return the configured MeterRegistry, or null if the type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase()) {
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }
}
