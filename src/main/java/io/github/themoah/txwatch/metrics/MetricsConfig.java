package io.github.themoah.txwatch.metrics;

import io.github.themoah.txwatch.config.EnvVars;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration.
 *
 * @param enabled whether metrics are recorded and exported
 * @param reporterType "prometheus" or "otlp"
 * @param jvmMetricsEnabled whether JVM binders are registered
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";

  /**
   * Loads METRICS_ENABLED (default true), METRICS_REPORTER (default prometheus)
   * and METRICS_JVM (default true).
   */
  public static MetricsConfig fromEnvironment() {
    EnvVars env = EnvVars.system();
    MetricsConfig config = new MetricsConfig(
      env.getBoolean("METRICS_ENABLED", true),
      env.getString("METRICS_REPORTER", DEFAULT_REPORTER),
      env.getBoolean("METRICS_JVM", true)
    );
    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}",
      config.enabled, config.reporterType, config.jvmMetricsEnabled);
    return config;
  }
}
