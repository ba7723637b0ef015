package io.github.themoah.txwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param baselineCsvPath CSV file with historical observations loaded at startup, or null
 * @param historyCapacity maximum number of observations kept for rebuilds
 * @param rebuildVolumeThreshold new observations that trigger a baseline rebuild
 */
public record AppConfig(
  int httpPort,
  String baselineCsvPath,
  int historyCapacity,
  int rebuildVolumeThreshold
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final int DEFAULT_HISTORY_CAPACITY = 100_000;
  private static final int DEFAULT_REBUILD_VOLUME_THRESHOLD = 500;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    return fromEnv(EnvVars.system());
  }

  static AppConfig fromEnv(EnvVars env) {
    int port = env.getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    String csvPath = env.getString("BASELINE_CSV_PATH", null);
    int capacity = env.getInt("HISTORY_CAPACITY", DEFAULT_HISTORY_CAPACITY);
    int threshold = env.getInt("REBUILD_VOLUME_THRESHOLD", DEFAULT_REBUILD_VOLUME_THRESHOLD);

    log.info("AppConfig loaded: httpPort={}, baselineCsvPath={}, historyCapacity={}, rebuildVolumeThreshold={}",
      port, csvPath, capacity, threshold);
    return new AppConfig(port, csvPath, capacity, threshold);
  }
}
