package io.github.themoah.txwatch.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x options. Scoring and rebuilds run on the worker pool, sized by
 * VERTX_WORKER_POOL_SIZE.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_WORKER_POOL_SIZE = "VERTX_WORKER_POOL_SIZE";

  private VertxConfig() {}

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    int workerPoolSize = EnvVars.system().getInt(ENV_WORKER_POOL_SIZE, VertxOptions.DEFAULT_WORKER_POOL_SIZE);
    options.setWorkerPoolSize(workerPoolSize);
    log.info("Vert.x worker pool size: {}", workerPoolSize);
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions();
  }
}
