package io.github.themoah.txwatch.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ratios for the checkout spike/drop comparison.
 *
 * @param spikeRatio today at or above this multiple of both averages is a spike (default 2.0)
 * @param dropRatio today at or below this multiple of both averages is a drop (default 0.5)
 */
public record CheckoutConfig(double spikeRatio, double dropRatio) {

  private static final Logger log = LoggerFactory.getLogger(CheckoutConfig.class);

  private static final double DEFAULT_SPIKE_RATIO = 2.0;
  private static final double DEFAULT_DROP_RATIO = 0.5;

  public CheckoutConfig {
    if (dropRatio >= spikeRatio) {
      throw new IllegalArgumentException("dropRatio must be below spikeRatio");
    }
  }

  public static CheckoutConfig defaults() {
    return new CheckoutConfig(DEFAULT_SPIKE_RATIO, DEFAULT_DROP_RATIO);
  }

  public static CheckoutConfig fromEnvironment() {
    return fromEnv(EnvVars.system());
  }

  static CheckoutConfig fromEnv(EnvVars env) {
    double spike = env.getDouble("CHECKOUT_SPIKE_RATIO", DEFAULT_SPIKE_RATIO);
    double drop = env.getDouble("CHECKOUT_DROP_RATIO", DEFAULT_DROP_RATIO);
    log.info("Checkout config: spikeRatio={}, dropRatio={}", spike, drop);
    return new CheckoutConfig(spike, drop);
  }
}
