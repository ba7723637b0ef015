package io.github.themoah.txwatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for environment-backed configuration.
 */
public class ConfigTest {

  private static EnvVars env(Map<String, String> values) {
    return EnvVars.from(values::get);
  }

  @Test
  void appConfig_defaults() {
    AppConfig config = AppConfig.fromEnv(env(Map.of()));

    assertEquals(8888, config.httpPort());
    assertNull(config.baselineCsvPath());
    assertEquals(100_000, config.historyCapacity());
    assertEquals(500, config.rebuildVolumeThreshold());
  }

  @Test
  void invalidNumbers_fallBackToDefaults() {
    AppConfig app = AppConfig.fromEnv(env(Map.of("HTTP_PORT", "eighty", "HISTORY_CAPACITY", " 200 ")));
    DetectionConfig detection = DetectionConfig.fromEnv(env(Map.of("Z_SCORE_CRITICAL", "3,5")));

    assertEquals(8888, app.httpPort());
    assertEquals(200, app.historyCapacity());
    assertEquals(3.0, detection.zScoreCritical());
  }

  @Test
  void detectionConfig_fromEnvironment() {
    DetectionConfig config = DetectionConfig.fromEnv(env(Map.of(
      "BASELINE_MIN_SAMPLES", "10",
      "Z_SCORE_WARNING", "1.5",
      "Z_SCORE_EXTREME", "8",
      "PERCENTILE_CRITICAL", "99.5")));

    assertEquals(10, config.minSamples());
    assertEquals(1.5, config.zScoreWarning());
    assertEquals(3.0, config.zScoreCritical());
    assertEquals(8.0, config.zScoreExtreme());
    assertEquals(95.0, config.warningPercentile());
    assertEquals(99.5, config.criticalPercentile());
  }

  @Test
  void detectionConfig_rejectsInconsistentThresholds() {
    assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(5, 4.0, 3.0, 6.0, 95, 99));
    assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(5, 2.0, 3.0, 6.0, 99, 95));
    assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(0, 2.0, 3.0, 6.0, 95, 99));
  }

  @Test
  void modelConfig_fromEnvironment() {
    ModelConfig config = ModelConfig.fromEnv(env(Map.of("MODEL_ENABLED", "false", "MODEL_TREES", "50")));

    assertFalse(config.enabled());
    assertEquals(50, config.trees());
    assertEquals(256, config.subsampleSize());
    assertEquals(ModelConfig.defaults().contamination(), config.contamination());
  }

  @Test
  void modelConfig_rejectsContaminationOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> new ModelConfig(true, 100, 256, 24, 0.5, 0.55));
    assertThrows(IllegalArgumentException.class, () -> new ModelConfig(true, 100, 256, 24, 0.0, 0.55));
  }

  @Test
  void modelConfig_rejectsSingleTrainingVector() {
    assertThrows(IllegalArgumentException.class, () -> new ModelConfig(true, 100, 256, 1, 0.05, 0.55));
    assertEquals(2, new ModelConfig(true, 100, 256, 2, 0.05, 0.55).minTrainingVectors());
  }

  @Test
  void checkoutConfig_ratios() {
    CheckoutConfig config = CheckoutConfig.fromEnv(env(Map.of("CHECKOUT_SPIKE_RATIO", "3")));

    assertEquals(3.0, config.spikeRatio());
    assertEquals(0.5, config.dropRatio());
    assertThrows(IllegalArgumentException.class, () -> new CheckoutConfig(1.0, 1.0));
  }
}
