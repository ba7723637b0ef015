package io.github.themoah.txwatch.config;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed access to environment variables with logged fallback to defaults.
 */
public final class EnvVars {

  private static final Logger log = LoggerFactory.getLogger(EnvVars.class);

  private final Function<String, String> source;

  EnvVars(Function<String, String> source) {
    this.source = source;
  }

  /**
   * Reads from the process environment.
   */
  public static EnvVars system() {
    return new EnvVars(System::getenv);
  }

  /**
   * Reads from an arbitrary lookup, used by tests.
   */
  public static EnvVars from(Function<String, String> source) {
    return new EnvVars(source);
  }

  public String getString(String name, String defaultValue) {
    String value = source.apply(name);
    return (value == null || value.isBlank()) ? defaultValue : value.trim();
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    String value = source.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public int getInt(String name, int defaultValue) {
    String value = source.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid integer for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  public double getDouble(String name, double defaultValue) {
    String value = source.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid number for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }
}
