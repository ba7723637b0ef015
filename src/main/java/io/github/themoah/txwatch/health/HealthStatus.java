package io.github.themoah.txwatch.health;

/**
 * Health of the service as reported by the probes.
 */
public enum HealthStatus {
  UP("UP"),
  DOWN("DOWN");

  private final String value;

  HealthStatus(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  public static HealthStatus of(boolean up) {
    return up ? UP : DOWN;
  }
}
