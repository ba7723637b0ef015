package io.github.themoah.txwatch.engine;

/**
 * Outcome of a rebuild request.
 *
 * @param outcome whether a new snapshot was published
 * @param snapshotVersion the version active after the call
 * @param modelRetrained whether the published snapshot carries a newly trained model
 * @param message human-readable detail
 */
public record RebuildResult(
  Outcome outcome,
  long snapshotVersion,
  boolean modelRetrained,
  String message
) {

  /**
   * Rebuild outcome.
   */
  public enum Outcome {
    /** A new snapshot was published. */
    APPLIED,
    /** The rebuild did not take effect; the previous snapshot stays active. */
    REJECTED,
    /** Another rebuild was already running; this request was dropped. */
    COALESCED;

    public String toValue() {
      return name().toLowerCase();
    }
  }

  public static RebuildResult applied(long version, boolean modelRetrained, String message) {
    return new RebuildResult(Outcome.APPLIED, version, modelRetrained, message);
  }

  public static RebuildResult rejected(long currentVersion, String message) {
    return new RebuildResult(Outcome.REJECTED, currentVersion, false, message);
  }

  public static RebuildResult coalesced(long currentVersion) {
    return new RebuildResult(Outcome.COALESCED, currentVersion, false, "rebuild already in progress");
  }

  public boolean isApplied() {
    return outcome == Outcome.APPLIED;
  }
}
