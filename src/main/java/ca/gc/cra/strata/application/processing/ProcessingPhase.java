package ca.gc.cra.strata.application.processing;

/**
 * Point of the build pipeline at which a processing rule fires.
 *
 * @since 0.1.0
 */
public enum ProcessingPhase {
  /** Fires as each leaf is set by a merge, in source order. */
  PRE("pre"),
  /** Fires once on every modified leaf after the whole pipeline completed. */
  POST("post");

  private final String label;

  ProcessingPhase(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
