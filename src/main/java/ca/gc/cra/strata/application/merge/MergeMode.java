package ca.gc.cra.strata.application.merge;

/**
 * Key-creation contract of a merge pass.
 *
 * @since 0.1.0
 */
public enum MergeMode {
  /** Root-defining pass: unknown paths create keys and intermediate sub-configs. */
  DEFAULT,
  /** Experiment pass: every path must already exist and kinds are preserved. */
  OVERRIDE
}
