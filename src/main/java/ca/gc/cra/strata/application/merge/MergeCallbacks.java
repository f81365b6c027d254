package ca.gc.cra.strata.application.merge;

import ca.gc.cra.strata.domain.path.MatchReport;
import ca.gc.cra.strata.domain.tree.ConfigNode;

/**
 * Observer of a merge pass. Every method has a pass-through default.
 *
 * @since 0.1.0
 */
public interface MergeCallbacks {

  /** Callbacks that observe nothing and leave values untouched. */
  MergeCallbacks NO_OP = new MergeCallbacks() {};

  /**
   * Pre-processes a leaf right before it is stored.
   *
   * @param holder node receiving the value
   * @param key parameter name within {@code holder}
   * @param value incoming value
   * @param mode mode of the merge pass setting the value
   * @return value to store
   */
  default Object preProcess(ConfigNode holder, String key, Object value, MergeMode mode) {
    return value;
  }

  /**
   * Returns the value whose kind governs an override of {@code path}.
   *
   * @param path fully-qualified parameter path
   * @param current value currently stored
   * @return reference value, {@code current} unless a pre-post-processing value is known
   */
  default Object referenceValue(String path, Object current) {
    return current;
  }

  /**
   * Notified once a leaf has been stored.
   *
   * @param path fully-qualified parameter path
   * @param oldValue previous value, {@code null} for a newly created key
   * @param newValue stored value
   */
  default void leafSet(String path, Object oldValue, Object newValue) {}

  /**
   * Notified when the source carries saved-file metadata at its root.
   *
   * @param metadata raw metadata value
   */
  default void metadataFound(Object metadata) {}

  /**
   * Notified after a wildcard key was expanded.
   *
   * @param report matched paths
   */
  default void wildcardExpanded(MatchReport report) {}
}
