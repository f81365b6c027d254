package ca.gc.cra.strata.application.guard;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Configuration operations an {@link OverwriteGuard} may call when a mutation is allowed.
 *
 * @since 0.1.0
 */
public interface MutationTarget {

  /**
   * Overwrites the matched leaves without kind checks, hierarchy tracking or processing.
   *
   * @param path literal path or wildcard pattern
   * @param value new value
   */
  void applyDirect(String path, Object value);

  /**
   * Applies the change as an override merge from code: the hierarchy is extended and modified parameters are
   * post-processed.
   *
   * @param path literal path or wildcard pattern
   * @param value new value
   */
  void applyTracked(String path, Object value);

  /**
   * Returns the file the configuration was last saved to.
   *
   * @return save path, empty when never saved
   */
  Optional<Path> savedPath();

  /**
   * Re-serializes the configuration to {@link #savedPath()}.
   */
  void resave();
}
