package ca.gc.cra.strata.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port allocating indexed experiment directories.
 * <p><strong>Why:</strong> Runs of one experiment must never overwrite each other, so every run receives
 * {@code <name>_<index>} with an index above every existing one.</p>
 *
 * @since 0.1.0
 */
public interface ExperimentDirectoryPort {

  /**
   * Creates the directory of a new run.
   *
   * @param requested path whose last segment is the experiment name
   * @return created directory {@code <parent>/<name>_<max index + 1>}
   * @throws IOException when the directory cannot be created
   */
  Path createRunDirectory(Path requested) throws IOException;

  /**
   * Creates the directory of a variation inside the latest run.
   *
   * @param requested path whose last segment is the experiment name
   * @param variationName name of the variation
   * @return created directory {@code <parent>/<name>_<max index>/<variationName>}
   * @throws IOException when the directory cannot be created
   */
  Path createVariationDirectory(Path requested, String variationName) throws IOException;
}
