package ca.gc.cra.strata.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Port persisting a configuration tree and its hierarchy.
 *
 * @since 0.1.0
 */
public interface ConfigWriter {

  /**
   * Writes a configuration artifact, replacing any existing file.
   *
   * @param path target file
   * @param content metadata entry first, then parameters; sub-configs as tagged mappings
   * @throws IOException when the file cannot be written
   */
  void write(Path path, Map<String, Object> content) throws IOException;

  /**
   * Writes a hierarchy artifact.
   *
   * @param path target file
   * @param hierarchy path strings and inline mappings in merge order
   * @throws IOException when the file cannot be written
   */
  void writeHierarchy(Path path, List<Object> hierarchy) throws IOException;

  /**
   * Renders a configuration as text without touching the file system.
   *
   * @param content parameters as passed to {@link #write(Path, Map)}
   * @return document text
   */
  String render(Map<String, Object> content);
}
