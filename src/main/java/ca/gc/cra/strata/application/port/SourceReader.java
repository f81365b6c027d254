package ca.gc.cra.strata.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Port turning a structured document into native values.
 * <p><strong>Role:</strong> Implemented by document-format adapters; the engine only consumes scalars, lists,
 * string-keyed maps, {@link ca.gc.cra.strata.domain.tree.TaggedMapping} and
 * {@link ca.gc.cra.strata.domain.tree.Replacement} annotations.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Combine every document of a multi-document file into one mapping; a tagged document becomes an entry
 *   keyed by its tag.</li>
 *   <li>Reject duplicate keys with {@link ca.gc.cra.strata.domain.error.StructureException}.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface SourceReader {

  /**
   * Reads a source file.
   *
   * @param path file to read
   * @return parameters in document order
   * @throws IOException when the file cannot be read
   */
  Map<String, Object> read(Path path) throws IOException;

  /**
   * Reads a hierarchy artifact.
   *
   * @param path hierarchy file written next to a saved config
   * @return entries, each a path string or an inline mapping
   * @throws IOException when the file cannot be read
   */
  List<Object> readHierarchy(Path path) throws IOException;
}
