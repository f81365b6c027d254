package ca.gc.cra.strata.domain.tree;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a configuration hierarchy: either a source file or an inline partial mapping.
 *
 * @since 0.1.0
 */
public sealed interface SourceDescriptor permits SourceDescriptor.FileSource, SourceDescriptor.InlineSource {

  /**
   * Returns the serializable form written to the hierarchy artifact: a path string or a mapping.
   *
   * @return artifact entry
   */
  Object artifact();

  /**
   * Returns a short label used in log lines.
   *
   * @return origin description
   */
  String origin();

  /**
   * Wraps a file path.
   *
   * @param path source file
   * @return file descriptor
   */
  static SourceDescriptor file(Path path) {
    return new FileSource(path);
  }

  /**
   * Wraps an inline mapping.
   *
   * @param origin where the mapping came from (for example {@code command line})
   * @param content mapping merged into the tree
   * @return inline descriptor
   */
  static SourceDescriptor inline(String origin, Map<String, Object> content) {
    return new InlineSource(origin, content);
  }

  /** Source read from a file. */
  record FileSource(Path path) implements SourceDescriptor {
    public FileSource {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public Object artifact() {
      return path.toString();
    }

    @Override
    public String origin() {
      return "file " + path;
    }
  }

  /** Source given as an in-memory mapping. */
  record InlineSource(String origin, Map<String, Object> content) implements SourceDescriptor {
    public InlineSource {
      Objects.requireNonNull(origin, "origin");
      content = content == null
          ? Map.of()
          : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    @Override
    public Object artifact() {
      return content;
    }
  }
}
