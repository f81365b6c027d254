package ca.gc.cra.strata.domain.path;

import ca.gc.cra.strata.domain.error.PathNotFoundException;
import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.tree.ConfigNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Resolves dotted and wildcard paths against a configuration tree.
 * <p><strong>Role:</strong> Domain service shared by the merge engine, the command-line parser and the processing
 * registry.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enumerate the leaf paths matching a pattern, across sub-config boundaries.</li>
 *   <li>Read and write single parameters by literal path.</li>
 * </ul>
 * <p>Literal paths touching a missing key fail with {@link PathNotFoundException}. Wildcards matching several
 * paths are reported to the caller, never treated as errors.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class PathMatcher {

  private PathMatcher() {
    // Utility
  }

  /**
   * Lists the leaf paths of {@code scope} matched by {@code pattern}.
   *
   * @param scope node the pattern is relative to
   * @param pattern dotted pattern
   * @return matched paths relative to {@code scope}, in tree order
   */
  public static List<String> match(ConfigNode scope, String pattern) {
    Objects.requireNonNull(scope, "scope");
    PathPattern compiled = PathPattern.compile(pattern);
    List<String> matches = new ArrayList<>();
    for (String path : scope.leafPaths()) {
      if (compiled.matches(path)) {
        matches.add(path);
      }
    }
    return matches;
  }

  /**
   * Expands {@code pattern} and reports the matches as fully-qualified paths.
   *
   * @param scope node the pattern is relative to
   * @param pattern dotted pattern
   * @return match report naming every matched path from the root
   */
  public static MatchReport report(ConfigNode scope, String pattern) {
    List<String> qualified = new ArrayList<>();
    for (String path : match(scope, pattern)) {
      qualified.add(scope.pathOf(path));
    }
    return new MatchReport(scope.pathOf(pattern), qualified);
  }

  /**
   * Expands a pattern into literal paths; a literal pattern must resolve.
   *
   * @param scope node the pattern is relative to
   * @param pattern literal path or wildcard pattern
   * @return matched relative paths; possibly empty for wildcards
   * @throws PathNotFoundException when a literal pattern does not resolve
   */
  public static List<String> expand(ConfigNode scope, String pattern) {
    if (!PathPattern.isWildcard(pattern)) {
      holder(scope, pattern);
      return List.of(pattern);
    }
    return match(scope, pattern);
  }

  /**
   * Indicates whether a literal path resolves to a parameter or sub-config.
   *
   * @param scope node the path is relative to
   * @param path literal dotted path
   * @return {@code true} when every segment exists
   */
  public static boolean exists(ConfigNode scope, String path) {
    return !PathPattern.isWildcard(path) && scope.holderOf(path).isPresent();
  }

  /**
   * Reads a parameter by literal path.
   *
   * @param scope node the path is relative to
   * @param path literal dotted path
   * @return stored value; sub-configs are returned as {@link ConfigNode}
   * @throws PathNotFoundException when any segment is missing
   */
  public static Object read(ConfigNode scope, String path) {
    return holder(scope, path).get(lastSegment(path));
  }

  /**
   * Overwrites a leaf parameter by literal path without any kind check.
   *
   * @param scope node the path is relative to
   * @param path literal dotted path
   * @param value new value
   * @return previous value
   * @throws PathNotFoundException when any segment is missing
   * @throws StructureException when the path designates a sub-config
   */
  public static Object write(ConfigNode scope, String path, Object value) {
    ConfigNode holder = holder(scope, path);
    String key = lastSegment(path);
    if (holder.get(key) instanceof ConfigNode) {
      throw new StructureException("Parameter '" + holder.pathOf(key)
          + "' is a sub-config and cannot be replaced by a value", holder.pathOf(key));
    }
    return holder.put(key, value);
  }

  /**
   * Resolves the node directly holding the last segment of a literal path.
   *
   * @param scope node the path is relative to
   * @param path literal dotted path
   * @return holder node
   * @throws PathNotFoundException when any segment is missing or the path contains wildcards
   */
  public static ConfigNode holder(ConfigNode scope, String path) {
    Objects.requireNonNull(path, "path");
    if (PathPattern.isWildcard(path)) {
      throw new PathNotFoundException("Path '" + path + "' is a pattern, a literal path is required",
          scope.pathOf(path));
    }
    return scope.holderOf(path).orElseThrow(() -> new PathNotFoundException(
        "Parameter '" + scope.pathOf(path) + "' does not exist", scope.pathOf(path)));
  }

  /**
   * Returns the last segment of a dotted path.
   *
   * @param path dotted path
   * @return trailing segment
   */
  public static String lastSegment(String path) {
    int idx = path.lastIndexOf('.');
    return idx < 0 ? path : path.substring(idx + 1);
  }
}
