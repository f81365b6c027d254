package ca.gc.cra.strata.domain.path;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of expanding a wildcard pattern against a tree.
 *
 * @param pattern pattern text as supplied by the caller
 * @param matches fully-qualified leaf paths matched, in tree order
 * @since 0.1.0
 */
public record MatchReport(String pattern, List<String> matches) {

  public MatchReport {
    Objects.requireNonNull(pattern, "pattern");
    matches = matches == null ? List.of() : List.copyOf(matches);
  }

  public boolean isEmpty() {
    return matches.isEmpty();
  }

  /**
   * Indicates whether the pattern resolved to more than one path.
   *
   * @return {@code true} when several paths matched
   */
  public boolean isAmbiguous() {
    return matches.size() > 1;
  }
}
