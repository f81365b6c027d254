package ca.gc.cra.strata.application.variation;

import java.util.List;
import java.util.Objects;

/**
 * Named ordered list of partial sources, each producing one sibling configuration.
 *
 * @param name fully-qualified name of the declaring parameter
 * @param entries alternatives in declaration order
 * @since 0.1.0
 */
public record Variation(String name, List<Entry> entries) {

  public Variation {
    Objects.requireNonNull(name, "name");
    entries = entries == null ? List.of() : List.copyOf(entries);
  }

  public int size() {
    return entries.size();
  }

  /**
   * One alternative of a variation.
   *
   * @param name entry name: list index or mapping key
   * @param patch inline mapping or source path
   */
  public record Entry(String name, Object patch) {
    public Entry {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(patch, "patch");
    }
  }
}
