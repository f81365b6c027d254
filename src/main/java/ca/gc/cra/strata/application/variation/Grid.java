package ca.gc.cra.strata.application.variation;

import java.util.List;
import java.util.Objects;

/**
 * Cartesian combination of variations.
 *
 * @param name fully-qualified name of the declaring parameter
 * @param dimensions variation names, in the order their entries are merged
 * @since 0.1.0
 */
public record Grid(String name, List<String> dimensions) {

  public Grid {
    Objects.requireNonNull(name, "name");
    dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
  }
}
