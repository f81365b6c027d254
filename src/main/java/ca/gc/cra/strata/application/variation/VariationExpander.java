package ca.gc.cra.strata.application.variation;

import ca.gc.cra.strata.domain.error.StructureException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Produces one sibling configuration per declared variation entry and per grid combination.
 * <p><strong>Role:</strong> Application service run after construction, on demand.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expand grids first: the cartesian product of their dimensions, entries merged in the grid's declared
 *   order. Variations consumed by a grid are not expanded on their own.</li>
 *   <li>Expand every remaining variation entry into its own sibling.</li>
 *   <li>Name siblings {@code <variation>_<entry>}, joined with {@code +} for grid combinations.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class VariationExpander {
  private static final Logger log = LoggerFactory.getLogger(VariationExpander.class);

  /**
   * Creates every sibling described by {@code parent}.
   *
   * @param parent fully constructed configuration
   * @param <T> configuration type
   * @return siblings in expansion order; empty when nothing is declared
   * @throws StructureException when a grid names an unknown or empty variation
   */
  public <T> List<T> createVariations(VariationSource<T> parent) {
    Objects.requireNonNull(parent, "parent");
    List<Combination> combinations = combinations(parent.variations(), parent.grids());
    List<T> children = new ArrayList<>(combinations.size());
    for (Combination combination : combinations) {
      children.add(parent.deriveVariation(combination.name(), combination.patches()));
    }
    if (!children.isEmpty()) {
      log.info("Created {} variation(s) : {}", children.size(),
          combinations.stream().map(Combination::name).toList());
    }
    return children;
  }

  /**
   * Computes the name and ordered patches of every sibling without building them.
   *
   * @param variations registered variations
   * @param grids registered grids
   * @return combinations in expansion order
   */
  public List<Combination> combinations(List<Variation> variations, List<Grid> grids) {
    Map<String, Variation> remaining = new LinkedHashMap<>();
    for (Variation variation : variations) {
      remaining.put(variation.name(), variation);
    }
    Map<String, Variation> all = new LinkedHashMap<>(remaining);
    List<Combination> combinations = new ArrayList<>();

    for (Grid grid : grids) {
      if (grid.dimensions().isEmpty()) {
        continue;
      }
      List<Combination> product = List.of(new Combination("", List.of()));
      for (String dimension : grid.dimensions()) {
        Variation variation = all.get(dimension);
        if (variation == null || variation.size() == 0) {
          throw new StructureException("Grid element '" + dimension + "' of grid '" + grid.name()
              + "' is an empty list or not a registered variation", grid.name());
        }
        remaining.remove(dimension);
        List<Combination> next = new ArrayList<>(product.size() * variation.size());
        for (Combination partial : product) {
          for (Variation.Entry entry : variation.entries()) {
            next.add(partial.extend(variation.name() + "_" + entry.name(), entry.patch()));
          }
        }
        product = next;
      }
      combinations.addAll(product);
    }

    for (Variation variation : remaining.values()) {
      for (Variation.Entry entry : variation.entries()) {
        combinations.add(new Combination(variation.name() + "_" + entry.name(), List.of(entry.patch())));
      }
    }
    return combinations;
  }

  /**
   * Name and ordered patches of one sibling.
   *
   * @param name sibling name
   * @param patches patches to merge, in order
   */
  public record Combination(String name, List<Object> patches) {
    public Combination {
      Objects.requireNonNull(name, "name");
      patches = List.copyOf(patches);
    }

    Combination extend(String part, Object patch) {
      List<Object> extended = new ArrayList<>(patches);
      extended.add(patch);
      return new Combination(name.isEmpty() ? part : name + "+" + part, extended);
    }
  }
}
