package ca.gc.cra.strata.application.variation;

import java.util.List;

/**
 * Configuration able to describe its declared variations and derive patched siblings.
 *
 * @param <T> configuration type produced for each variation
 * @since 0.1.0
 */
public interface VariationSource<T> {

  /**
   * Returns the variations registered during construction, in registration order.
   *
   * @return variations
   */
  List<Variation> variations();

  /**
   * Returns the grids registered during construction, in registration order.
   *
   * @return grids
   */
  List<Grid> grids();

  /**
   * Builds a sibling: an independent copy of this configuration with {@code patches} merged in order as override
   * sources.
   *
   * @param name variation name
   * @param patches inline mappings or source paths
   * @return derived configuration
   */
  T deriveVariation(String name, List<Object> patches);
}
