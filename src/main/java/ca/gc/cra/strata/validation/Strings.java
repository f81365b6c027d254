package ca.gc.cra.strata.validation;

/**
 * <strong>What:</strong> Validation of parameter names.
 * <p><strong>Why:</strong> Parameter names double as path segments, so separators and wildcards inside a name would
 * make paths ambiguous.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {
  private static final String RESERVED = ".*= ";

  private Strings() {
    // Utility
  }

  /**
   * Validates a single parameter name (one path segment).
   *
   * @param name candidate name
   * @return the name, unchanged
   * @throws IllegalArgumentException when the name is blank or contains {@code .}, {@code *}, {@code =},
   *         a space or a control character
   */
  public static String requireParameterName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("parameter name must not be blank");
    }
    name.codePoints().forEach(cp -> {
      if (Character.isISOControl(cp)) {
        throw new IllegalArgumentException("parameter name must not contain control characters: '"
            + name.strip() + "'");
      }
      if (RESERVED.indexOf(cp) >= 0) {
        throw new IllegalArgumentException("parameter name '" + name + "' must not contain '"
            + Character.toString(cp) + "'");
      }
    });
    return name;
  }
}
