package ca.gc.cra.strata.domain.tree;

import java.util.Locale;

/**
 * Policy governing direct mutation of a configuration after construction.
 *
 * @since 0.1.0
 */
public enum OverwritingRegime {
  /** Every direct mutation is rejected. */
  LOCKED("locked"),
  /** Mutations are applied without hierarchy tracking or saving. */
  UNSAFE("unsafe"),
  /** Mutations are tracked in the hierarchy and re-saved when a save file exists. */
  AUTO_SAVE("auto-save");

  private final String label;

  OverwritingRegime(String label) {
    this.label = label;
  }

  /**
   * Returns the label used in saved files and option values.
   *
   * @return regime label such as {@code auto-save}
   */
  public String label() {
    return label;
  }

  /**
   * Parses a regime label; enum constant names are accepted too.
   *
   * @param value label such as {@code locked}, {@code unsafe} or {@code auto-save}
   * @return matching regime
   * @throws IllegalArgumentException when the label is unknown
   */
  public static OverwritingRegime fromLabel(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("overwriting regime must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    for (OverwritingRegime regime : values()) {
      if (regime.label.equals(normalized)) {
        return regime;
      }
    }
    throw new IllegalArgumentException("overwriting regime must be one of locked, unsafe or auto-save (was '"
        + value + "')");
  }
}
