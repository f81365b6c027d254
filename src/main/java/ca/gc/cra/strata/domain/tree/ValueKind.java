package ca.gc.cra.strata.domain.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Runtime kind of a parameter value, used to reject kind-changing overrides.
 *
 * @since 0.1.0
 */
public enum ValueKind {
  /** Absent value ({@code null}). */
  NONE,
  BOOLEAN,
  INTEGER,
  FLOAT,
  STRING,
  SEQUENCE,
  /** Opaque (untagged) mapping stored as a single leaf value. */
  MAPPING,
  /** Nested named sub-config. */
  NODE,
  /** Anything a post-processing transform produced that is not a native document value. */
  OTHER;

  /**
   * Classifies a value.
   *
   * @param value value to inspect; may be {@code null}
   * @return kind of the value
   */
  public static ValueKind of(Object value) {
    if (value == null) {
      return NONE;
    }
    if (value instanceof Replacement replacement) {
      return of(replacement.value());
    }
    if (value instanceof Boolean) {
      return BOOLEAN;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof BigInteger) {
      return INTEGER;
    }
    if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
      return FLOAT;
    }
    if (value instanceof String) {
      return STRING;
    }
    if (value instanceof List<?>) {
      return SEQUENCE;
    }
    if (value instanceof ConfigNode) {
      return NODE;
    }
    if (value instanceof Map<?, ?> || value instanceof TaggedMapping) {
      return MAPPING;
    }
    return OTHER;
  }

  /**
   * Indicates whether values of this kind can be written to and read back from a document.
   *
   * @return {@code true} for every kind except {@link #OTHER}
   */
  public boolean isNative() {
    return this != OTHER;
  }

  /**
   * Checks whether a value of kind {@code incoming} may replace a value of this kind.
   *
   * <p>Absent values on either side are accepted and integers widen to floats.</p>
   *
   * @param incoming kind of the replacing value
   * @return {@code true} when the replacement keeps the kind
   */
  public boolean accepts(ValueKind incoming) {
    if (this == NONE || incoming == NONE || this == OTHER) {
      return true;
    }
    if (this == FLOAT && incoming == INTEGER) {
      return true;
    }
    return this == incoming;
  }
}
