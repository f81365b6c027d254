package ca.gc.cra.strata.application.processing;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Library of ready-made validating transforms. Each transform passes {@code null} through untouched.
 *
 * @since 0.1.0
 */
public final class ProcessingFunctions {

  private ProcessingFunctions() {
    // Utility
  }

  /**
   * Returns a transform rejecting numbers outside {@code [minimum ; maximum]}.
   *
   * @param minimum inclusive lower bound
   * @param maximum inclusive upper bound
   * @return validating transform
   */
  public static ParameterTransform numberInRange(double minimum, double maximum) {
    if (minimum > maximum) {
      throw new IllegalArgumentException("minimum must not exceed maximum");
    }
    return value -> {
      if (value == null) {
        return null;
      }
      if (!(value instanceof Number number)) {
        throw new IllegalArgumentException("Invalid value '" + value + "': a number is required");
      }
      double numeric = number.doubleValue();
      if (numeric < minimum || numeric > maximum) {
        throw new IllegalArgumentException("Invalid value '" + value + "'. Must be in range ["
            + minimum + " ; " + maximum + "].");
      }
      return value;
    };
  }

  /**
   * Returns a transform rejecting values outside {@code choices}; strings are compared case-insensitively.
   *
   * @param choices accepted values
   * @return validating transform
   */
  public static ParameterTransform inList(List<?> choices) {
    Objects.requireNonNull(choices, "choices");
    List<Object> normalized = new ArrayList<>();
    for (Object choice : choices) {
      normalized.add(normalize(choice));
    }
    return value -> {
      if (value == null) {
        return null;
      }
      if (!normalized.contains(normalize(value))) {
        throw new IllegalArgumentException("Invalid value '" + value + "'. Valid choices are " + choices + ".");
      }
      return value;
    };
  }

  private static Object normalize(Object value) {
    return value instanceof String text ? text.toLowerCase(Locale.ROOT) : value;
  }
}
