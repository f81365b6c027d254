package ca.gc.cra.strata.api;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} command options into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
final class CliArgsParser {
  private static final Pattern OPTION = Pattern.compile("([A-Za-z][A-Za-z0-9_-]*)=(\\S.*)");

  private CliArgsParser() {
    // Utility
  }

  /**
   * Parses options in order; the value is everything after the first {@code '='}.
   *
   * @param options option tokens; {@code null} yields an empty map
   * @return mutable map preserving option order
   * @throws IllegalArgumentException when a token is not {@code key=value}, a key repeats or a value holds control
   *     characters
   */
  static Map<String, String> toMap(List<String> options) {
    Map<String, String> map = new LinkedHashMap<>();
    if (options == null) {
      return map;
    }
    for (String option : options) {
      Matcher matcher = OPTION.matcher(option.strip());
      if (!matcher.matches()) {
        throw new IllegalArgumentException("option must be key=value (was '" + option + "')");
      }
      String key = matcher.group(1);
      String value = matcher.group(2).strip();
      if (value.chars().anyMatch(Character::isISOControl)) {
        throw new IllegalArgumentException("option " + key + " must not contain control characters");
      }
      if (map.putIfAbsent(key, value) != null) {
        throw new IllegalArgumentException("option " + key + " given more than once");
      }
    }
    return map;
  }
}
