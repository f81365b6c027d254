package ca.gc.cra.strata.config;

import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges tool options from defaults, YAML, and CLI sources and converts them into {@link BuildOptions}.
 */
public final class OptionsMerger {
  static final String REGIME = "regime";
  static final String MERGE_COMMAND_LINE = "mergeCommandLine";
  static final String PRE_PROCESS = "preProcess";
  static final String POST_PROCESS = "postProcess";
  static final String STRICT_COMMAND_LINE = "strictCommandLine";
  static final String VERBOSE = "verbose";

  private OptionsMerger() {}

  /**
   * Returns the defaults as a flat map.
   *
   * @return immutable default option map
   */
  public static Map<String, String> defaults() {
    BuildOptions defaults = BuildOptions.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put(REGIME, defaults.regime().label());
    map.put(MERGE_COMMAND_LINE, String.valueOf(defaults.mergeCommandLine()));
    map.put(PRE_PROCESS, String.valueOf(defaults.preProcess()));
    map.put(POST_PROCESS, String.valueOf(defaults.postProcess()));
    map.put(STRICT_COMMAND_LINE, String.valueOf(defaults.strictCommandLine()));
    map.put(VERBOSE, String.valueOf(defaults.verbose()));
    return Map.copyOf(map);
  }

  /**
   * Builds an effective option map using precedence CLI > YAML > defaults.
   *
   * @param yaml optional YAML-derived options
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults default options
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged option map
   */
  public static Map<String, String> buildEffectiveOptions(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }

  /**
   * Converts an effective option map into typed options.
   *
   * @param effective merged option map
   * @return build options
   * @throws IllegalArgumentException when a value is malformed
   */
  public static BuildOptions toBuildOptions(Map<String, String> effective) {
    BuildOptions defaults = BuildOptions.defaults();
    String regime = effective.get(REGIME);
    return new BuildOptions(
        regime == null || regime.isBlank() ? defaults.regime() : OverwritingRegime.fromLabel(regime),
        parseBoolean(effective, MERGE_COMMAND_LINE, defaults.mergeCommandLine()),
        parseBoolean(effective, PRE_PROCESS, defaults.preProcess()),
        parseBoolean(effective, POST_PROCESS, defaults.postProcess()),
        parseBoolean(effective, STRICT_COMMAND_LINE, defaults.strictCommandLine()),
        parseBoolean(effective, VERBOSE, defaults.verbose()));
  }

  private static boolean parseBoolean(Map<String, String> effective, String key, boolean defaultValue) {
    String value = effective.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    };
  }
}
