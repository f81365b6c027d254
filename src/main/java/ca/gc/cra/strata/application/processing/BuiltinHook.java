package ca.gc.cra.strata.application.processing;

import java.util.Locale;

/**
 * Closed set of side-effecting transforms that register a parameter for a predefined role.
 *
 * <p>Hooks are bound to patterns like ordinary transforms but are dispatched explicitly to a
 * {@link HookHandler}.</p>
 *
 * @since 0.1.0
 */
public enum BuiltinHook {
  /** Creates an indexed experiment directory and replaces the value with its path. */
  EXPERIMENT_PATH("experiment_path"),
  /** Merges the file(s) named by the value at the same pipeline point. */
  ADDITIONAL_CONFIG_FILE("additional_config_file"),
  /** Declares the value as a variation: a list or mapping of partial sources. */
  CONFIG_VARIATIONS("config_variations"),
  /** Declares the value as a grid: a list of variation parameter names. */
  GRID("grid");

  private final String hookName;

  BuiltinHook(String hookName) {
    this.hookName = hookName;
  }

  public String hookName() {
    return hookName;
  }

  /**
   * Resolves a hook from its name, accepting the {@code register_as_} prefix.
   *
   * @param name hook name such as {@code grid} or {@code register_as_grid}
   * @return matching hook
   * @throws IllegalArgumentException when the name is unknown
   */
  public static BuiltinHook fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("hook name must not be null");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    if (normalized.startsWith("register_as_")) {
      normalized = normalized.substring("register_as_".length());
    }
    for (BuiltinHook hook : values()) {
      if (hook.hookName.equals(normalized)) {
        return hook;
      }
    }
    throw new IllegalArgumentException("unknown hook: " + name);
  }
}
