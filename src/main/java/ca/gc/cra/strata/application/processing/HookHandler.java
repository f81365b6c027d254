package ca.gc.cra.strata.application.processing;

/**
 * Executes built-in hooks on behalf of the registry.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface HookHandler {

  /** Handler that passes values through untouched. */
  HookHandler PASS_THROUGH = (hook, path, value) -> value;

  /**
   * Runs {@code hook} for the parameter at {@code path}.
   *
   * @param hook hook to run
   * @param path fully-qualified parameter path
   * @param value current value
   * @return value stored in place of {@code value}
   */
  Object handle(BuiltinHook hook, String path, Object value);
}
