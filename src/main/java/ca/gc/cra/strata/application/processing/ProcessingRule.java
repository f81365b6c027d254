package ca.gc.cra.strata.application.processing;

import ca.gc.cra.strata.domain.path.PathPattern;
import java.util.Objects;

/**
 * Pattern bound to either a user transform or a built-in hook.
 *
 * @since 0.1.0
 */
public sealed interface ProcessingRule permits ProcessingRule.TransformRule, ProcessingRule.HookRule {

  PathPattern pattern();

  /**
   * Rule running a user transform.
   *
   * @param pattern paths the rule applies to
   * @param transform transform to run
   */
  record TransformRule(PathPattern pattern, ParameterTransform transform) implements ProcessingRule {
    public TransformRule {
      Objects.requireNonNull(pattern, "pattern");
      Objects.requireNonNull(transform, "transform");
    }
  }

  /**
   * Rule dispatching a built-in hook.
   *
   * @param pattern paths the rule applies to
   * @param hook hook to dispatch
   */
  record HookRule(PathPattern pattern, BuiltinHook hook) implements ProcessingRule {
    public HookRule {
      Objects.requireNonNull(pattern, "pattern");
      Objects.requireNonNull(hook, "hook");
    }
  }
}
