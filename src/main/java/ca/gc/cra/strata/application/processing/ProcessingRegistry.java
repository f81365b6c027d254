package ca.gc.cra.strata.application.processing;

import ca.gc.cra.strata.application.processing.ProcessingRule.HookRule;
import ca.gc.cra.strata.application.processing.ProcessingRule.TransformRule;
import ca.gc.cra.strata.domain.error.ConfigException;
import ca.gc.cra.strata.domain.error.ProcessingException;
import ca.gc.cra.strata.domain.path.PathPattern;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered pattern-to-transform bindings for the pre- and post-processing phases.
 * <p><strong>Why:</strong> Replaces visitor style dispatch with a flat list of (matcher, transform) pairs evaluated
 * per leaf path.</p>
 * <p><strong>Role:</strong> Application service consulted by the merge pipeline whenever a leaf is set (pre) and
 * once the pipeline completes (post).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Thread a value through every matching rule in declaration order, regardless of pattern specificity.</li>
 *   <li>Dispatch built-in hooks to the caller-supplied {@link HookHandler}.</li>
 *   <li>Wrap transform failures in {@link ProcessingException}.</li>
 *   <li>Report patterns that match no parameter.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built; transforms themselves must be safe for the caller's
 * threading model.</p>
 *
 * @since 0.1.0
 */
public final class ProcessingRegistry {
  private static final Logger log = LoggerFactory.getLogger(ProcessingRegistry.class);

  private static final ProcessingRegistry EMPTY = builder().build();

  private final Map<ProcessingPhase, List<ProcessingRule>> rules;

  private ProcessingRegistry(Map<ProcessingPhase, List<ProcessingRule>> rules) {
    this.rules = rules;
  }

  /**
   * Returns a registry without any rule.
   *
   * @return shared empty registry
   */
  public static ProcessingRegistry empty() {
    return EMPTY;
  }

  /**
   * Starts a registry definition.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the rules of a phase in declaration order.
   *
   * @param phase processing phase
   * @return immutable rule list
   */
  public List<ProcessingRule> rules(ProcessingPhase phase) {
    return rules.get(phase);
  }

  /**
   * Returns the rules of {@code phase} matching {@code path}, in declaration order.
   *
   * @param path fully-qualified parameter path
   * @param phase processing phase
   * @return matching rules
   */
  public List<ProcessingRule> matching(String path, ProcessingPhase phase) {
    List<ProcessingRule> matching = new ArrayList<>();
    for (ProcessingRule rule : rules.get(phase)) {
      if (rule.pattern().matches(path)) {
        matching.add(rule);
      }
    }
    return matching;
  }

  /**
   * Returns the hooks of {@code phase} bound to {@code path}, in declaration order.
   *
   * @param path fully-qualified parameter path
   * @param phase processing phase
   * @return matching hooks
   */
  public List<BuiltinHook> hooksFor(String path, ProcessingPhase phase) {
    List<BuiltinHook> hooks = new ArrayList<>();
    for (ProcessingRule rule : matching(path, phase)) {
      if (rule instanceof HookRule hookRule) {
        hooks.add(hookRule.hook());
      }
    }
    return hooks;
  }

  /**
   * Threads {@code value} through every rule of {@code phase} matching {@code path}.
   *
   * @param path fully-qualified parameter path
   * @param value input value
   * @param phase processing phase
   * @param hooks handler receiving built-in hook dispatches
   * @return processed value
   * @throws ProcessingException when a transform fails
   */
  public Object apply(String path, Object value, ProcessingPhase phase, HookHandler hooks) {
    Objects.requireNonNull(hooks, "hooks");
    Object current = value;
    for (ProcessingRule rule : matching(path, phase)) {
      if (rule instanceof HookRule hookRule) {
        current = hooks.handle(hookRule.hook(), path, current);
      } else if (rule instanceof TransformRule transformRule) {
        current = run(transformRule, path, current, phase);
      }
    }
    return current;
  }

  private static Object run(TransformRule rule, String path, Object value, ProcessingPhase phase) {
    try {
      return rule.transform().apply(value);
    } catch (ConfigException ex) {
      throw ex;
    } catch (Exception ex) {
      log.error("Error while {}-processing parameter '{}' with pattern '{}'", phase.label(), path,
          rule.pattern().text());
      throw new ProcessingException("Error while " + phase.label() + "-processing parameter '" + path + "': "
          + ex.getMessage(), path, ex);
    }
  }

  /**
   * Lists the patterns of {@code phase} that match none of {@code paths}.
   *
   * @param phase processing phase
   * @param paths fully-qualified leaf paths of a tree
   * @return unmatched pattern texts in declaration order, without duplicates
   */
  public List<String> unmatchedPatterns(ProcessingPhase phase, Collection<String> paths) {
    List<String> unmatched = new ArrayList<>();
    for (ProcessingRule rule : rules.get(phase)) {
      PathPattern pattern = rule.pattern();
      if (unmatched.contains(pattern.text())) {
        continue;
      }
      boolean matched = false;
      for (String path : paths) {
        if (pattern.matches(path)) {
          matched = true;
          break;
        }
      }
      if (!matched) {
        unmatched.add(pattern.text());
      }
    }
    return unmatched;
  }

  /**
   * Indicates whether no rule is registered for either phase.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return rules.values().stream().allMatch(List::isEmpty);
  }

  /** Collects rules in declaration order. */
  public static final class Builder {
    private final Map<ProcessingPhase, List<ProcessingRule>> rules = new EnumMap<>(ProcessingPhase.class);

    private Builder() {
      for (ProcessingPhase phase : ProcessingPhase.values()) {
        rules.put(phase, new ArrayList<>());
      }
    }

    /**
     * Binds a transform to a pattern.
     *
     * @param phase processing phase
     * @param pattern dotted pattern
     * @param transform one-argument transform
     * @return this builder
     */
    public Builder transform(ProcessingPhase phase, String pattern, ParameterTransform transform) {
      rules.get(phase).add(new TransformRule(PathPattern.compile(pattern), transform));
      return this;
    }

    /**
     * Binds a built-in hook to a pattern.
     *
     * @param phase processing phase
     * @param pattern dotted pattern
     * @param hook built-in hook
     * @return this builder
     */
    public Builder hook(ProcessingPhase phase, String pattern, BuiltinHook hook) {
      rules.get(phase).add(new HookRule(PathPattern.compile(pattern), hook));
      return this;
    }

    public Builder pre(String pattern, ParameterTransform transform) {
      return transform(ProcessingPhase.PRE, pattern, transform);
    }

    public Builder post(String pattern, ParameterTransform transform) {
      return transform(ProcessingPhase.POST, pattern, transform);
    }

    /**
     * Appends every rule of {@code other}, after the rules already declared.
     *
     * @param other registry to append
     * @return this builder
     */
    public Builder addAll(ProcessingRegistry other) {
      for (ProcessingPhase phase : ProcessingPhase.values()) {
        rules.get(phase).addAll(other.rules(phase));
      }
      return this;
    }

    public ProcessingRegistry build() {
      Map<ProcessingPhase, List<ProcessingRule>> frozen = new EnumMap<>(ProcessingPhase.class);
      rules.forEach((phase, list) -> frozen.put(phase, List.copyOf(list)));
      return new ProcessingRegistry(frozen);
    }
  }
}
