package ca.gc.cra.strata.domain.tree;

/**
 * Marks a value as an explicit full structural replacement ({@code !replace} in YAML documents), which may change
 * the runtime kind of an existing parameter.
 *
 * @param value replacing value
 * @since 0.1.0
 */
public record Replacement(Object value) {}
