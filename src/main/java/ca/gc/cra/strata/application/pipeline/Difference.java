package ca.gc.cra.strata.application.pipeline;

import java.util.Objects;

/**
 * One parameter whose value differs between two configurations.
 *
 * @param path fully-qualified parameter path
 * @param left value in the compared config, {@code null} when absent
 * @param right value in the other config, {@code null} when absent
 * @since 0.1.0
 */
public record Difference(String path, Object left, Object right) {
  public Difference {
    Objects.requireNonNull(path, "path");
  }
}
