package ca.gc.cra.strata.domain.error;

import java.util.Optional;

/**
 * <strong>What:</strong> Root of the configuration error taxonomy.
 * <p><strong>Why:</strong> Lets callers catch every engine failure at once while still distinguishing the cause
 * through the concrete subclass.</p>
 * <p><strong>Role:</strong> Domain exception propagated synchronously to the direct caller; the engine performs
 * no rollback, so a failed merge may leave a tree partially updated.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public abstract class ConfigException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String path;

  /**
   * Creates an exception bound to an optional parameter path.
   *
   * @param message human-readable description
   * @param path offending dotted path; may be {@code null}
   */
  protected ConfigException(String message, String path) {
    super(message);
    this.path = path;
  }

  /**
   * Creates an exception bound to an optional parameter path with a cause.
   *
   * @param message human-readable description
   * @param path offending dotted path; may be {@code null}
   * @param cause underlying failure
   */
  protected ConfigException(String message, String path, Throwable cause) {
    super(message, cause);
    this.path = path;
  }

  /**
   * Returns the dotted path of the parameter involved in the failure.
   *
   * @return offending path when known
   */
  public Optional<String> path() {
    return Optional.ofNullable(path);
  }
}
