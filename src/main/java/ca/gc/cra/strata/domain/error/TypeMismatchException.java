package ca.gc.cra.strata.domain.error;

/**
 * Raised when an override would change the runtime kind of a parameter without an explicit full
 * structural replacement.
 *
 * @since 0.1.0
 */
public final class TypeMismatchException extends ConfigException {
  private static final long serialVersionUID = 1L;

  public TypeMismatchException(String message, String path) {
    super(message, path);
  }

  public TypeMismatchException(String message, String path, Throwable cause) {
    super(message, path, cause);
  }
}
