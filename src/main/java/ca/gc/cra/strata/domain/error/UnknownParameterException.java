package ca.gc.cra.strata.domain.error;

/**
 * Raised when a non-default source references a key absent from the tree.
 *
 * @since 0.1.0
 */
public final class UnknownParameterException extends ConfigException {
  private static final long serialVersionUID = 1L;

  public UnknownParameterException(String message, String path) {
    super(message, path);
  }

  public UnknownParameterException(String message, String path, Throwable cause) {
    super(message, path, cause);
  }
}
