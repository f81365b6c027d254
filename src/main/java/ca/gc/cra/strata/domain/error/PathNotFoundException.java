package ca.gc.cra.strata.domain.error;

/**
 * Raised when a literal (wildcard-free) path does not resolve against the tree.
 *
 * @since 0.1.0
 */
public final class PathNotFoundException extends ConfigException {
  private static final long serialVersionUID = 1L;

  public PathNotFoundException(String message, String path) {
    super(message, path);
  }

  public PathNotFoundException(String message, String path, Throwable cause) {
    super(message, path, cause);
  }
}
