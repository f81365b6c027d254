package ca.gc.cra.strata.domain.error;

/**
 * Raised on any direct mutation of a configuration built under the locked regime.
 *
 * @since 0.1.0
 */
public final class ImmutableConfigException extends ConfigException {
  private static final long serialVersionUID = 1L;

  public ImmutableConfigException(String message, String path) {
    super(message, path);
  }

  public ImmutableConfigException(String message, String path, Throwable cause) {
    super(message, path, cause);
  }
}
