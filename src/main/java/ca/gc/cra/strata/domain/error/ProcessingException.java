package ca.gc.cra.strata.domain.error;

/**
 * Raised when a processing transform or built-in hook fails, or returns a value of a kind the phase
 * does not accept.
 *
 * @since 0.1.0
 */
public final class ProcessingException extends ConfigException {
  private static final long serialVersionUID = 1L;

  public ProcessingException(String message, String path) {
    super(message, path);
  }

  public ProcessingException(String message, String path, Throwable cause) {
    super(message, path, cause);
  }
}
