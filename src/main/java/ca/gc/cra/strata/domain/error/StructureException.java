package ca.gc.cra.strata.domain.error;

/**
 * Raised on tag and shape conflicts: a tag naming another parameter, a sub-config addressed through a
 * plain value, a key set twice in a defining source, or an unreadable document.
 *
 * @since 0.1.0
 */
public final class StructureException extends ConfigException {
  private static final long serialVersionUID = 1L;

  public StructureException(String message, String path) {
    super(message, path);
  }

  public StructureException(String message, String path, Throwable cause) {
    super(message, path, cause);
  }
}
