package ca.gc.cra.strata.api;

/**
 * <strong>What:</strong> Exit codes returned by the {@code strata} command-line tool.
 * <p><strong>Why:</strong> Lets training scripts distinguish bad arguments from invalid configs and I/O
 * failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A source could not be read or a config could not be saved. */
  IO_ERROR(3),
  /** A config source was malformed or an override was rejected. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
