package ca.gc.cra.strata.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for saved-config metadata.
 * <p><strong>Why:</strong> Lets tests pin the saving time written into {@code config_metadata}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.strata.infrastructure.time.SystemClockAdapter
 */
@FunctionalInterface
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
