package ca.gc.cra.strata.infrastructure.time;

import ca.gc.cra.strata.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
