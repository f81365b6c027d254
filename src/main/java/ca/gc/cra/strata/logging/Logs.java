package ca.gc.cra.strata.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging helpers for parameter values and merged sources.
 * <p><strong>Why:</strong> Sources and parameter values may be arbitrarily large; log lines stay readable when they
 * are shortened to a byte budget.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Default UTF-8 budget for a logged value. */
  public static final int DEFAULT_VALUE_BYTES = 512;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Renders a value for a log line within {@link #DEFAULT_VALUE_BYTES}.
   *
   * @param value parameter value, source content or {@code null}
   * @return printable, possibly shortened text
   */
  public static String value(Object value) {
    return truncate(value == null ? null : String.valueOf(value), DEFAULT_VALUE_BYTES);
  }

  /**
   * Shortens a string to at most {@code maxBytes} UTF-8 bytes, never splitting a code point, and appends the
   * original size.
   *
   * @param value string to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the value when it fits, otherwise its longest fitting prefix followed by a size marker
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    int total = value.getBytes(StandardCharsets.UTF_8).length;
    if (total <= maxBytes) {
      return value;
    }
    int used = 0;
    int end = 0;
    while (end < value.length()) {
      int codePoint = value.codePointAt(end);
      int width = utf8Width(codePoint);
      if (used + width > maxBytes) {
        break;
      }
      used += width;
      end += Character.charCount(codePoint);
    }
    return value.substring(0, end) + "... (" + total + " bytes)";
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
