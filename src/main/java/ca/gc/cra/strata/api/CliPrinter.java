package ca.gc.cra.strata.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes command results (rendered YAML, argument lines, saved paths and usage text) to stdout.
 *
 * <p>Uses the native stdout descriptor so that results stay separate from log output.</p>
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter out = STDOUT;

  private CliPrinter() {
    // Utility
  }

  static void println(String line) {
    out.println(line);
  }

  /**
   * Prints multi-line text without its trailing blank lines.
   *
   * @param text block such as a YAML document
   */
  static void printBlock(String text) {
    out.println(text.stripTrailing());
  }

  static void redirect(PrintWriter writer) {
    out = writer;
  }

  static void restore() {
    out = STDOUT;
  }
}
