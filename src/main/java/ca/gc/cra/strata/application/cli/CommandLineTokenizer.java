package ca.gc.cra.strata.application.cli;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command-line string into tokens the way a POSIX shell would for simple cases: whitespace separates
 * tokens, single quotes keep text literally, double quotes keep whitespace and honour backslash escapes.
 *
 * @since 0.1.0
 */
public final class CommandLineTokenizer {

  private CommandLineTokenizer() {
    // Utility
  }

  /**
   * Tokenizes {@code commandLine}.
   *
   * @param commandLine raw command line; {@code null} yields no tokens
   * @return tokens in order
   * @throws IllegalArgumentException when a quote is left open
   */
  public static List<String> tokenize(String commandLine) {
    List<String> tokens = new ArrayList<>();
    if (commandLine == null) {
      return tokens;
    }
    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    char quote = 0;
    for (int i = 0; i < commandLine.length(); i++) {
      char c = commandLine.charAt(i);
      if (quote == '\'') {
        if (c == '\'') {
          quote = 0;
        } else {
          current.append(c);
        }
        continue;
      }
      if (c == '\\' && i + 1 < commandLine.length()) {
        char next = commandLine.charAt(i + 1);
        if (quote == 0 || next == '"' || next == '\\') {
          current.append(next);
          inToken = true;
          i++;
          continue;
        }
      }
      if (quote == '"') {
        if (c == '"') {
          quote = 0;
        } else {
          current.append(c);
        }
        continue;
      }
      if (c == '\'' || c == '"') {
        quote = c;
        inToken = true;
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          tokens.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
      } else {
        current.append(c);
        inToken = true;
      }
    }
    if (quote != 0) {
      throw new IllegalArgumentException("unterminated " + quote + " quote in command line");
    }
    if (inToken) {
      tokens.add(current.toString());
    }
    return tokens;
  }

  /**
   * Quotes a token so that {@link #tokenize(String)} returns it unchanged.
   *
   * @param token raw token
   * @return token, single-quoted when it contains whitespace or quotes
   */
  public static String quote(String token) {
    boolean plain = !token.isEmpty();
    for (int i = 0; i < token.length() && plain; i++) {
      char c = token.charAt(i);
      plain = !Character.isWhitespace(c) && c != '\'' && c != '"' && c != '\\';
    }
    if (plain) {
      return token;
    }
    return "'" + token.replace("'", "'\"'\"'") + "'";
  }
}
