package ca.gc.cra.strata.application.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders parameter values as command-line overrides that {@link CliOverrideParser} maps back to equal values.
 *
 * <p>Parameters holding {@code null} are skipped: they cannot be set from the command line. Strings that would
 * decode to another kind, such as {@code 123} or {@code true}, are rendered quoted.</p>
 *
 * @since 0.1.0
 */
public final class CommandLineRenderer {
  private final LiteralDecoder decoder = new LiteralDecoder();

  /**
   * Renders one token per parameter, {@code --path=literal}.
   *
   * @param leafValues values keyed by fully-qualified path
   * @return tokens in iteration order
   */
  public List<String> render(Map<String, Object> leafValues) {
    List<String> tokens = new ArrayList<>();
    for (Map.Entry<String, Object> entry : leafValues.entrySet()) {
      Object value = entry.getValue();
      if (value == null) {
        continue;
      }
      tokens.add("--" + entry.getKey() + "=" + decoder.encode(value));
    }
    return tokens;
  }

  /**
   * Renders the parameters as a single shell-quoted command line.
   *
   * @param leafValues values keyed by fully-qualified path
   * @return command line accepted by {@link CommandLineTokenizer#tokenize(String)}
   */
  public String renderLine(Map<String, Object> leafValues) {
    StringJoiner line = new StringJoiner(" ");
    for (String token : render(leafValues)) {
      line.add(CommandLineTokenizer.quote(token));
    }
    return line.toString();
  }
}
