package ca.gc.cra.strata.application.cli;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

/**
 * Decodes and encodes single command-line literals with the YAML scalar, flow sequence and flow mapping rules.
 *
 * <p>Not thread-safe: SnakeYAML instances keep parsing state.</p>
 *
 * @since 0.1.0
 */
public final class LiteralDecoder {
  private final Yaml yaml;

  public LiteralDecoder() {
    DumperOptions dumperOptions = new DumperOptions();
    dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.FLOW);
    dumperOptions.setWidth(Integer.MAX_VALUE);
    dumperOptions.setSplitLines(false);
    this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()),
        new Representer(dumperOptions), dumperOptions);
  }

  /**
   * Decodes a literal into a boolean, integer, float, string, list, mapping or {@code null}.
   *
   * @param literal literal text
   * @return decoded value; the text itself when it is not a valid literal
   */
  public Object decode(String literal) {
    if (literal == null) {
      return null;
    }
    try {
      return yaml.load(literal);
    } catch (YAMLException ex) {
      return literal;
    }
  }

  /**
   * Encodes a value as a single-line literal that {@link #decode(String)} maps back to an equal value.
   *
   * @param value native value
   * @return literal text
   */
  public String encode(Object value) {
    return yaml.dump(value).strip();
  }
}
