package ca.gc.cra.strata.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads command-line tool options from a YAML document into a flat key/value map.
 *
 * <p>The document is a mapping of option names to scalars, for example {@code regime: locked}. A top-level
 * {@code strata} section, when present, is used instead of the root.</p>
 */
public final class BuildOptionsLoader {
  private static final String SECTION = "strata";

  private BuildOptionsLoader() {}

  /**
   * Loads options from {@code path}.
   *
   * @param path location of the YAML options file
   * @return flat option map, empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");
      Object section = root.get(SECTION);
      Map<String, Object> options = section == null ? root : asMap(section, SECTION);

      Map<String, String> flat = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : options.entrySet()) {
        Object value = entry.getValue();
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
          throw new IllegalArgumentException("Option " + entry.getKey() + " must be a scalar");
        }
        flat.put(entry.getKey(), value == null ? "" : value.toString());
      }
      return Optional.of(Map.copyOf(flat));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML options at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
