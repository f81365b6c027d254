package ca.gc.cra.strata.infrastructure.yaml;

import ca.gc.cra.strata.application.port.SourceReader;
import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.tree.TaggedMapping;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads YAML sources, including multi-document files and sub-config tags.
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link SourceReader} with SnakeYAML's safe
 * constructor.</p>
 * <p>A document tagged {@code --- !name} becomes the entry {@code name} holding a {@link TaggedMapping}; untagged
 * documents contribute their keys to the root. Keys must be unique across all documents.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a SnakeYAML instance is created per call.</p>
 *
 * @since 0.1.0
 */
public final class YamlSourceReader implements SourceReader {
  /** Root key of the hierarchy artifact. */
  public static final String HIERARCHY_KEY = "config_hierarchy";

  @Override
  public Map<String, Object> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return readDocuments(reader, path.toString());
    }
  }

  /**
   * Parses YAML text.
   *
   * @param text YAML documents
   * @return parameters in document order
   */
  public Map<String, Object> readString(String text) {
    try {
      return readDocuments(new StringReader(text == null ? "" : text), "inline text");
    } catch (IOException ex) {
      throw new IllegalStateException("StringReader failed", ex);
    }
  }

  @Override
  public List<Object> readHierarchy(Path path) throws IOException {
    Map<String, Object> root = read(path);
    Object entries = root.get(HIERARCHY_KEY);
    if (!(entries instanceof List<?> list)) {
      throw new StructureException("Hierarchy file " + path + " must contain a '" + HIERARCHY_KEY + "' list",
          HIERARCHY_KEY);
    }
    List<Object> hierarchy = new ArrayList<>();
    for (Object entry : list) {
      if (entry instanceof String || entry instanceof Map<?, ?>) {
        hierarchy.add(entry instanceof Map<?, ?> map ? asMap(map, "hierarchy entry") : entry);
      } else {
        throw new StructureException("Hierarchy entries must be paths or mappings, got: " + entry, HIERARCHY_KEY);
      }
    }
    return hierarchy;
  }

  private static Map<String, Object> readDocuments(Reader reader, String origin) throws IOException {
    LoaderOptions options = new LoaderOptions();
    options.setAllowDuplicateKeys(false);
    Yaml yaml = new Yaml(new StrataConstructor(options));
    Map<String, Object> combined = new LinkedHashMap<>();
    try {
      for (Object document : yaml.loadAll(reader)) {
        if (document == null) {
          continue;
        }
        if (document instanceof TaggedMapping tagged) {
          putUnique(combined, tagged.tag(), tagged, origin);
        } else if (document instanceof Map<?, ?> map) {
          for (Map.Entry<String, Object> entry : asMap(map, origin).entrySet()) {
            putUnique(combined, entry.getKey(), entry.getValue(), origin);
          }
        } else {
          throw new StructureException("Every document of " + origin + " must be a mapping", null);
        }
      }
    } catch (YAMLException ex) {
      if (ex.getCause() instanceof IOException io) {
        throw io;
      }
      throw new StructureException("Failed to parse YAML source " + origin + ": " + ex.getMessage(), null, ex);
    }
    return combined;
  }

  private static void putUnique(Map<String, Object> target, String key, Object value, String origin) {
    if (target.containsKey(key)) {
      throw new StructureException("Parameter '" + key + "' was set twice in " + origin, key);
    }
    target.put(key, value);
  }

  private static Map<String, Object> asMap(Map<?, ?> raw, String context) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new StructureException(context + " contains non-string key " + entry.getKey(), null);
      }
      map.put(key, entry.getValue());
    }
    return map;
  }
}
