package ca.gc.cra.strata.infrastructure.yaml;

import ca.gc.cra.strata.application.port.ConfigWriter;
import ca.gc.cra.strata.domain.tree.Replacement;
import ca.gc.cra.strata.domain.tree.TaggedMapping;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Represent;
import org.yaml.snakeyaml.representer.Representer;

/**
 * Writes configurations and hierarchies as block-style YAML; sub-configs are written as {@code !name} tagged
 * mappings so the file reads back into the same tree.
 *
 * @since 0.1.0
 */
public final class YamlConfigWriter implements ConfigWriter {

  @Override
  public void write(Path path, Map<String, Object> content) throws IOException {
    Objects.requireNonNull(path, "path");
    dump(path, content);
  }

  @Override
  public void writeHierarchy(Path path, List<Object> hierarchy) throws IOException {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put(YamlSourceReader.HIERARCHY_KEY, hierarchy);
    dump(path, root);
  }

  @Override
  public String render(Map<String, Object> content) {
    return newYaml().dump(content);
  }

  private static void dump(Path path, Map<String, Object> content) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      newYaml().dump(content, writer);
    }
  }

  private static Yaml newYaml() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setWidth(120);
    return new Yaml(new TagRepresenter(options), options);
  }

  private static final class TagRepresenter extends Representer {

    TagRepresenter(DumperOptions options) {
      super(options);
      this.representers.put(TaggedMapping.class, new RepresentTagged());
      this.representers.put(Replacement.class, new RepresentReplacement());
    }

    private final class RepresentTagged implements Represent {
      @Override
      public Node representData(Object data) {
        TaggedMapping tagged = (TaggedMapping) data;
        return representMapping(new Tag("!" + tagged.tag()), tagged.content(), DumperOptions.FlowStyle.AUTO);
      }
    }

    private final class RepresentReplacement implements Represent {
      @Override
      public Node representData(Object data) {
        Node node = TagRepresenter.this.representData(((Replacement) data).value());
        node.setTag(new Tag("!" + StrataConstructor.REPLACE_TAG));
        return node;
      }
    }
  }
}
