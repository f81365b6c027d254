package ca.gc.cra.strata.infrastructure.yaml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.domain.tree.Replacement;
import ca.gc.cra.strata.domain.tree.TaggedMapping;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigWriterTest {
  private final YamlConfigWriter writer = new YamlConfigWriter();

  @TempDir
  Path tempDir;

  @Test
  void subConfigsAreWrittenAsTaggedMappings() throws IOException {
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("lr", 0.1);
    content.put("model", new TaggedMapping("model", Map.of("depth", 2)));
    content.put("epochs", new Replacement(5));

    String yaml = writer.render(content);
    assertTrue(yaml.contains("!model"), yaml);
    assertTrue(yaml.contains("!replace"), yaml);

    Path file = tempDir.resolve("nested/dir/config.yaml");
    writer.write(file, content);
    assertEquals(content, new YamlSourceReader().read(file));
  }

  @Test
  void hierarchyIsWrittenUnderItsRootKey() throws IOException {
    Path file = tempDir.resolve("run_hierarchy.yaml");
    List<Object> hierarchy = List.of("/configs/default.yaml", Map.of("lr", 0.02));

    writer.writeHierarchy(file, hierarchy);

    assertEquals(hierarchy, new YamlSourceReader().readHierarchy(file));
  }
}
