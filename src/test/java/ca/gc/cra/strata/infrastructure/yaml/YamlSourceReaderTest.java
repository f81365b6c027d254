package ca.gc.cra.strata.infrastructure.yaml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.tree.Replacement;
import ca.gc.cra.strata.domain.tree.TaggedMapping;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlSourceReaderTest {
  private final YamlSourceReader reader = new YamlSourceReader();

  @TempDir
  Path tempDir;

  @Test
  void taggedDocumentsBecomeSubConfigs() {
    Map<String, Object> content = reader.readString("""
        param1: 0.1
        --- !subconfig1
        param2: 3.0
        --- !subconfig2
        param3: 20.0
        subconfig3: !subconfig3
          param4: 'string'
        """);

    assertEquals(List.of("param1", "subconfig1", "subconfig2"), List.copyOf(content.keySet()));
    assertEquals(new TaggedMapping("subconfig1", Map.of("param2", 3.0)), content.get("subconfig1"));
    TaggedMapping second = (TaggedMapping) content.get("subconfig2");
    assertEquals(new TaggedMapping("subconfig3", Map.of("param4", "string")), second.content().get("subconfig3"));
  }

  @Test
  void untaggedMappingsStayPlainValues() {
    Map<String, Object> content = reader.readString("options: {a: 1, b: [x, y]}\n");

    assertEquals(Map.of("a", 1, "b", List.of("x", "y")), content.get("options"));
  }

  @Test
  void replaceTagWrapsTheValue() {
    Map<String, Object> content = reader.readString("epochs: !replace many\nlayers: !replace [1, 2]\n");

    assertEquals(new Replacement("many"), content.get("epochs"));
    assertEquals(new Replacement(List.of(1, 2)), content.get("layers"));
  }

  @Test
  void duplicateKeysAreRejected() {
    assertThrows(StructureException.class, () -> reader.readString("a: 1\na: 2\n"));
    assertThrows(StructureException.class, () -> reader.readString("a: 1\n---\na: 2\n"));
  }

  @Test
  void documentsMustBeMappings() {
    assertThrows(StructureException.class, () -> reader.readString("- a\n- b\n"));
  }

  @Test
  void emptyTextYieldsNoParameters() {
    assertEquals(Map.of(), reader.readString(""));
  }

  @Test
  void readsHierarchyFiles() throws IOException {
    Path file = Files.writeString(tempDir.resolve("run_hierarchy.yaml"), """
        config_hierarchy:
          - /configs/default.yaml
          - lr: 0.02
        """);

    assertEquals(List.of("/configs/default.yaml", Map.of("lr", 0.02)), reader.readHierarchy(file));
  }

  @Test
  void hierarchyFileWithoutListIsRejected() throws IOException {
    Path file = Files.writeString(tempDir.resolve("bad.yaml"), "config_hierarchy: nope\n");

    assertThrows(StructureException.class, () -> reader.readHierarchy(file));
  }
}
