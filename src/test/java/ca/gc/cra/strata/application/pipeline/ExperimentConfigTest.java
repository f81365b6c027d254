package ca.gc.cra.strata.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.domain.error.ImmutableConfigException;
import ca.gc.cra.strata.domain.error.PathNotFoundException;
import ca.gc.cra.strata.domain.error.TypeMismatchException;
import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import ca.gc.cra.strata.domain.tree.SourceDescriptor;
import ca.gc.cra.strata.infrastructure.fs.ExtensionDispatchingSourceReader;
import ca.gc.cra.strata.infrastructure.fs.FileSystemExperimentDirectories;
import ca.gc.cra.strata.infrastructure.yaml.YamlConfigWriter;
import ca.gc.cra.strata.infrastructure.yaml.YamlSourceReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExperimentConfigTest {
  @TempDir
  Path tempDir;

  private Path defaultFile;

  @BeforeEach
  void writeDefault() throws IOException {
    defaultFile = Files.writeString(tempDir.resolve("default.yaml"), """
        lr: 0.1
        epochs: 10
        name: baseline
        --- !model
        depth: 2
        dropout: 0.5
        """);
  }

  private ConfigBuilder builder() {
    return new ConfigBuilder(new ExtensionDispatchingSourceReader(), new YamlConfigWriter(),
        new FileSystemExperimentDirectories(), () -> 1_700_000_000_000L)
        .workingDirectory(tempDir)
        .zone(ZoneOffset.UTC);
  }

  @Test
  void lockedConfigRejectsSet() {
    ExperimentConfig config = builder().regime(OverwritingRegime.LOCKED).build(defaultFile);

    assertThrows(ImmutableConfigException.class, () -> config.set("lr", 0.2));
    assertEquals(0.1, config.get("lr"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void lockedConfigIsNotChangedThroughReturnedValues() throws IOException {
    Path withLists = Files.writeString(tempDir.resolve("lists.yaml"), """
        layers: [1, 2]
        optimizer: {name: adam, beta: 0.9}
        """);
    ExperimentConfig config = builder().regime(OverwritingRegime.LOCKED).build(withLists);

    ((List<Object>) config.get("layers")).add(3);
    config.get("optimizer", Map.class).put("name", "sgd");
    config.leafValues().put("layers", List.of());

    assertEquals(List.of(1, 2), config.get("layers"));
    assertEquals(Map.of("name", "adam", "beta", 0.9), config.get("optimizer"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void valuesBeforePostProcessingAreIndependentCopies() throws IOException {
    Path withLists = Files.writeString(tempDir.resolve("lists.yaml"), "layers: [1, 2]\n");
    ExperimentConfig config = builder()
        .postProcessing("layers", value -> List.of(((List<?>) value).size()))
        .build(withLists);

    ((List<Object>) config.valuesBeforePostProcessing().get("layers")).add(3);

    assertEquals(List.of(1, 2), config.valuesBeforePostProcessing().get("layers"));
    assertEquals(List.of(2), config.get("layers"));
  }

  @Test
  void autoSaveRewritesTheSavedFile() {
    ConfigBuilder builder = builder();
    ExperimentConfig config = builder.build(defaultFile);
    Path saved = config.save(tempDir.resolve("out/config.yaml"));

    config.set("lr", 0.05);

    assertEquals(0.05, config.get("lr"));
    assertEquals(0.05, builder.load(saved).get("lr"));
  }

  @Test
  void autoSaveKeepsKindChecks() {
    ExperimentConfig config = builder().build(defaultFile);

    assertThrows(TypeMismatchException.class, () -> config.set("lr", "fast"));
  }

  @Test
  void unsafeSetWritesDirectly() {
    ExperimentConfig config = builder().regime(OverwritingRegime.UNSAFE).build(defaultFile);

    config.set("lr", "fast");

    assertEquals("fast", config.get("lr"));
  }

  @Test
  void setAcceptsWildcards() {
    ExperimentConfig config = builder().build(defaultFile);

    config.set("*.dropout", 0.2);

    assertEquals(0.2, config.get("model.dropout"));
  }

  @Test
  void mergeAfterConstructionPostProcessesAndRecordsTheSource() {
    ExperimentConfig config = builder()
        .postProcessing("epochs", value -> (Integer) value * 2)
        .build(defaultFile);

    config.merge(Map.of("epochs", 30));

    assertEquals(60, config.get("epochs"));
    assertEquals(30, config.savedLeafValues().get("epochs"));
    SourceDescriptor last = config.hierarchy().get(config.hierarchy().size() - 1);
    assertEquals("code", last.origin());
  }

  @Test
  void readsValuesByPath() {
    ExperimentConfig config = builder().build(defaultFile);

    assertEquals(10, config.get("epochs", Integer.class));
    assertThrows(TypeMismatchException.class, () -> config.get("epochs", String.class));
    assertThrows(PathNotFoundException.class, () -> config.get("missing"));
    assertEquals(5, config.getOrDefault("missing", 5));
    assertEquals(List.of("model.dropout"), config.match("*.dropout"));
  }

  @Test
  void subConfigReadsAreIndependentCopies() {
    ExperimentConfig config = builder().build(defaultFile);

    @SuppressWarnings("unchecked")
    Map<String, Object> model = (Map<String, Object>) config.get("model");
    model.put("depth", 99);

    assertEquals(2, config.get("model.depth"));
  }

  @Test
  void compareListsDifferingParameters() {
    ExperimentConfig left = builder().build(defaultFile);
    ExperimentConfig right = builder().commandLine("--lr=0.5").build(defaultFile);

    assertEquals(List.of(new Difference("lr", 0.1, 0.5)), left.compare(right));
    assertTrue(left.compare(left.copy()).isEmpty());
  }

  @Test
  void copyIsIndependentAndUnsaved() {
    ExperimentConfig config = builder().build(defaultFile);
    config.save(tempDir.resolve("config.yaml"));

    ExperimentConfig copy = config.copy();
    copy.set("lr", 0.3);

    assertEquals(0.1, config.get("lr"));
    assertTrue(copy.savedPath().isEmpty());
    assertTrue(config.savedPath().isPresent());
  }

  @Test
  void copyWithRegimeChangesGuard() {
    ExperimentConfig locked = builder().build(defaultFile).copyWithRegime(OverwritingRegime.LOCKED);

    assertEquals(OverwritingRegime.LOCKED, locked.regime());
    assertThrows(ImmutableConfigException.class, () -> locked.set("epochs", 3));
  }

  @Test
  void commandLineArgumentsRebuildTheConfig() {
    ExperimentConfig config = builder().commandLine("--lr=0.02 --name 'my run'").build(defaultFile);

    List<String> arguments = config.commandLineArguments();
    ExperimentConfig rebuilt = builder().commandLine(arguments).build(defaultFile);

    assertTrue(arguments.contains("--lr=0.02"));
    assertEquals(config.leafValues(), rebuilt.leafValues());
  }

  @Test
  void experimentPathRequiresARegisteredParameter() {
    ExperimentConfig config = builder().build(defaultFile);

    assertThrows(IllegalStateException.class, config::experimentPath);
  }

  @Test
  void saveWritesMetadataAndHierarchy() throws IOException {
    ExperimentConfig config = builder().build(defaultFile);

    Path saved = config.save(tempDir.resolve("runs/config.yaml"));

    Map<String, Object> content = new YamlSourceReader().read(saved);
    Metadata metadata = Metadata.parse(content.get("config_metadata"));
    assertEquals(OverwritingRegime.AUTO_SAVE, metadata.regime());
    assertEquals(1_700_000_000.0, metadata.epochSeconds(), 1e-6);
    assertEquals(0.1, content.get("lr"));
    assertTrue(Files.isRegularFile(tempDir.resolve("runs/config_hierarchy.yaml")));
    assertEquals(List.of(defaultFile.toString()),
        new YamlSourceReader().readHierarchy(tempDir.resolve("runs/config_hierarchy.yaml")));
  }

  @Test
  void setChangesOnlyTheTargetParameter() {
    ExperimentConfig config = builder().build(defaultFile);
    Map<String, Object> values = new HashMap<>(config.leafValues());

    config.set("epochs", 12);
    values.put("epochs", 12);

    assertEquals(values, config.leafValues());
  }
}
