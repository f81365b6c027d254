package ca.gc.cra.strata.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.application.processing.BuiltinHook;
import ca.gc.cra.strata.application.processing.ProcessingFunctions;
import ca.gc.cra.strata.application.variation.VariationExpander;
import ca.gc.cra.strata.config.BuildOptions;
import ca.gc.cra.strata.domain.error.ProcessingException;
import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.error.TypeMismatchException;
import ca.gc.cra.strata.domain.error.UnknownParameterException;
import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import ca.gc.cra.strata.domain.tree.SourceDescriptor;
import ca.gc.cra.strata.infrastructure.fs.ExtensionDispatchingSourceReader;
import ca.gc.cra.strata.infrastructure.fs.FileSystemExperimentDirectories;
import ca.gc.cra.strata.infrastructure.yaml.YamlConfigWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigBuilderTest {
  private static final String DEFAULT_YAML = """
      lr: 0.1
      epochs: 10
      name: baseline
      experiment_path: null
      extra: null
      lr_sweep: null
      depth_sweep: null
      grid: null
      --- !model
      depth: 2
      dropout: 0.5
      """;

  @TempDir
  Path tempDir;

  private Path defaultFile;

  @BeforeEach
  void writeDefault() throws IOException {
    defaultFile = write("default.yaml", DEFAULT_YAML);
  }

  private Path write(String name, String content) throws IOException {
    Path file = tempDir.resolve(name);
    Files.createDirectories(file.getParent());
    return Files.writeString(file, content);
  }

  private ConfigBuilder builder() {
    return new ConfigBuilder(new ExtensionDispatchingSourceReader(), new YamlConfigWriter(),
        new FileSystemExperimentDirectories(), () -> 1_700_000_000_000L)
        .workingDirectory(tempDir)
        .zone(ZoneOffset.UTC);
  }

  @Test
  void defaultSourceDefinesParametersAndSubConfigs() {
    ExperimentConfig config = builder().build(defaultFile);

    assertEquals(0.1, config.get("lr"));
    assertEquals(2, config.get("model.depth"));
    assertEquals(Map.of("depth", 2, "dropout", 0.5), config.get("model"));
    assertTrue(config.parameterNames().contains("model.dropout"));
    assertEquals(1, config.hierarchy().size());
  }

  @Test
  void sourcesAndCommandLineOverrideInOrder() throws IOException {
    write("exp.yaml", """
        lr: 0.01
        epochs: 20
        --- !model
        depth: 3
        """);

    ExperimentConfig config = builder()
        .commandLine("--lr=0.02 --model.depth 4 --name 'my run'")
        .build("default", "exp");

    assertEquals(0.02, config.get("lr"));
    assertEquals(20, config.get("epochs"));
    assertEquals(4, config.get("model.depth"));
    assertEquals("my run", config.get("name"));
    assertEquals(3, config.hierarchy().size());
    SourceDescriptor last = config.hierarchy().get(2);
    assertEquals("command line", last.origin());
  }

  @Test
  void overrideOfUnknownParameterFails() throws IOException {
    write("exp.yaml", "learning_rate: 0.01\n");

    ConfigBuilder builder = builder();
    assertThrows(UnknownParameterException.class, () -> builder.build(defaultFile, "exp.yaml"));
  }

  @Test
  void overrideChangingKindFails() throws IOException {
    write("exp.yaml", "epochs: many\n");

    ConfigBuilder builder = builder();
    assertThrows(TypeMismatchException.class, () -> builder.build(defaultFile, "exp.yaml"));
  }

  @Test
  void explicitReplacementChangesKind() throws IOException {
    write("exp.yaml", "epochs: !replace many\n");

    assertEquals("many", builder().build(defaultFile, "exp.yaml").get("epochs"));
  }

  @Test
  void commandLineConfigOptionAppendsSources() throws IOException {
    write("exp.yaml", "epochs: 20\n");
    write("more.yaml", "epochs: 30\nlr: 0.5\n");

    ExperimentConfig config = builder()
        .commandLine(List.of("--config", "exp", "more", "--lr=0.3"))
        .build(defaultFile);

    assertEquals(30, config.get("epochs"));
    assertEquals(0.3, config.get("lr"));
  }

  @Test
  void strictCommandLineRejectsUnknownNames() {
    ConfigBuilder builder = builder()
        .options(new BuildOptions(OverwritingRegime.AUTO_SAVE, true, true, true, true, false))
        .commandLine("--unknown=1");

    assertThrows(UnknownParameterException.class, () -> builder.build(defaultFile));
  }

  @Test
  void lenientCommandLineIgnoresUnknownNames() {
    ExperimentConfig config = builder().commandLine("--unknown=1 --epochs=3").build(defaultFile);

    assertEquals(3, config.get("epochs"));
    assertFalse(config.contains("unknown"));
  }

  @Test
  void disabledCommandLineMergeIgnoresTokens() {
    ExperimentConfig config = builder()
        .options(new BuildOptions(OverwritingRegime.AUTO_SAVE, false, true, true, false, false))
        .commandLine("--epochs=3")
        .build(defaultFile);

    assertEquals(10, config.get("epochs"));
  }

  @Test
  void preProcessingValidatesMergedValues() {
    ConfigBuilder builder = builder()
        .preProcessing("lr", ProcessingFunctions.numberInRange(0, 1))
        .commandLine("--lr=2.0");

    ProcessingException ex = assertThrows(ProcessingException.class, () -> builder.build(defaultFile));
    assertEquals("lr", ex.path().orElseThrow());
  }

  @Test
  void preProcessingMustProduceNativeValues() {
    ConfigBuilder builder = builder().preProcessing("name", value -> Path.of((String) value));

    assertThrows(ProcessingException.class, () -> builder.build(defaultFile));
  }

  @Test
  void postProcessingKeepsOriginalValueForSaving() throws IOException {
    ConfigBuilder builder = builder().postProcessing("name", value -> ((String) value).toUpperCase());
    ExperimentConfig config = builder.build(defaultFile);

    assertEquals("BASELINE", config.get("name"));
    assertEquals("baseline", config.savedLeafValues().get("name"));
    assertEquals(Map.of("name", "baseline"), config.valuesBeforePostProcessing());

    Path saved = config.save(tempDir.resolve("out/config.yaml"));
    assertTrue(Files.readString(saved).contains("name: baseline"));
    assertEquals("BASELINE", builder.load(saved).get("name"));
  }

  @Test
  void postProcessingMayProduceNonNativeValues() {
    ExperimentConfig config = builder()
        .postProcessing("name", value -> Path.of((String) value))
        .build(defaultFile);

    assertEquals(Path.of("baseline"), config.get("name"));
    assertTrue(config.toYaml().contains("name: baseline"));
  }

  @Test
  void experimentPathHookCreatesIndexedRunDirectory() throws IOException {
    Path requested = tempDir.resolve("runs/exp");
    write("exp.yaml", "experiment_path: '" + requested + "'\n");

    ExperimentConfig config = builder()
        .hook("experiment_path", BuiltinHook.EXPERIMENT_PATH)
        .build(defaultFile, "exp.yaml");

    Path expected = tempDir.resolve("runs/exp_0");
    assertEquals(expected, config.experimentPath().orElseThrow());
    assertTrue(Files.isDirectory(expected));
    assertEquals(List.of("experiment_path"), config.hooked(BuiltinHook.EXPERIMENT_PATH));
  }

  @Test
  void emptyExperimentPathCreatesNothing() {
    ExperimentConfig config = builder()
        .hook("experiment_path", BuiltinHook.EXPERIMENT_PATH)
        .build(defaultFile);

    assertTrue(config.experimentPath().isEmpty());
    assertNull(config.get("experiment_path"));
  }

  @Test
  void additionalConfigFileIsMergedWhereItIsDeclared() throws IOException {
    write("exp.yaml", "extra: more\n");
    write("more.yaml", "epochs: 50\n");

    ExperimentConfig config = builder()
        .hook("extra", BuiltinHook.ADDITIONAL_CONFIG_FILE)
        .build(defaultFile, "exp.yaml");

    assertEquals(50, config.get("epochs"));
    assertEquals("more", config.get("extra"));
  }

  @Test
  void variationsAndGridProduceOneChildPerCombination() throws IOException {
    Path requested = tempDir.resolve("runs/exp");
    write("exp.yaml", "experiment_path: '" + requested + "'\n" + """
        lr_sweep:
          - lr: 0.01
          - lr: 0.001
        depth_sweep:
          - model.depth: 4
          - model.depth: 8
        grid: [lr_sweep, depth_sweep]
        """);

    ExperimentConfig config = builder()
        .hook("experiment_path", BuiltinHook.EXPERIMENT_PATH)
        .hook("*_sweep", BuiltinHook.CONFIG_VARIATIONS)
        .hook("grid", BuiltinHook.GRID)
        .build(defaultFile, "exp.yaml");

    List<ExperimentConfig> children = new VariationExpander().createVariations(config);

    assertEquals(4, children.size());
    ExperimentConfig child = children.get(1);
    assertEquals("lr_sweep_0+depth_sweep_1", child.variationName().orElseThrow());
    assertEquals(0.01, child.get("lr"));
    assertEquals(8, child.get("model.depth"));
    Path childDir = tempDir.resolve("runs/exp_0/lr_sweep_0+depth_sweep_1");
    assertEquals(childDir, child.experimentPath().orElseThrow());
    assertTrue(Files.isDirectory(childDir));
    assertEquals(0.1, config.get("lr"));
    assertEquals(2, config.get("model.depth"));
  }

  @Test
  void variationChildrenRecordExactlyTheirPatches() throws IOException {
    write("exp.yaml", """
        lr_sweep:
          - lr: 0.01
          - lr: 0.001
          - lr: 0.0001
        depth_sweep:
          - model.depth: 4
          - model.depth: 8
        """);
    ConfigBuilder builder = builder().hook("*_sweep", BuiltinHook.CONFIG_VARIATIONS);
    ExperimentConfig config = builder.build(defaultFile, "exp.yaml");
    int parentSize = config.hierarchy().size();

    List<ExperimentConfig> variations = new VariationExpander().createVariations(config);

    assertEquals(5, variations.size());
    for (ExperimentConfig child : variations) {
      assertEquals(parentSize + 1, child.hierarchy().size());
      assertEquals(1, child.compare(config).size());
    }
    ExperimentConfig deep = variations.get(4);
    assertEquals("depth_sweep_1", deep.variationName().orElseThrow());
    assertEquals(Map.of("model.depth", 8), deep.hierarchyArtifact().get(parentSize));
    assertEquals(List.of("model.depth"), deep.compare(config).stream().map(Difference::path).toList());

    write("grid.yaml", "grid: [lr_sweep, depth_sweep]\n");
    ExperimentConfig gridded = builder.hook("grid", BuiltinHook.GRID).build(defaultFile, "exp.yaml", "grid.yaml");
    int griddedSize = gridded.hierarchy().size();
    List<ExperimentConfig> combinations = new VariationExpander().createVariations(gridded);

    assertEquals(6, combinations.size());
    for (ExperimentConfig child : combinations) {
      assertEquals(griddedSize + 2, child.hierarchy().size());
      assertEquals(List.of("lr", "model.depth"),
          child.compare(gridded).stream().map(Difference::path).sorted().toList());
    }
    ExperimentConfig last = combinations.get(5);
    assertEquals("lr_sweep_2+depth_sweep_1", last.variationName().orElseThrow());
    assertEquals(List.of(Map.of("lr", 0.0001), Map.of("model.depth", 8)),
        last.hierarchyArtifact().subList(griddedSize, griddedSize + 2));
  }

  @Test
  void savedVariationKeepsItsName() throws IOException {
    write("exp.yaml", """
        lr_sweep:
          small: {lr: 0.01}
          large: {lr: 0.5}
        """);
    ConfigBuilder builder = builder().hook("lr_sweep", BuiltinHook.CONFIG_VARIATIONS);
    ExperimentConfig config = builder.build(defaultFile, "exp.yaml");
    ExperimentConfig large = new VariationExpander().createVariations(config).get(1);

    Path saved = large.save(tempDir.resolve("large.yaml"));
    ExperimentConfig reloaded = builder.load(saved);

    assertEquals("lr_sweep_large", reloaded.variationName().orElseThrow());
    assertEquals(0.5, reloaded.get("lr"));
  }

  @Test
  void loadRestoresTheSavedRegime() {
    ExperimentConfig config = builder().regime(OverwritingRegime.UNSAFE).build(defaultFile);
    Path saved = config.save(tempDir.resolve("unsafe.yaml"));

    ExperimentConfig reloaded = builder().load(saved);

    assertEquals(OverwritingRegime.UNSAFE, reloaded.regime());
    assertEquals(config.leafValues(), reloaded.leafValues());
  }

  @Test
  void loadSkipsPreProcessing() {
    Path saved = builder().build(defaultFile).save(tempDir.resolve("saved.yaml"));

    ConfigBuilder rejecting = builder().preProcessing("lr", value -> {
      throw new IllegalArgumentException("rejected");
    });

    assertEquals(0.1, rejecting.load(saved).get("lr"));
  }

  @Test
  void replayFromHierarchyFileRebuildsTheSameValues() throws IOException {
    write("exp.yaml", "epochs: 20\n");
    ExperimentConfig config = builder().commandLine("--lr=0.02").build(defaultFile, "exp.yaml");
    Path saved = config.save(tempDir.resolve("out/run.yaml"));

    Path hierarchyFile = ExperimentConfig.hierarchyFileFor(saved);
    ExperimentConfig replayed = builder().replay(hierarchyFile);

    assertEquals(tempDir.resolve("out/run_hierarchy.yaml"), hierarchyFile);
    assertEquals(config.leafValues(), replayed.leafValues());
    assertEquals(config.hierarchyArtifact(), replayed.hierarchyArtifact());
  }

  @Test
  void replayRejectsEmptyHierarchy() {
    ConfigBuilder builder = builder();

    assertThrows(StructureException.class, () -> builder.replay(List.of()));
  }

  @Test
  void inlineMappingCanBeTheDefaultSource() {
    ExperimentConfig config = builder().build(Map.of("alpha", 1), Map.of("alpha", 2));

    assertEquals(2, config.get("alpha"));
    assertInstanceOf(SourceDescriptor.InlineSource.class, config.hierarchy().get(0));
  }
}
