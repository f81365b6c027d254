package ca.gc.cra.strata.application.pipeline;

import ca.gc.cra.strata.application.cli.CliOverrideParser;
import ca.gc.cra.strata.application.cli.CliOverrides;
import ca.gc.cra.strata.application.cli.CommandLineTokenizer;
import ca.gc.cra.strata.application.merge.MergeMode;
import ca.gc.cra.strata.application.port.ClockPort;
import ca.gc.cra.strata.application.port.ConfigWriter;
import ca.gc.cra.strata.application.port.ExperimentDirectoryPort;
import ca.gc.cra.strata.application.port.SourceReader;
import ca.gc.cra.strata.application.processing.BuiltinHook;
import ca.gc.cra.strata.application.processing.ParameterTransform;
import ca.gc.cra.strata.application.processing.ProcessingPhase;
import ca.gc.cra.strata.application.processing.ProcessingRegistry;
import ca.gc.cra.strata.config.BuildOptions;
import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import ca.gc.cra.strata.domain.tree.SourceDescriptor;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the build pipeline producing an {@link ExperimentConfig}.
 * <p><strong>Role:</strong> Application use case; the composition root supplies its adapters.</p>
 * <p><strong>Pipeline:</strong>
 * <ol>
 *   <li>Merge the default source; it defines every legal key.</li>
 *   <li>Merge each experiment source in order as an override; {@code --config} paths from the command line are
 *   appended to the explicit sources.</li>
 *   <li>Parse and merge command-line overrides.</li>
 *   <li>Post-process every modified parameter.</li>
 *   <li>Warn about processing patterns matching nothing, then hand the config to its overwrite guard.</li>
 * </ol>
 * <p>Any step may throw a {@link ca.gc.cra.strata.domain.error.ConfigException}; nothing is rolled back.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a builder is configured and used by one thread.</p>
 *
 * @since 0.1.0
 */
public final class ConfigBuilder {
  private static final Logger log = LoggerFactory.getLogger(ConfigBuilder.class);
  private static final String DEFAULT_NAME = "main";

  private final SourceReader reader;
  private final ConfigWriter writer;
  private final ExperimentDirectoryPort directories;
  private final ClockPort clock;
  private final ProcessingRegistry.Builder processing = ProcessingRegistry.builder();
  private BuildOptions options = BuildOptions.defaults();
  private String name = DEFAULT_NAME;
  private List<String> commandLine = List.of();
  private ZoneId zone = ZoneId.systemDefault();
  private Path workingDirectory = Path.of("");

  /**
   * Creates a builder over explicit adapters.
   *
   * @param reader parses source files
   * @param writer serializes saved configs
   * @param directories creates experiment directories
   * @param clock supplies saving times
   */
  public ConfigBuilder(SourceReader reader, ConfigWriter writer, ExperimentDirectoryPort directories,
      ClockPort clock) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.directories = Objects.requireNonNull(directories, "directories");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ConfigBuilder name(String rootName) {
    this.name = Objects.requireNonNull(rootName, "rootName");
    return this;
  }

  public ConfigBuilder options(BuildOptions buildOptions) {
    this.options = Objects.requireNonNull(buildOptions, "buildOptions");
    return this;
  }

  public ConfigBuilder regime(OverwritingRegime regime) {
    this.options = options.withRegime(regime);
    return this;
  }

  /**
   * Binds a transform run when a matching parameter is set.
   *
   * @param pattern dotted pattern
   * @param transform one-argument transform
   * @return this builder
   */
  public ConfigBuilder preProcessing(String pattern, ParameterTransform transform) {
    processing.pre(pattern, transform);
    return this;
  }

  /**
   * Binds a transform run on matching modified parameters at the end of each pipeline.
   *
   * @param pattern dotted pattern
   * @param transform one-argument transform
   * @return this builder
   */
  public ConfigBuilder postProcessing(String pattern, ParameterTransform transform) {
    processing.post(pattern, transform);
    return this;
  }

  /**
   * Binds a built-in hook; hooks registered this way run at pre-processing time.
   *
   * @param pattern dotted pattern
   * @param hook built-in hook
   * @return this builder
   */
  public ConfigBuilder hook(String pattern, BuiltinHook hook) {
    processing.hook(ProcessingPhase.PRE, pattern, hook);
    return this;
  }

  public ConfigBuilder processing(ProcessingRegistry registry) {
    processing.addAll(Objects.requireNonNull(registry, "registry"));
    return this;
  }

  /**
   * Sets the command-line tokens merged after the experiment sources.
   *
   * @param tokens raw tokens such as {@code --lr=0.1}
   * @return this builder
   */
  public ConfigBuilder commandLine(List<String> tokens) {
    this.commandLine = tokens == null ? List.of() : List.copyOf(tokens);
    return this;
  }

  /**
   * Sets the command line from a single shell-like string.
   *
   * @param line command line, quoted like a shell would
   * @return this builder
   */
  public ConfigBuilder commandLine(String line) {
    return commandLine(CommandLineTokenizer.tokenize(line));
  }

  public ConfigBuilder zone(ZoneId saveZone) {
    this.zone = Objects.requireNonNull(saveZone, "saveZone");
    return this;
  }

  /**
   * Sets the directory relative source paths fall back to.
   *
   * @param directory base directory
   * @return this builder
   */
  public ConfigBuilder workingDirectory(Path directory) {
    this.workingDirectory = Objects.requireNonNull(directory, "directory");
    return this;
  }

  /**
   * Builds a config from a default source and experiment sources.
   *
   * @param defaultSource path ({@link String} or {@link Path}) or inline mapping defining every legal key
   * @param sources override sources, merged in order
   * @return constructed config
   */
  public ExperimentConfig build(Object defaultSource, Object... sources) {
    Objects.requireNonNull(defaultSource, "defaultSource");
    ExperimentConfig config = newConfig();
    config.mergeSource(defaultSource, MergeMode.DEFAULT, "default");
    List<Object> overrides = new ArrayList<>(Arrays.asList(sources));
    if (options.mergeCommandLine()) {
      overrides.addAll(CliOverrideParser.configPaths(commandLine));
    }
    for (Object source : overrides) {
      config.mergeSource(source, MergeMode.OVERRIDE, "inline");
    }
    if (options.mergeCommandLine() && !commandLine.isEmpty()) {
      mergeCommandLine(config);
    }
    return complete(config);
  }

  /**
   * Reloads a saved config. Its metadata disables pre-processing and restores the saved regime.
   *
   * @param savedFile file written by {@link ExperimentConfig#save(Path)}
   * @return constructed config
   */
  public ExperimentConfig load(Path savedFile) {
    Objects.requireNonNull(savedFile, "savedFile");
    ExperimentConfig config = newConfig();
    config.mergeFile(savedFile, MergeMode.DEFAULT);
    return complete(config);
  }

  /**
   * Rebuilds a config by merging a hierarchy artifact in order: the first entry as default source, the rest as
   * overrides.
   *
   * @param artifact file paths and inline mappings, as returned by {@link ExperimentConfig#hierarchyArtifact()}
   * @return constructed config
   * @throws StructureException when the artifact is empty or holds another kind of entry
   */
  public ExperimentConfig replay(List<Object> artifact) {
    if (artifact == null || artifact.isEmpty()) {
      throw new StructureException("Cannot replay an empty config hierarchy", null);
    }
    ExperimentConfig config = newConfig();
    for (int i = 0; i < artifact.size(); i++) {
      Object entry = artifact.get(i);
      if (!(entry instanceof String) && !(entry instanceof Map<?, ?>)) {
        throw new StructureException("Config hierarchy entries must be paths or mappings, got: " + entry, null);
      }
      config.mergeSource(entry, i == 0 ? MergeMode.DEFAULT : MergeMode.OVERRIDE, "hierarchy");
    }
    return complete(config);
  }

  /**
   * Rebuilds a config from a hierarchy file written next to a saved config.
   *
   * @param hierarchyFile {@code <stem>_hierarchy.yaml} file
   * @return constructed config
   * @throws UncheckedIOException when the file cannot be read
   */
  public ExperimentConfig replay(Path hierarchyFile) {
    try {
      return replay(reader.readHierarchy(hierarchyFile));
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read config hierarchy " + hierarchyFile, ex);
    }
  }

  private ExperimentConfig newConfig() {
    PipelinePorts ports = new PipelinePorts(reader, writer, directories, clock, zone, workingDirectory);
    return new ExperimentConfig(name, processing.build(), options.regime(), options.preProcess(),
        options.postProcess(), ports);
  }

  private void mergeCommandLine(ExperimentConfig config) {
    CliOverrideParser parser = new CliOverrideParser(options.strictCommandLine());
    CliOverrides overrides = parser.parse(commandLine, config.tree(), config::referenceValue);
    config.recordMatchReports(overrides.matchReports());
    if (overrides.overrides().isEmpty()) {
      return;
    }
    config.mergeContent(SourceDescriptor.inline("command line", overrides.overrides()), overrides.overrides(),
        MergeMode.OVERRIDE);
  }

  private ExperimentConfig complete(ExperimentConfig config) {
    config.postProcess();
    config.warnUnmatchedPatterns();
    config.finishConstruction();
    log.debug("Built {}", config);
    return config;
  }
}
