package ca.gc.cra.strata.config;

import ca.gc.cra.strata.application.pipeline.ConfigBuilder;
import ca.gc.cra.strata.application.port.ClockPort;
import ca.gc.cra.strata.application.port.ConfigWriter;
import ca.gc.cra.strata.application.port.ExperimentDirectoryPort;
import ca.gc.cra.strata.application.port.SourceReader;
import ca.gc.cra.strata.application.variation.VariationExpander;
import ca.gc.cra.strata.infrastructure.fs.ExtensionDispatchingSourceReader;
import ca.gc.cra.strata.infrastructure.fs.FileSystemExperimentDirectories;
import ca.gc.cra.strata.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.strata.infrastructure.yaml.YamlConfigWriter;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the build pipeline to concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the application layer only sees ports.</p>
 * <p><strong>Role:</strong> Composition root used by the command-line tool and by library callers.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable options; each factory call returns new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final BuildOptions options;
  private final SourceReader reader;
  private final ConfigWriter writer;
  private final ExperimentDirectoryPort directories;
  private final ClockPort clock;

  /**
   * Creates a root over the default adapters: YAML/JSON sources, YAML output, file-system directories and the
   * system clock.
   *
   * @param options build options applied to every builder
   */
  public CompositionRoot(BuildOptions options) {
    this(options, new ExtensionDispatchingSourceReader(), new YamlConfigWriter(),
        new FileSystemExperimentDirectories(), new SystemClockAdapter());
  }

  /**
   * Creates a root over explicit adapters.
   *
   * @param options build options applied to every builder
   * @param reader source parser
   * @param writer saved-config serializer
   * @param directories experiment directory creator
   * @param clock time source for saves
   */
  public CompositionRoot(BuildOptions options, SourceReader reader, ConfigWriter writer,
      ExperimentDirectoryPort directories, ClockPort clock) {
    this.options = Objects.requireNonNull(options, "options");
    this.reader = Objects.requireNonNull(reader, "reader");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.directories = Objects.requireNonNull(directories, "directories");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns a root with default options and adapters.
   *
   * @return composition root
   */
  public static CompositionRoot defaults() {
    return new CompositionRoot(BuildOptions.defaults());
  }

  public BuildOptions options() {
    return options;
  }

  /**
   * Creates a builder wired to this root's adapters and options.
   *
   * @return new builder
   */
  public ConfigBuilder configBuilder() {
    return new ConfigBuilder(reader, writer, directories, clock).options(options);
  }

  public VariationExpander variationExpander() {
    return new VariationExpander();
  }
}
