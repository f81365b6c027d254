package ca.gc.cra.strata.api;

import ca.gc.cra.strata.application.pipeline.ConfigBuilder;
import ca.gc.cra.strata.application.pipeline.ExperimentConfig;
import ca.gc.cra.strata.application.processing.BuiltinHook;
import ca.gc.cra.strata.config.BuildOptions;
import ca.gc.cra.strata.config.BuildOptionsLoader;
import ca.gc.cra.strata.config.CompositionRoot;
import ca.gc.cra.strata.config.OptionsMerger;
import ca.gc.cra.strata.domain.error.ConfigException;
import ca.gc.cra.strata.logging.LoggingConfigurator;
import ca.gc.cra.strata.validation.Paths;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the config-building commands of the {@code strata} tool.
 *
 * <p>Every command builds the config from {@code default=}, {@code sources=} and the overrides given after
 * {@code --}, then renders, saves or expands it.</p>
 *
 * @since 0.1.0
 */
final class ConfigCli {
  private static final Logger log = LoggerFactory.getLogger(ConfigCli.class);
  private static final String DEFAULT_KEY = "default";
  private static final String SOURCES_KEY = "sources";
  private static final String OUT_KEY = "out";
  private static final String OPTIONS_KEY = "options";
  private static final String OVERWRITE_KEY = "overwrite";
  private static final String HOOKS_KEY = "hooks";

  /** Tool commands. */
  enum Command {
    SHOW,
    SAVE,
    VARIATIONS,
    ARGS
  }

  private ConfigCli() {}

  /**
   * Executes {@code command}.
   *
   * @param command command to run
   * @param input parsed dispatcher input carrying options, flags and overrides
   * @return exit code capturing the outcome
   */
  static ExitCode run(Command command, CliInput input) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.options()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(Main.usage());
      return ExitCode.INVALID_ARGS;
    }

    String defaultSource = kv.remove(DEFAULT_KEY);
    List<String> sources = splitList(kv.remove(SOURCES_KEY));
    String out = kv.remove(OUT_KEY);
    String optionsPath = kv.remove(OPTIONS_KEY);
    String hooks = kv.remove(HOOKS_KEY);
    boolean allowOverwrite = input.has(CliInput.Flag.ALLOW_OVERWRITE)
        || Boolean.parseBoolean(kv.remove(OVERWRITE_KEY));
    if (defaultSource == null) {
      log.error("Missing required argument: default=PATH");
      CliPrinter.println(Main.usage());
      return ExitCode.INVALID_ARGS;
    }
    if (command == Command.SAVE && out == null) {
      log.error("The save command requires out=FILE");
      CliPrinter.println(Main.usage());
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> defaults = OptionsMerger.defaults();
    for (String key : kv.keySet()) {
      if (!defaults.containsKey(key)) {
        log.error("Unknown option: {}", key);
        CliPrinter.println(Main.usage());
        return ExitCode.INVALID_ARGS;
      }
    }

    Optional<Map<String, String>> yamlOptions = Optional.empty();
    if (optionsPath != null) {
      Path yamlPath = Path.of(optionsPath);
      if (!Files.exists(yamlPath)) {
        log.error("Options file does not exist: {}", yamlPath);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlOptions = BuildOptionsLoader.load(yamlPath);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML options: {}", ex.getMessage());
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read options file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    BuildOptions options;
    try {
      options = OptionsMerger.toBuildOptions(
          OptionsMerger.buildEffectiveOptions(yamlOptions, kv, defaults, log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid options: {}", ex.getMessage());
      CliPrinter.println(Main.usage());
      return ExitCode.INVALID_ARGS;
    }
    if (options.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    CompositionRoot root = new CompositionRoot(options);
    ConfigBuilder builder = root.configBuilder().commandLine(input.overrides());
    try {
      bindHooks(builder, hooks);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid hooks: {}", ex.getMessage());
      CliPrinter.println(Main.usage());
      return ExitCode.INVALID_ARGS;
    }
    try {
      ExperimentConfig config = builder.build(defaultSource, sources.toArray());
      return switch (command) {
        case SHOW -> show(config);
        case ARGS -> args(config);
        case SAVE -> save(config, Path.of(out), allowOverwrite);
        case VARIATIONS -> variations(root, config, out, allowOverwrite);
      };
    } catch (ConfigException ex) {
      log.error("Invalid configuration{}: {}", ex.path().map(p -> " at '" + p + "'").orElse(""), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (UncheckedIOException ex) {
      log.error("I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid arguments: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode show(ExperimentConfig config) {
    CliPrinter.printBlock(config.toYaml());
    return ExitCode.SUCCESS;
  }

  private static ExitCode args(ExperimentConfig config) {
    CliPrinter.println(String.join(" ", config.commandLineArguments()));
    return ExitCode.SUCCESS;
  }

  private static ExitCode save(ExperimentConfig config, Path out, boolean allowOverwrite) {
    Path target;
    try {
      target = Paths.outputFile(out, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid output file: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }
    Path saved = config.save(target);
    CliPrinter.println(saved.toString());
    return ExitCode.SUCCESS;
  }

  private static ExitCode variations(CompositionRoot root, ExperimentConfig config, String out,
      boolean allowOverwrite) {
    List<ExperimentConfig> children = root.variationExpander().createVariations(config);
    Path directory = null;
    if (out != null) {
      try {
        directory = Paths.outputDirectory(Path.of(out), allowOverwrite);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid variations output directory: {}", ex.getMessage());
        return ExitCode.INVALID_ARGS;
      }
    }
    for (ExperimentConfig child : children) {
      String name = child.variationName().orElse("");
      if (directory == null) {
        CliPrinter.println(name);
      } else {
        CliPrinter.println(name + " " + child.save(directory.resolve(name + ".yaml")));
      }
    }
    log.info("Expanded {} variation(s) of {}", children.size(), config.name());
    return ExitCode.SUCCESS;
  }

  private static void bindHooks(ConfigBuilder builder, String value) {
    for (String binding : splitList(value)) {
      int idx = binding.lastIndexOf(':');
      if (idx <= 0 || idx == binding.length() - 1) {
        throw new IllegalArgumentException("hook bindings must be PATTERN:HOOK (was '" + binding + "')");
      }
      builder.hook(binding.substring(0, idx).trim(), BuiltinHook.fromName(binding.substring(idx + 1)));
    }
  }

  private static List<String> splitList(String value) {
    List<String> items = new ArrayList<>();
    if (value == null) {
      return items;
    }
    for (String part : value.split(",")) {
      if (!part.isBlank()) {
        items.add(part.trim());
      }
    }
    return items;
  }
}
