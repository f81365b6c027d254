package ca.gc.cra.strata.api;

import ca.gc.cra.strata.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Strata command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: strata <show|save|variations|args> default=PATH [options] [-- --param=value ...]";
  private static final String HELP_TEXT = """
      Strata experiment configuration tool

      Usage:
        strata <command> default=PATH [sources=A,B] [options] [-- --param=value ...]

      Commands:
        show        Build the config and print it as YAML
        save        Build the config and save it with its hierarchy (requires out=FILE)
        variations  Build the config and list (or save, with out=DIR) its variations
        args        Build the config and print the command line reproducing it

      Options:
        default=PATH              Default source defining every parameter
        sources=A,B               Experiment sources merged in order
        out=PATH                  Output file (save) or directory (variations)
        hooks=PATTERN:HOOK,...    Bind built-in hooks (experiment_path, additional_config_file,
                                  config_variations, grid) to parameter patterns
        options=PATH              YAML file holding the options below
        regime=locked|unsafe|auto-save
        mergeCommandLine=true|false
        preProcess=true|false
        postProcess=true|false
        strictCommandLine=true|false
        --allow-overwrite         Permit replacing an existing output
        --quiet                   Only log warnings and errors
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Parameter overrides follow a bare '--', for example: -- --lr=0.01 --*.dropout=0.2
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first positional token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.has(CliInput.Flag.HELP)) {
      CliPrinter.printBlock(HELP_TEXT);
      return ExitCode.SUCCESS;
    }
    if (input.has(CliInput.Flag.VERBOSE)) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    } else if (input.has(CliInput.Flag.QUIET)) {
      LoggingConfigurator.enableQuietLogging();
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown flag(s): {}", input.unknownFlags());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.command().isEmpty()) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = input.command().get().toLowerCase(Locale.ROOT);
    ConfigCli.Command selected = switch (command) {
      case "show" -> ConfigCli.Command.SHOW;
      case "save" -> ConfigCli.Command.SAVE;
      case "variations" -> ConfigCli.Command.VARIATIONS;
      case "args" -> ConfigCli.Command.ARGS;
      default -> null;
    };
    if (selected == null) {
      log.error("Unknown command: {}", command);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return ConfigCli.run(selected, input);
  }

  static String usage() {
    return SUMMARY_USAGE;
  }
}
