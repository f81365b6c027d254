package ca.gc.cra.strata.api;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Tool arguments split into the command, its {@code key=value} options, switches and parameter overrides.
 *
 * <p>Every token after the first bare {@code --} is a parameter override and is kept verbatim.</p>
 *
 * @param command first positional token, if any
 * @param options remaining positional tokens, expected to be {@code key=value}
 * @param flags recognized switches
 * @param unknownFlags dash-prefixed tokens that are not switches, lower-cased
 * @param overrides parameter override tokens
 * @since 0.1.0
 */
record CliInput(Optional<String> command, List<String> options, Set<Flag> flags, Set<String> unknownFlags,
    List<String> overrides) {
  private static final String OVERRIDE_SEPARATOR = "--";

  /** Switches understood by every command. */
  enum Flag {
    HELP("--help", "-h", "help"),
    VERBOSE("--verbose", "-v", "--debug"),
    QUIET("--quiet", "-q"),
    ALLOW_OVERWRITE("--allow-overwrite");

    private final Set<String> spellings;

    Flag(String... spellings) {
      this.spellings = Set.of(spellings);
    }

    static Optional<Flag> lookup(String token) {
      String lower = token.toLowerCase(Locale.ROOT);
      for (Flag flag : values()) {
        if (flag.spellings.contains(lower)) {
          return Optional.of(flag);
        }
      }
      return Optional.empty();
    }
  }

  CliInput {
    options = List.copyOf(options);
    flags = Set.copyOf(flags);
    unknownFlags = Set.copyOf(unknownFlags);
    overrides = List.copyOf(overrides);
  }

  /**
   * Splits raw arguments.
   *
   * @param args raw arguments (may be {@code null})
   * @return parsed arguments
   */
  static CliInput parse(String[] args) {
    String command = null;
    List<String> options = new ArrayList<>();
    Set<Flag> flags = EnumSet.noneOf(Flag.class);
    Set<String> unknown = new LinkedHashSet<>();
    List<String> overrides = new ArrayList<>();
    boolean inOverrides = false;
    for (String raw : args == null ? new String[0] : args) {
      if (raw == null) {
        continue;
      }
      if (inOverrides) {
        overrides.add(raw);
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      if (OVERRIDE_SEPARATOR.equals(arg)) {
        inOverrides = true;
        continue;
      }
      Optional<Flag> flag = Flag.lookup(arg);
      if (flag.isPresent()) {
        flags.add(flag.get());
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        unknown.add(arg.toLowerCase(Locale.ROOT));
      } else if (command == null) {
        command = arg;
      } else {
        options.add(arg);
      }
    }
    return new CliInput(Optional.ofNullable(command), options, flags, unknown, overrides);
  }

  boolean has(Flag flag) {
    return flags.contains(flag);
  }
}
