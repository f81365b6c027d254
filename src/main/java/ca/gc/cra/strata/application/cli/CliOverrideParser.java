package ca.gc.cra.strata.application.cli;

import ca.gc.cra.strata.domain.error.TypeMismatchException;
import ca.gc.cra.strata.domain.error.UnknownParameterException;
import ca.gc.cra.strata.domain.path.MatchReport;
import ca.gc.cra.strata.domain.path.PathMatcher;
import ca.gc.cra.strata.domain.path.PathPattern;
import ca.gc.cra.strata.domain.tree.ConfigNode;
import ca.gc.cra.strata.domain.tree.ValueKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns command-line tokens into type-checked parameter overrides.
 * <p><strong>Role:</strong> Application service run by the build pipeline before the command-line merge pass.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Recognize {@code --name=value}, {@code --name value...} (tokens joined with spaces) and bare
 *   {@code --name} (decoded to {@code true}).</li>
 *   <li>Expand dotted and wildcard names against the tree, reporting every wildcard expansion.</li>
 *   <li>Decode literals and require the decoded kind to equal the kind of the target parameter.</li>
 *   <li>Collect {@code --config} source paths, which are never parameter overrides.</li>
 * </ul>
 * <p>Every literal is decoded, string parameters included: {@code --name=123} targets an integer and is rejected
 * on a string parameter, while {@code --name='123'} is accepted. Parameters holding {@code null} can never be
 * overridden from the command line since no literal decodes to the absent kind.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one parser per thread.</p>
 *
 * @since 0.1.0
 */
public final class CliOverrideParser {
  /** Reserved option selecting experiment sources. */
  public static final String CONFIG_OPTION = "config";

  private static final Logger log = LoggerFactory.getLogger(CliOverrideParser.class);

  private final LiteralDecoder decoder;
  private final boolean strict;

  /**
   * Creates a parser.
   *
   * @param strict when {@code true}, names matching no parameter raise {@link UnknownParameterException}
   */
  public CliOverrideParser(boolean strict) {
    this(new LiteralDecoder(), strict);
  }

  CliOverrideParser(LiteralDecoder decoder, boolean strict) {
    this.decoder = Objects.requireNonNull(decoder, "decoder");
    this.strict = strict;
  }

  /**
   * Parses {@code tokens} against the current values of {@code tree}.
   *
   * @param tokens command-line tokens
   * @param tree root of the tree the overrides target
   * @return decoded overrides
   * @throws TypeMismatchException when a literal does not decode to the kind of its target
   * @throws UnknownParameterException when strict and a name matches nothing
   */
  public CliOverrides parse(List<String> tokens, ConfigNode tree) {
    return parse(tokens, tree, path -> PathMatcher.read(tree, path));
  }

  /**
   * Parses {@code tokens}, checking kinds against caller-supplied reference values.
   *
   * @param tokens command-line tokens
   * @param tree root of the tree the overrides target
   * @param referenceValues maps a fully-qualified path to the value whose kind governs the override
   * @return decoded overrides
   */
  public CliOverrides parse(List<String> tokens, ConfigNode tree, Function<String, Object> referenceValues) {
    Objects.requireNonNull(tree, "tree");
    Objects.requireNonNull(referenceValues, "referenceValues");
    Map<String, String> raw = new LinkedHashMap<>();
    List<String> configPaths = new ArrayList<>();
    List<MatchReport> reports = new ArrayList<>();
    List<String> unmatched = new ArrayList<>();

    List<String> current = List.of();
    boolean inConfig = false;
    for (String token : tokens == null ? List.<String>of() : tokens) {
      if (token == null) {
        continue;
      }
      if (token.startsWith("--")) {
        String body = token.substring(2);
        int eq = body.indexOf('=');
        String name = eq < 0 ? body : body.substring(0, eq);
        String value = eq < 0 || eq == body.length() - 1 ? null : body.substring(eq + 1);
        if (CONFIG_OPTION.equals(name)) {
          inConfig = true;
          current = List.of();
          addConfigPaths(value, configPaths);
          continue;
        }
        inConfig = false;
        current = resolve(name, tree, reports);
        if (current.isEmpty()) {
          unmatched.add(name);
        }
        for (String path : current) {
          raw.put(path, value);
        }
      } else if (inConfig) {
        addConfigPaths(token, configPaths);
      } else if (!current.isEmpty()) {
        for (String path : current) {
          String previous = raw.get(path);
          raw.put(path, previous == null ? token : previous + " " + token);
        }
      } else {
        log.debug("Ignoring positional command-line token '{}'", token);
      }
    }

    if (!unmatched.isEmpty()) {
      if (strict) {
        throw new UnknownParameterException("Command-line parameters " + unmatched
            + " do not match any parameter in the config", unmatched.get(0));
      }
      log.warn("Parameters {}, encountered while merging params from the command line, do not match any param "
          + "in the config. They will not be merged.", unmatched);
    }

    Map<String, Object> overrides = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : raw.entrySet()) {
      String path = entry.getKey();
      overrides.put(path, decodeFor(path, entry.getValue(), referenceValues.apply(path)));
    }
    return new CliOverrides(overrides, configPaths, reports, unmatched);
  }

  /**
   * Extracts the {@code --config} source paths without resolving any parameter.
   *
   * @param tokens command-line tokens
   * @return source paths in command-line order
   */
  public static List<String> configPaths(List<String> tokens) {
    List<String> configPaths = new ArrayList<>();
    boolean inConfig = false;
    for (String token : tokens == null ? List.<String>of() : tokens) {
      if (token == null) {
        continue;
      }
      if (token.startsWith("--")) {
        String body = token.substring(2);
        int eq = body.indexOf('=');
        inConfig = CONFIG_OPTION.equals(eq < 0 ? body : body.substring(0, eq));
        if (inConfig && eq >= 0) {
          addConfigPaths(body.substring(eq + 1), configPaths);
        }
      } else if (inConfig) {
        addConfigPaths(token, configPaths);
      }
    }
    return configPaths;
  }

  private List<String> resolve(String name, ConfigNode tree, List<MatchReport> reports) {
    if (name.isEmpty()) {
      return List.of();
    }
    if (PathPattern.isWildcard(name)) {
      MatchReport report = PathMatcher.report(tree, name);
      reports.add(report);
      if (!report.isEmpty()) {
        log.info("Command-line pattern '{}' matched the following parameters : {}", name, report.matches());
      }
      return report.matches();
    }
    if (PathMatcher.exists(tree, name) && !(PathMatcher.read(tree, name) instanceof ConfigNode)) {
      return List.of(name);
    }
    return List.of();
  }

  private Object decodeFor(String path, String literal, Object reference) {
    ValueKind target = ValueKind.of(reference);
    if (target == ValueKind.NONE) {
      throw new TypeMismatchException("Parameter '" + path
          + "' holds no value and cannot be overridden from the command line", path);
    }
    Object decoded;
    if (literal == null) {
      decoded = Boolean.TRUE;
    } else {
      decoded = decoder.decode(literal);
    }
    ValueKind actual = ValueKind.of(decoded);
    if (target == ValueKind.FLOAT && actual == ValueKind.INTEGER) {
      return ((Number) decoded).doubleValue();
    }
    if (actual != target) {
      throw new TypeMismatchException("Command-line value '" + (literal == null ? "<flag>" : literal)
          + "' for parameter '" + path + "' decodes to " + actual + " but the parameter is " + target, path);
    }
    return decoded;
  }

  private static void addConfigPaths(String value, List<String> configPaths) {
    if (value == null) {
      return;
    }
    String trimmed = value.trim();
    if (trimmed.startsWith("[")) {
      trimmed = trimmed.substring(1);
    }
    if (trimmed.endsWith("]")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    for (String part : trimmed.split(",")) {
      String path = part.trim();
      if (!path.isEmpty()) {
        configPaths.add(stripQuotes(path));
      }
    }
  }

  private static String stripQuotes(String text) {
    if (text.length() >= 2 && (text.startsWith("'") && text.endsWith("'")
        || text.startsWith("\"") && text.endsWith("\""))) {
      return text.substring(1, text.length() - 1);
    }
    return text;
  }
}
