package ca.gc.cra.strata.application.cli;

import ca.gc.cra.strata.domain.path.MatchReport;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of scanning command-line tokens against a tree.
 *
 * @param overrides decoded values keyed by fully-qualified leaf path, in command-line order
 * @param configPaths source paths selected with {@code --config}
 * @param matchReports one report per wildcard name
 * @param unmatched names that matched no parameter
 * @since 0.1.0
 */
public record CliOverrides(
    Map<String, Object> overrides,
    List<String> configPaths,
    List<MatchReport> matchReports,
    List<String> unmatched) {

  public CliOverrides {
    overrides = overrides == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    configPaths = configPaths == null ? List.of() : List.copyOf(configPaths);
    matchReports = matchReports == null ? List.of() : List.copyOf(matchReports);
    unmatched = unmatched == null ? List.of() : List.copyOf(unmatched);
  }

  public boolean isEmpty() {
    return overrides.isEmpty();
  }
}
