package ca.gc.cra.strata.application.merge;

import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.error.TypeMismatchException;
import ca.gc.cra.strata.domain.error.UnknownParameterException;
import ca.gc.cra.strata.domain.path.MatchReport;
import ca.gc.cra.strata.domain.path.PathMatcher;
import ca.gc.cra.strata.domain.path.PathPattern;
import ca.gc.cra.strata.domain.tree.ConfigNode;
import ca.gc.cra.strata.domain.tree.Replacement;
import ca.gc.cra.strata.domain.tree.SourceDescriptor;
import ca.gc.cra.strata.domain.tree.TaggedMapping;
import ca.gc.cra.strata.domain.tree.ValueKind;
import ca.gc.cra.strata.domain.tree.Values;
import ca.gc.cra.strata.logging.Logs;
import ca.gc.cra.strata.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Performs one merge pass of a parsed source into a configuration tree.
 * <p><strong>Why:</strong> Centralizes the default-versus-override key-creation contract so every entry point
 * (files, inline mappings, command line, variations, auto-save) obeys the same rules.</p>
 * <p><strong>Role:</strong> Application service driven by the build pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk the source recursively; tagged mappings address named sub-configs, untagged mappings stay opaque
 *   values.</li>
 *   <li>Default mode: create keys and intermediate sub-configs, reject wildcards and keys set twice.</li>
 *   <li>Override mode: require existing keys, expand wildcards with a match report, preserve value kinds unless
 *   the value is an explicit {@link Replacement}.</li>
 *   <li>Invoke pre-processing right after each leaf is set, in source order.</li>
 *   <li>Append the source descriptor to the tree hierarchy.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; reentrant so that a hook may merge another source mid-pass. The
 * tree itself must not be shared across threads.</p>
 * <p><strong>Observability:</strong> INFO per merge and per wildcard expansion, WARN on zero-match wildcards,
 * DEBUG per leaf set.</p>
 *
 * @since 0.1.0
 */
public final class MergeEngine {
  /** Reserved root key carrying saved-file metadata. */
  public static final String METADATA_KEY = "config_metadata";

  private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

  /**
   * Merges {@code content} into {@code tree} and records {@code descriptor} in the tree hierarchy.
   *
   * <p>No rollback is performed: a failure may leave the tree partially updated.</p>
   *
   * @param descriptor hierarchy entry describing the source
   * @param content parsed source
   * @param tree root node to mutate
   * @param mode default (root-defining) or override pass
   * @param callbacks merge observer
   */
  public void merge(SourceDescriptor descriptor, Map<String, Object> content, ConfigNode tree, MergeMode mode,
      MergeCallbacks callbacks) {
    Objects.requireNonNull(descriptor, "descriptor");
    Objects.requireNonNull(tree, "tree");
    log.info("Merging from {} : {}", descriptor.origin(), Logs.value(content));
    mergeInto(content, tree, mode, callbacks);
    tree.recordSource(descriptor);
  }

  /**
   * Merges {@code content} into {@code scope} without touching the hierarchy; used for nested merges triggered
   * while another pass is running.
   *
   * @param content parsed source, relative to {@code scope}
   * @param scope node receiving the parameters
   * @param mode default (root-defining) or override pass
   * @param callbacks merge observer
   */
  public void mergeInto(Map<String, Object> content, ConfigNode scope, MergeMode mode, MergeCallbacks callbacks) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(mode, "mode");
    MergeCallbacks observer = callbacks == null ? MergeCallbacks.NO_OP : callbacks;
    if (content == null) {
      return;
    }
    for (Map.Entry<String, Object> entry : content.entrySet()) {
      mergeEntry(entry.getKey(), entry.getValue(), scope, mode, observer);
    }
  }

  private void mergeEntry(String key, Object value, ConfigNode scope, MergeMode mode, MergeCallbacks callbacks) {
    if (key == null || key.isBlank()) {
      throw new StructureException("Blank parameter name in " + describe(scope), scope.path());
    }
    if (METADATA_KEY.equals(key)) {
      if (!scope.isRoot()) {
        throw new StructureException("'" + METADATA_KEY + "' is reserved and may only appear at the root",
            scope.pathOf(key));
      }
      callbacks.metadataFound(value);
      return;
    }
    if (mode == MergeMode.DEFAULT) {
      addEntry(key, value, scope, callbacks);
    } else {
      overrideEntry(key, value, scope, callbacks);
    }
  }

  private void addEntry(String key, Object value, ConfigNode scope, MergeCallbacks callbacks) {
    if (PathPattern.isWildcard(key)) {
      throw new StructureException("The '*' character is not allowed in the default source ("
          + scope.pathOf(key) + ")", scope.pathOf(key));
    }
    int dot = key.indexOf('.');
    if (dot >= 0) {
      String head = key.substring(0, dot);
      ConfigNode child = childForAdd(scope, head);
      addEntry(key.substring(dot + 1), value, child, callbacks);
      return;
    }
    requireName(key, scope);
    if (value instanceof TaggedMapping tagged) {
      requireMatchingTag(tagged, key, scope);
      mergeInto(tagged.content(), childForAdd(scope, key), MergeMode.DEFAULT, callbacks);
      return;
    }
    if (scope.contains(key)) {
      throw new StructureException("Parameter '" + scope.pathOf(key) + "' was set twice", scope.pathOf(key));
    }
    Object stored = Values.deepCopy(Values.unwrap(value));
    log.debug("Adding '{}' = '{}'", scope.pathOf(key), stored);
    Object processed = callbacks.preProcess(scope, key, stored, MergeMode.DEFAULT);
    scope.put(key, processed);
    callbacks.leafSet(scope.pathOf(key), null, processed);
  }

  private ConfigNode childForAdd(ConfigNode scope, String name) {
    requireName(name, scope);
    Object existing = scope.get(name);
    if (existing instanceof ConfigNode node) {
      return node;
    }
    if (scope.contains(name)) {
      throw new StructureException("Parameter '" + scope.pathOf(name) + "' is not a sub-config",
          scope.pathOf(name));
    }
    return scope.createChild(name);
  }

  private void overrideEntry(String key, Object value, ConfigNode scope, MergeCallbacks callbacks) {
    if (PathPattern.isWildcard(key)) {
      MatchReport report = PathMatcher.report(scope, key);
      if (report.isEmpty()) {
        log.warn("Parameter '{}' will be ignored : it does not match any existing parameter", report.pattern());
      } else {
        log.info("Pattern parameter '{}' will be merged into the following matched parameters : {}",
            report.pattern(), report.matches());
      }
      callbacks.wildcardExpanded(report);
      for (String match : PathMatcher.match(scope, key)) {
        overrideEntry(match, value, scope, callbacks);
      }
      return;
    }
    int dot = key.indexOf('.');
    if (dot >= 0) {
      String head = key.substring(0, dot);
      if (!scope.contains(head)) {
        throw unknown(scope, key);
      }
      if (!(scope.get(head) instanceof ConfigNode child)) {
        throw new StructureException("Failed to set parameter '" + scope.pathOf(key) + "' : '"
            + scope.pathOf(head) + "' is not a sub-config", scope.pathOf(key));
      }
      overrideEntry(key.substring(dot + 1), value, child, callbacks);
      return;
    }
    if (!scope.contains(key)) {
      throw unknown(scope, key);
    }
    Object existing = scope.get(key);
    if (existing instanceof ConfigNode node) {
      overrideNode(node, value, callbacks);
      return;
    }
    if (value instanceof TaggedMapping tagged) {
      throw new StructureException("Tag '!" + tagged.tag() + "' targets parameter '" + scope.pathOf(key)
          + "' which is not a sub-config", scope.pathOf(key));
    }
    String path = scope.pathOf(key);
    Object incoming = Values.deepCopy(Values.unwrap(value));
    if (!(value instanceof Replacement)) {
      incoming = checkKind(path, callbacks.referenceValue(path, existing), incoming);
    }
    log.debug("Setting '{}' : old '{}' new '{}'", path, existing, incoming);
    Object processed = callbacks.preProcess(scope, key, incoming, MergeMode.OVERRIDE);
    scope.put(key, processed);
    callbacks.leafSet(path, existing, processed);
  }

  private void overrideNode(ConfigNode node, Object value, MergeCallbacks callbacks) {
    if (value instanceof TaggedMapping tagged) {
      if (!tagged.tag().equals(node.name())) {
        throw new StructureException("Tag '!" + tagged.tag() + "' does not match sub-config '" + node.path()
            + "'", node.path());
      }
      mergeInto(tagged.content(), node, MergeMode.OVERRIDE, callbacks);
      return;
    }
    if (value instanceof Map<?, ?> map) {
      mergeInto(stringKeys(map, node), node, MergeMode.OVERRIDE, callbacks);
      return;
    }
    throw new StructureException("Trying to set sub-config '" + node.path() + "' with non-config element '"
        + value + "'", node.path());
  }

  private static Object checkKind(String path, Object reference, Object incoming) {
    ValueKind expected = ValueKind.of(reference);
    ValueKind actual = ValueKind.of(incoming);
    if (!expected.accepts(actual)) {
      throw new TypeMismatchException("Cannot set parameter '" + path + "' of kind " + expected
          + " to a value of kind " + actual + " ('" + incoming + "'); use an explicit replacement", path);
    }
    if (expected == ValueKind.FLOAT && actual == ValueKind.INTEGER) {
      return ((Number) incoming).doubleValue();
    }
    return incoming;
  }

  private static void requireMatchingTag(TaggedMapping tagged, String key, ConfigNode scope) {
    if (!tagged.tag().equals(key)) {
      throw new StructureException("Tag '!" + tagged.tag() + "' does not match parameter name '"
          + scope.pathOf(key) + "'", scope.pathOf(key));
    }
  }

  private static void requireName(String name, ConfigNode scope) {
    try {
      Strings.requireParameterName(name);
    } catch (IllegalArgumentException ex) {
      throw new StructureException(ex.getMessage(), scope.pathOf(name), ex);
    }
  }

  private static Map<String, Object> stringKeys(Map<?, ?> raw, ConfigNode node) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new StructureException("Sub-config '" + node.path() + "' received a non-string key: "
            + entry.getKey(), node.path());
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static UnknownParameterException unknown(ConfigNode scope, String key) {
    String scopeName = scope.isRoot() ? scope.name() : scope.path();
    return new UnknownParameterException("Parameter '" + scope.pathOf(key)
        + "' cannot be merged : it is not in the default '" + scopeName + "' config", scope.pathOf(key));
  }

  private static String describe(ConfigNode scope) {
    return scope.isRoot() ? "root config" : "sub-config '" + scope.path() + "'";
  }
}
