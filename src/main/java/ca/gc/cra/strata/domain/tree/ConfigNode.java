package ca.gc.cra.strata.domain.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Recursive named node of a configuration tree.
 * <p><strong>Why:</strong> Models sub-configs explicitly as a tagged variant (leaf values versus nested nodes)
 * behind a path API instead of dynamic attribute access.</p>
 * <p><strong>Role:</strong> Domain aggregate mutated by the merge engine and read by every other component.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold parameters in declaration order; values are scalars, sequences, opaque mappings or child nodes.</li>
 *   <li>Keep a lookup-only back-reference to the parent node.</li>
 *   <li>Record the hierarchy of sources merged into the node.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a tree belongs to a single thread. Deep copies share no
 * mutable state and may be handed to other threads.</p>
 *
 * @since 0.1.0
 */
public final class ConfigNode {
  private final String name;
  private final ConfigNode parent;
  private final Map<String, Object> parameters = new LinkedHashMap<>();
  private final List<SourceDescriptor> hierarchy = new ArrayList<>();

  private ConfigNode(String name, ConfigNode parent) {
    this.name = Objects.requireNonNull(name, "name");
    this.parent = parent;
  }

  /**
   * Creates an empty root node.
   *
   * @param name root name, conventionally {@code main}
   * @return new root
   */
  public static ConfigNode root(String name) {
    return new ConfigNode(name, null);
  }

  public String name() {
    return name;
  }

  public Optional<ConfigNode> parent() {
    return Optional.ofNullable(parent);
  }

  public boolean isRoot() {
    return parent == null;
  }

  /**
   * Walks parent references up to the root.
   *
   * @return root of the tree containing this node
   */
  public ConfigNode root() {
    ConfigNode current = this;
    while (current.parent != null) {
      current = current.parent;
    }
    return current;
  }

  /**
   * Returns the dotted path of this node from the root; the root itself has an empty path.
   *
   * @return dotted path
   */
  public String path() {
    if (parent == null) {
      return "";
    }
    String parentPath = parent.path();
    return parentPath.isEmpty() ? name : parentPath + '.' + name;
  }

  /**
   * Returns the dotted path from the root of one of this node's parameters.
   *
   * @param key parameter name
   * @return full dotted path
   */
  public String pathOf(String key) {
    String own = path();
    return own.isEmpty() ? key : own + '.' + key;
  }

  public boolean contains(String key) {
    return parameters.containsKey(key);
  }

  /**
   * Returns the raw value stored under {@code key}; child nodes are returned as {@link ConfigNode}.
   *
   * @param key parameter name
   * @return stored value or {@code null}
   */
  public Object get(String key) {
    return parameters.get(key);
  }

  /**
   * Returns the child node stored under {@code key}.
   *
   * @param key parameter name
   * @return child node when the parameter is a sub-config
   */
  public Optional<ConfigNode> child(String key) {
    return parameters.get(key) instanceof ConfigNode node ? Optional.of(node) : Optional.empty();
  }

  /**
   * Stores a leaf value, replacing any previous leaf.
   *
   * @param key parameter name
   * @param value leaf value; nodes must be created with {@link #createChild(String)}
   * @return previous value
   * @throws IllegalArgumentException when {@code value} is a node or {@code key} holds a node
   */
  public Object put(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (value instanceof ConfigNode) {
      throw new IllegalArgumentException("child nodes must be created with createChild: " + pathOf(key));
    }
    if (parameters.get(key) instanceof ConfigNode) {
      throw new IllegalArgumentException("cannot replace sub-config with a value: " + pathOf(key));
    }
    return parameters.put(key, value);
  }

  /**
   * Creates an empty child node under {@code key}.
   *
   * @param key sub-config name
   * @return new child
   * @throws IllegalArgumentException when {@code key} is already present
   */
  public ConfigNode createChild(String key) {
    if (parameters.containsKey(key)) {
      throw new IllegalArgumentException("parameter already present: " + pathOf(key));
    }
    ConfigNode child = new ConfigNode(key, this);
    parameters.put(key, child);
    return child;
  }

  /**
   * Returns parameter names of this node in declaration order.
   *
   * @return unmodifiable view of the names
   */
  public Set<String> keys() {
    return Collections.unmodifiableSet(parameters.keySet());
  }

  /**
   * Returns every child node of this node, direct children first, depth-first.
   *
   * @return descendant nodes
   */
  public List<ConfigNode> descendants() {
    List<ConfigNode> nodes = new ArrayList<>();
    for (Object value : parameters.values()) {
      if (value instanceof ConfigNode node) {
        nodes.add(node);
        nodes.addAll(node.descendants());
      }
    }
    return nodes;
  }

  /**
   * Lists the dotted paths, relative to this node, of every leaf parameter (sub-configs excluded).
   *
   * @return leaf paths in declaration order
   */
  public List<String> leafPaths() {
    List<String> paths = new ArrayList<>();
    collectLeafPaths("", paths);
    return paths;
  }

  private void collectLeafPaths(String prefix, List<String> paths) {
    for (Map.Entry<String, Object> entry : parameters.entrySet()) {
      String path = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      if (entry.getValue() instanceof ConfigNode node) {
        node.collectLeafPaths(path, paths);
      } else {
        paths.add(path);
      }
    }
  }

  /**
   * Resolves the node that directly holds the last segment of a literal dotted path.
   *
   * @param dottedPath path without wildcards, relative to this node
   * @return holder of the parameter, empty when any segment is missing
   */
  public Optional<ConfigNode> holderOf(String dottedPath) {
    Objects.requireNonNull(dottedPath, "dottedPath");
    ConfigNode current = this;
    String[] segments = dottedPath.split("\\.", -1);
    for (int i = 0; i < segments.length - 1; i++) {
      if (!(current.parameters.get(segments[i]) instanceof ConfigNode node)) {
        return Optional.empty();
      }
      current = node;
    }
    return current.parameters.containsKey(segments[segments.length - 1])
        ? Optional.of(current)
        : Optional.empty();
  }

  /**
   * Returns leaf values keyed by their dotted path relative to this node.
   *
   * @return ordered map of leaf values (values are not copied)
   */
  public Map<String, Object> leafValues() {
    Map<String, Object> values = new LinkedHashMap<>();
    collectLeafValues("", values);
    return values;
  }

  private void collectLeafValues(String prefix, Map<String, Object> values) {
    for (Map.Entry<String, Object> entry : parameters.entrySet()) {
      String path = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      if (entry.getValue() instanceof ConfigNode node) {
        node.collectLeafValues(path, values);
      } else {
        values.put(path, entry.getValue());
      }
    }
  }

  /**
   * Converts the subtree into plain nested mappings.
   *
   * @param tagSubConfigs when {@code true} child nodes become {@link TaggedMapping}s, otherwise plain mappings
   * @return independent ordered mapping
   */
  public Map<String, Object> toMap(boolean tagSubConfigs) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : parameters.entrySet()) {
      if (entry.getValue() instanceof ConfigNode node) {
        Map<String, Object> content = node.toMap(tagSubConfigs);
        map.put(entry.getKey(), tagSubConfigs ? new TaggedMapping(node.name, content) : content);
      } else {
        map.put(entry.getKey(), Values.deepCopy(entry.getValue()));
      }
    }
    return map;
  }

  /**
   * Returns the sources merged into this node, in merge order.
   *
   * @return unmodifiable hierarchy
   */
  public List<SourceDescriptor> hierarchy() {
    return Collections.unmodifiableList(hierarchy);
  }

  /**
   * Appends a source to the hierarchy.
   *
   * @param descriptor merged source
   */
  public void recordSource(SourceDescriptor descriptor) {
    hierarchy.add(Objects.requireNonNull(descriptor, "descriptor"));
  }

  /**
   * Copies this node as a new root, including its hierarchy; values are deep-copied.
   *
   * @return independent tree
   */
  public ConfigNode deepCopy() {
    ConfigNode copy = new ConfigNode(name, null);
    copyInto(copy);
    return copy;
  }

  private void copyInto(ConfigNode target) {
    target.hierarchy.addAll(hierarchy);
    for (Map.Entry<String, Object> entry : parameters.entrySet()) {
      if (entry.getValue() instanceof ConfigNode node) {
        node.copyInto(target.createChild(entry.getKey()));
      } else {
        target.parameters.put(entry.getKey(), Values.deepCopy(entry.getValue()));
      }
    }
  }

  @Override
  public String toString() {
    return "ConfigNode{" + (isRoot() ? name : path()) + ", " + parameters.keySet() + '}';
  }
}
