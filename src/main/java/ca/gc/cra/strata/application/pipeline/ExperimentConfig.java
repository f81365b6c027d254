package ca.gc.cra.strata.application.pipeline;

import ca.gc.cra.strata.application.cli.CommandLineRenderer;
import ca.gc.cra.strata.application.guard.MutationTarget;
import ca.gc.cra.strata.application.guard.OverwriteGuard;
import ca.gc.cra.strata.application.merge.MergeCallbacks;
import ca.gc.cra.strata.application.merge.MergeEngine;
import ca.gc.cra.strata.application.merge.MergeMode;
import ca.gc.cra.strata.application.processing.BuiltinHook;
import ca.gc.cra.strata.application.processing.HookHandler;
import ca.gc.cra.strata.application.processing.ProcessingPhase;
import ca.gc.cra.strata.application.processing.ProcessingRegistry;
import ca.gc.cra.strata.application.variation.Grid;
import ca.gc.cra.strata.application.variation.Variation;
import ca.gc.cra.strata.application.variation.VariationSource;
import ca.gc.cra.strata.domain.error.PathNotFoundException;
import ca.gc.cra.strata.domain.error.ProcessingException;
import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.error.TypeMismatchException;
import ca.gc.cra.strata.domain.path.MatchReport;
import ca.gc.cra.strata.domain.path.PathMatcher;
import ca.gc.cra.strata.domain.tree.ConfigNode;
import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import ca.gc.cra.strata.domain.tree.SourceDescriptor;
import ca.gc.cra.strata.domain.tree.TaggedMapping;
import ca.gc.cra.strata.domain.tree.ValueKind;
import ca.gc.cra.strata.domain.tree.Values;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> A fully built experiment configuration: the parameter tree plus the state the build
 * pipeline attached to it.
 * <p><strong>Why:</strong> Keeps the tree, its source hierarchy, its overwriting regime and its processing
 * bookkeeping together so that saving, reloading and deriving variations stay reproducible.</p>
 * <p><strong>Role:</strong> Application facade returned by {@link ConfigBuilder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read parameters by dotted path; route writes through the {@link OverwriteGuard}.</li>
 *   <li>Run pre-processing while merging and post-processing on modified parameters.</li>
 *   <li>Execute built-in hooks: experiment directories, additional config files, variations and grids.</li>
 *   <li>Save values as they were before post-processing, with metadata and a hierarchy file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Copies and variations share no mutable state with their
 * origin.</p>
 * <p><strong>Observability:</strong> INFO for saves, post-processing and metadata; WARN for unmatched processing
 * patterns, unsafe saved files and auto-save overwrites.</p>
 *
 * @since 0.1.0
 */
public final class ExperimentConfig implements MutationTarget, VariationSource<ExperimentConfig> {
  private static final Logger log = LoggerFactory.getLogger(ExperimentConfig.class);
  private static final MergeEngine ENGINE = new MergeEngine();
  private static final String HIERARCHY_SUFFIX = "_hierarchy.yaml";

  private final ConfigNode root;
  private final ProcessingRegistry registry;
  private final PipelinePorts ports;
  private final SourcePathResolver resolver;
  private final boolean preProcessEnabled;
  private final boolean postProcessEnabled;
  private final Map<String, Object> valuesBeforePostProcessing = new LinkedHashMap<>();
  private final Set<String> modified = new LinkedHashSet<>();
  private final Map<BuiltinHook, List<String>> hooked = new EnumMap<>(BuiltinHook.class);
  private final Map<String, String> experimentPathRequests = new LinkedHashMap<>();
  private final Map<String, Variation> variations = new LinkedHashMap<>();
  private final Map<String, Grid> grids = new LinkedHashMap<>();
  private final List<MatchReport> matchReports = new ArrayList<>();
  private final PipelineCallbacks callbacks = new PipelineCallbacks();

  private OverwritingRegime regime;
  private OverwriteGuard guard;
  private Path savedPath;
  private String variationName;
  private boolean constructing = true;
  private boolean preProcessingActive;
  private ConfigNode currentHolder;
  private MergeMode currentMode;

  ExperimentConfig(String name, ProcessingRegistry registry, OverwritingRegime regime, boolean preProcess,
      boolean postProcess, PipelinePorts ports) {
    this.root = ConfigNode.root(Objects.requireNonNull(name, "name"));
    this.registry = Objects.requireNonNull(registry, "registry");
    this.regime = Objects.requireNonNull(regime, "regime");
    this.ports = Objects.requireNonNull(ports, "ports");
    this.resolver = new SourcePathResolver(ports.workingDirectory());
    this.preProcessEnabled = preProcess;
    this.postProcessEnabled = postProcess;
    this.preProcessingActive = preProcess;
  }

  private ExperimentConfig(ExperimentConfig source, OverwritingRegime regime) {
    this.root = source.root.deepCopy();
    this.registry = source.registry;
    this.regime = Objects.requireNonNull(regime, "regime");
    this.ports = source.ports;
    this.resolver = source.resolver;
    this.preProcessEnabled = source.preProcessEnabled;
    this.postProcessEnabled = source.postProcessEnabled;
    this.preProcessingActive = source.preProcessEnabled;
    this.variationName = source.variationName;
    source.valuesBeforePostProcessing.forEach((path, value) ->
        valuesBeforePostProcessing.put(path, Values.deepCopy(value)));
    source.hooked.forEach((hook, paths) -> hooked.put(hook, new ArrayList<>(paths)));
    experimentPathRequests.putAll(source.experimentPathRequests);
    variations.putAll(source.variations);
    grids.putAll(source.grids);
  }

  /**
   * Returns the current (post-processed) value of a parameter.
   *
   * @param path literal dotted path
   * @return independent copy of the leaf value, or an independent nested mapping for a sub-config
   * @throws PathNotFoundException when the path does not resolve
   */
  public Object get(String path) {
    Object value = PathMatcher.read(root, path);
    return value instanceof ConfigNode node ? node.toMap(false) : Values.deepCopy(value);
  }

  /**
   * Returns the value of a parameter, or {@code fallback} when the path does not resolve.
   *
   * @param path literal dotted path
   * @param fallback value returned for a missing parameter
   * @return parameter value or fallback
   */
  public Object getOrDefault(String path, Object fallback) {
    return PathMatcher.exists(root, path) ? get(path) : fallback;
  }

  /**
   * Returns the value of a parameter cast to {@code type}.
   *
   * @param path literal dotted path
   * @param type expected class
   * @param <T> expected type
   * @return typed value, {@code null} when the parameter holds none
   * @throws TypeMismatchException when the value is not a {@code type}
   */
  public <T> T get(String path, Class<T> type) {
    Object value = get(path);
    if (value != null && !type.isInstance(value)) {
      throw new TypeMismatchException("Parameter '" + path + "' holds a " + value.getClass().getSimpleName()
          + ", not a " + type.getSimpleName(), path);
    }
    return type.cast(value);
  }

  public boolean contains(String path) {
    return PathMatcher.exists(root, path);
  }

  /**
   * Lists the fully-qualified paths matching a pattern.
   *
   * @param pattern dotted pattern
   * @return matched leaf paths
   */
  public List<String> match(String pattern) {
    return PathMatcher.report(root, pattern).matches();
  }

  /**
   * Lists every leaf parameter.
   *
   * @return fully-qualified paths in tree order
   */
  public List<String> parameterNames() {
    return root.leafPaths();
  }

  /**
   * Returns the current leaf values.
   *
   * @return independent ordered map of path to value
   */
  public Map<String, Object> leafValues() {
    Map<String, Object> values = new LinkedHashMap<>();
    root.leafValues().forEach((path, value) -> values.put(path, Values.deepCopy(value)));
    return values;
  }

  /**
   * Returns the leaf values as they were before post-processing; these are the values saved to disk.
   *
   * @return independent ordered map of path to value
   */
  public Map<String, Object> savedLeafValues() {
    Map<String, Object> values = new LinkedHashMap<>();
    root.leafValues().forEach((path, value) -> values.put(path, Values.deepCopy(preProcessedValue(path, value))));
    return values;
  }

  /**
   * Returns the values replaced by post-processing, keyed by path.
   *
   * @return unmodifiable snapshot holding independent copies of the values
   */
  public Map<String, Object> valuesBeforePostProcessing() {
    Map<String, Object> values = new LinkedHashMap<>();
    valuesBeforePostProcessing.forEach((path, value) -> values.put(path, Values.deepCopy(value)));
    return Collections.unmodifiableMap(values);
  }

  /**
   * Converts the tree to nested plain mappings.
   *
   * @return independent mapping of current values
   */
  public Map<String, Object> toMap() {
    return root.toMap(false);
  }

  /**
   * Renders the tree as YAML, using values from before post-processing and tags for sub-configs.
   *
   * @return YAML text
   */
  public String toYaml() {
    return ports.writer().render(savedContent(root));
  }

  public String name() {
    return root.name();
  }

  public OverwritingRegime regime() {
    return regime;
  }

  public Optional<String> variationName() {
    return Optional.ofNullable(variationName);
  }

  @Override
  public Optional<Path> savedPath() {
    return Optional.ofNullable(savedPath);
  }

  /**
   * Returns the sources merged into this config, in merge order.
   *
   * @return hierarchy descriptors
   */
  public List<SourceDescriptor> hierarchy() {
    return root.hierarchy();
  }

  /**
   * Returns the serializable hierarchy: file paths and inline mappings, in merge order.
   *
   * @return independent artifact list
   */
  public List<Object> hierarchyArtifact() {
    List<Object> artifact = new ArrayList<>();
    for (SourceDescriptor descriptor : root.hierarchy()) {
      artifact.add(Values.deepCopy(descriptor.artifact()));
    }
    return artifact;
  }

  /**
   * Lists the wildcard expansions reported by merges into this config.
   *
   * @return match reports in merge order
   */
  public List<MatchReport> matchReports() {
    return List.copyOf(matchReports);
  }

  /**
   * Lists the parameters bound to a built-in hook.
   *
   * @param hook built-in hook
   * @return fully-qualified paths in registration order
   */
  public List<String> hooked(BuiltinHook hook) {
    return List.copyOf(hooked.getOrDefault(hook, List.of()));
  }

  /**
   * Returns the directory created for this experiment.
   *
   * @return experiment directory, empty when the parameter holds no path
   * @throws IllegalStateException when zero or several parameters are registered as experiment path
   */
  public Optional<Path> experimentPath() {
    List<String> paths = hooked(BuiltinHook.EXPERIMENT_PATH);
    if (paths.isEmpty()) {
      throw new IllegalStateException("No parameter is registered as experiment path; bind the '"
          + BuiltinHook.EXPERIMENT_PATH.hookName() + "' hook to one parameter");
    }
    if (paths.size() > 1) {
      throw new IllegalStateException("Several parameters are registered as experiment path: " + paths);
    }
    Object value = PathMatcher.read(root, paths.get(0));
    if (value == null || "".equals(value)) {
      return Optional.empty();
    }
    return Optional.of(Path.of(String.valueOf(value)));
  }

  /**
   * Renders the command-line arguments that rebuild this config from its default source.
   *
   * @return tokens such as {@code --lr=0.01}
   */
  public List<String> commandLineArguments() {
    return new CommandLineRenderer().render(savedLeafValues());
  }

  /**
   * Lists the parameters whose values differ from {@code other}.
   *
   * @param other config to compare with
   * @return differences, this config's parameters first
   */
  public List<Difference> compare(ExperimentConfig other) {
    Objects.requireNonNull(other, "other");
    Map<String, Object> mine = root.leafValues();
    Map<String, Object> theirs = other.root.leafValues();
    Set<String> paths = new LinkedHashSet<>(mine.keySet());
    paths.addAll(theirs.keySet());
    List<Difference> differences = new ArrayList<>();
    for (String path : paths) {
      boolean present = mine.containsKey(path) && theirs.containsKey(path);
      if (!present || !Objects.equals(mine.get(path), theirs.get(path))) {
        differences.add(new Difference(path, mine.get(path), theirs.get(path)));
      }
    }
    return differences;
  }

  @Override
  public List<Variation> variations() {
    return List.copyOf(variations.values());
  }

  @Override
  public List<Grid> grids() {
    return List.copyOf(grids.values());
  }

  /**
   * Sets a parameter under the control of the overwriting regime.
   *
   * @param path literal dotted path or wildcard pattern
   * @param value new value
   * @throws ca.gc.cra.strata.domain.error.ImmutableConfigException when the regime is locked
   */
  public void set(String path, Object value) {
    requireConstructed();
    guard.onMutate(path, value);
  }

  /**
   * Merges an additional override source after construction, then post-processes the modified parameters.
   *
   * @param source source path ({@link String} or {@link Path}) or inline mapping
   */
  public void merge(Object source) {
    requireConstructed();
    mergeSource(source, MergeMode.OVERRIDE, "code");
    postProcess();
    if (regime == OverwritingRegime.AUTO_SAVE && savedPath != null) {
      log.warn("Config modified by a merge after saving; overwriting saved config file {}", savedPath);
      resave();
    }
  }

  /**
   * Saves the config and its hierarchy.
   *
   * <p>The hierarchy is written next to {@code file} as {@code <stem>_hierarchy.yaml}.</p>
   *
   * @param file target file
   * @return absolute path of the saved file
   * @throws UncheckedIOException when writing fails
   */
  public Path save(Path file) {
    Objects.requireNonNull(file, "file");
    Path target = file.toAbsolutePath().normalize();
    Metadata metadata = Metadata.at(ports.clock().nowMillis(), ports.zone(), regime, variationName);
    Map<String, Object> content = new LinkedHashMap<>();
    content.put(MergeEngine.METADATA_KEY, metadata.format());
    content.putAll(savedContent(root));
    try {
      ports.writer().write(target, content);
      ports.writer().writeHierarchy(hierarchyFileFor(target), hierarchyArtifact());
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to save config to " + target, ex);
    }
    savedPath = target;
    log.info("Saved config to {}", target);
    return target;
  }

  /**
   * Returns the hierarchy file written alongside a saved config.
   *
   * @param savedFile saved config file
   * @return sibling {@code <stem>_hierarchy.yaml}
   */
  public static Path hierarchyFileFor(Path savedFile) {
    String fileName = savedFile.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    return savedFile.resolveSibling(stem + HIERARCHY_SUFFIX);
  }

  /**
   * Returns an independent copy with the same regime. The copy has never been saved.
   *
   * @return copy
   */
  public ExperimentConfig copy() {
    return copyWithRegime(regime);
  }

  /**
   * Returns an independent copy governed by another overwriting regime. The copy has never been saved.
   *
   * @param newRegime regime of the copy
   * @return copy
   */
  public ExperimentConfig copyWithRegime(OverwritingRegime newRegime) {
    requireConstructed();
    ExperimentConfig copy = new ExperimentConfig(this, newRegime);
    copy.finishConstruction();
    return copy;
  }

  @Override
  public ExperimentConfig deriveVariation(String name, List<Object> patches) {
    Objects.requireNonNull(name, "name");
    requireConstructed();
    ExperimentConfig child = new ExperimentConfig(this, regime);
    child.variationName = name;
    Map<String, Object> experimentPaths = new LinkedHashMap<>();
    for (String path : child.hooked(BuiltinHook.EXPERIMENT_PATH)) {
      experimentPaths.put(path, PathMatcher.read(child.root, path));
    }
    for (Object patch : patches) {
      child.mergeSource(patch, MergeMode.OVERRIDE, "variation " + name);
    }
    experimentPaths.forEach(child::relocateExperimentPath);
    child.postProcess();
    child.finishConstruction();
    return child;
  }

  @Override
  public void applyDirect(String path, Object value) {
    for (String match : PathMatcher.expand(root, path)) {
      PathMatcher.write(root, match, Values.deepCopy(value));
      valuesBeforePostProcessing.remove(match);
    }
  }

  @Override
  public void applyTracked(String path, Object value) {
    Map<String, Object> patch = new LinkedHashMap<>();
    patch.put(path, value);
    mergeContent(SourceDescriptor.inline("code", patch), patch, MergeMode.OVERRIDE);
    postProcess();
  }

  @Override
  public void resave() {
    if (savedPath != null) {
      save(savedPath);
    }
  }

  void mergeSource(Object source, MergeMode mode, String inlineOrigin) {
    if (source instanceof Path path) {
      mergeFile(path.isAbsolute() ? path : resolveSource(path.toString()), mode);
    } else if (source instanceof String text) {
      mergeFile(resolveSource(text), mode);
    } else if (source instanceof Map<?, ?> map) {
      Map<String, Object> content = stringKeyed(map);
      mergeContent(SourceDescriptor.inline(inlineOrigin, content), content, mode);
    } else {
      throw new IllegalArgumentException("Unsupported config source: " + source);
    }
  }

  void mergeFile(Path file, MergeMode mode) {
    Path normalized = file.toAbsolutePath().normalize();
    mergeContent(SourceDescriptor.file(normalized), read(normalized), mode);
  }

  void mergeContent(SourceDescriptor descriptor, Map<String, Object> content, MergeMode mode) {
    preProcessingActive = preProcessEnabled;
    try {
      ENGINE.merge(descriptor, content, root, mode, callbacks);
    } finally {
      preProcessingActive = preProcessEnabled;
    }
  }

  Path resolveSource(String raw) {
    List<Path> previous = new ArrayList<>();
    for (SourceDescriptor descriptor : root.hierarchy()) {
      if (descriptor instanceof SourceDescriptor.FileSource file) {
        previous.add(file.path());
      }
    }
    return resolver.resolve(raw, previous);
  }

  /**
   * Runs post-processing on the parameters modified since the last pass.
   */
  void postProcess() {
    List<String> pending = new ArrayList<>(modified);
    modified.clear();
    if (!postProcessEnabled) {
      return;
    }
    List<String> processed = new ArrayList<>();
    for (String path : pending) {
      if (!PathMatcher.exists(root, path) || registry.matching(path, ProcessingPhase.POST).isEmpty()) {
        continue;
      }
      Object before = PathMatcher.read(root, path);
      Object after = registry.apply(path, Values.deepCopy(before), ProcessingPhase.POST, callbacks);
      PathMatcher.write(root, path, after);
      valuesBeforePostProcessing.put(path, before);
      processed.add(path);
    }
    if (!processed.isEmpty()) {
      log.info("Post-processed parameters : {}", processed);
    }
  }

  void warnUnmatchedPatterns() {
    List<String> paths = root.leafPaths();
    for (ProcessingPhase phase : ProcessingPhase.values()) {
      for (String pattern : registry.unmatchedPatterns(phase, paths)) {
        log.warn("{}-processing pattern '{}' does not match any parameter", phase.label(), pattern);
      }
    }
  }

  void recordMatchReports(List<MatchReport> reports) {
    matchReports.addAll(reports);
  }

  Object referenceValue(String path) {
    return preProcessedValue(path, PathMatcher.read(root, path));
  }

  ConfigNode tree() {
    return root;
  }

  void finishConstruction() {
    constructing = false;
    currentHolder = null;
    currentMode = null;
    guard = OverwriteGuard.forRegime(regime, this);
  }

  private Object preProcessedValue(String path, Object current) {
    return valuesBeforePostProcessing.containsKey(path) ? valuesBeforePostProcessing.get(path) : current;
  }

  private Map<String, Object> savedContent(ConfigNode node) {
    Map<String, Object> content = new LinkedHashMap<>();
    for (String key : node.keys()) {
      Object value = node.get(key);
      if (value instanceof ConfigNode child) {
        content.put(key, new TaggedMapping(key, savedContent(child)));
      } else {
        content.put(key, Values.deepCopy(preProcessedValue(node.pathOf(key), value)));
      }
    }
    return content;
  }

  private Map<String, Object> read(Path file) {
    try {
      return ports.reader().read(file);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read config file " + file, ex);
    }
  }

  private void requireConstructed() {
    if (constructing) {
      throw new IllegalStateException("Config '" + root.name() + "' is still under construction");
    }
  }

  private void recordHook(BuiltinHook hook, String path) {
    List<String> paths = hooked.computeIfAbsent(hook, h -> new ArrayList<>());
    if (!paths.contains(path)) {
      paths.add(path);
    }
  }

  private void relocateExperimentPath(String path, Object parentValue) {
    Object current = PathMatcher.read(root, path);
    String requested = experimentPathRequests.get(path);
    if (!Objects.equals(current, parentValue) || requested == null) {
      return;
    }
    PathMatcher.write(root, path, createExperimentDirectory(path, requested));
  }

  private Object experimentDirectory(String path, Object value) {
    if (value == null || "".equals(value)) {
      experimentPathRequests.remove(path);
      return value;
    }
    if (!(value instanceof String requested)) {
      throw new ProcessingException("Experiment path parameter '" + path + "' must be a string, got: " + value,
          path);
    }
    experimentPathRequests.put(path, requested);
    return createExperimentDirectory(path, requested);
  }

  private String createExperimentDirectory(String path, String requested) {
    try {
      Path directory = variationName == null
          ? ports.directories().createRunDirectory(Path.of(requested))
          : ports.directories().createVariationDirectory(Path.of(requested), variationName);
      return directory.toString();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to create experiment directory for '" + path + "'", ex);
    }
  }

  private void mergeAdditional(String path, Object value) {
    List<String> files = new ArrayList<>();
    if (value instanceof String file) {
      files.add(file);
    } else if (value instanceof List<?> list) {
      for (Object item : list) {
        if (!(item instanceof String file)) {
          throw new ProcessingException("Additional config file parameter '" + path
              + "' must hold paths, got: " + item, path);
        }
        files.add(file);
      }
    } else if (value != null) {
      throw new ProcessingException("Additional config file parameter '" + path
          + "' must be a path or a list of paths, got: " + value, path);
    }
    ConfigNode scope = currentHolder != null ? currentHolder : PathMatcher.holder(root, path);
    MergeMode mode = currentMode != null ? currentMode : MergeMode.OVERRIDE;
    for (String file : files) {
      Path resolved = resolveSource(file);
      log.info("Merging additional config file {} into {}", resolved,
          scope.isRoot() ? "root config" : "sub-config '" + scope.path() + "'");
      ENGINE.mergeInto(read(resolved), scope, mode, callbacks);
    }
  }

  private void registerVariation(String path, Object value) {
    if (path.contains(".")) {
      throw new ProcessingException("Variations declared in sub-configs are not supported ('" + path
          + "'); declare them in the root config", path);
    }
    variations.remove(path);
    if (value == null) {
      return;
    }
    List<Variation.Entry> entries = new ArrayList<>();
    if (value instanceof List<?> list) {
      for (int i = 0; i < list.size(); i++) {
        entries.add(new Variation.Entry(String.valueOf(i), requirePatch(path, list.get(i))));
      }
    } else if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        entries.add(new Variation.Entry(String.valueOf(entry.getKey()), requirePatch(path, entry.getValue())));
      }
    } else {
      throw new ProcessingException("Variation parameter '" + path
          + "' must be a list or a mapping of partial configs or file paths, got: " + value, path);
    }
    if (!entries.isEmpty()) {
      variations.put(path, new Variation(path, entries));
    }
  }

  private static Object requirePatch(String path, Object patch) {
    if (patch instanceof String || patch instanceof Map<?, ?>) {
      return Values.deepCopy(patch);
    }
    throw new ProcessingException("Entries of variation '" + path
        + "' must be partial configs or file paths, got: " + patch, path);
  }

  private void registerGrid(String path, Object value) {
    grids.remove(path);
    if (value == null) {
      return;
    }
    if (!(value instanceof List<?> list)) {
      throw new ProcessingException("Grid parameter '" + path + "' must be a list of variation names, got: "
          + value, path);
    }
    List<String> dimensions = new ArrayList<>();
    for (Object item : list) {
      if (!(item instanceof String dimension)) {
        throw new ProcessingException("Grid parameter '" + path + "' must hold variation names, got: " + item,
            path);
      }
      dimensions.add(dimension);
    }
    if (!dimensions.isEmpty()) {
      grids.put(path, new Grid(path, dimensions));
    }
  }

  private static Map<String, Object> stringKeyed(Map<?, ?> raw) {
    Map<String, Object> content = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new StructureException("Config sources must have string keys, got: " + entry.getKey(), null);
      }
      content.put(key, entry.getValue());
    }
    return content;
  }

  @Override
  public String toString() {
    return "ExperimentConfig{" + root.name() + ", regime=" + regime.label()
        + (variationName == null ? "" : ", variation=" + variationName) + ", parameters=" + root.leafPaths()
        + '}';
  }

  /** Merge observer and hook executor bound to this config. */
  private final class PipelineCallbacks implements MergeCallbacks, HookHandler {

    @Override
    public Object preProcess(ConfigNode holder, String key, Object value, MergeMode mode) {
      String path = holder.pathOf(key);
      if (!preProcessingActive) {
        for (BuiltinHook hook : registry.hooksFor(path, ProcessingPhase.PRE)) {
          recordHook(hook, path);
        }
        return value;
      }
      ConfigNode previousHolder = currentHolder;
      MergeMode previousMode = currentMode;
      currentHolder = holder;
      currentMode = mode;
      Object result;
      try {
        result = registry.apply(path, value, ProcessingPhase.PRE, this);
      } finally {
        currentHolder = previousHolder;
        currentMode = previousMode;
      }
      if (!ValueKind.of(result).isNative()) {
        throw new ProcessingException("Pre-processing of parameter '" + path + "' produced a "
            + result.getClass().getName() + "; pre-processing must produce native values, use post-processing "
            + "for other types", path);
      }
      return result;
    }

    @Override
    public Object referenceValue(String path, Object current) {
      return preProcessedValue(path, current);
    }

    @Override
    public void leafSet(String path, Object oldValue, Object newValue) {
      modified.add(path);
      valuesBeforePostProcessing.remove(path);
    }

    @Override
    public void metadataFound(Object raw) {
      Metadata metadata = Metadata.parse(raw);
      preProcessingActive = false;
      log.info("Loading a saved config ({}); pre-processing is disabled for the rest of this merge",
          metadata.format());
      if (constructing) {
        regime = metadata.regime();
        variationName = metadata.variationName();
        if (regime == OverwritingRegime.UNSAFE) {
          log.warn("Loading a config saved under the unsafe regime: its values may have been changed without "
              + "being tracked");
        }
      }
    }

    @Override
    public void wildcardExpanded(MatchReport report) {
      matchReports.add(report);
    }

    @Override
    public Object handle(BuiltinHook hook, String path, Object value) {
      recordHook(hook, path);
      return switch (hook) {
        case EXPERIMENT_PATH -> experimentDirectory(path, value);
        case ADDITIONAL_CONFIG_FILE -> {
          mergeAdditional(path, value);
          yield value;
        }
        case CONFIG_VARIATIONS -> {
          registerVariation(path, value);
          yield value;
        }
        case GRID -> {
          registerGrid(path, value);
          yield value;
        }
      };
    }
  }
}
