package ca.gc.cra.strata.application.merge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.domain.error.StructureException;
import ca.gc.cra.strata.domain.error.TypeMismatchException;
import ca.gc.cra.strata.domain.error.UnknownParameterException;
import ca.gc.cra.strata.domain.path.MatchReport;
import ca.gc.cra.strata.domain.path.PathMatcher;
import ca.gc.cra.strata.domain.tree.ConfigNode;
import ca.gc.cra.strata.domain.tree.Replacement;
import ca.gc.cra.strata.domain.tree.SourceDescriptor;
import ca.gc.cra.strata.domain.tree.TaggedMapping;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class MergeEngineTest {
  private final MergeEngine engine = new MergeEngine();
  private ConfigNode root;
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    root = ConfigNode.root("main");
    Map<String, Object> defaults = new LinkedHashMap<>();
    defaults.put("param1", 0.1);
    defaults.put("name", "run");
    defaults.put("maybe", null);
    defaults.put("subconfig1", new TaggedMapping("subconfig1", Map.of("param2", 3.0)));
    defaults.put("subconfig2", new TaggedMapping("subconfig2", Map.of("param2", 4.0)));
    engine.merge(SourceDescriptor.inline("default", defaults), defaults, root, MergeMode.DEFAULT, null);

    logger = (Logger) LoggerFactory.getLogger(MergeEngine.class);
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
  }

  @Test
  void defaultMergeDefinesKeysAndRecordsHierarchy() {
    assertEquals(List.of("param1", "name", "maybe", "subconfig1.param2", "subconfig2.param2"), root.leafPaths());
    assertEquals(1, root.hierarchy().size());
  }

  @Test
  void defaultMergeRejectsKeysSetTwice() {
    StructureException ex = assertThrows(StructureException.class,
        () -> merge(MergeMode.DEFAULT, Map.of("param1", 0.2)));

    assertTrue(ex.getMessage().contains("set twice"));
  }

  @Test
  void defaultMergeRejectsWildcards() {
    assertThrows(StructureException.class, () -> merge(MergeMode.DEFAULT, Map.of("*.x", 1)));
  }

  @Test
  void dottedKeysCreateIntermediateSubConfigs() {
    merge(MergeMode.DEFAULT, Map.of("model.encoder.depth", 4));

    assertEquals(4, PathMatcher.read(root, "model.encoder.depth"));
  }

  @Test
  void mismatchedTagIsRejected() {
    assertThrows(StructureException.class,
        () -> merge(MergeMode.DEFAULT, Map.of("other", new TaggedMapping("wrong", Map.of()))));
  }

  @Test
  void overrideRequiresExistingKeys() {
    UnknownParameterException ex = assertThrows(UnknownParameterException.class,
        () -> merge(MergeMode.OVERRIDE, Map.of("param3", 1)));

    assertEquals("param3", ex.path().orElseThrow());
    assertThrows(UnknownParameterException.class, () -> merge(MergeMode.OVERRIDE, Map.of("subconfig1.x", 1)));
  }

  @Test
  void overridePreservesKindsAndWidensIntegers() {
    merge(MergeMode.OVERRIDE, Map.of("param1", 1));

    assertEquals(1.0, PathMatcher.read(root, "param1"));
    TypeMismatchException ex = assertThrows(TypeMismatchException.class,
        () -> merge(MergeMode.OVERRIDE, Map.of("name", 5)));
    assertEquals("name", ex.path().orElseThrow());
  }

  @Test
  void replacementBypassesKindCheck() {
    merge(MergeMode.OVERRIDE, Map.of("name", new Replacement(List.of(1, 2))));

    assertEquals(List.of(1, 2), PathMatcher.read(root, "name"));
  }

  @Test
  void noneAcceptsAnyKindInFileMerges() {
    merge(MergeMode.OVERRIDE, Map.of("maybe", "now"));

    assertEquals("now", PathMatcher.read(root, "maybe"));
  }

  @Test
  void taggedOverrideMergesIntoSubConfig() {
    merge(MergeMode.OVERRIDE, Map.of("subconfig1", new TaggedMapping("subconfig1", Map.of("param2", 5.0))));

    assertEquals(5.0, PathMatcher.read(root, "subconfig1.param2"));
    assertThrows(StructureException.class, () -> merge(MergeMode.OVERRIDE, Map.of("subconfig1", 3)));
  }

  @Test
  void wildcardOverrideUpdatesEveryMatchAndReportsIt() {
    List<MatchReport> reports = new ArrayList<>();
    Map<String, Object> content = Map.of("*.param2", 7.0);
    engine.merge(SourceDescriptor.inline("test", content), content, root, MergeMode.OVERRIDE,
        new MergeCallbacks() {
          @Override
          public void wildcardExpanded(MatchReport report) {
            reports.add(report);
          }
        });

    assertEquals(7.0, PathMatcher.read(root, "subconfig1.param2"));
    assertEquals(7.0, PathMatcher.read(root, "subconfig2.param2"));
    assertEquals(List.of("subconfig1.param2", "subconfig2.param2"), reports.get(0).matches());
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.INFO
        && event.getFormattedMessage().contains("Pattern parameter '*.param2'")));
  }

  @Test
  void zeroMatchWildcardIsWarned() {
    merge(MergeMode.OVERRIDE, Map.of("*.missing", 1));

    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("*.missing")));
  }

  @Test
  void metadataOnlyAllowedAtRoot() {
    List<Object> seen = new ArrayList<>();
    Map<String, Object> content = Map.of(MergeEngine.METADATA_KEY, "meta");
    engine.mergeInto(content, root, MergeMode.OVERRIDE, new MergeCallbacks() {
      @Override
      public void metadataFound(Object metadata) {
        seen.add(metadata);
      }
    });

    assertEquals(List.of("meta"), seen);
    ConfigNode sub = root.child("subconfig1").orElseThrow();
    assertThrows(StructureException.class, () -> engine.mergeInto(content, sub, MergeMode.OVERRIDE, null));
  }

  @Test
  void preProcessingSeesEveryLeafInSourceOrder() {
    List<String> seen = new ArrayList<>();
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("a", 1);
    content.put("b", 2);
    engine.mergeInto(content, ConfigNode.root("fresh"), MergeMode.DEFAULT, new MergeCallbacks() {
      @Override
      public Object preProcess(ConfigNode holder, String key, Object value, MergeMode mode) {
        seen.add(holder.pathOf(key));
        return ((Integer) value) * 10;
      }
    });

    assertEquals(List.of("a", "b"), seen);
  }

  private void merge(MergeMode mode, Map<String, Object> content) {
    engine.merge(SourceDescriptor.inline("test", content), content, root, mode, MergeCallbacks.NO_OP);
  }
}
