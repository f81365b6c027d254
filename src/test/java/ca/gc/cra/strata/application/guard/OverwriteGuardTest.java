package ca.gc.cra.strata.application.guard;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.strata.domain.error.ImmutableConfigException;
import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class OverwriteGuardTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private boolean originalAdditive;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(OverwriteGuard.class);
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
  void lockedRejectsEveryMutation() {
    RecordingTarget target = new RecordingTarget(null);
    OverwriteGuard guard = OverwriteGuard.forRegime(OverwritingRegime.LOCKED, target);

    ImmutableConfigException ex = assertThrows(ImmutableConfigException.class, () -> guard.onMutate("lr", 0.2));

    assertEquals("lr", ex.path().orElseThrow());
    assertTrue(target.calls.isEmpty());
  }

  @Test
  void unsafeAppliesDirectlyAndWarnsOnce() {
    RecordingTarget target = new RecordingTarget(null);
    OverwriteGuard guard = OverwriteGuard.forRegime(OverwritingRegime.UNSAFE, target);

    guard.onMutate("lr", 0.2);
    guard.onMutate("epochs", 3);

    assertEquals(List.of("direct lr", "direct epochs"), target.calls);
    assertEquals(1, appender.list.stream().filter(event -> event.getLevel() == Level.WARN).count());
  }

  @Test
  void autoSaveTracksAndResavesWhenSaved() {
    RecordingTarget target = new RecordingTarget(Path.of("saved.yaml"));
    OverwriteGuard guard = OverwriteGuard.forRegime(OverwritingRegime.AUTO_SAVE, target);

    guard.onMutate("lr", 0.2);

    assertEquals(List.of("tracked lr", "resave"), target.calls);
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.WARN
        && event.getFormattedMessage().contains("saved.yaml")));
  }

  @Test
  void autoSaveWithoutSaveFileOnlyTracks() {
    RecordingTarget target = new RecordingTarget(null);

    OverwriteGuard.forRegime(OverwritingRegime.AUTO_SAVE, target).onMutate("lr", 0.2);

    assertEquals(List.of("tracked lr"), target.calls);
  }

  private static final class RecordingTarget implements MutationTarget {
    private final List<String> calls = new ArrayList<>();
    private final Path saved;

    RecordingTarget(Path saved) {
      this.saved = saved;
    }

    @Override
    public void applyDirect(String path, Object value) {
      calls.add("direct " + path);
    }

    @Override
    public void applyTracked(String path, Object value) {
      calls.add("tracked " + path);
    }

    @Override
    public Optional<Path> savedPath() {
      return Optional.ofNullable(saved);
    }

    @Override
    public void resave() {
      calls.add("resave");
    }
  }
}
