package ca.gc.cra.strata.application.guard;

import ca.gc.cra.strata.domain.error.ImmutableConfigException;
import ca.gc.cra.strata.domain.tree.OverwritingRegime;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Enforces the overwriting regime on direct mutations made after construction.
 * <p><strong>Why:</strong> A configuration is the record of an experiment; edits outside the merge pipeline must
 * either be refused, flagged, or tracked and persisted.</p>
 * <p><strong>Role:</strong> Observer on node mutation. The on-mutate callback is selected once, from the regime, when
 * the guard is created; the regime never changes afterwards.</p>
 * <ul>
 *   <li>{@code locked}: rejected with {@link ImmutableConfigException}, tree unchanged.</li>
 *   <li>{@code unsafe}: applied unconditionally; a one-time notice is logged at the first mutation.</li>
 *   <li>{@code auto-save}: applied as a tracked merge, then re-saved when a save file exists.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe, like the configuration it guards.</p>
 *
 * @since 0.1.0
 */
public final class OverwriteGuard {
  private static final Logger log = LoggerFactory.getLogger(OverwriteGuard.class);

  private final OverwritingRegime regime;
  private final MutationTarget target;
  private final MutationCallback callback;
  private boolean unsafeNoticeEmitted;

  private OverwriteGuard(OverwritingRegime regime, MutationTarget target) {
    this.regime = Objects.requireNonNull(regime, "regime");
    this.target = Objects.requireNonNull(target, "target");
    this.callback = switch (regime) {
      case LOCKED -> this::reject;
      case UNSAFE -> this::applyUnsafe;
      case AUTO_SAVE -> this::applyAndSave;
    };
  }

  /**
   * Creates the guard for {@code regime}.
   *
   * @param regime overwriting regime fixed for the guarded configuration
   * @param target configuration receiving allowed mutations
   * @return guard
   */
  public static OverwriteGuard forRegime(OverwritingRegime regime, MutationTarget target) {
    return new OverwriteGuard(regime, target);
  }

  public OverwritingRegime regime() {
    return regime;
  }

  /**
   * Handles a direct mutation request.
   *
   * @param path literal path or wildcard pattern
   * @param value new value
   * @throws ImmutableConfigException under the locked regime
   */
  public void onMutate(String path, Object value) {
    Objects.requireNonNull(path, "path");
    callback.mutate(path, value);
  }

  private void reject(String path, Object value) {
    throw new ImmutableConfigException("Trying to set parameter '" + path + "' to '" + value
        + "' in a locked config. Build a copy with another overwriting regime to edit it.", path);
  }

  private void applyUnsafe(String path, Object value) {
    if (!unsafeNoticeEmitted) {
      unsafeNoticeEmitted = true;
      log.warn("Setting '{}' in an unsafe config: there is no safety net, this change is neither tracked nor "
          + "saved and reproducibility of the experiment is not ensured", path);
    }
    target.applyDirect(path, value);
  }

  private void applyAndSave(String path, Object value) {
    target.applyTracked(path, value);
    Optional<Path> saved = target.savedPath();
    if (saved.isPresent()) {
      log.warn("Parameter '{}' changed after saving; overwriting saved config file {}", path, saved.get());
      target.resave();
    }
  }

  @FunctionalInterface
  private interface MutationCallback {
    void mutate(String path, Object value);
  }
}
