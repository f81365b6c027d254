package ca.gc.cra.strata.application.pipeline;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves source paths named in configs, on the command line or in variations.
 *
 * <p>Relative paths are tried against the directories of previously merged files, most recent first, then against
 * the working directory. Each location is tried as written, then with {@code .yaml} and {@code .yml} appended.</p>
 *
 * @since 0.1.0
 */
final class SourcePathResolver {
  private static final List<String> EXTENSIONS = List.of("", ".yaml", ".yml");

  private final Path workingDirectory;

  SourcePathResolver(Path workingDirectory) {
    this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
  }

  /**
   * Locates {@code raw}.
   *
   * @param raw path as written
   * @param previousFiles files already merged, in merge order
   * @return absolute normalized path of an existing file
   * @throws UncheckedIOException wrapping {@link NoSuchFileException} when nothing matches
   */
  Path resolve(String raw, List<Path> previousFiles) {
    Objects.requireNonNull(raw, "raw");
    Path requested = Path.of(raw);
    List<Path> bases = new ArrayList<>();
    if (requested.isAbsolute()) {
      bases.add(null);
    } else {
      for (int i = previousFiles.size() - 1; i >= 0; i--) {
        Path parent = previousFiles.get(i).toAbsolutePath().getParent();
        if (parent != null && !bases.contains(parent)) {
          bases.add(parent);
        }
      }
      if (!bases.contains(workingDirectory)) {
        bases.add(workingDirectory);
      }
    }
    for (Path base : bases) {
      for (String extension : EXTENSIONS) {
        Path candidate = base == null ? Path.of(raw + extension) : base.resolve(raw + extension);
        if (Files.isRegularFile(candidate)) {
          return candidate.toAbsolutePath().normalize();
        }
      }
    }
    throw new UncheckedIOException("Config file not found: " + raw + " (searched " + bases + ")",
        new NoSuchFileException(raw));
  }
}
