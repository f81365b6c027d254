package ca.gc.cra.strata.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Checks on the files and directories a command writes saved configs to.
 * <p><strong>Why:</strong> Saving into a populated location would silently replace earlier runs.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Prepares a directory receiving one saved config per variation, creating it when absent.
   *
   * @param dir candidate directory
   * @param allowReuse when {@code false}, a directory that already holds entries is rejected
   * @return absolute, normalized directory
   * @throws IllegalArgumentException if the path names a file, is populated while reuse is forbidden, is not
   *         writable or cannot be created
   */
  public static Path outputDirectory(Path dir, boolean allowReuse) {
    Path target = absolute(dir);
    if (Files.exists(target) && !Files.isDirectory(target)) {
      throw new IllegalArgumentException("path is not a directory: " + target);
    }
    try {
      Files.createDirectories(target);
      if (!allowReuse) {
        try (Stream<Path> entries = Files.list(target)) {
          if (entries.findAny().isPresent()) {
            throw new IllegalArgumentException("directory " + target + " is not empty; re-run with "
                + "--allow-overwrite to reuse it");
          }
        }
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to prepare directory " + target + ": " + ex.getMessage(), ex);
    }
    if (!Files.isWritable(target)) {
      throw new IllegalArgumentException("directory is not writable: " + target);
    }
    return target;
  }

  /**
   * Checks the file a single saved config is written to.
   *
   * @param file candidate file
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute, normalized file
   * @throws IllegalArgumentException if the path is a directory, or exists while overwriting is forbidden
   */
  public static Path outputFile(Path file, boolean allowOverwrite) {
    Path target = absolute(file);
    if (Files.isDirectory(target)) {
      throw new IllegalArgumentException("path is a directory: " + target);
    }
    if (Files.exists(target) && !allowOverwrite) {
      throw new IllegalArgumentException("output file " + target + " already exists; re-run with "
          + "--allow-overwrite to replace it");
    }
    return target;
  }

  private static Path absolute(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (path.toString().indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}
