package ca.gc.cra.strata.infrastructure.fs;

import ca.gc.cra.strata.application.port.ExperimentDirectoryPort;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allocates experiment directories on the local file system.
 *
 * <p>The run index is one above the largest numeric suffix found among siblings starting with the experiment
 * name; siblings without a numeric suffix are ignored.</p>
 *
 * @since 0.1.0
 */
public final class FileSystemExperimentDirectories implements ExperimentDirectoryPort {
  private static final Logger log = LoggerFactory.getLogger(FileSystemExperimentDirectories.class);

  @Override
  public Path createRunDirectory(Path requested) throws IOException {
    Path folder = folderOf(requested);
    String experiment = requested.getFileName().toString();
    Path run = folder.resolve(experiment + "_" + (maxIndex(folder, experiment) + 1));
    Files.createDirectories(run);
    log.info("Created experiment directory {}", run);
    return run;
  }

  @Override
  public Path createVariationDirectory(Path requested, String variationName) throws IOException {
    Objects.requireNonNull(variationName, "variationName");
    Path folder = folderOf(requested);
    String experiment = requested.getFileName().toString();
    int index = Math.max(maxIndex(folder, experiment), 0);
    Path dir = folder.resolve(experiment + "_" + index).resolve(variationName);
    Files.createDirectories(dir);
    log.info("Created variation directory {}", dir);
    return dir;
  }

  private static Path folderOf(Path requested) throws IOException {
    Objects.requireNonNull(requested, "requested");
    if (requested.getFileName() == null) {
      throw new IOException("experiment path has no name: " + requested);
    }
    Path parent = requested.getParent();
    Path folder = parent == null ? Path.of(".") : parent;
    Files.createDirectories(folder);
    return folder;
  }

  private static int maxIndex(Path folder, String experiment) throws IOException {
    int max = -1;
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(folder)) {
      for (Path entry : entries) {
        String name = entry.getFileName().toString();
        if (!name.startsWith(experiment)) {
          continue;
        }
        int idx = name.lastIndexOf('_');
        if (idx < 0) {
          continue;
        }
        try {
          max = Math.max(max, Integer.parseInt(name.substring(idx + 1)));
        } catch (NumberFormatException ex) {
          log.debug("Ignoring non-indexed sibling {}", entry);
        }
      }
    }
    return max;
  }
}
