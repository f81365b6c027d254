package ca.gc.cra.strata.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void createsMissingDirectories() {
    Path created = Paths.outputDirectory(tempDir.resolve("variations/run"), false);

    assertTrue(Files.isDirectory(created));
  }

  @Test
  void populatedDirectoryRequiresReuse() throws IOException {
    Path dir = Files.createDirectories(tempDir.resolve("out"));
    Files.writeString(dir.resolve("a.yaml"), "lr: 0.1\n");

    assertThrows(IllegalArgumentException.class, () -> Paths.outputDirectory(dir, false));
    assertTrue(Files.isDirectory(Paths.outputDirectory(dir, true)));
  }

  @Test
  void regularFileIsNotADirectory() throws IOException {
    Path file = Files.writeString(tempDir.resolve("file.yaml"), "lr: 0.1\n");

    assertThrows(IllegalArgumentException.class, () -> Paths.outputDirectory(file, true));
  }

  @Test
  void existingOutputFileRequiresOverwrite() throws IOException {
    Path file = Files.writeString(tempDir.resolve("saved.yaml"), "lr: 0.1\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> Paths.outputFile(file, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(file.toAbsolutePath().normalize(), Paths.outputFile(file, true));
    assertThrows(IllegalArgumentException.class, () -> Paths.outputFile(tempDir, true));
  }
}
