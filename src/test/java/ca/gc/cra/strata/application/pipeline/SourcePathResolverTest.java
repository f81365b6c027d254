package ca.gc.cra.strata.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourcePathResolverTest {
  @TempDir
  Path tempDir;

  @Test
  void appendsYamlExtensions() throws IOException {
    Path file = Files.writeString(tempDir.resolve("exp.yml"), "a: 1\n");

    assertEquals(file, new SourcePathResolver(tempDir).resolve("exp", List.of()));
  }

  @Test
  void prefersDirectoryOfTheLatestMergedFile() throws IOException {
    Files.createDirectories(tempDir.resolve("nested"));
    Files.writeString(tempDir.resolve("extra.yaml"), "a: 1\n");
    Path nested = Files.writeString(tempDir.resolve("nested/extra.yaml"), "a: 2\n");
    Path previous = tempDir.resolve("nested/base.yaml");

    assertEquals(nested, new SourcePathResolver(tempDir).resolve("extra", List.of(previous)));
  }

  @Test
  void fallsBackToTheWorkingDirectory() throws IOException {
    Path file = Files.writeString(tempDir.resolve("extra.yaml"), "a: 1\n");
    Path previous = tempDir.resolve("nested/base.yaml");

    assertEquals(file, new SourcePathResolver(tempDir).resolve("extra.yaml", List.of(previous)));
  }

  @Test
  void missingFileRaisesNoSuchFile() {
    SourcePathResolver resolver = new SourcePathResolver(tempDir);

    UncheckedIOException ex = assertThrows(UncheckedIOException.class,
        () -> resolver.resolve("missing", List.of()));
    assertInstanceOf(NoSuchFileException.class, ex.getCause());
  }
}
