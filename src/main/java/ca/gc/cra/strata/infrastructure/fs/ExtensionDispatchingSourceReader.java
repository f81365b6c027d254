package ca.gc.cra.strata.infrastructure.fs;

import ca.gc.cra.strata.application.port.SourceReader;
import ca.gc.cra.strata.infrastructure.json.JsonSourceReader;
import ca.gc.cra.strata.infrastructure.yaml.YamlSourceReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chooses the document reader from the file extension: {@code .json} files are read as JSON, everything else as
 * YAML.
 *
 * @since 0.1.0
 */
public final class ExtensionDispatchingSourceReader implements SourceReader {
  private final SourceReader yaml;
  private final SourceReader json;

  public ExtensionDispatchingSourceReader() {
    this(new YamlSourceReader(), new JsonSourceReader());
  }

  ExtensionDispatchingSourceReader(SourceReader yaml, SourceReader json) {
    this.yaml = yaml;
    this.json = json;
  }

  @Override
  public Map<String, Object> read(Path path) throws IOException {
    return readerFor(path).read(path);
  }

  @Override
  public List<Object> readHierarchy(Path path) throws IOException {
    return readerFor(path).readHierarchy(path);
  }

  private SourceReader readerFor(Path path) {
    Path fileName = path.getFileName();
    String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    return name.endsWith(".json") ? json : yaml;
  }
}
