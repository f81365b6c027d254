package ca.gc.cra.strata.infrastructure.json;

import ca.gc.cra.strata.application.port.SourceReader;
import ca.gc.cra.strata.domain.error.StructureException;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads JSON sources with the Jackson streaming parser.
 *
 * <p>JSON carries no tags: nested objects stay opaque values and sub-configs are addressed with dotted keys.
 * Duplicate keys are rejected.</p>
 *
 * @since 0.1.0
 */
public final class JsonSourceReader implements SourceReader {
  private static final String HIERARCHY_KEY = "config_hierarchy";

  private final JsonFactory factory;

  public JsonSourceReader() {
    this.factory = JsonFactory.builder()
        .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
        .build();
  }

  @Override
  public Map<String, Object> read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    try (InputStream in = Files.newInputStream(path);
        JsonParser parser = factory.createParser(in)) {
      JsonToken first = parser.nextToken();
      if (first == null) {
        return new LinkedHashMap<>();
      }
      if (first != JsonToken.START_OBJECT) {
        throw new StructureException("JSON source " + path + " must contain an object", null);
      }
      return readObject(parser);
    } catch (JsonParseException ex) {
      throw new StructureException("Failed to parse JSON source " + path + ": " + ex.getOriginalMessage(), null,
          ex);
    }
  }

  @Override
  public List<Object> readHierarchy(Path path) throws IOException {
    Object entries = read(path).get(HIERARCHY_KEY);
    if (!(entries instanceof List<?> list)) {
      throw new StructureException("Hierarchy file " + path + " must contain a '" + HIERARCHY_KEY + "' list",
          HIERARCHY_KEY);
    }
    return new ArrayList<>(list);
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> narrow(parser.getNumberValue());
      case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new StructureException("Unsupported JSON token: " + token, null);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new StructureException("Expected field name but found " + token, null);
      }
      String fieldName = parser.currentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static Object narrow(Number number) {
    if (number instanceof Long value && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
      return value.intValue();
    }
    return number;
  }
}
