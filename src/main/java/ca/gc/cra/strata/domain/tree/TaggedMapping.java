package ca.gc.cra.strata.domain.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mapping annotated with a sub-config tag ({@code !name} in YAML documents).
 *
 * <p>A tagged mapping creates or addresses the nested node called {@code tag}; an untagged mapping stays an opaque
 * parameter value.</p>
 *
 * @param tag sub-config name carried by the tag
 * @param content parameters of the sub-config, in document order
 * @since 0.1.0
 */
public record TaggedMapping(String tag, Map<String, Object> content) {

  public TaggedMapping {
    Objects.requireNonNull(tag, "tag");
    content = content == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(content));
  }
}
