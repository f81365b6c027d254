package ca.gc.cra.strata.domain.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep-copy helpers for parameter values.
 */
public final class Values {

  private Values() {
    // Utility
  }

  /**
   * Copies sequences, mappings and tagged mappings recursively; scalars are returned as-is.
   *
   * @param value value to copy
   * @return independent copy
   */
  public static Object deepCopy(Object value) {
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      for (Object element : list) {
        copy.add(deepCopy(element));
      }
      return copy;
    }
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(entry.getKey(), deepCopy(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof TaggedMapping tagged) {
      return new TaggedMapping(tagged.tag(), deepCopyMapping(tagged.content()));
    }
    if (value instanceof Replacement replacement) {
      return new Replacement(deepCopy(replacement.value()));
    }
    return value;
  }

  /**
   * Copies a string-keyed mapping recursively.
   *
   * @param map mapping to copy
   * @return independent ordered copy
   */
  public static Map<String, Object> deepCopyMapping(Map<String, Object> map) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      copy.put(entry.getKey(), deepCopy(entry.getValue()));
    }
    return copy;
  }

  /**
   * Strips the explicit replacement marker.
   *
   * @param value possibly wrapped value
   * @return wrapped value, or {@code value} itself
   */
  public static Object unwrap(Object value) {
    return value instanceof Replacement replacement ? replacement.value() : value;
  }
}
