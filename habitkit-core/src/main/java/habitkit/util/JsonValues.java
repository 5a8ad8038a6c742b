package habitkit.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy helpers for JSON-shaped values: {@code Map<String, ?>}, collections, strings,
 * numbers, booleans and {@code null}.
 *
 * <p>Integration namespaces are opaque to the core but always JSON-shaped, so every
 * boundary that hands such a value to or from an extension makes a deep copy here.
 * Insertion order of map keys is preserved.
 */
public final class JsonValues {

  private JsonValues() {
  }

  /**
   * Deep, unmodifiable copy of a map. {@code null} yields an empty map.
   *
   * @param source the map to copy
   * @return an unmodifiable deep copy
   * @throws IllegalArgumentException if a nested map has a non-string key
   */
  public static Map<String, Object> immutableCopy(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Object> copy = new LinkedHashMap<>(source.size() * 2);
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      copy.put(requireKey(entry.getKey()), immutableValue(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Deep, mutable copy of a map. {@code null} yields an empty map.
   *
   * @param source the map to copy
   * @return a mutable deep copy
   */
  public static Map<String, Object> mutableCopy(Map<String, ?> source) {
    Map<String, Object> copy = new LinkedHashMap<>();
    if (source == null) {
      return copy;
    }
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      copy.put(requireKey(entry.getKey()), mutableValue(entry.getValue()));
    }
    return copy;
  }

  public static Object immutableValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return immutableCopy(castKeys(map));
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      for (Object element : collection) {
        copy.add(immutableValue(element));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }

  public static Object mutableValue(Object value) {
    if (value instanceof Map<?, ?> map) {
      return mutableCopy(castKeys(map));
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      for (Object element : collection) {
        copy.add(mutableValue(element));
      }
      return copy;
    }
    return value;
  }

  /**
   * Checks that a value can be stored as JSON.
   *
   * @param value the value to check
   * @param where description of the value's location, used in the error message
   * @throws IllegalArgumentException if the value, or anything nested in it, is not JSON-shaped
   */
  public static void requireJsonCompatible(Object value, String where) {
    if (value == null || value instanceof String || value instanceof Number
        || value instanceof Boolean) {
      return;
    }
    if (value instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException("Non-string key at " + where);
        }
        requireJsonCompatible(entry.getValue(), where + "." + key);
      }
      return;
    }
    if (value instanceof Collection<?> collection) {
      int index = 0;
      for (Object element : collection) {
        requireJsonCompatible(element, where + "[" + index++ + "]");
      }
      return;
    }
    throw new IllegalArgumentException(
        "Unsupported value type " + value.getClass().getName() + " at " + where);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, ?> castKeys(Map<?, ?> map) {
    for (Object key : map.keySet()) {
      requireKey(key);
    }
    return (Map<String, ?>) map;
  }

  private static String requireKey(Object key) {
    if (!(key instanceof String s)) {
      throw new IllegalArgumentException("JSON object keys must be strings, got: " + key);
    }
    return s;
  }
}
