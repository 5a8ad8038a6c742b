package habitkit.merge;

import habitkit.util.JsonValues;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How writes change integration documents. Every store applies write sets through here
 * so in-memory and JDBC persistence agree.
 */
public final class IntegrationDocuments {

  private IntegrationDocuments() {
  }

  /**
   * Applies a write set to a habit's whole {@code integrations} map.
   *
   * @param integrations current state keyed by extension name; not modified
   * @param writeSet     writes to apply
   * @return a new mutable map with the writes applied
   */
  public static Map<String, Map<String, Object>> apply(
      Map<String, ? extends Map<String, ?>> integrations, WriteSet writeSet) {
    Map<String, Map<String, Object>> result = new LinkedHashMap<>();
    if (integrations != null) {
      integrations.forEach((name, data) -> result.put(name, JsonValues.mutableCopy(data)));
    }
    for (String extension : writeSet.touchedExtensions()) {
      result.put(extension, applyToNamespace(result.get(extension), writeSet.writesFor(extension)));
    }
    return result;
  }

  /**
   * Applies writes to one namespace document.
   *
   * <p>{@link IntegrationWrite.Replace} discards everything before it. A
   * {@link IntegrationWrite.SetField} creates missing intermediate objects and replaces
   * intermediate values that are not objects.
   *
   * @param current current namespace content, {@code null} if absent; not modified
   * @param writes  writes for this namespace, in order
   * @return the new namespace content
   */
  public static Map<String, Object> applyToNamespace(Map<String, ?> current, List<IntegrationWrite> writes) {
    Map<String, Object> document = JsonValues.mutableCopy(current);
    for (IntegrationWrite write : writes) {
      if (write instanceof IntegrationWrite.Replace replace) {
        document = JsonValues.mutableCopy(replace.blob());
      } else if (write instanceof IntegrationWrite.SetField set) {
        setField(document, set.segments(), set.value());
      }
    }
    return document;
  }

  @SuppressWarnings("unchecked")
  private static void setField(Map<String, Object> document, List<String> segments, Object value) {
    Map<String, Object> node = document;
    for (int i = 0; i < segments.size() - 1; i++) {
      String segment = segments.get(i);
      Object child = node.get(segment);
      if (!(child instanceof Map)) {
        child = new LinkedHashMap<String, Object>();
        node.put(segment, child);
      }
      node = (Map<String, Object>) child;
    }
    node.put(segments.get(segments.size() - 1), JsonValues.mutableValue(value));
  }
}
