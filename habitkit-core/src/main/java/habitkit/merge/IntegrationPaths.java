package habitkit.merge;

import java.util.Arrays;
import java.util.List;

/**
 * Parses patch paths into segments below an extension's namespace.
 *
 * <p>Accepted forms, for extension {@code counter}:
 * <ul>
 *   <li>{@code integrations.counter.count} (qualified)</li>
 *   <li>{@code count} or {@code stats.total} (relative to the namespace)</li>
 * </ul>
 */
public final class IntegrationPaths {
  public static final String ROOT = "integrations";

  private IntegrationPaths() {
  }

  /**
   * Resolves a path for an extension.
   *
   * @return segments below the namespace root, never empty
   * @throws MergeException if the path is empty, has an empty segment, addresses another
   *     extension's namespace, or addresses the namespace root itself
   */
  public static List<String> resolve(String extensionName, String path) {
    if (path == null || path.isEmpty()) {
      throw new MergeException(extensionName, "Empty patch path from " + extensionName);
    }
    List<String> segments = Arrays.asList(path.split("\\.", -1));
    for (String segment : segments) {
      if (segment.isEmpty()) {
        throw new MergeException(extensionName, "Empty segment in patch path '" + path + "'");
      }
    }
    if (!ROOT.equals(segments.get(0))) {
      return List.copyOf(segments);
    }
    if (segments.size() < 2 || !extensionName.equals(segments.get(1))) {
      throw new MergeException(extensionName,
          "Extension " + extensionName + " cannot write outside its namespace: '" + path + "'");
    }
    if (segments.size() == 2) {
      throw new MergeException(extensionName,
          "Patch path '" + path + "' addresses the whole namespace; return a Seed instead");
    }
    return List.copyOf(segments.subList(2, segments.size()));
  }

  public static String qualified(String extensionName, List<String> segments) {
    return ROOT + "." + extensionName + "." + String.join(".", segments);
  }
}
