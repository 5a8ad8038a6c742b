package habitkit.merge;

import habitkit.HookResult;
import habitkit.util.JsonValues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns the hook results of one dispatch into a single {@link WriteSet}.
 *
 * <ul>
 *   <li>{@code Seed(blob)} becomes one {@link IntegrationWrite.Replace}; no deep merge
 *       with the previous namespace content.</li>
 *   <li>{@code Patch(map)} becomes one {@link IntegrationWrite.SetField} per entry. Values
 *       overwrite; numbers are never accumulated.</li>
 * </ul>
 *
 * <p>A result that cannot be merged (a path outside the extension's namespace, a value
 * that is not JSON-shaped) is dropped as a whole and recorded in
 * {@link WriteSet#rejected()}. Writes of other extensions are kept.
 *
 * <p>This class is stateless and thread-safe.
 */
public final class IntegrationMerger {
  private static final Logger logger = Logger.getLogger(IntegrationMerger.class.getName());

  public WriteSet merge(String habitId, List<ExtensionResult> results) {
    List<IntegrationWrite> writes = new ArrayList<>();
    Map<String, String> rejected = new LinkedHashMap<>();
    for (ExtensionResult result : results) {
      try {
        writes.addAll(toWrites(result));
      } catch (MergeException e) {
        rejected.put(result.extensionName(), e.getMessage());
        logger.log(Level.WARNING, "Dropped writes of extension " + result.extensionName()
            + " for habit " + habitId + ": " + e.getMessage());
      }
    }
    return new WriteSet(habitId, writes, rejected);
  }

  private static List<IntegrationWrite> toWrites(ExtensionResult tagged) {
    String extension = tagged.extensionName();
    HookResult result = tagged.result();
    if (result instanceof HookResult.Seed seed) {
      requireJson(extension, seed.blob(), IntegrationPaths.ROOT + "." + extension);
      return List.of(new IntegrationWrite.Replace(extension, seed.blob()));
    }
    if (result instanceof HookResult.Patch patch) {
      List<IntegrationWrite> writes = new ArrayList<>(patch.pathValues().size());
      for (Map.Entry<String, Object> entry : patch.pathValues().entrySet()) {
        List<String> segments = IntegrationPaths.resolve(extension, entry.getKey());
        requireJson(extension, entry.getValue(), IntegrationPaths.qualified(extension, segments));
        writes.add(new IntegrationWrite.SetField(extension, segments, entry.getValue()));
      }
      return writes;
    }
    return List.of();
  }

  private static void requireJson(String extension, Object value, String where) {
    try {
      JsonValues.requireJsonCompatible(value, where);
    } catch (IllegalArgumentException e) {
      throw new MergeException(extension, e.getMessage(), e);
    }
  }
}
