package habitkit.merge;

import habitkit.util.JsonValues;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One write against a single extension namespace.
 */
public sealed interface IntegrationWrite permits IntegrationWrite.Replace, IntegrationWrite.SetField {

  String extensionName();

  /** Overwrites the whole namespace with {@code blob}. */
  record Replace(String extensionName, Map<String, Object> blob) implements IntegrationWrite {
    public Replace {
      Objects.requireNonNull(extensionName, "extensionName");
      blob = JsonValues.immutableCopy(blob);
    }
  }

  /**
   * Sets one field inside the namespace. {@code segments} is the path below the
   * namespace root and is never empty.
   */
  record SetField(String extensionName, List<String> segments, Object value) implements IntegrationWrite {
    public SetField {
      Objects.requireNonNull(extensionName, "extensionName");
      segments = List.copyOf(segments);
      if (segments.isEmpty()) {
        throw new IllegalArgumentException("segments cannot be empty");
      }
      value = JsonValues.immutableValue(value);
    }

    public String dottedPath() {
      return String.join(".", segments);
    }
  }
}
