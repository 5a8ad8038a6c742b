package habitkit;

import java.util.Objects;

/**
 * The user whose action triggered a lifecycle event.
 *
 * @param id          user identifier
 * @param displayName optional display name
 */
public record UserRef(String id, String displayName) {

  public UserRef {
    Objects.requireNonNull(id, "id");
  }

  public static UserRef of(String id) {
    return new UserRef(id, null);
  }
}
