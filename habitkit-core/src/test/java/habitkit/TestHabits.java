package habitkit;

import java.util.Map;

/**
 * Snapshot factories shared by the core tests.
 */
public final class TestHabits {

    private TestHabits() {
    }

    public static HabitSnapshot habit(String id, String type) {
        return HabitSnapshot.builder(id, type).userId("u1").name("Read").build();
    }

    public static HabitSnapshot habit(String id, String type, String extension, Map<String, ?> data) {
        return HabitSnapshot.builder(id, type).userId("u1").name("Read").integration(extension, data).build();
    }

    public static UserRef user() {
        return new UserRef("u1", "Ada");
    }
}
