package habitkit;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LifecycleEventTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 1);

    @Test
    void factoriesAssignUlidIdsAndKinds() {
        HabitSnapshot habit = TestHabits.habit("h1", "simple");
        LifecycleEvent a = LifecycleEvent.created(habit, TestHabits.user());
        LifecycleEvent b = LifecycleEvent.deleted(habit, null);

        assertEquals(26, a.eventId().length());
        assertNotEquals(a.eventId(), b.eventId());
        assertEquals(EventKind.CREATED, a.kind());
        assertEquals(EventKind.DELETED, b.kind());
    }

    @Test
    void withHabitKeepsIdentity() {
        LifecycleEvent.Completed event = LifecycleEvent.completed(
                TestHabits.habit("h1", "simple"), CompletionEntry.completed(DAY), TestHabits.user());
        HabitSnapshot refreshed = event.habit().withIntegrations(Map.of("x", Map.of("n", 1)));

        LifecycleEvent.Completed copy = event.withHabit(refreshed);

        assertEquals(event.eventId(), copy.eventId());
        assertSame(event.entry(), copy.entry());
        assertEquals(1, copy.habit().integration("x").get("n"));
    }

    @Test
    void changedFieldsCoversCoreFieldsThenAttributes() {
        HabitSnapshot before = HabitSnapshot.builder("h1", "simple").name("Read")
                .attribute("color", "blue").attribute("icon", "book").build();
        HabitSnapshot after = HabitSnapshot.builder("h1", "count").name("Read more").targetValue(10.0)
                .attribute("color", "green").attribute("icon", "book").attribute("archived", false).build();

        LifecycleEvent.Updated event = LifecycleEvent.updated(after, before, null);

        assertEquals(List.of("name", "type", "targetValue", "archived", "color"), event.changedFields());
    }

    @Test
    void progressPercentage() {
        HabitSnapshot simple = TestHabits.habit("h1", "simple");
        assertEquals(100.0, LifecycleEvent.progressUpdated(simple,
                CompletionEntry.completed(DAY), null).progressPercentage());

        HabitSnapshot count = HabitSnapshot.builder("h2", "count").targetValue(8.0).build();
        assertEquals(50.0, LifecycleEvent.progressUpdated(count,
                CompletionEntry.progress(DAY, 4, false), null).progressPercentage());
        assertEquals(100.0, LifecycleEvent.progressUpdated(count,
                CompletionEntry.progress(DAY, 12, true), null).progressPercentage());

        HabitSnapshot noTarget = HabitSnapshot.builder("h3", "time").build();
        assertEquals(0.0, LifecycleEvent.progressUpdated(noTarget,
                CompletionEntry.progress(DAY, 4, false), null).progressPercentage());
    }

    @Test
    void streakMilestones() {
        HabitSnapshot habit = TestHabits.habit("h1", "simple");
        assertEquals("start", LifecycleEvent.streakAchieved(habit, null, 2, 5).milestone());
        assertEquals("milestone", LifecycleEvent.streakAchieved(habit, null, 3, 5).milestone());
        assertEquals("week", LifecycleEvent.streakAchieved(habit, null, 7, 5).milestone());
        assertEquals("month", LifecycleEvent.streakAchieved(habit, null, 30, 5).milestone());
        assertEquals("century", LifecycleEvent.streakAchieved(habit, null, 100, 5).milestone());
        assertEquals("year", LifecycleEvent.streakAchieved(habit, null, 400, 5).milestone());

        assertTrue(LifecycleEvent.streakAchieved(habit, null, 6, 5).personalBest());
        assertFalse(LifecycleEvent.streakAchieved(habit, null, 5, 5).personalBest());
    }

    @Test
    void snapshotRejectsMissingIdentity() {
        assertThrows(NullPointerException.class, () -> HabitSnapshot.builder(null, "simple").build());
        assertThrows(IllegalArgumentException.class, () -> HabitSnapshot.builder("", "simple").build());
    }

    @Test
    void hookNamesRoundTrip() {
        for (EventKind kind : EventKind.values()) {
            assertSame(kind, EventKind.fromHookName(kind.hookName()));
        }
        assertThrows(IllegalArgumentException.class, () -> EventKind.fromHookName("onHabitArchived"));
    }
}
