package habitkit.demo.extensions;

import habitkit.CompletionEntry;
import habitkit.EndpointRequest;
import habitkit.HabitSnapshot;
import habitkit.LifecycleEvent;
import habitkit.UserRef;
import habitkit.demo.HabitRepository;
import habitkit.dispatch.DispatchOutcome;
import habitkit.dispatch.EventDispatcher;
import habitkit.registry.DefaultExtensionRegistry;
import habitkit.registry.ExtensionRegistry;
import habitkit.store.InMemoryIntegrationStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreakTrackerExtensionTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T09:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    private HabitRepository habits;
    private InMemoryIntegrationStore store;
    private EventDispatcher dispatcher;
    private HabitSnapshot habit;

    @BeforeEach
    void setUp() {
        habits = new HabitRepository();
        store = new InMemoryIntegrationStore();
        ExtensionRegistry registry = new DefaultExtensionRegistry();
        registry.register(new StreakTrackerExtension(habits, store, CLOCK).descriptor());
        registry.register(new MoodTrackerExtension(store, () -> 7, CLOCK).descriptor());
        dispatcher = EventDispatcher.builder()
                .registry(registry)
                .store(store)
                .build();
        habit = habits.save(HabitSnapshot.builder("h-1", "simple").userId("u-1").name("Read").build());
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    void createdSeedsBothNamespaces() {
        DispatchOutcome outcome = dispatcher.dispatch(LifecycleEvent.created(habit, UserRef.of("u-1")));

        Map<String, Object> streak = outcome.integration(StreakTrackerExtension.NAME);
        assertEquals(Map.of("currentStreak", 0, "bestStreak", 0, "totalCompletions", 0),
                withoutNulls(streak.get("streakData")));
        assertEquals(List.of(), streak.get("milestones"));
        assertEquals("2024-03-15T09:00:00Z", streak.get("createdAt"));

        Map<String, Object> mood = outcome.integration(MoodTrackerExtension.NAME);
        assertEquals(0, mood.get("totalEntries"));
    }

    @Test
    void thirdConsecutiveDayUnlocksMilestone() {
        dispatcher.dispatch(LifecycleEvent.created(habit, UserRef.of("u-1")));
        DispatchOutcome outcome = null;
        for (int daysAgo = 2; daysAgo >= 0; daysAgo--) {
            CompletionEntry entry = CompletionEntry.completed(TODAY.minusDays(daysAgo));
            habits.recordEntry(habit.id(), entry);
            outcome = dispatcher.dispatch(LifecycleEvent.completed(habit, entry, UserRef.of("u-1")));
        }

        Map<String, Object> streak = outcome.integration(StreakTrackerExtension.NAME);
        @SuppressWarnings("unchecked")
        Map<String, Object> streakData = (Map<String, Object>) streak.get("streakData");
        assertEquals(3, ((Number) streakData.get("currentStreak")).intValue());
        assertEquals("2024-03-15", streakData.get("lastCompletedDate"));

        List<?> milestones = (List<?>) streak.get("milestones");
        assertEquals(1, milestones.size());
        assertEquals("Getting Started", ((Map<?, ?>) milestones.get(0)).get("title"));

        Map<String, Object> mood = outcome.integration(MoodTrackerExtension.NAME);
        assertEquals(3, mood.get("totalEntries"));
        assertEquals(7.0, ((Number) mood.get("averageMood")).doubleValue());
        assertTrue(outcome.failedExtensions().isEmpty());
    }

    @Test
    void streakAchievedRecordsLastMilestone() {
        DispatchOutcome outcome = dispatcher.dispatch(LifecycleEvent.streakAchieved(habit, UserRef.of("u-1"), 7, 7));

        Map<?, ?> lastMilestone = (Map<?, ?>) outcome.integration(StreakTrackerExtension.NAME).get("lastMilestone");
        assertEquals(7, ((Number) lastMilestone.get("streak")).intValue());
    }

    @Test
    void leaderboardSortsByCurrentStreak() throws Exception {
        HabitSnapshot other = habits.save(HabitSnapshot.builder("h-2", "simple").userId("u-1").name("Run").build());
        dispatcher.dispatch(LifecycleEvent.created(habit, UserRef.of("u-1")));
        dispatcher.dispatch(LifecycleEvent.created(other, UserRef.of("u-1")));
        CompletionEntry today = CompletionEntry.completed(TODAY);
        habits.recordEntry(other.id(), today);
        dispatcher.dispatch(LifecycleEvent.completed(other, today, UserRef.of("u-1")));

        StreakTrackerExtension extension = new StreakTrackerExtension(habits, store, CLOCK);
        List<?> board = (List<?>) extension.getStreakLeaderboard(
                new EndpointRequest(null, "u-1", Map.of()));

        assertEquals(2, board.size());
        assertEquals("h-2", ((Map<?, ?>) board.get(0)).get("habitId"));
        assertEquals(1, ((Map<?, ?>) board.get(0)).get("currentStreak"));
    }

    private static Map<?, ?> withoutNulls(Object map) {
        Map<?, ?> source = (Map<?, ?>) map;
        Map<Object, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, value);
            }
        });
        return copy;
    }
}
