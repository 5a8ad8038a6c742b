package habitkit.demo.extensions;

import habitkit.CompletionEntry;
import habitkit.DataManager;
import habitkit.EndpointRequest;
import habitkit.ExtensionBuilder;
import habitkit.ExtensionDescriptor;
import habitkit.ExtensionProvider;
import habitkit.HabitSnapshot;
import habitkit.HealthStatus;
import habitkit.HookResult;
import habitkit.LifecycleEvent;
import habitkit.demo.HabitRepository;
import habitkit.demo.extensions.StreakCalculator.Achievement;
import habitkit.demo.extensions.StreakCalculator.Streak;
import habitkit.spi.IntegrationStore;
import habitkit.spring.boot.HabitExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps current and best streaks for every habit and records milestone achievements
 * under {@code integrations.streakTracker}.
 */
@Component
@HabitExtension
@Order(1)
public class StreakTrackerExtension implements ExtensionProvider {
    private static final Logger log = LoggerFactory.getLogger(StreakTrackerExtension.class);

    public static final String NAME = "streakTracker";
    static final int MAX_STREAK_HISTORY = 365;

    private final HabitRepository habits;
    private final IntegrationStore store;
    private final Clock clock;
    private final DataManager data;

    @Autowired
    public StreakTrackerExtension(HabitRepository habits, IntegrationStore store) {
        this(habits, store, Clock.systemDefaultZone());
    }

    StreakTrackerExtension(HabitRepository habits, IntegrationStore store, Clock clock) {
        this.habits = habits;
        this.store = store;
        this.clock = clock;
        this.data = new DataManager(NAME, clock);
    }

    @Override
    public ExtensionDescriptor descriptor() {
        return ExtensionBuilder.named(NAME)
                .version("1.0.0")
                .description("Advanced streak tracking and analytics")
                .setMetadata(Map.of("author", "Habits Team"))
                .withConfig(Map.of(
                        "trackAllHabits", true,
                        "celebrateMilestones", true,
                        "maxStreakHistory", MAX_STREAK_HISTORY))
                .clock(clock)
                .onCreated(this::onCreated)
                .onCompleted(this::onCompleted)
                .onStreakAchieved(this::onStreakAchieved)
                .addEndpoint("getStreakData", this::getStreakData)
                .addEndpoint("getStreakLeaderboard", this::getStreakLeaderboard)
                .withHealthCheck(() -> HealthStatus.healthy(Map.of("maxStreakHistory", MAX_STREAK_HISTORY)))
                .build();
    }

    HookResult onCreated(LifecycleEvent.Created event) {
        Map<String, Object> streakData = new LinkedHashMap<>();
        streakData.put("currentStreak", 0);
        streakData.put("bestStreak", 0);
        streakData.put("totalCompletions", 0);
        streakData.put("lastCompletedDate", null);
        return data.createInitialData(Map.of(
                "streakData", streakData,
                "milestones", List.of()));
    }

    HookResult onCompleted(LifecycleEvent.Completed event) {
        HabitSnapshot habit = event.habit();
        LocalDate today = LocalDate.now(clock);
        Streak streak = StreakCalculator.calculate(habits.entries(habit.id(), today), today);

        Map<String, Object> streakData = new LinkedHashMap<>();
        streakData.put("currentStreak", streak.currentStreak());
        streakData.put("bestStreak", streak.bestStreak());
        streakData.put("totalCompletions", streak.totalCompletions());
        streakData.put("lastCompletedDate", lastCompletedDate(event.entry()));

        DataManager.PatchBuilder patch = data.patch()
                .set("streakData", streakData)
                .touch();
        StreakCalculator.achievementFor(streak.currentStreak()).ifPresent(achievement ->
                patch.set("milestones", appendMilestone(data.getData(habit), achievement, today)));
        return patch.build();
    }

    HookResult onStreakAchieved(LifecycleEvent.StreakAchieved event) {
        log.info("Habit {} reached a {} day streak", event.habit().id(), event.currentStreak());
        return data.patch()
                .set("lastMilestone", Map.of(
                        "streak", event.currentStreak(),
                        "reachedAt", event.occurredAt().toString()))
                .build();
    }

    Object getStreakData(EndpointRequest request) {
        Map<String, Object> namespace = store.load(request.habitId()).get(NAME);
        if (namespace == null) {
            return Map.of();
        }
        Object streakData = namespace.get("streakData");
        return streakData == null ? Map.of() : streakData;
    }

    Object getStreakLeaderboard(EndpointRequest request) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (HabitSnapshot habit : habits.findByUser(request.userId())) {
            Map<String, Object> namespace = store.load(habit.id()).get(NAME);
            if (namespace == null || !(namespace.get("streakData") instanceof Map<?, ?> streakData)) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("habitId", habit.id());
            row.put("habitName", habit.name());
            row.put("currentStreak", intValue(streakData.get("currentStreak")));
            row.put("bestStreak", intValue(streakData.get("bestStreak")));
            rows.add(row);
        }
        rows.sort(Comparator.comparingInt((Map<String, Object> row) -> (Integer) row.get("currentStreak")).reversed());
        return rows;
    }

    private static String lastCompletedDate(CompletionEntry entry) {
        return entry.completed() ? entry.date().toString() : null;
    }

    private static List<Object> appendMilestone(Map<String, Object> current, Achievement achievement, LocalDate day) {
        List<Object> milestones = new ArrayList<>();
        if (current.get("milestones") instanceof List<?> previous) {
            milestones.addAll(previous);
        }
        milestones.add(Map.of(
                "streak", achievement.days(),
                "title", achievement.title(),
                "message", achievement.message(),
                "achievedAt", day.toString()));
        while (milestones.size() > MAX_STREAK_HISTORY) {
            milestones.remove(0);
        }
        return milestones;
    }

    private static int intValue(Object value) {
        return value instanceof Number number ? number.intValue() : 0;
    }
}
