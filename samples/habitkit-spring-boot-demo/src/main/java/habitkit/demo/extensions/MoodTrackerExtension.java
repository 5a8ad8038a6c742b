package habitkit.demo.extensions;

import habitkit.DataManager;
import habitkit.EndpointRequest;
import habitkit.ExtensionBuilder;
import habitkit.ExtensionDescriptor;
import habitkit.ExtensionProvider;
import habitkit.HealthStatus;
import habitkit.HookResult;
import habitkit.LifecycleEvent;
import habitkit.spi.IntegrationStore;
import habitkit.spring.boot.HabitExtension;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntSupplier;

/**
 * Records a mood rating with every completion. Built with {@link ExtensionBuilder} and
 * a {@link DataManager}, so hook bodies never spell out integration paths.
 */
@Component
@HabitExtension
@Order(2)
public class MoodTrackerExtension implements ExtensionProvider {

    public static final String NAME = "moodTracker";
    static final int HISTORY_SIZE = 30;
    static final int SCALE = 10;

    private final IntegrationStore store;
    private final IntSupplier moodSource;
    private final Clock clock;

    @Autowired
    public MoodTrackerExtension(IntegrationStore store) {
        this(store, () -> ThreadLocalRandom.current().nextInt(1, SCALE + 1), Clock.systemUTC());
    }

    MoodTrackerExtension(IntegrationStore store, IntSupplier moodSource, Clock clock) {
        this.store = store;
        this.moodSource = moodSource;
        this.clock = clock;
    }

    @Override
    public ExtensionDescriptor descriptor() {
        ExtensionBuilder builder = ExtensionBuilder.named(NAME).clock(clock);
        DataManager data = builder.dataManager();
        return builder
                .setMetadata(Map.of(
                        "version", "1.0.0",
                        "description", "Track mood levels when completing habits",
                        "author", "Habits Team"))
                .withConfig(Map.of("moodScale", SCALE))
                .onCreated(event -> data.createInitialData(Map.of(
                        "moodHistory", List.of(),
                        "averageMood", 0,
                        "totalEntries", 0)))
                .onCompleted(event -> recordMood(data, event))
                .addEndpoint("getMoodData", request -> moodData(request.habitId()))
                .addEndpoint("getMoodStats", this::moodStats)
                .withHealthCheck(() -> HealthStatus.healthy(Map.of("moodScale", SCALE)))
                .build();
    }

    private HookResult recordMood(DataManager data, LifecycleEvent.Completed event) {
        Map<String, Object> current = data.getData(event.habit());
        List<Object> history = new ArrayList<>();
        if (current.get("moodHistory") instanceof List<?> previous) {
            history.addAll(previous);
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("date", event.entry().date().toString());
        entry.put("mood", moodSource.getAsInt());
        entry.put("timestamp", clock.instant().toString());
        history.add(entry);
        while (history.size() > HISTORY_SIZE) {
            history.remove(0);
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("moodHistory", history);
        changes.put("averageMood", average(history));
        changes.put("totalEntries", history.size());
        changes.put("lastMoodEntry", entry);
        return data.replaceData(current, changes);
    }

    private Map<String, Object> moodData(String habitId) {
        Map<String, Object> namespace = store.load(habitId).get(NAME);
        return namespace == null ? Map.of() : namespace;
    }

    private Object moodStats(EndpointRequest request) {
        Map<String, Object> namespace = moodData(request.habitId());
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("averageMood", namespace.getOrDefault("averageMood", 0));
        stats.put("totalEntries", namespace.getOrDefault("totalEntries", 0));
        stats.put("moodScale", SCALE);
        return stats;
    }

    static double average(List<?> history) {
        if (history.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (Object item : history) {
            if (item instanceof Map<?, ?> entry && entry.get("mood") instanceof Number mood) {
                sum += mood.doubleValue();
            }
        }
        return Math.round(sum / history.size() * 10) / 10.0;
    }
}
