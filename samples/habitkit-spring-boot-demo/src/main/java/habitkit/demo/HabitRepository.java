package habitkit.demo;

import habitkit.CompletionEntry;
import habitkit.HabitSnapshot;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory habits and their daily entries. Integration state is not kept here; it
 * lives in the {@link habitkit.spi.IntegrationStore}.
 */
@Repository
public class HabitRepository {

    private final Map<String, HabitSnapshot> habits = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<LocalDate, CompletionEntry>> entries = new ConcurrentHashMap<>();

    public HabitSnapshot save(HabitSnapshot habit) {
        habits.put(habit.id(), habit.withIntegrations(Map.of()));
        return habit;
    }

    public Optional<HabitSnapshot> find(String habitId) {
        return Optional.ofNullable(habits.get(habitId));
    }

    public Optional<HabitSnapshot> delete(String habitId) {
        entries.remove(habitId);
        return Optional.ofNullable(habits.remove(habitId));
    }

    public List<HabitSnapshot> findByUser(String userId) {
        List<HabitSnapshot> result = new ArrayList<>();
        for (HabitSnapshot habit : habits.values()) {
            if (userId.equals(habit.userId())) {
                result.add(habit);
            }
        }
        return result;
    }

    /** Records the entry for its day, replacing an earlier one. */
    public void recordEntry(String habitId, CompletionEntry entry) {
        entries.computeIfAbsent(habitId, id -> new ConcurrentSkipListMap<>()).put(entry.date(), entry);
    }

    /** Entries up to and including {@code upTo}, oldest first. */
    public List<CompletionEntry> entries(String habitId, LocalDate upTo) {
        NavigableMap<LocalDate, CompletionEntry> byDate = entries.get(habitId);
        if (byDate == null) {
            return List.of();
        }
        return new ArrayList<>(byDate.headMap(upTo, true).values());
    }
}
