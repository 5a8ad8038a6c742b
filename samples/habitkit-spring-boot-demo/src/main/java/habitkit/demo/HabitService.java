package habitkit.demo;

import habitkit.CompletionEntry;
import habitkit.HabitEventPublisher;
import habitkit.HabitSnapshot;
import habitkit.UserRef;
import habitkit.demo.extensions.StreakCalculator;
import habitkit.dispatch.DispatchOutcome;
import habitkit.spi.IntegrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns habit mutations. Every mutation is saved first and announced to the extensions
 * afterwards, so an extension failure never undoes it.
 */
@Service
public class HabitService {
    private static final Logger log = LoggerFactory.getLogger(HabitService.class);

    private final HabitRepository repository;
    private final HabitEventPublisher publisher;
    private final IntegrationStore store;
    private final Clock clock;

    @Autowired
    public HabitService(HabitRepository repository, HabitEventPublisher publisher, IntegrationStore store) {
        this(repository, publisher, store, Clock.systemDefaultZone());
    }

    HabitService(HabitRepository repository, HabitEventPublisher publisher, IntegrationStore store, Clock clock) {
        this.repository = repository;
        this.publisher = publisher;
        this.store = store;
        this.clock = clock;
    }

    public record Completion(HabitSnapshot habit, int currentStreak, int bestStreak, List<String> failedExtensions) {
    }

    public HabitSnapshot create(String userId, String name, String type, Double targetValue) {
        HabitSnapshot habit = HabitSnapshot.builder(UUID.randomUUID().toString(), type == null ? "simple" : type)
                .userId(userId)
                .name(name)
                .targetValue(targetValue)
                .build();
        repository.save(habit);
        log.info("Created habit {} ({}) for user {}", habit.id(), habit.type(), userId);
        return publisher.habitCreated(habit, user(userId))
                .map(outcome -> habit.withIntegrations(outcome.integrations()))
                .orElse(habit);
    }

    /**
     * Records today's (or the given day's) entry and publishes the completion, a progress
     * update when a value was tracked, and a streak achievement on milestone days.
     */
    public Completion complete(String habitId, LocalDate date, Double currentValue, String userId) {
        HabitSnapshot habit = require(habitId);
        LocalDate day = date == null ? LocalDate.now(clock) : date;
        CompletionEntry entry = currentValue == null
                ? CompletionEntry.completed(day)
                : CompletionEntry.progress(day, currentValue, isComplete(habit, currentValue));
        repository.recordEntry(habitId, entry);

        LocalDate today = LocalDate.now(clock);
        StreakCalculator.Streak streak = StreakCalculator.calculate(repository.entries(habitId, today), today);
        UserRef user = user(userId == null ? habit.userId() : userId);

        List<String> failed = new ArrayList<>();
        Optional<DispatchOutcome> last = publisher.habitCompleted(habit, entry, user);
        last.ifPresent(outcome -> failed.addAll(outcome.failedExtensions()));
        if (currentValue != null) {
            Optional<DispatchOutcome> progress = publisher.progressUpdated(habit, entry, user);
            progress.ifPresent(outcome -> failed.addAll(outcome.failedExtensions()));
            last = progress.isPresent() ? progress : last;
        }
        if (StreakCalculator.achievementFor(streak.currentStreak()).isPresent()) {
            Optional<DispatchOutcome> achieved =
                    publisher.streakAchieved(habit, user, streak.currentStreak(), streak.bestStreak());
            achieved.ifPresent(outcome -> failed.addAll(outcome.failedExtensions()));
            last = achieved.isPresent() ? achieved : last;
        }

        HabitSnapshot result = last
                .map(outcome -> habit.withIntegrations(outcome.integrations()))
                .orElseGet(() -> habit.withIntegrations(store.load(habitId)));
        return new Completion(result, streak.currentStreak(), streak.bestStreak(), failed);
    }

    public HabitSnapshot update(String habitId, String name, Double targetValue, String userId) {
        HabitSnapshot previous = require(habitId);
        HabitSnapshot.Builder builder = HabitSnapshot.builder(previous.id(), previous.type())
                .userId(previous.userId())
                .name(name == null ? previous.name() : name)
                .targetValue(targetValue == null ? previous.targetValue() : targetValue);
        previous.attributes().forEach(builder::attribute);
        HabitSnapshot updated = builder.build();
        repository.save(updated);
        return publisher.habitUpdated(updated, previous, userId == null ? null : user(userId))
                .map(outcome -> updated.withIntegrations(outcome.integrations()))
                .orElse(updated);
    }

    public void delete(String habitId, String userId) {
        HabitSnapshot habit = repository.delete(habitId)
                .orElseThrow(() -> new NoSuchElementException("Habit not found: " + habitId));
        publisher.habitDeleted(habit, userId == null ? null : user(userId));
        log.info("Deleted habit {}", habitId);
    }

    /** The habit with its stored integrations. */
    public HabitSnapshot get(String habitId) {
        return require(habitId).withIntegrations(store.load(habitId));
    }

    private HabitSnapshot require(String habitId) {
        return repository.find(habitId)
                .orElseThrow(() -> new NoSuchElementException("Habit not found: " + habitId));
    }

    private static boolean isComplete(HabitSnapshot habit, double currentValue) {
        Double target = habit.targetValue();
        return target == null || target <= 0 || currentValue >= target;
    }

    private static UserRef user(String userId) {
        return userId == null ? null : UserRef.of(userId);
    }
}
