package habitkit;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A habit lifecycle event, emitted by the owning service after its mutation commits.
 *
 * <p>Each variant is an immutable record carrying the committed {@link HabitSnapshot}
 * plus event-specific extras. Every event gets a ULID {@code eventId} and an
 * {@code occurredAt} timestamp when created through the static factories.
 *
 * <pre>{@code
 * dispatcher.dispatch(LifecycleEvent.completed(habit, CompletionEntry.completed(today), user));
 * }</pre>
 *
 * @see EventKind
 * @see habitkit.dispatch.EventDispatcher
 */
public sealed interface LifecycleEvent permits
    LifecycleEvent.Created,
    LifecycleEvent.Completed,
    LifecycleEvent.Updated,
    LifecycleEvent.Deleted,
    LifecycleEvent.ProgressUpdated,
    LifecycleEvent.StreakAchieved {

  String eventId();

  Instant occurredAt();

  HabitSnapshot habit();

  /** The acting user; may be {@code null} for updates and deletions. */
  UserRef user();

  EventKind kind();

  /**
   * Returns a copy of this event carrying a different habit snapshot. The dispatcher
   * uses this to hand hooks the latest stored integration state.
   */
  LifecycleEvent withHabit(HabitSnapshot habit);

  static Created created(HabitSnapshot habit, UserRef user) {
    return new Created(newEventId(), Instant.now(), habit, user);
  }

  static Completed completed(HabitSnapshot habit, CompletionEntry entry, UserRef user) {
    return new Completed(newEventId(), Instant.now(), habit, entry, user);
  }

  static Updated updated(HabitSnapshot habit, HabitSnapshot previous, UserRef user) {
    return new Updated(newEventId(), Instant.now(), habit, previous, user);
  }

  static Deleted deleted(HabitSnapshot habit, UserRef user) {
    return new Deleted(newEventId(), Instant.now(), habit, user);
  }

  static ProgressUpdated progressUpdated(HabitSnapshot habit, CompletionEntry entry, UserRef user) {
    return new ProgressUpdated(newEventId(), Instant.now(), habit, entry, user);
  }

  static StreakAchieved streakAchieved(HabitSnapshot habit, UserRef user, int currentStreak, int bestStreak) {
    return new StreakAchieved(newEventId(), Instant.now(), habit, user, currentStreak, bestStreak);
  }

  private static String newEventId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  record Created(String eventId, Instant occurredAt, HabitSnapshot habit, UserRef user)
      implements LifecycleEvent {

    public Created {
      Objects.requireNonNull(eventId, "eventId");
      Objects.requireNonNull(occurredAt, "occurredAt");
      Objects.requireNonNull(habit, "habit");
    }

    @Override
    public EventKind kind() {
      return EventKind.CREATED;
    }

    @Override
    public Created withHabit(HabitSnapshot habit) {
      return new Created(eventId, occurredAt, habit, user);
    }
  }

  record Completed(String eventId, Instant occurredAt, HabitSnapshot habit, CompletionEntry entry, UserRef user)
      implements LifecycleEvent {

    public Completed {
      Objects.requireNonNull(eventId, "eventId");
      Objects.requireNonNull(occurredAt, "occurredAt");
      Objects.requireNonNull(habit, "habit");
      Objects.requireNonNull(entry, "entry");
    }

    @Override
    public EventKind kind() {
      return EventKind.COMPLETED;
    }

    @Override
    public Completed withHabit(HabitSnapshot habit) {
      return new Completed(eventId, occurredAt, habit, entry, user);
    }
  }

  record Updated(String eventId, Instant occurredAt, HabitSnapshot habit, HabitSnapshot previous, UserRef user)
      implements LifecycleEvent {

    public Updated {
      Objects.requireNonNull(eventId, "eventId");
      Objects.requireNonNull(occurredAt, "occurredAt");
      Objects.requireNonNull(habit, "habit");
      Objects.requireNonNull(previous, "previous");
    }

    @Override
    public EventKind kind() {
      return EventKind.UPDATED;
    }

    @Override
    public Updated withHabit(HabitSnapshot habit) {
      return new Updated(eventId, occurredAt, habit, previous, user);
    }

    /**
     * Names of the fields that differ between {@code previous} and {@code habit}:
     * {@code name}, {@code type}, {@code targetValue}, then changed attribute keys in
     * alphabetical order. Integration state is not compared.
     */
    public List<String> changedFields() {
      List<String> changes = new ArrayList<>();
      if (!Objects.equals(previous.name(), habit.name())) {
        changes.add("name");
      }
      if (!Objects.equals(previous.type(), habit.type())) {
        changes.add("type");
      }
      if (!Objects.equals(previous.targetValue(), habit.targetValue())) {
        changes.add("targetValue");
      }
      TreeSet<String> keys = new TreeSet<>(previous.attributes().keySet());
      keys.addAll(habit.attributes().keySet());
      for (String key : keys) {
        if (!Objects.equals(previous.attributes().get(key), habit.attributes().get(key))) {
          changes.add(key);
        }
      }
      return Collections.unmodifiableList(changes);
    }
  }

  record Deleted(String eventId, Instant occurredAt, HabitSnapshot habit, UserRef user)
      implements LifecycleEvent {

    public Deleted {
      Objects.requireNonNull(eventId, "eventId");
      Objects.requireNonNull(occurredAt, "occurredAt");
      Objects.requireNonNull(habit, "habit");
    }

    @Override
    public EventKind kind() {
      return EventKind.DELETED;
    }

    @Override
    public Deleted withHabit(HabitSnapshot habit) {
      return new Deleted(eventId, occurredAt, habit, user);
    }
  }

  record ProgressUpdated(String eventId, Instant occurredAt, HabitSnapshot habit, CompletionEntry entry, UserRef user)
      implements LifecycleEvent {

    public ProgressUpdated {
      Objects.requireNonNull(eventId, "eventId");
      Objects.requireNonNull(occurredAt, "occurredAt");
      Objects.requireNonNull(habit, "habit");
      Objects.requireNonNull(entry, "entry");
    }

    @Override
    public EventKind kind() {
      return EventKind.PROGRESS_UPDATED;
    }

    @Override
    public ProgressUpdated withHabit(HabitSnapshot habit) {
      return new ProgressUpdated(eventId, occurredAt, habit, entry, user);
    }

    /**
     * Progress towards the habit's target in percent, capped at 100. Simple habits and
     * habits without a positive target are either 0 or 100.
     */
    public double progressPercentage() {
      if ("simple".equals(habit.type())) {
        return entry.completed() ? 100.0 : 0.0;
      }
      Double target = habit.targetValue();
      if (target != null && target > 0) {
        double value = entry.currentValue() == null ? 0.0 : entry.currentValue();
        return Math.min(100.0, value / target * 100.0);
      }
      return entry.completed() ? 100.0 : 0.0;
    }

    public boolean isComplete() {
      return entry.completed();
    }
  }

  record StreakAchieved(String eventId, Instant occurredAt, HabitSnapshot habit, UserRef user,
                        int currentStreak, int bestStreak)
      implements LifecycleEvent {

    public StreakAchieved {
      Objects.requireNonNull(eventId, "eventId");
      Objects.requireNonNull(occurredAt, "occurredAt");
      Objects.requireNonNull(habit, "habit");
      if (currentStreak < 0 || bestStreak < 0) {
        throw new IllegalArgumentException("streak lengths must be >= 0");
      }
    }

    @Override
    public EventKind kind() {
      return EventKind.STREAK_ACHIEVED;
    }

    @Override
    public StreakAchieved withHabit(HabitSnapshot habit) {
      return new StreakAchieved(eventId, occurredAt, habit, user, currentStreak, bestStreak);
    }

    /** Milestone bucket of {@code currentStreak}: start, milestone, week, month, century or year. */
    public String milestone() {
      if (currentStreak >= 365) return "year";
      if (currentStreak >= 100) return "century";
      if (currentStreak >= 30) return "month";
      if (currentStreak >= 7) return "week";
      if (currentStreak >= 3) return "milestone";
      return "start";
    }

    public boolean personalBest() {
      return currentStreak > bestStreak;
    }
  }
}
