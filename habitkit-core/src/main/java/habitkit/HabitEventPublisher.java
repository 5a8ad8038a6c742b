package habitkit;

import habitkit.dispatch.DispatchOutcome;
import habitkit.dispatch.EventDispatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for the service that owns habits. Call the matching method after the
 * habit mutation has committed.
 *
 * <pre>{@code
 * Habit saved = repository.save(habit);
 * publisher.habitCreated(toSnapshot(saved), UserRef.of(userId))
 *     .ifPresent(outcome -> saved.setIntegrations(outcome.integrations()));
 * }</pre>
 *
 * <p>None of these methods throw because of an extension: if the dispatch itself fails
 * unexpectedly the failure is logged and an empty result is returned, so the owning
 * operation's outcome depends only on its own mutation.
 */
public final class HabitEventPublisher {
  private static final Logger logger = Logger.getLogger(HabitEventPublisher.class.getName());

  private final EventDispatcher dispatcher;

  public HabitEventPublisher(EventDispatcher dispatcher) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
  }

  public Optional<DispatchOutcome> habitCreated(HabitSnapshot habit, UserRef user) {
    return publish(LifecycleEvent.created(habit, user));
  }

  public Optional<DispatchOutcome> habitCompleted(HabitSnapshot habit, CompletionEntry entry, UserRef user) {
    return publish(LifecycleEvent.completed(habit, entry, user));
  }

  public Optional<DispatchOutcome> habitUpdated(HabitSnapshot habit, HabitSnapshot previous, UserRef user) {
    return publish(LifecycleEvent.updated(habit, previous, user));
  }

  public Optional<DispatchOutcome> habitDeleted(HabitSnapshot habit, UserRef user) {
    return publish(LifecycleEvent.deleted(habit, user));
  }

  public Optional<DispatchOutcome> progressUpdated(HabitSnapshot habit, CompletionEntry entry, UserRef user) {
    return publish(LifecycleEvent.progressUpdated(habit, entry, user));
  }

  public Optional<DispatchOutcome> streakAchieved(HabitSnapshot habit, UserRef user, int currentStreak, int bestStreak) {
    return publish(LifecycleEvent.streakAchieved(habit, user, currentStreak, bestStreak));
  }

  /**
   * Publishes events in order. Events whose dispatch failed are left out of the result.
   */
  public List<DispatchOutcome> publishAll(List<? extends LifecycleEvent> events) {
    List<DispatchOutcome> outcomes = new ArrayList<>(events.size());
    for (LifecycleEvent event : events) {
      publish(event).ifPresent(outcomes::add);
    }
    return outcomes;
  }

  public Optional<DispatchOutcome> publish(LifecycleEvent event) {
    try {
      return Optional.of(dispatcher.dispatch(event));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to dispatch " + event.kind().hookName()
          + " for habit " + event.habit().id(), e);
      return Optional.empty();
    }
  }
}
