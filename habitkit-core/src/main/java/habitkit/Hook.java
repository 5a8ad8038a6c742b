package habitkit;

/**
 * Callback bound to one lifecycle event kind.
 *
 * <p>Hooks run on the dispatcher's worker pool, concurrently with the hooks of other
 * extensions. Anything a hook throws is caught by the dispatcher, logged and treated as
 * {@link HookResult#NO_UPDATE}. A hook that overruns the dispatcher's deadline is
 * interrupted.
 *
 * @param <E> the event type this hook handles
 */
@FunctionalInterface
public interface Hook<E extends LifecycleEvent> {

  /**
   * Handles a committed lifecycle event.
   *
   * @param event the event, carrying the habit with its latest stored integrations
   * @return the update to apply, {@link HookResult#NO_UPDATE} or {@code null} for none
   * @throws Exception on failure; the dispatcher isolates it
   */
  HookResult handle(E event) throws Exception;
}
