/**
 * Extension contract for habit lifecycle events.
 *
 * <p>An extension is an {@link habitkit.ExtensionDescriptor}: a name, the habit types it
 * handles, one {@link habitkit.Hook} per {@link habitkit.EventKind} it observes, optional
 * {@link habitkit.Endpoint}s and a {@link habitkit.HealthCheck}. Hooks return a
 * {@link habitkit.HookResult} describing writes to the extension's own namespace under
 * the habit's {@code integrations}.
 *
 * @see habitkit.ExtensionBuilder
 * @see habitkit.HabitEventPublisher
 */
package habitkit;
