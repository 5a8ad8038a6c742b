/**
 * Lifecycle event dispatch: concurrent hook invocation with per-hook deadlines,
 * per-habit serialization and atomic application of merged writes.
 *
 * @see habitkit.dispatch.EventDispatcher
 * @see habitkit.dispatch.DispatchInterceptor
 */
package habitkit.dispatch;
