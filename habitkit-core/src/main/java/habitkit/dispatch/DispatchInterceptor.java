package habitkit.dispatch;

import habitkit.LifecycleEvent;

/**
 * Cross-cutting hook for observing dispatches.
 *
 * <p>Interceptors run around each dispatch, inside the per-habit lock:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>hook fan-out, merge and apply</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>Exceptions thrown by interceptors are logged and ignored; they never change the
 * dispatch outcome.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventDispatcher.builder()
 *     .registry(registry)
 *     .interceptor(DispatchInterceptor.after((event, outcome, error) -> {
 *         if (outcome != null && !outcome.failedExtensions().isEmpty()) {
 *             alerts.notify(event.habit().id(), outcome.failedExtensions());
 *         }
 *     }))
 *     .build();
 * }</pre>
 */
public interface DispatchInterceptor {

  /**
   * Called before any hook runs.
   *
   * @param event the event, with integrations already refreshed from the store
   */
  default void beforeDispatch(LifecycleEvent event) throws Exception {
  }

  /**
   * Called after the dispatch finished.
   *
   * @param event   the dispatched event
   * @param outcome the outcome, {@code null} if the dispatch failed unexpectedly
   * @param error   the unexpected failure, {@code null} otherwise
   */
  default void afterDispatch(LifecycleEvent event, DispatchOutcome outcome, Exception error) {
  }

  /**
   * Creates an interceptor with only a beforeDispatch hook.
   */
  static DispatchInterceptor before(BeforeHook hook) {
    return new DispatchInterceptor() {
      @Override
      public void beforeDispatch(LifecycleEvent event) throws Exception {
        hook.accept(event);
      }
    };
  }

  /**
   * Creates an interceptor with only an afterDispatch hook.
   */
  static DispatchInterceptor after(AfterHook hook) {
    return new DispatchInterceptor() {
      @Override
      public void afterDispatch(LifecycleEvent event, DispatchOutcome outcome, Exception error) {
        hook.accept(event, outcome, error);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(LifecycleEvent event) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(LifecycleEvent event, DispatchOutcome outcome, Exception error);
  }
}
