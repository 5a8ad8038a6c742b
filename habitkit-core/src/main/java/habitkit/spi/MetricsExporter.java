package habitkit.spi;

import habitkit.EventKind;
import habitkit.HealthState;

/**
 * Observability hook for exporting dispatch and health metrics to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of dispatched events of a kind.
     */
    void incrementDispatch(EventKind kind);

    /**
     * Increments the count of hooks that returned normally.
     */
    void incrementHookSuccess(String extensionName);

    /**
     * Increments the count of hooks that threw.
     */
    void incrementHookFailure(String extensionName);

    /**
     * Increments the count of hooks cancelled for overrunning the deadline.
     */
    void incrementHookTimeout(String extensionName);

    /**
     * Increments the count of extension results dropped by the merger.
     */
    void incrementMergeRejected(String extensionName);

    /**
     * Increments the count of write sets the store failed to apply.
     */
    void incrementApplyFailure();

    /**
     * Records the wall time of one dispatch, from lock acquisition to apply.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    void recordDispatchDurationMs(EventKind kind, long durationMs);

    /**
     * Records the execution time of one hook.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordHookDurationMs(String extensionName, long durationMs) {
    }

    /**
     * Records the latest health state of an extension.
     */
    default void recordExtensionHealth(String extensionName, HealthState state) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDispatch(EventKind kind) {
        }

        @Override
        public void incrementHookSuccess(String extensionName) {
        }

        @Override
        public void incrementHookFailure(String extensionName) {
        }

        @Override
        public void incrementHookTimeout(String extensionName) {
        }

        @Override
        public void incrementMergeRejected(String extensionName) {
        }

        @Override
        public void incrementApplyFailure() {
        }

        @Override
        public void recordDispatchDurationMs(EventKind kind, long durationMs) {
        }
    }
}
