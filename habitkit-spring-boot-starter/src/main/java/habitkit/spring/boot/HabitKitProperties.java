package habitkit.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for habitkit.
 *
 * @see HabitKitAutoConfiguration
 */
@ConfigurationProperties(prefix = "habitkit")
public class HabitKitProperties {

    private final Dispatcher dispatcher = new Dispatcher();
    private final Health health = new Health();
    private final Store store = new Store();
    private final Metrics metrics = new Metrics();

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Health getHealth() {
        return health;
    }

    public Store getStore() {
        return store;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Where merged integration state is persisted.
     */
    public enum StoreType {
        /** JDBC when habitkit-jdbc and a DataSource are present, otherwise in memory. */
        AUTO,
        MEMORY,
        JDBC
    }

    public static class Dispatcher {
        /**
         * Hook threads kept alive while idle. The pool grows past this on demand.
         */
        private int workerCount = 4;

        /**
         * How long each hook may run, counted from when it starts.
         */
        private Duration hookTimeout = Duration.ofSeconds(5);

        /**
         * How long close() waits for running hooks.
         */
        private Duration drainTimeout = Duration.ofSeconds(5);

        /**
         * Whether a deleted habit's integration records are removed.
         */
        private boolean removeOnDelete = true;

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public Duration getHookTimeout() {
            return hookTimeout;
        }

        public void setHookTimeout(Duration hookTimeout) {
            this.hookTimeout = hookTimeout;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }

        public boolean isRemoveOnDelete() {
            return removeOnDelete;
        }

        public void setRemoveOnDelete(boolean removeOnDelete) {
            this.removeOnDelete = removeOnDelete;
        }
    }

    public static class Health {
        /**
         * How long each check may run, counted from when it starts.
         */
        private Duration timeout = Duration.ofSeconds(2);

        /**
         * Health check threads kept alive while idle.
         */
        private int workerCount = 2;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }
    }

    public static class Store {
        private StoreType type = StoreType.AUTO;

        /**
         * Table holding integration records when the JDBC store is used.
         */
        private String tableName = "habit_integration";

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }
    }

    public static class Metrics {
        /**
         * Export metrics through Micrometer when it is on the classpath.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "habitkit";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
