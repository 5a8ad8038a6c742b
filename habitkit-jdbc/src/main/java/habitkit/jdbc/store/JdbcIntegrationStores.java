package habitkit.jdbc.store;

import habitkit.jdbc.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of JDBC integration store dialects with auto-detection.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/habitkit.jdbc.store.AbstractJdbcIntegrationStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Detect the dialect and bind it to the DataSource
 * AbstractJdbcIntegrationStore store = JdbcIntegrationStores.detect(dataSource);
 *
 * // Same, with a custom table
 * AbstractJdbcIntegrationStore store = JdbcIntegrationStores.detect(dataSource, "my_integrations");
 *
 * // Unbound template by JDBC URL or by name
 * AbstractJdbcIntegrationStore template = JdbcIntegrationStores.detect("jdbc:postgresql://db/habits");
 * AbstractJdbcIntegrationStore h2 = JdbcIntegrationStores.get("h2");
 * }</pre>
 */
public final class JdbcIntegrationStores {

    private static final List<AbstractJdbcIntegrationStore> STORES;
    private static final Map<String, AbstractJdbcIntegrationStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcIntegrationStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcIntegrationStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcIntegrationStores() {
    }

    /**
     * Returns all registered dialect templates (unbound).
     */
    public static List<AbstractJdbcIntegrationStore> all() {
        return STORES;
    }

    /**
     * Gets an unbound dialect template by name.
     *
     * @param name store name (case-insensitive)
     * @return the template
     * @throws IllegalArgumentException if no store has that name
     */
    public static AbstractJdbcIntegrationStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcIntegrationStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown integration store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Detects the dialect from a DataSource's JDBC URL and binds it to that DataSource.
     *
     * @param dataSource the data source
     * @return a store ready for use
     * @throws IllegalStateException if the URL cannot be read
     * @throws IllegalArgumentException if no dialect matches
     */
    public static AbstractJdbcIntegrationStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url).withDataSource(dataSource);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect integration store from DataSource", e);
        }
    }

    /**
     * Like {@link #detect(DataSource)}, using a custom table name.
     */
    public static AbstractJdbcIntegrationStore detect(DataSource dataSource, String tableName) {
        return detect(dataSource).withTableName(tableName);
    }

    /**
     * Like {@link #detect(DataSource)}, using a custom table name and codec.
     */
    public static AbstractJdbcIntegrationStore detect(DataSource dataSource, String tableName, JsonCodec jsonCodec) {
        Objects.requireNonNull(jsonCodec, "jsonCodec");
        return detect(dataSource, tableName).withJsonCodec(jsonCodec);
    }

    /**
     * Detects the dialect template for a JDBC URL.
     *
     * @param jdbcUrl the JDBC URL
     * @return unbound template
     * @throws IllegalArgumentException if no dialect matches
     */
    public static AbstractJdbcIntegrationStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String lower = jdbcUrl.toLowerCase();
        for (AbstractJdbcIntegrationStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (lower.startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No integration store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
