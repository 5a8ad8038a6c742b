package habitkit.jdbc.store;

import habitkit.jdbc.IntegrationStoreException;
import habitkit.jdbc.JdbcTemplate;
import habitkit.jdbc.JsonCodec;
import habitkit.jdbc.TableNames;
import habitkit.merge.IntegrationDocuments;
import habitkit.merge.WriteSet;
import habitkit.spi.IntegrationStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base JDBC integration store. One row per (habit, extension) holds the namespace
 * document as JSON text:
 *
 * <pre>
 * habit_integration(habit_id, extension_name, data, created_at, updated_at)
 *   PRIMARY KEY (habit_id, extension_name)
 * </pre>
 *
 * <p>{@link #apply} runs in a single transaction: the habit's rows are locked with
 * {@code SELECT ... FOR UPDATE}, the new documents are computed with
 * {@link IntegrationDocuments}, and every touched namespace is upserted with the
 * dialect's {@link #upsertSql()}. Any failure rolls the whole write set back.
 *
 * <p>Instances created by {@link java.util.ServiceLoader} are unbound templates; call
 * {@link #withDataSource(DataSource)} (or use {@link JdbcIntegrationStores#detect})
 * before using them. Register custom dialects via
 * {@code META-INF/services/habitkit.jdbc.store.AbstractJdbcIntegrationStore}.
 *
 * @see JdbcIntegrationStores
 */
public abstract class AbstractJdbcIntegrationStore implements IntegrationStore {
  private static final Logger logger = Logger.getLogger(AbstractJdbcIntegrationStore.class.getName());

  private final DataSource dataSource;
  private final String tableName;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcIntegrationStore() {
    this(null, TableNames.DEFAULT_TABLE, JsonCodec.getDefault());
  }

  protected AbstractJdbcIntegrationStore(DataSource dataSource, String tableName, JsonCodec jsonCodec) {
    this.dataSource = dataSource;
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Insert-or-update statement for one namespace row. Parameters, in order:
   * {@code habit_id, extension_name, data, created_at, updated_at}. On conflict only
   * {@code data} and {@code updated_at} may change.
   */
  protected abstract String upsertSql();

  /** Creates a configured copy of this dialect. */
  protected abstract AbstractJdbcIntegrationStore newInstance(
      DataSource dataSource, String tableName, JsonCodec jsonCodec);

  public AbstractJdbcIntegrationStore withDataSource(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return newInstance(dataSource, tableName, jsonCodec);
  }

  public AbstractJdbcIntegrationStore withTableName(String tableName) {
    return newInstance(dataSource, tableName, jsonCodec);
  }

  public AbstractJdbcIntegrationStore withJsonCodec(JsonCodec jsonCodec) {
    return newInstance(dataSource, tableName, jsonCodec);
  }

  public String tableName() {
    return tableName;
  }

  public boolean isBound() {
    return dataSource != null;
  }

  @Override
  public Map<String, Map<String, Object>> load(String habitId) {
    Objects.requireNonNull(habitId, "habitId");
    try (Connection conn = requireDataSource().getConnection()) {
      return toIntegrations(selectRows(conn, habitId, false));
    } catch (SQLException e) {
      throw new IntegrationStoreException("Failed to load integrations for habit " + habitId, e);
    }
  }

  @Override
  public Map<String, Map<String, Object>> apply(WriteSet writeSet) {
    Objects.requireNonNull(writeSet, "writeSet");
    if (writeSet.isEmpty()) {
      return load(writeSet.habitId());
    }
    return inTransaction(writeSet.habitId(), conn -> applyLocked(conn, writeSet));
  }

  @Override
  public int removeAll(String habitId) {
    Objects.requireNonNull(habitId, "habitId");
    try (Connection conn = requireDataSource().getConnection()) {
      String sql = "DELETE FROM " + tableName() + " WHERE habit_id=?";
      return JdbcTemplate.update(conn, sql, habitId);
    } catch (SQLException e) {
      throw new IntegrationStoreException("Failed to remove integrations for habit " + habitId, e);
    }
  }

  private Map<String, Map<String, Object>> applyLocked(Connection conn, WriteSet writeSet) {
    String habitId = writeSet.habitId();
    Map<String, StoredNamespace> existing = new LinkedHashMap<>();
    for (StoredNamespace row : selectRows(conn, habitId, true)) {
      existing.put(row.extensionName(), row);
    }

    Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    Map<String, Map<String, Object>> result = toIntegrations(existing.values());
    for (String extension : writeSet.touchedExtensions()) {
      StoredNamespace current = existing.get(extension);
      Map<String, Object> document = IntegrationDocuments.applyToNamespace(
          current == null ? null : current.data(), writeSet.writesFor(extension));
      String json = encode(extension, document);
      Instant createdAt = current == null ? now : current.createdAt();
      JdbcTemplate.update(conn, upsertSql(),
          habitId, extension, json, Timestamp.from(createdAt), Timestamp.from(now));
      result.put(extension, document);
    }
    return result;
  }

  private List<StoredNamespace> selectRows(Connection conn, String habitId, boolean forUpdate) {
    String sql = "SELECT extension_name, data, created_at FROM " + tableName() +
        " WHERE habit_id=? ORDER BY extension_name" + (forUpdate ? " FOR UPDATE" : "");
    return JdbcTemplate.query(conn, sql, rs -> new StoredNamespace(
        rs.getString("extension_name"),
        decode(rs.getString("extension_name"), rs.getString("data")),
        rs.getTimestamp("created_at").toInstant()), habitId);
  }

  private String encode(String extension, Map<String, Object> document) {
    try {
      return jsonCodec.toJson(document);
    } catch (IllegalArgumentException e) {
      throw new IntegrationStoreException("Cannot encode namespace '" + extension + "'", e);
    }
  }

  private Map<String, Object> decode(String extension, String json) {
    try {
      return jsonCodec.parseObject(json);
    } catch (IllegalArgumentException e) {
      throw new IntegrationStoreException("Corrupt data in namespace '" + extension + "'", e);
    }
  }

  private <T> T inTransaction(String habitId, TransactionWork<T> work) {
    Connection conn;
    try {
      conn = requireDataSource().getConnection();
    } catch (SQLException e) {
      throw new IntegrationStoreException("Failed to open connection for habit " + habitId, e);
    }
    boolean committed = false;
    try {
      conn.setAutoCommit(false);
      T result = work.run(conn);
      conn.commit();
      committed = true;
      return result;
    } catch (SQLException e) {
      throw new IntegrationStoreException("Failed to apply writes for habit " + habitId, e);
    } finally {
      if (!committed) {
        safeRollback(conn, habitId);
      }
      release(conn);
    }
  }

  private static void safeRollback(Connection conn, String habitId) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback failed for habit " + habitId, e);
    }
  }

  private static void release(Connection conn) {
    try {
      conn.setAutoCommit(true);
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to restore auto-commit", e);
    } finally {
      try {
        conn.close();
      } catch (SQLException e) {
        logger.log(Level.WARNING, "Failed to close connection", e);
      }
    }
  }

  private DataSource requireDataSource() {
    if (dataSource == null) {
      throw new IllegalStateException("Integration store '" + name() + "' is not bound to a DataSource");
    }
    return dataSource;
  }

  private static Map<String, Map<String, Object>> toIntegrations(Iterable<StoredNamespace> rows) {
    Map<String, Map<String, Object>> integrations = new LinkedHashMap<>();
    for (StoredNamespace row : rows) {
      integrations.put(row.extensionName(), row.data());
    }
    return integrations;
  }

  @FunctionalInterface
  private interface TransactionWork<T> {
    T run(Connection conn) throws SQLException;
  }

  private record StoredNamespace(String extensionName, Map<String, Object> data, Instant createdAt) {
  }
}
