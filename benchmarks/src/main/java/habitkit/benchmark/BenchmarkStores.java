package habitkit.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import habitkit.jdbc.store.H2IntegrationStore;
import habitkit.jdbc.store.MySqlIntegrationStore;
import habitkit.jdbc.store.PostgresIntegrationStore;
import habitkit.spi.IntegrationStore;
import habitkit.store.InMemoryIntegrationStore;
import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates a {@link StoreSetup} for the requested store type.
 *
 * <p>Supported types: {@code "memory"}, {@code "h2"} (in-memory database), {@code "mysql"}
 * and {@code "postgresql"} (external servers). External connection details are read from
 * system properties:
 * <ul>
 *   <li>{@code bench.mysql.url}, default {@code jdbc:mysql://localhost:3306/habitkit_bench}</li>
 *   <li>{@code bench.mysql.user}, default {@code root}</li>
 *   <li>{@code bench.mysql.password}, default empty</li>
 *   <li>{@code bench.pg.url}, default {@code jdbc:postgresql://localhost:5432/habitkit_bench}</li>
 *   <li>{@code bench.pg.user}, default {@code postgres}</li>
 *   <li>{@code bench.pg.password}, default {@code postgres}</li>
 * </ul>
 */
final class BenchmarkStores {

  record StoreSetup(DataSource dataSource, IntegrationStore store) implements AutoCloseable {
    @Override
    public void close() throws Exception {
      if (dataSource instanceof AutoCloseable ac) ac.close();
    }
  }

  private static final String H2_CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS habit_integration (" +
          "habit_id VARCHAR(128) NOT NULL," +
          "extension_name VARCHAR(128) NOT NULL," +
          "data CLOB NOT NULL," +
          "created_at TIMESTAMP NOT NULL," +
          "updated_at TIMESTAMP NOT NULL," +
          "PRIMARY KEY (habit_id, extension_name)" +
          ")";

  private static final String MYSQL_CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS habit_integration (" +
          "habit_id VARCHAR(128) NOT NULL," +
          "extension_name VARCHAR(128) NOT NULL," +
          "data LONGTEXT NOT NULL," +
          "created_at DATETIME(3) NOT NULL," +
          "updated_at DATETIME(3) NOT NULL," +
          "PRIMARY KEY (habit_id, extension_name)" +
          ")";

  private static final String PG_CREATE_TABLE =
      "CREATE TABLE IF NOT EXISTS habit_integration (" +
          "habit_id VARCHAR(128) NOT NULL," +
          "extension_name VARCHAR(128) NOT NULL," +
          "data TEXT NOT NULL," +
          "created_at TIMESTAMPTZ NOT NULL," +
          "updated_at TIMESTAMPTZ NOT NULL," +
          "PRIMARY KEY (habit_id, extension_name)" +
          ")";

  static StoreSetup create(String type, String dbName) {
    return switch (type) {
      case "memory" -> new StoreSetup(null, new InMemoryIntegrationStore());
      case "h2" -> createH2(dbName);
      case "mysql" -> createMySql();
      case "postgresql" -> createPostgresql();
      default -> throw new IllegalArgumentException("Unsupported store: " + type);
    };
  }

  private static StoreSetup createH2(String dbName) {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1");
    initSchema(ds, H2_CREATE_TABLE);
    return new StoreSetup(ds, new H2IntegrationStore(ds));
  }

  private static StoreSetup createMySql() {
    DataSource ds = pool("bench-mysql",
        System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/habitkit_bench"),
        System.getProperty("bench.mysql.user", "root"),
        System.getProperty("bench.mysql.password", ""));
    initSchema(ds, MYSQL_CREATE_TABLE);
    return new StoreSetup(ds, new MySqlIntegrationStore(ds));
  }

  private static StoreSetup createPostgresql() {
    DataSource ds = pool("bench-pg",
        System.getProperty("bench.pg.url", "jdbc:postgresql://localhost:5432/habitkit_bench"),
        System.getProperty("bench.pg.user", "postgres"),
        System.getProperty("bench.pg.password", "postgres"));
    initSchema(ds, PG_CREATE_TABLE);
    return new StoreSetup(ds, new PostgresIntegrationStore(ds));
  }

  private static DataSource pool(String poolName, String url, String user, String password) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(user);
    config.setPassword(password);
    config.setPoolName(poolName);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    return new HikariDataSource(config);
  }

  private static void initSchema(DataSource ds, String createTable) {
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute(createTable);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to initialize benchmark schema", e);
    }
  }

  static void truncate(DataSource ds) {
    if (ds == null) {
      return;
    }
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("DELETE FROM habit_integration");
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to truncate benchmark table", e);
    }
  }

  private BenchmarkStores() {}
}
