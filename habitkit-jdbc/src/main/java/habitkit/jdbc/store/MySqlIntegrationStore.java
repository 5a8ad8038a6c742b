package habitkit.jdbc.store;

import habitkit.jdbc.JsonCodec;
import habitkit.jdbc.TableNames;

import javax.sql.DataSource;
import java.util.List;

/**
 * MySQL integration store (also handles TiDB and MariaDB URLs).
 *
 * <p>Upserts with {@code INSERT ... ON DUPLICATE KEY UPDATE}, keeping {@code created_at}.
 */
public final class MySqlIntegrationStore extends AbstractJdbcIntegrationStore {

  public MySqlIntegrationStore() {
    super();
  }

  public MySqlIntegrationStore(DataSource dataSource) {
    this(dataSource, TableNames.DEFAULT_TABLE, JsonCodec.getDefault());
  }

  public MySqlIntegrationStore(DataSource dataSource, String tableName, JsonCodec jsonCodec) {
    super(dataSource, tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  protected String upsertSql() {
    return "INSERT INTO " + tableName() +
        " (habit_id, extension_name, data, created_at, updated_at) VALUES (?,?,?,?,?)" +
        " ON DUPLICATE KEY UPDATE data=VALUES(data), updated_at=VALUES(updated_at)";
  }

  @Override
  protected AbstractJdbcIntegrationStore newInstance(DataSource dataSource, String tableName, JsonCodec jsonCodec) {
    return new MySqlIntegrationStore(dataSource, tableName, jsonCodec);
  }
}
