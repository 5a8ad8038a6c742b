package habitkit.jdbc.store;

import habitkit.jdbc.JsonCodec;
import habitkit.jdbc.TableNames;

import javax.sql.DataSource;
import java.util.List;

/**
 * PostgreSQL integration store.
 *
 * <p>Upserts with {@code INSERT ... ON CONFLICT (habit_id, extension_name) DO UPDATE}.
 */
public final class PostgresIntegrationStore extends AbstractJdbcIntegrationStore {

  public PostgresIntegrationStore() {
    super();
  }

  public PostgresIntegrationStore(DataSource dataSource) {
    this(dataSource, TableNames.DEFAULT_TABLE, JsonCodec.getDefault());
  }

  public PostgresIntegrationStore(DataSource dataSource, String tableName, JsonCodec jsonCodec) {
    super(dataSource, tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String upsertSql() {
    return "INSERT INTO " + tableName() +
        " (habit_id, extension_name, data, created_at, updated_at) VALUES (?,?,?,?,?)" +
        " ON CONFLICT (habit_id, extension_name)" +
        " DO UPDATE SET data=EXCLUDED.data, updated_at=EXCLUDED.updated_at";
  }

  @Override
  protected AbstractJdbcIntegrationStore newInstance(DataSource dataSource, String tableName, JsonCodec jsonCodec) {
    return new PostgresIntegrationStore(dataSource, tableName, jsonCodec);
  }
}
