package habitkit.jdbc.store;

import habitkit.jdbc.JsonCodec;
import habitkit.jdbc.TableNames;

import javax.sql.DataSource;
import java.util.List;

/**
 * H2 integration store. Primarily for tests and embedded demos.
 *
 * <p>Upserts with {@code MERGE INTO ... KEY (habit_id, extension_name)}; the caller
 * passes the original {@code created_at} for rows that already exist.
 */
public final class H2IntegrationStore extends AbstractJdbcIntegrationStore {

  public H2IntegrationStore() {
    super();
  }

  public H2IntegrationStore(DataSource dataSource) {
    this(dataSource, TableNames.DEFAULT_TABLE, JsonCodec.getDefault());
  }

  public H2IntegrationStore(DataSource dataSource, String tableName, JsonCodec jsonCodec) {
    super(dataSource, tableName, jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String upsertSql() {
    return "MERGE INTO " + tableName() +
        " (habit_id, extension_name, data, created_at, updated_at)" +
        " KEY (habit_id, extension_name) VALUES (?,?,?,?,?)";
  }

  @Override
  protected AbstractJdbcIntegrationStore newInstance(DataSource dataSource, String tableName, JsonCodec jsonCodec) {
    return new H2IntegrationStore(dataSource, tableName, jsonCodec);
  }
}
