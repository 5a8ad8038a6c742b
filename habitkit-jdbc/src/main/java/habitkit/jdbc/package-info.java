/**
 * JDBC persistence for integration state: SQL helpers, table-name validation and the
 * JSON codec used for namespace documents.
 *
 * @see habitkit.jdbc.store.AbstractJdbcIntegrationStore
 */
package habitkit.jdbc;
