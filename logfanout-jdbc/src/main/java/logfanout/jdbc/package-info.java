/**
 * JDBC plumbing for the {@link logfanout.spi.TargetStore}: connection provider,
 * statement helper, table name checks and the store exception type.
 *
 * @see logfanout.jdbc.store.JdbcTargetStores
 */
package logfanout.jdbc;
