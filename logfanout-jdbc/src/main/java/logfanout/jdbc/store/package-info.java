/**
 * JDBC {@link logfanout.spi.TargetStore} implementations.
 *
 * <p>{@link logfanout.jdbc.store.AbstractJdbcTargetStore} holds the shared SQL and row
 * mapping. Dialects differ only in how they report a duplicate target name.
 *
 * @see logfanout.jdbc.store.H2TargetStore
 * @see logfanout.jdbc.store.MySqlTargetStore
 * @see logfanout.jdbc.store.PostgresTargetStore
 * @see logfanout.jdbc.store.JdbcTargetStores
 */
package logfanout.jdbc.store;
