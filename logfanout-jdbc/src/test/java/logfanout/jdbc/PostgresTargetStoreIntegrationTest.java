package logfanout.jdbc;

import logfanout.jdbc.store.AbstractJdbcTargetStore;
import logfanout.jdbc.store.JdbcTargetStores;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;

@DockerAvailable
@Testcontainers
class PostgresTargetStoreIntegrationTest extends AbstractTargetStoreIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("logfanout_test");

    private static SimpleDataSource dataSource;
    private static AbstractJdbcTargetStore store;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        SchemaScripts.apply(dataSource, "/schema/postgresql.sql");
        store = JdbcTargetStores.forDataSource(dataSource);
    }

    @BeforeEach
    void truncate() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            conn.createStatement().execute("TRUNCATE TABLE logging_targets");
        }
    }

    @Override
    AbstractJdbcTargetStore store() {
        return store;
    }
}
