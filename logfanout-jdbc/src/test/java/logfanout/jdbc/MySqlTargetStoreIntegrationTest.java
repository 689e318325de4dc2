package logfanout.jdbc;

import logfanout.jdbc.store.AbstractJdbcTargetStore;
import logfanout.jdbc.store.MySqlTargetStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;

@DockerAvailable
@Testcontainers
class MySqlTargetStoreIntegrationTest extends AbstractTargetStoreIntegrationTest {

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("logfanout_test");

    private static SimpleDataSource dataSource;
    private static MySqlTargetStore store;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
        SchemaScripts.apply(dataSource, "/schema/mysql.sql");
        store = new MySqlTargetStore(new DataSourceConnectionProvider(dataSource));
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
