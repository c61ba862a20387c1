package io.hookline.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;

@DockerAvailable
@Testcontainers
class MySqlStoreIntegrationTest extends AbstractStoreIntegrationTest {

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("hookline_test");

    private static HikariDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(mysql.getJdbcUrl());
        dataSource.setUsername(mysql.getUsername());
        dataSource.setPassword(mysql.getPassword());
        dataSource.setMaximumPoolSize(2);
        try (Connection conn = dataSource.getConnection()) {
            SchemaScripts.apply(conn, "mysql");
        }
    }

    @AfterAll
    static void closePool() {
        if (dataSource != null) {
            dataSource.close();
        }
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    String dbName() {
        return "mysql";
    }
}
