package net.lightapi.endpoint.db;

import com.zaxxer.hikari.HikariConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SqlDbStartupHookTest {

    @AfterEach
    void tearDown() {
        if (SqlDbStartupHook.ds != null) {
            SqlDbStartupHook.ds.close();
            SqlDbStartupHook.ds = null;
        }
    }

    @Test
    public void testConfigLoaded() {
        assertEquals("org.sqlite.JDBC", SqlDbStartupHook.config.getDriverClassName());
        assertEquals("jdbc:sqlite::memory:", SqlDbStartupHook.config.getJdbcUrl());
        assertEquals(2, SqlDbStartupHook.config.getMaximumPoolSize());
    }

    @Test
    public void testOnStartupCreatesDataSource() throws Exception {
        new SqlDbStartupHook().onStartup();
        assertNotNull(SqlDbStartupHook.ds);
        try (Connection connection = SqlDbStartupHook.ds.getConnection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT 1")) {
            assertTrue(resultSet.next());
            assertEquals(1, resultSet.getInt(1));
        }
    }

    @Test
    public void testShippedConfigDefaults() throws Exception {
        Path shipped = Paths.get("src", "main", "resources", "config", DbConfig.CONFIG_NAME + ".yml");
        Map<String, Object> values;
        try (InputStream in = Files.newInputStream(shipped)) {
            values = new Yaml().load(in);
        }
        assertEquals("org.sqlite.JDBC", defaultOf(values, "driverClassName"));
        assertEquals("jdbc:sqlite:endpoint.zap", defaultOf(values, "jdbcUrl"));
        assertEquals("", defaultOf(values, "username"));
        assertEquals("", defaultOf(values, "password"));
        assertEquals("1", defaultOf(values, "maximumPoolSize"));

        // the default driver is on the runtime classpath
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setDriverClassName(defaultOf(values, "driverClassName"));
        assertEquals("org.sqlite.JDBC", hikariConfig.getDriverClassName());
    }

    // default part of a ${endpoint-db.key:default} value
    private static String defaultOf(Map<String, Object> values, String key) {
        String value = String.valueOf(values.get(key));
        String prefix = "${" + DbConfig.CONFIG_NAME + "." + key + ":";
        assertTrue(value.startsWith(prefix) && value.endsWith("}"), key + " = " + value);
        return value.substring(prefix.length(), value.length() - 1);
    }
}
