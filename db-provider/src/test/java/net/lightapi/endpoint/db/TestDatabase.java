package net.lightapi.endpoint.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.stream.Collectors;

/**
 * SQLite databases loaded with the test schema and fixture rows.
 */
public class TestDatabase {
    public static final String SCHEMA = "zap-schema.sql";
    public static final String DATA = "zap-data.sql";

    private TestDatabase() {
    }

    /**
     * Opens a private in-memory database with foreign keys enforced, schema and fixture rows loaded.
     */
    public static Connection openInMemory() throws SQLException, IOException {
        Connection conn = DriverManager.getConnection("jdbc:sqlite::memory:");
        load(conn);
        return conn;
    }

    /**
     * Loads schema and fixture rows into an already open connection.
     */
    public static void load(Connection conn) throws SQLException, IOException {
        try (Statement statement = conn.createStatement()) {
            statement.execute("PRAGMA foreign_keys = ON");
        }
        runScript(conn, SCHEMA);
        runScript(conn, DATA);
    }

    public static void runScript(Connection conn, String resource) throws SQLException, IOException {
        String script;
        try (InputStream in = TestDatabase.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("Missing test resource " + resource);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                script = reader.lines()
                        .filter(line -> !line.trim().startsWith("--"))
                        .collect(Collectors.joining("\n"));
            }
        }
        try (Statement statement = conn.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) {
                    statement.execute(sql.trim());
                }
            }
        }
    }
}
