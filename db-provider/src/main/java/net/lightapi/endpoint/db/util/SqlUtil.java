package net.lightapi.endpoint.db.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single statement helpers on a caller supplied connection. None of them opens, commits or closes the
 * connection; statements and result sets are closed before returning.
 */
public class SqlUtil {
    private static final Logger logger = LoggerFactory.getLogger(SqlUtil.class);

    private SqlUtil() {
        // Private constructor for utility class
    }

    /**
     * Maps the current row of a result set. Implementations must not move the cursor.
     *
     * @param <T> mapped type
     */
    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet resultSet) throws SQLException;
    }

    /**
     * Work that runs against a connection inside {@link #transactWithResult(Connection, SqlFunction)}.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface SqlFunction<T> {
        T apply(Connection connection) throws SQLException;
    }

    /**
     * Binds positional parameters starting at index 1. A null parameter is bound with setObject(i, null)
     * which every driver used here maps to SQL NULL.
     *
     * @param statement the prepared statement
     * @param params parameters in placeholder order
     * @throws SQLException if binding fails
     */
    public static void bind(PreparedStatement statement, Object... params) throws SQLException {
        if (params == null) return;
        for (int i = 0; i < params.length; i++) {
            statement.setObject(i + 1, params[i]);
        }
    }

    /**
     * Runs a query and maps every row.
     *
     * @return mapped rows in result set order, empty when nothing matches
     */
    public static <T> List<T> dbAll(Connection conn, String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        if(logger.isTraceEnabled()) logger.trace("dbAll sql = {}", sql);
        List<T> list = new ArrayList<>();
        try (PreparedStatement statement = conn.prepareStatement(sql)) {
            bind(statement, params);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    list.add(mapper.map(resultSet));
                }
            }
        }
        return list;
    }

    /**
     * Runs a query and maps the first row only.
     *
     * @return the mapped first row or null when the query returns no row
     */
    public static <T> T dbGet(Connection conn, String sql, RowMapper<T> mapper, Object... params) throws SQLException {
        if(logger.isTraceEnabled()) logger.trace("dbGet sql = {}", sql);
        try (PreparedStatement statement = conn.prepareStatement(sql)) {
            bind(statement, params);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (resultSet.next()) {
                    return mapper.map(resultSet);
                }
            }
        }
        return null;
    }

    /**
     * Runs an insert and returns the key generated for the inserted row.
     *
     * @return the generated key
     * @throws SQLException if the insert fails or the driver reports no generated key
     */
    public static long dbInsert(Connection conn, String sql, Object... params) throws SQLException {
        if(logger.isTraceEnabled()) logger.trace("dbInsert sql = {}", sql);
        try (PreparedStatement statement = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bind(statement, params);
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (keys != null && keys.next()) {
                    return keys.getLong(1);
                }
            }
        }
        throw new SQLException("No generated key returned for insert.");
    }

    /**
     * Runs a delete and returns the number of removed rows.
     */
    public static int dbRemove(Connection conn, String sql, Object... params) throws SQLException {
        return dbUpdate(conn, sql, params);
    }

    /**
     * Runs an update or delete and returns the number of affected rows.
     */
    public static int dbUpdate(Connection conn, String sql, Object... params) throws SQLException {
        if(logger.isTraceEnabled()) logger.trace("dbUpdate sql = {}", sql);
        try (PreparedStatement statement = conn.prepareStatement(sql)) {
            bind(statement, params);
            return statement.executeUpdate();
        }
    }

    /**
     * Reads a nullable integer column.
     *
     * @return the value or null when the column is SQL NULL
     */
    public static Integer getInteger(ResultSet resultSet, String column) throws SQLException {
        int value = resultSet.getInt(column);
        return resultSet.wasNull() ? null : value;
    }

    /**
     * Reads a nullable id or reference column.
     *
     * @return the value or null when the column is SQL NULL
     */
    public static Long getLong(ResultSet resultSet, String column) throws SQLException {
        long value = resultSet.getLong(column);
        return resultSet.wasNull() ? null : value;
    }

    /**
     * Reads a nullable 0/1 flag column.
     *
     * @return the flag or null when the column is SQL NULL
     */
    public static Boolean getBoolean(ResultSet resultSet, String column) throws SQLException {
        boolean value = resultSet.getBoolean(column);
        return resultSet.wasNull() ? null : value;
    }

    /**
     * Executes a series of database operations within a transaction and returns a result.
     * Commits if successful, rolls back on exception, and ensures connection is closed.
     *
     * @param connection JDBC Connection to use for the transaction.
     * @param callback Function that performs database operations using the provided Connection and returns a result.
     * @param <T> The type of the result returned by the callback.
     * @return The result from the callback function.
     * @throws SQLException if a database access error occurs or the callback throws an exception.
     */
    public static <T> T transactWithResult(
        final Connection connection,
        SqlFunction<T> callback
    ) throws SQLException {
        Objects.requireNonNull(connection, "Connection must not be null");
        try {
            connection.setAutoCommit(false);
            T result = callback.apply(connection);
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.close();
        }
    }
}
