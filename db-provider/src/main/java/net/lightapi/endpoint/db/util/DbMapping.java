package net.lightapi.endpoint.db.util;

import net.lightapi.endpoint.db.model.Endpoint;

import java.sql.ResultSet;
import java.sql.SQLException;

import static net.lightapi.endpoint.db.util.SqlUtil.getInteger;
import static net.lightapi.endpoint.db.util.SqlUtil.getLong;

/**
 * Row to object mappings shared by the persistence classes.
 */
public class DbMapping {

    private DbMapping() {
        // Private constructor for utility class
    }

    /**
     * Maps the current row of an ENDPOINT query. The row must carry ENDPOINT_ID, SESSION_REF,
     * ENDPOINT_IDENTIFIER, ENDPOINT_TYPE_REF, PROFILE, NETWORK_IDENTIFIER, DEVICE_VERSION and DEVICE_IDENTIFIER.
     */
    public static Endpoint endpoint(ResultSet resultSet) throws SQLException {
        return new Endpoint(
                resultSet.getLong("ENDPOINT_ID"),
                getLong(resultSet, "SESSION_REF"),
                getInteger(resultSet, "ENDPOINT_IDENTIFIER"),
                getLong(resultSet, "ENDPOINT_TYPE_REF"),
                getInteger(resultSet, "PROFILE"),
                getInteger(resultSet, "NETWORK_IDENTIFIER"),
                getInteger(resultSet, "DEVICE_VERSION"),
                getInteger(resultSet, "DEVICE_IDENTIFIER"));
    }
}
