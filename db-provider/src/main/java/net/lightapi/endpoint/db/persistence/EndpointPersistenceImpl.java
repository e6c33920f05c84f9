package net.lightapi.endpoint.db.persistence;

import net.lightapi.endpoint.db.model.Endpoint;
import net.lightapi.endpoint.db.model.EndpointCluster;
import net.lightapi.endpoint.db.model.EndpointClusterAttribute;
import net.lightapi.endpoint.db.model.EndpointClusterCommand;
import net.lightapi.endpoint.db.model.EndpointColumn;
import net.lightapi.endpoint.db.util.DbMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static net.lightapi.endpoint.EndpointConstants.ATTRIBUTE_CODE_BITS;
import static net.lightapi.endpoint.EndpointConstants.CLUSTER_CODE_BITS;
import static net.lightapi.endpoint.EndpointConstants.COMMAND_CODE_BITS;
import static net.lightapi.endpoint.db.util.SqlUtil.*;
import static net.lightapi.endpoint.util.BinUtil.toHexCode;

/**
 * Endpoint configuration queries. Every method runs one statement on the caller's connection and leaves
 * transaction handling to the caller. Store failures are logged and rethrown unchanged.
 */
public class EndpointPersistenceImpl implements EndpointPersistence {
    private static final Logger logger = LoggerFactory.getLogger(EndpointPersistenceImpl.class);

    @Override
    public List<EndpointCluster> selectEndpointClusters(Connection conn, long endpointTypeId) throws SQLException {
        final String sql =
                """
                SELECT
                  C.CLUSTER_ID,
                  EC.ENDPOINT_TYPE_CLUSTER_ID,
                  EC.ENDPOINT_TYPE_REF,
                  C.CODE,
                  C.NAME,
                  C.MANUFACTURER_CODE,
                  EC.SIDE
                FROM
                  CLUSTER AS C
                LEFT JOIN
                  ENDPOINT_TYPE_CLUSTER AS EC
                ON
                  C.CLUSTER_ID = EC.CLUSTER_REF
                WHERE
                  EC.ENABLED = 1
                  AND EC.ENDPOINT_TYPE_REF = ?
                ORDER BY C.CODE
                """;
        try {
            return dbAll(conn, sql, resultSet -> {
                int code = resultSet.getInt("CODE");
                return new EndpointCluster(
                        resultSet.getLong("CLUSTER_ID"),
                        resultSet.getLong("ENDPOINT_TYPE_REF"),
                        resultSet.getLong("ENDPOINT_TYPE_CLUSTER_ID"),
                        toHexCode(code, CLUSTER_CODE_BITS),
                        code,
                        resultSet.getString("NAME"),
                        getInteger(resultSet, "MANUFACTURER_CODE"),
                        resultSet.getString("SIDE"));
            }, endpointTypeId);
        } catch (SQLException e) {
            logger.error("SQLException during selectEndpointClusters for endpointTypeId {}: {}", endpointTypeId, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public List<EndpointClusterAttribute> selectEndpointClusterAttributes(Connection conn, long clusterId, String side, long endpointTypeId) throws SQLException {
        // the endpoint type filters sit in the WHERE clause, so attributes without an association row never match
        final String sql =
                """
                SELECT
                  A.ATTRIBUTE_ID,
                  A.CODE,
                  A.NAME,
                  A.SIDE,
                  A.TYPE,
                  A.ARRAY_TYPE,
                  A.MIN_LENGTH,
                  A.MAX_LENGTH,
                  A.MIN,
                  A.MAX,
                  A.MANUFACTURER_CODE,
                  A.IS_WRITABLE,
                  A.DEFINE,
                  EA.STORAGE_OPTION,
                  EA.SINGLETON,
                  EA.BOUNDED,
                  EA.INCLUDED,
                  EA.DEFAULT_VALUE,
                  EA.INCLUDED_REPORTABLE,
                  EA.MIN_INTERVAL,
                  EA.MAX_INTERVAL,
                  EA.REPORTABLE_CHANGE
                FROM
                  ATTRIBUTE AS A
                LEFT JOIN
                  ENDPOINT_TYPE_ATTRIBUTE AS EA
                ON
                  A.ATTRIBUTE_ID = EA.ATTRIBUTE_REF
                WHERE
                  (A.CLUSTER_REF = ? OR A.CLUSTER_REF IS NULL)
                  AND A.SIDE = ?
                  AND (EA.ENDPOINT_TYPE_REF = ? AND (EA.ENDPOINT_TYPE_CLUSTER_REF =
                    (SELECT ENDPOINT_TYPE_CLUSTER_ID
                     FROM ENDPOINT_TYPE_CLUSTER
                     WHERE CLUSTER_REF = ? AND SIDE = ? AND ENDPOINT_TYPE_REF = ?) ))
                ORDER BY A.MANUFACTURER_CODE, A.CODE
                """;
        try {
            return dbAll(conn, sql, resultSet -> {
                int code = resultSet.getInt("CODE");
                return EndpointClusterAttribute.builder()
                        .id(resultSet.getLong("ATTRIBUTE_ID"))
                        .clusterId(clusterId)
                        .code(code)
                        .manufacturerCode(getInteger(resultSet, "MANUFACTURER_CODE"))
                        .hexCode(toHexCode(code, ATTRIBUTE_CODE_BITS))
                        .name(resultSet.getString("NAME"))
                        .side(resultSet.getString("SIDE"))
                        .type(resultSet.getString("TYPE"))
                        .entryType(resultSet.getString("ARRAY_TYPE"))
                        .minLength(getInteger(resultSet, "MIN_LENGTH"))
                        .maxLength(getInteger(resultSet, "MAX_LENGTH"))
                        .min(resultSet.getString("MIN"))
                        .max(resultSet.getString("MAX"))
                        .storage(resultSet.getString("STORAGE_OPTION"))
                        .included(getBoolean(resultSet, "INCLUDED"))
                        .singleton(getBoolean(resultSet, "SINGLETON"))
                        .bound(getBoolean(resultSet, "BOUNDED"))
                        .writable(getBoolean(resultSet, "IS_WRITABLE"))
                        .defaultValue(resultSet.getString("DEFAULT_VALUE"))
                        .includedReportable(getBoolean(resultSet, "INCLUDED_REPORTABLE"))
                        .minInterval(getInteger(resultSet, "MIN_INTERVAL"))
                        .maxInterval(getInteger(resultSet, "MAX_INTERVAL"))
                        .reportableChange(getInteger(resultSet, "REPORTABLE_CHANGE"))
                        .define(resultSet.getString("DEFINE"))
                        .build();
            }, clusterId, side, endpointTypeId, clusterId, side, endpointTypeId);
        } catch (SQLException e) {
            logger.error("SQLException during selectEndpointClusterAttributes for clusterId {} side {} endpointTypeId {}: {}", clusterId, side, endpointTypeId, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public List<EndpointClusterCommand> selectEndpointClusterCommands(Connection conn, long clusterId, long endpointTypeId) throws SQLException {
        final String sql =
                """
                SELECT
                  C.COMMAND_ID,
                  C.NAME,
                  C.CODE,
                  C.SOURCE,
                  C.MANUFACTURER_CODE,
                  C.IS_OPTIONAL,
                  EC.INCOMING,
                  EC.OUTGOING
                FROM
                  COMMAND AS C
                LEFT JOIN
                  ENDPOINT_TYPE_COMMAND AS EC
                ON
                  C.COMMAND_ID = EC.COMMAND_REF
                WHERE
                  C.CLUSTER_REF = ?
                  AND EC.ENDPOINT_TYPE_REF = ?
                ORDER BY C.CODE
                """;
        try {
            return dbAll(conn, sql, resultSet -> {
                int code = resultSet.getInt("CODE");
                return new EndpointClusterCommand(
                        resultSet.getLong("COMMAND_ID"),
                        resultSet.getString("NAME"),
                        code,
                        getInteger(resultSet, "MANUFACTURER_CODE"),
                        getBoolean(resultSet, "IS_OPTIONAL"),
                        resultSet.getString("SOURCE"),
                        getBoolean(resultSet, "INCOMING"),
                        getBoolean(resultSet, "OUTGOING"),
                        toHexCode(code, COMMAND_CODE_BITS));
            }, clusterId, endpointTypeId);
        } catch (SQLException e) {
            logger.error("SQLException during selectEndpointClusterCommands for clusterId {} endpointTypeId {}: {}", clusterId, endpointTypeId, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public long insertEndpoint(Connection conn, long sessionId, int endpointIdentifier, long endpointTypeRef, int networkIdentifier,
                               int profileIdentifier, int endpointVersion, int deviceIdentifier) throws SQLException {
        // INSERT OR REPLACE: a row conflicting on a unique key is deleted first, so the returned id is always new
        final String sql =
                """
                INSERT OR REPLACE
                INTO ENDPOINT (
                  SESSION_REF,
                  ENDPOINT_IDENTIFIER,
                  ENDPOINT_TYPE_REF,
                  NETWORK_IDENTIFIER,
                  DEVICE_VERSION,
                  DEVICE_IDENTIFIER,
                  PROFILE
                ) VALUES ( ?, ?, ?, ?, ?, ?, ?)""";
        try {
            long id = dbInsert(conn, sql,
                    sessionId,
                    endpointIdentifier,
                    endpointTypeRef,
                    networkIdentifier,
                    endpointVersion,
                    deviceIdentifier,
                    profileIdentifier);
            if(logger.isTraceEnabled()) logger.trace("Inserted endpoint {} for sessionId {} endpointIdentifier {}", id, sessionId, endpointIdentifier);
            return id;
        } catch (SQLException e) {
            logger.error("SQLException during insertEndpoint for sessionId {} endpointIdentifier {}: {}", sessionId, endpointIdentifier, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public int deleteEndpoint(Connection conn, long id) throws SQLException {
        try {
            int count = dbRemove(conn, "DELETE FROM ENDPOINT WHERE ENDPOINT_ID = ?", id);
            if (count == 0) {
                logger.debug("No endpoint deleted for id {}", id);
            }
            return count;
        } catch (SQLException e) {
            logger.error("SQLException during deleteEndpoint for id {}: {}", id, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public Endpoint selectEndpoint(Connection conn, long endpointId) throws SQLException {
        final String sql =
                """
                SELECT
                  ENDPOINT_ID,
                  SESSION_REF,
                  ENDPOINT_IDENTIFIER,
                  ENDPOINT_TYPE_REF,
                  PROFILE,
                  NETWORK_IDENTIFIER,
                  DEVICE_VERSION,
                  DEVICE_IDENTIFIER
                FROM ENDPOINT
                WHERE ENDPOINT_ID = ?""";
        try {
            return dbGet(conn, sql, DbMapping::endpoint, endpointId);
        } catch (SQLException e) {
            logger.error("SQLException during selectEndpoint for endpointId {}: {}", endpointId, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public List<Endpoint> selectAllEndpoints(Connection conn, long sessionId) throws SQLException {
        final String sql =
                """
                SELECT
                  ENDPOINT_ID,
                  SESSION_REF,
                  ENDPOINT_IDENTIFIER,
                  ENDPOINT_TYPE_REF,
                  PROFILE,
                  NETWORK_IDENTIFIER,
                  DEVICE_VERSION,
                  DEVICE_IDENTIFIER
                FROM ENDPOINT
                WHERE SESSION_REF = ?
                ORDER BY ENDPOINT_IDENTIFIER""";
        try {
            return dbAll(conn, sql, DbMapping::endpoint, sessionId);
        } catch (SQLException e) {
            logger.error("SQLException during selectAllEndpoints for sessionId {}: {}", sessionId, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public int selectCountOfEndpointsWithGivenEndpointIdentifier(Connection conn, int endpointIdentifier, long sessionId) throws SQLException {
        final String sql =
                """
                SELECT
                  COUNT(ENDPOINT_IDENTIFIER) AS ENDPOINT_COUNT
                FROM ENDPOINT
                WHERE ENDPOINT_IDENTIFIER = ? AND SESSION_REF = ?""";
        try {
            Integer count = dbGet(conn, sql, resultSet -> resultSet.getInt("ENDPOINT_COUNT"), endpointIdentifier, sessionId);
            return count == null ? 0 : count;
        } catch (SQLException e) {
            logger.error("SQLException during selectCountOfEndpointsWithGivenEndpointIdentifier for endpointIdentifier {} sessionId {}: {}", endpointIdentifier, sessionId, e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public int updateEndpoint(Connection conn, long sessionId, long endpointId, Map<EndpointColumn, ?> changes) throws SQLException {
        if (changes == null || changes.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (Map.Entry<EndpointColumn, ?> change : changes.entrySet()) {
            // the column comes from the enum, only the value is bound
            String sql = "UPDATE ENDPOINT SET " + change.getKey().columnName() + " = ? WHERE ENDPOINT_ID = ? AND SESSION_REF = ?";
            try {
                count += dbUpdate(conn, sql, change.getValue(), endpointId, sessionId);
            } catch (SQLException e) {
                logger.error("SQLException during updateEndpoint for endpointId {} sessionId {} column {}: {}", endpointId, sessionId, change.getKey(), e.getMessage(), e);
                throw e;
            }
        }
        return count;
    }
}
