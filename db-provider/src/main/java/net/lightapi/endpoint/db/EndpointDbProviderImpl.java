package net.lightapi.endpoint.db;

import com.networknt.config.JsonMapper;
import com.networknt.monad.Failure;
import com.networknt.monad.Result;
import com.networknt.monad.Success;
import com.networknt.status.Status;
import net.lightapi.endpoint.db.model.Endpoint;
import net.lightapi.endpoint.db.model.EndpointCluster;
import net.lightapi.endpoint.db.model.EndpointClusterAttribute;
import net.lightapi.endpoint.db.model.EndpointClusterCommand;
import net.lightapi.endpoint.db.model.EndpointColumn;
import net.lightapi.endpoint.db.persistence.EndpointPersistence;
import net.lightapi.endpoint.db.persistence.EndpointPersistenceImpl;
import net.lightapi.endpoint.db.util.SqlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static net.lightapi.endpoint.EndpointConstants.*;

public class EndpointDbProviderImpl implements EndpointDbProvider {
    public static final Logger logger = LoggerFactory.getLogger(EndpointDbProviderImpl.class);

    private final EndpointPersistence endpointPersistence;
    private final Supplier<DataSource> dataSource;

    public EndpointDbProviderImpl() {
        this(() -> SqlDbStartupHook.ds);
    }

    public EndpointDbProviderImpl(Supplier<DataSource> dataSource) {
        this.endpointPersistence = new EndpointPersistenceImpl();
        this.dataSource = dataSource;
    }

    // --- Caller owned connection ---
    @Override public List<EndpointCluster> selectEndpointClusters(Connection conn, long endpointTypeId) throws SQLException { return endpointPersistence.selectEndpointClusters(conn, endpointTypeId); }
    @Override public List<EndpointClusterAttribute> selectEndpointClusterAttributes(Connection conn, long clusterId, String side, long endpointTypeId) throws SQLException { return endpointPersistence.selectEndpointClusterAttributes(conn, clusterId, side, endpointTypeId); }
    @Override public List<EndpointClusterCommand> selectEndpointClusterCommands(Connection conn, long clusterId, long endpointTypeId) throws SQLException { return endpointPersistence.selectEndpointClusterCommands(conn, clusterId, endpointTypeId); }
    @Override public long insertEndpoint(Connection conn, long sessionId, int endpointIdentifier, long endpointTypeRef, int networkIdentifier, int profileIdentifier, int endpointVersion, int deviceIdentifier) throws SQLException { return endpointPersistence.insertEndpoint(conn, sessionId, endpointIdentifier, endpointTypeRef, networkIdentifier, profileIdentifier, endpointVersion, deviceIdentifier); }
    @Override public int deleteEndpoint(Connection conn, long id) throws SQLException { return endpointPersistence.deleteEndpoint(conn, id); }
    @Override public Endpoint selectEndpoint(Connection conn, long endpointId) throws SQLException { return endpointPersistence.selectEndpoint(conn, endpointId); }
    @Override public List<Endpoint> selectAllEndpoints(Connection conn, long sessionId) throws SQLException { return endpointPersistence.selectAllEndpoints(conn, sessionId); }
    @Override public int selectCountOfEndpointsWithGivenEndpointIdentifier(Connection conn, int endpointIdentifier, long sessionId) throws SQLException { return endpointPersistence.selectCountOfEndpointsWithGivenEndpointIdentifier(conn, endpointIdentifier, sessionId); }
    @Override public int updateEndpoint(Connection conn, long sessionId, long endpointId, Map<EndpointColumn, ?> changes) throws SQLException { return endpointPersistence.updateEndpoint(conn, sessionId, endpointId, changes); }

    // --- Pooled connection, JSON result ---
    @Override
    public Result<String> getEndpointClusters(long endpointTypeId) {
        Result<String> result = null;
        try (Connection connection = dataSource.get().getConnection()) {
            List<EndpointCluster> clusters = endpointPersistence.selectEndpointClusters(connection, endpointTypeId);
            Map<String, Object> map = new HashMap<>();
            map.put(TOTAL, clusters.size());
            map.put(CLUSTERS, clusters);
            result = Success.of(JsonMapper.toJson(map));
        } catch (SQLException e) {
            logger.error("SQLException:", e);
            result = Failure.of(new Status(SQL_EXCEPTION, e.getMessage()));
        } catch (Exception e) {
            logger.error("Exception:", e);
            result = Failure.of(new Status(GENERIC_EXCEPTION, e.getMessage()));
        }
        return result;
    }

    @Override
    public Result<String> getEndpointClusterAttributes(long clusterId, String side, long endpointTypeId) {
        Result<String> result = null;
        try (Connection connection = dataSource.get().getConnection()) {
            List<EndpointClusterAttribute> attributes = endpointPersistence.selectEndpointClusterAttributes(connection, clusterId, side, endpointTypeId);
            Map<String, Object> map = new HashMap<>();
            map.put(TOTAL, attributes.size());
            map.put(ATTRIBUTES, attributes);
            result = Success.of(JsonMapper.toJson(map));
        } catch (SQLException e) {
            logger.error("SQLException:", e);
            result = Failure.of(new Status(SQL_EXCEPTION, e.getMessage()));
        } catch (Exception e) {
            logger.error("Exception:", e);
            result = Failure.of(new Status(GENERIC_EXCEPTION, e.getMessage()));
        }
        return result;
    }

    @Override
    public Result<String> getEndpointClusterCommands(long clusterId, long endpointTypeId) {
        Result<String> result = null;
        try (Connection connection = dataSource.get().getConnection()) {
            List<EndpointClusterCommand> commands = endpointPersistence.selectEndpointClusterCommands(connection, clusterId, endpointTypeId);
            Map<String, Object> map = new HashMap<>();
            map.put(TOTAL, commands.size());
            map.put(COMMANDS, commands);
            result = Success.of(JsonMapper.toJson(map));
        } catch (SQLException e) {
            logger.error("SQLException:", e);
            result = Failure.of(new Status(SQL_EXCEPTION, e.getMessage()));
        } catch (Exception e) {
            logger.error("Exception:", e);
            result = Failure.of(new Status(GENERIC_EXCEPTION, e.getMessage()));
        }
        return result;
    }

    @Override
    public Result<String> getEndpointById(long endpointId) {
        Result<String> result = null;
        try (Connection connection = dataSource.get().getConnection()) {
            Endpoint endpoint = endpointPersistence.selectEndpoint(connection, endpointId);
            if (endpoint != null) {
                result = Success.of(JsonMapper.toJson(endpoint));
            } else {
                result = Failure.of(new Status(OBJECT_NOT_FOUND, "endpoint", endpointId));
            }
        } catch (SQLException e) {
            logger.error("SQLException:", e);
            result = Failure.of(new Status(SQL_EXCEPTION, e.getMessage()));
        } catch (Exception e) {
            logger.error("Exception:", e);
            result = Failure.of(new Status(GENERIC_EXCEPTION, e.getMessage()));
        }
        return result;
    }

    @Override
    public Result<String> getEndpointsBySession(long sessionId) {
        Result<String> result = null;
        try (Connection connection = dataSource.get().getConnection()) {
            List<Endpoint> endpoints = endpointPersistence.selectAllEndpoints(connection, sessionId);
            Map<String, Object> map = new HashMap<>();
            map.put(TOTAL, endpoints.size());
            map.put(ENDPOINTS, endpoints);
            result = Success.of(JsonMapper.toJson(map));
        } catch (SQLException e) {
            logger.error("SQLException:", e);
            result = Failure.of(new Status(SQL_EXCEPTION, e.getMessage()));
        } catch (Exception e) {
            logger.error("Exception:", e);
            result = Failure.of(new Status(GENERIC_EXCEPTION, e.getMessage()));
        }
        return result;
    }

    @Override
    public Result<Long> createEndpoint(long sessionId, int endpointIdentifier, long endpointTypeRef, int networkIdentifier,
                                       int profileIdentifier, int endpointVersion, int deviceIdentifier) {
        Result<Long> result = null;
        try {
            long id = SqlUtil.transactWithResult(dataSource.get().getConnection(), connection ->
                    endpointPersistence.insertEndpoint(connection, sessionId, endpointIdentifier, endpointTypeRef,
                            networkIdentifier, profileIdentifier, endpointVersion, deviceIdentifier));
            result = Success.of(id);
        } catch (SQLException e) {
            logger.error("SQLException:", e);
            result = Failure.of(new Status(SQL_EXCEPTION, e.getMessage()));
        } catch (Exception e) {
            logger.error("Exception:", e);
            result = Failure.of(new Status(GENERIC_EXCEPTION, e.getMessage()));
        }
        return result;
    }

    @Override
    public Result<Integer> removeEndpoint(long endpointId) {
        Result<Integer> result = null;
        try {
            int count = SqlUtil.transactWithResult(dataSource.get().getConnection(), connection ->
                    endpointPersistence.deleteEndpoint(connection, endpointId));
            result = Success.of(count);
        } catch (SQLException e) {
            logger.error("SQLException:", e);
            result = Failure.of(new Status(SQL_EXCEPTION, e.getMessage()));
        } catch (Exception e) {
            logger.error("Exception:", e);
            result = Failure.of(new Status(GENERIC_EXCEPTION, e.getMessage()));
        }
        return result;
    }
}
