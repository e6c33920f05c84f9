package net.lightapi.endpoint.db.persistence;

import net.lightapi.endpoint.db.model.Endpoint;
import net.lightapi.endpoint.db.model.EndpointCluster;
import net.lightapi.endpoint.db.model.EndpointClusterAttribute;
import net.lightapi.endpoint.db.model.EndpointClusterCommand;
import net.lightapi.endpoint.db.model.EndpointColumn;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

public interface EndpointPersistence {
    List<EndpointCluster> selectEndpointClusters(Connection conn, long endpointTypeId) throws SQLException;
    List<EndpointClusterAttribute> selectEndpointClusterAttributes(Connection conn, long clusterId, String side, long endpointTypeId) throws SQLException;
    List<EndpointClusterCommand> selectEndpointClusterCommands(Connection conn, long clusterId, long endpointTypeId) throws SQLException;
    long insertEndpoint(Connection conn, long sessionId, int endpointIdentifier, long endpointTypeRef, int networkIdentifier,
                        int profileIdentifier, int endpointVersion, int deviceIdentifier) throws SQLException;
    int deleteEndpoint(Connection conn, long id) throws SQLException;
    Endpoint selectEndpoint(Connection conn, long endpointId) throws SQLException;
    List<Endpoint> selectAllEndpoints(Connection conn, long sessionId) throws SQLException;
    int selectCountOfEndpointsWithGivenEndpointIdentifier(Connection conn, int endpointIdentifier, long sessionId) throws SQLException;
    int updateEndpoint(Connection conn, long sessionId, long endpointId, Map<EndpointColumn, ?> changes) throws SQLException;
}
