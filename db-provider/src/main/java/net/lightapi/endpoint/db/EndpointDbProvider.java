package net.lightapi.endpoint.db;

import com.networknt.monad.Result;
import com.networknt.service.SingletonServiceFactory;
import net.lightapi.endpoint.db.persistence.EndpointPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contract of the endpoint configuration database. The typed methods inherited from
 * {@link EndpointPersistence} run on a connection owned by the caller. The methods returning
 * {@link Result} borrow a connection from the shared datasource and return JSON.
 */
public interface EndpointDbProvider extends EndpointPersistence {
    Logger logger = LoggerFactory.getLogger(EndpointDbProvider.class);

    String SQL_EXCEPTION = "ERR10017";
    String GENERIC_EXCEPTION = "ERR10014";
    String OBJECT_NOT_FOUND = "ERR11637";

    /**
     * Default method to provide the EndpointDbProvider instance from Singleton Service Factory.
     * If no instance found in factory, it creates an EndpointDbProviderImpl, puts it in factory and returns it.
     *
     * @return instance of the provider
     */
    static EndpointDbProvider getInstance() {
        EndpointDbProvider provider = SingletonServiceFactory.getBean(EndpointDbProvider.class);
        if (provider == null) {
            logger.warn("No EndpointDbProvider configured in service.yml; defaulting to EndpointDbProviderImpl");
            provider = new EndpointDbProviderImpl();
            SingletonServiceFactory.setBean(EndpointDbProvider.class.getName(), provider);
        }
        return provider;
    }

    Result<String> getEndpointClusters(long endpointTypeId);
    Result<String> getEndpointClusterAttributes(long clusterId, String side, long endpointTypeId);
    Result<String> getEndpointClusterCommands(long clusterId, long endpointTypeId);
    Result<String> getEndpointById(long endpointId);
    Result<String> getEndpointsBySession(long sessionId);
    Result<Long> createEndpoint(long sessionId, int endpointIdentifier, long endpointTypeRef, int networkIdentifier,
                                int profileIdentifier, int endpointVersion, int deviceIdentifier);
    Result<Integer> removeEndpoint(long endpointId);
}
