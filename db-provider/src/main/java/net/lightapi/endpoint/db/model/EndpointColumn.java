package net.lightapi.endpoint.db.model;

/**
 * Endpoint columns that can be changed with an update. The constant name is the column name.
 */
public enum EndpointColumn {
    ENDPOINT_IDENTIFIER,
    ENDPOINT_TYPE_REF,
    NETWORK_IDENTIFIER,
    PROFILE,
    DEVICE_VERSION,
    DEVICE_IDENTIFIER;

    public String columnName() {
        return name();
    }
}
