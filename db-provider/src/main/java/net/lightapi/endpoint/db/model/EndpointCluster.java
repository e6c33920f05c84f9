package net.lightapi.endpoint.db.model;

/**
 * A cluster enabled on an endpoint type.
 */
public final class EndpointCluster {
    private final long clusterId;
    private final long endpointTypeId;
    private final long endpointTypeClusterId;
    private final String hexCode;
    private final int code;
    private final String name;
    private final Integer manufacturerCode;
    private final String side;

    public EndpointCluster(long clusterId, long endpointTypeId, long endpointTypeClusterId, String hexCode,
                           int code, String name, Integer manufacturerCode, String side) {
        this.clusterId = clusterId;
        this.endpointTypeId = endpointTypeId;
        this.endpointTypeClusterId = endpointTypeClusterId;
        this.hexCode = hexCode;
        this.code = code;
        this.name = name;
        this.manufacturerCode = manufacturerCode;
        this.side = side;
    }

    public long getClusterId() {
        return clusterId;
    }

    public long getEndpointTypeId() {
        return endpointTypeId;
    }

    public long getEndpointTypeClusterId() {
        return endpointTypeClusterId;
    }

    public String getHexCode() {
        return hexCode;
    }

    public int getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public Integer getManufacturerCode() {
        return manufacturerCode;
    }

    /** Either {@code client} or {@code server}, see {@link net.lightapi.endpoint.EndpointConstants}. */
    public String getSide() {
        return side;
    }

    @Override
    public String toString() {
        return "EndpointCluster{" +
                "clusterId=" + clusterId +
                ", endpointTypeId=" + endpointTypeId +
                ", endpointTypeClusterId=" + endpointTypeClusterId +
                ", hexCode='" + hexCode + '\'' +
                ", code=" + code +
                ", name='" + name + '\'' +
                ", manufacturerCode=" + manufacturerCode +
                ", side='" + side + '\'' +
                '}';
    }
}
