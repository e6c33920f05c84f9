package net.lightapi.endpoint.db.model;

/**
 * An endpoint row of a session. References are nullable because the store may null them on delete of the
 * referenced row.
 */
public final class Endpoint {
    private final long id;
    private final Long sessionRef;
    private final Integer endpointIdentifier;
    private final Long endpointTypeRef;
    private final Integer profile;
    private final Integer networkIdentifier;
    private final Integer deviceVersion;
    private final Integer deviceIdentifier;

    public Endpoint(long id, Long sessionRef, Integer endpointIdentifier, Long endpointTypeRef, Integer profile,
                    Integer networkIdentifier, Integer deviceVersion, Integer deviceIdentifier) {
        this.id = id;
        this.sessionRef = sessionRef;
        this.endpointIdentifier = endpointIdentifier;
        this.endpointTypeRef = endpointTypeRef;
        this.profile = profile;
        this.networkIdentifier = networkIdentifier;
        this.deviceVersion = deviceVersion;
        this.deviceIdentifier = deviceIdentifier;
    }

    public long getId() {
        return id;
    }

    public Long getSessionRef() {
        return sessionRef;
    }

    public Integer getEndpointIdentifier() {
        return endpointIdentifier;
    }

    public Long getEndpointTypeRef() {
        return endpointTypeRef;
    }

    public Integer getProfile() {
        return profile;
    }

    public Integer getNetworkIdentifier() {
        return networkIdentifier;
    }

    public Integer getDeviceVersion() {
        return deviceVersion;
    }

    public Integer getDeviceIdentifier() {
        return deviceIdentifier;
    }

    @Override
    public String toString() {
        return "Endpoint{" +
                "id=" + id +
                ", sessionRef=" + sessionRef +
                ", endpointIdentifier=" + endpointIdentifier +
                ", endpointTypeRef=" + endpointTypeRef +
                ", profile=" + profile +
                ", networkIdentifier=" + networkIdentifier +
                ", deviceVersion=" + deviceVersion +
                ", deviceIdentifier=" + deviceIdentifier +
                '}';
    }
}
