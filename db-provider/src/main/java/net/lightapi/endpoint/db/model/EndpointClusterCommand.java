package net.lightapi.endpoint.db.model;

/**
 * A cluster command as configured on an endpoint type. The incoming and outgoing flags come from the
 * endpoint type association.
 */
public final class EndpointClusterCommand {
    private final long id;
    private final String name;
    private final int code;
    private final Integer manufacturerCode;
    private final Boolean optional;
    private final String source;
    private final Boolean incoming;
    private final Boolean outgoing;
    private final String hexCode;

    public EndpointClusterCommand(long id, String name, int code, Integer manufacturerCode, Boolean optional,
                                  String source, Boolean incoming, Boolean outgoing, String hexCode) {
        this.id = id;
        this.name = name;
        this.code = code;
        this.manufacturerCode = manufacturerCode;
        this.optional = optional;
        this.source = source;
        this.incoming = incoming;
        this.outgoing = outgoing;
        this.hexCode = hexCode;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getCode() {
        return code;
    }

    public Integer getManufacturerCode() {
        return manufacturerCode;
    }

    public Boolean getOptional() {
        return optional;
    }

    public String getSource() {
        return source;
    }

    public Boolean getIncoming() {
        return incoming;
    }

    public Boolean getOutgoing() {
        return outgoing;
    }

    public String getHexCode() {
        return hexCode;
    }

    @Override
    public String toString() {
        return "EndpointClusterCommand{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", hexCode='" + hexCode + '\'' +
                ", source='" + source + '\'' +
                ", incoming=" + incoming +
                ", outgoing=" + outgoing +
                '}';
    }
}
