package net.lightapi.endpoint;

public class EndpointConstants {

    // cluster side as stored in the SIDE columns
    public static final String SIDE_CLIENT = "client";
    public static final String SIDE_SERVER = "server";

    // prefix put in front of every formatted code
    public static final String HEX_PREFIX = "0x";

    // bit width of the codes
    public static final int COMMAND_CODE_BITS = 8;
    public static final int CLUSTER_CODE_BITS = 16;
    public static final int ATTRIBUTE_CODE_BITS = 16;

    // json keys used by the provider responses
    public static final String CLUSTERS = "clusters";
    public static final String ATTRIBUTES = "attributes";
    public static final String COMMANDS = "commands";
    public static final String ENDPOINTS = "endpoints";
    public static final String TOTAL = "total";
}
