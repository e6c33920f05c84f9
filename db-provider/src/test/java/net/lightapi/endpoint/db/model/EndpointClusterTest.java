package net.lightapi.endpoint.db.model;

import org.junit.jupiter.api.Test;

import static net.lightapi.endpoint.EndpointConstants.SIDE_SERVER;
import static org.junit.jupiter.api.Assertions.*;

public class EndpointClusterTest {

    @Test
    public void testToStringIncludesCode() {
        EndpointCluster cluster = new EndpointCluster(4, 1, 7, "0xFC00", 0xFC00, "Manufacturer Specific", 4098, SIDE_SERVER);
        String text = cluster.toString();
        assertTrue(text.contains("code=64512"), text);
        assertTrue(text.contains("hexCode='0xFC00'"), text);
        assertTrue(text.contains("manufacturerCode=4098"), text);
        assertTrue(text.contains("side='server'"), text);
    }
}
