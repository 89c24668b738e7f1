package com.qubi.netmap.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.netmap.core.layout.LayoutStrategy;
import com.qubi.netmap.core.topology.TopologyInferencer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonSupportTest {

    private static Device router() {
        return Device.builder().id("a").address("10.0.0.1").displayName("core")
                .kind(DeviceKind.ROUTER).status(DeviceStatus.ONLINE)
                .lastSeen(Instant.parse("2024-05-01T10:00:00Z"))
                .metric("vendor", "Cisco")
                .position(new Position(120.5, 80))
                .build();
    }

    @Test
    void deviceWritesItsFields() {
        JsonNode tree = JsonSupport.readTree(JsonSupport.toJson(router()));
        assertNotNull(tree);
        assertEquals("a", tree.path("id").asText());
        assertEquals("10.0.0.1", tree.path("address").asText());
        assertEquals("ROUTER", tree.path("kind").asText());
        assertEquals("2024-05-01T10:00:00Z", tree.path("lastSeen").asText());
        assertEquals("Cisco", tree.path("metrics").path("vendor").asText());
        assertEquals(120.5, tree.path("position").path("x").asDouble());
        // derivados no se serializan
        assertFalse(tree.has("identityKey"));
        assertFalse(tree.has("online"));
    }

    @Test
    void deviceRoundTrip() {
        Device d = router();
        assertEquals(d, JsonSupport.fromJson(JsonSupport.toJson(d), Device.class));

        Device bare = Device.builder().address("10.0.0.9").build();
        String json = JsonSupport.toJson(bare);
        assertFalse(json.contains("\"id\""), "los nulos se omiten");
        assertEquals(bare, JsonSupport.fromJson(json, Device.class));
    }

    @Test
    void topologyViewRoundTrip() {
        List<Device> devices = List.of(router(),
                Device.builder().id("w").address("10.0.0.20").kind(DeviceKind.WORKSTATION)
                        .status(DeviceStatus.ONLINE).position(new Position(300, 400)).build());
        List<Edge> edges = new TopologyInferencer().infer(devices);
        TopologyView view = new TopologyView(devices, edges, AggregateCounters.of(devices, edges),
                ConnectionState.CONNECTED, false, LayoutStrategy.CLUSTERED, 7,
                Instant.parse("2024-05-01T10:00:05Z"));

        String json = JsonSupport.toJson(view);
        TopologyView back = JsonSupport.fromJson(json, TopologyView.class);
        assertEquals(view, back);
        assertEquals("a", JsonSupport.readTree(json).path("devices").path(0).path("id").asText());
    }
}
