package com.qubi.netmap.core.runtime;

import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.DeviceStatus;
import com.qubi.netmap.core.model.EventKind;
import com.qubi.netmap.core.normalize.EventRoutes;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class NormalizerRegistryTest {

    private final NormalizerRegistry registry = NormalizerRegistry.withDefaults(EventRoutes.defaults());

    @Test
    void bundledRoutesCoverBothEventFamilies() {
        EventRoutes routes = EventRoutes.defaults();
        assertEquals(EventKind.SIGHTED, routes.kindOf("deviceFound").orElseThrow());
        assertEquals(EventKind.SIGHTED, routes.kindOf("discovery.deviceFound").orElseThrow());
        assertEquals(EventKind.SIGHTED, routes.kindOf("deviceStatusChanged").orElseThrow());
        assertEquals(EventKind.REMOVED, routes.kindOf("device.deleted").orElseThrow());
        assertEquals(EventKind.SNAPSHOT, routes.kindOf("initialData").orElseThrow());
        assertEquals(EventKind.METRICS, routes.kindOf("device.metrics").orElseThrow());
        assertTrue(routes.kindOf("chat.message").isEmpty());
    }

    @Test
    void sightedEnvelope() {
        DeviceEvent e = registry.decodeLine(
                "{\"event\":\"deviceFound\",\"data\":{\"device\":{\"ip\":\"10.0.0.2\",\"status\":\"online\"}}}");
        DeviceEvent.Sighted s = assertInstanceOf(DeviceEvent.Sighted.class, e);
        assertEquals("10.0.0.2", s.device().address());
        assertEquals(DeviceStatus.ONLINE, s.device().status());
    }

    @Test
    void alternateEnvelopeKeys() {
        DeviceEvent e = registry.decodeLine("{\"type\":\"device.updated\",\"payload\":{\"id\":\"r1\",\"ip\":\"10.0.0.1\"}}");
        assertInstanceOf(DeviceEvent.Sighted.class, e);
    }

    @Test
    void removedAcceptsObjectOrBareId() {
        DeviceEvent a = registry.decodeLine("{\"event\":\"deviceRemoved\",\"data\":{\"deviceId\":\"abc\"}}");
        assertEquals("abc", assertInstanceOf(DeviceEvent.Removed.class, a).id());

        DeviceEvent b = registry.decodeLine("{\"event\":\"device.deleted\",\"data\":\"xyz\"}");
        assertEquals("xyz", assertInstanceOf(DeviceEvent.Removed.class, b).id());
    }

    @Test
    void snapshotSkipsBadEntries() {
        DeviceEvent e = registry.decodeLine(
                "{\"event\":\"initialData\",\"data\":{\"devices\":[{\"id\":\"a\"},{\"name\":\"no identity\"},{\"ip\":\"10.0.0.9\"}]}}");
        DeviceEvent.Snapshot s = assertInstanceOf(DeviceEvent.Snapshot.class, e);
        assertEquals(2, s.devices().size());
    }

    @Test
    void pullBodyIsReadAsSnapshot() {
        DeviceEvent e = registry.decodeSnapshot("[{\"id\":\"a\",\"ip\":\"10.0.0.1\"},{\"id\":\"b\",\"ip\":\"10.0.0.2\"}]");
        assertEquals(2, assertInstanceOf(DeviceEvent.Snapshot.class, e).devices().size());
        assertNull(registry.decodeSnapshot("<html>oops</html>"));
    }

    @Test
    void metricsEvent() {
        DeviceEvent e = registry.decodeLine("""
                {"event":"device.metrics","data":{"deviceId":"abc",
                 "metrics":{"responseTime":8,"lastSeen":"2024-05-01T10:00:00Z","vendor":"HP"}}}
                """.replace("\n", ""));
        DeviceEvent.Metrics m = assertInstanceOf(DeviceEvent.Metrics.class, e);
        assertEquals("abc", m.deviceId());
        assertEquals(8L, m.metrics().get("responseTime"));
        assertEquals("HP", m.metrics().get("vendor"));
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), m.lastSeen());
    }

    @Test
    void malformedInputIsDropped() {
        assertNull(registry.decodeLine("{not json"));
        assertNull(registry.decodeLine("{\"event\":\"unknownThing\",\"data\":{}}"));
        assertNull(registry.decodeLine("{\"data\":{\"id\":\"a\"}}"));
        assertNull(registry.decodeLine("{\"event\":\"deviceFound\",\"data\":{\"name\":\"x\"}}"));
        assertNull(registry.decodeLine("{\"event\":\"device.metrics\",\"data\":{\"metrics\":{}}}"));
        assertNull(registry.decodeLine(null));
    }

    @Test
    void customRoutesFromYaml() {
        String yaml = """
                envelope:
                  event_keys: [topic]
                  data_keys: [body]
                routes:
                  - kind: removed
                    events: [gone]
                """;
        EventRoutes routes = new EventRoutes(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        NormalizerRegistry custom = NormalizerRegistry.withDefaults(routes);
        assertInstanceOf(DeviceEvent.Removed.class, custom.decodeLine("{\"topic\":\"gone\",\"body\":{\"id\":\"a\"}}"));
        assertNull(custom.decodeLine("{\"event\":\"deviceFound\",\"data\":{\"id\":\"a\"}}"));
    }

    @Test
    void brokenRoutesFileFailsFast() {
        String yaml = "routes:\n  - kind: NOPE\n    events: [x]\n";
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new EventRoutes(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertEquals("Error loading event routes", ex.getMessage());
    }
}
