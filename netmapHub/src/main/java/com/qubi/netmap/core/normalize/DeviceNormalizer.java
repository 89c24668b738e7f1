package com.qubi.netmap.core.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.netmap.core.model.Device;
import com.qubi.netmap.core.model.DeviceKind;
import com.qubi.netmap.core.model.DeviceStatus;
import com.qubi.netmap.core.model.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts heterogeneous device payloads into one canonical {@link Device}.
 *
 * <p>Accepted shapes:
 * <ul>
 *   <li>{@code {device: {...}}} or a bare object (one level of nesting is unwrapped)</li>
 *   <li>address from {@code ip}, {@code ipAddress} or {@code address}</li>
 *   <li>id from {@code id}, {@code _id} or {@code deviceId}</li>
 *   <li>status from {@code status} or {@code state}, case-insensitive, {@code up}/{@code down} included</li>
 *   <li>{@code openPorts} array kept as a list metric</li>
 * </ul>
 * Returns {@code null} when the payload does not identify a device. Never throws.
 */
public final class DeviceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DeviceNormalizer.class);

    static final List<String> ADDRESS_KEYS = List.of("ip", "ipAddress", "address");
    static final List<String> ID_KEYS = List.of("id", "_id", "deviceId");
    static final List<String> STATUS_KEYS = List.of("status", "state");
    static final List<String> KIND_KEYS = List.of("type", "deviceType", "kind");
    static final List<String> NAME_KEYS = List.of("name", "hostname", "displayName");

    public Device normalize(String json) {
        return normalize(JsonSupport.readTree(json));
    }

    public Device normalize(JsonNode raw) {
        try {
            return doNormalize(raw);
        } catch (RuntimeException ex) {
            log.debug("[normalize] dropping payload: {}", ex.toString());
            return null;
        }
    }

    private Device doNormalize(JsonNode raw) {
        if (raw == null || !raw.isObject()) return null;
        JsonNode node = raw.has("device") && raw.get("device").isObject() ? raw.get("device") : raw;

        String address = firstText(node, ADDRESS_KEYS);
        String id = firstText(node, ID_KEYS);
        if (address == null && id == null) return null;

        JsonNode metricsNode = node.path("metrics");
        Device.Builder b = Device.builder()
                .id(id)
                .address(address)
                .displayName(firstText(node, NAME_KEYS))
                .kind(DeviceKind.fromString(firstText(node, KIND_KEYS)))
                .status(DeviceStatus.fromString(firstText(node, STATUS_KEYS)))
                .lastSeen(parseInstant(node.has("lastSeen") ? node.get("lastSeen") : metricsNode.get("lastSeen")));

        // métricas anidadas primero, los campos de primer nivel pisan
        if (metricsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = metricsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> en = it.next();
                if ("lastSeen".equals(en.getKey())) continue;
                b.metric(en.getKey(), metricValue(en.getValue()));
            }
        }
        b.metric("responseTime", scalar(node.get("responseTime")));
        String mac = firstText(node, List.of("mac", "macAddress"));
        if (mac != null) b.metric("macAddress", mac);
        b.metric("vendor", text(node.get("vendor")));
        b.metric("openPorts", scalarList(node.get("openPorts")));
        return b.build();
    }

    static String firstText(JsonNode node, List<String> keys) {
        for (String k : keys) {
            String v = text(node.get(k));
            if (v != null) return v;
        }
        return null;
    }

    static String text(JsonNode v) {
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    /** ISO-8601 text or epoch millis; null when neither. */
    public static Instant parseInstant(JsonNode v) {
        if (v == null || v.isNull()) return null;
        if (v.isNumber()) return Instant.ofEpochMilli(v.asLong());
        String s = text(v);
        if (s == null) return null;
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    private static Object metricValue(JsonNode v) {
        return v != null && v.isArray() ? scalarList(v) : scalar(v);
    }

    /** Array of scalars as an immutable list; nested containers and nulls are skipped. */
    private static List<Object> scalarList(JsonNode v) {
        if (v == null || !v.isArray()) return null;
        List<Object> out = new ArrayList<>(v.size());
        for (JsonNode item : v) {
            Object o = scalar(item);
            if (o != null) out.add(o);
        }
        return List.copyOf(out);
    }

    private static Object scalar(JsonNode v) {
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        if (v.isIntegralNumber()) return v.asLong();
        if (v.isNumber()) return v.asDouble();
        if (v.isBoolean()) return v.asBoolean();
        return text(v);
    }
}
