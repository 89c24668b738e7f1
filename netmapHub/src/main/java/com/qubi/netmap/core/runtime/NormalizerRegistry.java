// core/runtime/NormalizerRegistry.java
package com.qubi.netmap.core.runtime;
import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.EventKind;
import com.qubi.netmap.core.model.JsonSupport;
import com.qubi.netmap.core.normalize.DeviceNormalizer;
import com.qubi.netmap.core.normalize.EventRoutes;
import com.qubi.netmap.core.spi.EventNormalizer;
import com.qubi.netmap.plugins.events.MetricsEventNormalizer;
import com.qubi.netmap.plugins.events.RemovedEventNormalizer;
import com.qubi.netmap.plugins.events.SightedEventNormalizer;
import com.qubi.netmap.plugins.events.SnapshotEventNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.List;
import java.util.Optional;

/**
 * Decodes raw stream lines and pull bodies into {@link DeviceEvent}s. Total: every failure
 * ends as {@code null} and a debug log line, never as an exception.
 */
public class NormalizerRegistry {
  private static final Logger log = LoggerFactory.getLogger(NormalizerRegistry.class);

  private final EventRoutes routes;
  private final List<EventNormalizer> normalizers;

  public NormalizerRegistry(EventRoutes routes, List<EventNormalizer> ns){
    this.routes = routes;
    this.normalizers = List.copyOf(ns);
  }

  public static NormalizerRegistry withDefaults(EventRoutes routes) {
    DeviceNormalizer devices = new DeviceNormalizer();
    return new NormalizerRegistry(routes, List.of(
        new SightedEventNormalizer(devices),
        new RemovedEventNormalizer(),
        new SnapshotEventNormalizer(devices),
        new MetricsEventNormalizer()));
  }

  /** One stream line: {@code {"event": name, "data": payload}}. */
  public DeviceEvent decodeLine(String line) {
    JsonNode envelope = JsonSupport.readTree(line);
    if (envelope == null || !envelope.isObject()) {
      log.debug("[drop] not a JSON envelope: {}", abbreviate(line));
      return null;
    }
    String name = firstText(envelope, routes.eventKeys());
    JsonNode data = firstNode(envelope, routes.dataKeys());
    return decode(name, data);
  }

  public DeviceEvent decode(String eventName, JsonNode payload) {
    Optional<EventKind> kind = routes.kindOf(eventName);
    if (kind.isEmpty()) {
      log.debug("[drop] unrouted event '{}'", eventName);
      return null;
    }
    return apply(kind.get(), payload);
  }

  /** A pull response body; always read as a snapshot. */
  public DeviceEvent decodeSnapshot(String body) {
    return apply(EventKind.SNAPSHOT, JsonSupport.readTree(body));
  }

  public DeviceEvent apply(EventKind kind, JsonNode payload) {
    for (var n : normalizers) {
      if (!n.supports(kind)) continue;
      try {
        DeviceEvent out = n.normalize(payload);
        if (out != null) return out;
      } catch (RuntimeException ex) {
        log.debug("[drop] {} normalizer failed: {}", kind, ex.toString());
      }
    }
    log.debug("[drop] malformed {} payload", kind);
    return null;
  }

  private static String firstText(JsonNode node, List<String> keys) {
    for (String k : keys) {
      JsonNode v = node.get(k);
      if (v != null && v.isTextual() && !v.asText().isBlank()) return v.asText();
    }
    return null;
  }

  private static JsonNode firstNode(JsonNode node, List<String> keys) {
    for (String k : keys) {
      JsonNode v = node.get(k);
      if (v != null && !v.isNull()) return v;
    }
    return null;
  }

  private static String abbreviate(String s) {
    if (s == null) return "null";
    return s.length() <= 120 ? s : s.substring(0, 120) + "...";
  }
}
