// plugins/events/RemovedEventNormalizer.java
package com.qubi.netmap.plugins.events;
import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.EventKind;
import com.qubi.netmap.core.spi.EventNormalizer;
import java.util.List;

public class RemovedEventNormalizer implements EventNormalizer {
  private static final List<String> ID_KEYS = List.of("id", "deviceId", "_id");

  @Override public boolean supports(EventKind kind) {
    return kind == EventKind.REMOVED;
  }

  @Override public DeviceEvent normalize(JsonNode payload) {
    if (payload == null) return null;
    // también acepta el id como string suelto
    if (payload.isTextual() || payload.isNumber()) {
      String id = payload.asText().trim();
      return id.isEmpty() ? null : new DeviceEvent.Removed(id);
    }
    if (!payload.isObject()) return null;
    JsonNode node = payload.has("device") && payload.get("device").isObject() ? payload.get("device") : payload;
    for (String k : ID_KEYS) {
      JsonNode v = node.get(k);
      if (v != null && !v.isNull() && !v.isContainerNode() && !v.asText().isBlank()) {
        return new DeviceEvent.Removed(v.asText().trim());
      }
    }
    return null;
  }
}
