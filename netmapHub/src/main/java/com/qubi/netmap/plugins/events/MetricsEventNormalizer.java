// plugins/events/MetricsEventNormalizer.java
package com.qubi.netmap.plugins.events;
import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.EventKind;
import com.qubi.netmap.core.normalize.DeviceNormalizer;
import com.qubi.netmap.core.spi.EventNormalizer;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@code {deviceId, metrics: {responseTime, lastSeen, ...}}}. */
public class MetricsEventNormalizer implements EventNormalizer {

  @Override public boolean supports(EventKind kind) {
    return kind == EventKind.METRICS;
  }

  @Override public DeviceEvent normalize(JsonNode payload) {
    if (payload == null || !payload.isObject()) return null;
    JsonNode idNode = payload.has("deviceId") ? payload.get("deviceId") : payload.get("id");
    if (idNode == null || idNode.isNull() || idNode.isContainerNode() || idNode.asText().isBlank()) return null;

    Map<String, Object> metrics = new LinkedHashMap<>();
    Instant lastSeen = null;
    JsonNode m = payload.path("metrics");
    if (m.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = m.fields();
      while (it.hasNext()) {
        var en = it.next();
        JsonNode v = en.getValue();
        if ("lastSeen".equals(en.getKey())) {
          lastSeen = DeviceNormalizer.parseInstant(v);
        } else if (v.isIntegralNumber()) {
          metrics.put(en.getKey(), v.asLong());
        } else if (v.isNumber()) {
          metrics.put(en.getKey(), v.asDouble());
        } else if (v.isTextual() && !v.asText().isBlank()) {
          metrics.put(en.getKey(), v.asText());
        }
      }
    }
    return new DeviceEvent.Metrics(idNode.asText().trim(), metrics, lastSeen);
  }

}
