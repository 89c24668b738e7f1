// plugins/events/SnapshotEventNormalizer.java
package com.qubi.netmap.plugins.events;
import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.netmap.core.model.Device;
import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.EventKind;
import com.qubi.netmap.core.normalize.DeviceNormalizer;
import com.qubi.netmap.core.spi.EventNormalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Accepts {@code {devices: [...]}} or a bare array. Entries that do not normalize are skipped,
 * the rest of the snapshot is kept.
 */
public class SnapshotEventNormalizer implements EventNormalizer {
  private final DeviceNormalizer devices;

  public SnapshotEventNormalizer(DeviceNormalizer devices) {
    this.devices = devices;
  }

  @Override public boolean supports(EventKind kind) {
    return kind == EventKind.SNAPSHOT;
  }

  @Override public DeviceEvent normalize(JsonNode payload) {
    if (payload == null) return null;
    JsonNode arr = payload.isArray() ? payload : payload.path("devices");
    if (!arr.isArray()) return null;
    List<Device> out = new ArrayList<>(arr.size());
    for (JsonNode item : arr) {
      Device d = devices.normalize(item);
      if (d != null) out.add(d);
    }
    return new DeviceEvent.Snapshot(out);
  }
}
