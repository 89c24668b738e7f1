// plugins/events/SightedEventNormalizer.java
package com.qubi.netmap.plugins.events;
import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.netmap.core.model.Device;
import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.EventKind;
import com.qubi.netmap.core.normalize.DeviceNormalizer;
import com.qubi.netmap.core.spi.EventNormalizer;

public class SightedEventNormalizer implements EventNormalizer {
  private final DeviceNormalizer devices;

  public SightedEventNormalizer(DeviceNormalizer devices) {
    this.devices = devices;
  }

  @Override public boolean supports(EventKind kind) {
    return kind == EventKind.SIGHTED;
  }

  @Override public DeviceEvent normalize(JsonNode payload) {
    Device d = devices.normalize(payload);
    return d == null ? null : new DeviceEvent.Sighted(d);
  }
}
