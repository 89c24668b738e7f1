package com.qubi.netmap.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.qubi.netmap.core.model.DeviceEvent;
import com.qubi.netmap.core.model.EventKind;

public interface EventNormalizer {
  /** ¿Este normalizador decodifica este tipo de evento? */
  boolean supports(EventKind kind);
  /** Decoded event, or null when the payload does not have the expected shape. */
  DeviceEvent normalize(JsonNode payload);
}
