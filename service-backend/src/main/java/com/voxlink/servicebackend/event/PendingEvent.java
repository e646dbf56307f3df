package com.voxlink.servicebackend.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public record PendingEvent(EventType type, Map<String, String> payload, Instant ts) {

    public PendingEvent {
        payload = Map.copyOf(payload);
    }

    /**
     * Flat wire form: {@code type}, then the payload fields, then {@code ts} as ISO-8601.
     */
    public Map<String, Object> toWire() {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("type", type.wireName());
        wire.putAll(payload);
        wire.put("ts", ts.toString());
        return wire;
    }
}
