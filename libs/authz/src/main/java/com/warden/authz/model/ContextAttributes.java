package com.warden.authz.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Environment of the request.
 *
 * @param ipAddress client address as a literal
 * @param userAgent client user agent
 * @param timestamp when the request was received
 * @param requestId correlation id
 * @param sessionId session id
 * @param metadata  free-form attributes
 */
public record ContextAttributes(
        String ipAddress,
        String userAgent,
        Instant timestamp,
        String requestId,
        String sessionId,
        Map<String, Object> metadata) {

    public ContextAttributes {
        metadata = metadata == null ? Map.of() : metadata;
    }

    /** A context with only a timestamp. */
    public static ContextAttributes at(Instant timestamp) {
        return new ContextAttributes(null, null, timestamp, null, null, null);
    }

    public Map<String, Object> toAttributeMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        AttributeMaps.putIfNotNull(map, "ipAddress", ipAddress);
        AttributeMaps.putIfNotNull(map, "userAgent", userAgent);
        AttributeMaps.putIfNotNull(map, "timestamp", timestamp);
        AttributeMaps.putIfNotNull(map, "requestId", requestId);
        AttributeMaps.putIfNotNull(map, "sessionId", sessionId);
        map.put("metadata", metadata);
        return map;
    }
}
