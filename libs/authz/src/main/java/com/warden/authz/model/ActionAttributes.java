package com.warden.authz.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The action being attempted.
 *
 * @param name         action name, e.g. {@code read}
 * @param resourceType resource type the action targets
 * @param metadata     free-form attributes
 */
public record ActionAttributes(String name, String resourceType, Map<String, Object> metadata) {

    public ActionAttributes {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static ActionAttributes of(String name, String resourceType) {
        return new ActionAttributes(name, resourceType, null);
    }

    public Map<String, Object> toAttributeMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        AttributeMaps.putIfNotNull(map, "resourceType", resourceType);
        map.put("metadata", metadata);
        return map;
    }
}
