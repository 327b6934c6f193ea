package com.warden.authz.model;

import java.util.Map;

final class AttributeMaps {

    private AttributeMaps() {
        // utility class
    }

    static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
