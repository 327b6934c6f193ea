package com.warden.observability;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks sensitive entries of free-form attribute metadata before it is written to audit logs.
 * <p>
 * A key is sensitive when its lower-cased form contains one of the configured fragments.
 * Nested maps are redacted recursively; other values are copied as-is.
 */
public final class MetadataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_FRAGMENTS = Set.of(
            "password", "secret", "token", "authorization", "apikey", "api_key",
            "credential", "cookie", "ssn", "cardnumber", "iban"
    );

    private final Set<String> fragments;

    public MetadataRedactor() {
        this(DEFAULT_FRAGMENTS);
    }

    /**
     * @param fragments key fragments treated as sensitive (matched case-insensitively)
     */
    public MetadataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be null or empty");
        }
        Set<String> lowered = new HashSet<>();
        for (String fragment : fragments) {
            lowered.add(fragment.toLowerCase(Locale.ROOT));
        }
        this.fragments = Set.copyOf(lowered);
    }

    /**
     * Returns a copy of {@code metadata} with sensitive values masked. Null returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(metadata.size());
        for (Map.Entry<String, ?> entry : metadata.entrySet()) {
            Object value = entry.getValue();
            if (isSensitive(entry.getKey())) {
                result.put(entry.getKey(), REDACTED);
            } else if (value instanceof Map<?, ?> nested) {
                result.put(entry.getKey(), redact(asStringKeyed(nested)));
            } else {
                result.put(entry.getKey(), value);
            }
        }
        return result;
    }

    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        String lowered = key.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (lowered.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> fragments() {
        return fragments;
    }

    private static Map<String, Object> asStringKeyed(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>(map.size());
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }
}
