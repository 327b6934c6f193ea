package com.warden.authz.condition;

import java.util.Map;
import java.util.Optional;

/**
 * The four attribute bags a condition can read, as plain nested maps.
 * <p>
 * Lookups walk dot-separated paths through nested maps. A missing key, a null value or a
 * non-map intermediate value all resolve to empty, never to an exception.
 *
 * @param subject  subject attributes
 * @param action   action attributes
 * @param resource resource attributes
 * @param context  context attributes
 */
public record AttributeBags(
        Map<String, Object> subject,
        Map<String, Object> action,
        Map<String, Object> resource,
        Map<String, Object> context) {

    public AttributeBags {
        subject = subject == null ? Map.of() : subject;
        action = action == null ? Map.of() : action;
        resource = resource == null ? Map.of() : resource;
        context = context == null ? Map.of() : context;
    }

    public Map<String, Object> bag(AttributeSource source) {
        return switch (source) {
            case SUBJECT -> subject;
            case ACTION -> action;
            case RESOURCE -> resource;
            case CONTEXT -> context;
        };
    }

    /**
     * Resolves {@code path} inside the bag for {@code source}.
     *
     * @return the value, or empty if the source is null, the path is blank or nothing is there
     */
    public Optional<Object> lookup(AttributeSource source, String path) {
        if (source == null || path == null || path.isBlank()) {
            return Optional.empty();
        }
        Object current = bag(source);
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    /** Resolves a reference against these bags; unknown sources resolve to empty. */
    public Optional<Object> lookup(AttributeReference reference) {
        return reference.source().flatMap(source -> lookup(source, reference.path()));
    }
}
