package com.warden.authz.condition;

import java.util.Optional;

/**
 * A comparison value that points at another attribute, written {@code {"ref": "resource.ownerId"}}
 * in policy documents. It is resolved against the live request when the condition is evaluated.
 *
 * @param ref {@code <bag>.<dot.path>}
 */
public record AttributeReference(String ref) {

    public AttributeReference {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("ref must not be null or blank");
        }
    }

    /** The referenced bag, or empty when the prefix is not a known source. */
    public Optional<AttributeSource> source() {
        int dot = ref.indexOf('.');
        return dot <= 0 ? Optional.empty() : AttributeSource.fromKey(ref.substring(0, dot));
    }

    /** The path inside the bag; empty string when the reference has no path. */
    public String path() {
        int dot = ref.indexOf('.');
        return dot < 0 ? "" : ref.substring(dot + 1);
    }
}
