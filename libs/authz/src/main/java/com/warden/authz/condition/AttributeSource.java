package com.warden.authz.condition;

import java.util.Optional;

/**
 * The attribute bag a condition reads from.
 */
public enum AttributeSource {

    SUBJECT("subject"),
    RESOURCE("resource"),
    CONTEXT("context"),
    ACTION("action");

    private final String key;

    AttributeSource(String key) {
        this.key = key;
    }

    /** The lower-case key used in policy documents and references (e.g. "subject"). */
    public String key() {
        return key;
    }

    /**
     * Looks up a source by its key, ignoring case.
     *
     * @return the matching source, or empty if unknown
     */
    public static Optional<AttributeSource> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (AttributeSource source : values()) {
            if (source.key.equalsIgnoreCase(key)) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }
}
