package com.warden.authz.policy;

import java.util.Optional;

public enum PolicyEffect {
    ALLOW,
    DENY;

    /** Case-insensitive lookup; empty for null or unknown values. */
    public static Optional<PolicyEffect> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PolicyEffect effect : values()) {
            if (effect.name().equalsIgnoreCase(value)) {
                return Optional.of(effect);
            }
        }
        return Optional.empty();
    }
}
