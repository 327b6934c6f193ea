package com.warden.authz.policy;

import java.util.Optional;

/**
 * Lifecycle state of a policy. Only {@link #ACTIVE} policies take part in evaluation.
 */
public enum PolicyStatus {
    ACTIVE,
    DISABLED,
    ARCHIVED;

    public static Optional<PolicyStatus> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PolicyStatus status : values()) {
            if (status.name().equalsIgnoreCase(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
