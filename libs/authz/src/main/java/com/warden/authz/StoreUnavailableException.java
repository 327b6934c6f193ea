package com.warden.authz;

import java.util.Locale;

/**
 * Thrown when a backing role or policy store cannot be read.
 * <p>
 * This is distinct from a denial: the engine could not determine access at all. Callers must
 * treat it as "service unavailable" and never as an allow.
 */
public class StoreUnavailableException extends RuntimeException {

    public enum Store {
        ROLE,
        POLICY;

        /** Lower-case name used as a metric tag. */
        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Store store;

    public StoreUnavailableException(Store store, String tenantId, Throwable cause) {
        super("%s store unavailable for tenant '%s'".formatted(store, tenantId), cause);
        this.store = store;
    }

    public Store store() {
        return store;
    }
}
