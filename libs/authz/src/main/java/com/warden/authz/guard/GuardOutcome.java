package com.warden.authz.guard;

/**
 * Result of a guard check, safe to show to end users.
 *
 * @param status  outcome
 * @param message generic message for the caller; never contains policy details
 */
public record GuardOutcome(Status status, String message) {

    public enum Status {
        ALLOWED,
        DENIED,
        UNAVAILABLE
    }

    private static final GuardOutcome ALLOWED = new GuardOutcome(Status.ALLOWED, "Authorized");
    private static final GuardOutcome DENIED = new GuardOutcome(Status.DENIED, "Not authorized");
    private static final GuardOutcome UNAVAILABLE = new GuardOutcome(Status.UNAVAILABLE, "Service unavailable");

    public static GuardOutcome allowed() {
        return ALLOWED;
    }

    public static GuardOutcome denied() {
        return DENIED;
    }

    public static GuardOutcome unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAllowed() {
        return status == Status.ALLOWED;
    }
}
