package com.warden.authz.rbac;

import java.util.Collection;

/**
 * Matches held permission strings against a required one.
 * <p>
 * Permissions are colon-separated segments, {@code resource:action[:qualifier]}. Rules:
 * <ul>
 *   <li>{@code *}, {@code *:*} and {@code manage} held on their own grant everything.</li>
 *   <li>A held {@code *} or {@code manage} segment matches any single required segment at
 *       the same position, so {@code property:manage} covers {@code property:read}.</li>
 *   <li>A trailing held {@code *} segment matches one or more remaining segments, so
 *       {@code report:*} covers {@code report:export:pdf}.</li>
 *   <li>Otherwise both strings must have the same number of segments.</li>
 * </ul>
 */
public final class PermissionMatcher {

    private static final String WILDCARD = "*";
    private static final String MANAGE = "manage";

    private PermissionMatcher() {
        // utility class
    }

    public static boolean matches(String held, String required) {
        if (held == null || required == null || held.isBlank() || required.isBlank()) {
            return false;
        }
        if (held.equals(WILDCARD) || held.equals("*:*") || held.equals(MANAGE)) {
            return true;
        }
        if (held.equals(required)) {
            return true;
        }
        String[] heldSegments = held.split(":", -1);
        String[] requiredSegments = required.split(":", -1);
        boolean trailingWildcard = heldSegments[heldSegments.length - 1].equals(WILDCARD);

        if (heldSegments.length != requiredSegments.length) {
            if (!trailingWildcard || requiredSegments.length < heldSegments.length) {
                return false;
            }
        }
        int compared = trailingWildcard ? heldSegments.length - 1 : heldSegments.length;
        for (int i = 0; i < compared; i++) {
            if (!segmentMatches(heldSegments[i], requiredSegments[i])) {
                return false;
            }
        }
        return true;
    }

    /** True if any of {@code held} matches {@code required}. */
    public static boolean anyMatches(Collection<String> held, String required) {
        for (String permission : held) {
            if (matches(permission, required)) {
                return true;
            }
        }
        return false;
    }

    private static boolean segmentMatches(String held, String required) {
        return held.equals(WILDCARD) || held.equals(MANAGE) || held.equals(required);
    }
}
