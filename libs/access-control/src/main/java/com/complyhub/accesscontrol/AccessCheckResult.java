package com.complyhub.accesscontrol;

import java.util.List;

/**
 * Aggregated result of a permission or restriction check.
 *
 * @param allowed               true when no permission is missing and no restriction was violated
 * @param reason                summary of the denial, {@code null} when allowed
 * @param missingPermissions    permissions in {@code resource:ACTION} form the caller lacks
 * @param restrictionViolations reasons reported by violated access restrictions
 */
public record AccessCheckResult(
        boolean allowed,
        String reason,
        List<String> missingPermissions,
        List<String> restrictionViolations) {

    public AccessCheckResult {
        missingPermissions = missingPermissions == null ? List.of() : List.copyOf(missingPermissions);
        restrictionViolations = restrictionViolations == null ? List.of() : List.copyOf(restrictionViolations);
    }

    /** Creates a passing result. */
    public static AccessCheckResult granted() {
        return new AccessCheckResult(true, null, List.of(), List.of());
    }

    /** Creates a result denied for lack of a permission. */
    public static AccessCheckResult missingPermission(String permission, String reason) {
        return new AccessCheckResult(false, reason, List.of(permission), List.of());
    }

    /**
     * Creates a result from restriction violations; allowed exactly when the list is empty.
     */
    public static AccessCheckResult fromViolations(List<String> violations) {
        if (violations == null || violations.isEmpty()) {
            return granted();
        }
        String reason = violations.size() == 1
                ? violations.get(0)
                : "%d access restrictions violated".formatted(violations.size());
        return new AccessCheckResult(false, reason, List.of(), violations);
    }
}
