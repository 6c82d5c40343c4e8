package com.complyhub.accesscontrol.permission;

import java.util.List;

/**
 * A capability granted on a resource, optionally gated by attribute conditions.
 *
 * @param resource   resource name, or {@link #WILDCARD} for every resource
 * @param action     granted action; {@link PermissionAction#ADMIN} implies all actions
 * @param conditions conditions that must all hold for the permission to apply (empty = none)
 */
public record Permission(String resource, PermissionAction action, List<PermissionCondition> conditions) {

    /** Resource name matching every resource. */
    public static final String WILDCARD = "*";

    public Permission {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    /** Creates an unconditional permission. */
    public static Permission of(String resource, PermissionAction action) {
        return new Permission(resource, action, List.of());
    }

    /** Creates a permission gated by the given conditions. */
    public static Permission of(String resource, PermissionAction action, PermissionCondition... conditions) {
        return new Permission(resource, action, List.of(conditions));
    }

    public PermissionKey key() {
        return new PermissionKey(resource, action);
    }

    public boolean coversResource(String requested) {
        return WILDCARD.equals(resource) || resource.equals(requested);
    }

    public boolean coversAction(PermissionAction requested) {
        return action.implies(requested);
    }

    /**
     * Checks every condition against the context. Unconditional permissions always apply.
     */
    public boolean conditionsHold(PermissionContext context) {
        if (conditions.isEmpty()) {
            return true;
        }
        if (context == null) {
            return false;
        }
        for (PermissionCondition condition : conditions) {
            if (!condition.matches(context)) {
                return false;
            }
        }
        return true;
    }
}
