package com.complyhub.accesscontrol.permission;

import java.util.Optional;

/**
 * Actions a permission can grant on a resource.
 * <p>
 * {@link #ADMIN} on a resource implies every other action on that resource.
 */
public enum PermissionAction {

    CREATE,
    READ,
    UPDATE,
    DELETE,
    EXPORT,
    APPROVE,
    ADMIN;

    /**
     * Checks whether a permission carrying this action authorizes the requested action.
     */
    public boolean implies(PermissionAction requested) {
        return this == requested || this == ADMIN;
    }

    /**
     * Looks up an action by its exact name (e.g., "DELETE").
     *
     * @param value the string to match
     * @return the matching action, or empty if not found
     */
    public static Optional<PermissionAction> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (PermissionAction action : values()) {
            if (action.name().equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
