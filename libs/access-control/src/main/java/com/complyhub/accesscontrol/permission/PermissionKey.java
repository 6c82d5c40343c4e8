package com.complyhub.accesscontrol.permission;

import java.util.Optional;

/**
 * Identity of a permission within an effective permission set: a resource and an action,
 * written {@code resource:ACTION} (e.g., {@code clients:DELETE}).
 *
 * @param resource resource name or {@code *}
 * @param action   granted action
 */
public record PermissionKey(String resource, PermissionAction action) {

    public PermissionKey {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
    }

    /**
     * Parses the {@code resource:ACTION} form.
     *
     * @param value text to parse
     * @return the key, or empty when the text is not exactly one resource and one known action
     */
    public static Optional<PermissionKey> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        int separator = value.indexOf(':');
        if (separator <= 0 || separator != value.lastIndexOf(':')) {
            return Optional.empty();
        }
        String resource = value.substring(0, separator).trim();
        if (resource.isEmpty()) {
            return Optional.empty();
        }
        return PermissionAction.fromString(value.substring(separator + 1).trim())
                .map(action -> new PermissionKey(resource, action));
    }

    @Override
    public String toString() {
        return resource + ":" + action.name();
    }
}
