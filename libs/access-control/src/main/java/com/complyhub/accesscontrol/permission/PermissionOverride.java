package com.complyhub.accesscontrol.permission;

/**
 * Per-user grant or revoke applied after role and group resolution.
 *
 * @param permission permission in {@code resource:ACTION} form
 * @param granted    true inserts the permission, false removes it
 */
public record PermissionOverride(String permission, boolean granted) {

    public static PermissionOverride grant(String permission) {
        return new PermissionOverride(permission, true);
    }

    public static PermissionOverride revoke(String permission) {
        return new PermissionOverride(permission, false);
    }
}
