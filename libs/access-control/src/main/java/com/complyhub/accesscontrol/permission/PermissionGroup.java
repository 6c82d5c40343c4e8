package com.complyhub.accesscontrol.permission;

import java.util.List;

/**
 * Named, reusable bundle of permissions assignable to users on top of their role.
 *
 * @param tenantId    owning firm
 * @param name        group name, unique per tenant
 * @param description optional description
 * @param permissions permissions granted by membership
 */
public record PermissionGroup(String tenantId, String name, String description, List<Permission> permissions) {

    public PermissionGroup {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
