package com.complyhub.accesscontrol.permission;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, map-backed {@link RolePermissionRepository}.
 */
public final class InMemoryRolePermissionRepository implements RolePermissionRepository {

    private final Map<String, List<Permission>> permissionsByRole;

    /**
     * @param permissionsByRole role name to baseline permissions; copied, iteration order kept
     */
    public InMemoryRolePermissionRepository(Map<String, List<Permission>> permissionsByRole) {
        if (permissionsByRole == null) {
            throw new IllegalArgumentException("permissionsByRole must not be null");
        }
        Map<String, List<Permission>> copy = new LinkedHashMap<>();
        permissionsByRole.forEach((role, permissions) ->
                copy.put(role, permissions == null ? List.of() : List.copyOf(permissions)));
        this.permissionsByRole = Collections.unmodifiableMap(copy);
    }

    @Override
    public List<Permission> findByRole(String role) {
        if (role == null) {
            return List.of();
        }
        return permissionsByRole.getOrDefault(role, List.of());
    }
}
