package com.complyhub.accesscontrol.permission;

import java.util.List;

/**
 * Source of role baseline permissions.
 * <p>
 * Implementations are typically backed by tenant configuration so firms can customise their
 * roles without a code change. Implementations must be safe for concurrent reads.
 */
public interface RolePermissionRepository {

    /**
     * Returns the baseline permissions of a role.
     *
     * @param role role name (e.g., "MANAGER")
     * @return the role's permissions, or an empty list for an unknown role
     */
    List<Permission> findByRole(String role);
}
