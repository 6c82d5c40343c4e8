package com.complyhub.accesscontrol.permission;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Role template document: baseline permissions per role plus the role hierarchy.
 *
 * <pre>{@code
 * {
 *   "hierarchy": ["SUPER_ADMIN", "ADMIN", ...],
 *   "functionalRoles": ["OPERATIONS", ...],
 *   "managementRoles": ["SUPER_ADMIN", ...],
 *   "roles": {
 *     "SUPER_ADMIN": [{ "resource": "*", "action": "ADMIN" }],
 *     ...
 *   }
 * }
 * }</pre>
 *
 * @param hierarchy       hierarchical roles, highest privilege first
 * @param functionalRoles department roles outside the hierarchy
 * @param managementRoles roles treated as management
 * @param roles           baseline permissions per role
 */
public record RoleTemplates(
        List<String> hierarchy,
        List<String> functionalRoles,
        List<String> managementRoles,
        Map<String, List<Permission>> roles) {

    public RoleTemplates {
        hierarchy = hierarchy == null ? List.of() : List.copyOf(hierarchy);
        functionalRoles = functionalRoles == null ? List.of() : List.copyOf(functionalRoles);
        managementRoles = managementRoles == null ? List.of() : List.copyOf(managementRoles);
        roles = roles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(roles));
    }

    public RolePermissionRepository toRepository() {
        return new InMemoryRolePermissionRepository(roles);
    }

    public RoleHierarchy toHierarchy() {
        return new RoleHierarchy(hierarchy, Set.copyOf(functionalRoles), Set.copyOf(managementRoles));
    }
}
