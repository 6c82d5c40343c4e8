package com.complyhub.accesscontrol.permission;

import java.util.List;
import java.util.Set;

/**
 * Ranking of hierarchical roles plus the set of functional (department) roles.
 * <p>
 * Hierarchical roles are ordered from highest to lowest privilege; index 0 is the most
 * privileged. Functional roles sit outside the ranking and never satisfy a hierarchical
 * requirement.
 *
 * @param rankedRoles     hierarchical roles, highest privilege first
 * @param functionalRoles department roles outside the hierarchy
 * @param managementRoles roles treated as management (a subset of the ranked roles)
 */
public record RoleHierarchy(List<String> rankedRoles, Set<String> functionalRoles, Set<String> managementRoles) {

    /** Level reported for roles outside the hierarchy. */
    public static final int UNRANKED = Integer.MAX_VALUE;

    private static final String MANAGER_SUFFIX = "_MANAGER";

    public RoleHierarchy {
        rankedRoles = rankedRoles == null ? List.of() : List.copyOf(rankedRoles);
        functionalRoles = functionalRoles == null ? Set.of() : Set.copyOf(functionalRoles);
        managementRoles = managementRoles == null ? Set.of() : Set.copyOf(managementRoles);
    }

    /** Returns the hierarchy shipped with the default role templates. */
    public static RoleHierarchy defaults() {
        return DefaultsHolder.INSTANCE;
    }

    /**
     * Returns the rank of a role: 0 for the most privileged, {@link #UNRANKED} for
     * functional or unknown roles.
     */
    public int levelOf(String role) {
        int index = rankedRoles.indexOf(role);
        return index == -1 ? UNRANKED : index;
    }

    /**
     * Checks whether {@code role} is at least as privileged as {@code required}.
     * A role outside the hierarchy never qualifies.
     */
    public boolean isAtLeast(String role, String required) {
        int level = levelOf(role);
        if (level == UNRANKED) {
            return false;
        }
        return level <= levelOf(required);
    }

    public boolean isHierarchical(String role) {
        return rankedRoles.contains(role);
    }

    public boolean isFunctional(String role) {
        return role != null && functionalRoles.contains(role);
    }

    /** A functional role whose name ends in {@code _MANAGER}. */
    public boolean isFunctionalManager(String role) {
        return isFunctional(role) && role.endsWith(MANAGER_SUFFIX);
    }

    public boolean isManagement(String role) {
        return role != null && managementRoles.contains(role);
    }

    private static final class DefaultsHolder {
        static final RoleHierarchy INSTANCE = RoleTemplateLoader.loadDefaults().toHierarchy();
    }
}
