package com.complyhub.accesscontrol.permission;

import com.complyhub.accesscontrol.AccessCheckResult;
import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics;
import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics.Evaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes effective permission sets and answers "may this principal perform this action on
 * this resource" queries.
 * <p>
 * Effective permissions are the role baseline, overwritten by group grants, then adjusted by
 * per-user overrides. Evaluation never throws on malformed rule data: anything it cannot
 * interpret is treated as not granting access.
 */
public class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    private final RolePermissionRepository rolePermissions;
    private final AccessDecisionMetrics metrics;

    public PermissionResolver(RolePermissionRepository rolePermissions) {
        this(rolePermissions, AccessDecisionMetrics.disabled());
    }

    public PermissionResolver(RolePermissionRepository rolePermissions, AccessDecisionMetrics metrics) {
        if (rolePermissions == null) {
            throw new IllegalArgumentException("rolePermissions must not be null");
        }
        this.rolePermissions = rolePermissions;
        this.metrics = metrics == null ? AccessDecisionMetrics.disabled() : metrics;
    }

    /**
     * Returns the baseline permissions of a role, or an empty list for an unknown role.
     */
    public List<Permission> getRolePermissions(String role) {
        List<Permission> permissions = rolePermissions.findByRole(role);
        return permissions == null ? List.of() : permissions;
    }

    /**
     * Checks an unconditional query; permissions carrying conditions never apply.
     */
    public boolean hasPermission(List<Permission> permissions, String resource, PermissionAction action) {
        return hasPermission(permissions, resource, action, null);
    }

    /**
     * Checks whether any permission authorizes {@code action} on {@code resource}.
     * <p>
     * A permission applies when its resource is the requested one or {@code *}, its action is
     * the requested one or {@code ADMIN}, and all of its conditions hold against
     * {@code context}. Conditions evaluated without a context fail.
     *
     * @param permissions effective permissions of the principal
     * @param resource    requested resource
     * @param action      requested action
     * @param context     attributes for condition evaluation; may be null
     * @return true on the first applicable permission, false if none applies
     */
    public boolean hasPermission(
            List<Permission> permissions, String resource, PermissionAction action, PermissionContext context) {
        if (permissions == null || resource == null || action == null) {
            return false;
        }
        for (Permission permission : permissions) {
            if (permission == null
                    || !permission.coversResource(resource)
                    || !permission.coversAction(action)) {
                continue;
            }
            if (permission.conditionsHold(context)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Same as {@link #hasPermission(List, String, PermissionAction, PermissionContext)} but
     * reports the missing permission and records the decision.
     */
    public AccessCheckResult checkPermission(
            List<Permission> permissions, String resource, PermissionAction action, PermissionContext context) {
        boolean allowed = hasPermission(permissions, resource, action, context);
        metrics.record(Evaluator.PERMISSION, allowed);
        if (allowed) {
            return AccessCheckResult.granted();
        }
        String missing = resource + ":" + action;
        log.debug("Permission denied: missing {}", missing);
        return AccessCheckResult.missingPermission(
                missing, "Missing %s permission on %s".formatted(action, resource));
    }

    /**
     * Merges role, group and override permissions into one effective set keyed by
     * {@code resource:ACTION}.
     * <p>
     * Group entries replace role entries with the same key. Overrides are then applied in
     * order: a grant inserts an unconditional permission (replacing any conditional one), a
     * revoke removes the key whichever source granted it. A grant whose key cannot be parsed
     * is ignored.
     *
     * @return the merged permissions in first-insertion order
     */
    public List<Permission> mergePermissions(
            List<Permission> rolePermissions,
            List<Permission> groupPermissions,
            List<PermissionOverride> overrides) {
        Map<String, Permission> merged = new LinkedHashMap<>();
        putAll(merged, rolePermissions);
        putAll(merged, groupPermissions);

        if (overrides != null) {
            for (PermissionOverride override : overrides) {
                if (override == null || override.permission() == null) {
                    continue;
                }
                applyOverride(merged, override);
            }
        }
        return List.copyOf(merged.values());
    }

    /**
     * Resolves the effective permissions of a principal from its role, group memberships and
     * personal overrides.
     */
    public List<Permission> resolveEffectivePermissions(
            String role, List<PermissionGroup> groups, List<PermissionOverride> overrides) {
        List<Permission> groupPermissions = new ArrayList<>();
        if (groups != null) {
            for (PermissionGroup group : groups) {
                if (group != null) {
                    groupPermissions.addAll(group.permissions());
                }
            }
        }
        return mergePermissions(getRolePermissions(role), groupPermissions, overrides);
    }

    private static void putAll(Map<String, Permission> merged, List<Permission> permissions) {
        if (permissions == null) {
            return;
        }
        for (Permission permission : permissions) {
            if (permission != null) {
                merged.put(permission.key().toString(), permission);
            }
        }
    }

    private static void applyOverride(Map<String, Permission> merged, PermissionOverride override) {
        String rawKey = override.permission().trim();
        Optional<PermissionKey> key = PermissionKey.parse(rawKey);

        if (!override.granted()) {
            merged.remove(key.map(PermissionKey::toString).orElse(rawKey));
            return;
        }
        if (key.isEmpty()) {
            log.warn("Ignoring permission grant with malformed key '{}'", rawKey);
            return;
        }
        PermissionKey parsed = key.get();
        merged.put(parsed.toString(), Permission.of(parsed.resource(), parsed.action()));
    }
}
