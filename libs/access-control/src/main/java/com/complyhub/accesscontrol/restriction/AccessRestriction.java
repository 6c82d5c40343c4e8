package com.complyhub.accesscontrol.restriction;

/**
 * A contextual access gate configured for a tenant, optionally narrowed to one user.
 *
 * @param tenantId        owning firm
 * @param userId          user the restriction applies to, or null for the whole tenant
 * @param restrictionType dimension constrained; must equal {@code config.type()}
 * @param config          type-specific configuration
 */
public record AccessRestriction(
        String tenantId, String userId, RestrictionType restrictionType, RestrictionConfig config) {

    /** Creates a tenant-wide restriction whose type is taken from the configuration. */
    public static AccessRestriction forTenant(String tenantId, RestrictionConfig config) {
        return new AccessRestriction(tenantId, null, config.type(), config);
    }

    /** Creates a restriction for a single user whose type is taken from the configuration. */
    public static AccessRestriction forUser(String tenantId, String userId, RestrictionConfig config) {
        return new AccessRestriction(tenantId, userId, config.type(), config);
    }
}
