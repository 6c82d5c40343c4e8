package com.complyhub.accesscontrol.spring;

import com.complyhub.accesscontrol.restriction.MissingContextPolicy;
import com.complyhub.accesscontrol.session.SessionPolicyEnforcer;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the access-control engine.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * complyhub:
 *   access-control:
 *     role-permissions-location: classpath:role-permissions/firm-role-permissions.json
 *     missing-context-policy: DENY
 *     session-refresh-threshold: 0.75
 *     metrics-enabled: true
 * }</pre>
 *
 * @param rolePermissionsLocation Spring resource location of the role template document
 * @param missingContextPolicy    what to do when a restriction needs a context value the request lacks
 * @param sessionRefreshThreshold fraction of the idle timeout after which a session refresh is suggested
 * @param metricsEnabled          whether decisions are counted in the Micrometer registry
 */
@Validated
@ConfigurationProperties(prefix = "complyhub.access-control")
public record AccessControlProperties(
        @NotBlank String rolePermissionsLocation,
        @NotNull MissingContextPolicy missingContextPolicy,
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0") Double sessionRefreshThreshold,
        Boolean metricsEnabled) {

    public static final String DEFAULT_ROLE_PERMISSIONS_LOCATION =
            "classpath:role-permissions/default-role-permissions.json";

    public AccessControlProperties {
        if (rolePermissionsLocation == null) {
            rolePermissionsLocation = DEFAULT_ROLE_PERMISSIONS_LOCATION;
        }
        if (missingContextPolicy == null) {
            missingContextPolicy = MissingContextPolicy.SKIP;
        }
        if (sessionRefreshThreshold == null) {
            sessionRefreshThreshold = SessionPolicyEnforcer.DEFAULT_REFRESH_THRESHOLD;
        }
        if (metricsEnabled == null) {
            metricsEnabled = Boolean.TRUE;
        }
    }

    /** Properties with every default applied. */
    public static AccessControlProperties defaults() {
        return new AccessControlProperties(null, null, null, null);
    }
}
