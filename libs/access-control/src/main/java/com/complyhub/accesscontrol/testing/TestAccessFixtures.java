package com.complyhub.accesscontrol.testing;

import com.complyhub.accesscontrol.field.FieldAccessType;
import com.complyhub.accesscontrol.field.FieldSecurityRule;
import com.complyhub.accesscontrol.field.MaskingType;
import com.complyhub.accesscontrol.permission.Permission;
import com.complyhub.accesscontrol.permission.PermissionAction;
import com.complyhub.accesscontrol.permission.PermissionGroup;
import com.complyhub.accesscontrol.restriction.AccessRestriction;
import com.complyhub.accesscontrol.restriction.DeviceRestrictionConfig;
import com.complyhub.accesscontrol.restriction.GeoRestrictionConfig;
import com.complyhub.accesscontrol.restriction.IpRestrictionConfig;
import com.complyhub.accesscontrol.restriction.RestrictionContext;
import com.complyhub.accesscontrol.restriction.TimeRestrictionConfig;
import com.complyhub.accesscontrol.restriction.TimeRestrictionConfig.HourWindow;
import com.complyhub.accesscontrol.session.MfaMethod;
import com.complyhub.accesscontrol.session.Session;
import com.complyhub.accesscontrol.session.SessionPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Ready-made rules, policies and contexts for tests of code that depends on the
 * access-control engine.
 * <p>
 * Lives in the main source set so downstream modules can use it from their test scope
 * through a regular dependency. Package {@code testing} marks it as test-only.
 */
public final class TestAccessFixtures {

    public static final String TENANT_ID = "test-tenant-001";
    public static final String USER_ID = "test-user-001";
    public static final String OFFICE_CIDR = "10.0.0.0/8";
    public static final String OFFICE_IP = "10.1.2.3";
    public static final String KOLKATA = "Asia/Kolkata";

    private TestAccessFixtures() {
        // utility class
    }

    /** Tenant-wide IP restriction allowing only the office network. */
    public static AccessRestriction officeNetworkOnly() {
        return AccessRestriction.forTenant(TENANT_ID, IpRestrictionConfig.allowingCidrs(OFFICE_CIDR));
    }

    /** Tenant-wide geo restriction allowing only India. */
    public static AccessRestriction indiaOnly() {
        return AccessRestriction.forTenant(TENANT_ID, new GeoRestrictionConfig(List.of("IN"), List.of(), List.of()));
    }

    /** Monday to Friday, 09:00 to 18:00 India time. */
    public static AccessRestriction businessHoursIndia() {
        return AccessRestriction.forTenant(TENANT_ID,
                new TimeRestrictionConfig(List.of(1, 2, 3, 4, 5), new HourWindow(9, 18), KOLKATA));
    }

    /** Desktop or laptop, trusted devices only. */
    public static AccessRestriction trustedComputersOnly() {
        return AccessRestriction.forUser(TENANT_ID, USER_ID,
                new DeviceRestrictionConfig(List.of("desktop", "laptop"), true));
    }

    /** Context of a request from the office, on a trusted laptop in India. */
    public static RestrictionContext officeContext(Instant at) {
        return RestrictionContext.builder()
                .ip(OFFICE_IP)
                .country("IN")
                .state("MH")
                .deviceType("laptop")
                .trustedDevice(true)
                .currentTime(at)
                .build();
    }

    /** Eight hour sessions, thirty minute idle timeout, three concurrent sessions, TOTP required. */
    public static SessionPolicy standardSessionPolicy() {
        return SessionPolicy.builder(TENANT_ID, "standard")
                .maxSessionDuration(Duration.ofHours(8))
                .idleTimeout(Duration.ofMinutes(30))
                .maxConcurrentSessions(3)
                .requireMfa(true)
                .mfaMethods(MfaMethod.TOTP)
                .build();
    }

    /** Session created {@code age} before {@code now} and last active {@code idle} before {@code now}. */
    public static Session session(Instant now, Duration age, Duration idle, String ipAddress) {
        return new Session(now.minus(age), now.minus(idle), ipAddress);
    }

    /** Client PAN number readable by partners and managers, partially masked. */
    public static FieldSecurityRule maskedPanRule() {
        return new FieldSecurityRule(TENANT_ID, "client", "panNumber",
                Set.of("PARTNER", "MANAGER"), FieldAccessType.READ, MaskingType.PARTIAL);
    }

    /** Client billing rate writable by partners only. */
    public static FieldSecurityRule partnerBillingRateRule() {
        return new FieldSecurityRule(TENANT_ID, "client", "billingRate",
                Set.of("PARTNER"), FieldAccessType.BOTH, MaskingType.NONE);
    }

    /** Group granting report export. */
    public static PermissionGroup reportExportersGroup() {
        return new PermissionGroup(TENANT_ID, "report-exporters", "Can export reports",
                List.of(Permission.of("reports", PermissionAction.EXPORT)));
    }
}
