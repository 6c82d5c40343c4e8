package com.complyhub.accesscontrol.validation;

import com.complyhub.accesscontrol.field.FieldSecurityRule;
import com.complyhub.accesscontrol.restriction.AccessRestriction;
import com.complyhub.accesscontrol.restriction.CidrRange;
import com.complyhub.accesscontrol.restriction.IpAddresses;
import com.complyhub.accesscontrol.restriction.IpRestrictionConfig;
import com.complyhub.accesscontrol.restriction.RestrictionConfig;
import com.complyhub.accesscontrol.restriction.TimeRestrictionConfig;
import com.complyhub.accesscontrol.session.SessionPolicy;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates access rules before they are stored or evaluated. Every check runs, so a result
 * lists all problems at once.
 */
public final class AccessRuleValidator {

    private AccessRuleValidator() {
        // utility class
    }

    /**
     * Validates an access restriction: the configuration must be present, match the declared
     * restriction type, and be internally consistent.
     */
    public static RuleValidationResult validate(AccessRestriction restriction) {
        if (restriction == null) {
            return RuleValidationResult.fail(List.of("restriction must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (restriction.restrictionType() == null) {
            errors.add("restrictionType must not be null");
        }
        RestrictionConfig config = restriction.config();
        if (config == null) {
            errors.add("config must not be null");
        } else {
            if (restriction.restrictionType() != null && config.type() != restriction.restrictionType()) {
                errors.add("config type %s does not match restrictionType %s"
                        .formatted(config.type(), restriction.restrictionType()));
            }
            if (config instanceof IpRestrictionConfig ip) {
                validateIp(ip, errors);
            } else if (config instanceof TimeRestrictionConfig time) {
                validateTime(time, errors);
            }
        }
        return errors.isEmpty() ? RuleValidationResult.ok() : RuleValidationResult.fail(errors);
    }

    /**
     * Validates a field security rule: entity type and field name are required.
     */
    public static RuleValidationResult validate(FieldSecurityRule rule) {
        if (rule == null) {
            return RuleValidationResult.fail(List.of("rule must not be null"));
        }
        List<String> errors = new ArrayList<>();
        if (isBlank(rule.entityType())) {
            errors.add("entityType must not be null or blank");
        }
        if (isBlank(rule.fieldName())) {
            errors.add("fieldName must not be null or blank");
        }
        return errors.isEmpty() ? RuleValidationResult.ok() : RuleValidationResult.fail(errors);
    }

    /**
     * Validates a session policy: limits, when set, must be positive and whitelisted
     * addresses must be IP literals.
     */
    public static RuleValidationResult validate(SessionPolicy policy) {
        if (policy == null) {
            return RuleValidationResult.fail(List.of("policy must not be null"));
        }
        List<String> errors = new ArrayList<>();
        requirePositive(policy.maxSessionDuration(), "maxSessionDuration", errors);
        requirePositive(policy.idleTimeout(), "idleTimeout", errors);
        if (policy.maxConcurrentSessions() != null && policy.maxConcurrentSessions() <= 0) {
            errors.add("maxConcurrentSessions must be positive");
        }
        for (String ip : policy.ipWhitelist()) {
            if (IpAddresses.parse(ip).isEmpty()) {
                errors.add("ipWhitelist contains invalid address '%s'".formatted(ip));
            }
        }
        return errors.isEmpty() ? RuleValidationResult.ok() : RuleValidationResult.fail(errors);
    }

    private static void validateIp(IpRestrictionConfig config, List<String> errors) {
        for (String ip : config.allowedIps()) {
            if (IpAddresses.parse(ip).isEmpty()) {
                errors.add("allowedIps contains invalid address '%s'".formatted(ip));
            }
        }
        for (String ip : config.blockedIps()) {
            if (IpAddresses.parse(ip).isEmpty()) {
                errors.add("blockedIps contains invalid address '%s'".formatted(ip));
            }
        }
        for (String cidr : config.allowedCidrs()) {
            if (CidrRange.parse(cidr).isEmpty()) {
                errors.add("allowedCidrs contains invalid range '%s'".formatted(cidr));
            }
        }
    }

    private static void validateTime(TimeRestrictionConfig config, List<String> errors) {
        if (config.allowedDays() == null) {
            errors.add("allowedDays must not be null");
        } else {
            for (Integer day : config.allowedDays()) {
                if (day == null || day < 0 || day > 6) {
                    errors.add("allowedDays must be between 0 (Sunday) and 6 (Saturday): " + day);
                }
            }
        }
        if (config.allowedHours() == null) {
            errors.add("allowedHours must not be null");
        } else if (!config.allowedHours().isComplete()) {
            errors.add("allowedHours must have both start and end");
        } else if (!config.allowedHours().isWellFormed()) {
            errors.add("allowedHours must satisfy 0 <= start < end <= 24: %d-%d"
                    .formatted(config.allowedHours().start(), config.allowedHours().end()));
        }
        if (isBlank(config.timezone())) {
            errors.add("timezone must not be null or blank");
        } else {
            try {
                ZoneId.of(config.timezone());
            } catch (DateTimeException e) {
                errors.add("timezone is not a valid zone id: " + config.timezone());
            }
        }
    }

    private static void requirePositive(Duration value, String name, List<String> errors) {
        if (value != null && (value.isNegative() || value.isZero())) {
            errors.add(name + " must be positive");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
