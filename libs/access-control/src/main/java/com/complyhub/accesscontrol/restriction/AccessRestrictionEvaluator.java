package com.complyhub.accesscontrol.restriction;

import com.complyhub.accesscontrol.AccessCheckResult;
import com.complyhub.accesscontrol.Decision;
import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics;
import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics.Evaluator;
import com.complyhub.accesscontrol.validation.AccessRuleValidator;
import com.complyhub.accesscontrol.validation.RuleValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks a request's origin, geography, time and device against configured access
 * restrictions.
 * <p>
 * Precedence inside each restriction is block list, then allow list, then ranges. A
 * restriction whose configuration is missing, inconsistent with its declared type, or
 * otherwise invalid is reported as a violation rather than ignored. A restriction whose
 * required request attribute is absent is handled per {@link MissingContextPolicy}.
 */
public class AccessRestrictionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AccessRestrictionEvaluator.class);

    private final Clock clock;
    private final MissingContextPolicy missingContextPolicy;
    private final AccessDecisionMetrics metrics;

    /** Creates an evaluator using the system UTC clock that skips restrictions lacking context. */
    public AccessRestrictionEvaluator() {
        this(Clock.systemUTC(), MissingContextPolicy.SKIP, AccessDecisionMetrics.disabled());
    }

    public AccessRestrictionEvaluator(Clock clock, MissingContextPolicy missingContextPolicy) {
        this(clock, missingContextPolicy, AccessDecisionMetrics.disabled());
    }

    public AccessRestrictionEvaluator(
            Clock clock, MissingContextPolicy missingContextPolicy, AccessDecisionMetrics metrics) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (missingContextPolicy == null) {
            throw new IllegalArgumentException("missingContextPolicy must not be null");
        }
        this.clock = clock;
        this.missingContextPolicy = missingContextPolicy;
        this.metrics = metrics == null ? AccessDecisionMetrics.disabled() : metrics;
    }

    public MissingContextPolicy missingContextPolicy() {
        return missingContextPolicy;
    }

    /**
     * Checks a client address. A blocked address is denied even if also allowed; a non-empty
     * allow list must contain the address; a non-empty range list must contain it.
     * An address that is not a valid IP literal is denied whenever the configuration
     * constrains anything.
     */
    public Decision checkIpRestriction(IpRestrictionConfig config, String clientIp) {
        if (config == null) {
            return Decision.deny("IP restriction has no configuration");
        }
        Optional<InetAddress> parsed = IpAddresses.parse(clientIp);
        if (parsed.isEmpty()) {
            return config.constrainsAnything()
                    ? Decision.deny("IP address is not a valid IP address")
                    : Decision.allow();
        }
        InetAddress address = parsed.get();

        if (config.blockedIps().stream().anyMatch(blocked -> IpAddresses.matches(blocked, address))) {
            return Decision.deny("IP address is blocked");
        }
        if (!config.allowedIps().isEmpty()
                && config.allowedIps().stream().noneMatch(allowed -> IpAddresses.matches(allowed, address))) {
            return Decision.deny("IP address not in allowed list");
        }
        if (!config.allowedCidrs().isEmpty() && !inAnyRange(config.allowedCidrs(), address)) {
            return Decision.deny("IP address not in allowed range");
        }
        return Decision.allow();
    }

    /**
     * Checks a resolved location. A blocked country is denied; a non-empty allowed-country
     * list must contain the country; a supplied state must be in a non-empty allowed-state list.
     */
    public Decision checkGeoRestriction(GeoRestrictionConfig config, String country, String state) {
        if (config == null) {
            return Decision.deny("Geo restriction has no configuration");
        }
        if (containsIgnoreCase(config.blockedCountries(), country)) {
            return Decision.deny("Access from this country is blocked");
        }
        if (!config.allowedCountries().isEmpty() && !containsIgnoreCase(config.allowedCountries(), country)) {
            return Decision.deny("Access not allowed from this country");
        }
        if (state != null && !state.isBlank()
                && !config.allowedStates().isEmpty()
                && !containsIgnoreCase(config.allowedStates(), state)) {
            return Decision.deny("Access not allowed from this state");
        }
        return Decision.allow();
    }

    /**
     * Checks an instant against a weekly time window. The instant is converted to the
     * configured zone's local day and hour, so daylight-saving transitions are honoured.
     */
    public Decision checkTimeRestriction(TimeRestrictionConfig config, Instant now) {
        if (config == null) {
            return Decision.deny("Time restriction has no configuration");
        }
        if (config.allowedDays() == null || config.allowedHours() == null || config.timezone() == null
                || !config.allowedHours().isComplete()) {
            return Decision.deny("Time restriction is incomplete");
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(config.timezone());
        } catch (DateTimeException e) {
            return Decision.deny("Time restriction has an invalid timezone: " + config.timezone());
        }

        ZonedDateTime local = (now == null ? clock.instant() : now).atZone(zone);
        int day = local.getDayOfWeek().getValue() % 7;
        if (!config.allowedDays().contains(day)) {
            return Decision.deny("Access not allowed on this day");
        }
        TimeRestrictionConfig.HourWindow hours = config.allowedHours();
        if (!hours.contains(local.getHour())) {
            return Decision.deny("Access only allowed between %d:00 and %d:00".formatted(hours.start(), hours.end()));
        }
        return Decision.allow();
    }

    /**
     * Checks the client device. A non-empty allowed-type list must contain the device type;
     * a configuration requiring a trusted device denies unknown or untrusted devices.
     */
    public Decision checkDeviceRestriction(DeviceRestrictionConfig config, String deviceType, Boolean trustedDevice) {
        if (config == null) {
            return Decision.deny("Device restriction has no configuration");
        }
        if (!config.allowedDeviceTypes().isEmpty() && !containsIgnoreCase(config.allowedDeviceTypes(), deviceType)) {
            return Decision.deny("Device type not allowed");
        }
        if (config.requireTrustedDevice() && !Boolean.TRUE.equals(trustedDevice)) {
            return Decision.deny("A trusted device is required");
        }
        return Decision.allow();
    }

    /**
     * Evaluates every restriction independently and collects the violation reasons.
     *
     * @param restrictions restrictions applicable to the request (tenant-wide and per user)
     * @param context      request attributes; null is treated as an empty context
     * @return allowed exactly when no restriction was violated
     */
    public AccessCheckResult checkAllRestrictions(List<AccessRestriction> restrictions, RestrictionContext context) {
        RestrictionContext ctx = context == null ? RestrictionContext.builder().build() : context;
        List<String> violations = new ArrayList<>();

        if (restrictions != null) {
            for (AccessRestriction restriction : restrictions) {
                if (restriction == null) {
                    continue;
                }
                Decision decision = evaluate(restriction, ctx);
                if (decision.denied()) {
                    violations.add(decision.reason());
                }
            }
        }

        AccessCheckResult result = AccessCheckResult.fromViolations(violations);
        metrics.record(Evaluator.RESTRICTION, result.allowed());
        if (!result.allowed()) {
            log.debug("Access restrictions violated: {}", violations);
        }
        return result;
    }

    private Decision evaluate(AccessRestriction restriction, RestrictionContext ctx) {
        RuleValidationResult validation = AccessRuleValidator.validate(restriction);
        if (!validation.valid()) {
            log.warn("Rejecting malformed {} restriction for tenant {}: {}",
                    restriction.restrictionType(), restriction.tenantId(), validation.errors());
            return Decision.deny("Invalid %s restriction: %s"
                    .formatted(restriction.restrictionType(), validation.firstError()));
        }

        RestrictionConfig config = restriction.config();
        if (config instanceof IpRestrictionConfig ip) {
            return ctx.hasIp() ? checkIpRestriction(ip, ctx.ip()) : missing(restriction, "ip");
        }
        if (config instanceof GeoRestrictionConfig geo) {
            return ctx.hasCountry()
                    ? checkGeoRestriction(geo, ctx.country(), ctx.state())
                    : missing(restriction, "country");
        }
        if (config instanceof TimeRestrictionConfig time) {
            return checkTimeRestriction(time, ctx.currentTime());
        }
        if (config instanceof DeviceRestrictionConfig device) {
            if (!device.allowedDeviceTypes().isEmpty() && !ctx.hasDeviceType()) {
                return missing(restriction, "deviceType");
            }
            return checkDeviceRestriction(device, ctx.deviceType(), ctx.trustedDevice());
        }
        return Decision.deny("Unsupported restriction configuration");
    }

    private Decision missing(AccessRestriction restriction, String attribute) {
        if (missingContextPolicy == MissingContextPolicy.DENY) {
            return Decision.deny("%s restriction requires %s but it was not supplied"
                    .formatted(restriction.restrictionType(), attribute));
        }
        log.warn("Skipping {} restriction for tenant {}: request context has no {}",
                restriction.restrictionType(), restriction.tenantId(), attribute);
        return Decision.allow();
    }

    private static boolean inAnyRange(List<String> cidrs, InetAddress address) {
        for (String cidr : cidrs) {
            Optional<CidrRange> range = CidrRange.parse(cidr);
            if (range.isPresent() && range.get().contains(address)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        if (candidate == null) {
            return false;
        }
        String trimmed = candidate.trim();
        return values.stream().anyMatch(value -> value != null && value.trim().equalsIgnoreCase(trimmed));
    }
}
