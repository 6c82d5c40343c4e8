package com.complyhub.accesscontrol.session;

import com.complyhub.accesscontrol.Decision;
import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics;
import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics.Evaluator;
import com.complyhub.accesscontrol.restriction.IpAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Validates live sessions against a {@link SessionPolicy}: maximum age, idle timeout, IP
 * affinity and concurrency, and reports the policy's MFA requirements.
 * <p>
 * Session states as seen here: a session is active until it exceeds its maximum age or idle
 * timeout, at which point it is reported invalid; past {@code refreshThreshold} of the idle
 * timeout it is reported valid but in need of refresh. Logging out and expiring sessions is
 * up to the caller.
 */
public class SessionPolicyEnforcer {

    /** Fraction of the idle timeout after which a refresh is suggested. */
    public static final double DEFAULT_REFRESH_THRESHOLD = 0.8;

    /** MFA methods offered when a policy lists none. */
    public static final List<MfaMethod> DEFAULT_MFA_METHODS = List.of(MfaMethod.EMAIL);

    static final String EXCEEDED_MAX_DURATION = "Session has exceeded maximum duration";
    static final String IDLE_TIMEOUT = "Session has timed out due to inactivity";
    static final String IP_NOT_WHITELISTED = "Session IP not in whitelist";

    private static final Logger log = LoggerFactory.getLogger(SessionPolicyEnforcer.class);

    private final Clock clock;
    private final double refreshThreshold;
    private final AccessDecisionMetrics metrics;

    public SessionPolicyEnforcer() {
        this(Clock.systemUTC(), DEFAULT_REFRESH_THRESHOLD, AccessDecisionMetrics.disabled());
    }

    public SessionPolicyEnforcer(Clock clock) {
        this(clock, DEFAULT_REFRESH_THRESHOLD, AccessDecisionMetrics.disabled());
    }

    /**
     * @param clock            source of "now" when the caller does not pass one
     * @param refreshThreshold fraction of the idle timeout, in {@code (0, 1]}, after which a
     *                         refresh is suggested
     * @param metrics          decision counters
     */
    public SessionPolicyEnforcer(Clock clock, double refreshThreshold, AccessDecisionMetrics metrics) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (!(refreshThreshold > 0.0 && refreshThreshold <= 1.0)) {
            throw new IllegalArgumentException("refreshThreshold must be in (0, 1]: " + refreshThreshold);
        }
        this.clock = clock;
        this.refreshThreshold = refreshThreshold;
        this.metrics = metrics == null ? AccessDecisionMetrics.disabled() : metrics;
    }

    public double refreshThreshold() {
        return refreshThreshold;
    }

    /** Validates a session as of the enforcer's clock. */
    public SessionValidationResult validateSession(SessionPolicy policy, Session session) {
        return validateSession(policy, session, clock.instant());
    }

    /**
     * Validates a session as of {@code now}.
     * <ol>
     *   <li>older than {@code maxSessionDuration}: invalid</li>
     *   <li>idle longer than {@code idleTimeout}: invalid</li>
     *   <li>idle longer than the refresh threshold of {@code idleTimeout}: valid, refresh suggested</li>
     *   <li>non-empty {@code ipWhitelist} not containing the session address: invalid</li>
     * </ol>
     * A null policy imposes no constraint. A timestamp the policy needs but the session lacks
     * makes the session invalid.
     */
    public SessionValidationResult validateSession(SessionPolicy policy, Session session, Instant now) {
        SessionValidationResult result = evaluate(policy, session, now == null ? clock.instant() : now);
        metrics.record(Evaluator.SESSION, result.valid());
        if (!result.valid()) {
            log.debug("Session rejected by policy {}: {}", policy == null ? null : policy.name(), result.reason());
        }
        return result;
    }

    private SessionValidationResult evaluate(SessionPolicy policy, Session session, Instant now) {
        if (session == null) {
            return SessionValidationResult.invalid("Session is missing");
        }
        if (policy == null) {
            return SessionValidationResult.ok();
        }

        if (isSet(policy.maxSessionDuration())) {
            if (session.createdAt() == null) {
                return SessionValidationResult.invalid("Session has no creation time");
            }
            Duration age = Duration.between(session.createdAt(), now);
            if (age.compareTo(policy.maxSessionDuration()) > 0) {
                return SessionValidationResult.invalid(EXCEEDED_MAX_DURATION);
            }
        }

        boolean shouldRefresh = false;
        if (isSet(policy.idleTimeout())) {
            if (session.lastActivityAt() == null) {
                return SessionValidationResult.invalid("Session has no activity time");
            }
            Duration idle = Duration.between(session.lastActivityAt(), now);
            if (idle.compareTo(policy.idleTimeout()) > 0) {
                return SessionValidationResult.invalid(IDLE_TIMEOUT);
            }
            shouldRefresh = idle.toMillis() > policy.idleTimeout().toMillis() * refreshThreshold;
        }

        if (!policy.ipWhitelist().isEmpty() && !isWhitelisted(policy.ipWhitelist(), session.ipAddress())) {
            return SessionValidationResult.invalid(IP_NOT_WHITELISTED);
        }

        return shouldRefresh ? SessionValidationResult.okNeedingRefresh() : SessionValidationResult.ok();
    }

    /** Returns true only when the policy explicitly requires MFA. */
    public boolean isMfaRequired(SessionPolicy policy) {
        return policy != null && Boolean.TRUE.equals(policy.requireMfa());
    }

    /** Returns the policy's MFA methods, or {@link #DEFAULT_MFA_METHODS} when it lists none. */
    public List<MfaMethod> getAllowedMfaMethods(SessionPolicy policy) {
        if (policy == null || policy.mfaMethods().isEmpty()) {
            return DEFAULT_MFA_METHODS;
        }
        return policy.mfaMethods();
    }

    /**
     * Checks whether another session may be opened. Denied when the active count has reached
     * the policy's maximum; unconstrained when the policy sets none.
     */
    public Decision checkConcurrentSessions(SessionPolicy policy, int activeSessionCount) {
        Decision decision;
        if (policy == null || policy.maxConcurrentSessions() == null || policy.maxConcurrentSessions() <= 0) {
            decision = Decision.allow();
        } else if (activeSessionCount >= policy.maxConcurrentSessions()) {
            decision = Decision.deny(
                    "Maximum concurrent sessions (%d) exceeded".formatted(policy.maxConcurrentSessions()));
        } else {
            decision = Decision.allow();
        }
        metrics.record(Evaluator.CONCURRENT_SESSIONS, decision.allowed());
        return decision;
    }

    private static boolean isSet(Duration limit) {
        return limit != null && !limit.isNegative() && !limit.isZero();
    }

    private static boolean isWhitelisted(List<String> whitelist, String ipAddress) {
        if (ipAddress == null || ipAddress.isBlank()) {
            return false;
        }
        return whitelist.stream().anyMatch(entry ->
                IpAddresses.sameAddress(entry, ipAddress) || entry.trim().equals(ipAddress.trim()));
    }
}
