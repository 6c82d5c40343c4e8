package com.complyhub.accesscontrol.session;

import java.time.Duration;
import java.util.List;

/**
 * Constraints on session lifetime, idleness, concurrency and MFA for a tenant.
 * <p>
 * Every limit is optional: null, zero or negative means unconstrained for that dimension.
 *
 * @param tenantId              owning firm
 * @param name                  policy name
 * @param maxSessionDuration    maximum age of a session
 * @param idleTimeout           maximum time between two requests
 * @param maxConcurrentSessions maximum number of simultaneously active sessions per user
 * @param requireMfa            whether a second factor is required at login
 * @param mfaMethods            accepted second factors (empty = platform default)
 * @param ipWhitelist           addresses sessions must originate from (empty = any)
 */
public record SessionPolicy(
        String tenantId,
        String name,
        Duration maxSessionDuration,
        Duration idleTimeout,
        Integer maxConcurrentSessions,
        Boolean requireMfa,
        List<MfaMethod> mfaMethods,
        List<String> ipWhitelist) {

    public SessionPolicy {
        mfaMethods = mfaMethods == null ? List.of() : List.copyOf(mfaMethods);
        ipWhitelist = ipWhitelist == null ? List.of() : List.copyOf(ipWhitelist);
    }

    public static Builder builder(String tenantId, String name) {
        return new Builder(tenantId, name);
    }

    /** Builder for {@link SessionPolicy}; unset limits stay unconstrained. */
    public static final class Builder {
        private final String tenantId;
        private final String name;
        private Duration maxSessionDuration;
        private Duration idleTimeout;
        private Integer maxConcurrentSessions;
        private Boolean requireMfa;
        private List<MfaMethod> mfaMethods = List.of();
        private List<String> ipWhitelist = List.of();

        private Builder(String tenantId, String name) {
            this.tenantId = tenantId;
            this.name = name;
        }

        public Builder maxSessionDuration(Duration maxSessionDuration) {
            this.maxSessionDuration = maxSessionDuration;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder maxConcurrentSessions(Integer maxConcurrentSessions) {
            this.maxConcurrentSessions = maxConcurrentSessions;
            return this;
        }

        public Builder requireMfa(Boolean requireMfa) {
            this.requireMfa = requireMfa;
            return this;
        }

        public Builder mfaMethods(MfaMethod... mfaMethods) {
            this.mfaMethods = List.of(mfaMethods);
            return this;
        }

        public Builder ipWhitelist(String... ipWhitelist) {
            this.ipWhitelist = List.of(ipWhitelist);
            return this;
        }

        public SessionPolicy build() {
            return new SessionPolicy(tenantId, name, maxSessionDuration, idleTimeout,
                    maxConcurrentSessions, requireMfa, mfaMethods, ipWhitelist);
        }
    }
}
