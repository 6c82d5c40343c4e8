package com.complyhub.accesscontrol.session;

import java.time.Instant;

/**
 * Snapshot of a live session as seen by the policy enforcer. Sessions are created, refreshed
 * and destroyed by the authentication subsystem; the enforcer only reads them.
 *
 * @param createdAt      login time
 * @param lastActivityAt time of the most recent request
 * @param ipAddress      address the session was established from, if recorded
 */
public record Session(Instant createdAt, Instant lastActivityAt, String ipAddress) {

    public static Session of(Instant createdAt, Instant lastActivityAt) {
        return new Session(createdAt, lastActivityAt, null);
    }
}
