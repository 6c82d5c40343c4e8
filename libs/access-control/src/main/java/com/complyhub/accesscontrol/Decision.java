package com.complyhub.accesscontrol;

/**
 * Outcome of a single access gate (IP, geography, time, device, concurrent sessions).
 *
 * @param allowed whether the gate let the request through
 * @param reason  human-readable reason for a denial; {@code null} when allowed
 */
public record Decision(boolean allowed, String reason) {

    private static final Decision ALLOW = new Decision(true, null);

    /** Creates a passing decision. */
    public static Decision allow() {
        return ALLOW;
    }

    /** Creates a denying decision with the given reason. */
    public static Decision deny(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be null or blank");
        }
        return new Decision(false, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
