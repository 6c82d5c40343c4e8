package com.complyhub.accesscontrol.session;

/**
 * Result of validating a session against a {@link SessionPolicy}.
 *
 * @param valid         whether the session may continue
 * @param reason        why the session is invalid; null when valid
 * @param shouldRefresh true when the session is valid but close to its idle timeout, so the
 *                      caller should extend it
 */
public record SessionValidationResult(boolean valid, String reason, boolean shouldRefresh) {

    private static final SessionValidationResult OK = new SessionValidationResult(true, null, false);
    private static final SessionValidationResult REFRESH = new SessionValidationResult(true, null, true);

    public static SessionValidationResult ok() {
        return OK;
    }

    public static SessionValidationResult okNeedingRefresh() {
        return REFRESH;
    }

    public static SessionValidationResult invalid(String reason) {
        return new SessionValidationResult(false, reason, false);
    }
}
