package com.complyhub.accesscontrol.session;

/**
 * Second factors a session policy may accept.
 */
public enum MfaMethod {
    TOTP,
    SMS,
    EMAIL,
    HARDWARE_KEY
}
