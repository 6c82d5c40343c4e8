package com.complyhub.accesscontrol.restriction;

/**
 * What to do with a restriction whose required request attribute (IP, country, device type)
 * was not supplied.
 */
public enum MissingContextPolicy {

    /** Skip the restriction. The request passes that gate unchecked. */
    SKIP,

    /** Record a violation for the restriction. */
    DENY
}
