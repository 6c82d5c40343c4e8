package com.complyhub.accesscontrol.restriction;

/**
 * Contextual dimension an {@link AccessRestriction} constrains.
 */
public enum RestrictionType {
    IP,
    GEO,
    TIME,
    DEVICE
}
