package com.complyhub.accesscontrol.field;

/**
 * Redaction applied to a readable field's value.
 */
public enum MaskingType {
    /** Value is returned unchanged. */
    NONE,
    /** First and last two characters kept, the rest hidden. */
    PARTIAL,
    /** Value replaced entirely. */
    FULL
}
