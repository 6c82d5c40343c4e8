package com.complyhub.accesscontrol.field;

/**
 * Kind of field access a rule permits, or a caller requests.
 */
public enum FieldAccessType {
    READ,
    WRITE,
    BOTH
}
