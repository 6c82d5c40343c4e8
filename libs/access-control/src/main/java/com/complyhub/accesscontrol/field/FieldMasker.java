package com.complyhub.accesscontrol.field;

/**
 * Irreversible redaction of field values for display.
 */
public final class FieldMasker {

    /** Replacement for the hidden middle of a partially masked value. */
    public static final String PARTIAL_MASK = "****";

    /** Replacement for a fully masked value. */
    public static final String FULL_MASK = "********";

    private static final int VISIBLE_CHARS = 2;

    private FieldMasker() {
        // utility class
    }

    /**
     * Masks a value.
     * <ul>
     *   <li>{@code NONE}: value unchanged</li>
     *   <li>{@code PARTIAL}: first two and last two characters of the string form kept
     *       ({@code "1234567890"} becomes {@code "12****90"}); strings of four characters or
     *       fewer become {@value #PARTIAL_MASK}</li>
     *   <li>{@code FULL}: always {@value #FULL_MASK}</li>
     * </ul>
     * Null values pass through unmasked.
     */
    public static Object mask(Object value, MaskingType maskingType) {
        if (value == null || maskingType == null) {
            return value;
        }
        return switch (maskingType) {
            case NONE -> value;
            case PARTIAL -> maskPartially(String.valueOf(value));
            case FULL -> FULL_MASK;
        };
    }

    private static String maskPartially(String value) {
        if (value.length() <= VISIBLE_CHARS * 2) {
            return PARTIAL_MASK;
        }
        return value.substring(0, VISIBLE_CHARS) + PARTIAL_MASK + value.substring(value.length() - VISIBLE_CHARS);
    }
}
