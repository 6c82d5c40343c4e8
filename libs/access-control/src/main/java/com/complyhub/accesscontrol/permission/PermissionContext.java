package com.complyhub.accesscontrol.permission;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable attribute map that permission conditions are evaluated against
 * (e.g., {@code tenantId}, {@code ownerId}, {@code clientStatus}).
 * <p>
 * Attribute values may be null; a null value and an absent key are treated alike.
 */
public final class PermissionContext {

    private static final PermissionContext EMPTY = new PermissionContext(Map.of());

    private final Map<String, Object> attributes;

    private PermissionContext(Map<String, Object> attributes) {
        this.attributes = attributes;
    }

    /** Returns a context with no attributes. */
    public static PermissionContext empty() {
        return EMPTY;
    }

    /**
     * Creates a context from the given attributes. The map is copied.
     *
     * @param attributes attribute name to value; null yields an empty context
     */
    public static PermissionContext of(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return EMPTY;
        }
        return new PermissionContext(Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
    }

    /** Returns a copy of this context with one attribute added or replaced. */
    public PermissionContext with(String field, Object value) {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("field must not be null or blank");
        }
        Map<String, Object> copy = new LinkedHashMap<>(attributes);
        copy.put(field, value);
        return new PermissionContext(Collections.unmodifiableMap(copy));
    }

    /** Returns the attribute value, or null when absent. */
    public Object get(String field) {
        return attributes.get(field);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PermissionContext other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "PermissionContext" + attributes;
    }
}
