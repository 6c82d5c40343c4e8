package com.complyhub.accesscontrol.permission;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Closed set of comparison operators usable in a {@link PermissionCondition}.
 * <p>
 * {@link #UNKNOWN} stands in for any operator name this version does not understand
 * (e.g., read from a newer rule document). It never matches, so a permission carrying
 * it is never applied.
 */
public enum ConditionOperator {

    EQUALS,
    NOT_EQUALS,
    IN,
    NOT_IN,
    CONTAINS,
    @JsonEnumDefaultValue
    UNKNOWN;

    /**
     * Applies this operator to a context value and the condition's configured value.
     *
     * @param contextValue the value looked up in the request context (may be null)
     * @param expected     the value configured on the condition (may be null)
     * @return whether the condition holds; never throws
     */
    public boolean test(Object contextValue, Object expected) {
        return switch (this) {
            case EQUALS -> valuesEqual(contextValue, expected);
            case NOT_EQUALS -> !valuesEqual(contextValue, expected);
            case IN -> {
                List<Object> candidates = asList(expected);
                yield candidates != null && containsValue(candidates, contextValue);
            }
            case NOT_IN -> {
                List<Object> candidates = asList(expected);
                yield candidates != null && !containsValue(candidates, contextValue);
            }
            case CONTAINS -> contains(contextValue, expected);
            case UNKNOWN -> false;
        };
    }

    private static boolean contains(Object contextValue, Object expected) {
        if (contextValue == null || expected == null) {
            return false;
        }
        List<Object> elements = asList(contextValue);
        if (elements != null) {
            return containsValue(elements, expected);
        }
        return String.valueOf(contextValue).contains(String.valueOf(expected));
    }

    private static boolean containsValue(List<Object> candidates, Object value) {
        for (Object candidate : candidates) {
            if (valuesEqual(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    /** Numbers compare by value so that 5 (Integer) equals 5L (Long) and 5.0 (Double). */
    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            try {
                return new BigDecimal(l.toString()).compareTo(new BigDecimal(r.toString())) == 0;
            } catch (NumberFormatException e) {
                return l.doubleValue() == r.doubleValue();
            }
        }
        return Objects.equals(left, right);
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        return null;
    }
}
