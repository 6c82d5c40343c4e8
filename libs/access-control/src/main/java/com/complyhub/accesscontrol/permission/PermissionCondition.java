package com.complyhub.accesscontrol.permission;

/**
 * Attribute condition attached to a {@link Permission}.
 *
 * @param field    name of the context attribute to inspect
 * @param operator comparison to apply; a missing operator is read as {@link ConditionOperator#UNKNOWN}
 * @param value    value to compare against; a collection for {@code IN} and {@code NOT_IN}
 */
public record PermissionCondition(String field, ConditionOperator operator, Object value) {

    public PermissionCondition {
        if (operator == null) {
            operator = ConditionOperator.UNKNOWN;
        }
    }

    /**
     * Evaluates this condition. A null context or a blank field name never matches.
     */
    public boolean matches(PermissionContext context) {
        if (context == null || field == null || field.isBlank()) {
            return false;
        }
        return operator.test(context.get(field), value);
    }
}
