package com.complyhub.accesscontrol.validation;

import java.util.List;

/**
 * Result of validating an access rule.
 *
 * @param valid  whether the rule passed all checks
 * @param errors validation error messages (empty if valid)
 */
public record RuleValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static RuleValidationResult ok() {
        return new RuleValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static RuleValidationResult fail(List<String> errors) {
        return new RuleValidationResult(false, List.copyOf(errors));
    }

    /** Returns the first error, or null when valid. */
    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
