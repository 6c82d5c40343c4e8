package com.complyhub.accesscontrol.field;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shapes entity payloads according to field security rules: removes fields a role may not
 * read, masks the ones it may only see redacted, and reports which fields it may write.
 * <p>
 * Rules are applied in list order. When several rules target the same field, the effect of
 * the last one wins for masking; a removal by any earlier rule is final because the field is
 * no longer present. Callers must therefore pass rules in a deterministic order.
 */
public class FieldSecurityFilter {

    /**
     * Checks whether a role may access a field.
     *
     * @param rule      the rule for the field, or null when the field is unrestricted
     * @param role      the caller's role
     * @param requested the access needed
     * @return true when no rule applies, or the role is listed and the rule permits the access
     */
    public boolean canAccessField(FieldSecurityRule rule, String role, FieldAccessType requested) {
        if (rule == null) {
            return true;
        }
        if (role == null || !rule.roles().contains(role)) {
            return false;
        }
        return requested == FieldAccessType.READ || rule.accessType() != FieldAccessType.READ;
    }

    /** Masks a single value; see {@link FieldMasker#mask(Object, MaskingType)}. */
    public Object maskField(Object value, MaskingType maskingType) {
        return FieldMasker.mask(value, maskingType);
    }

    /**
     * Returns a copy of {@code data} with unreadable fields removed and masked fields redacted.
     * The input map is not modified; key order is preserved. Applying the result again with
     * the same rules yields the same map.
     *
     * @param data       the entity payload (null yields an empty map)
     * @param entityType entity type the rules are matched against
     * @param rules      field rules in evaluation order
     * @param role       the caller's role
     */
    public Map<String, Object> applyFieldSecurity(
            Map<String, Object> data, String entityType, List<FieldSecurityRule> rules, String role) {
        if (data == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> result = new LinkedHashMap<>(data);
        if (rules == null) {
            return result;
        }
        for (FieldSecurityRule rule : rules) {
            if (rule == null || !rule.appliesTo(entityType) || !result.containsKey(rule.fieldName())) {
                continue;
            }
            if (!canAccessField(rule, role, FieldAccessType.READ)) {
                result.remove(rule.fieldName());
            } else if (rule.maskingType() != MaskingType.NONE) {
                result.put(rule.fieldName(), maskField(result.get(rule.fieldName()), rule.maskingType()));
            }
        }
        return result;
    }

    /**
     * Returns {@code allFields} minus every field some matching rule denies write access to.
     */
    public List<String> getWritableFields(
            String entityType, List<FieldSecurityRule> rules, String role, List<String> allFields) {
        if (allFields == null) {
            return List.of();
        }
        Set<String> restricted = unwritableFields(entityType, rules, role);
        return allFields.stream()
                .filter(field -> !restricted.contains(field))
                .toList();
    }

    /**
     * Returns a copy of an inbound payload without the fields the role may not write.
     */
    public Map<String, Object> stripUnwritableFields(
            Map<String, Object> data, String entityType, List<FieldSecurityRule> rules, String role) {
        if (data == null) {
            return new LinkedHashMap<>();
        }
        Set<String> restricted = unwritableFields(entityType, rules, role);
        Map<String, Object> result = new LinkedHashMap<>(data);
        result.keySet().removeAll(restricted);
        return result;
    }

    private Set<String> unwritableFields(String entityType, List<FieldSecurityRule> rules, String role) {
        Set<String> restricted = new LinkedHashSet<>();
        if (rules == null) {
            return restricted;
        }
        for (FieldSecurityRule rule : rules) {
            if (rule != null && rule.appliesTo(entityType)
                    && !canAccessField(rule, role, FieldAccessType.WRITE)) {
                restricted.add(rule.fieldName());
            }
        }
        return restricted;
    }
}
