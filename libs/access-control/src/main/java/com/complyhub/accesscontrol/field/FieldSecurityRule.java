package com.complyhub.accesscontrol.field;

import java.util.Set;

/**
 * Per-field read/write restriction with an optional masking transform.
 * <p>
 * Only roles listed in {@code roles} may access the field at all. A missing access type is
 * read as {@link FieldAccessType#READ} and a missing masking type as {@link MaskingType#NONE}.
 *
 * @param tenantId    owning firm
 * @param entityType  entity the field belongs to (e.g., "client")
 * @param fieldName   field the rule targets (e.g., "panNumber")
 * @param roles       roles allowed to access the field
 * @param accessType  access granted to those roles
 * @param maskingType redaction applied when the field is read
 */
public record FieldSecurityRule(
        String tenantId,
        String entityType,
        String fieldName,
        Set<String> roles,
        FieldAccessType accessType,
        MaskingType maskingType) {

    public FieldSecurityRule {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
        if (accessType == null) {
            accessType = FieldAccessType.READ;
        }
        if (maskingType == null) {
            maskingType = MaskingType.NONE;
        }
    }

    public boolean appliesTo(String entity) {
        return entityType != null && entityType.equals(entity);
    }
}
