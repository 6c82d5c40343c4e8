package com.complyhub.accesscontrol.serialization;

import com.complyhub.accesscontrol.field.FieldSecurityRule;
import com.complyhub.accesscontrol.permission.PermissionGroup;
import com.complyhub.accesscontrol.restriction.AccessRestriction;
import com.complyhub.accesscontrol.session.SessionPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON reading and writing of access rule documents: role templates, permission groups,
 * field security rules, access restrictions and session policies.
 * <p>
 * Dates and durations are ISO-8601 strings ({@code 2025-01-07T09:30:00Z}, {@code PT30M}).
 * Enum values this version does not know map to the enum's declared default (for condition
 * operators, one that never matches) rather than failing the whole document.
 */
public final class AccessRuleSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private static final TypeReference<List<FieldSecurityRule>> FIELD_RULES = new TypeReference<>() {};
    private static final TypeReference<List<AccessRestriction>> RESTRICTIONS = new TypeReference<>() {};
    private static final TypeReference<List<PermissionGroup>> GROUPS = new TypeReference<>() {};

    private AccessRuleSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE);
    }

    /**
     * Serializes a rule document to JSON.
     *
     * @throws AccessRuleSerializationException if serialization fails
     */
    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AccessRuleSerializationException("Failed to serialize " + describe(value), e);
        }
    }

    /**
     * Reads a JSON document into the given type.
     *
     * @throws AccessRuleSerializationException if the JSON is malformed
     */
    public static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AccessRuleSerializationException("Failed to read " + type.getSimpleName(), e);
        }
    }

    /**
     * Reads a JSON document from a stream. The stream is not closed.
     *
     * @throws AccessRuleSerializationException if the stream cannot be read or the JSON is malformed
     */
    public static <T> T read(InputStream in, Class<T> type) {
        try {
            return MAPPER.readValue(new NonClosingInputStream(in), type);
        } catch (IOException | IllegalArgumentException e) {
            throw new AccessRuleSerializationException("Failed to read " + type.getSimpleName(), e);
        }
    }

    /** Reads a JSON array of field security rules. */
    public static List<FieldSecurityRule> readFieldSecurityRules(String json) {
        return readList(json, FIELD_RULES, "field security rules");
    }

    /** Reads a JSON array of access restrictions. */
    public static List<AccessRestriction> readAccessRestrictions(String json) {
        return readList(json, RESTRICTIONS, "access restrictions");
    }

    /** Reads a JSON array of permission groups. */
    public static List<PermissionGroup> readPermissionGroups(String json) {
        return readList(json, GROUPS, "permission groups");
    }

    /** Reads a single session policy. */
    public static SessionPolicy readSessionPolicy(String json) {
        return read(json, SessionPolicy.class);
    }

    /**
     * Reads a JSON document, returning empty on failure.
     */
    public static <T> Optional<T> tryRead(String json, Class<T> type) {
        try {
            return Optional.of(read(json, type));
        } catch (AccessRuleSerializationException e) {
            return Optional.empty();
        }
    }

    private static <T> List<T> readList(String json, TypeReference<List<T>> type, String what) {
        try {
            List<T> values = MAPPER.readValue(json, type);
            return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AccessRuleSerializationException("Failed to read " + what, e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /**
     * Exception thrown when a rule document cannot be read or written.
     */
    public static class AccessRuleSerializationException extends RuntimeException {
        public AccessRuleSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static final class NonClosingInputStream extends FilterInputStream {
        NonClosingInputStream(InputStream in) {
            super(in);
        }

        @Override
        public void close() {
            // owned by the caller
        }
    }
}
