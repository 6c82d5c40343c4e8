package com.complyhub.accesscontrol.permission;

import com.complyhub.accesscontrol.serialization.AccessRuleSerializer;
import com.complyhub.accesscontrol.serialization.AccessRuleSerializer.AccessRuleSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads {@link RoleTemplates} documents from JSON.
 */
public final class RoleTemplateLoader {

    /** Classpath location of the platform's default role templates. */
    public static final String DEFAULT_LOCATION = "role-permissions/default-role-permissions.json";

    private static final Logger log = LoggerFactory.getLogger(RoleTemplateLoader.class);

    private RoleTemplateLoader() {
        // utility class
    }

    /**
     * Loads the default role templates shipped with this library.
     *
     * @throws AccessRuleSerializationException if the resource is missing or malformed
     */
    public static RoleTemplates loadDefaults() {
        return fromClasspath(DEFAULT_LOCATION);
    }

    /**
     * Loads role templates from a classpath resource.
     *
     * @param location resource path relative to the classpath root
     * @throws AccessRuleSerializationException if the resource is missing or malformed
     */
    public static RoleTemplates fromClasspath(String location) {
        ClassLoader loader = RoleTemplateLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(location)) {
            if (in == null) {
                throw new AccessRuleSerializationException("Role templates not found on classpath: " + location, null);
            }
            RoleTemplates templates = load(in);
            log.info("Loaded {} role templates from classpath:{}", templates.roles().size(), location);
            return templates;
        } catch (IOException e) {
            throw new AccessRuleSerializationException("Failed to read role templates: " + location, e);
        }
    }

    /**
     * Loads role templates from a stream. The stream is not closed.
     *
     * @throws AccessRuleSerializationException if the JSON is malformed
     */
    public static RoleTemplates load(InputStream in) {
        return AccessRuleSerializer.read(in, RoleTemplates.class);
    }
}
