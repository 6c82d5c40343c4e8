package com.complyhub.accesscontrol.spring;

import com.complyhub.accesscontrol.field.FieldSecurityFilter;
import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics;
import com.complyhub.accesscontrol.permission.PermissionResolver;
import com.complyhub.accesscontrol.permission.RoleHierarchy;
import com.complyhub.accesscontrol.permission.RolePermissionRepository;
import com.complyhub.accesscontrol.permission.RoleTemplateLoader;
import com.complyhub.accesscontrol.permission.RoleTemplates;
import com.complyhub.accesscontrol.restriction.AccessRestrictionEvaluator;
import com.complyhub.accesscontrol.serialization.AccessRuleSerializer.AccessRuleSerializationException;
import com.complyhub.accesscontrol.session.SessionPolicyEnforcer;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

/**
 * Registers the access-control engine as Spring beans.
 * <p>
 * Every bean backs off when the application defines its own, so a service can, for example,
 * supply a database-backed {@link RolePermissionRepository} and keep the rest.
 *
 * @see AccessControlProperties
 */
@AutoConfiguration
@EnableConfigurationProperties(AccessControlProperties.class)
public class AccessControlAutoConfiguration {

    /** Service tag used when {@code spring.application.name} is not set. */
    public static final String DEFAULT_SERVICE_NAME = "complyhub";

    private static final Logger log = LoggerFactory.getLogger(AccessControlAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock accessControlClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleTemplates roleTemplates(AccessControlProperties properties, ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(properties.rolePermissionsLocation());
        if (!resource.exists()) {
            throw new IllegalStateException(
                    "Role permission templates not found at " + properties.rolePermissionsLocation());
        }
        try (InputStream in = resource.getInputStream()) {
            RoleTemplates templates = RoleTemplateLoader.load(in);
            log.info("Loaded role templates for {} roles from {}",
                    templates.roles().size(), properties.rolePermissionsLocation());
            return templates;
        } catch (IOException e) {
            throw new AccessRuleSerializationException(
                    "Failed to read role templates from " + properties.rolePermissionsLocation(), e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public RolePermissionRepository rolePermissionRepository(RoleTemplates roleTemplates) {
        return roleTemplates.toRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleHierarchy roleHierarchy(RoleTemplates roleTemplates) {
        return roleTemplates.toHierarchy();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessDecisionMetrics accessDecisionMetrics(
            AccessControlProperties properties,
            ObjectProvider<MeterRegistry> meterRegistry,
            Environment environment) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (!properties.metricsEnabled() || registry == null) {
            return AccessDecisionMetrics.disabled();
        }
        return new AccessDecisionMetrics(
                registry, environment.getProperty("spring.application.name", DEFAULT_SERVICE_NAME));
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionResolver permissionResolver(
            RolePermissionRepository rolePermissionRepository, AccessDecisionMetrics metrics) {
        return new PermissionResolver(rolePermissionRepository, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldSecurityFilter fieldSecurityFilter() {
        return new FieldSecurityFilter();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessRestrictionEvaluator accessRestrictionEvaluator(
            Clock clock, AccessControlProperties properties, AccessDecisionMetrics metrics) {
        return new AccessRestrictionEvaluator(clock, properties.missingContextPolicy(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionPolicyEnforcer sessionPolicyEnforcer(
            Clock clock, AccessControlProperties properties, AccessDecisionMetrics metrics) {
        return new SessionPolicyEnforcer(clock, properties.sessionRefreshThreshold(), metrics);
    }
}
