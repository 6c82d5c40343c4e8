package com.complyhub.accesscontrol.permission;

import com.complyhub.accesscontrol.AccessCheckResult;
import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.complyhub.accesscontrol.permission.PermissionAction.ADMIN;
import static com.complyhub.accesscontrol.permission.PermissionAction.APPROVE;
import static com.complyhub.accesscontrol.permission.PermissionAction.CREATE;
import static com.complyhub.accesscontrol.permission.PermissionAction.DELETE;
import static com.complyhub.accesscontrol.permission.PermissionAction.EXPORT;
import static com.complyhub.accesscontrol.permission.PermissionAction.READ;
import static com.complyhub.accesscontrol.permission.PermissionAction.UPDATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("PermissionResolver")
class PermissionResolverTest {

    private PermissionResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new PermissionResolver(RoleTemplateLoader.loadDefaults().toRepository());
    }

    @Test
    @DisplayName("rejects a null repository")
    void rejectsNullRepository() {
        assertThatThrownBy(() -> new PermissionResolver(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("getRolePermissions()")
    class RolePermissions {

        @Test
        @DisplayName("returns the template of a known role")
        void knownRole() {
            assertThat(resolver.getRolePermissions("SUPER_ADMIN"))
                    .containsExactly(Permission.of(Permission.WILDCARD, ADMIN));
        }

        @Test
        @DisplayName("delegates to the repository and treats a null answer as no permissions")
        void delegates() {
            var repository = mock(RolePermissionRepository.class);
            when(repository.findByRole("AUDITOR")).thenReturn(null);

            assertThat(new PermissionResolver(repository).getRolePermissions("AUDITOR")).isEmpty();
            verify(repository).findByRole("AUDITOR");
        }

        @Test
        @DisplayName("returns an empty list for an unknown role")
        void unknownRole() {
            assertThat(resolver.getRolePermissions("JANITOR")).isEmpty();
            assertThat(resolver.getRolePermissions(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("hasPermission()")
    class HasPermission {

        @Test
        @DisplayName("SUPER_ADMIN may do anything on any resource")
        void superAdminWildcard() {
            var perms = resolver.getRolePermissions("SUPER_ADMIN");
            for (PermissionAction action : PermissionAction.values()) {
                assertThat(resolver.hasPermission(perms, "anything", action)).isTrue();
            }
        }

        @Test
        @DisplayName("ADMIN on a resource implies every action on it")
        void adminImpliesAll() {
            var perms = List.of(Permission.of("clients", ADMIN));
            assertThat(resolver.hasPermission(perms, "clients", DELETE)).isTrue();
            assertThat(resolver.hasPermission(perms, "clients", EXPORT)).isTrue();
            assertThat(resolver.hasPermission(perms, "documents", READ)).isFalse();
        }

        @Test
        @DisplayName("TRAINEE can read clients but cannot create them")
        void traineeReadOnly() {
            var perms = resolver.getRolePermissions("TRAINEE");
            assertThat(resolver.hasPermission(perms, "clients", READ)).isTrue();
            assertThat(resolver.hasPermission(perms, "clients", CREATE)).isFalse();
        }

        @Test
        @DisplayName("a non-ADMIN action only matches itself")
        void exactAction() {
            var perms = List.of(Permission.of("reports", READ));
            assertThat(resolver.hasPermission(perms, "reports", UPDATE)).isFalse();
        }

        @Test
        @DisplayName("empty or null permission lists deny")
        void emptyDenies() {
            assertThat(resolver.hasPermission(List.of(), "clients", READ)).isFalse();
            assertThat(resolver.hasPermission(null, "clients", READ)).isFalse();
        }

        @Test
        @DisplayName("conditional permission holds only when every condition matches")
        void conditions() {
            var perms = List.of(Permission.of("documents", APPROVE,
                    new PermissionCondition("department", ConditionOperator.EQUALS, "audit"),
                    new PermissionCondition("amount", ConditionOperator.NOT_IN, List.of(0))));

            var ok = PermissionContext.empty().with("department", "audit").with("amount", 5000);
            var wrongDept = PermissionContext.of(Map.of("department", "tax", "amount", 5000));

            assertThat(resolver.hasPermission(perms, "documents", APPROVE, ok)).isTrue();
            assertThat(resolver.hasPermission(perms, "documents", APPROVE, wrongDept)).isFalse();
        }

        @Test
        @DisplayName("conditional permission fails when no context is supplied")
        void conditionsWithoutContext() {
            var perms = List.of(Permission.of("documents", APPROVE,
                    new PermissionCondition("department", ConditionOperator.EQUALS, "audit")));
            assertThat(resolver.hasPermission(perms, "documents", APPROVE)).isFalse();
        }

        @Test
        @DisplayName("a failing conditional entry does not hide an unconditional one")
        void laterUnconditionalWins() {
            var perms = List.of(
                    Permission.of("documents", READ,
                            new PermissionCondition("owner", ConditionOperator.EQUALS, "u-1")),
                    Permission.of("documents", ADMIN));
            assertThat(resolver.hasPermission(perms, "documents", READ, PermissionContext.empty())).isTrue();
        }
    }

    @Nested
    @DisplayName("checkPermission()")
    class CheckPermission {

        @Test
        @DisplayName("reports the missing permission in resource:ACTION form")
        void reportsMissing() {
            AccessCheckResult result = resolver.checkPermission(
                    resolver.getRolePermissions("TRAINEE"), "clients", DELETE, null);

            assertThat(result.allowed()).isFalse();
            assertThat(result.missingPermissions()).containsExactly("clients:DELETE");
            assertThat(result.reason()).isEqualTo("Missing DELETE permission on clients");
        }

        @Test
        @DisplayName("grants when a permission applies")
        void grants() {
            AccessCheckResult result = resolver.checkPermission(
                    List.of(Permission.of("clients", READ)), "clients", READ, null);
            assertThat(result.allowed()).isTrue();
            assertThat(result.missingPermissions()).isEmpty();
        }

        @Test
        @DisplayName("records the outcome on the decision counter")
        void recordsMetric() {
            var registry = new SimpleMeterRegistry();
            var metrics = new AccessDecisionMetrics(registry, "test-svc");
            var measured = new PermissionResolver(new InMemoryRolePermissionRepository(Map.of()), metrics);

            measured.checkPermission(List.of(), "clients", READ, null);

            assertThat(metrics.counter(AccessDecisionMetrics.Evaluator.PERMISSION, false).count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("mergePermissions()")
    class Merge {

        @Test
        @DisplayName("group entries replace role entries with the same key")
        void groupOverridesRole() {
            var conditional = Permission.of("reports", READ,
                    new PermissionCondition("region", ConditionOperator.EQUALS, "west"));
            var merged = resolver.mergePermissions(
                    List.of(conditional), List.of(Permission.of("reports", READ)), List.of());

            assertThat(merged).containsExactly(Permission.of("reports", READ));
        }

        @Test
        @DisplayName("a revoke removes the permission whichever source granted it")
        void revokeRemoves() {
            var merged = resolver.mergePermissions(
                    List.of(Permission.of("clients", READ)),
                    List.of(Permission.of("reports", EXPORT)),
                    List.of(PermissionOverride.revoke("reports:EXPORT"), PermissionOverride.revoke("clients:READ")));

            assertThat(merged).isEmpty();
        }

        @Test
        @DisplayName("a revoke wins even when both role and group grant the permission")
        void revokeBeatsRoleAndGroup() {
            var merged = resolver.mergePermissions(
                    List.of(Permission.of("clients", DELETE)),
                    List.of(Permission.of("clients", DELETE)),
                    List.of(PermissionOverride.revoke("clients:DELETE")));

            assertThat(resolver.hasPermission(merged, "clients", DELETE)).isFalse();
        }

        @Test
        @DisplayName("a grant adds an unconditional permission")
        void grantAdds() {
            var merged = resolver.mergePermissions(
                    List.of(Permission.of("clients", READ)), List.of(), List.of(PermissionOverride.grant("tools:DELETE")));

            assertThat(merged).containsExactly(Permission.of("clients", READ), Permission.of("tools", DELETE));
        }

        @Test
        @DisplayName("overrides apply in order: a later grant restores an earlier revoke")
        void overridesInOrder() {
            var merged = resolver.mergePermissions(
                    List.of(Permission.of("clients", READ)), List.of(),
                    List.of(PermissionOverride.revoke("clients:READ"), PermissionOverride.grant("clients:READ")));

            assertThat(merged).containsExactly(Permission.of("clients", READ));
        }

        @Test
        @DisplayName("a grant with a malformed key is ignored")
        void malformedGrantIgnored() {
            var merged = resolver.mergePermissions(
                    List.of(Permission.of("clients", READ)), List.of(),
                    List.of(PermissionOverride.grant("clients"), PermissionOverride.grant("clients:FLY")));

            assertThat(merged).containsExactly(Permission.of("clients", READ));
        }

        @Test
        @DisplayName("null inputs yield an empty set")
        void nulls() {
            assertThat(resolver.mergePermissions(null, null, null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("resolveEffectivePermissions()")
    class Resolve {

        @Test
        @DisplayName("combines role baseline, group grants and personal overrides")
        void combines() {
            var group = new PermissionGroup("t-1", "exporters", null, List.of(Permission.of("reports", EXPORT)));
            var effective = resolver.resolveEffectivePermissions(
                    "TRAINEE", List.of(group), List.of(PermissionOverride.revoke("tools:READ")));

            assertThat(resolver.hasPermission(effective, "reports", EXPORT)).isTrue();
            assertThat(resolver.hasPermission(effective, "clients", READ)).isTrue();
            assertThat(resolver.hasPermission(effective, "tools", READ)).isFalse();
        }

        @Test
        @DisplayName("an unknown role with no groups or overrides has no permissions")
        void unknownRole() {
            assertThat(resolver.resolveEffectivePermissions("NOBODY", null, null)).isEmpty();
        }
    }
}
