package com.complyhub.accesscontrol.metrics;

import com.complyhub.accesscontrol.metrics.AccessDecisionMetrics.Evaluator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AccessDecisionMetrics")
class AccessDecisionMetricsTest {

    @Test
    @DisplayName("counts decisions tagged by service, evaluator and outcome")
    void counts() {
        var registry = new SimpleMeterRegistry();
        var metrics = new AccessDecisionMetrics(registry, "engagement-service");

        metrics.record(Evaluator.PERMISSION, true);
        metrics.record(Evaluator.PERMISSION, true);
        metrics.record(Evaluator.PERMISSION, false);

        Counter allowed = registry.find(AccessDecisionMetrics.DECISIONS)
                .tag(AccessDecisionMetrics.TAG_SERVICE, "engagement-service")
                .tag(AccessDecisionMetrics.TAG_EVALUATOR, "permission")
                .tag(AccessDecisionMetrics.TAG_OUTCOME, AccessDecisionMetrics.OUTCOME_ALLOW)
                .counter();
        assertThat(allowed).isNotNull();
        assertThat(allowed.count()).isEqualTo(2.0);
        assertThat(metrics.counter(Evaluator.PERMISSION, false).count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a disabled instance records nothing")
    void disabled() {
        var metrics = AccessDecisionMetrics.disabled();

        metrics.record(Evaluator.SESSION, false);

        assertThat(metrics.enabled()).isFalse();
        assertThatThrownBy(() -> metrics.counter(Evaluator.SESSION, false))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("requires a registry and a service name")
    void preconditions() {
        assertThatThrownBy(() -> new AccessDecisionMetrics(null, "svc"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new AccessDecisionMetrics(new SimpleMeterRegistry(), " "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
