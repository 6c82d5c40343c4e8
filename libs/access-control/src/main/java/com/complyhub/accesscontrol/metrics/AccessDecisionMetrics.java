package com.complyhub.accesscontrol.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Counts allow/deny decisions per evaluator on a Micrometer {@link MeterRegistry}.
 * <p>
 * Every counter carries a {@code service} tag plus {@code evaluator} and {@code outcome}.
 * A disabled instance (see {@link #disabled()}) records nothing, which is what evaluators
 * use when constructed without metrics.
 */
public final class AccessDecisionMetrics {

    /** Counter name for access decisions. */
    public static final String DECISIONS = "complyhub.access.decisions";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_EVALUATOR = "evaluator";
    public static final String TAG_OUTCOME = "outcome";

    public static final String OUTCOME_ALLOW = "allow";
    public static final String OUTCOME_DENY = "deny";

    private static final AccessDecisionMetrics DISABLED = new AccessDecisionMetrics();

    private final MeterRegistry registry;
    private final String serviceName;

    private AccessDecisionMetrics() {
        this.registry = null;
        this.serviceName = null;
    }

    /**
     * Creates metrics bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a tag
     */
    public AccessDecisionMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** Returns an instance that records nothing. */
    public static AccessDecisionMetrics disabled() {
        return DISABLED;
    }

    public boolean enabled() {
        return registry != null;
    }

    /**
     * Increments the decision counter for the given evaluator and outcome.
     *
     * @param evaluator evaluator name (see {@link Evaluator})
     * @param allowed   decision outcome
     */
    public void record(Evaluator evaluator, boolean allowed) {
        if (registry == null) {
            return;
        }
        counter(evaluator, allowed).increment();
    }

    /**
     * Returns the counter for an evaluator/outcome pair, registering it on first use.
     */
    public Counter counter(Evaluator evaluator, boolean allowed) {
        if (registry == null) {
            throw new IllegalStateException("metrics are disabled");
        }
        return Counter.builder(DECISIONS)
                .description("Access-control decisions by evaluator and outcome")
                .tags(Tags.of(
                        TAG_SERVICE, serviceName,
                        TAG_EVALUATOR, evaluator.tagValue(),
                        TAG_OUTCOME, allowed ? OUTCOME_ALLOW : OUTCOME_DENY))
                .register(registry);
    }

    /** Evaluators that report decisions. */
    public enum Evaluator {
        PERMISSION("permission"),
        RESTRICTION("restriction"),
        SESSION("session"),
        CONCURRENT_SESSIONS("concurrent-sessions");

        private final String tagValue;

        Evaluator(String tagValue) {
            this.tagValue = tagValue;
        }

        public String tagValue() {
            return tagValue;
        }
    }
}
