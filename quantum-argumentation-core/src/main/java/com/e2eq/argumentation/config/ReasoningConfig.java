package com.e2eq.argumentation.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Maps the {@code argumentation.reasoning.*} properties. Names are kept as strings here and
 * converted, with validation, by {@link ReasoningOptions#fromConfig(ReasoningConfig)}.
 */
@ConfigMapping(prefix = "argumentation.reasoning")
public interface ReasoningConfig {

    /**
     * Acceptance semantics: grounded, complete, preferred or stable.
     * @return the semantics name
     */
    @WithDefault("grounded")
    String semantics();

    /**
     * How parallel cross-bundle relations combine: sum-clamp, mean or max.
     * @return the aggregation name
     */
    @WithDefault("sum-clamp")
    String bundleAggregation();

    /**
     * A warrant is active while its score is strictly above this value.
     * @return the gate threshold
     */
    @WithDefault("0.5")
    double gateThreshold();

    @WithDefault("100")
    int maxIterations();

    @WithDefault("1e-6")
    double convergenceEpsilon();

    /**
     * Maximum number of opponent moves on one dispute tree branch.
     * @return the dispute depth ceiling
     */
    @WithDefault("10")
    int disputeMaxDepth();

    /**
     * Weight of the evidence term in the credibility update.
     * @return lambda
     */
    @WithDefault("1.0")
    double evidenceWeight();

    @WithDefault("64")
    int derivationMaxDepth();

    /**
     * Worker threads for the extension search; 1 searches on the calling thread.
     * @return the parallelism
     */
    @WithDefault("1")
    int parallelism();

    @WithDefault("false")
    boolean allowCircularRules();

    @WithDefault("false")
    boolean recordHistory();
}
