package com.e2eq.argumentation.config;

import com.e2eq.argumentation.core.WeightAggregation;
import com.e2eq.argumentation.dung.Semantics;
import com.e2eq.argumentation.exceptions.ConfigurationException;

import java.util.Objects;

/**
 * Validated, immutable reasoning options. Every engine reads its settings from one of these;
 * {@link #validate()} runs before any computation starts.
 */
public record ReasoningOptions(Semantics semantics,
                               WeightAggregation bundleAggregation,
                               double gateThreshold,
                               int maxIterations,
                               double convergenceEpsilon,
                               int disputeMaxDepth,
                               double evidenceWeight,
                               int derivationMaxDepth,
                               int parallelism,
                               boolean allowCircularRules,
                               boolean recordHistory) {

    public static final Semantics DEFAULT_SEMANTICS = Semantics.GROUNDED;
    public static final WeightAggregation DEFAULT_AGGREGATION = WeightAggregation.SUM_CLAMP;
    public static final double DEFAULT_GATE_THRESHOLD = 0.5;
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_CONVERGENCE_EPSILON = 1e-6;
    public static final int DEFAULT_DISPUTE_MAX_DEPTH = 10;
    public static final double DEFAULT_EVIDENCE_WEIGHT = 1.0;
    public static final int DEFAULT_DERIVATION_MAX_DEPTH = 64;

    public ReasoningOptions {
        Objects.requireNonNull(semantics, "semantics");
        Objects.requireNonNull(bundleAggregation, "bundleAggregation");
    }

    public static ReasoningOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .semantics(semantics)
                .bundleAggregation(bundleAggregation)
                .gateThreshold(gateThreshold)
                .maxIterations(maxIterations)
                .convergenceEpsilon(convergenceEpsilon)
                .disputeMaxDepth(disputeMaxDepth)
                .evidenceWeight(evidenceWeight)
                .derivationMaxDepth(derivationMaxDepth)
                .parallelism(parallelism)
                .allowCircularRules(allowCircularRules)
                .recordHistory(recordHistory);
    }

    /**
     * Converts and validates mapped configuration. Unknown semantics or aggregation names are
     * reported as {@link ConfigurationException}s.
     */
    public static ReasoningOptions fromConfig(ReasoningConfig config) {
        Semantics semantics;
        try {
            semantics = Semantics.fromKey(config.semantics());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("semantics", config.semantics(),
                    "expected one of grounded, complete, preferred, stable");
        }
        WeightAggregation aggregation;
        try {
            aggregation = WeightAggregation.fromKey(config.bundleAggregation());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("bundle-aggregation", config.bundleAggregation(),
                    "expected one of sum-clamp, mean, max");
        }
        return new ReasoningOptions(semantics, aggregation, config.gateThreshold(), config.maxIterations(),
                config.convergenceEpsilon(), config.disputeMaxDepth(), config.evidenceWeight(),
                config.derivationMaxDepth(), config.parallelism(), config.allowCircularRules(),
                config.recordHistory()).validate();
    }

    /**
     * @return this instance, for chaining
     * @throws ConfigurationException on the first invalid option
     */
    public ReasoningOptions validate() {
        check(Double.isFinite(gateThreshold) && gateThreshold >= 0.0 && gateThreshold <= 1.0,
                "gate-threshold", gateThreshold, "must lie in [0, 1]");
        check(maxIterations >= 1, "max-iterations", maxIterations, "must be at least 1");
        check(Double.isFinite(convergenceEpsilon) && convergenceEpsilon > 0.0,
                "convergence-epsilon", convergenceEpsilon, "must be a positive number");
        check(disputeMaxDepth >= 1, "dispute-max-depth", disputeMaxDepth, "must be at least 1");
        check(Double.isFinite(evidenceWeight) && evidenceWeight >= 0.0,
                "evidence-weight", evidenceWeight, "must be a non-negative number");
        check(derivationMaxDepth >= 1, "derivation-max-depth", derivationMaxDepth, "must be at least 1");
        check(parallelism >= 1, "parallelism", parallelism, "must be at least 1");
        return this;
    }

    private static void check(boolean cond, String option, Object value, String constraint) {
        if (!cond) {
            throw new ConfigurationException(option, value, constraint);
        }
    }

    public static final class Builder {
        private Semantics semantics = DEFAULT_SEMANTICS;
        private WeightAggregation bundleAggregation = DEFAULT_AGGREGATION;
        private double gateThreshold = DEFAULT_GATE_THRESHOLD;
        private int maxIterations = DEFAULT_MAX_ITERATIONS;
        private double convergenceEpsilon = DEFAULT_CONVERGENCE_EPSILON;
        private int disputeMaxDepth = DEFAULT_DISPUTE_MAX_DEPTH;
        private double evidenceWeight = DEFAULT_EVIDENCE_WEIGHT;
        private int derivationMaxDepth = DEFAULT_DERIVATION_MAX_DEPTH;
        private int parallelism = 1;
        private boolean allowCircularRules;
        private boolean recordHistory;

        private Builder() {}

        public Builder semantics(Semantics semantics) { this.semantics = semantics; return this; }
        public Builder bundleAggregation(WeightAggregation aggregation) { this.bundleAggregation = aggregation; return this; }
        public Builder gateThreshold(double gateThreshold) { this.gateThreshold = gateThreshold; return this; }
        public Builder maxIterations(int maxIterations) { this.maxIterations = maxIterations; return this; }
        public Builder convergenceEpsilon(double epsilon) { this.convergenceEpsilon = epsilon; return this; }
        public Builder disputeMaxDepth(int depth) { this.disputeMaxDepth = depth; return this; }
        public Builder evidenceWeight(double lambda) { this.evidenceWeight = lambda; return this; }
        public Builder derivationMaxDepth(int depth) { this.derivationMaxDepth = depth; return this; }
        public Builder parallelism(int parallelism) { this.parallelism = parallelism; return this; }
        public Builder allowCircularRules(boolean allow) { this.allowCircularRules = allow; return this; }
        public Builder recordHistory(boolean record) { this.recordHistory = record; return this; }

        /**
         * @throws ConfigurationException when an option is out of range
         */
        public ReasoningOptions build() {
            return new ReasoningOptions(semantics, bundleAggregation, gateThreshold, maxIterations,
                    convergenceEpsilon, disputeMaxDepth, evidenceWeight, derivationMaxDepth, parallelism,
                    allowCircularRules, recordHistory).validate();
        }
    }
}
