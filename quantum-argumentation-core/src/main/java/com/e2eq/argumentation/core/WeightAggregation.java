package com.e2eq.argumentation.core;

import java.util.List;

/**
 * Combines the signed weights of all claim-level relations crossing from one bundle into
 * another. Every mode clamps its result to {@code [-1, 1]}.
 */
public enum WeightAggregation {
    SUM_CLAMP("sum-clamp"),
    MEAN("mean"),
    /** The weight of largest magnitude, the first one winning ties. */
    MAX("max");

    public static final double LOWER_BOUND = -1.0;
    public static final double UPPER_BOUND = 1.0;

    private final String key;

    WeightAggregation(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public double aggregate(List<Double> signedWeights) {
        if (signedWeights.isEmpty()) {
            return 0.0;
        }
        double value;
        switch (this) {
            case SUM_CLAMP -> value = signedWeights.stream().mapToDouble(Double::doubleValue).sum();
            case MEAN -> value = signedWeights.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            case MAX -> {
                value = signedWeights.get(0);
                for (double w : signedWeights) {
                    if (Math.abs(w) > Math.abs(value)) value = w;
                }
            }
            default -> throw new IllegalStateException("Unhandled aggregation " + this);
        }
        return Math.max(LOWER_BOUND, Math.min(UPPER_BOUND, value));
    }

    public static WeightAggregation fromKey(String key) {
        for (WeightAggregation a : values()) {
            if (a.key.equalsIgnoreCase(key) || a.name().equalsIgnoreCase(key)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Unknown bundle aggregation '" + key + "'");
    }
}
