package com.e2eq.argumentation.reasoner;

import com.e2eq.argumentation.core.BundleProjection;

/**
 * Bundle-level projection and the semantics evaluated over its bundle framework.
 */
public record BundleOutcome(BundleProjection projection, DungOutcome outcome) {
}
