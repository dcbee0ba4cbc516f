package com.e2eq.argumentation.core;

import java.util.*;

/**
 * Result of projecting a claim graph onto its argument bundles. Relations inside a bundle are
 * kept verbatim; relations crossing bundles are replaced by one aggregated {@link BundleEdge}
 * per ordered bundle pair.
 */
public record BundleProjection(Map<String, ArgumentBundle> bundles,
                               Map<String, List<Relation>> internalRelations,
                               List<BundleEdge> edges,
                               WeightAggregation aggregation) {

    /**
     * Aggregated influence of one bundle on another.
     *
     * @param weight            aggregated signed weight in {@code [-1, 1]}
     * @param sourceRelationIds the claim-level relations that were aggregated
     */
    public record BundleEdge(String srcBundle, String dstBundle, double weight, List<String> sourceRelationIds) {
        public BundleEdge {
            sourceRelationIds = List.copyOf(sourceRelationIds);
        }

        public boolean attack() {
            return weight < 0;
        }

        public RelationKind kind() {
            return attack() ? RelationKind.ATTACK : RelationKind.SUPPORT;
        }
    }

    public BundleProjection {
        bundles = Collections.unmodifiableMap(new LinkedHashMap<>(bundles));
        internalRelations = Collections.unmodifiableMap(new LinkedHashMap<>(internalRelations));
        edges = List.copyOf(edges);
    }

    public Optional<BundleEdge> edge(String srcBundle, String dstBundle) {
        return edges.stream()
                .filter(e -> e.srcBundle().equals(srcBundle) && e.dstBundle().equals(dstBundle))
                .findFirst();
    }

    /**
     * Projects back to claim level: the in-bundle relations exactly as they were, followed by one
     * relation per bundle edge between the bundles' ids, weighted with the aggregate.
     */
    public List<Relation> toRelations() {
        List<Relation> out = new ArrayList<>();
        internalRelations.values().forEach(out::addAll);
        for (BundleEdge e : edges) {
            out.add(new Relation(e.srcBundle() + "->" + e.dstBundle(), e.srcBundle(), e.dstBundle(),
                    e.kind(), Optional.of(e.weight()), List.of(), GateMode.OR));
        }
        return List.copyOf(out);
    }
}
