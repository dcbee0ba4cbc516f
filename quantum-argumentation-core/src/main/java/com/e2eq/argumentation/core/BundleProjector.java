package com.e2eq.argumentation.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Groups claims into argument bundles and aggregates cross-bundle relations.
 * <p>
 * Declared bundles are used when the graph has any; otherwise each weakly connected component
 * of the support subgraph becomes a bundle, ids {@code arg_1, arg_2, ...} in component order.
 * Units outside every declared bundle do not take part in the projection.
 */
@ApplicationScoped
public class BundleProjector {
    private static final Logger LOG = Logger.getLogger(BundleProjector.class);

    public BundleProjection project(ArgumentGraph graph, WeightAggregation aggregation) {
        Objects.requireNonNull(aggregation, "aggregation");
        GraphValidator.validate(graph);

        Map<String, ArgumentBundle> bundles = graph.bundles().isEmpty()
                ? supportComponents(graph)
                : graph.bundles();

        Map<String, String> owner = new HashMap<>();
        for (ArgumentBundle b : bundles.values()) {
            for (String unitId : b.unitIds()) owner.put(unitId, b.id());
        }

        Map<String, List<Relation>> internal = new LinkedHashMap<>();
        for (String bundleId : bundles.keySet()) internal.put(bundleId, new ArrayList<>());
        // ordered bundle pair -> contributing relations, first-seen order
        Map<List<String>, List<Relation>> crossing = new LinkedHashMap<>();
        int skipped = 0;
        for (Relation r : graph.relations()) {
            String src = owner.get(r.src());
            String dst = owner.get(r.dst());
            if (src == null || dst == null) {
                skipped++;
                continue;
            }
            if (src.equals(dst)) {
                internal.get(src).add(r);
            } else {
                crossing.computeIfAbsent(List.of(src, dst), k -> new ArrayList<>()).add(r);
            }
        }

        List<BundleProjection.BundleEdge> edges = new ArrayList<>();
        for (Map.Entry<List<String>, List<Relation>> en : crossing.entrySet()) {
            List<Double> weights = en.getValue().stream().map(Relation::signedWeight).toList();
            List<String> ids = en.getValue().stream().map(Relation::id).toList();
            edges.add(new BundleProjection.BundleEdge(en.getKey().get(0), en.getKey().get(1),
                    aggregation.aggregate(weights), ids));
        }
        edges.sort(Comparator.comparing(BundleProjection.BundleEdge::srcBundle)
                .thenComparing(BundleProjection.BundleEdge::dstBundle));

        if (skipped > 0) {
            LOG.debugf("Bundle projection ignored %d relations touching unbundled units", skipped);
        }
        LOG.debugf("Projected %d units onto %d bundles with %d cross-bundle edges (%s)",
                graph.units().size(), bundles.size(), edges.size(), aggregation.key());

        Map<String, List<Relation>> frozen = new LinkedHashMap<>();
        internal.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return new BundleProjection(bundles, frozen, edges, aggregation);
    }

    /**
     * Bundles formed by the weakly connected components of the support relations.
     */
    public Map<String, ArgumentBundle> supportComponents(ArgumentGraph graph) {
        List<List<String>> components = GraphDiagnostics.weaklyConnectedComponents(
                graph.units().keySet(), graph.relations(), r -> !r.kind().isAttack());
        Map<String, ArgumentBundle> bundles = new LinkedHashMap<>();
        int n = 1;
        for (List<String> component : components) {
            String id = "arg_" + n++;
            bundles.put(id, new ArgumentBundle(id, component));
        }
        return bundles;
    }
}
