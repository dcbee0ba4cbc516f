package com.e2eq.argumentation.critique;

import com.e2eq.argumentation.core.ArgumentGraph;
import com.e2eq.argumentation.core.ArgumentUnit;
import com.e2eq.argumentation.core.GraphDiagnostics;
import com.e2eq.argumentation.core.GraphValidator;
import com.e2eq.argumentation.core.Relation;
import com.e2eq.argumentation.core.RelationKind;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Finds structural reasoning patterns in an argument graph and turns them into gate actions.
 * Detection reads only ids, relation kinds, warrants and unit text; scores play no part.
 */
public final class PatternDetector {
    private static final Logger LOG = Logger.getLogger(PatternDetector.class);

    private PatternDetector() {}

    /**
     * Every match in the graph, sorted.
     */
    public static List<PatternMatch> detect(ArgumentGraph graph) {
        GraphValidator.validate(graph);
        List<PatternMatch> matches = new ArrayList<>();
        circularReasoning(graph, matches);
        for (Relation r : graph.relations()) {
            if (r.kind().isAttack() && r.src().equals(r.dst())) {
                matches.add(new PatternMatch(PatternKind.SELF_ATTACK, List.of(r.src()), List.of(r.id()),
                        "Relation " + r.id() + " attacks its own source."));
            }
            if (!r.gated()) {
                matches.add(new PatternMatch(PatternKind.UNSTATED_WARRANT, List.of(r.src(), r.dst()),
                        List.of(r.id()), "Relation " + r.id() + " has no explicit warrants."));
            }
        }
        unsupportedConclusions(graph, matches);
        redundancy(graph, matches);
        contradictions(graph, matches);
        Collections.sort(matches);
        LOG.debugf("Detected %d pattern matches over %d units", matches.size(), graph.units().size());
        return List.copyOf(matches);
    }

    /**
     * A copy of {@code graph} with the relations of every {@link PatternAction#DISABLE_EDGE}
     * match disabled. Other actions leave the graph unchanged; unknown relation ids are skipped.
     */
    public static ArgumentGraph applyGateActions(ArgumentGraph graph, Collection<PatternMatch> matches) {
        ArgumentGraph.Builder builder = graph.toBuilder();
        Set<String> disabled = new TreeSet<>();
        for (PatternMatch m : matches) {
            if (m.action() != PatternAction.DISABLE_EDGE) continue;
            for (String id : m.edges()) {
                Optional<Relation> relation = graph.relation(id);
                if (relation.isPresent() && disabled.add(id)) {
                    builder.replaceRelation(relation.get().disable());
                }
            }
        }
        LOG.debugf("Gate actions disabled relations %s", disabled);
        return builder.build();
    }

    private static void circularReasoning(ArgumentGraph graph, List<PatternMatch> matches) {
        List<List<String>> sccs = GraphDiagnostics.stronglyConnectedComponents(graph.units().keySet(),
                graph.relations(), r -> r.kind() == RelationKind.SUPPORT);
        for (List<String> scc : sccs) {
            if (scc.size() < 2) continue;
            Set<String> members = new HashSet<>(scc);
            List<String> edges = graph.relations().stream()
                    .filter(r -> r.kind() == RelationKind.SUPPORT)
                    .filter(r -> members.contains(r.src()) && members.contains(r.dst()))
                    .map(Relation::id)
                    .toList();
            matches.add(new PatternMatch(PatternKind.CIRCULAR_REASONING, scc, edges,
                    "Support cycle across " + scc.size() + " claims."));
        }
    }

    private static void unsupportedConclusions(ArgumentGraph graph, List<PatternMatch> matches) {
        for (ArgumentUnit u : graph.units().values()) {
            if (u.axiom()) continue;
            boolean supported = graph.incoming(u.id()).stream().anyMatch(r -> r.kind() == RelationKind.SUPPORT);
            if (!supported) {
                matches.add(new PatternMatch(PatternKind.UNSUPPORTED_CONCLUSION, List.of(u.id()), List.of(),
                        "Claim " + u.id() + " has no incoming support relations."));
            }
        }
    }

    /**
     * Supports into one target whose sources read the same once case and spacing are normalized.
     * Sources without text are never compared.
     */
    private static void redundancy(ArgumentGraph graph, List<PatternMatch> matches) {
        Map<String, Map<String, List<Relation>>> byTarget = new LinkedHashMap<>();
        for (Relation r : graph.relations()) {
            if (r.kind() != RelationKind.SUPPORT) continue;
            String text = normalize(graph.unit(r.src()).map(ArgumentUnit::text).orElse(""));
            if (text.isEmpty()) continue;
            byTarget.computeIfAbsent(r.dst(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(text, k -> new ArrayList<>())
                    .add(r);
        }
        byTarget.forEach((target, groups) -> groups.values().forEach(group -> {
            if (group.size() < 2) return;
            SortedSet<String> nodes = new TreeSet<>();
            nodes.add(target);
            List<String> sources = new ArrayList<>();
            for (Relation r : group) {
                nodes.add(r.src());
                sources.add(r.src());
            }
            matches.add(new PatternMatch(PatternKind.REDUNDANCY, List.copyOf(nodes),
                    group.stream().map(Relation::id).toList(),
                    "Redundant supports to " + target + ": " + String.join(", ", sources) + "."));
        }));
    }

    private static void contradictions(ArgumentGraph graph, List<PatternMatch> matches) {
        Map<List<String>, List<Relation>> byPair = new LinkedHashMap<>();
        for (Relation r : graph.relations()) {
            byPair.computeIfAbsent(List.of(r.src(), r.dst()), k -> new ArrayList<>()).add(r);
        }
        byPair.forEach((pair, relations) -> {
            List<String> supports = relations.stream().filter(r -> !r.kind().isAttack()).map(Relation::id).toList();
            List<String> attacks = relations.stream().filter(r -> r.kind().isAttack()).map(Relation::id).toList();
            if (supports.isEmpty() || attacks.isEmpty()) return;
            List<String> edges = new ArrayList<>(supports);
            edges.addAll(attacks);
            matches.add(new PatternMatch(PatternKind.CONTRADICTION, pair, edges,
                    pair.get(0) + " both supports and attacks " + pair.get(1) + "."));
        });
    }

    private static String normalize(String text) {
        return String.join(" ", text.toLowerCase(Locale.ROOT).trim().split("\\s+"));
    }
}
