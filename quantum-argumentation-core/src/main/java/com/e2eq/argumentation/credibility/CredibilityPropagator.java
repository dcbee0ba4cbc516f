package com.e2eq.argumentation.credibility;

import com.e2eq.argumentation.config.ReasoningOptions;
import com.e2eq.argumentation.core.ArgumentGraph;
import com.e2eq.argumentation.core.ArgumentUnit;
import com.e2eq.argumentation.core.GraphValidator;
import com.e2eq.argumentation.core.Relation;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Iterative credibility scoring over an argument graph.
 * <p>
 * Every non-axiom unit is updated synchronously as
 * {@code tanh(λ·E + Σ gate·|w|·sign·s)}, where {@code s} is the source score for supports and
 * its absolute value for attacks. Gates and source scores are read from the previous iteration.
 * Disabled relations are always closed. Axioms stay at their manual score; units that ignore influence still receive it but transmit
 * nothing. Iteration stops once no score moves by {@code convergence-epsilon} or more, or after
 * {@code max-iterations} updates, in which case the result is marked as not converged.
 */
@ApplicationScoped
public class CredibilityPropagator {
    private static final Logger LOG = Logger.getLogger(CredibilityPropagator.class);

    public CredibilityResult propagate(ArgumentGraph graph) {
        return propagate(graph, ReasoningOptions.defaults());
    }

    public CredibilityResult propagate(ArgumentGraph graph, ReasoningOptions options) {
        options.validate();
        GraphValidator.validate(graph);

        Map<String, Double> scores = initialScores(graph);
        Map<String, Double> previous = scores;
        List<Map<String, Double>> history = new ArrayList<>();
        if (options.recordHistory()) {
            history.add(Map.copyOf(scores));
        }

        int iterations = 0;
        boolean converged = false;
        double delta = Double.NaN;
        while (iterations < options.maxIterations()) {
            Map<String, Double> next = step(graph, scores, options);
            iterations++;
            delta = maxDelta(scores, next);
            previous = scores;
            scores = next;
            if (options.recordHistory()) {
                history.add(Map.copyOf(scores));
            }
            if (delta < options.convergenceEpsilon()) {
                converged = true;
                break;
            }
        }

        if (converged) {
            LOG.debugf("Credibility converged after %d iterations over %d units", iterations, scores.size());
        } else {
            LOG.warnf("Credibility did not converge within %d iterations (last change %.3g, epsilon %.3g)",
                    iterations, delta, options.convergenceEpsilon());
        }
        return assemble(graph, options, previous, scores, iterations, converged, history);
    }

    /**
     * score(0): the manual score of axioms, the evidence support E of every other unit.
     */
    public Map<String, Double> initialScores(ArgumentGraph graph) {
        Map<String, Double> scores = new TreeMap<>();
        for (ArgumentUnit u : graph.units().values()) {
            scores.put(u.id(), u.axiom() ? u.score().orElseThrow() : u.evidenceSupport());
        }
        return scores;
    }

    /**
     * One synchronous update of every unit from {@code scores}. Applying it to the scores of a
     * converged run returns them unchanged up to the convergence epsilon.
     */
    public Map<String, Double> step(ArgumentGraph graph, Map<String, Double> scores, ReasoningOptions options) {
        Map<String, Double> next = new TreeMap<>();
        for (ArgumentUnit u : graph.units().values()) {
            if (u.axiom()) {
                next.put(u.id(), u.score().orElseThrow());
                continue;
            }
            double z = options.evidenceWeight() * u.evidenceSupport();
            for (Relation r : graph.incoming(u.id())) {
                z += contribution(graph, r, scores, options).contribution();
            }
            next.put(u.id(), Math.tanh(z));
        }
        return next;
    }

    static boolean gateOpen(Relation r, Map<String, Double> scores, double threshold) {
        if (r.disabled()) {
            return false;
        }
        if (!r.gated()) {
            return true;
        }
        return r.gateMode().evaluate(r.warrantIds().stream().mapToDouble(scores::get), s -> s > threshold);
    }

    private EdgeContribution contribution(ArgumentGraph graph, Relation r, Map<String, Double> scores,
                                          ReasoningOptions options) {
        double sourceScore = scores.get(r.src());
        boolean open = gateOpen(r, scores, options.gateThreshold());
        boolean transmits = open && !graph.units().get(r.src()).ignoreInfluence();
        double value = 0.0;
        if (transmits) {
            double s = r.kind().isAttack() ? Math.abs(sourceScore) : sourceScore;
            value = r.kind().sign() * r.magnitude() * s;
        }
        return new EdgeContribution(r.id(), r.src(), r.kind(), r.magnitude(), open, transmits, sourceScore, value);
    }

    private CredibilityResult assemble(ArgumentGraph graph, ReasoningOptions options,
                                       Map<String, Double> previous, Map<String, Double> scores,
                                       int iterations, boolean converged, List<Map<String, Double>> history) {
        SortedMap<String, Double> evidence = new TreeMap<>();
        SortedMap<String, UnitBreakdown> breakdowns = new TreeMap<>();
        for (ArgumentUnit u : graph.units().values()) {
            double e = u.evidenceSupport();
            evidence.put(u.id(), e);
            if (u.axiom()) {
                breakdowns.put(u.id(), new UnitBreakdown(u.id(), true, e, 0.0, 0.0, scores.get(u.id()), List.of()));
                continue;
            }
            List<EdgeContribution> edges = new ArrayList<>();
            double propagated = 0.0;
            for (Relation r : graph.incoming(u.id())) {
                EdgeContribution c = contribution(graph, r, previous, options);
                edges.add(c);
                propagated += c.contribution();
            }
            breakdowns.put(u.id(), new UnitBreakdown(u.id(), false, e, options.evidenceWeight() * e,
                    propagated, scores.get(u.id()), edges));
        }

        Map<String, Boolean> gates = new LinkedHashMap<>();
        for (Relation r : graph.relations()) {
            gates.put(r.id(), gateOpen(r, previous, options.gateThreshold()));
        }
        SortedMap<String, Double> warrantScores = new TreeMap<>();
        SortedMap<String, Boolean> activation = new TreeMap<>();
        for (String w : graph.warrantIds()) {
            double s = previous.get(w);
            warrantScores.put(w, s);
            activation.put(w, s > options.gateThreshold());
        }
        return new CredibilityResult(new TreeMap<>(scores), evidence, gates, warrantScores, activation,
                breakdowns, iterations, converged, history);
    }

    private static double maxDelta(Map<String, Double> a, Map<String, Double> b) {
        double max = 0.0;
        for (Map.Entry<String, Double> e : a.entrySet()) {
            max = Math.max(max, Math.abs(e.getValue() - b.get(e.getKey())));
        }
        return max;
    }
}
