package com.e2eq.argumentation.credibility;

import com.e2eq.argumentation.config.ReasoningOptions;
import com.e2eq.argumentation.core.*;
import com.e2eq.argumentation.exceptions.ConfigurationException;
import com.e2eq.argumentation.exceptions.StructuralException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CredibilityPropagatorTest {

    private final CredibilityPropagator propagator = new CredibilityPropagator();

    private static ArgumentGraph supportChain() {
        return ArgumentGraph.builder()
                .addUnit(ArgumentUnit.claim("a", "Evidence-backed").withEvidence(0.6, 1.0))
                .addClaim("b", "Supported claim")
                .addSupport("a", "b")
                .build();
    }

    private static ArgumentGraph gated(GateMode mode) {
        return gated(mode, 0.9, 0.3);
    }

    private static ArgumentGraph gated(GateMode mode, double w1, double w2) {
        return ArgumentGraph.builder()
                .addAxiom("w1", "First warrant", w1)
                .addAxiom("w2", "Second warrant", w2)
                .addAxiom("a", "Premise", 1.0)
                .addClaim("b", "Conclusion")
                .addRelation("a", "b", RelationKind.SUPPORT, null, List.of("w1", "w2"), mode)
                .build();
    }

    @Test
    void testSupportChainConverges() {
        CredibilityResult result = propagator.propagate(supportChain());

        assertTrue(result.converged());
        assertEquals(0.8, result.evidence().get("a"), 1e-12);
        assertEquals(Math.tanh(0.8), result.score("a"), 1e-9);
        assertEquals(Math.tanh(Math.tanh(0.8)), result.score("b"), 1e-9);
        assertEquals(3, result.iterations());
        assertTrue(result.history().isEmpty());
    }

    @Test
    void testStepIsIdempotentAtConvergence() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .addUnit(ArgumentUnit.claim("a", "").withEvidence(0.9))
                .addUnit(ArgumentUnit.claim("b", "").withEvidence(0.4))
                .addUnit(ArgumentUnit.claim("c", "").withEvidence(0.7))
                .addSupport("a", "b")
                .addRelation("c", "b", RelationKind.ATTACK, 0.5, List.of(), null)
                .addRelation("b", "c", RelationKind.REBUT, 0.3, List.of(), null)
                .build();
        ReasoningOptions options = ReasoningOptions.defaults();

        CredibilityResult result = propagator.propagate(graph, options);
        assertTrue(result.converged());

        Map<String, Double> again = propagator.step(graph, result.scores(), options);
        for (Map.Entry<String, Double> e : result.scores().entrySet()) {
            assertEquals(e.getValue(), again.get(e.getKey()), 1e-5);
        }
    }

    @Test
    void testAndGateClosedByWeakWarrant() {
        CredibilityResult result = propagator.propagate(gated(GateMode.AND));

        assertFalse(result.gateOpen("e0"));
        assertEquals(0.0, result.score("b"), 1e-12);
        assertTrue(result.warrantActivation().get("w1"));
        assertFalse(result.warrantActivation().get("w2"));
    }

    @Test
    void testOrGateOpenedByStrongWarrant() {
        CredibilityResult result = propagator.propagate(gated(GateMode.OR));

        assertTrue(result.gateOpen("e0"));
        assertEquals(Math.tanh(1.0), result.score("b"), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({
            "AND, 0.9, 0.9, true",
            "AND, 0.9, 0.3, false",
            "AND, 0.3, 0.9, false",
            "AND, 0.3, 0.3, false",
            "OR, 0.9, 0.9, true",
            "OR, 0.9, 0.3, true",
            "OR, 0.3, 0.9, true",
            "OR, 0.3, 0.3, false"
    })
    void testGateCombinations(GateMode mode, double w1, double w2, boolean open) {
        CredibilityResult result = propagator.propagate(gated(mode, w1, w2));

        assertEquals(open, result.gateOpen("e0"));
        EdgeContribution edge = result.breakdowns().get("b").edges().get(0);
        assertEquals(open, edge.gateOpen());
        assertEquals(open ? 1.0 : 0.0, edge.contribution(), 0.0);
        assertEquals(Math.tanh(edge.contribution()), result.score("b"), 1e-12);
    }

    @Test
    void testDisabledRelationNeverTransmits() {
        ArgumentGraph graph = gated(GateMode.OR, 0.9, 0.9);
        ArgumentGraph disabled = graph.toBuilder()
                .replaceRelation(graph.relation("e0").orElseThrow().disable())
                .build();

        CredibilityResult result = propagator.propagate(disabled);
        assertFalse(result.gateOpen("e0"));
        assertEquals(0.0, result.score("b"), 0.0);
    }

    @Test
    void testAxiomsStayFixed() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .addAxiom("x", "Fixed", 0.9)
                .addUnit(ArgumentUnit.claim("y", "").withEvidence(1.0))
                .addAttack("y", "x")
                .build();

        CredibilityResult result = propagator.propagate(graph);
        assertEquals(0.9, result.score("x"), 0.0);
        assertTrue(result.breakdowns().get("x").axiom());
        assertTrue(result.breakdowns().get("x").edges().isEmpty());
    }

    @Test
    void testAttackUsesAbsoluteSourceScore() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .addAxiom("p", "", 1.0)
                .addClaim("q", "")
                .addClaim("r", "")
                .addAttack("p", "q")
                .addAttack("q", "r")
                .build();

        CredibilityResult result = propagator.propagate(graph);
        assertEquals(Math.tanh(-1.0), result.score("q"), 1e-9);
        assertTrue(result.score("r") < 0.0, "a discredited attacker still weakens its target");
        assertEquals(Math.tanh(-Math.abs(Math.tanh(-1.0))), result.score("r"), 1e-9);
    }

    @Test
    void testIgnoreInfluenceTransmitsNothing() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .addUnit(ArgumentUnit.axiom("a", "", 1.0).ignoringInfluence())
                .addClaim("b", "")
                .addSupport("a", "b")
                .build();

        CredibilityResult result = propagator.propagate(graph);
        assertEquals(0.0, result.score("b"), 1e-12);
        EdgeContribution edge = result.breakdowns().get("b").edges().get(0);
        assertTrue(edge.gateOpen());
        assertFalse(edge.transmitted());
        assertEquals(0.0, edge.contribution(), 0.0);
    }

    @Test
    void testBreakdownExplainsScore() {
        CredibilityResult result = propagator.propagate(supportChain());

        UnitBreakdown b = result.breakdowns().get("b");
        assertEquals(0.0, b.evidenceTerm(), 0.0);
        assertEquals(1, b.edges().size());
        assertEquals("a", b.edges().get(0).source());
        assertEquals(Math.tanh(b.evidenceTerm() + b.propagatedTerm()), b.score(), 1e-12);
        UnitBreakdown a = result.breakdowns().get("a");
        assertEquals(0.8, a.evidenceTerm(), 1e-12);
        assertEquals(0.0, a.propagatedTerm(), 0.0);
    }

    @Test
    void testIterationCeilingReportsNonConvergence() {
        ReasoningOptions options = ReasoningOptions.builder().maxIterations(1).recordHistory(true).build();

        CredibilityResult result = propagator.propagate(supportChain(), options);
        assertFalse(result.converged());
        assertEquals(1, result.iterations());
        assertEquals(2, result.history().size());
        assertEquals(0.8, result.history().get(0).get("a"), 1e-12);
    }

    @Test
    void testEvidenceWeightScalesEvidenceTerm() {
        ReasoningOptions options = ReasoningOptions.builder().evidenceWeight(0.5).build();

        CredibilityResult result = propagator.propagate(supportChain(), options);
        assertEquals(Math.tanh(0.4), result.score("a"), 1e-9);
    }

    @Test
    void testInvalidGraphAndOptionsRejected() {
        ArgumentGraph dangling = ArgumentGraph.builder().addClaim("a", "").addAttack("a", "b").build();
        assertThrows(StructuralException.class, () -> propagator.propagate(dangling));

        ReasoningOptions invalid = new ReasoningOptions(ReasoningOptions.DEFAULT_SEMANTICS,
                ReasoningOptions.DEFAULT_AGGREGATION, 0.5, 100, -1.0, 10, 1.0, 64, 1, false, false);
        assertThrows(ConfigurationException.class, () -> propagator.propagate(supportChain(), invalid));
    }
}
