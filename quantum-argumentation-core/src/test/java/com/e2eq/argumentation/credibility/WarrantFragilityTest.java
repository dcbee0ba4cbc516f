package com.e2eq.argumentation.credibility;

import com.e2eq.argumentation.core.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WarrantFragilityTest {

    private static ArgumentGraph graph(double w1, double w2, GateMode mode) {
        return ArgumentGraph.builder()
                .addAxiom("w1", "", w1)
                .addAxiom("w2", "", w2)
                .addAxiom("a", "", 1.0)
                .addClaim("b", "")
                .addClaim("c", "")
                .addRelation("a", "b", RelationKind.SUPPORT, null, List.of("w1", "w2"), mode)
                .addSupport("a", "c")
                .build();
    }

    private static List<WarrantFragility.RelationFragility> analyze(ArgumentGraph graph) {
        CredibilityResult result = new CredibilityPropagator().propagate(graph);
        return WarrantFragility.analyze(graph, result, 0.5);
    }

    @Test
    void testAndGateWeakestWarrantIsCritical() {
        List<WarrantFragility.RelationFragility> report = analyze(graph(0.9, 0.6, GateMode.AND));

        assertEquals(1, report.size());
        WarrantFragility.RelationFragility f = report.get(0);
        assertEquals("e0", f.relationId());
        assertEquals("b", f.dst());
        assertTrue(f.open());
        assertEquals(0.6, f.gateScore(), 1e-12);
        assertEquals(List.of("w2"), f.criticalWarrants());
        assertEquals(0.1, f.margin(), 1e-9);
    }

    @Test
    void testOrGateTiedWarrantsAreBothCritical() {
        WarrantFragility.RelationFragility f = analyze(graph(0.9, 0.9, GateMode.OR)).get(0);

        assertTrue(f.open());
        assertEquals(List.of("w1", "w2"), f.criticalWarrants());
    }

    @Test
    void testClosedGateHasNegativeMargin() {
        WarrantFragility.RelationFragility f = analyze(graph(0.9, 0.3, GateMode.AND)).get(0);

        assertFalse(f.open());
        assertEquals(-0.2, f.margin(), 1e-9);
        assertEquals(List.of("w2"), f.criticalWarrants());
    }
}
