package com.e2eq.argumentation.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphFingerprintTest {

    @Test
    void testFingerprintStability() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .addClaim("a", "A").addClaim("b", "B")
                .addAttack("a", "b")
                .build();

        String hash = GraphFingerprint.compute(graph);
        assertEquals(hash, GraphFingerprint.compute(graph));
        assertEquals(64, hash.length());
    }

    @Test
    void testFingerprintIndependentOfUnitOrder() {
        ArgumentGraph first = ArgumentGraph.builder()
                .addClaim("a", "A").addClaim("b", "B")
                .addAttack("a", "b")
                .build();
        ArgumentGraph second = ArgumentGraph.builder()
                .addClaim("b", "B").addClaim("a", "A")
                .addAttack("a", "b")
                .build();

        assertEquals(GraphFingerprint.compute(first), GraphFingerprint.compute(second));
    }

    @Test
    void testFingerprintChangesWithWeight() {
        ArgumentGraph first = ArgumentGraph.builder()
                .addClaim("a", "").addClaim("b", "")
                .addRelation("a", "b", RelationKind.ATTACK, 0.5, List.of(), null)
                .build();
        ArgumentGraph second = ArgumentGraph.builder()
                .addClaim("a", "").addClaim("b", "")
                .addRelation("a", "b", RelationKind.ATTACK, 0.6, List.of(), null)
                .build();

        assertNotEquals(GraphFingerprint.compute(first), GraphFingerprint.compute(second));
    }

    @Test
    void testFingerprintFollowsRelationIds() {
        ArgumentGraph explicit = ArgumentGraph.builder()
                .addClaim("a", "").addClaim("b", "").addClaim("c", "")
                .addRelation(new Relation("r1", "a", "b", RelationKind.SUPPORT, null, null, null))
                .addRelation(new Relation("r2", "c", "b", RelationKind.ATTACK, null, null, null))
                .build();
        ArgumentGraph explicitReordered = ArgumentGraph.builder()
                .addClaim("a", "").addClaim("b", "").addClaim("c", "")
                .addRelation(new Relation("r2", "c", "b", RelationKind.ATTACK, null, null, null))
                .addRelation(new Relation("r1", "a", "b", RelationKind.SUPPORT, null, null, null))
                .build();
        assertEquals(GraphFingerprint.compute(explicit), GraphFingerprint.compute(explicitReordered));

        ArgumentGraph generated = ArgumentGraph.builder()
                .addClaim("a", "").addClaim("b", "").addClaim("c", "")
                .addSupport("a", "b").addAttack("c", "b")
                .build();
        ArgumentGraph generatedReordered = ArgumentGraph.builder()
                .addClaim("a", "").addClaim("b", "").addClaim("c", "")
                .addAttack("c", "b").addSupport("a", "b")
                .build();
        assertNotEquals(GraphFingerprint.compute(generated), GraphFingerprint.compute(generatedReordered));
    }

    @Test
    void testFingerprintChangesWhenRelationDisabled() {
        ArgumentGraph graph = ArgumentGraph.builder()
                .addClaim("a", "").addClaim("b", "")
                .addSupport("a", "b")
                .build();
        ArgumentGraph disabled = graph.toBuilder()
                .replaceRelation(graph.relation("e0").orElseThrow().disable())
                .build();

        assertNotEquals(GraphFingerprint.compute(graph), GraphFingerprint.compute(disabled));
    }
}
