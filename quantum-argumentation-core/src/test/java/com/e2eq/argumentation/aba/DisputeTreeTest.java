package com.e2eq.argumentation.aba;

import com.e2eq.argumentation.dung.Semantics;
import com.e2eq.argumentation.exceptions.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DisputeTreeTest {

    /** a and b each attack the other through their contraries. */
    private AbaFramework mutualAttack() {
        return new AbaFramework()
                .addAssumptions("a", "b")
                .addContrary("a", "not_a")
                .addContrary("b", "not_b")
                .addRule("not_a", "b")
                .addRule("not_b", "a");
    }

    /** a0 is attacked through a1, defended through a2, and so on; a6 is unattacked. */
    private AbaFramework defenceChain() {
        AbaFramework aba = new AbaFramework();
        for (int i = 0; i <= 6; i++) {
            aba.addAssumption("a" + i);
        }
        for (int i = 0; i < 6; i++) {
            aba.addContrary("a" + i, "c" + i);
            aba.addRule("c" + i, "a" + (i + 1));
        }
        return aba;
    }

    @Test
    void testUnattackedGoalIsWon() {
        AbaFramework aba = new AbaFramework()
                .addAssumption("a")
                .addContrary("a", "not_a")
                .addRule("b", "a");

        DisputeResult result = new DisputeTreeBuilder(aba).build("b", Semantics.PREFERRED);

        assertTrue(result.won());
        assertTrue(result.converged());
        DisputeTree tree = result.winningTree().orElseThrow();
        assertEquals("b:{a}", tree.root().argument().id());
        assertEquals(MoveAnnotation.ROOT, tree.root().annotation());
        assertTrue(tree.root().children().isEmpty());
        assertEquals(Set.of("a"), tree.defences());
        assertTrue(tree.culprits().isEmpty());
        assertTrue(tree.admissible());
        assertEquals(List.of(new Rule("b", List.of("a"))), tree.snapshot().rules());
    }

    @Test
    void testUnanswerableAttackIsLost() {
        AbaFramework aba = new AbaFramework()
                .addAssumption("a")
                .addContrary("a", "x")
                .addRule("x");

        DisputeResult result = new DisputeTreeBuilder(aba).build("a", Semantics.PREFERRED);

        assertFalse(result.won());
        assertTrue(result.converged());
        DisputeTree tree = result.trees().get(0);
        assertEquals(DisputeOutcome.LOST, tree.outcome());
        DisputeNode opponent = tree.root().children().get(0);
        assertEquals(DisputeMove.OPPONENT, opponent.move());
        assertEquals("x:{}", opponent.argument().id());
        assertEquals(Optional.of("a"), opponent.target());
        assertEquals(MoveAnnotation.UNANSWERED, opponent.annotation());
        assertFalse(tree.admissible());
    }

    @Test
    void testMutualAttackWonUnderPreferred() {
        DisputeResult result = new DisputeTreeBuilder(mutualAttack()).build("a", Semantics.PREFERRED);

        assertTrue(result.won());
        DisputeTree tree = result.winningTree().orElseThrow();
        DisputeNode opponent = tree.root().children().get(0);
        assertEquals("not_a:{b}", opponent.argument().id());
        assertEquals(MoveAnnotation.COUNTERED, opponent.annotation());
        DisputeNode counter = opponent.children().get(0);
        assertEquals(DisputeMove.PROPONENT, counter.move());
        assertEquals("not_b:{a}", counter.argument().id());
        assertEquals(Optional.of("b"), counter.target());
        assertEquals(MoveAnnotation.COUNTER_ATTACK, counter.annotation());
        assertEquals(Set.of("a"), tree.defences());
        assertEquals(Set.of("b"), tree.culprits());
        assertTrue(tree.admissible());
    }

    @Test
    void testMutualAttackLostUnderGrounded() {
        DisputeResult result = new DisputeTreeBuilder(mutualAttack()).build("a", Semantics.GROUNDED);

        assertFalse(result.won());
        assertTrue(result.converged());
        assertEquals(DisputeOutcome.LOST, result.trees().get(0).outcome());
    }

    @Test
    void testDefenceChain() {
        DisputeResult grounded = new DisputeTreeBuilder(defenceChain()).build("a0", Semantics.GROUNDED);
        assertTrue(grounded.won());
        assertEquals(7, grounded.winningTree().orElseThrow().root().depth());

        DisputeResult complete = new DisputeTreeBuilder(defenceChain()).build("a0", Semantics.COMPLETE);
        assertTrue(complete.won());
        assertEquals(Set.of("a0", "a2", "a4", "a6"), complete.winningTree().orElseThrow().defences());
        assertEquals(Set.of("a1", "a3", "a5"), complete.winningTree().orElseThrow().culprits());
    }

    @Test
    void testDepthCeilingMarksResultUnconverged() {
        DisputeResult result = new DisputeTreeBuilder(defenceChain(), 2).build("a0", Semantics.PREFERRED);

        assertFalse(result.won());
        assertFalse(result.converged());
        assertEquals(DisputeOutcome.UNDECIDED, result.trees().get(0).outcome());
    }

    @Test
    void testOpponentMovesFollowContraryRegistrationOrder() {
        AbaFramework aba = new AbaFramework()
                .addAssumptions("a", "b")
                .addContrary("b", "nb")
                .addContrary("a", "na")
                .addRule("nb")
                .addRule("na")
                .addRule("g", "a", "b");

        DisputeTree tree = new DisputeTreeBuilder(aba).build("g", Semantics.PREFERRED).trees().get(0);

        assertEquals(DisputeOutcome.LOST, tree.outcome());
        List<DisputeNode> moves = tree.root().children();
        assertEquals(Optional.of("b"), moves.get(0).target());
        assertEquals(Optional.of("a"), moves.get(1).target());
    }

    @Test
    void testOneTreePerSupport() {
        AbaFramework aba = new AbaFramework()
                .addAssumptions("a", "b")
                .addContrary("a", "na")
                .addRule("na")
                .addRule("g", "a")
                .addRule("g", "b");

        DisputeResult result = new DisputeTreeBuilder(aba).build("g", Semantics.PREFERRED);

        assertEquals(2, result.trees().size());
        assertEquals(DisputeOutcome.LOST, result.trees().get(0).outcome());
        assertEquals(DisputeOutcome.WON, result.trees().get(1).outcome());
        assertEquals("g:{b}", result.winningTree().orElseThrow().root().argument().id());
    }

    @Test
    void testUnderivableGoalHasNoTrees() {
        DisputeResult result = new DisputeTreeBuilder(mutualAttack()).build("unknown", Semantics.PREFERRED);
        assertTrue(result.trees().isEmpty());
        assertFalse(result.won());
    }

    @Test
    void testStableSemanticsRejected() {
        DisputeTreeBuilder builder = new DisputeTreeBuilder(mutualAttack());
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> builder.build("a", Semantics.STABLE));
        assertEquals("semantics", ex.getOption());
    }

    @Test
    void testDepthMustBePositive() {
        assertThrows(ConfigurationException.class, () -> new DisputeTreeBuilder(mutualAttack(), 0));
    }

    @Test
    void testWonTreeConvergesWhenAnAbandonedBranchHitsTheCeiling() {
        // b is countered through c first, whose defence runs past depth 2; e then wins unattacked.
        AbaFramework aba = new AbaFramework()
                .addAssumptions("a", "b", "c", "e", "f", "g", "h")
                .addContrary("a", "x")
                .addContrary("b", "y")
                .addContrary("c", "z")
                .addContrary("f", "u")
                .addContrary("g", "v")
                .addRule("x", "b")
                .addRule("y", "c")
                .addRule("y", "e")
                .addRule("z", "f")
                .addRule("u", "g")
                .addRule("v", "h");

        for (Semantics semantics : List.of(Semantics.GROUNDED, Semantics.PREFERRED)) {
            DisputeResult result = new DisputeTreeBuilder(aba, 2).build("a", semantics);

            assertTrue(result.won(), semantics.key());
            assertTrue(result.converged(), semantics.key());
            DisputeTree tree = result.winningTree().orElseThrow();
            assertEquals(DisputeOutcome.WON, tree.outcome());
            assertTrue(tree.root().proponent());

            DisputeNode opponent = tree.root().children().get(0);
            assertFalse(opponent.proponent());
            assertEquals("x:{b}", opponent.argument().id());
            assertEquals(MoveAnnotation.COUNTERED, opponent.annotation());

            DisputeNode counter = opponent.children().get(0);
            assertTrue(counter.proponent());
            assertEquals("y:{e}", counter.argument().id());
            assertEquals(Optional.of("b"), counter.target());
            assertEquals(Set.of("a", "e"), tree.defences());
            assertEquals(Set.of("b"), tree.culprits());
        }
    }
}
