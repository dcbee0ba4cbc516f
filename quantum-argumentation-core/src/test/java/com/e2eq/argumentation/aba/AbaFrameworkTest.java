package com.e2eq.argumentation.aba;

import com.e2eq.argumentation.dung.Extension;
import com.e2eq.argumentation.dung.Semantics;
import com.e2eq.argumentation.exceptions.StructuralException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class AbaFrameworkTest {

    @Test
    void testDeriveFromSingleAssumption() {
        AbaFramework aba = new AbaFramework()
                .addAssumption("a")
                .addContrary("a", "not_a")
                .addRule("b", "a");

        Derivation b = aba.derive("b");
        assertEquals(List.of(new TreeSet<>(Set.of("a"))), b.supports());
        assertFalse(b.truncated());
        assertTrue(aba.derive("a").derivable());
        assertFalse(aba.derive("not_a").derivable());
    }

    @Test
    void testTranslationWithoutAttacks() {
        AbaFramework aba = new AbaFramework()
                .addAssumption("a")
                .addContrary("a", "not_a")
                .addRule("b", "a");

        AbaTranslation translation = aba.toAf();
        assertEquals(List.of("a:{a}", "b:{a}"), translation.framework().arguments());
        assertEquals(0, translation.framework().attackCount());

        AbaSolution solution = aba.solve(Semantics.GROUNDED);
        assertEquals(1, solution.extensions().size());
        AbaExtension extension = solution.extensions().get(0);
        assertEquals(Extension.of("a:{a}", "b:{a}"), extension.arguments());
        assertEquals(Set.of("a", "b"), extension.claims());
        assertEquals(Set.of("a"), extension.assumptions());
    }

    @Test
    void testContraryAttacksSupport() {
        AbaFramework aba = new AbaFramework()
                .addAssumptions("a", "c")
                .addContrary("a", "x")
                .addRule("x", "c");

        AbaTranslation translation = aba.toAf();
        assertTrue(translation.framework().attacks("x:{c}", "a:{a}"));
        assertEquals("x", translation.argument("x:{c}").orElseThrow().claim());

        AbaExtension grounded = aba.solve(Semantics.GROUNDED).extensions().get(0);
        assertEquals(Set.of("c"), grounded.assumptions());
        assertEquals(Set.of("c", "x"), grounded.claims());
    }

    @Test
    void testMinimalSupportsOnly() {
        AbaFramework aba = new AbaFramework()
                .addAssumptions("a", "b")
                .addRule("p", "a")
                .addRule("p", "a", "b")
                .addRule("p", "q")
                .addRule("q", "b");

        List<TreeSet<String>> expected = List.of(new TreeSet<>(Set.of("a")), new TreeSet<>(Set.of("b")));
        assertEquals(expected, aba.derive("p").supports());
    }

    @Test
    void testFactNeedsNoAssumption() {
        AbaFramework aba = new AbaFramework().addRule("sky_is_blue");

        assertEquals(List.of(new TreeSet<String>()), aba.derive("sky_is_blue").supports());
        assertEquals(List.of("sky_is_blue:{}"), aba.toAf().framework().arguments());
    }

    @Test
    void testAssumptionCannotBeRuleHead() {
        AbaFramework aba = new AbaFramework().addAssumption("a");
        assertThrows(StructuralException.class, () -> aba.addRule("a", "b"));

        AbaFramework other = new AbaFramework().addRule("h");
        assertThrows(StructuralException.class, () -> other.addAssumption("h"));
    }

    @Test
    void testCircularRulesRejected() {
        AbaFramework aba = new AbaFramework().addRule("p", "q");
        StructuralException ex = assertThrows(StructuralException.class, () -> aba.addRule("q", "p"));
        assertTrue(ex.getMessage().contains("Circular rule"));

        assertThrows(StructuralException.class, () -> new AbaFramework().addRule("h", "h"));
    }

    @Test
    void testCircularRulesAllowedWhenConfigured() {
        AbaFramework aba = new AbaFramework(true, AbaFramework.DEFAULT_DERIVATION_MAX_DEPTH)
                .addAssumption("a")
                .addRule("p", "q")
                .addRule("q", "p")
                .addRule("q", "a");

        assertEquals(List.of(new TreeSet<>(Set.of("a"))), aba.derive("p").supports());
    }

    @Test
    void testValidateReportsDanglingReferences() {
        AbaFramework aba = new AbaFramework()
                .addAssumption("a")
                .addContrary("z", "w")
                .addRule("p", "a", "undefined");

        StructuralException ex = assertThrows(StructuralException.class, aba::validate);
        assertEquals(2, ex.getViolations().size());
        assertTrue(ex.getMessage().contains("'z'"));
        assertTrue(ex.getMessage().contains("'undefined'"));
        assertThrows(StructuralException.class, () -> aba.derive("p"));
    }

    @Test
    void testDerivationDepthCeiling() {
        AbaFramework aba = new AbaFramework(false, 2)
                .addAssumption("a")
                .addRule("p3", "a")
                .addRule("p2", "p3")
                .addRule("p1", "p2")
                .addRule("p0", "p1");

        Derivation d = aba.derive("p0");
        assertTrue(d.truncated());
        assertFalse(d.derivable());
        assertTrue(aba.derive("p2").derivable());
    }

    @Test
    void testSnapshotKeepsRelevantClosure() {
        AbaFramework aba = new AbaFramework()
                .addAssumptions("a", "b")
                .addContrary("a", "na")
                .addContrary("b", "nb")
                .addRule("p", "a")
                .addRule("unrelated", "b");

        AbaSnapshot snapshot = aba.snapshot(List.of("p"));
        assertEquals(Set.of("a"), snapshot.assumptions());
        assertEquals(Map.of("a", "na"), snapshot.contraries());
        assertEquals(List.of(new Rule("p", List.of("a"))), snapshot.rules());
    }

    @Test
    void testFingerprintIgnoresRuleOrder() {
        AbaFramework first = new AbaFramework()
                .addAssumptions("a", "b")
                .addContrary("a", "na")
                .addRule("c", "a")
                .addRule("d", "b");
        AbaFramework second = new AbaFramework()
                .addAssumptions("b", "a")
                .addContrary("a", "na")
                .addRule("d", "b")
                .addRule("c", "a");
        AbaFramework otherContrary = new AbaFramework()
                .addAssumptions("a", "b")
                .addContrary("a", "d")
                .addRule("c", "a")
                .addRule("d", "b");

        assertEquals(first.fingerprint(), second.fingerprint());
        assertEquals(64, first.fingerprint().length());
        assertNotEquals(first.fingerprint(), otherContrary.fingerprint());
    }
}
