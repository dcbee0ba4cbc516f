package com.e2eq.argumentation.dung;

import com.e2eq.argumentation.core.ArgumentGraph;
import com.e2eq.argumentation.core.BundleProjection;
import com.e2eq.argumentation.core.GraphValidator;
import com.e2eq.argumentation.core.Relation;
import com.e2eq.argumentation.exceptions.StructuralException;

import java.util.*;

/**
 * An abstract argumentation framework: a set of argument ids and a binary attack relation.
 * <p>
 * Arguments are indexed in natural string order; attack sets are kept as {@link BitSet}s over
 * that index so semantic checks are plain set operations. Instances are immutable.
 */
public final class ArgumentationFramework {

    private final List<String> arguments;
    private final Map<String, Integer> index;
    private final BitSet[] attackers;
    private final BitSet[] attacks;
    private final int attackCount;

    private ArgumentationFramework(SortedSet<String> args, Set<List<String>> attackPairs) {
        this.arguments = List.copyOf(args);
        this.index = new HashMap<>();
        for (int i = 0; i < arguments.size(); i++) {
            index.put(arguments.get(i), i);
        }
        int n = arguments.size();
        this.attackers = new BitSet[n];
        this.attacks = new BitSet[n];
        for (int i = 0; i < n; i++) {
            attackers[i] = new BitSet(n);
            attacks[i] = new BitSet(n);
        }
        for (List<String> pair : attackPairs) {
            int a = index.get(pair.get(0));
            int b = index.get(pair.get(1));
            attacks[a].set(b);
            attackers[b].set(a);
        }
        this.attackCount = attackPairs.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Arguments are all unit ids; every non-support relation becomes an attack.
     */
    public static ArgumentationFramework fromGraph(ArgumentGraph graph) {
        GraphValidator.validate(graph);
        Builder b = builder();
        graph.units().keySet().forEach(b::argument);
        for (Relation r : graph.relations()) {
            if (r.kind().isAttack()) {
                b.attack(r.src(), r.dst());
            }
        }
        return b.build();
    }

    /**
     * Arguments are bundle ids; a bundle edge with a negative aggregate becomes an attack.
     */
    public static ArgumentationFramework fromBundles(BundleProjection projection) {
        Builder b = builder();
        projection.bundles().keySet().forEach(b::argument);
        for (BundleProjection.BundleEdge e : projection.edges()) {
            if (e.attack()) {
                b.attack(e.srcBundle(), e.dstBundle());
            }
        }
        return b.build();
    }

    public List<String> arguments() { return arguments; }
    public int size() { return arguments.size(); }
    public int attackCount() { return attackCount; }
    public boolean contains(String argument) { return index.containsKey(argument); }

    public boolean attacks(String attacker, String target) {
        return attacks[indexOf(attacker)].get(indexOf(target));
    }

    public SortedSet<String> attackersOf(String argument) {
        return names(attackers[indexOf(argument)]);
    }

    public SortedSet<String> attackedBy(String argument) {
        return names(attacks[indexOf(argument)]);
    }

    int indexOf(String argument) {
        Integer i = index.get(argument);
        if (i == null) {
            throw new IllegalArgumentException("Unknown argument: " + argument);
        }
        return i;
    }

    String nameOf(int i) {
        return arguments.get(i);
    }

    BitSet attackersBits(int i) { return attackers[i]; }
    BitSet attacksBits(int i) { return attacks[i]; }

    BitSet bits(Collection<String> members) {
        BitSet s = new BitSet(size());
        for (String m : members) s.set(indexOf(m));
        return s;
    }

    SortedSet<String> names(BitSet s) {
        SortedSet<String> out = new TreeSet<>();
        for (int i = s.nextSetBit(0); i >= 0; i = s.nextSetBit(i + 1)) {
            out.add(arguments.get(i));
        }
        return out;
    }

    /**
     * Collects arguments and attacks. Attacks may be declared before their arguments; the
     * references are resolved, and dangling ones rejected, in {@link #build()}.
     */
    public static final class Builder {
        private final SortedSet<String> arguments = new TreeSet<>();
        private final Set<List<String>> attacks = new LinkedHashSet<>();

        private Builder() {}

        public Builder argument(String id) {
            arguments.add(Objects.requireNonNull(id, "argument"));
            return this;
        }

        public Builder arguments(String... ids) {
            for (String id : ids) argument(id);
            return this;
        }

        public Builder attack(String attacker, String target) {
            attacks.add(List.of(attacker, target));
            return this;
        }

        public ArgumentationFramework build() {
            List<String> violations = new ArrayList<>();
            for (List<String> pair : attacks) {
                for (String end : pair) {
                    if (!arguments.contains(end)) {
                        violations.add("Attack " + pair.get(0) + " -> " + pair.get(1)
                                + " references unknown argument '" + end + "'");
                    }
                }
            }
            if (!violations.isEmpty()) {
                throw new StructuralException(violations);
            }
            return new ArgumentationFramework(arguments, attacks);
        }
    }
}
