package com.e2eq.argumentation.aba;

import com.e2eq.argumentation.core.GraphFingerprint;
import com.e2eq.argumentation.dung.ArgumentationFramework;
import com.e2eq.argumentation.dung.DungSemantics;
import com.e2eq.argumentation.dung.Extension;
import com.e2eq.argumentation.dung.Semantics;
import com.e2eq.argumentation.exceptions.StructuralException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * A flat assumption-based argumentation framework: assumptions, their contraries and inference
 * rules over string atoms.
 * <p>
 * Assumptions may not be rule heads. Rules whose head is reachable again from their own body
 * through non-assumption atoms are rejected unless circular rules are explicitly allowed; in
 * that case derivation cuts the cycle.
 */
public class AbaFramework {
    private static final Logger LOG = Logger.getLogger(AbaFramework.class);

    public static final int DEFAULT_DERIVATION_MAX_DEPTH = 64;

    private final boolean allowCircularRules;
    private final int derivationMaxDepth;

    private final SortedSet<String> assumptions = new TreeSet<>();
    private final Map<String, String> contraries = new LinkedHashMap<>();
    private final List<Rule> rules = new ArrayList<>();
    private final Map<String, List<Rule>> rulesByHead = new HashMap<>();

    public AbaFramework() {
        this(false, DEFAULT_DERIVATION_MAX_DEPTH);
    }

    public AbaFramework(boolean allowCircularRules, int derivationMaxDepth) {
        require(derivationMaxDepth > 0, "derivationMaxDepth must be positive");
        this.allowCircularRules = allowCircularRules;
        this.derivationMaxDepth = derivationMaxDepth;
    }

    // ---- registration ---------------------------------------------------------------------

    public AbaFramework addAssumption(String atom) {
        Objects.requireNonNull(atom, "atom");
        if (rulesByHead.containsKey(atom)) {
            throw new StructuralException("Assumption '" + atom + "' is already the head of a rule");
        }
        assumptions.add(atom);
        return this;
    }

    public AbaFramework addAssumptions(String... atoms) {
        for (String a : atoms) addAssumption(a);
        return this;
    }

    /**
     * Registers {@code contrary} as the contrary of {@code assumption}. Registration order is the
     * order in which dispute search tries opponent moves. Re-registering replaces the contrary
     * and keeps the original position.
     */
    public AbaFramework addContrary(String assumption, String contrary) {
        Objects.requireNonNull(assumption, "assumption");
        Objects.requireNonNull(contrary, "contrary");
        contraries.put(assumption, contrary);
        return this;
    }

    public AbaFramework addRule(String head, String... body) {
        return addRule(new Rule(head, List.of(body)));
    }

    public AbaFramework addRule(Rule rule) {
        Objects.requireNonNull(rule, "rule");
        if (assumptions.contains(rule.head())) {
            throw new StructuralException("Rule head '" + rule.head() + "' is an assumption; only flat frameworks are supported");
        }
        if (closesCycle(rule)) {
            if (!allowCircularRules) {
                throw new StructuralException("Circular rule: '" + rule.head() + "' is reachable from its own body in " + rule);
            }
            LOG.debugf("Accepting circular rule %s", rule);
        }
        rules.add(rule);
        rulesByHead.computeIfAbsent(rule.head(), k -> new ArrayList<>()).add(rule);
        return this;
    }

    private boolean closesCycle(Rule rule) {
        Deque<String> pending = new ArrayDeque<>(rule.body());
        Set<String> seen = new HashSet<>();
        while (!pending.isEmpty()) {
            String atom = pending.pop();
            if (atom.equals(rule.head())) return true;
            if (assumptions.contains(atom) || !seen.add(atom)) continue;
            for (Rule r : rulesByHead.getOrDefault(atom, List.of())) {
                pending.addAll(r.body());
            }
        }
        return false;
    }

    // ---- accessors ------------------------------------------------------------------------

    public SortedSet<String> assumptions() {
        return Collections.unmodifiableSortedSet(assumptions);
    }

    public Map<String, String> contraries() {
        return Collections.unmodifiableMap(contraries);
    }

    public Optional<String> contraryOf(String assumption) {
        return Optional.ofNullable(contraries.get(assumption));
    }

    public List<Rule> rules() {
        return Collections.unmodifiableList(rules);
    }

    public boolean isAssumption(String atom) {
        return assumptions.contains(atom);
    }

    /**
     * Assumptions, rule heads and contrary atoms, sorted.
     */
    public SortedSet<String> atoms() {
        SortedSet<String> atoms = new TreeSet<>(assumptions);
        atoms.addAll(rulesByHead.keySet());
        atoms.addAll(contraries.values());
        return atoms;
    }

    // ---- validation -----------------------------------------------------------------------

    /**
     * Fails with every dangling contrary and undefined rule body atom. Contrary atoms need not be
     * derivable.
     */
    public void validate() {
        List<String> violations = new ArrayList<>();
        for (String a : contraries.keySet()) {
            if (!assumptions.contains(a)) {
                violations.add("Contrary declared for '" + a + "', which is not an assumption");
            }
        }
        for (Rule r : rules) {
            for (String atom : r.body()) {
                if (!assumptions.contains(atom) && !rulesByHead.containsKey(atom)) {
                    violations.add("Atom '" + atom + "' in rule " + r + " is neither an assumption nor a rule head");
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new StructuralException(violations);
        }
    }

    // ---- derivation -----------------------------------------------------------------------

    /**
     * Minimal sets of assumptions from which {@code atom} can be derived. An assumption is
     * supported by itself; an atom without rules is underivable.
     */
    public Derivation derive(String atom) {
        validate();
        boolean[] truncated = new boolean[1];
        Set<SortedSet<String>> found = supports(atom, new HashSet<>(), 0, truncated);
        if (truncated[0]) {
            LOG.warnf("Derivation of '%s' reached the depth ceiling of %d; supports may be incomplete",
                    atom, derivationMaxDepth);
        }
        return new Derivation(atom, canonical(found), truncated[0]);
    }

    private Set<SortedSet<String>> supports(String atom, Set<String> inProgress, int depth, boolean[] truncated) {
        if (assumptions.contains(atom)) {
            return Set.of(new TreeSet<>(Set.of(atom)));
        }
        if (depth >= derivationMaxDepth) {
            truncated[0] = true;
            return Set.of();
        }
        if (!inProgress.add(atom)) {
            return Set.of();
        }
        try {
            Set<SortedSet<String>> result = new HashSet<>();
            for (Rule rule : rulesByHead.getOrDefault(atom, List.of())) {
                Set<SortedSet<String>> partial = new HashSet<>();
                partial.add(new TreeSet<>());
                for (String b : rule.body()) {
                    Set<SortedSet<String>> bodySupports = supports(b, inProgress, depth + 1, truncated);
                    if (bodySupports.isEmpty()) {
                        partial = Set.of();
                        break;
                    }
                    Set<SortedSet<String>> joined = new HashSet<>();
                    for (SortedSet<String> left : partial) {
                        for (SortedSet<String> right : bodySupports) {
                            SortedSet<String> u = new TreeSet<>(left);
                            u.addAll(right);
                            joined.add(u);
                        }
                    }
                    partial = minimal(joined);
                }
                result.addAll(partial);
            }
            return minimal(result);
        } finally {
            inProgress.remove(atom);
        }
    }

    /** Drops every set that strictly contains another. */
    private static Set<SortedSet<String>> minimal(Set<SortedSet<String>> sets) {
        Set<SortedSet<String>> kept = new HashSet<>();
        for (SortedSet<String> s : sets) {
            boolean dominated = false;
            for (SortedSet<String> other : sets) {
                if (other.size() < s.size() && s.containsAll(other)) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated) kept.add(s);
        }
        return kept;
    }

    private static List<SortedSet<String>> canonical(Set<SortedSet<String>> sets) {
        List<SortedSet<String>> out = new ArrayList<>();
        for (SortedSet<String> s : sets) out.add(Collections.unmodifiableSortedSet(s));
        out.sort(AbaArgument.SUPPORT_ORDER);
        return out;
    }

    /**
     * Every argument for every atom, in {@link AbaArgument} order.
     */
    public List<AbaArgument> arguments() {
        validate();
        List<AbaArgument> out = new ArrayList<>();
        for (String atom : atoms()) {
            for (SortedSet<String> support : derive(atom).supports()) {
                out.add(new AbaArgument(atom, support));
            }
        }
        Collections.sort(out);
        return out;
    }

    // ---- abstract framework -----------------------------------------------------------------

    /**
     * One abstract argument per derivation; X attacks Y iff X's claim is the contrary of an
     * assumption in Y's support.
     */
    public AbaTranslation toAf() {
        List<AbaArgument> args = arguments();
        Map<String, List<AbaArgument>> byClaim = new HashMap<>();
        Map<String, AbaArgument> byId = new TreeMap<>();
        ArgumentationFramework.Builder builder = ArgumentationFramework.builder();
        for (AbaArgument a : args) {
            byClaim.computeIfAbsent(a.claim(), k -> new ArrayList<>()).add(a);
            byId.put(a.id(), a);
            builder.argument(a.id());
        }
        for (AbaArgument target : args) {
            for (String assumption : target.support()) {
                String contrary = contraries.get(assumption);
                if (contrary == null) continue;
                for (AbaArgument attacker : byClaim.getOrDefault(contrary, List.of())) {
                    builder.attack(attacker.id(), target.id());
                }
            }
        }
        ArgumentationFramework af = builder.build();
        LOG.debugf("Translated ABA framework into %d arguments and %d attacks", af.size(), af.attackCount());
        return new AbaTranslation(af, byId);
    }

    public AbaSolution solve(Semantics semantics) {
        return solve(semantics, 1);
    }

    public AbaSolution solve(Semantics semantics, int parallelism) {
        AbaTranslation translation = toAf();
        DungSemantics dung = new DungSemantics(translation.framework(), parallelism);
        List<AbaExtension> out = new ArrayList<>();
        for (Extension e : dung.extensions(semantics)) {
            SortedSet<String> claims = new TreeSet<>();
            SortedSet<String> accepted = new TreeSet<>();
            for (String id : e.members()) {
                AbaArgument a = translation.arguments().get(id);
                claims.add(a.claim());
                if (assumptions.contains(a.claim())) accepted.add(a.claim());
            }
            out.add(new AbaExtension(e, Collections.unmodifiableSortedSet(claims),
                    Collections.unmodifiableSortedSet(accepted)));
        }
        return new AbaSolution(semantics, out, translation);
    }

    // ---- snapshots ----------------------------------------------------------------------------

    /**
     * The assumptions, contraries and rules reachable from {@code atoms} through rule bodies and
     * contraries.
     */
    public AbaSnapshot snapshot(Collection<String> atoms) {
        Set<String> seen = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(atoms);
        SortedSet<String> usedAssumptions = new TreeSet<>();
        Set<Rule> usedRules = new LinkedHashSet<>();
        while (!pending.isEmpty()) {
            String atom = pending.pop();
            if (!seen.add(atom)) continue;
            if (assumptions.contains(atom)) {
                usedAssumptions.add(atom);
                continue;
            }
            for (Rule r : rulesByHead.getOrDefault(atom, List.of())) {
                usedRules.add(r);
                pending.addAll(r.body());
            }
        }
        Map<String, String> usedContraries = new LinkedHashMap<>();
        contraries.forEach((a, c) -> {
            if (usedAssumptions.contains(a)) usedContraries.put(a, c);
        });
        List<Rule> ordered = rules.stream().filter(usedRules::contains).toList();
        return new AbaSnapshot(usedAssumptions, usedContraries, ordered);
    }

    /**
     * Stable hash of the framework. Rule order does not affect it; contrary registration order
     * does, since it orders dispute search.
     */
    public String fingerprint() {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("assumptions", List.copyOf(assumptions));
        List<List<String>> contraryPairs = new ArrayList<>();
        contraries.forEach((a, c) -> contraryPairs.add(List.of(a, c)));
        canonical.put("contraries", contraryPairs);
        canonical.put("rules", rules.stream().map(Rule::toString).sorted().toList());
        canonical.put("allowCircularRules", allowCircularRules);
        canonical.put("derivationMaxDepth", derivationMaxDepth);
        return GraphFingerprint.hash(canonical);
    }

    private static void require(boolean cond, String msg) {
        if (!cond) throw new IllegalArgumentException(msg);
    }
}
