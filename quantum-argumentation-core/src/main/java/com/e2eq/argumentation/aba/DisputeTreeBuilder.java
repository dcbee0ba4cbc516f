package com.e2eq.argumentation.aba;

import com.e2eq.argumentation.dung.Semantics;
import com.e2eq.argumentation.exceptions.ConfigurationException;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Searches for dispute trees that establish a goal in an {@link AbaFramework}.
 * <p>
 * The proponent opens with an argument for the goal; every attack on an assumption the
 * proponent relies on becomes an opponent move the proponent must answer by attacking one
 * assumption (the culprit) of the opponent argument. Opponent moves are answered depth first,
 * in contrary registration order, and the proponent backtracks over its alternatives.
 * <p>
 * Opponent arguments that use a culprit are already answered (culprit filtering). For
 * admissible semantics (complete, preferred) an assumption defended once need not be defended
 * again (defence filtering); for grounded semantics it must, a culprit only counts as answered
 * once its counter-attack is complete, and a proponent argument may not repeat on its own
 * branch, which keeps grounded trees finite.
 */
public class DisputeTreeBuilder {
    private static final Logger LOG = Logger.getLogger(DisputeTreeBuilder.class);

    public static final int DEFAULT_MAX_DEPTH = 10;

    private final AbaFramework framework;
    private final int maxDepth;

    public DisputeTreeBuilder(AbaFramework framework) {
        this(framework, DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth maximum number of opponent moves on one branch
     */
    public DisputeTreeBuilder(AbaFramework framework, int maxDepth) {
        this.framework = Objects.requireNonNull(framework, "framework");
        if (maxDepth < 1) {
            throw new ConfigurationException("dispute-max-depth", maxDepth, "must be at least 1");
        }
        this.maxDepth = maxDepth;
    }

    public DisputeResult build(String goal, Semantics semantics) {
        Objects.requireNonNull(goal, "goal");
        if (semantics == Semantics.STABLE) {
            throw new ConfigurationException("semantics", semantics.key(),
                    "dispute trees support grounded, complete and preferred semantics");
        }
        framework.validate();
        Search search = new Search(semantics != Semantics.GROUNDED);
        Derivation goalDerivation = search.derivation(goal);

        List<DisputeTree> trees = new ArrayList<>();
        boolean limited = false;
        for (SortedSet<String> support : goalDerivation.supports()) {
            search.depthLimited = false;
            DisputeTree tree = search.tree(goal, new AbaArgument(goal, support));
            limited |= tree.outcome() == DisputeOutcome.UNDECIDED;
            trees.add(tree);
        }
        // A won tree settles the goal whatever other supports ran into.
        boolean won = trees.stream().anyMatch(t -> t.outcome() == DisputeOutcome.WON);
        boolean converged = (won || !limited) && !search.derivationTruncated;
        LOG.debugf("Dispute search for '%s' under %s: %d candidate supports, won=%s, converged=%s",
                goal, semantics.key(), trees.size(), won, converged);
        return new DisputeResult(goal, semantics, trees, converged);
    }

    // ---- search state -----------------------------------------------------------------------

    /** An opponent move waiting for an answer. */
    private record Obligation(int id, int parent, String target, AbaArgument attacker, int depth,
                              Set<String> ancestors) implements Item {}

    /** Marks the end of the obligations opened by the counter-attack on {@code culprit}. */
    private record Settle(String culprit) implements Item {}

    private interface Item {}

    private record Agenda(Item head, Agenda tail) {
        static Agenda of(List<? extends Item> items, Agenda tail) {
            Agenda a = tail;
            for (int i = items.size() - 1; i >= 0; i--) a = new Agenda(items.get(i), a);
            return a;
        }
    }

    private record Answer(MoveAnnotation annotation, String culprit, Integer proponent) {}

    private record State(Set<String> defences,
                         Set<String> culprits,
                         Set<String> settled,
                         Map<Integer, AbaArgument> proponents,
                         Map<Integer, Obligation> obligations,
                         Map<Integer, Answer> answers,
                         int nextId) {

        State answer(Obligation ob, Answer answer) {
            Map<Integer, Answer> a = new HashMap<>(answers);
            a.put(ob.id(), answer);
            return new State(defences, culprits, settled, proponents, obligations, a, nextId);
        }

        State settle(String culprit) {
            Set<String> s = new HashSet<>(settled);
            s.add(culprit);
            return new State(defences, culprits, s, proponents, obligations, answers, nextId);
        }
    }

    private final class Search {
        private final boolean admissible;
        private final Map<String, Derivation> derivations = new HashMap<>();
        boolean depthLimited;
        boolean derivationTruncated;

        Search(boolean admissible) {
            this.admissible = admissible;
        }

        Derivation derivation(String atom) {
            Derivation d = derivations.computeIfAbsent(atom, framework::derive);
            derivationTruncated |= d.truncated();
            return d;
        }

        DisputeTree tree(String goal, AbaArgument rootArgument) {
            State initial = new State(Set.of(), Set.of(), Set.of(), Map.of(0, rootArgument),
                    Map.of(), Map.of(), 1);
            Set<String> ancestors = Set.of(rootArgument.id());
            List<Obligation> opened = new ArrayList<>();
            initial = open(initial, rootArgument.support(), 0, 1, ancestors, opened);

            Optional<State> won = solve(Agenda.of(opened, null), initial);
            if (won.isPresent()) {
                State s = won.get();
                return new DisputeTree(goal, DisputeOutcome.WON,
                        proponentNode(s, 0, Optional.empty(), MoveAnnotation.ROOT),
                        new TreeSet<>(s.defences()), new TreeSet<>(s.culprits()),
                        framework.snapshot(atomsOf(s)));
            }

            // Explain the loss one opponent move at a time.
            List<DisputeNode> children = new ArrayList<>();
            Set<String> atoms = new HashSet<>(rootArgument.support());
            atoms.add(goal);
            boolean limited = depthLimited;
            for (Obligation ob : opened) {
                Optional<State> answered = solve(Agenda.of(List.of(ob), null), initial);
                limited |= depthLimited;
                if (answered.isPresent()) {
                    children.add(opponentNode(answered.get(), ob));
                    atoms.addAll(atomsOf(answered.get()));
                } else {
                    children.add(new DisputeNode(DisputeMove.OPPONENT, ob.attacker(), Optional.of(ob.target()),
                            MoveAnnotation.UNANSWERED, List.of()));
                    atoms.add(ob.attacker().claim());
                    atoms.addAll(ob.attacker().support());
                }
            }
            depthLimited = limited;
            DisputeNode root = new DisputeNode(DisputeMove.PROPONENT, rootArgument, Optional.empty(),
                    MoveAnnotation.ROOT, children);
            return new DisputeTree(goal, limited ? DisputeOutcome.UNDECIDED : DisputeOutcome.LOST, root,
                    new TreeSet<>(initial.defences()), new TreeSet<>(), framework.snapshot(atoms));
        }

        /**
         * Adds {@code assumptions} to the defences and opens an obligation for every attack on the
         * ones that need defending.
         */
        private State open(State s, Set<String> assumptions, int parent, int depth,
                           Set<String> ancestors, List<Obligation> opened) {
            Set<String> fresh = new HashSet<>(assumptions);
            if (admissible) fresh.removeAll(s.defences());
            Set<String> defences = new HashSet<>(s.defences());
            defences.addAll(assumptions);

            Map<Integer, Obligation> obligations = new HashMap<>(s.obligations());
            int next = s.nextId();
            for (Map.Entry<String, String> c : framework.contraries().entrySet()) {
                if (!fresh.contains(c.getKey())) continue;
                for (SortedSet<String> support : derivation(c.getValue()).supports()) {
                    Obligation ob = new Obligation(next++, parent, c.getKey(),
                            new AbaArgument(c.getValue(), support), depth, ancestors);
                    obligations.put(ob.id(), ob);
                    opened.add(ob);
                }
            }
            return new State(defences, s.culprits(), s.settled(), s.proponents(), obligations, s.answers(), next);
        }

        private Optional<State> solve(Agenda agenda, State s) {
            if (agenda == null) return Optional.of(s);
            if (agenda.head() instanceof Settle settle) {
                return solve(agenda.tail(), s.settle(settle.culprit()));
            }
            Obligation ob = (Obligation) agenda.head();

            Set<String> answered = admissible ? s.culprits() : s.settled();
            for (String b : ob.attacker().support()) {
                if (answered.contains(b)) {
                    return solve(agenda.tail(), s.answer(ob, new Answer(MoveAnnotation.FILTERED, b, null)));
                }
            }
            if (ob.depth() > maxDepth) {
                depthLimited = true;
                return Optional.empty();
            }

            for (String culprit : ob.attacker().support()) {
                if (s.defences().contains(culprit)) continue;
                Optional<String> contrary = framework.contraryOf(culprit);
                if (contrary.isEmpty()) continue;
                for (SortedSet<String> support : derivation(contrary.get()).supports()) {
                    if (support.contains(culprit) || !Collections.disjoint(support, s.culprits())) continue;
                    AbaArgument counter = new AbaArgument(contrary.get(), support);
                    if (!admissible && ob.ancestors().contains(counter.id())) continue;

                    int id = s.nextId();
                    Map<Integer, AbaArgument> proponents = new HashMap<>(s.proponents());
                    proponents.put(id, counter);
                    Set<String> culprits = new HashSet<>(s.culprits());
                    culprits.add(culprit);
                    State next = new State(s.defences(), culprits, s.settled(), proponents,
                            s.obligations(), s.answers(), id + 1)
                            .answer(ob, new Answer(MoveAnnotation.COUNTERED, culprit, id));

                    Set<String> ancestors = new HashSet<>(ob.ancestors());
                    ancestors.add(counter.id());
                    List<Obligation> opened = new ArrayList<>();
                    next = open(next, support, id, ob.depth() + 1, ancestors, opened);

                    List<Item> items = new ArrayList<>(opened);
                    items.add(new Settle(culprit));
                    Optional<State> done = solve(Agenda.of(items, agenda.tail()), next);
                    if (done.isPresent()) return done;
                }
            }
            return Optional.empty();
        }

        private DisputeNode proponentNode(State s, int id, Optional<String> target, MoveAnnotation annotation) {
            List<DisputeNode> children = new ArrayList<>();
            s.obligations().values().stream()
                    .filter(ob -> ob.parent() == id && s.answers().containsKey(ob.id()))
                    .sorted(Comparator.comparingInt(Obligation::id))
                    .forEach(ob -> children.add(opponentNode(s, ob)));
            return new DisputeNode(DisputeMove.PROPONENT, s.proponents().get(id), target, annotation, children);
        }

        private DisputeNode opponentNode(State s, Obligation ob) {
            Answer answer = s.answers().get(ob.id());
            List<DisputeNode> children = answer.proponent() == null
                    ? List.of()
                    : List.of(proponentNode(s, answer.proponent(), Optional.of(answer.culprit()),
                            MoveAnnotation.COUNTER_ATTACK));
            return new DisputeNode(DisputeMove.OPPONENT, ob.attacker(), Optional.of(ob.target()),
                    answer.annotation(), children);
        }

        private Set<String> atomsOf(State s) {
            Set<String> atoms = new HashSet<>();
            for (AbaArgument a : s.proponents().values()) {
                atoms.add(a.claim());
                atoms.addAll(a.support());
            }
            for (Obligation ob : s.obligations().values()) {
                if (!s.answers().containsKey(ob.id())) continue;
                atoms.add(ob.attacker().claim());
                atoms.addAll(ob.attacker().support());
            }
            return atoms;
        }
    }
}
