package com.e2eq.argumentation.dung;

import org.jboss.logging.Logger;

import java.util.*;
import java.util.concurrent.*;

/**
 * Grounded, complete, preferred and stable semantics over one {@link ArgumentationFramework}.
 * <p>
 * The grounded extension is the least fixed point of the characteristic function
 * F(S) = {a : S defends a}, reached by iterating F from the empty set.
 * Complete and preferred extensions come from one exact search over the admissible supersets
 * of the grounded extension: a branch adds or skips each remaining candidate argument in index
 * order and is cut as soon as it becomes conflicting or one of its members can no longer be
 * defended by the candidates left. Preferred extensions are the maximal admissible sets,
 * complete extensions the admissible fixed points of F, and stable extensions the preferred
 * ones that attack every argument they leave out.
 * <p>
 * Every list of extensions is in {@link Extension} order. Results are computed once per
 * instance and shared; the instance is safe to use from several threads.
 */
public class DungSemantics {
    private static final Logger LOG = Logger.getLogger(DungSemantics.class);

    private final ArgumentationFramework af;
    private final int parallelism;

    private volatile BitSet grounded;
    private volatile List<BitSet> admissibleAboveGrounded;

    public DungSemantics(ArgumentationFramework af) {
        this(af, 1);
    }

    /**
     * @param parallelism number of worker threads for the extension search; 1 searches inline
     */
    public DungSemantics(ArgumentationFramework af, int parallelism) {
        this.af = Objects.requireNonNull(af, "af");
        this.parallelism = Math.max(1, parallelism);
    }

    public ArgumentationFramework framework() {
        return af;
    }

    // ---- set-level predicates -------------------------------------------------------------

    public boolean conflictFree(Collection<String> s) {
        return conflictFree(af.bits(s));
    }

    public boolean defendedBy(Collection<String> s, String argument) {
        return defends(attackedBy(af.bits(s)), af.indexOf(argument));
    }

    public boolean admissible(Collection<String> s) {
        return admissible(af.bits(s));
    }

    /**
     * The characteristic function: every argument defended by {@code s}.
     */
    public Extension characteristic(Collection<String> s) {
        return new Extension(af.names(characteristic(af.bits(s))));
    }

    // ---- extensions -------------------------------------------------------------------------

    public Extension groundedExtension() {
        return new Extension(af.names(grounded()));
    }

    /**
     * Every admissible set, the empty set included. Exponential; intended for small frameworks
     * and for checking properties of the other semantics.
     */
    public List<Extension> admissibleSets() {
        List<BitSet> found = search(new BitSet(af.size()));
        return toExtensions(found);
    }

    public List<Extension> completeExtensions() {
        List<BitSet> complete = new ArrayList<>();
        for (BitSet s : admissibleAboveGrounded()) {
            if (characteristic(s).equals(s)) {
                complete.add(s);
            }
        }
        return toExtensions(complete);
    }

    public List<Extension> preferredExtensions() {
        return toExtensions(maximal(admissibleAboveGrounded()));
    }

    /**
     * Preferred extensions that attack every argument outside themselves. Empty when the
     * framework has no stable extension.
     */
    public List<Extension> stableExtensions() {
        List<BitSet> stable = new ArrayList<>();
        for (BitSet s : maximal(admissibleAboveGrounded())) {
            BitSet covered = attackedBy(s);
            covered.or(s);
            if (covered.cardinality() == af.size()) {
                stable.add(s);
            }
        }
        return toExtensions(stable);
    }

    public List<Extension> extensions(Semantics semantics) {
        return switch (semantics) {
            case GROUNDED -> List.of(groundedExtension());
            case COMPLETE -> completeExtensions();
            case PREFERRED -> preferredExtensions();
            case STABLE -> stableExtensions();
        };
    }

    // ---- labelings ----------------------------------------------------------------------------

    /**
     * in: member of the extension; out: attacked by a member; undec: otherwise.
     */
    public Labeling labelingFromExtension(Extension extension) {
        BitSet s = af.bits(extension.members());
        BitSet out = attackedBy(s);
        SortedMap<String, Label> labels = new TreeMap<>();
        for (int i = 0; i < af.size(); i++) {
            Label l = s.get(i) ? Label.IN : out.get(i) ? Label.OUT : Label.UNDEC;
            labels.put(af.nameOf(i), l);
        }
        return new Labeling(labels);
    }

    public List<Labeling> labelings(Semantics semantics) {
        return extensions(semantics).stream().map(this::labelingFromExtension).toList();
    }

    // ---- acceptance ---------------------------------------------------------------------------

    /**
     * True iff the argument belongs to every extension. False when there are no extensions.
     */
    public boolean skepticallyAccepted(String argument, Semantics semantics) {
        af.indexOf(argument);
        List<Extension> exts = extensions(semantics);
        return !exts.isEmpty() && exts.stream().allMatch(e -> e.contains(argument));
    }

    public boolean credulouslyAccepted(String argument, Semantics semantics) {
        af.indexOf(argument);
        return extensions(semantics).stream().anyMatch(e -> e.contains(argument));
    }

    // ---- internals ----------------------------------------------------------------------------

    private BitSet grounded() {
        BitSet g = grounded;
        if (g == null) {
            BitSet s = new BitSet(af.size());
            int iterations = 0;
            while (true) {
                iterations++;
                BitSet next = characteristic(s);
                if (next.equals(s)) break;
                s = next;
            }
            LOG.debugf("Grounded extension reached after %d iterations (%d of %d arguments)",
                    iterations, s.cardinality(), af.size());
            grounded = g = s;
        }
        return g;
    }

    private List<BitSet> admissibleAboveGrounded() {
        List<BitSet> a = admissibleAboveGrounded;
        if (a == null) {
            admissibleAboveGrounded = a = List.copyOf(search(grounded()));
        }
        return a;
    }

    private boolean conflictFree(BitSet s) {
        for (int i = s.nextSetBit(0); i >= 0; i = s.nextSetBit(i + 1)) {
            if (af.attacksBits(i).intersects(s)) return false;
        }
        return true;
    }

    private boolean admissible(BitSet s) {
        if (!conflictFree(s)) return false;
        BitSet attacked = attackedBy(s);
        for (int i = s.nextSetBit(0); i >= 0; i = s.nextSetBit(i + 1)) {
            if (!defends(attacked, i)) return false;
        }
        return true;
    }

    private BitSet attackedBy(BitSet s) {
        BitSet out = new BitSet(af.size());
        for (int i = s.nextSetBit(0); i >= 0; i = s.nextSetBit(i + 1)) {
            out.or(af.attacksBits(i));
        }
        return out;
    }

    /** Every attacker of {@code arg} is among the arguments attacked by the defending set. */
    private boolean defends(BitSet attackedBySet, int arg) {
        BitSet undefeated = (BitSet) af.attackersBits(arg).clone();
        undefeated.andNot(attackedBySet);
        return undefeated.isEmpty();
    }

    private BitSet characteristic(BitSet s) {
        BitSet attacked = attackedBy(s);
        BitSet out = new BitSet(af.size());
        for (int i = 0; i < af.size(); i++) {
            if (defends(attacked, i)) out.set(i);
        }
        return out;
    }

    /**
     * All admissible supersets of {@code base}, which must itself be admissible.
     */
    private List<BitSet> search(BitSet base) {
        BitSet excluded = attackedBy(base);
        for (int i = 0; i < af.size(); i++) {
            if (af.attacksBits(i).get(i) || af.attacksBits(i).intersects(base)) {
                excluded.set(i);
            }
        }
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < af.size(); i++) {
            if (!base.get(i) && !excluded.get(i)) candidates.add(i);
        }
        int[] cand = candidates.stream().mapToInt(Integer::intValue).toArray();

        long started = System.nanoTime();
        List<BitSet> found;
        if (parallelism > 1 && cand.length > 4) {
            found = searchParallel((BitSet) base.clone(), cand);
        } else {
            found = new ArrayList<>();
            extend((BitSet) base.clone(), cand, 0, found);
        }
        LOG.debugf("Admissible search over %d candidates found %d sets in %d ms",
                cand.length, found.size(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
        return found;
    }

    private void extend(BitSet s, int[] cand, int k, List<BitSet> found) {
        if (k == cand.length) {
            if (admissible(s)) found.add((BitSet) s.clone());
            return;
        }
        int a = cand[k];
        if (!af.attacksBits(a).intersects(s) && !af.attackersBits(a).intersects(s)) {
            s.set(a);
            if (defensible(s, cand, k + 1)) {
                extend(s, cand, k + 1, found);
            }
            s.clear(a);
        }
        if (defensible(s, cand, k + 1)) {
            extend(s, cand, k + 1, found);
        }
    }

    /**
     * Whether every attacker of a member is, or can still be, counter-attacked by the set
     * extended with candidates from position {@code k} on.
     */
    private boolean defensible(BitSet s, int[] cand, int k) {
        BitSet reachable = attackedBy(s);
        for (int j = k; j < cand.length; j++) {
            reachable.or(af.attacksBits(cand[j]));
        }
        for (int i = s.nextSetBit(0); i >= 0; i = s.nextSetBit(i + 1)) {
            if (!defends(reachable, i)) return false;
        }
        return true;
    }

    private List<BitSet> searchParallel(BitSet base, int[] cand) {
        int depth = Math.min(cand.length, 32 - Integer.numberOfLeadingZeros(parallelism) + 1);
        List<BitSet> prefixes = new ArrayList<>();
        collectPrefixes(base, cand, 0, depth, prefixes);

        ExecutorService pool = Executors.newFixedThreadPool(parallelism);
        try {
            List<Callable<List<BitSet>>> tasks = new ArrayList<>();
            for (BitSet prefix : prefixes) {
                tasks.add(() -> {
                    List<BitSet> local = new ArrayList<>();
                    extend((BitSet) prefix.clone(), cand, depth, local);
                    return local;
                });
            }
            List<BitSet> found = new ArrayList<>();
            for (Future<List<BitSet>> f : pool.invokeAll(tasks)) {
                found.addAll(f.get());
            }
            return found;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Extension search interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("Extension search failed", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private void collectPrefixes(BitSet s, int[] cand, int k, int depth, List<BitSet> out) {
        if (k == depth) {
            out.add((BitSet) s.clone());
            return;
        }
        int a = cand[k];
        if (!af.attacksBits(a).intersects(s) && !af.attackersBits(a).intersects(s)) {
            s.set(a);
            if (defensible(s, cand, k + 1)) collectPrefixes(s, cand, k + 1, depth, out);
            s.clear(a);
        }
        if (defensible(s, cand, k + 1)) collectPrefixes(s, cand, k + 1, depth, out);
    }

    private static List<BitSet> maximal(List<BitSet> sets) {
        List<BitSet> bySize = new ArrayList<>(sets);
        bySize.sort(Comparator.comparingInt(BitSet::cardinality).reversed());
        List<BitSet> kept = new ArrayList<>();
        for (BitSet s : bySize) {
            boolean dominated = false;
            for (BitSet k : kept) {
                BitSet rest = (BitSet) s.clone();
                rest.andNot(k);
                if (rest.isEmpty()) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated) kept.add(s);
        }
        return kept;
    }

    private List<Extension> toExtensions(List<BitSet> sets) {
        List<Extension> out = new ArrayList<>(sets.size());
        for (BitSet s : sets) out.add(new Extension(af.names(s)));
        Collections.sort(out);
        return List.copyOf(out);
    }
}
