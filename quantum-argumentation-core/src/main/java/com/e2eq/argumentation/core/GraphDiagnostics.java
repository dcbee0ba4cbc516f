package com.e2eq.argumentation.core;

import java.util.*;
import java.util.function.Predicate;

/**
 * Structural statistics for an argument graph: components, strongly connected components,
 * cycles, degrees and reachability. All listings are sorted so reports are reproducible.
 */
public final class GraphDiagnostics {
    private GraphDiagnostics() {}

    public record Degree(int in, int out) {}

    public record Report(int unitCount,
                         int relationCount,
                         int attackRelationCount,
                         int supportRelationCount,
                         List<List<String>> components,
                         List<List<String>> stronglyConnectedComponents,
                         List<List<String>> cyclicComponents,
                         List<String> isolatedUnits,
                         List<String> unsupportedUnits,
                         List<String> axioms,
                         Map<String, Degree> degrees,
                         Map<String, SortedSet<String>> reachability) {
        public boolean acyclic() {
            return cyclicComponents.isEmpty();
        }
    }

    public static Report analyze(ArgumentGraph graph) {
        List<String> nodes = new ArrayList<>(new TreeSet<>(graph.units().keySet()));
        List<Relation> all = graph.relations();

        Map<String, Degree> degrees = new TreeMap<>();
        Map<String, int[]> counts = new HashMap<>();
        for (String n : nodes) counts.put(n, new int[2]);
        Set<String> supported = new HashSet<>();
        int attacks = 0;
        for (Relation r : all) {
            counts.computeIfAbsent(r.dst(), k -> new int[2])[0]++;
            counts.computeIfAbsent(r.src(), k -> new int[2])[1]++;
            if (r.kind().isAttack()) {
                attacks++;
            } else {
                supported.add(r.dst());
            }
        }
        counts.forEach((k, v) -> degrees.put(k, new Degree(v[0], v[1])));

        List<String> isolated = new ArrayList<>();
        List<String> unsupported = new ArrayList<>();
        for (String n : nodes) {
            Degree d = degrees.get(n);
            if (d.in() == 0 && d.out() == 0) isolated.add(n);
            if (!supported.contains(n)) unsupported.add(n);
        }

        List<List<String>> sccs = stronglyConnectedComponents(nodes, all, r -> true);
        Set<String> selfLooped = new HashSet<>();
        for (Relation r : all) {
            if (r.src().equals(r.dst())) selfLooped.add(r.src());
        }
        List<List<String>> cyclic = new ArrayList<>();
        for (List<String> scc : sccs) {
            if (scc.size() > 1 || selfLooped.contains(scc.get(0))) cyclic.add(scc);
        }

        Map<String, SortedSet<String>> reach = new TreeMap<>();
        for (String n : nodes) {
            reach.put(n, Collections.unmodifiableSortedSet(reachableFrom(graph, n, r -> true)));
        }

        List<String> axioms = graph.units().values().stream()
                .filter(ArgumentUnit::axiom).map(ArgumentUnit::id).sorted().toList();

        return new Report(nodes.size(), all.size(), attacks, all.size() - attacks,
                weaklyConnectedComponents(nodes, all, r -> true), sccs, List.copyOf(cyclic),
                List.copyOf(isolated), List.copyOf(unsupported), axioms,
                Collections.unmodifiableMap(degrees), Collections.unmodifiableMap(reach));
    }

    /**
     * Returns every unit reachable from {@code start} along relations accepted by {@code filter}
     * (transitive closure, excluding {@code start} unless it lies on a cycle).
     */
    public static SortedSet<String> reachableFrom(ArgumentGraph graph, String start, Predicate<Relation> filter) {
        SortedSet<String> result = new TreeSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Relation r : graph.outgoing(current)) {
                if (filter.test(r) && result.add(r.dst())) {
                    queue.add(r.dst());
                }
            }
        }
        return result;
    }

    /**
     * Weakly connected components over the relations accepted by {@code filter}. Nodes with no
     * accepted relation form singleton components.
     */
    public static List<List<String>> weaklyConnectedComponents(Collection<String> nodes,
                                                               Collection<Relation> relations,
                                                               Predicate<Relation> filter) {
        Map<String, Set<String>> adjacency = new TreeMap<>();
        for (String n : nodes) adjacency.put(n, new TreeSet<>());
        for (Relation r : relations) {
            if (!filter.test(r)) continue;
            adjacency.computeIfAbsent(r.src(), k -> new TreeSet<>()).add(r.dst());
            adjacency.computeIfAbsent(r.dst(), k -> new TreeSet<>()).add(r.src());
        }

        Set<String> remaining = new TreeSet<>(adjacency.keySet());
        List<List<String>> components = new ArrayList<>();
        while (!remaining.isEmpty()) {
            String start = remaining.iterator().next();
            remaining.remove(start);
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            SortedSet<String> component = new TreeSet<>();
            component.add(start);
            while (!queue.isEmpty()) {
                String node = queue.poll();
                for (String neighbor : adjacency.get(node)) {
                    if (remaining.remove(neighbor)) {
                        component.add(neighbor);
                        queue.add(neighbor);
                    }
                }
            }
            components.add(List.copyOf(component));
        }
        components.sort(COMPONENT_ORDER);
        return List.copyOf(components);
    }

    /**
     * Tarjan's algorithm, iterative so deep chains cannot overflow the stack.
     */
    public static List<List<String>> stronglyConnectedComponents(Collection<String> nodes,
                                                                 Collection<Relation> relations,
                                                                 Predicate<Relation> filter) {
        Map<String, List<String>> adjacency = new TreeMap<>();
        for (String n : nodes) adjacency.put(n, new ArrayList<>());
        for (Relation r : relations) {
            if (!filter.test(r)) continue;
            adjacency.computeIfAbsent(r.src(), k -> new ArrayList<>()).add(r.dst());
            adjacency.computeIfAbsent(r.dst(), k -> new ArrayList<>());
        }

        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> low = new HashMap<>();
        Deque<String> stack = new ArrayDeque<>();
        Set<String> onStack = new HashSet<>();
        List<List<String>> components = new ArrayList<>();
        int counter = 0;

        for (String root : adjacency.keySet()) {
            if (index.containsKey(root)) continue;
            Deque<Map.Entry<String, Iterator<String>>> calls = new ArrayDeque<>();
            index.put(root, counter);
            low.put(root, counter++);
            stack.push(root);
            onStack.add(root);
            calls.push(Map.entry(root, adjacency.get(root).iterator()));

            while (!calls.isEmpty()) {
                Map.Entry<String, Iterator<String>> frame = calls.peek();
                String v = frame.getKey();
                Iterator<String> it = frame.getValue();
                if (it.hasNext()) {
                    String w = it.next();
                    if (!index.containsKey(w)) {
                        index.put(w, counter);
                        low.put(w, counter++);
                        stack.push(w);
                        onStack.add(w);
                        calls.push(Map.entry(w, adjacency.get(w).iterator()));
                    } else if (onStack.contains(w)) {
                        low.put(v, Math.min(low.get(v), index.get(w)));
                    }
                    continue;
                }
                calls.pop();
                if (low.get(v).equals(index.get(v))) {
                    SortedSet<String> component = new TreeSet<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(v));
                    components.add(List.copyOf(component));
                }
                if (!calls.isEmpty()) {
                    String parent = calls.peek().getKey();
                    low.put(parent, Math.min(low.get(parent), low.get(v)));
                }
            }
        }
        components.sort(COMPONENT_ORDER);
        return List.copyOf(components);
    }

    static final Comparator<List<String>> COMPONENT_ORDER = (a, b) -> {
        int c = Integer.compare(a.size(), b.size());
        if (c != 0) return c;
        for (int i = 0; i < a.size(); i++) {
            c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return 0;
    };
}
