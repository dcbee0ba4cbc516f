package com.e2eq.argumentation.core;

import java.util.*;

/**
 * Immutable snapshot of units, relations and bundles, indexed by id. Cycles among relations
 * are plain id lookups, so no reasoning engine needs to special-case them.
 * <p>
 * Graphs are assembled through {@link Builder} and frozen with {@link Builder#build()}.
 * Referential integrity is not checked while building; {@link GraphValidator} runs when a
 * reasoning task is invoked.
 */
public final class ArgumentGraph {

    private final Map<String, ArgumentUnit> units;
    private final List<Relation> relations;
    private final Map<String, Relation> relationsById;
    private final Map<String, ArgumentBundle> bundles;
    private final Map<String, List<Relation>> incoming;
    private final Map<String, List<Relation>> outgoing;
    private final Set<String> warrantIds;

    private ArgumentGraph(Builder b) {
        this.units = Collections.unmodifiableMap(new LinkedHashMap<>(b.units));
        this.relations = List.copyOf(b.relations);
        this.bundles = Collections.unmodifiableMap(new LinkedHashMap<>(b.bundles));

        Map<String, Relation> byId = new LinkedHashMap<>();
        Map<String, List<Relation>> in = new HashMap<>();
        Map<String, List<Relation>> out = new HashMap<>();
        Set<String> warrants = new TreeSet<>();
        for (Relation r : relations) {
            byId.put(r.id(), r);
            in.computeIfAbsent(r.dst(), k -> new ArrayList<>()).add(r);
            out.computeIfAbsent(r.src(), k -> new ArrayList<>()).add(r);
            warrants.addAll(r.warrantIds());
        }
        in.replaceAll((k, v) -> List.copyOf(v));
        out.replaceAll((k, v) -> List.copyOf(v));
        this.relationsById = Collections.unmodifiableMap(byId);
        this.incoming = Collections.unmodifiableMap(in);
        this.outgoing = Collections.unmodifiableMap(out);
        this.warrantIds = Collections.unmodifiableSet(warrants);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder holding this graph's units, relations and bundles, relation ids included.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        units.values().forEach(b::addUnit);
        relations.forEach(b::addRelation);
        bundles.values().forEach(b::defineBundle);
        return b;
    }

    public Map<String, ArgumentUnit> units() { return units; }
    public Optional<ArgumentUnit> unit(String id) { return Optional.ofNullable(units.get(id)); }
    public boolean hasUnit(String id) { return units.containsKey(id); }
    public List<Relation> relations() { return relations; }
    public Optional<Relation> relation(String id) { return Optional.ofNullable(relationsById.get(id)); }
    public Map<String, ArgumentBundle> bundles() { return bundles; }
    public List<Relation> incoming(String unitId) { return incoming.getOrDefault(unitId, List.of()); }
    public List<Relation> outgoing(String unitId) { return outgoing.getOrDefault(unitId, List.of()); }

    /** Ids referenced as a warrant by at least one relation, sorted. */
    public Set<String> warrantIds() { return warrantIds; }
    public boolean isWarrant(String unitId) { return warrantIds.contains(unitId); }

    /**
     * Mutable construction phase. Not thread-safe; hand the built snapshot to reasoning code.
     */
    public static final class Builder {
        private final Map<String, ArgumentUnit> units = new LinkedHashMap<>();
        private final List<Relation> relations = new ArrayList<>();
        private final Set<String> relationIds = new HashSet<>();
        private final Map<String, ArgumentBundle> bundles = new LinkedHashMap<>();

        private Builder() {}

        public Builder addUnit(ArgumentUnit unit) {
            require(!units.containsKey(unit.id()), "Unit already exists: " + unit.id());
            units.put(unit.id(), unit);
            return this;
        }

        public Builder addClaim(String id, String text) {
            return addUnit(ArgumentUnit.claim(id, text));
        }

        public Builder addClaim(String id, String text, UnitType type) {
            return addUnit(ArgumentUnit.claim(id, text).withType(type));
        }

        public Builder addAxiom(String id, String text, double score) {
            return addUnit(ArgumentUnit.axiom(id, text, score));
        }

        public Builder addRelation(Relation relation) {
            String id = relation.id();
            if (id == null || id.isBlank()) {
                id = "e" + relations.size();
                while (relationIds.contains(id)) {
                    id = id + "'";
                }
                relation = relation.withId(id);
            }
            require(relationIds.add(id), "Relation already exists: " + id);
            relations.add(relation);
            return this;
        }

        /**
         * Swaps the relation with the same id for {@code relation}, keeping its position.
         */
        public Builder replaceRelation(Relation relation) {
            require(relation.id() != null && relationIds.contains(relation.id()),
                    "Unknown relation: " + relation.id());
            for (int i = 0; i < relations.size(); i++) {
                if (relations.get(i).id().equals(relation.id())) {
                    relations.set(i, relation);
                    break;
                }
            }
            return this;
        }

        public Builder addRelation(String src, String dst, RelationKind kind) {
            return addRelation(new Relation(src, dst, kind));
        }

        public Builder addRelation(String src, String dst, RelationKind kind, Double weight,
                                   List<String> warrantIds, GateMode gateMode) {
            return addRelation(new Relation(null, src, dst, kind, Optional.ofNullable(weight), warrantIds, gateMode));
        }

        public Builder addSupport(String src, String dst) {
            return addRelation(src, dst, RelationKind.SUPPORT);
        }

        public Builder addAttack(String src, String dst) {
            return addRelation(src, dst, RelationKind.ATTACK);
        }

        public Builder defineBundle(String id, String... unitIds) {
            return defineBundle(new ArgumentBundle(id, List.of(unitIds)));
        }

        public Builder defineBundle(ArgumentBundle bundle) {
            require(!bundles.containsKey(bundle.id()), "Argument bundle already exists: " + bundle.id());
            bundles.put(bundle.id(), bundle);
            return this;
        }

        public ArgumentGraph build() {
            return new ArgumentGraph(this);
        }

        private static void require(boolean cond, String msg) {
            if (!cond) throw new IllegalArgumentException(msg);
        }
    }
}
