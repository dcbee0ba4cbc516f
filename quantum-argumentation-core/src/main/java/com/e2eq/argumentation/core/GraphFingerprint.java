package com.e2eq.argumentation.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.*;

/**
 * Computes a stable hash of an argument graph by canonicalizing it to sorted JSON.
 * Unit and bundle order do not affect the hash. Relations are keyed by id, so reordering
 * relations with explicit ids keeps the hash, while reordering relations whose ids were
 * assigned by the builder ({@code e0}, {@code e1}, ...) changes it.
 */
public final class GraphFingerprint {
    private GraphFingerprint() {}

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    public static String compute(ArgumentGraph graph) {
        return hash(canonicalize(graph));
    }

    /**
     * SHA-256 of {@code canonical} serialized with map entries sorted by key.
     */
    public static String hash(Map<String, Object> canonical) {
        try {
            String json = MAPPER.writeValueAsString(canonical);
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(json.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute fingerprint", e);
        }
    }

    private static Map<String, Object> canonicalize(ArgumentGraph graph) {
        Map<String, Object> result = new TreeMap<>();

        Map<String, Object> units = new TreeMap<>();
        for (ArgumentUnit u : graph.units().values()) {
            Map<String, Object> uData = new TreeMap<>();
            uData.put("text", u.text());
            uData.put("type", u.type().name());
            uData.put("score", u.score().orElse(null));
            uData.put("axiom", u.axiom());
            uData.put("ignoreInfluence", u.ignoreInfluence());
            uData.put("evidence", u.evidence());
            units.put(u.id(), uData);
        }
        result.put("units", units);

        Map<String, Object> relations = new TreeMap<>();
        for (Relation r : graph.relations()) {
            Map<String, Object> rData = new TreeMap<>();
            rData.put("src", r.src());
            rData.put("dst", r.dst());
            rData.put("kind", r.kind().name());
            rData.put("weight", r.weight().orElse(null));
            rData.put("warrants", r.warrantIds());
            rData.put("gate", r.gateMode().name());
            rData.put("disabled", r.disabled());
            relations.put(r.id(), rData);
        }
        result.put("relations", relations);

        Map<String, Object> bundles = new TreeMap<>();
        for (ArgumentBundle b : graph.bundles().values()) {
            bundles.put(b.id(), new TreeSet<>(b.unitIds()));
        }
        result.put("bundles", bundles);
        return result;
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
