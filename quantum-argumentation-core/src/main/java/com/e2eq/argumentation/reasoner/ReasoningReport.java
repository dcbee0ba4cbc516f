package com.e2eq.argumentation.reasoner;

import java.util.*;

/**
 * Results of one {@link Reasoner#run} call, keyed by task in request order.
 *
 * @param fingerprint hash of the graph or ABA framework the results were computed on
 */
public record ReasoningReport(String fingerprint,
                              Map<ReasoningTask, Object> results,
                              Optional<Explanations> explanations) {

    public ReasoningReport {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        explanations = explanations == null ? Optional.empty() : explanations;
    }

    public <T> T result(ReasoningTask task, Class<T> type) {
        Object value = results.get(task);
        if (value == null) {
            throw new IllegalArgumentException("Task was not run: " + task.key());
        }
        return type.cast(value);
    }

    public boolean contains(ReasoningTask task) {
        return results.containsKey(task);
    }
}
