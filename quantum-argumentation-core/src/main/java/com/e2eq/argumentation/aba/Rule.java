package com.e2eq.argumentation.aba;

import java.util.List;
import java.util.Objects;

/**
 * An inference rule {@code head <- body}. An empty body makes the head a fact.
 */
public record Rule(String head, List<String> body) {
    public Rule {
        Objects.requireNonNull(head, "head");
        body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public String toString() {
        return head + " <- " + String.join(", ", body);
    }
}
