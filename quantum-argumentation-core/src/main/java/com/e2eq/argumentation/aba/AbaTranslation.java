package com.e2eq.argumentation.aba;

import com.e2eq.argumentation.dung.ArgumentationFramework;

import java.util.Map;
import java.util.Optional;

/**
 * An ABA framework rendered as an abstract framework. Argument ids map back to derivations.
 */
public record AbaTranslation(ArgumentationFramework framework, Map<String, AbaArgument> arguments) {
    public AbaTranslation {
        arguments = Map.copyOf(arguments);
    }

    public Optional<AbaArgument> argument(String id) {
        return Optional.ofNullable(arguments.get(id));
    }
}
