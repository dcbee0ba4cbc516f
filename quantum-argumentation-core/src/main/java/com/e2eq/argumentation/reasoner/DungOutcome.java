package com.e2eq.argumentation.reasoner;

import com.e2eq.argumentation.dung.Extension;
import com.e2eq.argumentation.dung.Labeling;
import com.e2eq.argumentation.dung.Semantics;

import java.util.List;

/**
 * Extensions under one semantics with the labeling derived from each, index for index.
 */
public record DungOutcome(Semantics semantics, List<Extension> extensions, List<Labeling> labelings) {
    public DungOutcome {
        extensions = List.copyOf(extensions);
        labelings = List.copyOf(labelings);
    }
}
