package com.e2eq.argumentation.aba;

import com.e2eq.argumentation.dung.Semantics;

import java.util.List;

/**
 * Extensions of an ABA framework under one semantics, in canonical extension order.
 * An empty list means the semantics has no extension for this framework.
 */
public record AbaSolution(Semantics semantics, List<AbaExtension> extensions, AbaTranslation translation) {
    public AbaSolution {
        extensions = List.copyOf(extensions);
    }
}
