package com.e2eq.argumentation.credibility;

import com.e2eq.argumentation.core.RelationKind;

/**
 * What one incoming relation added to its destination's pre-activation in the last update.
 *
 * @param gateOpen    the warrant gate was open (ungated relations are open unless disabled)
 * @param transmitted false when the gate was closed or the source ignores influence
 * @param sourceScore the source score the update read
 */
public record EdgeContribution(String relationId,
                               String source,
                               RelationKind kind,
                               double magnitude,
                               boolean gateOpen,
                               boolean transmitted,
                               double sourceScore,
                               double contribution) {
}
