package io.gridsweep.combo;

import java.util.List;

/** Combinations and per-parameter metadata produced by the same build pass. */
public record Expansion(List<Combination> combinations, List<ParameterMetadata> parameters) {
    public Expansion {
        combinations = List.copyOf(combinations);
        parameters = List.copyOf(parameters);
    }
}
