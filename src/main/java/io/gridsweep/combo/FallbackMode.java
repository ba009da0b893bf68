package io.gridsweep.combo;

/** What the builder does when a parameter cannot be resolved. */
public enum FallbackMode {
    /** Substitute the spec's deterministic textual form and emit a warning. */
    BEST_EFFORT,
    /** Propagate the {@link io.gridsweep.param.ResolutionException}. */
    STRICT
}
