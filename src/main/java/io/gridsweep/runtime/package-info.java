/**
 * Sweep orchestration.
 *
 * <p>{@link io.gridsweep.runtime.SweepRunner} connects the combination builder,
 * the bounded dispatcher and the result store, and decides which combinations
 * an earlier run already settled.
 */
package io.gridsweep.runtime;
