/**
 * GridSweep source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.gridsweep.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.gridsweep.combo.CombinationBuilder} expands parameter specs into hashed combinations.</li>
 *   <li>{@code io.gridsweep.runtime.SweepRunner} filters settled work, dispatches the rest and collects results.</li>
 *   <li>{@code io.gridsweep.store.ResultStore} owns the sweep directory and its append-only log.</li>
 * </ul>
 */
package io.gridsweep;
