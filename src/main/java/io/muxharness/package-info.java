/**
 * MuxHarness source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.muxharness.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.muxharness.cli.MuxHarnessCommand} maps commands to the orchestrator.</li>
 *   <li>{@code io.muxharness.runtime.RunOrchestrator} sequences scenarios and owns the final sweep.</li>
 *   <li>{@code io.muxharness.process.ProcessTargetRunner} is the only place that launches the target.</li>
 * </ul>
 */
package io.muxharness;
