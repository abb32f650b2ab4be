/**
 * Run orchestration package.
 *
 * <p>{@link io.muxharness.runtime.RunOrchestrator} owns the linear run sequence:
 * preflight, scenarios, unconditional cleanup sweep, summary and exit status.
 * Concurrency never leaks out of {@link io.muxharness.concurrent.ConcurrencyHarness}.
 */
package io.muxharness.runtime;
