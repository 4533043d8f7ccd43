/**
 * JobRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.jobrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.jobrelay.cli.JobRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.jobrelay.runtime.JobRelayRuntime} wires the store, registries and worker loop.</li>
 *   <li>{@code io.jobrelay.storage.JobStore} is the authoritative persistence layer.</li>
 *   <li>{@code io.jobrelay.scheduler.SchedulerLoop} is the per-worker poll/claim/execute cycle.</li>
 * </ul>
 */
package io.jobrelay;
