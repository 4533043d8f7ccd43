/**
 * Runtime wiring package.
 *
 * <p>{@link io.jobrelay.runtime.JobRelayRuntime} owns process-level behavior:
 * registration, operator actions, settings reload, script handler loading, and
 * the read views used by the CLI.
 */
package io.jobrelay.runtime;
