/**
 * fleetstate source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.fleetstate.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.fleetstate.runtime.CleanupRuntime} queues cleanups and runs drain passes.</li>
 *   <li>{@code io.fleetstate.cleanup.CleanupRegistry} maps each task kind to its teardown handler.</li>
 *   <li>{@code io.fleetstate.storage.CleanupStore} is the durable task queue.</li>
 * </ul>
 */
package io.fleetstate;
