/**
 * Public entry points of the cleanup engine.
 *
 * <p>{@link io.fleetstate.runtime.CleanupRuntime} queues cleanups, reports whether any are
 * pending, and runs single drain passes. It has no loop of its own: whoever owns the process
 * calls {@code runCleanup()} periodically or on demand.
 */
package io.fleetstate.runtime;
