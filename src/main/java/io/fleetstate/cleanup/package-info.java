/**
 * Cascading teardown handlers and their dispatcher.
 *
 * <p>Every handler is idempotent: it may run against an entity that a previous, partially
 * completed run already removed, and then succeeds without doing anything. A handler that
 * throws leaves its task pending for the next pass. Force-mode handlers step over failures
 * instead and report them through {@link io.fleetstate.cleanup.Diagnostics}.
 */
package io.fleetstate.cleanup;
