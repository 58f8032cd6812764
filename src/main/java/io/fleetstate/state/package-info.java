/**
 * Contract of the entity-lifecycle layer the cleanup engine drives.
 *
 * <p>The engine never writes lifecycle fields itself. It calls these operations and relies on
 * their exception taxonomy: {@link io.fleetstate.state.NotFoundException} means the work is
 * already done, {@link io.fleetstate.state.DependentsRemainException} means try again later,
 * anything else is a real failure.
 */
package io.fleetstate.state;
