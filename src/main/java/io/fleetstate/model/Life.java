package io.fleetstate.model;

/**
 * Lifecycle of every managed entity. Transitions only move forward:
 * {@code ALIVE -> DYING -> DEAD}, after which the entity may be removed.
 */
public enum Life {
    ALIVE,
    DYING,
    DEAD
}
