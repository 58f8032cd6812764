package io.fleetstate.state;

/**
 * A unit's membership in one relation.
 */
public interface RelationUnit {
    /**
     * Signals that the unit is about to depart, so peers can stop waiting on it.
     */
    void prepareLeaveScope();

    void leaveScope();
}
