package io.fleetstate.state;

public interface Relation {
    String key();

    /**
     * @throws NotFoundException when the unit is not part of the relation
     */
    RelationUnit unit(Unit unit);
}
