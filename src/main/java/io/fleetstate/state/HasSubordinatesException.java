package io.fleetstate.state;

public class HasSubordinatesException extends DependentsRemainException {
    public HasSubordinatesException(String unitName) {
        super("unit " + unitName + " has subordinates");
    }
}
