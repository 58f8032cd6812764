package io.fleetstate.state;

public class HasStorageAttachmentsException extends DependentsRemainException {
    public HasStorageAttachmentsException(String unitName) {
        super("unit " + unitName + " has storage attachments");
    }
}
