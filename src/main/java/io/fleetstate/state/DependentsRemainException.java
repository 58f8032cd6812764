package io.fleetstate.state;

/**
 * An entity cannot become dead yet because dependents are still attached. Retryable: the task
 * that hit it stays pending and runs again on a later pass.
 */
public abstract class DependentsRemainException extends StateException {
    protected DependentsRemainException(String message) {
        super(message);
    }
}
