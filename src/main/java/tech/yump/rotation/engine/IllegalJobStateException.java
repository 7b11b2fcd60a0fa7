package tech.yump.rotation.engine;

import tech.yump.rotation.core.RotationException;

/**
 * Exception thrown when an operation is not allowed in the job's current state, e.g. cancelling a
 * job that has already reached ACTIVATING.
 */
public class IllegalJobStateException extends RotationException {
    public IllegalJobStateException(String message) {
        super(message);
    }
}
