package tech.yump.rotation.engine;

import tech.yump.rotation.core.RotationException;

/**
 * Exception thrown when rotation is requested for a class halted after an invariant violation.
 */
public class ClassHaltedException extends RotationException {
    public ClassHaltedException(String classId, String reason) {
        super("Secret class '" + classId + "' is halted pending operator review: " + reason);
    }
}
