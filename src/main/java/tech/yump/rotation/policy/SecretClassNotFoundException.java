package tech.yump.rotation.policy;

import tech.yump.rotation.core.RotationException;

/**
 * Exception thrown when no policy is registered for a secret class.
 */
public class SecretClassNotFoundException extends RotationException {
    public SecretClassNotFoundException(String classId) {
        super("Secret class not found: " + classId);
    }
}
