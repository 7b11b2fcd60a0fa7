package tech.yump.rotation.core;

/**
 * Base exception for errors raised by the rotation engine's domain operations.
 */
public class RotationException extends RuntimeException {
    public RotationException(String message) {
        super(message);
    }

    public RotationException(String message, Throwable cause) {
        super(message, cause);
    }
}
