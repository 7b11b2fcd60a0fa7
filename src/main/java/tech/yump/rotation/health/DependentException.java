package tech.yump.rotation.health;

public class DependentException extends RuntimeException {
    public DependentException(String message) {
        super(message);
    }

    public DependentException(String message, Throwable cause) {
        super(message, cause);
    }
}
