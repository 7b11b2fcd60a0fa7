package tech.yump.rotation.backup;

/**
 * Exception thrown when a snapshot cannot be taken, acknowledged or restored.
 */
public class BackupException extends RuntimeException {
    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
