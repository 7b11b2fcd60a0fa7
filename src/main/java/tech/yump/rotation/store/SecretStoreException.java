package tech.yump.rotation.store;

import lombok.Getter;

/**
 * Typed failure of a secret store call.
 */
@Getter
public class SecretStoreException extends RuntimeException {

    private final StoreErrorType type;

    public SecretStoreException(StoreErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public SecretStoreException(StoreErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public boolean isRetryable() {
        return type == StoreErrorType.UNREACHABLE;
    }
}
