package tech.yump.rotation.store;

public enum StoreErrorType {
    /** Network failure, timeout or 5xx. The only retryable type. */
    UNREACHABLE,
    AUTH_FAILED,
    /** Compare-and-swap precondition did not hold. */
    CONFLICT,
    NOT_FOUND
}
