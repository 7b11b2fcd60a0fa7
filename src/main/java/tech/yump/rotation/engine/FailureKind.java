package tech.yump.rotation.engine;

/**
 * Error taxonomy of rotation jobs.
 */
public enum FailureKind {
    /** Store or dependent temporarily unavailable. Retried with backoff, surfaced after exhaustion. */
    TRANSIENT,
    /** Approval denied or expired. Terminal, no store mutation. */
    POLICY,
    /** Post-rotation validation failed. Automatic rollback. */
    VALIDATION,
    /** Compare-and-swap lost. Terminal, flagged for operator review, never retried automatically. */
    CONFLICT,
    /** Invariant violation or unrecoverable store error. The class is halted. */
    FATAL,
    /** Operator cancellation. */
    CANCELLED
}
