package tech.yump.rotation.store;

/**
 * Lifecycle status of a secret version inside the store.
 */
public enum VersionStatus {
    PENDING,
    ACTIVE,
    REVOKED_PENDING_GRACE,
    REVOKED,
    ABANDONED
}
