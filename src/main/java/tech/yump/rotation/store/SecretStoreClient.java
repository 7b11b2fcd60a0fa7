package tech.yump.rotation.store;

import java.util.List;
import java.util.Optional;

/**
 * Narrow contract to the backing secret store. The store mints material and holds the single
 * authoritative "active version" pointer per secret class.
 * <p>
 * All methods throw {@link SecretStoreException}; only {@link StoreErrorType#UNREACHABLE} is retryable.
 */
public interface SecretStoreClient {

    /**
     * Returns the currently active version of the class, or empty if the class has never been rotated.
     */
    Optional<SecretVersion> getMetadata(String classId);

    /**
     * All versions known for the class, oldest first.
     */
    List<SecretVersion> listVersions(String classId);

    /**
     * Mints new material and returns it as a PENDING version. Has no effect on the active pointer.
     */
    SecretVersion mintVersion(String classId);

    /**
     * Compare-and-swap of the active pointer: makes {@code candidate} ACTIVE only if the currently active
     * version id equals {@code expectedActiveId} ({@code null} meaning "no active version").
     * The candidate may be PENDING or a version still in its grace period (rollback). The previously
     * active version enters REVOKED_PENDING_GRACE in the same atomic step, so at most one version is
     * ever ACTIVE.
     *
     * @throws SecretStoreException with {@link StoreErrorType#CONFLICT} when the precondition fails.
     */
    void activate(String classId, String expectedActiveId, SecretVersion candidate);

    /**
     * Revokes a version: PENDING becomes ABANDONED, REVOKED_PENDING_GRACE becomes REVOKED.
     * Revoking an already revoked or abandoned version is a no-op; revoking the active version is a CONFLICT.
     */
    void revoke(String classId, String versionId);

    /**
     * Confirms that a superseded version is in its grace period (REVOKED_PENDING_GRACE), stamping
     * {@code retiredAt} if the store has not done so. Idempotent.
     */
    void retire(String classId, String versionId);

    StoreHealth health();
}
