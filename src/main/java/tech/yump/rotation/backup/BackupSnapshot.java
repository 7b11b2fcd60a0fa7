package tech.yump.rotation.backup;

import tech.yump.rotation.store.SecretVersion;

import java.time.Instant;

/**
 * Snapshot of the version that was active before a rotation, used to restore it on rollback.
 */
public record BackupSnapshot(
        String backupRef,
        String secretClassId,
        SecretVersion version,
        Instant takenAt,
        Instant retainUntil,
        String jobId
) {
}
