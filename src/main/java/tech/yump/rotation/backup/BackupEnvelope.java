package tech.yump.rotation.backup;

import tech.yump.rotation.storage.EncryptedData;

import java.time.Instant;

/**
 * Stored form of a snapshot: cleartext retention metadata plus the encrypted {@link BackupSnapshot}.
 */
public record BackupEnvelope(
        String backupRef,
        String secretClassId,
        Instant takenAt,
        Instant retainUntil,
        EncryptedData sealed
) {
}
