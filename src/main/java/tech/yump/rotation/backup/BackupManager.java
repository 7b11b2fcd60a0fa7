package tech.yump.rotation.backup;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.rotation.config.RotationProperties;
import tech.yump.rotation.crypto.EncryptionService;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.storage.EncryptedData;
import tech.yump.rotation.storage.StorageBackend;
import tech.yump.rotation.storage.StorageException;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretVersion;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Encrypted snapshots of prior active versions under {@code backups/<classId>/<backupRef>}, and the
 * restore path used by rollback. Snapshots are retained for their retention period regardless of
 * the outcome of the job that took them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackupManager {

    static final String BACKUP_DIR = "backups";

    private final StorageBackend storage;
    private final EncryptionService encryptionService;
    private final SecretStoreClient storeClient;
    private final ObjectMapper objectMapper;
    private final RotationProperties properties;
    private final Clock clock;

    /**
     * Snapshots {@code version} and reads it back before returning, so the returned reference is
     * known to be durable and decryptable.
     *
     * @throws BackupException if the snapshot cannot be written or acknowledged.
     */
    public String snapshot(SecretClass secretClass, SecretVersion version, String jobId) {
        Instant now = clock.instant();
        Duration retention = secretClass.backupRetention() != null
                ? secretClass.backupRetention()
                : properties.backup().retention();
        String backupRef = UUID.randomUUID().toString();
        BackupSnapshot snapshot = new BackupSnapshot(backupRef, secretClass.id(), version, now, now.plus(retention), jobId);

        try {
            byte[] plaintext = objectMapper.writeValueAsBytes(snapshot);
            EncryptedData sealed = EncryptedData.fromNonceAndCiphertext(encryptionService.encrypt(plaintext));
            storage.put(backupKey(secretClass.id(), backupRef),
                    new BackupEnvelope(backupRef, secretClass.id(), now, snapshot.retainUntil(), sealed));
        } catch (IOException | StorageException | EncryptionService.EncryptionException e) {
            log.error("Failed to write snapshot of version {} for class '{}': {}", version.id(), secretClass.id(), e.getMessage(), e);
            throw new BackupException("Failed to write snapshot for class " + secretClass.id(), e);
        }

        BackupSnapshot acknowledged = find(secretClass.id(), backupRef)
                .orElseThrow(() -> new BackupException("Snapshot " + backupRef + " not readable after write"));
        if (!version.id().equals(acknowledged.version().id())) {
            throw new BackupException("Snapshot " + backupRef + " does not match version " + version.id());
        }
        log.info("Snapshot {} taken of version {} for class '{}', retained until {}",
                backupRef, version.id(), secretClass.id(), snapshot.retainUntil());
        return backupRef;
    }

    /**
     * Re-activates the snapshotted version through the store's compare-and-swap.
     *
     * @param expectedActiveId the version currently active (the one being rolled back).
     * @return the restored version.
     */
    public SecretVersion restore(SecretClass secretClass, String backupRef, String expectedActiveId) {
        BackupSnapshot snapshot = find(secretClass.id(), backupRef)
                .orElseThrow(() -> new BackupException("Snapshot " + backupRef + " not found for class " + secretClass.id()));
        storeClient.activate(secretClass.id(), expectedActiveId, snapshot.version());
        log.info("Restored version {} of class '{}' from snapshot {}", snapshot.version().id(), secretClass.id(), backupRef);
        return snapshot.version();
    }

    public Optional<BackupSnapshot> find(String backupRef) {
        return storage.listDirectory(BACKUP_DIR).stream()
                .map(classId -> find(classId, backupRef))
                .flatMap(Optional::stream)
                .findFirst();
    }

    public Optional<BackupSnapshot> find(String classId, String backupRef) {
        return storage.get(backupKey(classId, backupRef), BackupEnvelope.class).map(this::open);
    }

    /**
     * Deletes snapshots past their retention, always keeping the newest
     * {@code rotation.backup.keep-minimum} per class.
     *
     * @return number of snapshots deleted.
     */
    public int pruneExpired() {
        Instant now = clock.instant();
        int keepMinimum = properties.backup().keepMinimum();
        int pruned = 0;
        for (String classId : storage.listDirectory(BACKUP_DIR)) {
            List<BackupEnvelope> envelopes = storage.listDirectory(BACKUP_DIR + "/" + classId).stream()
                    .map(ref -> storage.get(backupKey(classId, ref), BackupEnvelope.class))
                    .flatMap(Optional::stream)
                    .sorted(Comparator.comparing(BackupEnvelope::takenAt).reversed())
                    .toList();
            for (int i = keepMinimum; i < envelopes.size(); i++) {
                BackupEnvelope envelope = envelopes.get(i);
                if (envelope.retainUntil().isBefore(now)) {
                    storage.delete(backupKey(classId, envelope.backupRef()));
                    pruned++;
                    log.debug("Pruned snapshot {} of class '{}' (retained until {})", envelope.backupRef(), classId, envelope.retainUntil());
                }
            }
        }
        if (pruned > 0) {
            log.info("Pruned {} expired backup snapshot(s).", pruned);
        }
        return pruned;
    }

    private BackupSnapshot open(BackupEnvelope envelope) {
        try {
            byte[] plaintext = encryptionService.decrypt(envelope.sealed().getNonceAndCiphertext());
            return objectMapper.readValue(plaintext, BackupSnapshot.class);
        } catch (IOException | EncryptionService.EncryptionException e) {
            throw new BackupException("Snapshot " + envelope.backupRef() + " cannot be decrypted or parsed", e);
        }
    }

    private static String backupKey(String classId, String backupRef) {
        if (!backupRef.matches("[A-Za-z0-9-]{1,64}")) {
            throw new BackupException("Invalid backup reference: " + backupRef);
        }
        return BACKUP_DIR + "/" + classId + "/" + backupRef;
    }
}
