package tech.yump.rotation.store.local;

import lombok.extern.slf4j.Slf4j;
import tech.yump.rotation.crypto.EncryptionService;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.StoreErrorType;
import tech.yump.rotation.store.StoreHealth;
import tech.yump.rotation.store.VersionStatus;
import tech.yump.rotation.storage.EncryptedData;
import tech.yump.rotation.storage.StorageBackend;
import tech.yump.rotation.storage.StorageException;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Secret store kept on the engine's own storage backend. Mints 256-bit random material, keeps it
 * encrypted at rest and serializes pointer updates per class with a storage lock.
 * <p>
 * Layout below {@code store/<classId>/}: {@code state} (active pointer), {@code versions/<id>}
 * (metadata) and {@code material/<id>} (encrypted material).
 */
@Slf4j
public class LocalSecretStoreClient implements SecretStoreClient {

    private static final int MATERIAL_LENGTH_BYTES = 32;
    private static final String CHECKSUM_PREFIX = "sha256:";

    private final StorageBackend storage;
    private final EncryptionService encryptionService;
    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public LocalSecretStoreClient(StorageBackend storage, EncryptionService encryptionService, Clock clock) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.encryptionService = Objects.requireNonNull(encryptionService, "encryptionService");
        this.clock = Objects.requireNonNull(clock, "clock");
        log.info("Local secret store backend initialized.");
    }

    @Override
    public Optional<SecretVersion> getMetadata(String classId) {
        return call(() -> {
            LocalClassState state = readState(classId);
            if (state.activeVersionId() == null) {
                return Optional.<SecretVersion>empty();
            }
            return storage.get(versionKey(classId, state.activeVersionId()), SecretVersion.class);
        });
    }

    @Override
    public List<SecretVersion> listVersions(String classId) {
        return call(() -> storage.listDirectory(classDir(classId) + "/versions").stream()
                .map(id -> storage.get(versionKey(classId, id), SecretVersion.class))
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingLong(SecretVersion::versionNumber))
                .toList());
    }

    @Override
    public SecretVersion mintVersion(String classId) {
        return call(() -> storage.withLock(stateKey(classId), () -> {
            LocalClassState state = readState(classId);
            byte[] material = new byte[MATERIAL_LENGTH_BYTES];
            secureRandom.nextBytes(material);
            try {
                String versionId = UUID.randomUUID().toString();
                SecretVersion version = SecretVersion.builder()
                        .id(versionId)
                        .secretClassId(classId)
                        .versionNumber(state.lastVersionNumber() + 1)
                        .createdAt(clock.instant())
                        .status(VersionStatus.PENDING)
                        .checksum(checksum(material))
                        .build();

                storage.put(materialKey(classId, versionId),
                        EncryptedData.fromNonceAndCiphertext(encryptionService.encrypt(material)));
                storage.put(versionKey(classId, versionId), version);
                storage.put(stateKey(classId), new LocalClassState(state.activeVersionId(), version.versionNumber()));
                log.debug("Minted version {} (#{}) for class '{}'", versionId, version.versionNumber(), classId);
                return version;
            } finally {
                Arrays.fill(material, (byte) 0);
            }
        }));
    }

    @Override
    public void activate(String classId, String expectedActiveId, SecretVersion candidate) {
        Objects.requireNonNull(candidate, "candidate");
        call(() -> storage.withLock(stateKey(classId), () -> {
            LocalClassState state = readState(classId);
            if (!Objects.equals(state.activeVersionId(), expectedActiveId)) {
                throw new SecretStoreException(StoreErrorType.CONFLICT, String.format(
                        "Active version of class '%s' is '%s', expected '%s'", classId, state.activeVersionId(), expectedActiveId));
            }
            SecretVersion target = requireVersion(classId, candidate.id());
            if (target.status() != VersionStatus.PENDING && target.status() != VersionStatus.REVOKED_PENDING_GRACE) {
                throw new SecretStoreException(StoreErrorType.CONFLICT, String.format(
                        "Version '%s' of class '%s' cannot be activated from status %s", target.id(), classId, target.status()));
            }
            Instant now = clock.instant();
            if (state.activeVersionId() != null) {
                SecretVersion previous = requireVersion(classId, state.activeVersionId());
                storage.put(versionKey(classId, previous.id()), previous.toBuilder()
                        .status(VersionStatus.REVOKED_PENDING_GRACE)
                        .retiredAt(now)
                        .build());
            }
            storage.put(versionKey(classId, target.id()), target.toBuilder()
                    .status(VersionStatus.ACTIVE)
                    .activatedAt(now)
                    .retiredAt(null)
                    .backupRef(candidate.backupRef() != null ? candidate.backupRef() : target.backupRef())
                    .build());
            storage.put(stateKey(classId), new LocalClassState(target.id(), state.lastVersionNumber()));
            log.info("Class '{}' active version swapped {} -> {}", classId, expectedActiveId, target.id());
            return null;
        }));
    }

    @Override
    public void revoke(String classId, String versionId) {
        call(() -> storage.withLock(stateKey(classId), () -> {
            SecretVersion version = requireVersion(classId, versionId);
            VersionStatus next = switch (version.status()) {
                case PENDING -> VersionStatus.ABANDONED;
                case REVOKED_PENDING_GRACE -> VersionStatus.REVOKED;
                case REVOKED, ABANDONED -> null;
                case ACTIVE -> throw new SecretStoreException(StoreErrorType.CONFLICT,
                        "Version '" + versionId + "' of class '" + classId + "' is active and cannot be revoked");
            };
            if (next == null) {
                log.debug("Version {} of class '{}' already {}", versionId, classId, version.status());
                return null;
            }
            storage.put(versionKey(classId, versionId), version.toBuilder()
                    .status(next)
                    .retiredAt(version.retiredAt() != null ? version.retiredAt() : clock.instant())
                    .build());
            storage.delete(materialKey(classId, versionId));
            log.info("Version {} of class '{}' revoked: {} -> {}", versionId, classId, version.status(), next);
            return null;
        }));
    }

    @Override
    public void retire(String classId, String versionId) {
        call(() -> storage.withLock(stateKey(classId), () -> {
            SecretVersion version = requireVersion(classId, versionId);
            if (versionId.equals(readState(classId).activeVersionId())) {
                throw new SecretStoreException(StoreErrorType.CONFLICT,
                        "Version '" + versionId + "' of class '" + classId + "' is still the active version");
            }
            if (version.status() == VersionStatus.REVOKED_PENDING_GRACE && version.retiredAt() != null) {
                return null;
            }
            if (version.status() != VersionStatus.REVOKED_PENDING_GRACE && version.status() != VersionStatus.ACTIVE) {
                log.debug("Version {} of class '{}' is {}, nothing to retire", versionId, classId, version.status());
                return null;
            }
            storage.put(versionKey(classId, versionId), version.toBuilder()
                    .status(VersionStatus.REVOKED_PENDING_GRACE)
                    .retiredAt(clock.instant())
                    .build());
            return null;
        }));
    }

    @Override
    public StoreHealth health() {
        long start = System.nanoTime();
        try {
            long free = storage.freeCapacityBytes();
            return new StoreHealth(true, Duration.ofNanos(System.nanoTime() - start), free, "local store");
        } catch (StorageException e) {
            log.warn("Local store health probe failed: {}", e.getMessage());
            return StoreHealth.unreachable(Duration.ofNanos(System.nanoTime() - start), e.getMessage());
        }
    }

    /**
     * Decrypts the stored material of a version.
     */
    byte[] readMaterial(String classId, String versionId) {
        EncryptedData data = call(() -> storage.get(materialKey(classId, versionId), EncryptedData.class))
                .orElseThrow(() -> new SecretStoreException(StoreErrorType.NOT_FOUND,
                        "No material for version '" + versionId + "' of class '" + classId + "'"));
        return encryptionService.decrypt(data.getNonceAndCiphertext());
    }

    static String checksum(byte[] material) {
        try {
            return CHECKSUM_PREFIX + HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(material));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private SecretVersion requireVersion(String classId, String versionId) {
        return storage.get(versionKey(classId, versionId), SecretVersion.class)
                .orElseThrow(() -> new SecretStoreException(StoreErrorType.NOT_FOUND,
                        "Version '" + versionId + "' not found for class '" + classId + "'"));
    }

    private LocalClassState readState(String classId) {
        return storage.get(stateKey(classId), LocalClassState.class).orElseGet(LocalClassState::empty);
    }

    private <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (StorageException | EncryptionService.EncryptionException e) {
            throw new SecretStoreException(StoreErrorType.UNREACHABLE, "Local store I/O failed: " + e.getMessage(), e);
        }
    }

    private static String classDir(String classId) {
        return "store/" + classId;
    }

    private static String stateKey(String classId) {
        return classDir(classId) + "/state";
    }

    private static String versionKey(String classId, String versionId) {
        return classDir(classId) + "/versions/" + versionId;
    }

    private static String materialKey(String classId, String versionId) {
        return classDir(classId) + "/material/" + versionId;
    }
}
