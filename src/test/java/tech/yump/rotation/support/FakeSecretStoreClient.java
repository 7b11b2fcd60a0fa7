package tech.yump.rotation.support;

import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.StoreErrorType;
import tech.yump.rotation.store.StoreHealth;
import tech.yump.rotation.store.VersionStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory secret store with the same pointer semantics as the real backends, plus hooks to
 * inject failures.
 */
public class FakeSecretStoreClient implements SecretStoreClient {

    private final Clock clock;
    private final Map<String, Map<String, SecretVersion>> versions = new HashMap<>();
    private final Map<String, String> active = new HashMap<>();
    private final Deque<SecretStoreException> mintFailures = new ArrayDeque<>();
    private final Deque<SecretStoreException> activateFailures = new ArrayDeque<>();
    private volatile StoreHealth health = new StoreHealth(true, Duration.ofMillis(5), Long.MAX_VALUE, "fake");
    private int activateCalls;

    public FakeSecretStoreClient(Clock clock) {
        this.clock = clock;
    }

    /**
     * Creates an ACTIVE version as if the class had been rotated at {@code activatedAt}.
     */
    public synchronized SecretVersion seedActive(String classId, Instant activatedAt) {
        SecretVersion version = SecretVersion.builder()
                .id(UUID.randomUUID().toString())
                .secretClassId(classId)
                .versionNumber(classVersions(classId).size() + 1)
                .createdAt(activatedAt)
                .activatedAt(activatedAt)
                .status(VersionStatus.ACTIVE)
                .checksum("sha256:" + UUID.randomUUID())
                .build();
        String previous = active.get(classId);
        if (previous != null) {
            SecretVersion old = classVersions(classId).get(previous);
            classVersions(classId).put(previous, old.toBuilder().status(VersionStatus.REVOKED_PENDING_GRACE).retiredAt(activatedAt).build());
        }
        classVersions(classId).put(version.id(), version);
        active.put(classId, version.id());
        return version;
    }

    /**
     * Marks a version ACTIVE without touching the pointer, breaking the single-active invariant.
     */
    public synchronized void corruptActive(String classId, String versionId) {
        SecretVersion version = classVersions(classId).get(versionId);
        classVersions(classId).put(versionId, version.toBuilder().status(VersionStatus.ACTIVE).build());
    }

    /**
     * Moves the pointer behind the engine's back, as a concurrent writer would.
     */
    public synchronized SecretVersion externalRotation(String classId) {
        SecretVersion minted = mintVersion(classId);
        activate(classId, active.get(classId), minted);
        activateCalls--;
        return status(classId, minted.id());
    }

    public synchronized void failNextMint(StoreErrorType type, int times) {
        for (int i = 0; i < times; i++) {
            mintFailures.add(new SecretStoreException(type, "injected mint failure (" + type + ")"));
        }
    }

    public synchronized void failNextActivate(StoreErrorType type) {
        activateFailures.add(new SecretStoreException(type, "injected activate failure (" + type + ")"));
    }

    public void setHealth(StoreHealth health) {
        this.health = health;
    }

    public synchronized int activateCalls() {
        return activateCalls;
    }

    public synchronized SecretVersion status(String classId, String versionId) {
        return classVersions(classId).get(versionId);
    }

    @Override
    public synchronized Optional<SecretVersion> getMetadata(String classId) {
        return Optional.ofNullable(active.get(classId)).map(id -> classVersions(classId).get(id));
    }

    @Override
    public synchronized List<SecretVersion> listVersions(String classId) {
        List<SecretVersion> list = new ArrayList<>(classVersions(classId).values());
        list.sort(Comparator.comparingLong(SecretVersion::versionNumber));
        return list;
    }

    @Override
    public synchronized SecretVersion mintVersion(String classId) {
        if (!mintFailures.isEmpty()) {
            throw mintFailures.poll();
        }
        SecretVersion version = SecretVersion.builder()
                .id(UUID.randomUUID().toString())
                .secretClassId(classId)
                .versionNumber(classVersions(classId).size() + 1)
                .createdAt(clock.instant())
                .status(VersionStatus.PENDING)
                .checksum("sha256:" + UUID.randomUUID())
                .build();
        classVersions(classId).put(version.id(), version);
        return version;
    }

    @Override
    public synchronized void activate(String classId, String expectedActiveId, SecretVersion candidate) {
        activateCalls++;
        if (!activateFailures.isEmpty()) {
            throw activateFailures.poll();
        }
        String current = active.get(classId);
        if (!Objects.equals(current, expectedActiveId)) {
            throw new SecretStoreException(StoreErrorType.CONFLICT, "active is " + current + ", expected " + expectedActiveId);
        }
        SecretVersion target = require(classId, candidate.id());
        if (target.status() != VersionStatus.PENDING && target.status() != VersionStatus.REVOKED_PENDING_GRACE) {
            throw new SecretStoreException(StoreErrorType.CONFLICT, "cannot activate from " + target.status());
        }
        Instant now = clock.instant();
        if (current != null) {
            SecretVersion previous = require(classId, current);
            classVersions(classId).put(current, previous.toBuilder().status(VersionStatus.REVOKED_PENDING_GRACE).retiredAt(now).build());
        }
        classVersions(classId).put(target.id(), target.toBuilder().status(VersionStatus.ACTIVE).activatedAt(now).retiredAt(null).build());
        active.put(classId, target.id());
    }

    @Override
    public synchronized void revoke(String classId, String versionId) {
        SecretVersion version = require(classId, versionId);
        VersionStatus next = switch (version.status()) {
            case PENDING -> VersionStatus.ABANDONED;
            case REVOKED_PENDING_GRACE -> VersionStatus.REVOKED;
            case REVOKED, ABANDONED -> null;
            case ACTIVE -> throw new SecretStoreException(StoreErrorType.CONFLICT, "cannot revoke the active version");
        };
        if (next != null) {
            classVersions(classId).put(versionId, version.toBuilder().status(next).build());
        }
    }

    @Override
    public synchronized void retire(String classId, String versionId) {
        SecretVersion version = require(classId, versionId);
        if (versionId.equals(active.get(classId))) {
            throw new SecretStoreException(StoreErrorType.CONFLICT, "version is still active");
        }
        if (version.status() == VersionStatus.REVOKED_PENDING_GRACE && version.retiredAt() == null) {
            classVersions(classId).put(versionId, version.toBuilder().retiredAt(clock.instant()).build());
        }
    }

    @Override
    public StoreHealth health() {
        return health;
    }

    private SecretVersion require(String classId, String versionId) {
        SecretVersion version = classVersions(classId).get(versionId);
        if (version == null) {
            throw new SecretStoreException(StoreErrorType.NOT_FOUND, "unknown version " + versionId);
        }
        return version;
    }

    private Map<String, SecretVersion> classVersions(String classId) {
        return versions.computeIfAbsent(classId, k -> new LinkedHashMap<>());
    }
}
