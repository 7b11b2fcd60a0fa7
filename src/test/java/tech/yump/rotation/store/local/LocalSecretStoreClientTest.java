package tech.yump.rotation.store.local;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.rotation.crypto.EncryptionService;
import tech.yump.rotation.config.RotationProperties;
import tech.yump.rotation.storage.FileSystemStorageBackend;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.StoreErrorType;
import tech.yump.rotation.store.StoreHealth;
import tech.yump.rotation.store.VersionStatus;
import tech.yump.rotation.support.EngineFixture;
import tech.yump.rotation.support.MutableClock;
import tech.yump.rotation.support.TestProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalSecretStoreClientTest {

    private static final String CLASS_ID = "database";

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(EngineFixture.START);
    private LocalSecretStoreClient store;

    @BeforeEach
    void setUp() {
        RotationProperties properties = TestProperties.forDirectory(tempDir);
        store = new LocalSecretStoreClient(new FileSystemStorageBackend(EngineFixture.objectMapper(), properties),
                new EncryptionService(properties), clock);
    }

    @Test
    @DisplayName("A fresh class has no active version and no versions")
    void emptyClass() {
        assertThat(store.getMetadata(CLASS_ID)).isEmpty();
        assertThat(store.listVersions(CLASS_ID)).isEmpty();
    }

    @Test
    @DisplayName("Minted versions are PENDING, numbered in sequence and checksummed over their material")
    void mintVersion() {
        SecretVersion first = store.mintVersion(CLASS_ID);
        SecretVersion second = store.mintVersion(CLASS_ID);

        assertThat(first.status()).isEqualTo(VersionStatus.PENDING);
        assertThat(first.versionNumber()).isEqualTo(1);
        assertThat(second.versionNumber()).isEqualTo(2);
        assertThat(first.checksum()).startsWith("sha256:").isNotEqualTo(second.checksum());
        byte[] material = store.readMaterial(CLASS_ID, first.id());
        assertThat(material).hasSize(32);
        assertThat(LocalSecretStoreClient.checksum(material)).isEqualTo(first.checksum());
        assertThat(store.getMetadata(CLASS_ID)).isEmpty();
    }

    @Test
    @DisplayName("Material is not stored in plaintext")
    void materialEncryptedAtRest() throws Exception {
        SecretVersion version = store.mintVersion(CLASS_ID);
        byte[] material = store.readMaterial(CLASS_ID, version.id());

        String onDisk = Files.readString(tempDir.resolve("store/" + CLASS_ID + "/material/" + version.id() + ".json"));
        assertThat(onDisk).doesNotContain(java.util.Base64.getEncoder().encodeToString(material));
    }

    @Test
    @DisplayName("Activation swaps the pointer by compare-and-swap and puts the old version in grace")
    void activateSwapsPointer() {
        SecretVersion v1 = store.mintVersion(CLASS_ID);
        store.activate(CLASS_ID, null, v1);
        clock.advance(Duration.ofDays(1));
        SecretVersion v2 = store.mintVersion(CLASS_ID);

        store.activate(CLASS_ID, v1.id(), v2);

        SecretVersion active = store.getMetadata(CLASS_ID).orElseThrow();
        assertThat(active.id()).isEqualTo(v2.id());
        assertThat(active.activatedAt()).isEqualTo(clock.instant());
        assertThat(store.listVersions(CLASS_ID)).filteredOn(SecretVersion::isActive).hasSize(1);
        SecretVersion old = store.listVersions(CLASS_ID).get(0);
        assertThat(old.status()).isEqualTo(VersionStatus.REVOKED_PENDING_GRACE);
        assertThat(old.retiredAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("Activation with a stale expected version is a CONFLICT and changes nothing")
    void staleExpectedVersion() {
        SecretVersion v1 = store.mintVersion(CLASS_ID);
        store.activate(CLASS_ID, null, v1);
        SecretVersion v2 = store.mintVersion(CLASS_ID);

        assertThatThrownBy(() -> store.activate(CLASS_ID, null, v2))
                .isInstanceOf(SecretStoreException.class)
                .satisfies(e -> assertThat(((SecretStoreException) e).getType()).isEqualTo(StoreErrorType.CONFLICT));
        assertThat(store.getMetadata(CLASS_ID).orElseThrow().id()).isEqualTo(v1.id());
    }

    @Test
    @DisplayName("A version in grace can be re-activated, a revoked one cannot")
    void reactivation() {
        SecretVersion v1 = store.mintVersion(CLASS_ID);
        store.activate(CLASS_ID, null, v1);
        SecretVersion v2 = store.mintVersion(CLASS_ID);
        store.activate(CLASS_ID, v1.id(), v2);

        store.activate(CLASS_ID, v2.id(), v1);
        assertThat(store.getMetadata(CLASS_ID).orElseThrow().id()).isEqualTo(v1.id());

        store.revoke(CLASS_ID, v2.id());
        assertThatThrownBy(() -> store.activate(CLASS_ID, v1.id(), v2))
                .isInstanceOf(SecretStoreException.class)
                .hasMessageContaining("REVOKED");
    }

    @Test
    @DisplayName("Revoke abandons pending versions, ends grace, is idempotent and refuses the active version")
    void revoke() {
        SecretVersion v1 = store.mintVersion(CLASS_ID);
        store.activate(CLASS_ID, null, v1);
        SecretVersion candidate = store.mintVersion(CLASS_ID);

        store.revoke(CLASS_ID, candidate.id());
        store.revoke(CLASS_ID, candidate.id());

        assertThat(store.listVersions(CLASS_ID).get(1).status()).isEqualTo(VersionStatus.ABANDONED);
        assertThatThrownBy(() -> store.readMaterial(CLASS_ID, candidate.id()))
                .isInstanceOf(SecretStoreException.class);
        assertThatThrownBy(() -> store.revoke(CLASS_ID, v1.id()))
                .isInstanceOf(SecretStoreException.class)
                .hasMessageContaining("active");
    }

    @Test
    @DisplayName("Retire refuses the active version and keeps the first retirement time")
    void retire() {
        SecretVersion v1 = store.mintVersion(CLASS_ID);
        store.activate(CLASS_ID, null, v1);
        SecretVersion v2 = store.mintVersion(CLASS_ID);
        store.activate(CLASS_ID, v1.id(), v2);
        clock.advance(Duration.ofHours(1));

        store.retire(CLASS_ID, v1.id());

        assertThat(store.listVersions(CLASS_ID).get(0).retiredAt()).isEqualTo(EngineFixture.START);
        assertThatThrownBy(() -> store.retire(CLASS_ID, v2.id())).isInstanceOf(SecretStoreException.class);
    }

    @Test
    @DisplayName("Unknown versions are NOT_FOUND")
    void unknownVersion() {
        assertThatThrownBy(() -> store.revoke(CLASS_ID, "missing"))
                .isInstanceOf(SecretStoreException.class)
                .satisfies(e -> assertThat(((SecretStoreException) e).getType()).isEqualTo(StoreErrorType.NOT_FOUND));
    }

    @Test
    @DisplayName("Health reports the free capacity of the storage volume")
    void health() {
        StoreHealth health = store.health();

        assertThat(health.reachable()).isTrue();
        assertThat(health.freeCapacityBytes()).isPositive();
    }
}
