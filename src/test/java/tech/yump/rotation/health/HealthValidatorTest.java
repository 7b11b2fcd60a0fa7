package tech.yump.rotation.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.StoreHealth;
import tech.yump.rotation.support.EngineFixture;
import tech.yump.rotation.support.FakeSecretStoreClient;
import tech.yump.rotation.support.MutableClock;
import tech.yump.rotation.support.ScriptedDependentClient;
import tech.yump.rotation.support.TestProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HealthValidatorTest {

    @TempDir
    Path tempDir;

    private FakeSecretStoreClient store;
    private ScriptedDependentClient dependents;
    private HealthValidator validator;
    private SecretClass standalone;
    private SecretClass withDependents;

    @BeforeEach
    void setUp() {
        store = new FakeSecretStoreClient(new MutableClock(EngineFixture.START));
        dependents = new ScriptedDependentClient();
        validator = new HealthValidator(store, dependents, TestProperties.forDirectory(tempDir));
        standalone = SecretClass.builder().id("internal-token").rotationFrequency(Duration.ofHours(24)).build();
        withDependents = standalone.toBuilder().dependents(List.of("api", "worker")).build();
    }

    @Test
    @DisplayName("Pre-check passes for a reachable, fast store with capacity")
    void preCheckPasses() {
        assertThat(validator.preCheck(standalone).ok()).isTrue();
    }

    @Test
    @DisplayName("Pre-check fails when the store is unreachable")
    void preCheckUnreachable() {
        store.setHealth(StoreHealth.unreachable(Duration.ofMillis(3), "connection refused"));

        HealthCheckResult result = validator.preCheck(standalone);

        assertThat(result.ok()).isFalse();
        assertThat(result.reason()).contains("unreachable").contains("connection refused");
    }

    @Test
    @DisplayName("Pre-check fails above the latency budget")
    void preCheckSlow() {
        store.setHealth(new StoreHealth(true, Duration.ofSeconds(3), Long.MAX_VALUE, "slow"));

        assertThat(validator.preCheck(standalone).reason()).contains("latency 3000ms");
    }

    @Test
    @DisplayName("Pre-check fails below the capacity floor and ignores unreported capacity")
    void preCheckCapacity() {
        store.setHealth(new StoreHealth(true, Duration.ofMillis(5), 1024, "full"));
        assertThat(validator.preCheck(standalone).reason()).contains("free capacity 1024");

        store.setHealth(new StoreHealth(true, Duration.ofMillis(5), -1, "unknown"));
        assertThat(validator.preCheck(standalone).ok()).isTrue();
    }

    @Test
    @DisplayName("Without dependents the post-check compares checksums with the store")
    void postCheckChecksum() {
        SecretVersion minted = store.mintVersion(standalone.id());

        assertThat(validator.postCheck(standalone, minted).ok()).isTrue();
        assertThat(validator.postCheck(standalone, minted.toBuilder().checksum("sha256:other").build()).reason())
                .contains("checksum mismatch");
        assertThat(validator.postCheck(standalone, minted.toBuilder().id("ghost").build()).reason())
                .contains("not present");

        store.revoke(standalone.id(), minted.id());
        assertThat(validator.postCheck(standalone, minted).reason()).contains("ABANDONED");
    }

    @Test
    @DisplayName("Any rejecting dependent fails the post-check")
    void postCheckRejected() {
        SecretVersion minted = store.mintVersion(standalone.id());
        dependents.scriptVerify(VerifyOutcome.AUTHENTICATED, VerifyOutcome.REJECTED);

        assertThat(validator.postCheck(withDependents, minted).reason()).contains("1 dependent(s) rejected");
    }

    @Test
    @DisplayName("At least one dependent must authenticate; unavailable ones alone do not fail it")
    void postCheckUnavailable() {
        SecretVersion minted = store.mintVersion(standalone.id());

        dependents.scriptVerify(VerifyOutcome.UNAVAILABLE, VerifyOutcome.UNAVAILABLE);
        assertThat(validator.postCheck(withDependents, minted).reason()).contains("no dependent could authenticate");

        dependents.scriptVerify(VerifyOutcome.UNAVAILABLE, VerifyOutcome.AUTHENTICATED);
        assertThat(validator.postCheck(withDependents, minted).ok()).isTrue();
    }
}
