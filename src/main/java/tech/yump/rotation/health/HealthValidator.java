package tech.yump.rotation.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.rotation.config.RotationProperties;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.StoreHealth;
import tech.yump.rotation.store.VersionStatus;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only checks around a rotation: store readiness before anything is minted, and synthetic
 * authentication of a version against the class's dependents. Never mutates state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HealthValidator {

    private final SecretStoreClient storeClient;
    private final DependentClient dependentClient;
    private final RotationProperties properties;

    /**
     * Store reachable, answering within the latency budget and with enough free capacity.
     */
    public HealthCheckResult preCheck(SecretClass secretClass) {
        StoreHealth health = storeClient.health();
        RotationProperties.HealthProperties limits = properties.health();
        if (!health.reachable()) {
            return fail(secretClass, "secret store unreachable: " + health.detail());
        }
        if (health.latency() != null && health.latency().compareTo(limits.latencyBudget()) > 0) {
            return fail(secretClass, "secret store latency " + health.latency().toMillis() + "ms exceeds budget of "
                    + limits.latencyBudget().toMillis() + "ms");
        }
        if (health.freeCapacityBytes() >= 0 && health.freeCapacityBytes() < limits.minFreeCapacity()) {
            return fail(secretClass, "secret store free capacity " + health.freeCapacityBytes()
                    + " bytes below minimum of " + limits.minFreeCapacity());
        }
        log.debug("Pre-check passed for class '{}' (latency {}ms)", secretClass.id(),
                health.latency() != null ? health.latency().toMillis() : -1);
        return HealthCheckResult.passed();
    }

    /**
     * Synthetic login with {@code version} against every declared dependent: at least one must
     * authenticate and none may reject. A class without dependents is verified by comparing the
     * version's checksum with the store's metadata.
     */
    public HealthCheckResult postCheck(SecretClass secretClass, SecretVersion version) {
        if (secretClass.dependents().isEmpty()) {
            return verifyChecksum(secretClass, version);
        }
        Map<VerifyOutcome, Integer> outcomes = new EnumMap<>(VerifyOutcome.class);
        for (String dependent : secretClass.dependents()) {
            VerifyOutcome outcome = dependentClient.verify(dependent, secretClass, version);
            outcomes.merge(outcome, 1, Integer::sum);
            log.debug("Dependent '{}' verification of version {}: {}", dependent, version.id(), outcome);
        }
        if (outcomes.getOrDefault(VerifyOutcome.REJECTED, 0) > 0) {
            return fail(secretClass, outcomes.get(VerifyOutcome.REJECTED) + " dependent(s) rejected version " + version.id());
        }
        if (outcomes.getOrDefault(VerifyOutcome.AUTHENTICATED, 0) == 0) {
            return fail(secretClass, "no dependent could authenticate with version " + version.id());
        }
        return HealthCheckResult.passed();
    }

    private HealthCheckResult verifyChecksum(SecretClass secretClass, SecretVersion version) {
        try {
            SecretVersion stored = storeClient.listVersions(secretClass.id()).stream()
                    .filter(v -> v.id().equals(version.id()))
                    .findFirst()
                    .orElse(null);
            if (stored == null) {
                return fail(secretClass, "version " + version.id() + " not present in the store");
            }
            if (stored.status() != VersionStatus.PENDING && stored.status() != VersionStatus.ACTIVE) {
                return fail(secretClass, "version " + version.id() + " is " + stored.status());
            }
            if (stored.checksum() == null || !Objects.equals(stored.checksum(), version.checksum())) {
                return fail(secretClass, "checksum mismatch for version " + version.id());
            }
            return HealthCheckResult.passed();
        } catch (SecretStoreException e) {
            return fail(secretClass, "store verification failed: " + e.getMessage());
        }
    }

    private static HealthCheckResult fail(SecretClass secretClass, String reason) {
        log.warn("Health check failed for class '{}': {}", secretClass.id(), reason);
        return HealthCheckResult.failed(reason);
    }
}
