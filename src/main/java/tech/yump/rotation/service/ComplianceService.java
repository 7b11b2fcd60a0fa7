package tech.yump.rotation.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.rotation.policy.PolicyRegistry;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretVersion;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Compliance queries over the current state of the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceService {

    private final PolicyRegistry policyRegistry;
    private final SecretStoreClient storeClient;
    private final Clock clock;

    /**
     * Age of the active version of every class. A class that has never rotated is reported as overdue.
     */
    public List<ActiveVersionAge> activeVersionAges() {
        Instant now = clock.instant();
        return policyRegistry.list().stream()
                .map(secretClass -> ageOf(secretClass, now))
                .toList();
    }

    private ActiveVersionAge ageOf(SecretClass secretClass, Instant now) {
        Optional<SecretVersion> active = storeClient.getMetadata(secretClass.id());
        Instant activatedAt = active.map(SecretVersion::activatedAt).orElse(null);
        Duration age = activatedAt != null ? Duration.between(activatedAt, now) : null;
        boolean overdue = age == null || age.compareTo(secretClass.rotationFrequency()) > 0;
        if (overdue && secretClass.enabled()) {
            log.debug("Class '{}' is overdue for rotation (age {})", secretClass.id(), age);
        }
        return new ActiveVersionAge(secretClass.id(), active.map(SecretVersion::id).orElse(null), activatedAt,
                age, secretClass.rotationFrequency(), overdue);
    }

    public record ActiveVersionAge(
            String classId,
            String activeVersionId,
            Instant activatedAt,
            Duration age,
            Duration rotationFrequency,
            boolean overdue
    ) {
    }
}
