package tech.yump.rotation.policy;

import jakarta.annotation.PostConstruct;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.rotation.audit.AuditActions;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.audit.AuditRecorder;
import tech.yump.rotation.config.RotationProperties;
import tech.yump.rotation.storage.StorageBackend;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds the typed rotation policy of every secret class, persisted under {@code policies/<classId>}.
 * Policies are validated on every upsert and are never deleted; disabling a class keeps its history.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyRegistry {

    static final String POLICY_DIR = "policies";

    private final StorageBackend storage;
    private final Validator validator;
    private final AuditRecorder auditRecorder;
    private final RotationProperties properties;
    private final Clock clock;

    /**
     * Loads the classes declared under {@code rotation.classes}. Persisted policies win over the
     * configuration unless {@code rotation.policy.overwrite-on-startup} is set.
     */
    @PostConstruct
    void seedFromConfiguration() {
        boolean overwrite = properties.policy().overwriteOnStartup();
        for (RotationProperties.SecretClassDefinition definition : properties.classes()) {
            SecretClass secretClass = definition.toSecretClass();
            if (!overwrite && find(secretClass.id()).isPresent()) {
                log.debug("Policy for class '{}' already persisted, configuration seed skipped.", secretClass.id());
                continue;
            }
            upsert(secretClass, null);
            log.info("Seeded policy for secret class '{}' from configuration.", secretClass.id());
        }
    }

    /**
     * @throws SecretClassNotFoundException if the class is unknown.
     */
    public SecretClass get(String classId) {
        return find(classId).orElseThrow(() -> new SecretClassNotFoundException(classId));
    }

    public Optional<SecretClass> find(String classId) {
        if (classId == null || !classId.matches(SecretClass.ID_PATTERN)) {
            return Optional.empty();
        }
        return storage.get(policyKey(classId), SecretClass.class);
    }

    public List<SecretClass> list() {
        return storage.listDirectory(POLICY_DIR).stream()
                .map(this::find)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparing(SecretClass::id))
                .toList();
    }

    /**
     * Validates and persists a policy, stamping {@code updatedAt}, and writes a {@code policy_upsert}
     * audit record.
     *
     * @throws PolicyValidationException if the policy violates any constraint.
     */
    public SecretClass upsert(SecretClass secretClass, String actor) {
        validate(secretClass);
        SecretClass stamped = secretClass.toBuilder().updatedAt(clock.instant()).build();
        boolean existed = storage.get(policyKey(stamped.id()), SecretClass.class).isPresent();
        storage.put(policyKey(stamped.id()), stamped);
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.POLICY_UPSERT)
                .secretClassId(stamped.id())
                .actor(actor)
                .result(AuditRecord.RESULT_SUCCESS)
                .data(Map.of(
                        "created", !existed,
                        "enabled", stamped.enabled(),
                        "requires_approval", stamped.requiresApproval(),
                        "rotation_frequency", stamped.rotationFrequency().toString()))
                .build());
        log.info("Policy for secret class '{}' {}.", stamped.id(), existed ? "updated" : "created");
        return stamped;
    }

    void validate(SecretClass secretClass) {
        if (secretClass == null) {
            throw new IllegalArgumentException("Secret class policy must not be null.");
        }
        Set<ConstraintViolation<SecretClass>> violations = validator.validate(secretClass);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .toList();
            log.warn("Rejected policy for class '{}': {}", secretClass.id(), messages);
            throw new PolicyValidationException(secretClass.id(), messages);
        }
    }

    private static String policyKey(String classId) {
        return POLICY_DIR + "/" + classId;
    }
}
