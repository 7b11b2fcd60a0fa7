package tech.yump.rotation.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.rotation.audit.AuditActions;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.audit.AuditRecorder;
import tech.yump.rotation.notify.NotificationSink;
import tech.yump.rotation.notify.RotationNotification;
import tech.yump.rotation.storage.StorageBackend;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretVersion;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enforces "at most one active version per class". A violation halts the class under
 * {@code halts/<classId>} until an operator resumes it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvariantGuard {

    static final String HALT_DIR = "halts";

    private final SecretStoreClient storeClient;
    private final StorageBackend storage;
    private final AuditRecorder auditRecorder;
    private final NotificationSink notificationSink;
    private final Clock clock;

    /**
     * Counts ACTIVE versions of the class in the store.
     *
     * @return true if the invariant holds.
     */
    public boolean verify(String classId, @Nullable String jobId) {
        List<SecretVersion> active = storeClient.listVersions(classId).stream()
                .filter(SecretVersion::isActive)
                .toList();
        if (active.size() <= 1) {
            return true;
        }
        List<String> ids = active.stream().map(SecretVersion::id).toList();
        String reason = "multiple active versions: " + ids;
        log.error("INVARIANT VIOLATION for class '{}': {} versions ACTIVE {}", classId, active.size(), ids);
        halt(classId, reason, jobId);
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.INVARIANT_VIOLATION)
                .jobId(jobId)
                .secretClassId(classId)
                .result(AuditRecord.RESULT_FAILURE)
                .errorKind(FailureKind.FATAL.name())
                .message(reason)
                .data(Map.of("active_versions", ids))
                .build());
        notificationSink.send(new RotationNotification(jobId, classId, "HALTED",
                RotationNotification.Level.CRITICAL, reason, clock.instant()));
        return false;
    }

    public void halt(String classId, String reason, @Nullable String jobId) {
        storage.put(haltKey(classId), new ClassHalt(classId, reason, jobId, clock.instant()));
        log.error("Secret class '{}' halted: {}", classId, reason);
    }

    public boolean isHalted(String classId) {
        return findHalt(classId).isPresent();
    }

    public Optional<ClassHalt> findHalt(String classId) {
        return storage.get(haltKey(classId), ClassHalt.class);
    }

    /**
     * Clears a halt.
     *
     * @return true if the class was halted.
     */
    public boolean clear(String classId, String actor) {
        Optional<ClassHalt> halt = findHalt(classId);
        if (halt.isEmpty()) {
            return false;
        }
        storage.delete(haltKey(classId));
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.HALT_CLEARED)
                .secretClassId(classId)
                .actor(actor)
                .result(AuditRecord.RESULT_SUCCESS)
                .message(halt.get().reason())
                .build());
        log.warn("Halt of secret class '{}' cleared by '{}'", classId, actor);
        return true;
    }

    private static String haltKey(String classId) {
        return HALT_DIR + "/" + classId;
    }
}
