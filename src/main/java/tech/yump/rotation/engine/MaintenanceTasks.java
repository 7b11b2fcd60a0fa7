package tech.yump.rotation.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.yump.rotation.audit.AuditActions;
import tech.yump.rotation.audit.AuditRecorder;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.backup.BackupManager;
import tech.yump.rotation.config.RotationProperties;
import tech.yump.rotation.policy.PolicyRegistry;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.VersionStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Housekeeping that runs outside any job: ending grace periods, abandoning orphaned candidates,
 * archiving finished jobs and pruning old snapshots.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceTasks {

    private final PolicyRegistry policyRegistry;
    private final SecretStoreClient storeClient;
    private final RotationJobRepository repository;
    private final ClassLockRegistry classLocks;
    private final BackupManager backupManager;
    private final AuditRecorder auditRecorder;
    private final RotationProperties properties;
    private final Clock clock;

    @Scheduled(initialDelayString = "${rotation.engine.maintenance-interval:PT15M}",
            fixedDelayString = "${rotation.engine.maintenance-interval:PT15M}")
    @SchedulerLock(name = "rotationMaintenance", lockAtMostFor = "${rotation.scheduler.lock-at-most-for:PT5M}")
    public void runMaintenance() {
        log.debug("Maintenance run triggered");
        int reaped = reapRevocations();
        int archived = archiveJobs();
        int pruned = pruneBackups();
        if (reaped + archived + pruned > 0) {
            log.info("Maintenance: {} version(s) revoked, {} job(s) archived, {} snapshot(s) pruned", reaped, archived, pruned);
        }
    }

    /**
     * Revokes superseded versions whose grace period has ended, and abandons PENDING versions that
     * no job in flight refers to. Classes with a job currently being worked on are skipped.
     *
     * @return number of versions revoked or abandoned.
     */
    public int reapRevocations() {
        Instant now = clock.instant();
        Duration grace = properties.engine().gracePeriod();
        int reaped = 0;
        for (SecretClass secretClass : policyRegistry.list()) {
            try {
                reaped += classLocks.tryWithClassLock(secretClass.id(), () -> reapClass(secretClass.id(), now, grace)).orElse(0);
            } catch (SecretStoreException e) {
                log.warn("Revocation reaper skipped class '{}' ({}): {}", secretClass.id(), e.getType(), e.getMessage());
            }
        }
        return reaped;
    }

    private int reapClass(String classId, Instant now, Duration grace) {
        Optional<String> inFlightCandidate = repository.findNonTerminal(classId).map(RotationJob::candidateVersionId);
        int reaped = 0;
        for (SecretVersion version : storeClient.listVersions(classId)) {
            if (version.status() == VersionStatus.REVOKED_PENDING_GRACE) {
                Instant since = version.retiredAt() != null ? version.retiredAt() : version.activatedAt();
                if (since != null && !since.plus(grace).isAfter(now)) {
                    storeClient.revoke(classId, version.id());
                    recordReaped(classId, version, "grace period ended");
                    reaped++;
                }
            } else if (version.status() == VersionStatus.PENDING
                    && !inFlightCandidate.map(version.id()::equals).orElse(false)) {
                storeClient.revoke(classId, version.id());
                recordReaped(classId, version, "orphaned candidate");
                reaped++;
            }
        }
        return reaped;
    }

    private void recordReaped(String classId, SecretVersion version, String reason) {
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.VERSION_REAPED)
                .secretClassId(classId)
                .result(AuditRecord.RESULT_SUCCESS)
                .message(reason)
                .data(Map.of("version_id", version.id(), "previous_status", version.status().name()))
                .build());
        log.info("Revoked version {} of class '{}': {}", version.id(), classId, reason);
    }

    /**
     * Moves terminal jobs older than {@code rotation.engine.job-retention} to the archive.
     *
     * @return number of jobs archived.
     */
    public int archiveJobs() {
        Instant cutoff = clock.instant().minus(properties.engine().jobRetention());
        int archived = 0;
        for (RotationJob job : repository.listActive()) {
            if (job.state().isTerminal() && job.completedAt() != null && job.completedAt().isBefore(cutoff)) {
                repository.archive(job.id());
                auditRecorder.record(AuditRecord.builder()
                        .action(AuditActions.JOB_ARCHIVED)
                        .jobId(job.id())
                        .secretClassId(job.secretClassId())
                        .newState(job.state().name())
                        .result(AuditRecord.RESULT_SUCCESS)
                        .build());
                archived++;
            }
        }
        return archived;
    }

    public int pruneBackups() {
        int pruned = backupManager.pruneExpired();
        if (pruned > 0) {
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.BACKUP_PRUNED)
                    .result(AuditRecord.RESULT_SUCCESS)
                    .data(Map.of("pruned", pruned))
                    .build());
        }
        return pruned;
    }
}
