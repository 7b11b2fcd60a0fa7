package tech.yump.rotation.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.rotation.approval.ApprovalGate;
import tech.yump.rotation.approval.ApprovalRecord;
import tech.yump.rotation.approval.ApprovalRequest;
import tech.yump.rotation.audit.AuditActions;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.audit.AuditRecorder;
import tech.yump.rotation.backup.BackupException;
import tech.yump.rotation.backup.BackupManager;
import tech.yump.rotation.health.DependentClient;
import tech.yump.rotation.health.DependentException;
import tech.yump.rotation.health.HealthCheckResult;
import tech.yump.rotation.health.HealthValidator;
import tech.yump.rotation.notify.NotificationSink;
import tech.yump.rotation.notify.RotationNotification;
import tech.yump.rotation.policy.PolicyRegistry;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.StoreErrorType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives rotation jobs through their state machine. Every transition is validated against the
 * {@link JobState} graph, persisted, then audited, in that order. Side effects against the store
 * are preceded by an intent record, so a resumed job can tell what may already have happened.
 * <p>
 * A worker advances a job while holding the class lock and stops as soon as the job has to wait
 * (scheduled time, retry backoff, pending approval) or reaches a terminal state. Waiting jobs are
 * picked up again by the {@link RotationDispatcher}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RotationOrchestrator {

    static final String OPERATOR_REVIEW = "operator_review_required";

    private final RotationJobRepository repository;
    private final PolicyRegistry policyRegistry;
    private final SecretStoreClient storeClient;
    private final HealthValidator healthValidator;
    private final ApprovalGate approvalGate;
    private final BackupManager backupManager;
    private final DependentClient dependentClient;
    private final AuditRecorder auditRecorder;
    private final NotificationSink notificationSink;
    private final InvariantGuard invariantGuard;
    private final ClassLockRegistry classLocks;
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    /**
     * Creates a PENDING job for the class unless it already has a non-terminal one.
     */
    public EnqueueResult enqueue(SecretClass secretClass, RotationTrigger trigger, @Nullable String actor, Instant scheduledAt) {
        return classLocks.withClassLock(secretClass.id(), () -> {
            Optional<RotationJob> existing = repository.findNonTerminal(secretClass.id());
            if (existing.isPresent()) {
                log.debug("Class '{}' already has job {} in state {}", secretClass.id(), existing.get().id(), existing.get().state());
                return new EnqueueResult(existing.get(), false);
            }
            Instant now = clock.instant();
            RotationJob job = RotationJob.builder()
                    .id(UUID.randomUUID().toString())
                    .secretClassId(secretClass.id())
                    .trigger(trigger)
                    .requestedBy(AuditRecorder.resolveActor(actor))
                    .createdAt(now)
                    .scheduledAt(scheduledAt)
                    .state(JobState.PENDING)
                    .updatedAt(now)
                    .build();
            repository.create(job);
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.JOB_CREATED)
                    .jobId(job.id())
                    .secretClassId(job.secretClassId())
                    .actor(job.requestedBy())
                    .newState(JobState.PENDING.name())
                    .result(AuditRecord.RESULT_SUCCESS)
                    .data(Map.of("trigger", trigger.name(), "scheduled_at", scheduledAt.toString()))
                    .build());
            log.info("Rotation job {} created for class '{}' ({}), scheduled at {}", job.id(), job.secretClassId(), trigger, scheduledAt);
            return new EnqueueResult(job, true);
        });
    }

    /**
     * Advances the job as far as it can go without waiting.
     *
     * @return the job as last persisted.
     */
    public RotationJob advance(String jobId) {
        RotationJob job = repository.require(jobId);
        return classLocks.withClassLock(job.secretClassId(), () -> runUntilBlocked(jobId));
    }

    /**
     * Cancels a job that has not reached ACTIVATING. If a worker currently holds the job, the
     * request is recorded and honoured at the worker's next step boundary.
     *
     * @throws IllegalJobStateException if the job is terminal or activation has started.
     */
    public RotationJob cancel(String jobId, String actor) {
        RotationJob current = repository.require(jobId);
        checkCancellable(current);
        String effectiveActor = AuditRecorder.resolveActor(actor);
        Optional<RotationJob> cancelled = classLocks.tryWithClassLock(current.secretClassId(), () -> {
            RotationJob fresh = repository.require(jobId);
            checkCancellable(fresh);
            return cancelHeld(fresh, effectiveActor);
        });
        if (cancelled.isPresent()) {
            return cancelled.get();
        }
        repository.requestCancel(jobId, effectiveActor, clock.instant());
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.CANCEL_REQUESTED)
                .jobId(jobId)
                .secretClassId(current.secretClassId())
                .actor(effectiveActor)
                .previousState(current.state().name())
                .result(AuditRecord.RESULT_SUCCESS)
                .build());
        log.info("Job {} is being worked on; cancellation requested by '{}' will apply at the next step.", jobId, effectiveActor);
        return current.toBuilder().cancelRequested(true).build();
    }

    boolean isRunnable(RotationJob job, Instant now) {
        if (job.state().isTerminal()) {
            return false;
        }
        if (job.nextAttemptAt() != null && job.nextAttemptAt().isAfter(now)) {
            return false;
        }
        return job.state() != JobState.PENDING || !job.scheduledAt().isAfter(now);
    }

    private RotationJob runUntilBlocked(String jobId) {
        RotationJob job = repository.require(jobId);
        while (!job.state().isTerminal()) {
            if (invariantGuard.isHalted(job.secretClassId())) {
                log.warn("Class '{}' is halted; job {} stays in {}", job.secretClassId(), job.id(), job.state());
                break;
            }
            Optional<RotationJobRepository.CancelRequest> cancelRequest = repository.findCancelRequest(job.id());
            if (cancelRequest.isPresent()) {
                if (job.state().isCancellable()) {
                    RotationJob cancelled = cancelHeld(job, cancelRequest.get().actor());
                    repository.clearCancelRequest(job.id());
                    return cancelled;
                }
                repository.clearCancelRequest(job.id());
                log.warn("Cancellation of job {} ignored: activation already started (state {})", job.id(), job.state());
            }
            if (!isRunnable(job, clock.instant())) {
                break;
            }
            RotationJob next = step(job);
            // Same instance: the step is waiting on something external
            if (next == job) {
                break;
            }
            job = next;
        }
        return job;
    }

    private RotationJob step(RotationJob job) {
        SecretClass policy = policyRegistry.get(job.secretClassId());
        try {
            return switch (job.state()) {
                case PENDING -> transition(job, JobState.HEALTH_CHECK, null, null, null);
                case HEALTH_CHECK -> healthCheck(job, policy);
                case APPROVAL_WAIT -> awaitApproval(job, policy);
                case GENERATING -> generate(job);
                case DISTRIBUTING -> distribute(job, policy);
                case VALIDATING -> validate(job, policy);
                case ACTIVATING -> activate(job, policy);
                case CLEANUP -> cleanup(job, policy);
                default -> job;
            };
        } catch (SecretStoreException e) {
            // Reload: the step may have persisted markers (activationIssued, backupRef) before failing
            return handleStoreFailure(repository.require(job.id()), policy, e);
        } catch (BackupException e) {
            log.warn("Snapshot step of job {} failed: {}", job.id(), e.getMessage());
            return retryOrFail(repository.require(job.id()), policy, "backup snapshot failed: " + e.getMessage());
        }
    }

    // --- States ---

    private RotationJob healthCheck(RotationJob job, SecretClass policy) {
        HealthCheckResult result = healthValidator.preCheck(policy);
        if (!result.ok()) {
            return retryOrFail(job, policy, "pre-check failed: " + result.reason());
        }
        JobState next = policy.requiresApproval() ? JobState.APPROVAL_WAIT : JobState.GENERATING;
        return transition(job, next, null, null, null);
    }

    private RotationJob awaitApproval(RotationJob job, SecretClass policy) {
        ApprovalRequest request = approvalGate.open(job.id(), policy, policy.approvalTtl());
        return switch (request.status()) {
            case PENDING -> {
                if (!request.isExpiredAt(clock.instant())) {
                    yield job;
                }
                if (!approvalGate.expire(job.id())) {
                    // Resolved concurrently; the next sweep reads the outcome
                    yield job;
                }
                yield fail(job, FailureKind.POLICY, "approval expired at " + request.expiry() + " with "
                        + request.approvals().size() + " of " + request.approversRequired() + " approvals");
            }
            case EXPIRED -> fail(job, FailureKind.POLICY, "approval expired at " + request.expiry());
            case DENIED -> fail(job, FailureKind.POLICY, "approval denied by " + request.resolvedBy()
                    + (request.reason() != null ? ": " + request.reason() : ""));
            case CANCELLED -> transition(job, JobState.CANCELLED,
                    new JobError(FailureKind.CANCELLED, "approval request cancelled", clock.instant()), null, request.resolvedBy());
            case APPROVED -> transition(job, JobState.GENERATING, null,
                    Map.of("approvers", request.approvals().stream().map(ApprovalRecord::actor).toList()), null);
        };
    }

    private RotationJob generate(RotationJob job) {
        if (job.candidateVersionId() != null) {
            return transition(job, JobState.DISTRIBUTING, null, null, null);
        }
        String classId = job.secretClassId();
        String priorId = storeClient.getMetadata(classId).map(SecretVersion::id).orElse(null);
        intent(job, AuditActions.ABOUT_TO_MINT, priorId != null ? Map.of("prior_version_id", priorId) : null);

        SecretVersion minted = storeClient.mintVersion(classId);
        RotationJob withCandidate = job.toBuilder()
                .candidateVersionId(minted.id())
                .priorVersionId(priorId)
                .updatedAt(clock.instant())
                .build();
        repository.save(withCandidate);
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.MINTED)
                .jobId(job.id())
                .secretClassId(classId)
                .previousState(job.state().name())
                .newState(job.state().name())
                .result(AuditRecord.RESULT_SUCCESS)
                .data(Map.of("version_id", minted.id(), "version_number", minted.versionNumber()))
                .build());
        return transition(withCandidate, JobState.DISTRIBUTING, null, null, null);
    }

    private RotationJob distribute(RotationJob job, SecretClass policy) {
        SecretVersion candidate = requireVersion(job.secretClassId(), job.candidateVersionId());
        int failures = 0;
        for (String dependent : policy.dependents()) {
            try {
                dependentClient.distribute(dependent, policy, candidate);
            } catch (DependentException e) {
                failures++;
                log.warn("Job {}: distribution of version {} to '{}' failed: {}", job.id(), candidate.id(), dependent, e.getMessage());
            }
        }
        RotationJob distributed = job.toBuilder().dependentFailures(failures).build();
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.DISTRIBUTED)
                .jobId(job.id())
                .secretClassId(job.secretClassId())
                .previousState(job.state().name())
                .newState(job.state().name())
                .result(failures == 0 ? AuditRecord.RESULT_SUCCESS : AuditRecord.RESULT_FAILURE)
                .data(Map.of("dependents", policy.dependents().size(), "failures", failures))
                .build());
        return transition(distributed, JobState.VALIDATING, null, null, null);
    }

    private RotationJob validate(RotationJob job, SecretClass policy) {
        SecretVersion candidate = requireVersion(job.secretClassId(), job.candidateVersionId());
        HealthCheckResult result = healthValidator.postCheck(policy, candidate);
        if (result.ok()) {
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.VALIDATED)
                    .jobId(job.id())
                    .secretClassId(job.secretClassId())
                    .previousState(job.state().name())
                    .newState(job.state().name())
                    .result(AuditRecord.RESULT_SUCCESS)
                    .data(Map.of("version_id", candidate.id()))
                    .build());
            return transition(job, JobState.ACTIVATING, null, null, null);
        }
        // The old version never stopped being active: abandoning the candidate is the whole rollback
        revokeCandidate(job, candidate.id());
        return transition(job, JobState.ROLLED_BACK,
                new JobError(FailureKind.VALIDATION, "validation failed: " + result.reason(), clock.instant()), null, null);
    }

    private RotationJob activate(RotationJob job, SecretClass policy) {
        String classId = job.secretClassId();
        SecretVersion candidate = requireVersion(classId, job.candidateVersionId());
        if (job.rollbackIssued()) {
            return continueRollback(job, policy, candidate);
        }

        String activeId = storeClient.getMetadata(classId).map(SecretVersion::id).orElse(null);
        if (job.activationIssued()) {
            if (candidate.id().equals(activeId)) {
                log.info("Job {}: activation of {} already applied before restart, continuing.", job.id(), candidate.id());
                return afterActivation(job, policy, candidate);
            }
            if (!Objects.equals(activeId, job.priorVersionId())) {
                return fail(job, FailureKind.CONFLICT, "active version is " + activeId + ", expected " + job.priorVersionId()
                        + " or " + candidate.id() + "; " + OPERATOR_REVIEW);
            }
            log.info("Job {}: activation of {} was not applied before restart, re-issuing.", job.id(), candidate.id());
        } else {
            if (!Objects.equals(activeId, job.priorVersionId())) {
                return fail(job, FailureKind.CONFLICT, "active version changed from " + job.priorVersionId() + " to "
                        + activeId + " during rotation; " + OPERATOR_REVIEW);
            }
            if (activeId != null && job.backupRef() == null) {
                SecretVersion prior = requireVersion(classId, activeId);
                String backupRef = backupManager.snapshot(policy, prior, job.id());
                job = save(job.toBuilder().backupRef(backupRef).build());
                auditRecorder.record(AuditRecord.builder()
                        .action(AuditActions.BACKUP_SNAPSHOT)
                        .jobId(job.id())
                        .secretClassId(classId)
                        .previousState(job.state().name())
                        .newState(job.state().name())
                        .result(AuditRecord.RESULT_SUCCESS)
                        .data(Map.of("backup_ref", backupRef, "version_id", prior.id()))
                        .build());
            }
            intent(job, AuditActions.ABOUT_TO_ACTIVATE, activationData(job, candidate));
            job = save(job.toBuilder().activationIssued(true).build());
        }

        storeClient.activate(classId, job.priorVersionId(), candidate);
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.ACTIVATED)
                .jobId(job.id())
                .secretClassId(classId)
                .previousState(job.state().name())
                .newState(job.state().name())
                .result(AuditRecord.RESULT_SUCCESS)
                .data(activationData(job, candidate))
                .build());
        return afterActivation(job, policy, candidate);
    }

    private RotationJob afterActivation(RotationJob job, SecretClass policy, SecretVersion candidate) {
        if (!invariantGuard.verify(job.secretClassId(), job.id())) {
            return fail(job, FailureKind.FATAL, "more than one active version after activation of " + candidate.id());
        }
        SecretVersion active = requireVersion(job.secretClassId(), candidate.id());
        HealthCheckResult result = healthValidator.postCheck(policy, active);
        if (result.ok()) {
            return transition(job, JobState.CLEANUP, null, null, null);
        }
        if (job.backupRef() == null) {
            return fail(job, FailureKind.VALIDATION, "post-activation check failed and there is no prior version to restore: "
                    + result.reason() + "; " + OPERATOR_REVIEW);
        }
        intent(job, AuditActions.ABOUT_TO_RESTORE, Map.of("backup_ref", job.backupRef(), "reason", result.reason()));
        RotationJob rollingBack = save(job.toBuilder()
                .rollbackIssued(true)
                .error(new JobError(FailureKind.VALIDATION, "post-activation check failed: " + result.reason(), clock.instant()))
                .build());
        return continueRollback(rollingBack, policy, candidate);
    }

    private RotationJob continueRollback(RotationJob job, SecretClass policy, SecretVersion candidate) {
        String classId = job.secretClassId();
        String activeId = storeClient.getMetadata(classId).map(SecretVersion::id).orElse(null);
        if (candidate.id().equals(activeId)) {
            backupManager.restore(policy, job.backupRef(), candidate.id());
        } else if (!Objects.equals(activeId, job.priorVersionId())) {
            return fail(job, FailureKind.CONFLICT, "rollback found active version " + activeId + ", expected "
                    + candidate.id() + "; " + OPERATOR_REVIEW);
        }
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.RESTORED)
                .jobId(job.id())
                .secretClassId(classId)
                .previousState(job.state().name())
                .newState(job.state().name())
                .result(AuditRecord.RESULT_SUCCESS)
                .data(Map.of("backup_ref", job.backupRef(), "restored_version_id", String.valueOf(job.priorVersionId())))
                .build());
        storeClient.revoke(classId, candidate.id());
        auditRevoked(job, candidate.id());
        String reason = job.error() != null ? job.error().message() : "post-activation check failed";
        return transition(job, JobState.ROLLED_BACK, new JobError(FailureKind.VALIDATION, reason, clock.instant()), null, null);
    }

    private RotationJob cleanup(RotationJob job, SecretClass policy) {
        if (job.priorVersionId() != null) {
            storeClient.retire(job.secretClassId(), job.priorVersionId());
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.VERSION_RETIRED)
                    .jobId(job.id())
                    .secretClassId(job.secretClassId())
                    .previousState(job.state().name())
                    .newState(job.state().name())
                    .result(AuditRecord.RESULT_SUCCESS)
                    .data(Map.of("version_id", job.priorVersionId()))
                    .build());
        }
        return transition(job, JobState.COMPLETED, null, Map.of("active_version_id", job.candidateVersionId()), null);
    }

    // --- Failure handling ---

    private RotationJob handleStoreFailure(RotationJob job, SecretClass policy, SecretStoreException e) {
        log.warn("Job {} ({}): store call failed with {}: {}", job.id(), job.state(), e.getType(), e.getMessage());
        if (e.isRetryable()) {
            return retryOrFail(job, policy, e.getMessage());
        }
        if (e.getType() == StoreErrorType.CONFLICT) {
            return fail(job, FailureKind.CONFLICT, e.getMessage() + "; " + OPERATOR_REVIEW);
        }
        return fail(job, FailureKind.FATAL, "store error " + e.getType() + ": " + e.getMessage());
    }

    /**
     * Persists a backoff (the worker is released) or fails the job once {@code maxRetry} is spent.
     */
    private RotationJob retryOrFail(RotationJob job, SecretClass policy, String message) {
        Instant now = clock.instant();
        if (job.attempts() < policy.maxRetry()) {
            Duration delay = retryPolicy.delay(policy.backoffBase(), job.attempts());
            RotationJob retry = save(job.toBuilder()
                    .attempts(job.attempts() + 1)
                    .nextAttemptAt(now.plus(delay))
                    .error(new JobError(FailureKind.TRANSIENT, message, now))
                    .build());
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.RETRY_SCHEDULED)
                    .jobId(job.id())
                    .secretClassId(job.secretClassId())
                    .previousState(job.state().name())
                    .newState(job.state().name())
                    .result(AuditRecord.RESULT_FAILURE)
                    .errorKind(FailureKind.TRANSIENT.name())
                    .message(message)
                    .data(Map.of("attempt", retry.attempts(), "next_attempt_at", retry.nextAttemptAt().toString()))
                    .build());
            log.warn("Job {} ({}): attempt {} of {} failed, retrying in {}: {}",
                    job.id(), job.state(), retry.attempts(), policy.maxRetry(), delay, message);
            return retry;
        }
        String detail = job.state() == JobState.CLEANUP
                ? "cleanup incomplete; new version is active: " + message
                : "retries exhausted after " + job.attempts() + " attempt(s): " + message;
        return fail(job, FailureKind.TRANSIENT, detail);
    }

    private RotationJob fail(RotationJob job, FailureKind kind, String message) {
        RotationJob failed = transition(job, JobState.FAILED, new JobError(kind, message, clock.instant()), null, null);
        if (kind == FailureKind.FATAL) {
            invariantGuard.halt(job.secretClassId(), message, job.id());
        }
        return failed;
    }

    private RotationJob cancelHeld(RotationJob job, String actor) {
        if (job.state() == JobState.APPROVAL_WAIT) {
            approvalGate.cancel(job.id(), actor);
        }
        if (job.candidateVersionId() != null) {
            revokeCandidate(job, job.candidateVersionId());
        }
        return transition(job.toBuilder().cancelRequested(true).build(), JobState.CANCELLED,
                new JobError(FailureKind.CANCELLED, "cancelled by " + actor, clock.instant()), null, actor);
    }

    private static void checkCancellable(RotationJob job) {
        if (job.state().isTerminal()) {
            throw new IllegalJobStateException("Job " + job.id() + " is already " + job.state());
        }
        if (!job.state().isCancellable()) {
            throw new IllegalJobStateException("Job " + job.id() + " cannot be cancelled once activation has started (state "
                    + job.state() + ")");
        }
    }

    // --- Helpers ---

    /**
     * Validates, persists and audits a state change; terminal states also notify.
     */
    private RotationJob transition(RotationJob job, JobState target, @Nullable JobError error,
                                   @Nullable Map<String, Object> data, @Nullable String actor) {
        if (!job.state().canTransitionTo(target)) {
            throw new IllegalJobStateException("Illegal transition " + job.state() + " -> " + target + " for job " + job.id());
        }
        Instant now = clock.instant();
        RotationJob.RotationJobBuilder builder = job.toBuilder()
                .state(target)
                .attempts(0)
                .nextAttemptAt(null)
                .updatedAt(now);
        if (job.startedAt() == null) {
            builder.startedAt(now);
        }
        if (error != null) {
            builder.error(error);
        }
        if (target.isTerminal()) {
            builder.completedAt(now);
        }
        RotationJob updated = builder.build();
        repository.save(updated);

        String result = error == null ? AuditRecord.RESULT_SUCCESS
                : error.kind() == FailureKind.CANCELLED ? "cancelled" : AuditRecord.RESULT_FAILURE;
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.TRANSITION)
                .jobId(job.id())
                .secretClassId(job.secretClassId())
                .actor(actor)
                .previousState(job.state().name())
                .newState(target.name())
                .result(result)
                .errorKind(error != null ? error.kind().name() : null)
                .message(error != null ? error.message() : null)
                .data(data)
                .build());

        if (error != null && error.kind() != FailureKind.CANCELLED) {
            log.warn("Job {} (class '{}'): {} -> {} [{}] {}", job.id(), job.secretClassId(), job.state(), target, error.kind(), error.message());
        } else {
            log.info("Job {} (class '{}'): {} -> {}", job.id(), job.secretClassId(), job.state(), target);
        }
        if (target.isTerminal()) {
            notifyOutcome(updated);
        }
        return updated;
    }

    private RotationJob save(RotationJob job) {
        RotationJob stamped = job.toBuilder().updatedAt(clock.instant()).build();
        repository.save(stamped);
        return stamped;
    }

    private void intent(RotationJob job, String action, @Nullable Map<String, Object> data) {
        auditRecorder.record(AuditRecord.builder()
                .action(action)
                .jobId(job.id())
                .secretClassId(job.secretClassId())
                .previousState(job.state().name())
                .newState(job.state().name())
                .result(AuditRecord.RESULT_INTENT)
                .data(data)
                .build());
    }

    private void revokeCandidate(RotationJob job, String versionId) {
        try {
            storeClient.revoke(job.secretClassId(), versionId);
            auditRevoked(job, versionId);
        } catch (SecretStoreException e) {
            // Left PENDING; the maintenance sweep abandons candidates of finished jobs
            log.error("Job {}: could not revoke candidate {} ({}): {}", job.id(), versionId, e.getType(), e.getMessage());
        }
    }

    private void auditRevoked(RotationJob job, String versionId) {
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.VERSION_REVOKED)
                .jobId(job.id())
                .secretClassId(job.secretClassId())
                .previousState(job.state().name())
                .newState(job.state().name())
                .result(AuditRecord.RESULT_SUCCESS)
                .data(Map.of("version_id", versionId))
                .build());
    }

    private SecretVersion requireVersion(String classId, String versionId) {
        if (versionId == null) {
            throw new SecretStoreException(StoreErrorType.NOT_FOUND, "Job has no candidate version for class '" + classId + "'");
        }
        return storeClient.listVersions(classId).stream()
                .filter(v -> v.id().equals(versionId))
                .findFirst()
                .orElseThrow(() -> new SecretStoreException(StoreErrorType.NOT_FOUND,
                        "Version '" + versionId + "' not found for class '" + classId + "'"));
    }

    private static Map<String, Object> activationData(RotationJob job, SecretVersion candidate) {
        Map<String, Object> data = new HashMap<>();
        data.put("candidate_version_id", candidate.id());
        if (job.priorVersionId() != null) {
            data.put("expected_active_id", job.priorVersionId());
        }
        if (job.backupRef() != null) {
            data.put("backup_ref", job.backupRef());
        }
        return data;
    }

    private void notifyOutcome(RotationJob job) {
        RotationNotification.Level level;
        String message;
        if (job.state() == JobState.COMPLETED) {
            level = RotationNotification.Level.INFO;
            message = "rotation completed; active version " + job.candidateVersionId();
        } else {
            FailureKind kind = job.error() != null ? job.error().kind() : null;
            level = kind == FailureKind.FATAL || kind == FailureKind.CONFLICT
                    ? RotationNotification.Level.CRITICAL
                    : RotationNotification.Level.WARNING;
            message = job.error() != null ? job.error().kind() + ": " + job.error().message() : job.state().name();
        }
        notificationSink.send(new RotationNotification(job.id(), job.secretClassId(), job.state().name(), level, message, clock.instant()));
    }

    public record EnqueueResult(RotationJob job, boolean created) {
    }
}
