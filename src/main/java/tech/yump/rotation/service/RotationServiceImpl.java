package tech.yump.rotation.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.rotation.approval.ApprovalGate;
import tech.yump.rotation.approval.ApprovalRecord;
import tech.yump.rotation.approval.ApprovalRequest;
import tech.yump.rotation.audit.AuditActions;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.audit.AuditRecorder;
import tech.yump.rotation.engine.ClassHalt;
import tech.yump.rotation.engine.ClassHaltedException;
import tech.yump.rotation.engine.FailureKind;
import tech.yump.rotation.engine.InvariantGuard;
import tech.yump.rotation.engine.JobError;
import tech.yump.rotation.engine.JobState;
import tech.yump.rotation.engine.RotationDispatcher;
import tech.yump.rotation.engine.RotationJob;
import tech.yump.rotation.engine.RotationJobRepository;
import tech.yump.rotation.engine.RotationNotDueException;
import tech.yump.rotation.engine.RotationOrchestrator;
import tech.yump.rotation.engine.RotationScheduler;
import tech.yump.rotation.engine.RotationTrigger;
import tech.yump.rotation.health.HealthCheckResult;
import tech.yump.rotation.health.HealthValidator;
import tech.yump.rotation.policy.PolicyRegistry;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretVersion;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class RotationServiceImpl implements RotationService {

    private final PolicyRegistry policyRegistry;
    private final RotationJobRepository repository;
    private final RotationOrchestrator orchestrator;
    private final RotationScheduler scheduler;
    private final RotationDispatcher dispatcher;
    private final InvariantGuard invariantGuard;
    private final HealthValidator healthValidator;
    private final ApprovalGate approvalGate;
    private final SecretStoreClient storeClient;
    private final AuditRecorder auditRecorder;
    private final Clock clock;

    @Override
    public RotationJob rotate(String classId, boolean force, boolean dryRun, String actor) {
        SecretClass secretClass = policyRegistry.get(classId);
        Optional<ClassHalt> halt = invariantGuard.findHalt(classId);
        if (halt.isPresent()) {
            throw new ClassHaltedException(classId, halt.get().reason());
        }
        Instant now = clock.instant();
        if (dryRun) {
            return dryRun(secretClass, force, actor, now);
        }

        Optional<RotationJob> existing = repository.findNonTerminal(classId);
        if (existing.isPresent()) {
            log.info("Rotation of class '{}' requested by '{}': job {} already in flight ({})",
                    classId, AuditRecorder.resolveActor(actor), existing.get().id(), existing.get().state());
            return existing.get();
        }
        if (!force && !scheduler.isDue(secretClass, now)) {
            throw new RotationNotDueException(classId, scheduler.nextDue(secretClass));
        }
        if (!secretClass.enabled()) {
            log.warn("Manual rotation requested for disabled class '{}'", classId);
        }

        RotationTrigger trigger = force ? RotationTrigger.FORCED : RotationTrigger.MANUAL;
        RotationOrchestrator.EnqueueResult result = orchestrator.enqueue(secretClass, trigger, actor, now);
        if (result.created()) {
            dispatcher.submit(result.job().id());
        }
        return result.job();
    }

    private RotationJob dryRun(SecretClass secretClass, boolean force, String actor, Instant now) {
        String effectiveActor = AuditRecorder.resolveActor(actor);
        boolean due = scheduler.isDue(secretClass, now);
        Instant nextDue = scheduler.nextDue(secretClass);
        HealthCheckResult preCheck = healthValidator.preCheck(secretClass);

        Map<String, Object> data = new HashMap<>();
        data.put("due", due);
        data.put("force", force);
        data.put("next_due", nextDue.toString());
        data.put("pre_check_ok", preCheck.ok());
        if (!preCheck.ok()) {
            data.put("pre_check_reason", preCheck.reason());
        }
        boolean wouldRun = (due || force) && preCheck.ok();
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.DRY_RUN)
                .secretClassId(secretClass.id())
                .actor(effectiveActor)
                .result(wouldRun ? AuditRecord.RESULT_SUCCESS : AuditRecord.RESULT_FAILURE)
                .data(data)
                .build());

        if (!due && !force) {
            throw new RotationNotDueException(secretClass.id(), nextDue);
        }
        log.info("Dry run for class '{}' by '{}': due={}, pre-check {}", secretClass.id(), effectiveActor, due,
                preCheck.ok() ? "passed" : "failed: " + preCheck.reason());
        return RotationJob.builder()
                .id(UUID.randomUUID().toString())
                .secretClassId(secretClass.id())
                .trigger(force ? RotationTrigger.FORCED : RotationTrigger.MANUAL)
                .requestedBy(effectiveActor)
                .createdAt(now)
                .scheduledAt(now)
                .updatedAt(now)
                .state(JobState.PENDING)
                .error(preCheck.ok() ? null : new JobError(FailureKind.TRANSIENT, "pre-check failed: " + preCheck.reason(), now))
                .build();
    }

    @Override
    public RotationStatus getStatus(String classId) {
        SecretClass secretClass = policyRegistry.get(classId);
        Optional<SecretVersion> active = storeClient.getMetadata(classId);
        List<RotationJob> jobs = repository.findByClass(classId);
        Optional<RotationJob> current = jobs.stream().filter(j -> !j.state().isTerminal()).findFirst();
        JobError lastError = jobs.stream()
                .map(RotationJob::error)
                .filter(Objects::nonNull)
                .max(Comparator.comparing(JobError::at))
                .orElse(null);
        Optional<ClassHalt> halt = invariantGuard.findHalt(classId);
        Instant lastRotation = active.map(SecretVersion::activatedAt).orElse(null);
        Instant nextDue = lastRotation != null ? lastRotation.plus(secretClass.rotationFrequency()) : clock.instant();

        return new RotationStatus(
                classId,
                active.map(SecretVersion::id).orElse(null),
                lastRotation,
                nextDue,
                current.map(RotationJob::state).orElse(null),
                current.map(RotationJob::id).orElse(null),
                lastError,
                halt.isPresent(),
                halt.map(ClassHalt::reason).orElse(null));
    }

    @Override
    public RotationJob cancel(String jobId, String actor) {
        RotationJob job = orchestrator.cancel(jobId, actor);
        if (!job.state().isTerminal()) {
            // The worker holding the job sees the request at its next step; this covers an idle job
            dispatcher.submit(jobId);
        }
        return job;
    }

    @Override
    public RotationJob getJob(String jobId) {
        return repository.require(jobId);
    }

    @Override
    public RotationReport report(String jobId) {
        RotationJob job = repository.require(jobId);
        List<AuditRecord> trail = auditRecorder.findByJob(jobId);
        List<RotationReport.TransitionEntry> transitions = trail.stream()
                .filter(r -> AuditActions.TRANSITION.equals(r.action()))
                .map(r -> new RotationReport.TransitionEntry(r.sequence(), r.timestamp(), r.previousState(), r.newState(),
                        r.actor(), r.result(), r.errorKind(), r.message()))
                .toList();
        List<ApprovalRecord> approvals = approvalGate.find(jobId)
                .map(ApprovalRequest::approvals)
                .orElse(List.of());
        return new RotationReport(
                job.id(),
                job.secretClassId(),
                job.trigger(),
                job.requestedBy(),
                job.state(),
                job.error(),
                job.createdAt(),
                job.startedAt(),
                job.completedAt(),
                job.priorVersionId(),
                job.candidateVersionId(),
                job.backupRef(),
                job.dependentFailures(),
                approvals,
                transitions,
                trail.size());
    }

    @Override
    public RotationStatus resume(String classId, String actor) {
        policyRegistry.get(classId);
        String effectiveActor = AuditRecorder.resolveActor(actor);
        if (invariantGuard.clear(classId, effectiveActor)) {
            repository.findNonTerminal(classId).ifPresent(job -> dispatcher.submit(job.id()));
        } else {
            log.info("Resume of class '{}' requested by '{}' but the class is not halted", classId, effectiveActor);
        }
        return getStatus(classId);
    }
}
