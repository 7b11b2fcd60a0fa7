package tech.yump.rotation.approval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import tech.yump.rotation.audit.AuditActions;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.audit.AuditRecorder;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.storage.StorageBackend;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable N-of-M approval gate. Pending requests live under {@code approvals/pending/<jobId>};
 * resolved, expired and cancelled ones are moved to {@code approvals/archive/<jobId>}.
 * <p>
 * A resolution is always persisted before {@link ApprovalResolvedEvent} is published, so a crash
 * between the two is recovered by the dispatcher sweep reading the stored status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApprovalGate {

    static final String PENDING_DIR = "approvals/pending";
    static final String ARCHIVE_DIR = "approvals/archive";
    private static final String JOB_ID_PATTERN = "[A-Za-z0-9-]{1,64}";

    private final StorageBackend storage;
    private final AuditRecorder auditRecorder;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Opens the approval request for a job. Idempotent: an existing request (pending or resolved)
     * is returned unchanged.
     */
    public ApprovalRequest open(String jobId, SecretClass secretClass, Duration ttl) {
        Optional<ApprovalRequest> existing = find(jobId);
        if (existing.isPresent()) {
            return existing.get();
        }
        Instant now = clock.instant();
        ApprovalRequest request = ApprovalRequest.builder()
                .jobId(jobId)
                .secretClassId(secretClass.id())
                .requestedAt(now)
                .approversRequired(secretClass.approversRequired())
                .eligibleApprovers(secretClass.eligibleApprovers())
                .approvals(List.of())
                .expiry(now.plus(ttl))
                .status(ApprovalStatus.PENDING)
                .build();
        if (!storage.putIfAbsent(pendingKey(jobId), request)) {
            return find(jobId).orElse(request);
        }
        auditRecorder.record(AuditRecord.builder()
                .action(AuditActions.APPROVAL_OPENED)
                .jobId(jobId)
                .secretClassId(secretClass.id())
                .actor(AuditRecorder.resolveActor(null))
                .result(AuditRecord.RESULT_SUCCESS)
                .data(Map.of(
                        "approvers_required", request.approversRequired(),
                        "expiry", request.expiry().toString()))
                .build());
        log.info("Approval requested for job {} (class '{}'): {} approval(s) needed before {}",
                jobId, secretClass.id(), request.approversRequired(), request.expiry());
        return request;
    }

    /**
     * Records an approval vote.
     *
     * @return true if this vote (or an earlier one) completed the quorum.
     * @throws ApprovalNotFoundException  if no request exists for the job.
     * @throws ApprovalRejectedException if the actor is not eligible, or the request is resolved or expired.
     */
    public boolean approve(String jobId, String actor) {
        ApprovalRequest result = storage.withLock(pendingKey(jobId), () -> {
            ApprovalRequest request = requirePending(jobId);
            Instant now = clock.instant();
            if (request.isExpiredAt(now)) {
                throw new ApprovalRejectedException("Approval request for job " + jobId + " expired at " + request.expiry());
            }
            if (!request.isEligible(actor)) {
                log.warn("Actor '{}' is not an eligible approver for job {}", actor, jobId);
                throw new ApprovalRejectedException("Actor '" + actor + "' is not an eligible approver for job " + jobId);
            }
            if (request.hasApproved(actor)) {
                log.info("Duplicate approval by '{}' for job {} ignored.", actor, jobId);
                return request;
            }
            List<ApprovalRecord> approvals = new ArrayList<>(request.approvals());
            approvals.add(new ApprovalRecord(actor, now));
            ApprovalRequest updated = request.toBuilder().approvals(approvals).build();
            if (updated.isQuorumReached()) {
                updated = updated.toBuilder()
                        .status(ApprovalStatus.APPROVED)
                        .resolvedAt(now)
                        .resolvedBy(actor)
                        .build();
            }
            storage.put(pendingKey(jobId), updated);
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.APPROVAL_GRANTED)
                    .jobId(jobId)
                    .secretClassId(updated.secretClassId())
                    .actor(actor)
                    .result(AuditRecord.RESULT_SUCCESS)
                    .data(Map.of(
                            "approvals", updated.approvals().size(),
                            "approvers_required", updated.approversRequired(),
                            "quorum_reached", updated.isQuorumReached()))
                    .build());
            if (updated.status() == ApprovalStatus.APPROVED) {
                storage.move(pendingKey(jobId), archiveKey(jobId));
            }
            return updated;
        });

        if (result.status() == ApprovalStatus.APPROVED) {
            log.info("Approval quorum reached for job {} ({} of {}).", jobId, result.approvals().size(), result.approversRequired());
            eventPublisher.publishEvent(new ApprovalResolvedEvent(jobId, result.secretClassId(), ApprovalStatus.APPROVED));
            return true;
        }
        return false;
    }

    /**
     * Denies the request. A single eligible denial resolves it.
     */
    public ApprovalRequest deny(String jobId, String actor, String reason) {
        ApprovalRequest denied = storage.withLock(pendingKey(jobId), () -> {
            ApprovalRequest request = requirePending(jobId);
            Instant now = clock.instant();
            if (request.isExpiredAt(now)) {
                throw new ApprovalRejectedException("Approval request for job " + jobId + " expired at " + request.expiry());
            }
            if (!request.isEligible(actor)) {
                throw new ApprovalRejectedException("Actor '" + actor + "' is not an eligible approver for job " + jobId);
            }
            ApprovalRequest updated = resolve(request, ApprovalStatus.DENIED, actor, reason, now);
            Map<String, Object> data = new HashMap<>();
            if (reason != null) {
                data.put("reason", reason);
            }
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.APPROVAL_DENIED)
                    .jobId(jobId)
                    .secretClassId(updated.secretClassId())
                    .actor(actor)
                    .result(AuditRecord.RESULT_SUCCESS)
                    .message(reason)
                    .data(data)
                    .build());
            return updated;
        });
        log.info("Approval for job {} denied by '{}'.", jobId, actor);
        eventPublisher.publishEvent(new ApprovalResolvedEvent(jobId, denied.secretClassId(), ApprovalStatus.DENIED));
        return denied;
    }

    /**
     * True if the request is past its expiry without quorum (or already marked EXPIRED).
     */
    public boolean isExpired(String jobId) {
        return find(jobId).map(r -> r.isExpiredAt(clock.instant())).orElse(false);
    }

    /**
     * Marks a pending request whose expiry has passed as EXPIRED.
     *
     * @return true if this call expired the request.
     */
    public boolean expire(String jobId) {
        return storage.withLock(pendingKey(jobId), () -> {
            Optional<ApprovalRequest> pending = storage.get(pendingKey(jobId), ApprovalRequest.class);
            Instant now = clock.instant();
            if (pending.isEmpty() || pending.get().status() != ApprovalStatus.PENDING || !pending.get().isExpiredAt(now)) {
                return false;
            }
            ApprovalRequest expired = resolve(pending.get(), ApprovalStatus.EXPIRED, null, "approval window elapsed", now);
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.APPROVAL_EXPIRED)
                    .jobId(jobId)
                    .secretClassId(expired.secretClassId())
                    .result(AuditRecord.RESULT_FAILURE)
                    .data(Map.of("approvals", expired.approvals().size(), "approvers_required", expired.approversRequired()))
                    .build());
            log.warn("Approval request for job {} expired with {} of {} approvals.",
                    jobId, expired.approvals().size(), expired.approversRequired());
            return true;
        });
    }

    /**
     * Withdraws a pending request because its job was cancelled. No-op for resolved requests.
     */
    public void cancel(String jobId, String actor) {
        storage.withLock(pendingKey(jobId), () -> {
            Optional<ApprovalRequest> pending = storage.get(pendingKey(jobId), ApprovalRequest.class);
            if (pending.isEmpty() || pending.get().status() != ApprovalStatus.PENDING) {
                return null;
            }
            ApprovalRequest cancelled = resolve(pending.get(), ApprovalStatus.CANCELLED, actor, "rotation job cancelled", clock.instant());
            auditRecorder.record(AuditRecord.builder()
                    .action(AuditActions.APPROVAL_CANCELLED)
                    .jobId(jobId)
                    .secretClassId(cancelled.secretClassId())
                    .actor(actor)
                    .result(AuditRecord.RESULT_SUCCESS)
                    .build());
            return null;
        });
    }

    public List<ApprovalRequest> listPending() {
        return storage.listDirectory(PENDING_DIR).stream()
                .map(jobId -> storage.get(pendingKey(jobId), ApprovalRequest.class))
                .flatMap(Optional::stream)
                .filter(r -> r.status() == ApprovalStatus.PENDING)
                .sorted(Comparator.comparing(ApprovalRequest::requestedAt))
                .toList();
    }

    /**
     * Looks up the request for a job, live or archived.
     */
    public Optional<ApprovalRequest> find(String jobId) {
        Optional<ApprovalRequest> pending = storage.get(pendingKey(jobId), ApprovalRequest.class);
        return pending.isPresent() ? pending : storage.get(archiveKey(jobId), ApprovalRequest.class);
    }

    private ApprovalRequest requirePending(String jobId) {
        Optional<ApprovalRequest> pending = storage.get(pendingKey(jobId), ApprovalRequest.class);
        if (pending.isPresent() && pending.get().status() == ApprovalStatus.PENDING) {
            return pending.get();
        }
        ApprovalRequest resolved = pending.or(() -> storage.get(archiveKey(jobId), ApprovalRequest.class))
                .orElseThrow(() -> new ApprovalNotFoundException(jobId));
        throw new ApprovalRejectedException("Approval request for job " + jobId + " is already " + resolved.status());
    }

    private ApprovalRequest resolve(ApprovalRequest request, ApprovalStatus status, String actor, String reason, Instant now) {
        ApprovalRequest resolved = request.toBuilder()
                .status(status)
                .resolvedAt(now)
                .resolvedBy(actor)
                .reason(reason)
                .build();
        storage.put(pendingKey(request.jobId()), resolved);
        storage.move(pendingKey(request.jobId()), archiveKey(request.jobId()));
        return resolved;
    }

    private static String pendingKey(String jobId) {
        return PENDING_DIR + "/" + checkJobId(jobId);
    }

    private static String archiveKey(String jobId) {
        return ARCHIVE_DIR + "/" + checkJobId(jobId);
    }

    private static String checkJobId(String jobId) {
        if (jobId == null || !jobId.matches(JOB_ID_PATTERN)) {
            throw new ApprovalNotFoundException(String.valueOf(jobId));
        }
        return jobId;
    }
}
