package tech.yump.rotation.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.yump.rotation.approval.ApprovalRecord;
import tech.yump.rotation.engine.JobError;
import tech.yump.rotation.engine.JobState;
import tech.yump.rotation.engine.RotationTrigger;

import java.time.Instant;
import java.util.List;

/**
 * Post-rotation report of a single job, assembled from the job document, its approval request
 * and its audit trail.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RotationReport(
        String jobId,
        String classId,
        RotationTrigger trigger,
        String requestedBy,
        JobState outcome,
        JobError error,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String priorVersionId,
        String newVersionId,
        String backupRef,
        int dependentFailures,
        List<ApprovalRecord> approvals,
        List<TransitionEntry> transitions,
        int auditRecordCount
) {

    public record TransitionEntry(
            long sequence,
            Instant timestamp,
            String from,
            String to,
            String actor,
            String result,
            String errorKind,
            String message
    ) {
    }
}
