package tech.yump.rotation.approval;

/**
 * Published after an approval request has been durably resolved (approved or denied), so the
 * waiting rotation job can be resumed without polling.
 */
public record ApprovalResolvedEvent(
        String jobId,
        String secretClassId,
        ApprovalStatus status
) {
}
