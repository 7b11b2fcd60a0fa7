package tech.yump.rotation.approval;

import java.time.Instant;

/**
 * A single approver's vote.
 */
public record ApprovalRecord(
        String actor,
        Instant approvedAt
) {
}
