package tech.yump.rotation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.rotation.approval.ApprovalRequest;
import tech.yump.rotation.approval.ApprovalStatus;

@Schema(description = "Outcome of an approval vote.")
public record ApprovalDecisionResponse(
        String jobId,
        ApprovalStatus status,
        boolean quorumReached,
        int approvals,
        int approversRequired
) {

    public static ApprovalDecisionResponse of(ApprovalRequest request) {
        return new ApprovalDecisionResponse(request.jobId(), request.status(), request.isQuorumReached(),
                request.approvals().size(), request.approversRequired());
    }
}
