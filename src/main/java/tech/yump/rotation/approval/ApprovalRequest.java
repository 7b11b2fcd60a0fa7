package tech.yump.rotation.approval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Persisted N-of-M approval request guarding one rotation job.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApprovalRequest(
        String jobId,
        String secretClassId,
        Instant requestedAt,
        int approversRequired,
        Set<String> eligibleApprovers,
        List<ApprovalRecord> approvals,
        Instant expiry,
        ApprovalStatus status,
        Instant resolvedAt,
        String resolvedBy,
        String reason
) {

    public ApprovalRequest {
        eligibleApprovers = eligibleApprovers == null ? Set.of() : Set.copyOf(eligibleApprovers);
        approvals = approvals == null ? List.of() : List.copyOf(approvals);
    }

    @JsonIgnore
    public boolean isQuorumReached() {
        return approvals.size() >= approversRequired;
    }

    @JsonIgnore
    public boolean hasApproved(String actor) {
        return approvals.stream().anyMatch(a -> a.actor().equals(actor));
    }

    @JsonIgnore
    public boolean isEligible(String actor) {
        return eligibleApprovers.isEmpty() || eligibleApprovers.contains(actor);
    }

    @JsonIgnore
    public boolean isExpiredAt(Instant now) {
        return status == ApprovalStatus.EXPIRED || (status == ApprovalStatus.PENDING && !now.isBefore(expiry));
    }
}
