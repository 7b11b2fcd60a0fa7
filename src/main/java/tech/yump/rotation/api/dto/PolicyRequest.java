package tech.yump.rotation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import tech.yump.rotation.policy.SecretClass;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Rotation policy as sent by operators. Omitted optional fields take the engine defaults;
 * validation happens in the policy registry.
 */
@Schema(description = "Rotation policy of a secret class. Durations are ISO-8601 (e.g. P90D, PT30S).")
public record PolicyRequest(
        @Schema(description = "How often the class must rotate.", example = "P90D", requiredMode = Schema.RequiredMode.REQUIRED)
        Duration rotationFrequency,
        @Schema(description = "Whether a rotation waits for approvers.", example = "true")
        boolean requiresApproval,
        @Schema(description = "Approvals needed (N of N-of-M).", example = "2")
        Integer approversRequired,
        @Schema(description = "Eligible approvers (M). Empty means any approver.")
        Set<String> eligibleApprovers,
        @Schema(description = "How long an approval request stays open.", example = "PT24H")
        Duration approvalTtl,
        @Schema(description = "Retries per state before the job fails.", example = "3")
        Integer maxRetry,
        @Schema(description = "Base delay of the exponential backoff.", example = "PT30S")
        Duration backoffBase,
        @Schema(description = "Snapshot retention override.", example = "P30D")
        Duration backupRetention,
        @Schema(description = "Dependents consuming the secret (names under rotation.dependents).")
        List<String> dependents,
        @Schema(description = "Whether the scheduler rotates this class.", example = "true")
        Boolean enabled
) {

    public SecretClass toSecretClass(String classId) {
        return SecretClass.builder()
                .id(classId)
                .rotationFrequency(rotationFrequency)
                .requiresApproval(requiresApproval)
                .approversRequired(approversRequired != null ? approversRequired : (requiresApproval ? 1 : 0))
                .eligibleApprovers(eligibleApprovers)
                .approvalTtl(approvalTtl != null ? approvalTtl : SecretClass.DEFAULT_APPROVAL_TTL)
                .maxRetry(maxRetry != null ? maxRetry : SecretClass.DEFAULT_MAX_RETRY)
                .backoffBase(backoffBase != null ? backoffBase : SecretClass.DEFAULT_BACKOFF_BASE)
                .backupRetention(backupRetention)
                .dependents(dependents)
                .enabled(enabled == null || enabled)
                .build();
    }
}
