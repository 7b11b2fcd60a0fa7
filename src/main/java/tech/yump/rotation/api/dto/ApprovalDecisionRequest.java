package tech.yump.rotation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(description = "Body of an approve or deny call.")
public record ApprovalDecisionRequest(
        @Schema(description = "Acting approver. Only used when authentication is disabled; otherwise the authenticated principal is the actor.",
                example = "alice")
        @Size(max = 128)
        String actorId,

        @Schema(description = "Optional reason, recorded for denials.", example = "change freeze until Monday")
        @Size(max = 1024)
        String reason
) {
}
