package tech.yump.rotation.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.rotation.api.ApiError;
import tech.yump.rotation.api.dto.ApprovalDecisionRequest;
import tech.yump.rotation.api.dto.ApprovalDecisionResponse;
import tech.yump.rotation.approval.ApprovalGate;
import tech.yump.rotation.approval.ApprovalNotFoundException;
import tech.yump.rotation.approval.ApprovalRequest;
import tech.yump.rotation.audit.AuditHelper;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.audit.AuditRecorder;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/approvals")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Approvals", description = "N-of-M approval of rotation jobs")
public class ApprovalController {

    private final ApprovalGate approvalGate;
    private final AuditHelper auditHelper;

    @PostMapping("/{jobId}/approve")
    @Operation(summary = "Approve a rotation job",
            description = "Records an approval vote. The job proceeds once the class's quorum is reached.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Vote recorded."),
            @ApiResponse(responseCode = "403", description = "Actor not eligible, or the request is expired or resolved.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "No approval request for the job.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<ApprovalDecisionResponse> approve(
            @PathVariable String jobId,
            @Valid @RequestBody(required = false) @Nullable ApprovalDecisionRequest body
    ) {
        String actor = resolveActor(body);
        log.info("Received approval for job {} from '{}'", jobId, actor);
        approvalGate.approve(jobId, actor);
        ApprovalRequest request = requireRequest(jobId);
        auditHelper.logHttpEvent("approve", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("job_id", jobId, "quorum_reached", request.isQuorumReached()));
        return ResponseEntity.ok(ApprovalDecisionResponse.of(request));
    }

    @PostMapping("/{jobId}/deny")
    @Operation(summary = "Deny a rotation job", description = "A single eligible denial fails the job.")
    public ResponseEntity<ApprovalDecisionResponse> deny(
            @PathVariable String jobId,
            @Valid @RequestBody(required = false) @Nullable ApprovalDecisionRequest body
    ) {
        String actor = resolveActor(body);
        log.info("Received denial for job {} from '{}'", jobId, actor);
        ApprovalRequest denied = approvalGate.deny(jobId, actor, body != null ? body.reason() : null);
        auditHelper.logHttpEvent("deny", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("job_id", jobId));
        return ResponseEntity.ok(ApprovalDecisionResponse.of(denied));
    }

    @GetMapping("/pending")
    @Operation(summary = "List pending approval requests")
    public ResponseEntity<List<ApprovalRequest>> pending() {
        List<ApprovalRequest> pending = approvalGate.listPending();
        auditHelper.logHttpEvent("approval_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("count", pending.size()));
        return ResponseEntity.ok(pending);
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get the approval request of a job")
    public ResponseEntity<ApprovalRequest> get(@PathVariable String jobId) {
        ApprovalRequest request = requireRequest(jobId);
        auditHelper.logHttpEvent("approval_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("job_id", jobId));
        return ResponseEntity.ok(request);
    }

    private ApprovalRequest requireRequest(String jobId) {
        return approvalGate.find(jobId)
                .orElseThrow(() -> new ApprovalNotFoundException(jobId));
    }

    /**
     * The authenticated principal votes. The body's actorId is only honoured when authentication
     * is disabled.
     */
    private String resolveActor(@Nullable ApprovalDecisionRequest body) {
        String principal = AuditRecorder.resolveActor(null);
        if (!AuditRecorder.SYSTEM_ACTOR.equals(principal)) {
            return principal;
        }
        if (body == null || body.actorId() == null || body.actorId().isBlank()) {
            throw new IllegalArgumentException("actorId is required when authentication is disabled");
        }
        return body.actorId();
    }
}
