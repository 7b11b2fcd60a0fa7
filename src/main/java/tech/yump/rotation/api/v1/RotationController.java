package tech.yump.rotation.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.rotation.api.ApiError;
import tech.yump.rotation.audit.AuditHelper;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.engine.RotationJob;
import tech.yump.rotation.service.RotationReport;
import tech.yump.rotation.service.RotationService;
import tech.yump.rotation.service.RotationStatus;

import java.util.Map;

@RestController
@RequestMapping("/v1/rotation")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Rotation", description = "Trigger, inspect and cancel secret rotations")
public class RotationController {

    private final RotationService rotationService;
    private final AuditHelper auditHelper;

    @PostMapping("/classes/{classId}/rotate")
    @Operation(
            summary = "Request a rotation",
            description = "Enqueues a rotation job for the class. If a non-terminal job already exists it is returned instead. "
                    + "With dryRun=true only due-ness and the store pre-check are evaluated."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Rotation job accepted (new or already in flight).",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = RotationJob.class))),
            @ApiResponse(responseCode = "200", description = "Dry run evaluated. Nothing was persisted.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = RotationJob.class))),
            @ApiResponse(responseCode = "401", description = "Authentication failed (Missing or invalid X-Vault-Token).", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "403", description = "Caller lacks the OPERATOR role.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "404", description = "Unknown secret class.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "Class not due and force not set.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "423", description = "Class halted pending operator review.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<RotationJob> rotate(
            @Parameter(description = "Secret class id.", required = true, example = "database")
            @PathVariable String classId,
            @Parameter(description = "Rotate even if the class is not due.")
            @RequestParam(defaultValue = "false") boolean force,
            @Parameter(description = "Evaluate without rotating.")
            @RequestParam(defaultValue = "false") boolean dryRun
    ) {
        log.info("Received rotation request for class '{}' (force={}, dryRun={})", classId, force, dryRun);
        RotationJob job = rotationService.rotate(classId, force, dryRun, null);
        HttpStatus status = dryRun ? HttpStatus.OK : HttpStatus.ACCEPTED;
        auditHelper.logHttpEvent(dryRun ? "dry_run" : "rotate", AuditRecord.RESULT_SUCCESS, status.value(), null,
                Map.of("class_id", classId, "job_id", job.id(), "force", force));
        return ResponseEntity.status(status).body(job);
    }

    @GetMapping("/classes/{classId}/status")
    @Operation(summary = "Rotation status of a class",
            description = "Active version, last rotation, next due time and current job of the class.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status returned."),
            @ApiResponse(responseCode = "404", description = "Unknown secret class.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<RotationStatus> status(@PathVariable String classId) {
        RotationStatus status = rotationService.getStatus(classId);
        auditHelper.logHttpEvent("rotation_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("class_id", classId));
        return ResponseEntity.ok(status);
    }

    @PostMapping("/classes/{classId}/resume")
    @Operation(summary = "Resume a halted class",
            description = "Clears the halt placed on the class after a fatal failure or invariant violation and resumes its pending job.")
    public ResponseEntity<RotationStatus> resume(@PathVariable String classId) {
        log.info("Received resume request for class '{}'", classId);
        RotationStatus status = rotationService.resume(classId, null);
        auditHelper.logHttpEvent("resume", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("class_id", classId));
        return ResponseEntity.ok(status);
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get a rotation job")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Job returned."),
            @ApiResponse(responseCode = "404", description = "Unknown job.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<RotationJob> job(@PathVariable String jobId) {
        RotationJob job = rotationService.getJob(jobId);
        auditHelper.logHttpEvent("rotation_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("job_id", jobId));
        return ResponseEntity.ok(job);
    }

    @GetMapping("/jobs/{jobId}/report")
    @Operation(summary = "Rotation report",
            description = "Outcome, transitions and approvals of a job, assembled from the audit ledger.")
    public ResponseEntity<RotationReport> report(@PathVariable String jobId) {
        RotationReport report = rotationService.report(jobId);
        auditHelper.logHttpEvent("rotation_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("job_id", jobId));
        return ResponseEntity.ok(report);
    }

    @PostMapping("/jobs/{jobId}/cancel")
    @Operation(summary = "Cancel a rotation job",
            description = "Cancels a job that has not begun activation. A job held by a worker is cancelled at its next step.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Job cancelled or cancellation requested."),
            @ApiResponse(responseCode = "404", description = "Unknown job.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "409", description = "Job is terminal or activation has begun.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<RotationJob> cancel(@PathVariable String jobId) {
        log.info("Received cancel request for job {}", jobId);
        RotationJob job = rotationService.cancel(jobId, null);
        auditHelper.logHttpEvent("cancel", AuditRecord.RESULT_SUCCESS, HttpStatus.ACCEPTED.value(), null,
                Map.of("job_id", jobId, "state", job.state().name()));
        return ResponseEntity.accepted().body(job);
    }
}
