package tech.yump.rotation.api.v1;

import io.swagger.v3.oas.annotations.Operation;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.rotation.api.ApiError;
import tech.yump.rotation.api.dto.PolicyRequest;
import tech.yump.rotation.audit.AuditHelper;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.policy.PolicyRegistry;
import tech.yump.rotation.policy.SecretClass;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/policies")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Policies", description = "Rotation policies of secret classes")
public class PolicyController {

    private final PolicyRegistry policyRegistry;
    private final AuditHelper auditHelper;

    @GetMapping
    @Operation(summary = "List secret classes")
    public ResponseEntity<List<SecretClass>> list() {
        List<SecretClass> classes = policyRegistry.list();
        auditHelper.logHttpEvent("policy_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("count", classes.size()));
        return ResponseEntity.ok(classes);
    }

    @GetMapping("/{classId}")
    @Operation(summary = "Get the policy of a secret class")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Policy returned."),
            @ApiResponse(responseCode = "404", description = "Unknown secret class.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<SecretClass> get(@PathVariable String classId) {
        SecretClass secretClass = policyRegistry.get(classId);
        auditHelper.logHttpEvent("policy_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("class_id", classId));
        return ResponseEntity.ok(secretClass);
    }

    @PutMapping("/{classId}")
    @Operation(summary = "Create or replace a policy",
            description = "Validates and stores the rotation policy of the class. Changes apply to jobs created afterwards.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Policy stored."),
            @ApiResponse(responseCode = "400", description = "Policy violates a constraint.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class))),
            @ApiResponse(responseCode = "403", description = "Caller lacks the OPERATOR role.", content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = ApiError.class)))
    })
    public ResponseEntity<SecretClass> upsert(@PathVariable String classId, @RequestBody PolicyRequest request) {
        log.info("Received policy update for class '{}'", classId);
        SecretClass stored = policyRegistry.upsert(request.toSecretClass(classId), null);
        auditHelper.logHttpEvent("policy_upsert", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("class_id", classId));
        return ResponseEntity.ok(stored);
    }
}
