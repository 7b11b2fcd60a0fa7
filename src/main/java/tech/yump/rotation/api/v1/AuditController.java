package tech.yump.rotation.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.rotation.audit.AuditHelper;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.audit.AuditRecorder;
import tech.yump.rotation.service.ComplianceService;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/audit")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Audit ledger export and compliance reporting")
public class AuditController {

    public static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final AuditRecorder auditRecorder;
    private final ComplianceService complianceService;
    private final AuditHelper auditHelper;

    @GetMapping(value = "/export", produces = "application/x-ndjson")
    @Operation(summary = "Export the audit ledger",
            description = "Ledger records as newline-delimited JSON, in ledger order, optionally filtered by class and time range.")
    public ResponseEntity<String> export(
            @Parameter(description = "Restrict to one secret class.", example = "database")
            @RequestParam(required = false) @Nullable String classId,
            @Parameter(description = "Inclusive lower bound (ISO-8601 instant).")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) @Nullable Instant from,
            @Parameter(description = "Exclusive upper bound (ISO-8601 instant).")
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) @Nullable Instant to
    ) {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new IllegalArgumentException("'from' must be before 'to'");
        }
        StringWriter writer = new StringWriter();
        int count;
        try {
            count = auditRecorder.exportNdjson(classId, from, to, writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export audit ledger", e);
        }
        log.info("Exported {} audit records (classId={}, from={}, to={})", count, classId, from, to);
        Map<String, Object> data = new HashMap<>();
        data.put("count", count);
        if (classId != null) {
            data.put("class_id", classId);
        }
        auditHelper.logHttpEvent("audit_export", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null, data);
        return ResponseEntity.ok().contentType(NDJSON).body(writer.toString());
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Audit trail of a job")
    public ResponseEntity<List<AuditRecord>> jobTrail(@PathVariable String jobId) {
        List<AuditRecord> trail = auditRecorder.findByJob(jobId);
        auditHelper.logHttpEvent("audit_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("job_id", jobId, "count", trail.size()));
        return ResponseEntity.ok(trail);
    }

    @GetMapping("/compliance/active-version-ages")
    @Operation(summary = "Active version ages",
            description = "Age of each class's active version against its rotation frequency.")
    public ResponseEntity<List<ComplianceService.ActiveVersionAge>> activeVersionAges() {
        List<ComplianceService.ActiveVersionAge> ages = complianceService.activeVersionAges();
        auditHelper.logHttpEvent("audit_read", AuditRecord.RESULT_SUCCESS, HttpStatus.OK.value(), null,
                Map.of("classes", ages.size()));
        return ResponseEntity.ok(ages);
    }
}
