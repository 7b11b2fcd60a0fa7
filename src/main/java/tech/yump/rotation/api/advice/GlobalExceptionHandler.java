package tech.yump.rotation.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.rotation.approval.ApprovalNotFoundException;
import tech.yump.rotation.approval.ApprovalRejectedException;
import tech.yump.rotation.audit.AuditHelper;
import tech.yump.rotation.audit.AuditRecord;
import tech.yump.rotation.backup.BackupException;
import tech.yump.rotation.engine.ClassHaltedException;
import tech.yump.rotation.engine.IllegalJobStateException;
import tech.yump.rotation.engine.JobNotFoundException;
import tech.yump.rotation.engine.RotationNotDueException;
import tech.yump.rotation.policy.PolicyValidationException;
import tech.yump.rotation.policy.SecretClassNotFoundException;
import tech.yump.rotation.storage.StorageException;
import tech.yump.rotation.store.SecretStoreException;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps domain exceptions to RFC 7807 problem details and forwards every failed request to the
 * audit backend.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private final AuditHelper auditHelper;

    private static final Pattern CLASS_PATH_PATTERN = Pattern.compile(".*/v1/(?:rotation/classes|policies)/([^/]+).*");
    private static final Pattern JOB_PATH_PATTERN = Pattern.compile(".*/v1/(?:rotation/jobs|approvals)/([^/]+).*");

    @ExceptionHandler({SecretClassNotFoundException.class, JobNotFoundException.class, ApprovalNotFoundException.class})
    public ResponseEntity<ProblemDetail> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        String title = ex instanceof SecretClassNotFoundException ? "Secret Class Not Found"
                : ex instanceof JobNotFoundException ? "Job Not Found" : "Approval Not Found";
        log.warn("{}: {}. Request: {} {}", title, ex.getMessage(), request.getMethod(), request.getRequestURI());
        return problem(HttpStatus.NOT_FOUND, title, ex.getMessage(), request);
    }

    @ExceptionHandler(PolicyValidationException.class)
    public ResponseEntity<ProblemDetail> handlePolicyValidation(PolicyValidationException ex, HttpServletRequest request) {
        log.warn("Policy validation failed: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.BAD_REQUEST, "Invalid Rotation Policy", ex.getMessage(), request);
        response.getBody().setProperty("violations", ex.getViolations());
        return response;
    }

    @ExceptionHandler(RotationNotDueException.class)
    public ResponseEntity<ProblemDetail> handleNotDue(RotationNotDueException ex, HttpServletRequest request) {
        log.info("Rotation not due: {}", ex.getMessage());
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.CONFLICT, "Rotation Not Due", ex.getMessage(), request);
        response.getBody().setProperty("nextDue", ex.getNextDue());
        return response;
    }

    @ExceptionHandler(IllegalJobStateException.class)
    public ResponseEntity<ProblemDetail> handleIllegalJobState(IllegalJobStateException ex, HttpServletRequest request) {
        log.warn("Illegal job state: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return problem(HttpStatus.CONFLICT, "Illegal Job State", ex.getMessage(), request);
    }

    @ExceptionHandler(ClassHaltedException.class)
    public ResponseEntity<ProblemDetail> handleHalted(ClassHaltedException ex, HttpServletRequest request) {
        log.warn("Request for halted class rejected: {}", ex.getMessage());
        return problem(HttpStatus.LOCKED, "Secret Class Halted", ex.getMessage(), request);
    }

    @ExceptionHandler(ApprovalRejectedException.class)
    public ResponseEntity<ProblemDetail> handleApprovalRejected(ApprovalRejectedException ex, HttpServletRequest request) {
        log.warn("Approval rejected: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return problem(HttpStatus.FORBIDDEN, "Approval Rejected", ex.getMessage(), request);
    }

    @ExceptionHandler(SecretStoreException.class)
    public ResponseEntity<ProblemDetail> handleStoreError(SecretStoreException ex, HttpServletRequest request) {
        log.error("Secret store error ({}): {}. Request: {} {}", ex.getType(), ex.getMessage(), request.getMethod(), request.getRequestURI());
        ResponseEntity<ProblemDetail> response = problem(HttpStatus.BAD_GATEWAY, "Secret Store Error", ex.getMessage(), request);
        response.getBody().setProperty("storeError", ex.getType());
        return response;
    }

    @ExceptionHandler({StorageException.class, BackupException.class})
    public ResponseEntity<ProblemDetail> handleStorageError(RuntimeException ex, HttpServletRequest request) {
        log.error("Engine storage error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Error", "Engine storage is unavailable.", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}", request.getDescription(false), ex.getMessage());

        if (request instanceof ServletWebRequest servletWebRequest) {
            HttpServletRequest servletRequest = servletWebRequest.getRequest();
            auditHelper.logHttpEvent(determineAction(servletRequest), AuditRecord.RESULT_FAILURE, status.value(), message,
                    extractContextData(servletRequest));
        }
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected internal error occurred.", request);
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail, HttpServletRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        auditHelper.logHttpEvent(determineAction(request), AuditRecord.RESULT_FAILURE, status.value(), detail,
                extractContextData(request));
        return ResponseEntity.status(status).body(problemDetail);
    }

    private String determineAction(HttpServletRequest request) {
        String path = request.getRequestURI();
        String method = request.getMethod();
        if (path.endsWith("/rotate")) return "rotate";
        if (path.endsWith("/cancel")) return "cancel";
        if (path.endsWith("/resume")) return "resume";
        if (path.endsWith("/approve")) return "approve";
        if (path.endsWith("/deny")) return "deny";
        if (path.startsWith("/v1/policies")) {
            return "PUT".equalsIgnoreCase(method) ? "policy_upsert" : "policy_read";
        }
        if (path.startsWith("/v1/audit")) return "audit_read";
        if (path.startsWith("/v1/rotation")) return "rotation_read";
        return "unknown";
    }

    private Map<String, Object> extractContextData(HttpServletRequest request) {
        String uri = request.getRequestURI();
        Matcher classMatcher = CLASS_PATH_PATTERN.matcher(uri);
        if (classMatcher.matches()) {
            return Map.of("class_id", classMatcher.group(1));
        }
        Matcher jobMatcher = JOB_PATH_PATTERN.matcher(uri);
        if (jobMatcher.matches() && !"pending".equals(jobMatcher.group(1))) {
            return Map.of("job_id", jobMatcher.group(1));
        }
        return Map.of();
    }
}
