package tech.yump.rotation.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import tech.yump.rotation.auth.StaticTokenAuthFilter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Forwards HTTP request outcomes to the audit backend. These records describe API traffic and do
 * not enter the sequenced rotation ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String HTTP_REQUEST_ACTION = "http_request";

    private final AuditBackend auditBackend;

    /**
     * Logs an audit record for the current HTTP request.
     *
     * @param action       what the caller tried to do (e.g. "rotate", "approve").
     * @param outcome      {@link AuditRecord#RESULT_SUCCESS} or {@link AuditRecord#RESULT_FAILURE}.
     * @param statusCode   HTTP status returned.
     * @param errorMessage optional error message, for failures.
     * @param data         optional context such as the class or job id.
     */
    public void logHttpEvent(String action, String outcome, int statusCode,
                             @Nullable String errorMessage, @Nullable Map<String, Object> data) {
        try {
            Map<String, Object> context = new HashMap<>();
            if (data != null) {
                context.putAll(data);
            }
            context.put("operation", action);
            context.put("status_code", statusCode);
            HttpServletRequest request = getCurrentHttpRequest();
            if (request != null) {
                Object requestId = request.getAttribute(StaticTokenAuthFilter.REQUEST_ID_ATTR);
                if (requestId != null) {
                    context.put("request_id", requestId);
                }
                context.put("method", request.getMethod());
                context.put("path", request.getRequestURI());
                context.put("source_address", request.getRemoteAddr());
            }
            auditBackend.logRecord(AuditRecord.builder()
                    .timestamp(Instant.now())
                    .action(HTTP_REQUEST_ACTION)
                    .actor(AuditRecorder.resolveActor(null))
                    .result(outcome)
                    .message(errorMessage)
                    .data(context)
                    .build());
        } catch (RuntimeException e) {
            log.error("Failed to log audit record in AuditHelper: Action={}, Outcome={}, Error={}",
                    action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }
}
