package tech.yump.rotation.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable entry of the compliance ledger. {@code sequence} is assigned by the
 * {@link AuditRecorder} and is strictly increasing in write order.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditRecord(
        long sequence,
        Instant timestamp,
        String jobId,
        String secretClassId,
        String actor,
        String action,
        String previousState,
        String newState,
        String result,
        String errorKind,
        String message,
        Map<String, Object> data
) {

    public static final String RESULT_SUCCESS = "success";
    public static final String RESULT_FAILURE = "failure";
    public static final String RESULT_INTENT = "intent";
}
