package tech.yump.rotation.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * An AuditBackend implementation that logs audit records as JSON strings
 * to the configured SLF4j logger (typically at INFO level).
 */
@Slf4j
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    private final ObjectMapper objectMapper;

    @Override
    public void logRecord(AuditRecord record) {
        if (record == null) {
            log.warn("Attempted to log a null audit record.");
            return;
        }

        try {
            String json = objectMapper.writeValueAsString(record);
            log.info("AUDIT_RECORD: {}", json);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize AuditRecord to JSON. Logging raw record details.", e);
            log.info("AUDIT_RECORD_FALLBACK: {}", record);
        }
    }
}
