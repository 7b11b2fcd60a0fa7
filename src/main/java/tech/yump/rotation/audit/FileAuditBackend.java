package tech.yump.rotation.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An AuditBackend implementation that writes audit records as NDJSON lines
 * to a dedicated audit log file configured via Logback, for SIEM shipping.
 */
@RequiredArgsConstructor
@Slf4j
public class FileAuditBackend implements AuditBackend {

    // Logger name configured in logback-spring.xml
    public static final String AUDIT_LOGGER_NAME = "tech.yump.rotation.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void logRecord(AuditRecord record) {
        if (record == null) {
            log.warn("Attempted to log a null audit record.");
            return;
        }

        try {
            auditLogger.info(objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            // Keep the audit file pure NDJSON; serialization errors go to the application log
            log.error("Failed to serialize AuditRecord to JSON for file audit logging. Record: {}", record, e);
        }
    }
}
