package tech.yump.rotation.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import tech.yump.rotation.storage.StorageBackend;
import tech.yump.rotation.storage.StorageException;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Append-only, write-ordered compliance ledger. Every record is assigned the next sequence number and
 * fsynced to {@code audit/ledger.ndjson} before {@link #record} returns; only then is it forwarded to
 * the configured {@link AuditBackend}.
 */
@Component
@Slf4j
public class AuditRecorder {

    static final String LEDGER_KEY = "audit/ledger";
    static final String SEQUENCE_KEY = "audit/sequence";
    public static final String SYSTEM_ACTOR = "system";

    private final StorageBackend storage;
    private final AuditBackend auditBackend;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditRecorder(StorageBackend storage, AuditBackend auditBackend, ObjectMapper objectMapper, Clock clock) {
        this.storage = storage;
        this.auditBackend = auditBackend;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Appends a record to the ledger.
     *
     * @return the record as written, with sequence, timestamp and actor filled in.
     * @throws StorageException if the ledger write fails; the caller must not proceed with the step.
     */
    public AuditRecord record(AuditRecord draft) {
        Objects.requireNonNull(draft, "draft");
        AuditRecord written = storage.withLock(LEDGER_KEY, () -> {
            long sequence = storage.get(SEQUENCE_KEY, LedgerSequence.class)
                    .map(LedgerSequence::last)
                    .orElse(0L) + 1;
            AuditRecord complete = draft.toBuilder()
                    .sequence(sequence)
                    .timestamp(draft.timestamp() != null ? draft.timestamp() : clock.instant())
                    .actor(resolveActor(draft.actor()))
                    .data(draft.data() != null && !draft.data().isEmpty() ? draft.data() : null)
                    .build();
            String line;
            try {
                line = objectMapper.writeValueAsString(complete);
            } catch (JsonProcessingException e) {
                throw new StorageException("Failed to serialize audit record for action " + draft.action(), e);
            }
            // Sequence first: a crash in between leaves a gap, never a duplicate
            storage.put(SEQUENCE_KEY, new LedgerSequence(sequence));
            storage.appendLine(LEDGER_KEY, line);
            return complete;
        });

        try {
            auditBackend.logRecord(written);
        } catch (RuntimeException e) {
            log.error("Failed to forward audit record #{} ({}) to audit backend: {}",
                    written.sequence(), written.action(), e.getMessage(), e);
        }
        return written;
    }

    /**
     * Convenience for records that are not tied to a job state change.
     */
    public AuditRecord recordEvent(String action, @Nullable String jobId, @Nullable String secretClassId,
                                   @Nullable String actor, String result, @Nullable String message,
                                   @Nullable Map<String, Object> data) {
        return record(AuditRecord.builder()
                .action(action)
                .jobId(jobId)
                .secretClassId(secretClassId)
                .actor(actor)
                .result(result)
                .message(message)
                .data(data)
                .build());
    }

    public List<AuditRecord> findByJob(String jobId) {
        return readLedger(r -> jobId.equals(r.jobId()));
    }

    public List<AuditRecord> findByClass(String secretClassId, @Nullable Instant from, @Nullable Instant to) {
        return readLedger(r -> secretClassId.equals(r.secretClassId()) && inRange(r, from, to));
    }

    /**
     * Writes matching records as NDJSON, one JSON object per line, in ledger order.
     */
    public int exportNdjson(@Nullable String secretClassId, @Nullable Instant from, @Nullable Instant to,
                            Writer writer) throws IOException {
        List<AuditRecord> records = readLedger(r ->
                (secretClassId == null || secretClassId.equals(r.secretClassId())) && inRange(r, from, to));
        for (AuditRecord record : records) {
            writer.write(objectMapper.writeValueAsString(record));
            writer.write('\n');
        }
        writer.flush();
        return records.size();
    }

    /**
     * Principal of the current security context, or "system" for engine-internal work.
     */
    public static String resolveActor(@Nullable String actor) {
        if (actor != null && !actor.isBlank()) {
            return actor;
        }
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        return Optional.ofNullable(authentication)
                .filter(Authentication::isAuthenticated)
                .map(Authentication::getName)
                .filter(name -> !"anonymousUser".equals(name))
                .orElse(SYSTEM_ACTOR);
    }

    private List<AuditRecord> readLedger(Predicate<AuditRecord> filter) {
        List<AuditRecord> result = new ArrayList<>();
        for (String line : storage.readLines(LEDGER_KEY)) {
            try {
                AuditRecord record = objectMapper.readValue(line, AuditRecord.class);
                if (filter.test(record)) {
                    result.add(record);
                }
            } catch (JsonProcessingException e) {
                // A torn trailing line after a crash; the record was never acknowledged
                log.warn("Skipping unreadable audit ledger line: {}", e.getOriginalMessage());
            }
        }
        return result;
    }

    private static boolean inRange(AuditRecord record, @Nullable Instant from, @Nullable Instant to) {
        Instant ts = record.timestamp();
        return (from == null || !ts.isBefore(from)) && (to == null || ts.isBefore(to));
    }

    public record LedgerSequence(long last) {
    }
}
