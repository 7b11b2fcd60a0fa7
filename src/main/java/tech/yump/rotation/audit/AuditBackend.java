package tech.yump.rotation.audit;

/**
 * Secondary sink for audit records (SIEM shipping). The ledger kept by {@link AuditRecorder} is the
 * record of truth; backends receive a copy after the ledger write succeeded.
 */
public interface AuditBackend {

    /**
     * Forwards a given audit record.
     * Implementations determine *how* the record is shipped (e.g., to the application log, a dedicated file).
     *
     * @param record The AuditRecord to forward. Must not be null.
     */
    void logRecord(AuditRecord record);

}
