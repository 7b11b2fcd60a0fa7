package tech.yump.rotation.audit;

/**
 * Action names written to the audit ledger.
 */
public final class AuditActions {

    public static final String JOB_CREATED = "job_created";
    public static final String TRANSITION = "transition";
    public static final String RETRY_SCHEDULED = "retry_scheduled";
    public static final String CANCEL_REQUESTED = "cancel_requested";
    public static final String DRY_RUN = "dry_run";

    public static final String ABOUT_TO_MINT = "about_to_mint";
    public static final String MINTED = "minted";
    public static final String DISTRIBUTED = "distributed";
    public static final String VALIDATED = "validated";
    public static final String BACKUP_SNAPSHOT = "backup_snapshot";
    public static final String ABOUT_TO_ACTIVATE = "about_to_activate";
    public static final String ACTIVATED = "activated";
    public static final String ABOUT_TO_RESTORE = "about_to_restore";
    public static final String RESTORED = "restored";
    public static final String VERSION_REVOKED = "version_revoked";
    public static final String VERSION_RETIRED = "version_retired";
    public static final String VERSION_REAPED = "version_reaped";

    public static final String APPROVAL_OPENED = "approval_opened";
    public static final String APPROVAL_GRANTED = "approval_granted";
    public static final String APPROVAL_DENIED = "approval_denied";
    public static final String APPROVAL_EXPIRED = "approval_expired";
    public static final String APPROVAL_CANCELLED = "approval_cancelled";

    public static final String POLICY_UPSERT = "policy_upsert";
    public static final String INVARIANT_VIOLATION = "invariant_violation";
    public static final String HALT_CLEARED = "halt_cleared";
    public static final String JOB_ARCHIVED = "job_archived";
    public static final String BACKUP_PRUNED = "backup_pruned";

    public static final String AUTH_TOKEN_VALIDATION = "auth_token_validation";

    private AuditActions() {
    }
}
