package tech.yump.rotation.auth;

/**
 * Roles a static token can carry. Granted as {@code ROLE_<name>} authorities.
 */
public enum EngineRole {
    /** Triggers, cancels and resumes rotations; maintains policies. */
    OPERATOR,
    /** Votes on approval requests. */
    APPROVER,
    /** Exports the audit ledger and reads compliance data. */
    AUDITOR;

    public String authority() {
        return "ROLE_" + name();
    }
}
