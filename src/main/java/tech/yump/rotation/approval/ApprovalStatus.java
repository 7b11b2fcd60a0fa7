package tech.yump.rotation.approval;

public enum ApprovalStatus {
    PENDING,
    APPROVED,
    DENIED,
    EXPIRED,
    CANCELLED;

    public boolean isResolved() {
        return this != PENDING;
    }
}
