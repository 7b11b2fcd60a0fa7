package tech.yump.rotation.approval;

import tech.yump.rotation.core.RotationException;

public class ApprovalNotFoundException extends RotationException {
    public ApprovalNotFoundException(String jobId) {
        super("No approval request found for job: " + jobId);
    }
}
