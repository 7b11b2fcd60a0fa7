package tech.yump.rotation.approval;

import tech.yump.rotation.core.RotationException;

/**
 * Exception thrown when an approval or denial cannot be accepted: the actor is not eligible, or the
 * request is no longer pending.
 */
public class ApprovalRejectedException extends RotationException {
    public ApprovalRejectedException(String message) {
        super(message);
    }
}
