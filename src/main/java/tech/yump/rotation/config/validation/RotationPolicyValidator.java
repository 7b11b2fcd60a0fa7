package tech.yump.rotation.config.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import tech.yump.rotation.policy.SecretClass;

import java.time.Duration;

public class RotationPolicyValidator implements ConstraintValidator<ValidRotationPolicy, SecretClass> {

    @Override
    public boolean isValid(SecretClass value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        context.disableDefaultConstraintViolation();
        boolean valid = true;

        if (!isPositive(value.rotationFrequency())) {
            valid = violation(context, "rotationFrequency", "rotationFrequency must be greater than zero");
        }
        if (!isPositive(value.backoffBase())) {
            valid = violation(context, "backoffBase", "backoffBase must be greater than zero");
        }
        if (value.backupRetention() != null && !isPositive(value.backupRetention())) {
            valid = violation(context, "backupRetention", "backupRetention must be greater than zero when set");
        }
        if (value.requiresApproval()) {
            if (value.approversRequired() < 1) {
                valid = violation(context, "approversRequired", "approversRequired must be at least 1 when approval is required");
            }
            if (!isPositive(value.approvalTtl())) {
                valid = violation(context, "approvalTtl", "approvalTtl must be greater than zero when approval is required");
            }
            if (!value.eligibleApprovers().isEmpty() && value.approversRequired() > value.eligibleApprovers().size()) {
                valid = violation(context, "approversRequired",
                        "approversRequired (" + value.approversRequired() + ") exceeds the number of eligible approvers ("
                                + value.eligibleApprovers().size() + ")");
            }
        }
        return valid;
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }

    private static boolean violation(ConstraintValidatorContext context, String property, String message) {
        context.buildConstraintViolationWithTemplate(message)
                .addPropertyNode(property)
                .addConstraintViolation();
        return false;
    }
}
