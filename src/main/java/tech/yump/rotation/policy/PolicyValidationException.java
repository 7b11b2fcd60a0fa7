package tech.yump.rotation.policy;

import lombok.Getter;
import tech.yump.rotation.core.RotationException;

import java.util.List;

/**
 * Exception thrown when a secret class policy fails validation on upsert.
 */
@Getter
public class PolicyValidationException extends RotationException {

    private final List<String> violations;

    public PolicyValidationException(String classId, List<String> violations) {
        super("Invalid policy for secret class '" + classId + "': " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
