package tech.yump.rotation.engine;

import lombok.Getter;
import tech.yump.rotation.core.RotationException;

import java.time.Instant;

/**
 * Exception thrown when a non-forced rotation is requested for a class that is not yet due.
 */
@Getter
public class RotationNotDueException extends RotationException {

    private final String classId;
    private final Instant nextDue;

    public RotationNotDueException(String classId, Instant nextDue) {
        super("Secret class '" + classId + "' is not due for rotation until " + nextDue);
        this.classId = classId;
        this.nextDue = nextDue;
    }
}
