package tech.yump.rotation.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.yump.rotation.engine.JobError;
import tech.yump.rotation.engine.JobState;

import java.time.Instant;

/**
 * Rotation status of one secret class.
 *
 * @param lastRotation activation time of the current version, null if never rotated.
 * @param lastError    most recent error of any job of the class.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RotationStatus(
        String classId,
        String activeVersionId,
        Instant lastRotation,
        Instant nextDue,
        JobState currentState,
        String currentJobId,
        JobError lastError,
        boolean halted,
        String haltReason
) {
}
