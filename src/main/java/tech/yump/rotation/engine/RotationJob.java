package tech.yump.rotation.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * Persisted state of one rotation of one secret class.
 *
 * @param attempts           retries spent in the current state.
 * @param nextAttemptAt      earliest time the current state may be retried, set while backing off.
 * @param priorVersionId     version that was active when generation started; the expected value of the activation swap.
 * @param dependentFailures  number of dependents the new version could not be distributed to.
 * @param activationIssued   set before the activation swap is sent, so a resumed job reconciles instead of re-sending.
 * @param rollbackIssued     set before the restore swap is sent, for the same reason.
 * @param cancelRequested    an operator asked for cancellation while a worker held the job.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RotationJob(
        String id,
        String secretClassId,
        RotationTrigger trigger,
        String requestedBy,
        Instant createdAt,
        Instant scheduledAt,
        JobState state,
        int attempts,
        Instant nextAttemptAt,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt,
        JobError error,
        String priorVersionId,
        String candidateVersionId,
        String backupRef,
        int dependentFailures,
        boolean activationIssued,
        boolean rollbackIssued,
        boolean cancelRequested
) {
}
