package tech.yump.rotation.service;

import tech.yump.rotation.engine.RotationJob;

/**
 * Trigger interface of the engine, used by the HTTP API.
 */
public interface RotationService {

    /**
     * Requests a rotation of the class. Returns the class's non-terminal job if one exists.
     *
     * @param force  rotate even if the class is not due.
     * @param dryRun compute due-ness and run the store pre-check only; nothing is persisted but a
     *               {@code dry_run} audit record.
     * @throws tech.yump.rotation.policy.SecretClassNotFoundException if the class is unknown.
     * @throws tech.yump.rotation.engine.RotationNotDueException if not due and not forced.
     * @throws tech.yump.rotation.engine.ClassHaltedException if the class is halted.
     */
    RotationJob rotate(String classId, boolean force, boolean dryRun, String actor);

    RotationStatus getStatus(String classId);

    /**
     * @throws tech.yump.rotation.engine.IllegalJobStateException if the job is terminal or activation has started.
     */
    RotationJob cancel(String jobId, String actor);

    RotationJob getJob(String jobId);

    RotationReport report(String jobId);

    /**
     * Clears the halt of a class after operator review and resumes its pending job, if any.
     */
    RotationStatus resume(String classId, String actor);
}
