package tech.yump.rotation.engine;

import java.time.Instant;

/**
 * Persisted marker that a class is halted pending operator review.
 */
public record ClassHalt(
        String secretClassId,
        String reason,
        String jobId,
        Instant haltedAt
) {
}
