package tech.yump.rotation.engine;

import java.time.Instant;

public record JobError(
        FailureKind kind,
        String message,
        Instant at
) {
}
