package tech.yump.rotation.notify;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outbound webhook payload for rotation outcomes.
 */
public record RotationNotification(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("class_id") String classId,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("level") Level level,
        @JsonProperty("message") String message,
        @JsonProperty("timestamp") Instant timestamp
) {

    public enum Level {
        @JsonProperty("info") INFO,
        @JsonProperty("warning") WARNING,
        @JsonProperty("critical") CRITICAL
    }
}
