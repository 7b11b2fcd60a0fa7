package tech.yump.rotation.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Error response format (RFC 7807 problem detail subset)")
public record ApiError(
        @Schema(description = "Short error title.", example = "Rotation Not Due", requiredMode = Schema.RequiredMode.REQUIRED)
        String title,
        @Schema(description = "HTTP status code.", example = "409", requiredMode = Schema.RequiredMode.REQUIRED)
        int status,
        @Schema(description = "Detailed error message.", example = "Secret class 'database' is not due for rotation until 2026-12-01T00:00:00Z")
        String detail,
        @Schema(description = "Timestamp when the error occurred.")
        Instant timestamp
) {
}
