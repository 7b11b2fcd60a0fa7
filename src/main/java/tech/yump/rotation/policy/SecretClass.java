package tech.yump.rotation.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Builder;
import tech.yump.rotation.config.validation.ValidRotationPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Typed rotation policy of one class of secrets (e.g. "database", "internal-token").
 *
 * @param eligibleApprovers approvers allowed to vote; empty means any authenticated approver.
 * @param backupRetention   optional override of the global snapshot retention.
 * @param dependents        names of the dependents (see {@code rotation.dependents}) that consume the secret.
 */
@Builder(toBuilder = true)
@ValidRotationPolicy
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecretClass(
        @NotBlank(message = "Secret class id must not be blank")
        @Pattern(regexp = ID_PATTERN, message = "Secret class id may only contain letters, digits, '.', '_' and '-'")
        String id,

        @NotNull(message = "rotationFrequency is required")
        Duration rotationFrequency,

        boolean requiresApproval,

        @Min(value = 0, message = "approversRequired must not be negative")
        int approversRequired,

        Set<String> eligibleApprovers,

        Duration approvalTtl,

        @Min(value = 0, message = "maxRetry must not be negative")
        int maxRetry,

        @NotNull(message = "backoffBase is required")
        Duration backoffBase,

        Duration backupRetention,

        List<String> dependents,

        boolean enabled,

        Instant updatedAt
) {

    public static final String ID_PATTERN = "[A-Za-z0-9][A-Za-z0-9._-]{0,127}";
    public static final Duration DEFAULT_APPROVAL_TTL = Duration.ofHours(24);
    public static final int DEFAULT_MAX_RETRY = 3;
    public static final Duration DEFAULT_BACKOFF_BASE = Duration.ofSeconds(30);

    public SecretClass {
        eligibleApprovers = eligibleApprovers == null ? Set.of() : Set.copyOf(eligibleApprovers);
        dependents = dependents == null ? List.of() : List.copyOf(dependents);
    }
}
