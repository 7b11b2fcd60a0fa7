package tech.yump.rotation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import tech.yump.rotation.auth.EngineRole;
import tech.yump.rotation.policy.SecretClass;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the rotation engine under the 'rotation' prefix.
 */
@ConfigurationProperties(prefix = "rotation")
@Validated
public record RotationProperties(

        @Valid
        @NotNull(message = "Storage configuration (rotation.storage) is required.")
        StorageProperties storage,

        @Valid
        @NotNull(message = "Backup configuration (rotation.backup) is required.")
        BackupProperties backup,

        @Valid
        StoreProperties store,

        @Valid
        SchedulerProperties scheduler,

        @Valid
        EngineProperties engine,

        @Valid
        HealthProperties health,

        @Valid
        NotificationProperties notification,

        @Valid
        AuditProperties audit,

        @Valid
        AuthProperties auth,

        @Valid
        PolicyProperties policy,

        @Valid
        Map<String, DependentEndpoint> dependents,

        @Valid
        List<SecretClassDefinition> classes
) {
    public RotationProperties {
        if (store == null) {
            store = new StoreProperties(null, null, null);
        }
        if (scheduler == null) {
            scheduler = new SchedulerProperties(null, null, null, null, null);
        }
        if (engine == null) {
            engine = new EngineProperties(null, null, null, null, null);
        }
        if (health == null) {
            health = new HealthProperties(null, null, null);
        }
        if (notification == null) {
            notification = new NotificationProperties(null);
        }
        if (audit == null) {
            audit = new AuditProperties(null, null);
        }
        if (auth == null) {
            auth = new AuthProperties(null);
        }
        if (policy == null) {
            policy = new PolicyProperties(false);
        }
        if (dependents == null) {
            dependents = Collections.emptyMap();
        }
        if (classes == null) {
            classes = Collections.emptyList();
        }
    }

    // --- StorageProperties ---
    @Validated
    public record StorageProperties(
            @Valid
            @NotNull(message = "Filesystem storage configuration (rotation.storage.filesystem) is required.")
            FileSystemProperties filesystem
    ) {
        @Validated
        public record FileSystemProperties(
                @NotBlank(message = "Filesystem storage path (rotation.storage.filesystem.path) must be provided.")
                String path
        ) {}
    }

    // --- BackupProperties ---
    @Validated
    public record BackupProperties(
            @NotBlank(message = "Backup encryption key (rotation.backup.encryption-key-b64) must be provided.")
            String encryptionKeyB64,

            Duration retention,

            @Min(value = 1, message = "rotation.backup.keep-minimum must be at least 1.")
            Integer keepMinimum
    ) {
        public BackupProperties {
            if (retention == null) {
                retention = Duration.ofDays(30);
            }
            if (keepMinimum == null) {
                keepMinimum = 10;
            }
        }

        @Override
        public String toString() {
            return "BackupProperties[encryptionKeyB64=******, retention=" + retention + ", keepMinimum=" + keepMinimum + ']';
        }
    }

    /**
     * Which secret store backend the engine drives.
     */
    public enum StoreBackend {
        LOCAL, VAULT
    }

    // --- StoreProperties ---
    @Validated
    public record StoreProperties(
            StoreBackend backend,
            Duration timeout,
            @Valid
            VaultStoreProperties vault
    ) {
        public StoreProperties {
            if (backend == null) {
                backend = StoreBackend.LOCAL;
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(30);
            }
        }

        @AssertTrue(message = "Vault store settings (rotation.store.vault.uri, token) are required when rotation.store.backend=vault.")
        public boolean isVaultConfigValid() {
            return backend != StoreBackend.VAULT
                    || (vault != null && StringUtils.hasText(vault.uri()) && StringUtils.hasText(vault.token()));
        }
    }

    @Validated
    public record VaultStoreProperties(
            String uri,
            String token,
            String mount
    ) {
        public VaultStoreProperties {
            if (!StringUtils.hasText(mount)) {
                mount = "rotation";
            }
        }

        @Override
        public String toString() {
            return "VaultStoreProperties[uri=" + uri + ", token=******, mount=" + mount + ']';
        }
    }

    // --- SchedulerProperties ---
    @Validated
    public record SchedulerProperties(
            Boolean enabled,
            Duration tickInterval,
            Duration dispatchInterval,
            Duration staggerWindow,
            Duration lockAtMostFor
    ) {
        public SchedulerProperties {
            if (enabled == null) {
                enabled = true;
            }
            if (tickInterval == null) {
                tickInterval = Duration.ofMinutes(1);
            }
            if (dispatchInterval == null) {
                dispatchInterval = Duration.ofSeconds(5);
            }
            if (staggerWindow == null) {
                staggerWindow = Duration.ofMinutes(10);
            }
            if (lockAtMostFor == null) {
                lockAtMostFor = Duration.ofMinutes(5);
            }
        }
    }

    // --- EngineProperties ---
    @Validated
    public record EngineProperties(
            @Min(value = 1, message = "rotation.engine.max-concurrent-rotations must be at least 1.")
            Integer maxConcurrentRotations,
            Duration backoffCap,
            Duration gracePeriod,
            Duration jobRetention,
            Duration maintenanceInterval
    ) {
        public EngineProperties {
            if (maxConcurrentRotations == null) {
                maxConcurrentRotations = 4;
            }
            if (backoffCap == null) {
                backoffCap = Duration.ofMinutes(15);
            }
            if (gracePeriod == null) {
                gracePeriod = Duration.ofHours(24);
            }
            if (jobRetention == null) {
                jobRetention = Duration.ofDays(30);
            }
            if (maintenanceInterval == null) {
                maintenanceInterval = Duration.ofMinutes(15);
            }
        }
    }

    // --- HealthProperties ---
    @Validated
    public record HealthProperties(
            Duration latencyBudget,
            Long minFreeCapacity,
            Duration postCheckTimeout
    ) {
        public HealthProperties {
            if (latencyBudget == null) {
                latencyBudget = Duration.ofSeconds(2);
            }
            if (minFreeCapacity == null) {
                minFreeCapacity = 10L * 1024 * 1024;
            }
            if (postCheckTimeout == null) {
                postCheckTimeout = Duration.ofSeconds(10);
            }
        }
    }

    // --- NotificationProperties ---
    @Validated
    public record NotificationProperties(
            String webhookUrl
    ) {}

    // --- AuditProperties ---
    @Validated
    public record AuditProperties(
            String backend,
            @Valid
            FileAuditProperties file
    ) {
        public AuditProperties {
            if (!StringUtils.hasText(backend)) {
                backend = "slf4j";
            }
        }

        @Validated
        public record FileAuditProperties(
                String path
        ) {
            public static final String PATH_PROPERTY = "rotation.audit.file.path";
        }
    }

    @Validated
    public record AuthProperties(
            @Valid
            StaticTokenAuthProperties staticTokens
    ) {

        @Validated
        public record StaticTokenMapping(
                @NotBlank(message = "Static token value cannot be blank")
                String token,

                @NotBlank(message = "Static token must be bound to a principal name")
                String principal,

                @NotEmpty(message = "Token must be associated with at least one role")
                Set<EngineRole> roles
        ) {
            @Override
            public String toString() {
                return "StaticTokenMapping[token=******, principal=" + principal + ", roles=" + roles + ']';
            }
        }

        /**
         * Properties specific to static token authentication.
         */
        @Validated
        public record StaticTokenAuthProperties(
                boolean enabled,

                @Valid
                List<StaticTokenMapping> mappings
        ) {
            public StaticTokenAuthProperties {
                if (mappings == null) {
                    mappings = Collections.emptyList();
                }
            }

            @AssertTrue(message = "Static token mappings (rotation.auth.static-tokens.mappings) cannot be empty when static token auth is enabled.")
            public boolean isMappingsValid() {
                return !this.enabled() || (this.mappings() != null && !this.mappings().isEmpty());
            }
        }
    }

    @Validated
    public record PolicyProperties(
            boolean overwriteOnStartup
    ) {}

    /**
     * Endpoint of a dependent that consumes rotated credentials.
     */
    @Validated
    public record DependentEndpoint(
            @NotBlank(message = "Dependent endpoint url must be provided.")
            String url
    ) {}

    /**
     * Seed policy for a secret class, loaded into the policy registry at startup.
     */
    @Validated
    public record SecretClassDefinition(
            @NotBlank(message = "Secret class id (rotation.classes[].id) must be provided.")
            String id,
            @NotNull(message = "rotation.classes[].rotation-frequency must be provided.")
            Duration rotationFrequency,
            boolean requiresApproval,
            Integer approversRequired,
            Set<String> eligibleApprovers,
            Duration approvalTtl,
            Integer maxRetry,
            Duration backoffBase,
            Duration backupRetention,
            List<String> dependents,
            Boolean enabled
    ) {
        public SecretClass toSecretClass() {
            return SecretClass.builder()
                    .id(id)
                    .rotationFrequency(rotationFrequency)
                    .requiresApproval(requiresApproval)
                    .approversRequired(approversRequired != null ? approversRequired : (requiresApproval ? 1 : 0))
                    .eligibleApprovers(eligibleApprovers != null ? Set.copyOf(eligibleApprovers) : Set.of())
                    .approvalTtl(approvalTtl != null ? approvalTtl : SecretClass.DEFAULT_APPROVAL_TTL)
                    .maxRetry(maxRetry != null ? maxRetry : SecretClass.DEFAULT_MAX_RETRY)
                    .backoffBase(backoffBase != null ? backoffBase : SecretClass.DEFAULT_BACKOFF_BASE)
                    .backupRetention(backupRetention)
                    .dependents(dependents != null ? List.copyOf(dependents) : List.of())
                    .enabled(enabled == null || enabled)
                    .updatedAt(Instant.now())
                    .build();
        }
    }
}
