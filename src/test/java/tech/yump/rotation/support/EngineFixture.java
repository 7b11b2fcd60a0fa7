package tech.yump.rotation.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.validation.Validation;
import org.springframework.core.task.SyncTaskExecutor;
import tech.yump.rotation.approval.ApprovalGate;
import tech.yump.rotation.approval.ApprovalResolvedEvent;
import tech.yump.rotation.audit.AuditRecorder;
import tech.yump.rotation.audit.LogAuditBackend;
import tech.yump.rotation.backup.BackupManager;
import tech.yump.rotation.config.RotationProperties;
import tech.yump.rotation.crypto.EncryptionService;
import tech.yump.rotation.engine.ClassLockRegistry;
import tech.yump.rotation.engine.InvariantGuard;
import tech.yump.rotation.engine.MaintenanceTasks;
import tech.yump.rotation.engine.RetryPolicy;
import tech.yump.rotation.engine.RotationDispatcher;
import tech.yump.rotation.engine.RotationJobRepository;
import tech.yump.rotation.engine.RotationOrchestrator;
import tech.yump.rotation.engine.RotationScheduler;
import tech.yump.rotation.engine.StaggerPlanner;
import tech.yump.rotation.health.HealthValidator;
import tech.yump.rotation.notify.RotationNotification;
import tech.yump.rotation.policy.PolicyRegistry;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.service.RotationServiceImpl;
import tech.yump.rotation.storage.FileSystemStorageBackend;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The engine wired by hand on a temporary directory, with a fake store, scripted dependents, a
 * mutable clock and a synchronous worker pool. Approval events are delivered to the dispatcher
 * the way the application context would.
 */
public class EngineFixture {

    public static final Instant START = Instant.parse("2026-01-15T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final ObjectMapper objectMapper = objectMapper();
    public final RotationProperties properties;
    public final FileSystemStorageBackend storage;
    public final EncryptionService encryptionService;
    public final FakeSecretStoreClient store = new FakeSecretStoreClient(clock);
    public final ScriptedDependentClient dependents = new ScriptedDependentClient();
    public final List<RotationNotification> notifications = new CopyOnWriteArrayList<>();
    public final List<Object> events = new CopyOnWriteArrayList<>();
    public final AuditRecorder auditRecorder;
    public final PolicyRegistry policyRegistry;
    public final ApprovalGate approvalGate;
    public final BackupManager backupManager;
    public final InvariantGuard invariantGuard;
    public final RotationJobRepository repository;
    public final ClassLockRegistry classLocks = new ClassLockRegistry();
    public final HealthValidator healthValidator;
    public final RotationOrchestrator orchestrator;
    public final RotationScheduler scheduler;
    public final RotationDispatcher dispatcher;
    public final MaintenanceTasks maintenance;
    public final RotationServiceImpl service;

    public EngineFixture(Path dir) {
        this(TestProperties.forDirectory(dir));
    }

    public EngineFixture(RotationProperties properties) {
        this.properties = properties;
        this.storage = new FileSystemStorageBackend(objectMapper, properties);
        this.encryptionService = new EncryptionService(properties);
        this.auditRecorder = new AuditRecorder(storage, new LogAuditBackend(objectMapper), objectMapper, clock);
        this.policyRegistry = new PolicyRegistry(storage, Validation.buildDefaultValidatorFactory().getValidator(),
                auditRecorder, properties, clock);
        this.repository = new RotationJobRepository(storage);
        this.approvalGate = new ApprovalGate(storage, auditRecorder, this::publish, clock);
        this.backupManager = new BackupManager(storage, encryptionService, store, objectMapper, properties, clock);
        this.invariantGuard = new InvariantGuard(store, storage, auditRecorder, notifications::add, clock);
        this.healthValidator = new HealthValidator(store, dependents, properties);
        this.orchestrator = new RotationOrchestrator(repository, policyRegistry, store, healthValidator, approvalGate,
                backupManager, dependents, auditRecorder, notifications::add, invariantGuard, classLocks,
                new RetryPolicy(properties), clock);
        this.scheduler = new RotationScheduler(policyRegistry, store, repository, orchestrator, invariantGuard,
                new StaggerPlanner(new Random(42)), properties, clock);
        this.dispatcher = new RotationDispatcher(repository, orchestrator, approvalGate, invariantGuard, new SyncTaskExecutor(), clock);
        this.maintenance = new MaintenanceTasks(policyRegistry, store, repository, classLocks, backupManager,
                auditRecorder, properties, clock);
        this.service = new RotationServiceImpl(policyRegistry, repository, orchestrator, scheduler, dispatcher,
                invariantGuard, healthValidator, approvalGate, store, auditRecorder, clock);
    }

    /**
     * A class rotating every 90 days that needs two approvals, like a production database credential.
     */
    public SecretClass databaseClass() {
        return policyRegistry.upsert(SecretClass.builder()
                .id("database")
                .rotationFrequency(Duration.ofDays(90))
                .requiresApproval(true)
                .approversRequired(2)
                .approvalTtl(Duration.ofHours(24))
                .maxRetry(3)
                .backoffBase(Duration.ofSeconds(30))
                .enabled(true)
                .build(), "test-setup");
    }

    /**
     * A class rotating daily without approval.
     */
    public SecretClass internalTokenClass() {
        return policyRegistry.upsert(SecretClass.builder()
                .id("internal-token")
                .rotationFrequency(Duration.ofHours(24))
                .maxRetry(2)
                .backoffBase(Duration.ofSeconds(10))
                .enabled(true)
                .build(), "test-setup");
    }

    public SecretClass upsert(SecretClass secretClass) {
        return policyRegistry.upsert(secretClass, "test-setup");
    }

    private void publish(Object event) {
        events.add(event);
        if (event instanceof ApprovalResolvedEvent resolved && dispatcher != null) {
            dispatcher.onApprovalResolved(resolved);
        }
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
