package tech.yump.rotation.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.yump.rotation.config.RotationProperties;
import tech.yump.rotation.policy.PolicyRegistry;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides which secret classes are due and enqueues a staggered job for each. The last rotation
 * time is read from the store on every tick; nothing about previous ticks is kept in memory.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RotationScheduler {

    static final String SCHEDULER_ACTOR = "scheduler";

    private final PolicyRegistry policyRegistry;
    private final SecretStoreClient storeClient;
    private final RotationJobRepository repository;
    private final RotationOrchestrator orchestrator;
    private final InvariantGuard invariantGuard;
    private final StaggerPlanner staggerPlanner;
    private final RotationProperties properties;
    private final Clock clock;

    @Scheduled(initialDelayString = "${rotation.scheduler.tick-interval:PT1M}",
            fixedDelayString = "${rotation.scheduler.tick-interval:PT1M}")
    @SchedulerLock(name = "rotationSchedulerTick", lockAtMostFor = "${rotation.scheduler.lock-at-most-for:PT5M}")
    public void scheduledTick() {
        log.debug("Rotation scheduler tick triggered");
        List<RotationJob> created = tick();
        if (!created.isEmpty()) {
            log.info("Scheduler enqueued {} rotation job(s)", created.size());
        }
    }

    /**
     * Enqueues one job per due class that has no job in flight. Idempotent.
     *
     * @return the jobs created by this tick.
     */
    public List<RotationJob> tick() {
        Instant now = clock.instant();
        List<SecretClass> due = new ArrayList<>();
        for (SecretClass secretClass : policyRegistry.list()) {
            if (!secretClass.enabled()) {
                continue;
            }
            if (invariantGuard.isHalted(secretClass.id())) {
                log.warn("Skipping halted class '{}'", secretClass.id());
                continue;
            }
            try {
                if (!invariantGuard.verify(secretClass.id(), null)) {
                    continue;
                }
                if (isDue(secretClass, now) && repository.findNonTerminal(secretClass.id()).isEmpty()) {
                    due.add(secretClass);
                }
            } catch (SecretStoreException e) {
                log.warn("Skipping class '{}' this tick, store call failed ({}): {}", secretClass.id(), e.getType(), e.getMessage());
            }
        }
        if (due.isEmpty()) {
            return List.of();
        }

        List<Duration> offsets = staggerPlanner.plan(due.size(), properties.scheduler().staggerWindow());
        List<RotationJob> created = new ArrayList<>();
        for (int i = 0; i < due.size(); i++) {
            RotationOrchestrator.EnqueueResult result = orchestrator.enqueue(
                    due.get(i), RotationTrigger.SCHEDULED, SCHEDULER_ACTOR, now.plus(offsets.get(i)));
            if (result.created()) {
                created.add(result.job());
            }
        }
        return created;
    }

    /**
     * Activation time of the current version, or empty if the class has never rotated.
     */
    public Optional<Instant> lastRotation(SecretClass secretClass) {
        return storeClient.getMetadata(secretClass.id()).map(SecretVersion::activatedAt);
    }

    /**
     * When the class next becomes due; a class that has never rotated is due immediately.
     */
    public Instant nextDue(SecretClass secretClass) {
        return lastRotation(secretClass)
                .map(last -> last.plus(secretClass.rotationFrequency()))
                .orElseGet(clock::instant);
    }

    public boolean isDue(SecretClass secretClass, Instant now) {
        return lastRotation(secretClass)
                .map(last -> !last.plus(secretClass.rotationFrequency()).isAfter(now))
                .orElse(true);
    }
}
