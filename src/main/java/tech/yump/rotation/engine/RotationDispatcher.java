package tech.yump.rotation.engine;

import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.yump.rotation.approval.ApprovalGate;
import tech.yump.rotation.approval.ApprovalResolvedEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands runnable jobs to the rotation worker pool. The periodic sweep is also how jobs are resumed
 * after a restart, how retry backoffs end, and how expired approvals are noticed.
 */
@Slf4j
@Component
public class RotationDispatcher {

    private final RotationJobRepository repository;
    private final RotationOrchestrator orchestrator;
    private final ApprovalGate approvalGate;
    private final InvariantGuard invariantGuard;
    private final TaskExecutor executor;
    private final Clock clock;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public RotationDispatcher(RotationJobRepository repository,
                              RotationOrchestrator orchestrator,
                              ApprovalGate approvalGate,
                              InvariantGuard invariantGuard,
                              @Qualifier("rotationExecutor") TaskExecutor executor,
                              Clock clock) {
        this.repository = repository;
        this.orchestrator = orchestrator;
        this.approvalGate = approvalGate;
        this.invariantGuard = invariantGuard;
        this.executor = executor;
        this.clock = clock;
    }

    @Scheduled(initialDelayString = "${rotation.scheduler.dispatch-interval:PT5S}",
            fixedDelayString = "${rotation.scheduler.dispatch-interval:PT5S}")
    @SchedulerLock(name = "rotationDispatcherSweep", lockAtMostFor = "${rotation.scheduler.lock-at-most-for:PT5M}")
    public void scheduledSweep() {
        int submitted = sweep();
        if (submitted > 0) {
            log.debug("Dispatcher sweep submitted {} job(s)", submitted);
        }
    }

    /**
     * Submits every non-terminal job that can make progress now.
     *
     * @return number of jobs submitted.
     */
    public int sweep() {
        Instant now = clock.instant();
        int submitted = 0;
        for (RotationJob job : repository.listActive()) {
            if (!job.state().isTerminal() && isDispatchable(job, now) && submit(job.id())) {
                submitted++;
            }
        }
        return submitted;
    }

    /**
     * Queues the job on the worker pool unless it is already queued or running in this process.
     *
     * @return true if the job was queued by this call.
     */
    public boolean submit(String jobId) {
        if (!inFlight.add(jobId)) {
            return false;
        }
        try {
            executor.execute(() -> run(jobId));
            return true;
        } catch (TaskRejectedException e) {
            inFlight.remove(jobId);
            log.warn("Rotation worker pool saturated; job {} will be retried on the next sweep", jobId);
            return false;
        }
    }

    @EventListener
    public void onApprovalResolved(ApprovalResolvedEvent event) {
        log.debug("Approval for job {} resolved as {}, dispatching", event.jobId(), event.status());
        submit(event.jobId());
    }

    boolean isDispatchable(RotationJob job, Instant now) {
        // A halted class makes no progress until an operator resumes it
        if (invariantGuard.isHalted(job.secretClassId())) {
            return false;
        }
        if (repository.findCancelRequest(job.id()).isPresent()) {
            return true;
        }
        if (!orchestrator.isRunnable(job, now)) {
            return false;
        }
        if (job.state() == JobState.APPROVAL_WAIT) {
            // Waiting on approvers holds no worker
            return approvalGate.find(job.id())
                    .map(request -> request.status().isResolved() || request.isExpiredAt(now))
                    .orElse(true);
        }
        return true;
    }

    private void run(String jobId) {
        try {
            RotationJob job = orchestrator.advance(jobId);
            log.debug("Job {} paused in state {}", jobId, job.state());
        } catch (RuntimeException e) {
            log.error("Unexpected error while advancing job {}: {}", jobId, e.getMessage(), e);
        } finally {
            inFlight.remove(jobId);
        }
    }
}
