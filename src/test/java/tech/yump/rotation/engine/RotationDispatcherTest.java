package tech.yump.rotation.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.StoreErrorType;
import tech.yump.rotation.support.EngineFixture;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RotationDispatcherTest {

    @TempDir
    Path tempDir;

    private EngineFixture engine;

    @BeforeEach
    void setUp() {
        engine = new EngineFixture(tempDir);
    }

    @Test
    @DisplayName("Sweep runs pending jobs whose scheduled time has come")
    void sweepRunsDueJobs() {
        SecretClass cls = engine.internalTokenClass();
        RotationJob job = engine.orchestrator.enqueue(cls, RotationTrigger.SCHEDULED, "scheduler",
                EngineFixture.START.plus(Duration.ofMinutes(2))).job();

        assertThat(engine.dispatcher.sweep()).isZero();

        engine.clock.advance(Duration.ofMinutes(2));
        assertThat(engine.dispatcher.sweep()).isEqualTo(1);
        assertThat(engine.repository.require(job.id()).state()).isEqualTo(JobState.COMPLETED);
    }

    @Test
    @DisplayName("Jobs waiting on approvers hold no worker until the request resolves or expires")
    void approvalWaitIsNotDispatched() {
        SecretClass cls = engine.databaseClass();
        RotationJob job = engine.orchestrator.enqueue(cls, RotationTrigger.MANUAL, "alice", engine.clock.instant()).job();
        RotationJob waiting = engine.orchestrator.advance(job.id());

        assertThat(engine.dispatcher.isDispatchable(waiting, engine.clock.instant())).isFalse();
        assertThat(engine.dispatcher.sweep()).isZero();

        engine.clock.advance(Duration.ofHours(24));
        assertThat(engine.dispatcher.isDispatchable(waiting, engine.clock.instant())).isTrue();
        engine.dispatcher.sweep();
        assertThat(engine.repository.require(job.id()).state()).isEqualTo(JobState.FAILED);
    }

    @Test
    @DisplayName("Jobs backing off are dispatched once the backoff ends")
    void backoffIsHonoured() {
        SecretClass cls = engine.internalTokenClass();
        engine.store.failNextMint(StoreErrorType.UNREACHABLE, 1);
        RotationJob job = engine.orchestrator.enqueue(cls, RotationTrigger.MANUAL, "alice", engine.clock.instant()).job();
        engine.dispatcher.submit(job.id());

        assertThat(engine.dispatcher.sweep()).isZero();

        engine.clock.advance(Duration.ofSeconds(10));
        assertThat(engine.dispatcher.sweep()).isEqualTo(1);
        assertThat(engine.repository.require(job.id()).state()).isEqualTo(JobState.COMPLETED);
    }

    @Test
    @DisplayName("A pending cancellation makes a backing-off job dispatchable")
    void cancelRequestIsDispatchable() {
        SecretClass cls = engine.internalTokenClass();
        engine.store.failNextMint(StoreErrorType.UNREACHABLE, 1);
        RotationJob job = engine.orchestrator.enqueue(cls, RotationTrigger.MANUAL, "alice", engine.clock.instant()).job();
        RotationJob backingOff = engine.orchestrator.advance(job.id());
        engine.repository.requestCancel(job.id(), "alice", engine.clock.instant());

        assertThat(engine.dispatcher.isDispatchable(backingOff, engine.clock.instant())).isTrue();
        engine.dispatcher.sweep();
        assertThat(engine.repository.require(job.id()).state()).isEqualTo(JobState.CANCELLED);
    }

    @Test
    @DisplayName("Jobs of a halted class are left alone by the sweep until the class is resumed")
    void haltedClassIsNotDispatched() {
        SecretClass cls = engine.internalTokenClass();
        RotationJob job = engine.orchestrator.enqueue(cls, RotationTrigger.MANUAL, "alice", engine.clock.instant()).job();
        engine.invariantGuard.halt(cls.id(), "duplicate active versions", null);

        assertThat(engine.dispatcher.isDispatchable(job, engine.clock.instant())).isFalse();
        assertThat(engine.dispatcher.sweep()).isZero();
        assertThat(engine.repository.require(job.id()).state()).isEqualTo(JobState.PENDING);

        engine.invariantGuard.clear(cls.id(), "alice");
        assertThat(engine.dispatcher.sweep()).isEqualTo(1);
        assertThat(engine.repository.require(job.id()).state()).isEqualTo(JobState.COMPLETED);
    }

    @Test
    @DisplayName("A job already queued in this process is not queued twice")
    void submitDeduplicates() {
        List<Runnable> queued = new ArrayList<>();
        RotationDispatcher dispatcher = new RotationDispatcher(engine.repository, engine.orchestrator,
                engine.approvalGate, engine.invariantGuard, queued::add, engine.clock);

        assertThat(dispatcher.submit("job-1")).isTrue();
        assertThat(dispatcher.submit("job-1")).isFalse();
        assertThat(queued).hasSize(1);
    }

    @Test
    @DisplayName("A saturated pool rejects the job, which is retried on a later submit")
    void saturatedPool() {
        TaskExecutor executor = mock(TaskExecutor.class);
        doThrow(new TaskRejectedException("pool full")).when(executor).execute(any());
        RotationDispatcher dispatcher = new RotationDispatcher(engine.repository, engine.orchestrator,
                engine.approvalGate, engine.invariantGuard, executor, engine.clock);

        assertThat(dispatcher.submit("job-1")).isFalse();
        assertThat(dispatcher.submit("job-1")).isFalse();
        verify(executor, times(2)).execute(any());
    }
}
