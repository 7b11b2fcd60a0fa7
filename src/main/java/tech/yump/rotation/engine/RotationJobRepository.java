package tech.yump.rotation.engine;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.rotation.storage.StorageBackend;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Rotation jobs on the storage backend. Live jobs (non-terminal, and terminal ones within the
 * retention period) are kept under {@code jobs/active}; archived jobs under {@code jobs/archive}.
 * Cancellation requests for jobs held by a worker are separate documents under {@code jobs/cancel}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RotationJobRepository {

    static final String ACTIVE_DIR = "jobs/active";
    static final String ARCHIVE_DIR = "jobs/archive";
    static final String CANCEL_DIR = "jobs/cancel";
    private static final String JOB_ID_PATTERN = "[A-Za-z0-9-]{1,64}";

    private final StorageBackend storage;

    /**
     * @return false if a job with the same id already exists.
     */
    public boolean create(RotationJob job) {
        return storage.putIfAbsent(activeKey(job.id()), job);
    }

    public void save(RotationJob job) {
        storage.put(activeKey(job.id()), job);
    }

    public Optional<RotationJob> find(String jobId) {
        if (jobId == null || !jobId.matches(JOB_ID_PATTERN)) {
            return Optional.empty();
        }
        Optional<RotationJob> live = storage.get(activeKey(jobId), RotationJob.class);
        return live.isPresent() ? live : storage.get(ARCHIVE_DIR + "/" + jobId, RotationJob.class);
    }

    public RotationJob require(String jobId) {
        return find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<RotationJob> listActive() {
        return loadAll(ACTIVE_DIR).toList();
    }

    public Optional<RotationJob> findNonTerminal(String classId) {
        return loadAll(ACTIVE_DIR)
                .filter(j -> j.secretClassId().equals(classId))
                .filter(j -> !j.state().isTerminal())
                .findFirst();
    }

    /**
     * All jobs of a class, live and archived, most recently updated first.
     */
    public List<RotationJob> findByClass(String classId) {
        return Stream.concat(loadAll(ACTIVE_DIR), loadAll(ARCHIVE_DIR))
                .filter(j -> j.secretClassId().equals(classId))
                .sorted(Comparator.comparing(RotationJob::updatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public void archive(String jobId) {
        storage.move(activeKey(jobId), ARCHIVE_DIR + "/" + jobId);
        clearCancelRequest(jobId);
    }

    public void requestCancel(String jobId, String actor, Instant at) {
        storage.put(CANCEL_DIR + "/" + checkId(jobId), new CancelRequest(jobId, actor, at));
    }

    public Optional<CancelRequest> findCancelRequest(String jobId) {
        return storage.get(CANCEL_DIR + "/" + checkId(jobId), CancelRequest.class);
    }

    public void clearCancelRequest(String jobId) {
        storage.delete(CANCEL_DIR + "/" + checkId(jobId));
    }

    private Stream<RotationJob> loadAll(String dir) {
        return storage.listDirectory(dir).stream()
                .map(id -> storage.get(dir + "/" + id, RotationJob.class))
                .flatMap(Optional::stream);
    }

    private static String activeKey(String jobId) {
        return ACTIVE_DIR + "/" + checkId(jobId);
    }

    private static String checkId(String jobId) {
        if (jobId == null || !jobId.matches(JOB_ID_PATTERN)) {
            throw new JobNotFoundException(String.valueOf(jobId));
        }
        return jobId;
    }

    public record CancelRequest(String jobId, String actor, Instant requestedAt) {
    }
}
