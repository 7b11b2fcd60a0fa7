package tech.yump.rotation.engine;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutex per secret class, held while a job is created and while a worker advances a job.
 * Serializes rotations of the same class within this process; the store's compare-and-swap
 * covers other processes.
 */
@Component
public class ClassLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withClassLock(String classId, Supplier<T> action) {
        ReentrantLock lock = lockFor(classId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the action only if the lock is free right now.
     *
     * @return empty if another thread holds the class lock.
     */
    public <T> Optional<T> tryWithClassLock(String classId, Supplier<T> action) {
        ReentrantLock lock = lockFor(classId);
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.get());
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String classId) {
        return locks.computeIfAbsent(classId, k -> new ReentrantLock());
    }
}
