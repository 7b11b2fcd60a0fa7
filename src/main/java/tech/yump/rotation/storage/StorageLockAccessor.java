package tech.yump.rotation.storage;

import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.ClockProvider;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.support.AbstractStorageAccessor;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ShedLock storage accessor keeping lock records as documents under {@code locks/<name>}.
 * Each operation is a read-modify-write under the storage lock of the same key, so replicas
 * sharing the storage directory agree on the holder.
 */
@Slf4j
public class StorageLockAccessor extends AbstractStorageAccessor {

  static final String LOCK_DIR = "locks";

  private final StorageBackend storage;

  public StorageLockAccessor(StorageBackend storage) {
    this.storage = Objects.requireNonNull(storage, "storage");
  }

  @Override
  public boolean insertRecord(LockConfiguration lockConfiguration) {
    String key = key(lockConfiguration.getName());
    return storage.withLock(key, () -> {
      if (storage.get(key, LockRecord.class).isPresent()) {
        return false;
      }
      storage.put(key, newRecord(lockConfiguration));
      log.debug("Lock '{}' created and acquired until {}", lockConfiguration.getName(), lockConfiguration.getLockAtMostUntil());
      return true;
    });
  }

  @Override
  public boolean updateRecord(LockConfiguration lockConfiguration) {
    String key = key(lockConfiguration.getName());
    return storage.withLock(key, () -> {
      Optional<LockRecord> existing = storage.get(key, LockRecord.class);
      if (existing.isPresent() && existing.get().lockUntil().isAfter(ClockProvider.now())) {
        return false;
      }
      storage.put(key, newRecord(lockConfiguration));
      return true;
    });
  }

  @Override
  public void unlock(LockConfiguration lockConfiguration) {
    String key = key(lockConfiguration.getName());
    storage.withLock(key, () -> {
      storage.get(key, LockRecord.class).ifPresent(current ->
              storage.put(key, new LockRecord(current.name(), lockConfiguration.getUnlockTime(), current.lockedAt(), current.lockedBy())));
      return null;
    });
  }

  private LockRecord newRecord(LockConfiguration lockConfiguration) {
    return new LockRecord(lockConfiguration.getName(), lockConfiguration.getLockAtMostUntil(), ClockProvider.now(), getHostname());
  }

  private static String key(String lockName) {
    return LOCK_DIR + "/" + lockName;
  }

  /**
   * Persisted lock document.
   */
  public record LockRecord(String name, Instant lockUntil, Instant lockedAt, String lockedBy) {
  }
}
