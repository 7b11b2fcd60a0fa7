package tech.yump.rotation.storage;

import net.javacrumbs.shedlock.support.StorageBasedLockProvider;

/**
 * ShedLock provider keeping its lock records in the engine's {@link StorageBackend}.
 */
public class StorageLockProvider extends StorageBasedLockProvider {

  public StorageLockProvider(StorageBackend storage) {
    super(new StorageLockAccessor(storage));
  }
}
