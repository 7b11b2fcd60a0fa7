package tech.yump.rotation.storage;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Contract for the durable document store holding engine state (jobs, approvals, policies,
 * backups, locks and the audit ledger). Documents are addressed by logical keys such as
 * {@code jobs/active/1b2c...} and serialized as JSON.
 */
public interface StorageBackend {

  /**
   * Persists a document under the given key, replacing any existing document atomically.
   *
   * @param key      logical key, no leading/trailing slash and no "..".
   * @param document the value to serialize. Must not be null.
   * @throws StorageException if the document cannot be written durably.
   */
  void put(String key, Object document) throws StorageException;

  /**
   * Persists a document only if no document exists under the key.
   *
   * @return true if the document was created, false if the key was already taken.
   * @throws StorageException on I/O failure.
   */
  boolean putIfAbsent(String key, Object document) throws StorageException;

  /**
   * Reads and deserializes a document.
   *
   * @return the document, or Optional.empty() if none exists under the key.
   * @throws StorageException if the document exists but cannot be read or parsed.
   */
  <T> Optional<T> get(String key, Class<T> type) throws StorageException;

  /**
   * Deletes the document under the key. Missing keys are ignored.
   */
  void delete(String key) throws StorageException;

  /**
   * Moves a document to a new key (used for archiving). Missing source keys are ignored.
   */
  void move(String fromKey, String toKey) throws StorageException;

  /**
   * Lists the document keys (file names without extension) and sub-directories directly below
   * a directory. Returns an empty list if the directory does not exist.
   */
  List<String> listDirectory(String relativeDirPath) throws StorageException;

  boolean isDirectory(String relativePath) throws StorageException;

  /**
   * Appends one line to an append-only log and forces it to disk before returning. An unterminated
   * tail left by an interrupted append is closed first, so the new line is never merged into it.
   */
  void appendLine(String key, String line) throws StorageException;

  /**
   * Reads all lines of an append-only log, in write order. Empty if the log does not exist.
   * Malformed UTF-8 is replaced rather than rejected.
   */
  List<String> readLines(String key) throws StorageException;

  /**
   * Runs the action while holding an exclusive lock on the key, excluding both other threads of
   * this process and other processes sharing the storage.
   */
  <T> T withLock(String key, Supplier<T> action) throws StorageException;

  /**
   * Usable bytes left on the volume holding the storage.
   */
  long freeCapacityBytes() throws StorageException;
}
