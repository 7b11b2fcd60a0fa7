package tech.yump.rotation.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tech.yump.rotation.config.RotationProperties;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

@Slf4j
@Component
public class FileSystemStorageBackend implements StorageBackend {

  private static final String DOCUMENT_EXTENSION = ".json";
  private static final String LOG_EXTENSION = ".ndjson";
  private static final String LOCK_EXTENSION = ".lock";
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path basePath;
  private final ObjectMapper objectMapper;
  private final ConcurrentMap<String, ReentrantLock> threadLocks = new ConcurrentHashMap<>();

  public FileSystemStorageBackend(final ObjectMapper objectMapper, final RotationProperties properties) {
    this.objectMapper = objectMapper;
    this.basePath = Paths.get(properties.storage().filesystem().path())
            .toAbsolutePath()
            .normalize();
    log.info("FileSystemStorageBackend initialized with base path: {}", this.basePath);
  }

  /**
   * Validates the base path after bean creation and property injection.
   */
  @PostConstruct
  void validateBasePath() {
    try {
      if (Files.exists(basePath)) {
        if (!Files.isDirectory(basePath)) {
          throw new StorageException("Configured base path exists but is not a directory: " + basePath);
        }
        if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
          throw new StorageException("Configured base path directory lacks read/write permissions: " + basePath);
        }
        log.debug("Base path validation successful: {}", basePath);
      } else {
        log.warn("Base path directory does not exist, attempting to create: {}", basePath);
        Files.createDirectories(basePath);
        log.info("Successfully created base path directory: {}", basePath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create base path: {}", basePath, e);
      throw new StorageException("Failed to initialize storage base path: " + basePath, e);
    }
  }

  @Override
  public void put(String key, Object document) throws StorageException {
    if (!StringUtils.hasText(key) || document == null) {
      throw new IllegalArgumentException("Key cannot be null or empty, and document cannot be null for put operation.");
    }
    Path filePath = resolvePath(key + DOCUMENT_EXTENSION);
    log.debug("Putting document for key '{}' at path: {}", key, filePath);

    Path tempFile = null;
    try {
      Files.createDirectories(filePath.getParent());
      tempFile = writeTempFile(filePath.getParent(), objectMapper.writeValueAsBytes(document));
      Files.move(tempFile, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Successfully stored document for key '{}'", key);
    } catch (IOException e) {
      log.error("Failed to put document for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to write document for key: " + key, e);
    } finally {
      deleteQuietly(tempFile);
    }
  }

  @Override
  public boolean putIfAbsent(String key, Object document) throws StorageException {
    if (!StringUtils.hasText(key) || document == null) {
      throw new IllegalArgumentException("Key cannot be null or empty, and document cannot be null for putIfAbsent operation.");
    }
    Path filePath = resolvePath(key + DOCUMENT_EXTENSION);

    Path tempFile = null;
    try {
      Files.createDirectories(filePath.getParent());
      tempFile = writeTempFile(filePath.getParent(), objectMapper.writeValueAsBytes(document));
      // link(2) fails atomically when the target exists
      Files.createLink(filePath, tempFile);
      log.debug("Created document for key '{}'", key);
      return true;
    } catch (FileAlreadyExistsException e) {
      log.debug("Document for key '{}' already exists, putIfAbsent skipped", key);
      return false;
    } catch (UnsupportedOperationException e) {
      log.debug("Hard links unsupported at {}, falling back to locked create for key '{}'", basePath, key);
      return withLock(key, () -> {
        if (Files.exists(filePath)) {
          return false;
        }
        put(key, document);
        return true;
      });
    } catch (IOException e) {
      log.error("Failed to create document for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to create document for key: " + key, e);
    } finally {
      deleteQuietly(tempFile);
    }
  }

  @Override
  public <T> Optional<T> get(String key, Class<T> type) throws StorageException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for get operation.");
    }
    Path filePath = resolvePath(key + DOCUMENT_EXTENSION);
    log.trace("Getting document for key '{}' from path: {}", key, filePath);

    if (!Files.isRegularFile(filePath)) {
      return Optional.empty();
    }

    try (InputStream in = Files.newInputStream(filePath, StandardOpenOption.READ)) {
      return Optional.of(objectMapper.readValue(in, type));
    } catch (NoSuchFileException e) {
      // Removed between the existence check and the read (archived concurrently)
      log.debug("Document for key '{}' disappeared during read: {}", key, filePath);
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to get document for key '{}' from path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to read or parse document for key: " + key, e);
    }
  }

  @Override
  public void delete(String key) throws StorageException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for delete operation.");
    }
    Path filePath = resolvePath(key + DOCUMENT_EXTENSION);

    try {
      if (Files.deleteIfExists(filePath)) {
        log.debug("Deleted document for key '{}'", key);
      }
    } catch (AccessDeniedException e) {
      log.error("Permission denied while trying to delete file for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Permission denied deleting document for key: " + key, e);
    } catch (IOException e) {
      log.error("Failed to delete document for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to delete document for key: " + key, e);
    }
  }

  @Override
  public void move(String fromKey, String toKey) throws StorageException {
    Path source = resolvePath(fromKey + DOCUMENT_EXTENSION);
    Path target = resolvePath(toKey + DOCUMENT_EXTENSION);
    try {
      if (!Files.isRegularFile(source)) {
        log.debug("Nothing to move for key '{}'", fromKey);
        return;
      }
      Files.createDirectories(target.getParent());
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      log.debug("Moved document '{}' to '{}'", fromKey, toKey);
    } catch (IOException e) {
      log.error("Failed to move document '{}' to '{}': {}", fromKey, toKey, e.getMessage(), e);
      throw new StorageException("Failed to move document from " + fromKey + " to " + toKey, e);
    }
  }

  @Override
  public boolean isDirectory(String relativePath) throws StorageException {
    if (!StringUtils.hasText(relativePath)) {
      throw new IllegalArgumentException("Relative path cannot be null or empty for isDirectory check.");
    }
    return Files.isDirectory(resolvePath(relativePath), LinkOption.NOFOLLOW_LINKS);
  }

  @Override
  public List<String> listDirectory(String relativeDirPath) throws StorageException {
    if (!StringUtils.hasText(relativeDirPath)) {
      throw new IllegalArgumentException("Relative directory path cannot be null or empty for list operation.");
    }
    Path absoluteDirPath = resolvePath(relativeDirPath);

    if (!Files.isDirectory(absoluteDirPath, LinkOption.NOFOLLOW_LINKS)) {
      return List.of();
    }

    List<String> entries = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(absoluteDirPath)) {
      for (Path entry : stream) {
        String name = entry.getFileName().toString();
        if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
          entries.add(name);
        } else if (name.endsWith(DOCUMENT_EXTENSION) && !name.startsWith(".")) {
          entries.add(name.substring(0, name.length() - DOCUMENT_EXTENSION.length()));
        }
      }
      Collections.sort(entries);
      return entries;
    } catch (IOException e) {
      log.error("Failed to list directory contents for path {}: {}", absoluteDirPath, e.getMessage(), e);
      throw new StorageException("Failed to list directory: " + relativeDirPath, e);
    }
  }

  @Override
  public void appendLine(String key, String line) throws StorageException {
    if (line == null || line.indexOf('\n') >= 0) {
      throw new IllegalArgumentException("Appended line must be non-null and must not contain a newline.");
    }
    Path logPath = resolvePath(key + LOG_EXTENSION);
    try {
      Files.createDirectories(logPath.getParent());
      try (FileChannel channel = FileChannel.open(logPath,
              StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
        long size = channel.size();
        // Terminate a torn tail left by a crashed writer so this line starts on its own
        String prefix = size > 0 && !endsWithNewline(channel, size) ? "\n" : "";
        ByteBuffer buffer = ByteBuffer.wrap((prefix + line + "\n").getBytes(StandardCharsets.UTF_8));
        long position = size;
        while (buffer.hasRemaining()) {
          position += channel.write(buffer, position);
        }
        channel.force(true);
      }
    } catch (IOException e) {
      log.error("Failed to append to log '{}' at path {}: {}", key, logPath, e.getMessage(), e);
      throw new StorageException("Failed to append to log: " + key, e);
    }
  }

  private static boolean endsWithNewline(FileChannel channel, long size) throws IOException {
    ByteBuffer last = ByteBuffer.allocate(1);
    channel.read(last, size - 1);
    return last.get(0) == '\n';
  }

  @Override
  public List<String> readLines(String key) throws StorageException {
    Path logPath = resolvePath(key + LOG_EXTENSION);
    if (!Files.isRegularFile(logPath)) {
      return List.of();
    }
    try {
      // new String(...) replaces malformed sequences instead of failing on a torn multi-byte character
      String content = new String(Files.readAllBytes(logPath), StandardCharsets.UTF_8);
      return content.lines()
              .filter(StringUtils::hasText)
              .toList();
    } catch (IOException e) {
      log.error("Failed to read log '{}' at path {}: {}", key, logPath, e.getMessage(), e);
      throw new StorageException("Failed to read log: " + key, e);
    }
  }

  @Override
  public <T> T withLock(String key, Supplier<T> action) throws StorageException {
    Path lockPath = resolvePath(key + LOCK_EXTENSION);
    ReentrantLock threadLock = threadLocks.computeIfAbsent(key, k -> new ReentrantLock());
    threadLock.lock();
    try {
      if (threadLock.getHoldCount() > 1) {
        // Re-entered on this thread: the file lock is already held
        return action.get();
      }
      Files.createDirectories(lockPath.getParent());
      try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
           FileLock ignored = channel.lock()) {
        return action.get();
      }
    } catch (IOException e) {
      log.error("Failed to acquire storage lock '{}' at path {}: {}", key, lockPath, e.getMessage(), e);
      throw new StorageException("Failed to acquire storage lock: " + key, e);
    } finally {
      threadLock.unlock();
    }
  }

  @Override
  public long freeCapacityBytes() throws StorageException {
    try {
      return Files.getFileStore(basePath).getUsableSpace();
    } catch (IOException e) {
      throw new StorageException("Failed to determine free capacity of " + basePath, e);
    }
  }

  private Path writeTempFile(Path directory, byte[] content) throws IOException {
    Path tempFile = Files.createTempFile(directory, ".", TEMP_SUFFIX);
    try (FileChannel channel = FileChannel.open(tempFile, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
      ByteBuffer buffer = ByteBuffer.wrap(content);
      while (buffer.hasRemaining()) {
        channel.write(buffer);
      }
      channel.force(true);
    }
    return tempFile;
  }

  private void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not delete temporary file {}: {}", path, e.getMessage());
    }
  }

  /**
   * Resolves a relative path against the base storage path and performs security checks.
   *
   * @throws StorageException if the path is invalid or results in a path outside the base directory.
   */
  private Path resolvePath(String relativePath) throws StorageException {
    String sanitizedPath = relativePath.replace('\\', '/').trim();
    if (sanitizedPath.startsWith("/") || sanitizedPath.endsWith("/") || sanitizedPath.contains("..") || sanitizedPath.isEmpty()) {
      log.error("Invalid storage path provided: '{}'", relativePath);
      throw new StorageException("Invalid storage path format: " + relativePath);
    }

    Path absolutePath = this.basePath.resolve(sanitizedPath).normalize();

    if (!absolutePath.startsWith(this.basePath)) {
      log.error("Path traversal attempt detected for path '{}', resolved path '{}' is outside base path '{}'", relativePath, absolutePath, this.basePath);
      throw new StorageException("Invalid path resulting in path traversal attempt: " + relativePath);
    }

    return absolutePath;
  }
}
