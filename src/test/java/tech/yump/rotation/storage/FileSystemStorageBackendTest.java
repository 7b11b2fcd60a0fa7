package tech.yump.rotation.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.yump.rotation.support.EngineFixture;
import tech.yump.rotation.support.TestProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemStorageBackendTest {

  @TempDir
  Path tempStorageDir;

  private FileSystemStorageBackend storageBackend;

  record Doc(String name, int value, Instant at) {
  }

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = EngineFixture.objectMapper();
    storageBackend = new FileSystemStorageBackend(objectMapper, TestProperties.forDirectory(tempStorageDir));
  }

  @Test
  @DisplayName("put then get returns the stored document, nested keys create directories")
  void putAndGet() {
    Doc doc = new Doc("alpha", 1, Instant.parse("2026-01-15T10:00:00Z"));

    storageBackend.put("jobs/active/job-1", doc);

    assertEquals(Optional.of(doc), storageBackend.get("jobs/active/job-1", Doc.class));
    assertTrue(Files.isRegularFile(tempStorageDir.resolve("jobs/active/job-1.json")));
    assertTrue(storageBackend.isDirectory("jobs/active"));
  }

  @Test
  @DisplayName("get of a missing key is empty")
  void getMissing() {
    assertEquals(Optional.empty(), storageBackend.get("nothing/here", Doc.class));
  }

  @Test
  @DisplayName("put replaces, putIfAbsent does not")
  void putIfAbsentKeepsExisting() {
    assertTrue(storageBackend.putIfAbsent("policies/db", new Doc("first", 1, null)));
    assertFalse(storageBackend.putIfAbsent("policies/db", new Doc("second", 2, null)));
    assertEquals("first", storageBackend.get("policies/db", Doc.class).orElseThrow().name());

    storageBackend.put("policies/db", new Doc("third", 3, null));
    assertEquals("third", storageBackend.get("policies/db", Doc.class).orElseThrow().name());
  }

  @Test
  @DisplayName("delete and move are idempotent")
  void deleteAndMove() {
    storageBackend.put("jobs/active/a", new Doc("a", 1, null));

    storageBackend.move("jobs/active/a", "jobs/archive/a");
    storageBackend.move("jobs/active/a", "jobs/archive/a");
    assertEquals(Optional.empty(), storageBackend.get("jobs/active/a", Doc.class));
    assertTrue(storageBackend.get("jobs/archive/a", Doc.class).isPresent());

    storageBackend.delete("jobs/archive/a");
    storageBackend.delete("jobs/archive/a");
    assertEquals(Optional.empty(), storageBackend.get("jobs/archive/a", Doc.class));
  }

  @Test
  @DisplayName("listDirectory returns sorted document keys and subdirectories, skipping locks and temp files")
  void listDirectory() throws Exception {
    storageBackend.put("backups/db/b", new Doc("b", 1, null));
    storageBackend.put("backups/db/a", new Doc("a", 1, null));
    storageBackend.put("backups/token/c", new Doc("c", 1, null));
    storageBackend.withLock("backups/db/a", () -> null);
    Files.writeString(tempStorageDir.resolve("backups/db/.half-written.tmp"), "{");

    assertEquals(List.of("a", "b"), storageBackend.listDirectory("backups/db"));
    assertEquals(List.of("db", "token"), storageBackend.listDirectory("backups"));
    assertEquals(List.of(), storageBackend.listDirectory("missing"));
  }

  @Test
  @DisplayName("appendLine and readLines keep line order")
  void appendAndRead() {
    storageBackend.appendLine("audit/ledger", "{\"sequence\":1}");
    storageBackend.appendLine("audit/ledger", "{\"sequence\":2}");

    assertEquals(List.of("{\"sequence\":1}", "{\"sequence\":2}"), storageBackend.readLines("audit/ledger"));
    assertEquals(List.of(), storageBackend.readLines("audit/other"));
    assertThrows(IllegalArgumentException.class, () -> storageBackend.appendLine("audit/ledger", "two\nlines"));
  }

  @Test
  @DisplayName("appendLine after an unterminated tail starts a new line")
  void appendAfterTornTail() throws Exception {
    storageBackend.appendLine("audit/ledger", "{\"sequence\":1}");
    Path ledger = tempStorageDir.resolve("audit/ledger.ndjson");
    byte[] torn = {'{', '"', 'm', '"', ':', '"', (byte) 0xC3};
    Files.write(ledger, torn, StandardOpenOption.APPEND);

    storageBackend.appendLine("audit/ledger", "{\"sequence\":3}");

    List<String> lines = storageBackend.readLines("audit/ledger");
    assertEquals(3, lines.size());
    assertEquals("{\"sequence\":1}", lines.get(0));
    assertTrue(lines.get(1).startsWith("{\"m\":\""));
    assertEquals("{\"sequence\":3}", lines.get(2));
  }

  @Test
  @DisplayName("Paths escaping the base directory are rejected")
  void rejectsTraversal() {
    Doc doc = new Doc("x", 1, null);
    assertThrows(StorageException.class, () -> storageBackend.put("../outside", doc));
    assertThrows(StorageException.class, () -> storageBackend.put("/absolute", doc));
    assertThrows(StorageException.class, () -> storageBackend.get("jobs/../../etc/passwd", Doc.class));
    assertThrows(StorageException.class, () -> storageBackend.listDirectory("jobs/"));
    assertThrows(IllegalArgumentException.class, () -> storageBackend.put("", doc));
  }

  @Test
  @DisplayName("Unparseable documents surface as StorageException")
  void corruptDocument() throws Exception {
    Files.createDirectories(tempStorageDir.resolve("jobs"));
    Files.writeString(tempStorageDir.resolve("jobs/broken.json"), "{not json");

    assertThrows(StorageException.class, () -> storageBackend.get("jobs/broken", Doc.class));
  }

  @Test
  @DisplayName("withLock serialises read-modify-write cycles across threads and is re-entrant")
  void withLockSerialises() throws Exception {
    storageBackend.put("counters/c", new Doc("c", 0, null));
    ExecutorService pool = Executors.newFixedThreadPool(4);
    AtomicInteger reentered = new AtomicInteger();
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        futures.add(pool.submit(() -> storageBackend.withLock("counters/c", () -> {
          Doc current = storageBackend.get("counters/c", Doc.class).orElseThrow();
          storageBackend.put("counters/c", new Doc("c", current.value() + 1, null));
          return storageBackend.withLock("counters/c", reentered::incrementAndGet);
        })));
      }
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(20, storageBackend.get("counters/c", Doc.class).orElseThrow().value());
    assertEquals(20, reentered.get());
  }

  @Test
  @DisplayName("Free capacity of the storage volume is reported")
  void freeCapacity() {
    assertTrue(storageBackend.freeCapacityBytes() > 0);
  }
}
