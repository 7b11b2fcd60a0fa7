package tech.yump.rotation.support;

import tech.yump.rotation.config.RotationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Engine properties for unit tests, rooted at a temporary directory.
 */
public final class TestProperties {

    public static final String BACKUP_KEY_B64 = "MDEyMzQ1Njc4OTAxMjM0NTY3ODkwMTIzNDU2Nzg5MDE=";

    private TestProperties() {
    }

    public static RotationProperties forDirectory(Path dir) {
        return forDirectory(dir, Duration.ZERO, 1);
    }

    public static RotationProperties forDirectory(Path dir, Duration staggerWindow, int keepMinimumBackups) {
        return new RotationProperties(
                new RotationProperties.StorageProperties(
                        new RotationProperties.StorageProperties.FileSystemProperties(dir.toAbsolutePath().toString())),
                new RotationProperties.BackupProperties(BACKUP_KEY_B64, Duration.ofDays(30), keepMinimumBackups),
                null,
                new RotationProperties.SchedulerProperties(false, null, null, staggerWindow, null),
                new RotationProperties.EngineProperties(2, Duration.ofMinutes(15), Duration.ofHours(24), Duration.ofDays(30), null),
                null,
                null,
                null,
                null,
                null,
                Map.of(),
                List.of());
    }
}
