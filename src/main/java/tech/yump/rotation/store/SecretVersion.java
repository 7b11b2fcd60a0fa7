package tech.yump.rotation.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;

/**
 * Metadata of one generation of a secret class's material. The material itself never leaves the store.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SecretVersion(
        String id,
        String secretClassId,
        long versionNumber,
        Instant createdAt,
        Instant activatedAt,
        Instant retiredAt,
        VersionStatus status,
        String checksum,
        String backupRef
) {

    @JsonIgnore
    public boolean isActive() {
        return status == VersionStatus.ACTIVE;
    }
}
