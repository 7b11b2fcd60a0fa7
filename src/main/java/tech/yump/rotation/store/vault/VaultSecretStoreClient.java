package tech.yump.rotation.store.vault;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.StoreErrorType;
import tech.yump.rotation.store.StoreHealth;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Secret store client for a Vault-like HTTP API mounted under {@code /v1/<mount>/classes/<classId>}.
 * The {@link RestClient} passed in is expected to carry the base URI, the {@code X-Vault-Token}
 * header and the configured timeouts.
 */
@Slf4j
public class VaultSecretStoreClient implements SecretStoreClient {

    public static final String VAULT_TOKEN_HEADER = "X-Vault-Token";

    private final RestClient restClient;
    private final String mount;

    public VaultSecretStoreClient(RestClient restClient, String mount) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.mount = Objects.requireNonNull(mount, "mount");
        log.info("Vault secret store backend initialized on mount '{}'.", mount);
    }

    @Override
    public Optional<SecretVersion> getMetadata(String classId) {
        return execute("getMetadata", classId, () -> {
            ResponseEntity<SecretVersion> response = restClient.get()
                    .uri("/v1/{mount}/classes/{classId}/active", mount, classId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .toEntity(SecretVersion.class);
            if (response.getStatusCode() == HttpStatus.NO_CONTENT) {
                return Optional.<SecretVersion>empty();
            }
            return Optional.ofNullable(response.getBody());
        });
    }

    @Override
    public List<SecretVersion> listVersions(String classId) {
        return execute("listVersions", classId, () -> {
            SecretVersion[] versions = restClient.get()
                    .uri("/v1/{mount}/classes/{classId}/versions", mount, classId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(SecretVersion[].class);
            return versions == null ? List.<SecretVersion>of() : Arrays.asList(versions);
        });
    }

    @Override
    public SecretVersion mintVersion(String classId) {
        return execute("mintVersion", classId, () -> {
            SecretVersion minted = restClient.post()
                    .uri("/v1/{mount}/classes/{classId}/versions", mount, classId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(SecretVersion.class);
            if (minted == null || minted.id() == null) {
                throw new SecretStoreException(StoreErrorType.UNREACHABLE,
                        "Store returned an empty response when minting a version for class '" + classId + "'");
            }
            return minted;
        });
    }

    @Override
    public void activate(String classId, String expectedActiveId, SecretVersion candidate) {
        Objects.requireNonNull(candidate, "candidate");
        execute("activate", classId, () -> restClient.post()
                .uri("/v1/{mount}/classes/{classId}/activate", mount, classId)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ActivateRequest(expectedActiveId, candidate.id()))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void revoke(String classId, String versionId) {
        execute("revoke", classId, () -> restClient.post()
                .uri("/v1/{mount}/classes/{classId}/versions/{versionId}/revoke", mount, classId, versionId)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void retire(String classId, String versionId) {
        execute("retire", classId, () -> restClient.post()
                .uri("/v1/{mount}/classes/{classId}/versions/{versionId}/retire", mount, classId, versionId)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public StoreHealth health() {
        long start = System.nanoTime();
        try {
            HealthResponse body = restClient.get()
                    .uri("/v1/sys/health")
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(HealthResponse.class);
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            long free = body != null && body.freeCapacityBytes() != null ? body.freeCapacityBytes() : -1;
            return new StoreHealth(true, latency, free, "vault");
        } catch (RestClientException e) {
            log.warn("Vault health probe failed: {}", e.getMessage());
            return StoreHealth.unreachable(Duration.ofNanos(System.nanoTime() - start), e.getMessage());
        }
    }

    private <T> T execute(String operation, String classId, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientResponseException e) {
            StoreErrorType type = mapStatus(e.getStatusCode());
            log.warn("Vault {} for class '{}' failed with HTTP {} ({})", operation, classId, e.getStatusCode().value(), type);
            throw new SecretStoreException(type, String.format("Vault %s for class '%s' failed: HTTP %d",
                    operation, classId, e.getStatusCode().value()), e);
        } catch (ResourceAccessException e) {
            log.warn("Vault {} for class '{}' failed with I/O error: {}", operation, classId, e.getMessage());
            throw new SecretStoreException(StoreErrorType.UNREACHABLE,
                    "Vault " + operation + " for class '" + classId + "' failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.warn("Vault {} for class '{}' failed: {}", operation, classId, e.getMessage());
            throw new SecretStoreException(StoreErrorType.UNREACHABLE,
                    "Vault " + operation + " for class '" + classId + "' failed: " + e.getMessage(), e);
        }
    }

    static StoreErrorType mapStatus(HttpStatusCode status) {
        return switch (status.value()) {
            case 401, 403 -> StoreErrorType.AUTH_FAILED;
            case 404 -> StoreErrorType.NOT_FOUND;
            case 409, 412 -> StoreErrorType.CONFLICT;
            default -> StoreErrorType.UNREACHABLE;
        };
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HealthResponse(@JsonProperty("free_capacity_bytes") Long freeCapacityBytes) {
    }

    record ActivateRequest(
            @JsonProperty("expected_active_id") String expectedActiveId,
            @JsonProperty("candidate_id") String candidateId
    ) {}
}
