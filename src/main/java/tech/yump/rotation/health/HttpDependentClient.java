package tech.yump.rotation.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tech.yump.rotation.config.RotationProperties;
import tech.yump.rotation.policy.SecretClass;
import tech.yump.rotation.store.SecretVersion;

import java.util.Map;

/**
 * {@link DependentClient} speaking the dependent rotation API:
 * {@code POST {url}/rotation/distribute} and {@code POST {url}/rotation/verify}.
 */
@Slf4j
public class HttpDependentClient implements DependentClient {

    private final RestClient restClient;
    private final Map<String, RotationProperties.DependentEndpoint> endpoints;

    public HttpDependentClient(RestClient restClient, Map<String, RotationProperties.DependentEndpoint> endpoints) {
        this.restClient = restClient;
        this.endpoints = Map.copyOf(endpoints);
        log.debug("HttpDependentClient initialized with {} dependent endpoint(s).", this.endpoints.size());
    }

    @Override
    public void distribute(String dependent, SecretClass secretClass, SecretVersion version) {
        String url = baseUrl(dependent);
        try {
            restClient.post()
                    .uri(url + "/rotation/distribute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(VersionReference.of(secretClass, version))
                    .retrieve()
                    .toBodilessEntity();
            log.debug("Distributed version {} of class '{}' to dependent '{}'", version.id(), secretClass.id(), dependent);
        } catch (RestClientException e) {
            throw new DependentException("Distribution to dependent '" + dependent + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public VerifyOutcome verify(String dependent, SecretClass secretClass, SecretVersion version) {
        String url;
        try {
            url = baseUrl(dependent);
        } catch (DependentException e) {
            log.warn(e.getMessage());
            return VerifyOutcome.UNAVAILABLE;
        }
        try {
            VerifyResponse response = restClient.post()
                    .uri(url + "/rotation/verify")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(VersionReference.of(secretClass, version))
                    .retrieve()
                    .body(VerifyResponse.class);
            if (response != null && response.authenticated()) {
                return VerifyOutcome.AUTHENTICATED;
            }
            log.warn("Dependent '{}' refused version {} of class '{}': {}", dependent, version.id(), secretClass.id(),
                    response != null ? response.detail() : "empty response");
            return VerifyOutcome.REJECTED;
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                log.warn("Dependent '{}' rejected version {} of class '{}' with HTTP {}", dependent, version.id(), secretClass.id(), status);
                return VerifyOutcome.REJECTED;
            }
            log.warn("Dependent '{}' verification failed with HTTP {}", dependent, status);
            return VerifyOutcome.UNAVAILABLE;
        } catch (RestClientException e) {
            log.warn("Dependent '{}' unreachable during verification: {}", dependent, e.getMessage());
            return VerifyOutcome.UNAVAILABLE;
        }
    }

    private String baseUrl(String dependent) {
        RotationProperties.DependentEndpoint endpoint = endpoints.get(dependent);
        if (endpoint == null) {
            throw new DependentException("No endpoint configured for dependent '" + dependent + "' (rotation.dependents)");
        }
        String url = endpoint.url();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    record VersionReference(
            @JsonProperty("class_id") String classId,
            @JsonProperty("version_id") String versionId,
            @JsonProperty("version_number") long versionNumber,
            @JsonProperty("checksum") String checksum
    ) {
        static VersionReference of(SecretClass secretClass, SecretVersion version) {
            return new VersionReference(secretClass.id(), version.id(), version.versionNumber(), version.checksum());
        }
    }

    record VerifyResponse(
            @JsonProperty("authenticated") boolean authenticated,
            @JsonProperty("detail") String detail
    ) {
    }
}
