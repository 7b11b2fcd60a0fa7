package tech.yump.rotation.store.vault;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import tech.yump.rotation.store.SecretStoreException;
import tech.yump.rotation.store.SecretVersion;
import tech.yump.rotation.store.StoreErrorType;
import tech.yump.rotation.store.StoreHealth;
import tech.yump.rotation.store.VersionStatus;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class VaultSecretStoreClientTest {

    private static final String BASE = "http://vault.test";
    private static final String VERSION_JSON = """
            {"id":"v-2","secretClassId":"database","versionNumber":2,"createdAt":"2026-01-15T10:00:00Z",
             "status":"PENDING","checksum":"sha256:abc"}
            """;

    private MockRestServiceServer server;
    private VaultSecretStoreClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(BASE)
                .defaultHeader(VaultSecretStoreClient.VAULT_TOKEN_HEADER, "s.engine-token");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new VaultSecretStoreClient(builder.build(), "rotation");
    }

    @Test
    @DisplayName("getMetadata reads the active version, 204 means no active version")
    void getMetadata() {
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/active"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(VaultSecretStoreClient.VAULT_TOKEN_HEADER, "s.engine-token"))
                .andRespond(withSuccess(VERSION_JSON.replace("PENDING", "ACTIVE"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1/rotation/classes/fresh/active"))
                .andRespond(withNoContent());

        Optional<SecretVersion> active = client.getMetadata("database");
        Optional<SecretVersion> none = client.getMetadata("fresh");

        assertThat(active).hasValueSatisfying(v -> {
            assertThat(v.id()).isEqualTo("v-2");
            assertThat(v.status()).isEqualTo(VersionStatus.ACTIVE);
            assertThat(v.versionNumber()).isEqualTo(2);
        });
        assertThat(none).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("listVersions and mintVersion map the JSON body")
    void listAndMint() {
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/versions"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[" + VERSION_JSON + "]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/versions"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(VERSION_JSON, MediaType.APPLICATION_JSON));

        List<SecretVersion> versions = client.listVersions("database");
        SecretVersion minted = client.mintVersion("database");

        assertThat(versions).extracting(SecretVersion::id).containsExactly("v-2");
        assertThat(minted.checksum()).isEqualTo("sha256:abc");
        server.verify();
    }

    @Test
    @DisplayName("activate sends the expected and candidate ids for the compare-and-swap")
    void activateSendsCas() {
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/activate"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.expected_active_id").value("v-1"))
                .andExpect(jsonPath("$.candidate_id").value("v-2"))
                .andRespond(withNoContent());

        client.activate("database", "v-1", SecretVersion.builder().id("v-2").build());

        server.verify();
    }

    @Test
    @DisplayName("409 on activate is a CONFLICT")
    void activateConflict() {
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/activate"))
                .andRespond(withStatus(HttpStatus.CONFLICT));

        assertThatThrownBy(() -> client.activate("database", "v-1", SecretVersion.builder().id("v-2").build()))
                .isInstanceOf(SecretStoreException.class)
                .satisfies(e -> assertThat(((SecretStoreException) e).getType()).isEqualTo(StoreErrorType.CONFLICT));
    }

    @Test
    @DisplayName("HTTP failures map to store error types")
    void errorMapping() {
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/versions/v-1/revoke"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN));
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/versions/v-1/retire"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/versions"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo(BASE + "/v1/rotation/classes/database/versions"))
                .andRespond(withException(new IOException("connection reset")));

        assertThatThrownBy(() -> client.revoke("database", "v-1"))
                .satisfies(e -> assertThat(((SecretStoreException) e).getType()).isEqualTo(StoreErrorType.AUTH_FAILED));
        assertThatThrownBy(() -> client.retire("database", "v-1"))
                .satisfies(e -> assertThat(((SecretStoreException) e).getType()).isEqualTo(StoreErrorType.NOT_FOUND));
        assertThatThrownBy(() -> client.listVersions("database"))
                .satisfies(e -> assertThat(((SecretStoreException) e).isRetryable()).isTrue());
        assertThatThrownBy(() -> client.mintVersion("database"))
                .satisfies(e -> assertThat(((SecretStoreException) e).getType()).isEqualTo(StoreErrorType.UNREACHABLE));
        server.verify();
    }

    @Test
    @DisplayName("health reads the reported free capacity and degrades to unreachable on errors")
    void health() {
        server.expect(requestTo(BASE + "/v1/sys/health"))
                .andRespond(withSuccess("{\"free_capacity_bytes\":1048576000}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1/sys/health"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        StoreHealth up = client.health();
        StoreHealth down = client.health();

        assertThat(up.reachable()).isTrue();
        assertThat(up.freeCapacityBytes()).isEqualTo(1_048_576_000L);
        assertThat(down.reachable()).isFalse();
        assertThat(down.freeCapacityBytes()).isEqualTo(-1);
    }

    @Test
    @DisplayName("health tolerates extra fields and a missing free capacity")
    void healthWithoutCapacity() {
        server.expect(requestTo(BASE + "/v1/sys/health"))
                .andRespond(withSuccess("{\"initialized\":true,\"sealed\":false}", MediaType.APPLICATION_JSON));

        StoreHealth up = client.health();

        assertThat(up.reachable()).isTrue();
        assertThat(up.freeCapacityBytes()).isEqualTo(-1);
        server.verify();
    }
}
