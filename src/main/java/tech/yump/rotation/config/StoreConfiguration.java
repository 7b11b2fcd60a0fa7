package tech.yump.rotation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import tech.yump.rotation.crypto.EncryptionService;
import tech.yump.rotation.storage.StorageBackend;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.local.LocalSecretStoreClient;
import tech.yump.rotation.store.vault.VaultSecretStoreClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Creates the {@link SecretStoreClient} for {@code rotation.store.backend}.
 */
@Configuration
@Slf4j
public class StoreConfiguration {

    @Bean
    public SecretStoreClient secretStoreClient(RotationProperties properties,
                                               StorageBackend storage,
                                               EncryptionService encryptionService,
                                               Clock clock,
                                               RestClient.Builder restClientBuilder) {
        RotationProperties.StoreProperties store = properties.store();
        return switch (store.backend()) {
            case LOCAL -> {
                log.info("Using the local secret store backend on the engine storage.");
                yield new LocalSecretStoreClient(storage, encryptionService, clock);
            }
            case VAULT -> {
                log.info("Using the Vault secret store backend at {} (timeout {}).", store.vault().uri(), store.timeout());
                RestClient restClient = restClientBuilder.clone()
                        .baseUrl(store.vault().uri())
                        .defaultHeader(VaultSecretStoreClient.VAULT_TOKEN_HEADER, store.vault().token())
                        .requestFactory(requestFactory(store.timeout()))
                        .build();
                yield new VaultSecretStoreClient(restClient, store.vault().mount());
            }
        };
    }

    static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return factory;
    }
}
