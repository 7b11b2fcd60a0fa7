package tech.yump.rotation.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import tech.yump.rotation.store.SecretStoreClient;
import tech.yump.rotation.store.StoreHealth;

/**
 * Exposes the secret store probe as the {@code secretStore} actuator health component.
 */
@Component("secretStore")
@RequiredArgsConstructor
public class SecretStoreHealthIndicator implements HealthIndicator {

    private final SecretStoreClient storeClient;

    @Override
    public Health health() {
        StoreHealth health = storeClient.health();
        Health.Builder builder = health.reachable() ? Health.up() : Health.down();
        builder.withDetail("latencyMs", health.latency() != null ? health.latency().toMillis() : -1);
        if (health.freeCapacityBytes() >= 0) {
            builder.withDetail("freeCapacityBytes", health.freeCapacityBytes());
        }
        if (health.detail() != null) {
            builder.withDetail("detail", health.detail());
        }
        return builder.build();
    }
}
