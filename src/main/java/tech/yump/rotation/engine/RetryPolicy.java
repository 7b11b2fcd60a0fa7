package tech.yump.rotation.engine;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tech.yump.rotation.config.RotationProperties;

import java.time.Duration;

/**
 * Exponential backoff: {@code min(cap, base * 2^attempt)}.
 */
@Component
@RequiredArgsConstructor
public class RetryPolicy {

    private final RotationProperties properties;

    public Duration delay(Duration base, int attempt) {
        return delay(base, attempt, properties.engine().backoffCap());
    }

    static Duration delay(Duration base, int attempt, Duration cap) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must not be negative");
        }
        if (attempt >= 62) {
            return cap;
        }
        long factor = 1L << attempt;
        long baseMillis = base.toMillis();
        if (baseMillis > cap.toMillis() / factor) {
            return cap;
        }
        Duration delay = Duration.ofMillis(baseMillis * factor);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }
}
