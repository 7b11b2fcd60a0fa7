package tech.yump.rotation.store;

import java.time.Duration;

/**
 * Result of probing the secret store.
 *
 * @param reachable         whether the store answered at all.
 * @param latency           round-trip time of the probe.
 * @param freeCapacityBytes capacity left for new versions, -1 when the store does not report it.
 * @param detail            human readable detail, e.g. the failure reason.
 */
public record StoreHealth(
        boolean reachable,
        Duration latency,
        long freeCapacityBytes,
        String detail
) {

    public static StoreHealth unreachable(Duration latency, String detail) {
        return new StoreHealth(false, latency, -1, detail);
    }
}
