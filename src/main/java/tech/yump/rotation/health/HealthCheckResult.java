package tech.yump.rotation.health;

public record HealthCheckResult(boolean ok, String reason) {

    public static HealthCheckResult passed() {
        return new HealthCheckResult(true, null);
    }

    public static HealthCheckResult failed(String reason) {
        return new HealthCheckResult(false, reason);
    }
}
