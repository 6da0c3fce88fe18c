package com.smarttest.core.health;

import java.util.List;
import java.util.Map;

/**
 * Result of checking one component. Statuses are declared from best to worst.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    /**
     * Worst status among {@code checks}, or UP when there are none.
     */
    public static Status overall(List<HealthStatus> checks) {
        return checks.stream()
                .map(HealthStatus::status)
                .max(Enum::compareTo)
                .orElse(Status.UP);
    }

    public static long count(List<HealthStatus> checks, Status status) {
        return checks.stream().filter(c -> c.status() == status).count();
    }
}
