package com.smarttest.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    @Test
    @DisplayName("overall status is the worst component status")
    void overallIsWorst() {
        var up = HealthStatus.up("repository", "ok", Map.of());
        var degraded = HealthStatus.degraded("database", "in memory", Map.of());
        var down = HealthStatus.down("workspace", "read only", Map.of());

        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of(up)));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(up, degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(down, degraded, up)));
    }

    @Test
    @DisplayName("no components counts as up")
    void emptyIsUp() {
        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
    }

    @Test
    @DisplayName("components are counted by status")
    void countsByStatus() {
        var checks = List.of(
                HealthStatus.degraded("database", "in memory", Map.of()),
                HealthStatus.degraded("workspace", "missing", Map.of()),
                HealthStatus.up("repository", "ok", Map.of()));

        assertEquals(2, HealthStatus.count(checks, HealthStatus.Status.DEGRADED));
        assertEquals(0, HealthStatus.count(checks, HealthStatus.Status.DOWN));
    }

    @Test
    @DisplayName("missing metadata reads as empty")
    void nullMetadata() {
        var status = new HealthStatus("database", HealthStatus.Status.UP, "ok", null);

        assertEquals(Map.of(), status.metadata());
    }
}
