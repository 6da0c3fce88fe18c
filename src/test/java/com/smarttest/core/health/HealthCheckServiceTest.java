package com.smarttest.core.health;

import com.smarttest.core.engine.OrchestratorProperties;
import com.smarttest.core.persistence.InMemoryRunRepository;
import com.smarttest.core.persistence.PersistenceException;
import com.smarttest.core.persistence.RunRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    @TempDir
    Path workspace;

    private OrchestratorProperties properties(Path root) {
        var properties = new OrchestratorProperties();
        properties.setWorkspaceRoot(root.toString());
        return properties;
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns repository, database and workspace components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(new InMemoryRunRepository(Clock.systemUTC()), properties(workspace), null);
        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("repository", "database", "workspace"), components);
    }

    @Test
    @DisplayName("In-memory storage -> database DEGRADED, repository and workspace UP")
    void inMemory() {
        var service = new HealthCheckService(new InMemoryRunRepository(Clock.systemUTC()), properties(workspace), null);
        List<HealthStatus> results = service.checkAll();

        assertEquals(HealthStatus.Status.UP, component(results, "repository").status());
        assertEquals("InMemoryRunRepository", component(results, "repository").metadata().get("type"));
        assertEquals(HealthStatus.Status.DEGRADED, component(results, "database").status());
        assertEquals(HealthStatus.Status.UP, component(results, "workspace").status());
    }

    @Test
    @DisplayName("Missing workspace root -> workspace DEGRADED")
    void missingWorkspace() {
        var service = new HealthCheckService(new InMemoryRunRepository(Clock.systemUTC()),
                properties(workspace.resolve("not-yet")), null);
        assertEquals(HealthStatus.Status.DEGRADED, component(service.checkAll(), "workspace").status());
    }

    @Test
    @DisplayName("Failing repository -> repository DOWN")
    void failingRepository() {
        var repository = mock(RunRepository.class);
        when(repository.findRecent(anyInt())).thenThrow(new PersistenceException("connection refused", new SQLException("refused")));
        var service = new HealthCheckService(repository, properties(workspace), null);

        HealthStatus status = component(service.checkAll(), "repository");
        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("connection refused"));
    }

    @Test
    @DisplayName("Valid connection -> database UP, unreachable -> DOWN")
    void database() throws SQLException {
        var connection = mock(Connection.class);
        when(connection.isValid(anyInt())).thenReturn(true);
        var good = mock(DataSource.class);
        when(good.getConnection()).thenReturn(connection);
        var bad = mock(DataSource.class);
        when(bad.getConnection()).thenThrow(new SQLException("no route to host"));
        var repository = new InMemoryRunRepository(Clock.systemUTC());

        assertEquals(HealthStatus.Status.UP,
                component(new HealthCheckService(repository, properties(workspace), good).checkAll(), "database").status());
        assertEquals(HealthStatus.Status.DOWN,
                component(new HealthCheckService(repository, properties(workspace), bad).checkAll(), "database").status());
    }
}
