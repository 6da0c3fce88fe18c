package com.smarttest.core.health;

import com.smarttest.core.engine.OrchestratorProperties;
import com.smarttest.core.persistence.RunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the run repository, the optional database and the workspace root.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final RunRepository runRepository;
    private final OrchestratorProperties properties;
    private final DataSource dataSource;

    public HealthCheckService(
            RunRepository runRepository,
            OrchestratorProperties properties,
            @Autowired(required = false) DataSource dataSource) {
        this.runRepository = runRepository;
        this.properties = properties;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRepository());
        results.add(checkDatabase());
        results.add(checkWorkspace());
        return results;
    }

    private HealthStatus checkRepository() {
        String type = runRepository.getClass().getSimpleName();
        try {
            runRepository.findRecent(1);
            return HealthStatus.up("repository", "Run repository reachable", Map.of("type", type));
        } catch (Exception e) {
            log.warn("Repository health check failed: {}", e.getMessage());
            return HealthStatus.down("repository",
                    "Repository error: " + e.getMessage(), Map.of("type", type));
        }
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.degraded("database",
                    "No DataSource configured; runs are kept in memory", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database", "Database connection valid", Map.of());
            }
            return HealthStatus.down("database", "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database",
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkWorkspace() {
        Path root = Path.of(properties.getWorkspaceRoot());
        var metadata = Map.of("path", root.toAbsolutePath().toString());
        if (!Files.exists(root)) {
            return HealthStatus.degraded("workspace", "Workspace root does not exist yet", metadata);
        }
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            return HealthStatus.down("workspace", "Workspace root is not a writable directory", metadata);
        }
        return HealthStatus.up("workspace", "Workspace root writable", metadata);
    }
}
