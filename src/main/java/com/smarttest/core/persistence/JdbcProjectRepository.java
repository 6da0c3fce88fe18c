package com.smarttest.core.persistence;

import com.smarttest.core.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link ProjectRepository} over the {@code smarttest_projects} table.
 */
public class JdbcProjectRepository implements ProjectRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcProjectRepository.class);

    private static final String TABLE_NAME = "smarttest_projects";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id   VARCHAR(255) NOT NULL PRIMARY KEY,
                name VARCHAR(255) NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT INTO %s (id, name) VALUES (?, ?)
            ON CONFLICT (id) DO UPDATE SET name = EXCLUDED.name
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = "SELECT id, name FROM %s WHERE id = ?".formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = "SELECT id, name FROM %s ORDER BY id".formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcProjectRepository(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Project table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<Project> findById(String projectId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, projectId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next()
                        ? Optional.of(new Project(rs.getString("id"), rs.getString("name")))
                        : Optional.empty();
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load project " + projectId, e);
        }
    }

    @Override
    public Project save(Project project) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, project.id());
            stmt.setString(2, project.name());
            stmt.executeUpdate();
            return project;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to save project " + project.id(), e);
        }
    }

    @Override
    public List<Project> findAll() {
        var projects = new ArrayList<Project>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL);
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                projects.add(new Project(rs.getString("id"), rs.getString("name")));
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list projects", e);
        }
        return projects;
    }
}
