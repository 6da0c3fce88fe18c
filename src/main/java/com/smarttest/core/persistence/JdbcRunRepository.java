package com.smarttest.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smarttest.core.engine.NotFoundException;
import com.smarttest.core.model.DecisionLogEntry;
import com.smarttest.core.model.QualityMetrics;
import com.smarttest.core.model.ReasonCode;
import com.smarttest.core.model.RunState;
import com.smarttest.core.model.RunUpdate;
import com.smarttest.core.model.TestRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link RunRepository}.
 * <p>
 * Scalar fields map to columns; lists, maps, the decision log and the quality metrics are
 * stored as JSON text. The table {@code smarttest_runs} is created by {@link #createTables()}.
 * <p>
 * Each row carries a version that {@link #update} compares and bumps, so a write based on a
 * stale read fails with {@link StaleRunException} instead of overwriting the newer row.
 */
public class JdbcRunRepository implements RunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunRepository.class);

    private static final String TABLE_NAME = "smarttest_runs";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final TypeReference<List<DecisionLogEntry>> DECISION_LOG = new TypeReference<>() {};

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id               VARCHAR(64)  NOT NULL PRIMARY KEY,
                project_id       VARCHAR(255) NOT NULL,
                state            VARCHAR(32)  NOT NULL,
                reason_code      VARCHAR(32),
                prd_path         TEXT,
                tested_routes    TEXT NOT NULL,
                workspace_path   TEXT,
                env_fingerprint  TEXT NOT NULL,
                agent_versions   TEXT NOT NULL,
                prompt_versions  TEXT NOT NULL,
                decision_log     TEXT NOT NULL,
                quality_metrics  TEXT,
                report_path      TEXT,
                created_at       TIMESTAMP NOT NULL,
                updated_at       TIMESTAMP NOT NULL,
                completed_at     TIMESTAMP,
                version          BIGINT NOT NULL DEFAULT 0
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_PROJECT_INDEX_SQL =
            "CREATE INDEX IF NOT EXISTS idx_%1$s_project ON %1$s (project_id)".formatted(TABLE_NAME);

    private static final String CREATE_STATE_INDEX_SQL =
            "CREATE INDEX IF NOT EXISTS idx_%1$s_state ON %1$s (state)".formatted(TABLE_NAME);

    private static final String COLUMNS = """
            id, project_id, state, reason_code, prd_path, tested_routes, workspace_path,
            env_fingerprint, agent_versions, prompt_versions, decision_log, quality_metrics,
            report_path, created_at, updated_at, completed_at
            """;

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String UPDATE_SQL = """
            UPDATE %s
            SET state = ?, reason_code = ?, decision_log = ?, quality_metrics = ?,
                report_path = ?, updated_at = ?, completed_at = ?, version = version + 1
            WHERE id = ? AND version = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL =
            "SELECT %s FROM %s WHERE id = ?".formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_VERSIONED_SQL =
            "SELECT %s, version FROM %s WHERE id = ?".formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_PROJECT_SQL =
            "SELECT %s FROM %s WHERE project_id = ? ORDER BY created_at DESC".formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_STATE_SQL =
            "SELECT %s FROM %s WHERE state = ? ORDER BY created_at ASC".formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_RECENT_SQL =
            "SELECT %s FROM %s ORDER BY created_at DESC LIMIT ?".formatted(COLUMNS, TABLE_NAME);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcRunRepository(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Creates the runs table and its indexes if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_TABLE_SQL, CREATE_PROJECT_INDEX_SQL, CREATE_STATE_INDEX_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Run table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<TestRun> findById(String runId) {
        try (Connection conn = dataSource.getConnection()) {
            return selectById(conn, runId);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to load run " + runId, e);
        }
    }

    @Override
    public TestRun create(TestRun run) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, run.id());
            stmt.setString(2, run.projectId());
            stmt.setString(3, run.state().wireName());
            stmt.setString(4, run.reasonCode() != null ? run.reasonCode().wireName() : null);
            stmt.setString(5, run.prdPath());
            stmt.setString(6, toJson(run.testedRoutes()));
            stmt.setString(7, run.workspacePath());
            stmt.setString(8, toJson(run.envFingerprint()));
            stmt.setString(9, toJson(run.agentVersions()));
            stmt.setString(10, toJson(run.promptVersions()));
            stmt.setString(11, toJson(run.decisionLog()));
            stmt.setString(12, run.qualityMetrics() != null ? toJson(run.qualityMetrics()) : null);
            stmt.setString(13, run.reportPath());
            setInstant(stmt, 14, run.createdAt());
            setInstant(stmt, 15, run.updatedAt());
            setInstant(stmt, 16, run.completedAt());
            stmt.executeUpdate();
            log.debug("Inserted run '{}' for project '{}'", run.id(), run.projectId());
            return run;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to insert run " + run.id(), e);
        }
    }

    /**
     * {@inheritDoc}
     *
     * @throws StaleRunException if the row changed between the read and the write
     */
    @Override
    public TestRun update(String runId, RunUpdate update) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                VersionedRun current = selectVersioned(conn, runId);
                TestRun updated = update.applyTo(current.run(), clock.instant());
                try (PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
                    stmt.setString(1, updated.state().wireName());
                    stmt.setString(2, updated.reasonCode() != null ? updated.reasonCode().wireName() : null);
                    stmt.setString(3, toJson(updated.decisionLog()));
                    stmt.setString(4, updated.qualityMetrics() != null ? toJson(updated.qualityMetrics()) : null);
                    stmt.setString(5, updated.reportPath());
                    setInstant(stmt, 6, updated.updatedAt());
                    setInstant(stmt, 7, updated.completedAt());
                    stmt.setString(8, runId);
                    stmt.setLong(9, current.version());
                    int rows = stmt.executeUpdate();
                    if (rows != 1) {
                        throw new StaleRunException(runId, current.version());
                    }
                }
                conn.commit();
                return updated;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to update run " + runId, e);
        }
    }

    @Override
    public List<TestRun> findByProjectId(String projectId) {
        return query(SELECT_BY_PROJECT_SQL, stmt -> stmt.setString(1, projectId));
    }

    @Override
    public List<TestRun> findByState(RunState state) {
        return query(SELECT_BY_STATE_SQL, stmt -> stmt.setString(1, state.wireName()));
    }

    @Override
    public List<TestRun> findRecent(int limit) {
        return query(SELECT_RECENT_SQL, stmt -> stmt.setInt(1, limit));
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<TestRun> query(String sql, Binder binder) {
        var runs = new ArrayList<TestRun>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    runs.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Failed to query runs", e);
        }
        return runs;
    }

    private record VersionedRun(TestRun run, long version) {}

    private VersionedRun selectVersioned(Connection conn, String runId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_VERSIONED_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw NotFoundException.run(runId);
                }
                return new VersionedRun(fromResultSet(rs), rs.getLong("version"));
            }
        }
    }

    private Optional<TestRun> selectById(Connection conn, String runId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, runId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        }
    }

    private TestRun fromResultSet(ResultSet rs) throws SQLException {
        String reasonCode = rs.getString("reason_code");
        String metrics = rs.getString("quality_metrics");
        return new TestRun(
                rs.getString("id"),
                rs.getString("project_id"),
                RunState.fromWireName(rs.getString("state")),
                reasonCode != null ? ReasonCode.fromWireName(reasonCode) : null,
                rs.getString("prd_path"),
                fromJson(rs.getString("tested_routes"), STRING_LIST),
                rs.getString("workspace_path"),
                fromJson(rs.getString("env_fingerprint"), STRING_MAP),
                fromJson(rs.getString("agent_versions"), STRING_MAP),
                fromJson(rs.getString("prompt_versions"), STRING_MAP),
                fromJson(rs.getString("decision_log"), DECISION_LOG),
                metrics != null ? fromJson(metrics, new TypeReference<QualityMetrics>() {}) : null,
                rs.getString("report_path"),
                getInstant(rs, "created_at"),
                getInstant(rs, "updated_at"),
                getInstant(rs, "completed_at"));
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(index, Types.TIMESTAMP);
        } else {
            stmt.setTimestamp(index, Timestamp.from(instant));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to deserialize column value", e);
        }
    }
}
