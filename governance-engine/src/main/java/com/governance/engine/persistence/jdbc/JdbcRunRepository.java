package com.governance.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.governance.core.exception.DuplicateRecordException;
import com.governance.core.exception.OptimisticLockException;
import com.governance.core.exception.PersistenceException;
import com.governance.core.model.run.Run;
import com.governance.core.model.run.RunStatus;
import com.governance.core.repository.RunRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed run store. Updates are conditional on the previous version.
 */
public class JdbcRunRepository implements RunRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RunRowMapper rowMapper;

    public JdbcRunRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new RunRowMapper();
    }

    @Override
    @Transactional
    public void insert(Run run) {
        String sql = """
            INSERT INTO runs (
                run_id, playbook_id, status, triggered_by, environment, variables,
                created_at, started_at, completed_at, deadline,
                paused_by, pause_reason, paused_at, resumed_by, resumed_at,
                approval_step_index, approval_granted_by, cancelled_by,
                last_error_code, last_error, version
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (run_id) DO NOTHING
            """;

        int rows;
        try {
            rows = jdbcTemplate.update(sql,
                run.runId(),
                run.playbookId(),
                run.status().name(),
                run.triggeredBy(),
                run.environment(),
                toJson(run.variables()),
                toTimestamp(run.createdAt()),
                toTimestamp(run.startedAt()),
                toTimestamp(run.completedAt()),
                toTimestamp(run.deadline()),
                run.pausedBy(),
                run.pauseReason(),
                toTimestamp(run.pausedAt()),
                run.resumedBy(),
                toTimestamp(run.resumedAt()),
                run.approvalStepIndex(),
                run.approvalGrantedBy(),
                run.cancelledBy(),
                run.lastErrorCode(),
                run.lastError(),
                run.version()
            );
        } catch (DataAccessException e) {
            throw new PersistenceException("insert run " + run.runId(), e);
        }
        if (rows == 0) {
            throw new DuplicateRecordException("Run", run.runId().toString());
        }
    }

    @Override
    @Transactional
    public void update(Run run) {
        String sql = """
            UPDATE runs SET
                status = ?,
                variables = ?::jsonb,
                started_at = ?,
                completed_at = ?,
                deadline = ?,
                paused_by = ?,
                pause_reason = ?,
                paused_at = ?,
                resumed_by = ?,
                resumed_at = ?,
                approval_step_index = ?,
                approval_granted_by = ?,
                cancelled_by = ?,
                last_error_code = ?,
                last_error = ?,
                version = ?
            WHERE run_id = ? AND version = ?
            """;

        int rows;
        try {
            rows = jdbcTemplate.update(sql,
                run.status().name(),
                toJson(run.variables()),
                toTimestamp(run.startedAt()),
                toTimestamp(run.completedAt()),
                toTimestamp(run.deadline()),
                run.pausedBy(),
                run.pauseReason(),
                toTimestamp(run.pausedAt()),
                run.resumedBy(),
                toTimestamp(run.resumedAt()),
                run.approvalStepIndex(),
                run.approvalGrantedBy(),
                run.cancelledBy(),
                run.lastErrorCode(),
                run.lastError(),
                run.version(),
                run.runId(),
                run.version() - 1
            );
        } catch (DataAccessException e) {
            throw new PersistenceException("update run " + run.runId(), e);
        }
        if (rows == 0) {
            throw new OptimisticLockException("Run", run.runId().toString(), run.version() - 1);
        }
    }

    @Override
    public Optional<Run> findById(UUID runId) {
        try {
            List<Run> results = jdbcTemplate.query("SELECT * FROM runs WHERE run_id = ?", rowMapper, runId);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new PersistenceException("find run " + runId, e);
        }
    }

    @Override
    public List<Run> findByStatus(RunStatus status, int limit) {
        String sql = "SELECT * FROM runs WHERE status = ? ORDER BY created_at LIMIT ?";
        try {
            return jdbcTemplate.query(sql, rowMapper, status.name(), limit);
        } catch (DataAccessException e) {
            throw new PersistenceException("find runs by status " + status, e);
        }
    }

    // ========== Helper Methods ==========

    private String toJson(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize run variables", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class RunRowMapper implements RowMapper<Run> {
        @Override
        public Run mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                int approvalIndex = rs.getInt("approval_step_index");
                Integer approvalStepIndex = rs.wasNull() ? null : approvalIndex;
                return new Run(
                    UUID.fromString(rs.getString("run_id")),
                    rs.getString("playbook_id"),
                    RunStatus.valueOf(rs.getString("status")),
                    rs.getString("triggered_by"),
                    rs.getString("environment"),
                    (ObjectNode) objectMapper.readTree(rs.getString("variables")),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    toInstant(rs.getTimestamp("deadline")),
                    rs.getString("paused_by"),
                    rs.getString("pause_reason"),
                    toInstant(rs.getTimestamp("paused_at")),
                    rs.getString("resumed_by"),
                    toInstant(rs.getTimestamp("resumed_at")),
                    approvalStepIndex,
                    rs.getString("approval_granted_by"),
                    rs.getString("cancelled_by"),
                    rs.getString("last_error_code"),
                    rs.getString("last_error"),
                    rs.getLong("version")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map run row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
