package com.governance.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.governance.core.exception.PersistenceException;
import com.governance.core.model.run.StepRun;
import com.governance.core.model.run.StepStatus;
import com.governance.core.repository.StepRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * PostgreSQL-backed step store. A transition only applies while the row still has the expected status.
 */
public class JdbcStepRunRepository implements StepRunRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcStepRunRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final StepRunRowMapper rowMapper;

    public JdbcStepRunRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new StepRunRowMapper();
    }

    @Override
    @Transactional
    public void insertAll(List<StepRun> steps) {
        String sql = """
            INSERT INTO run_steps (
                run_id, step_index, step_name, status, attempts, output,
                error_code, error, idempotency_key_hash, started_at, completed_at
            ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?)
            ON CONFLICT (run_id, step_index) DO NOTHING
            """;

        try {
            jdbcTemplate.batchUpdate(sql, steps, steps.size(), (ps, step) -> {
                ps.setObject(1, step.runId());
                ps.setInt(2, step.stepIndex());
                ps.setString(3, step.stepName());
                ps.setString(4, step.status().name());
                ps.setInt(5, step.attempts());
                ps.setString(6, toJson(step.output()));
                ps.setString(7, step.errorCode());
                ps.setString(8, step.error());
                ps.setString(9, step.idempotencyKeyHash());
                ps.setTimestamp(10, toTimestamp(step.startedAt()));
                ps.setTimestamp(11, toTimestamp(step.completedAt()));
            });
        } catch (DataAccessException e) {
            throw new PersistenceException("insert steps", e);
        }
        log.debug("Inserted {} steps", steps.size());
    }

    @Override
    @Transactional
    public boolean transition(StepRun updated, StepStatus expectedStatus) {
        String sql = """
            UPDATE run_steps SET
                status = ?,
                attempts = ?,
                output = ?::jsonb,
                error_code = ?,
                error = ?,
                idempotency_key_hash = ?,
                started_at = ?,
                completed_at = ?
            WHERE run_id = ? AND step_index = ? AND status = ?
            """;

        try {
            int rows = jdbcTemplate.update(sql,
                updated.status().name(),
                updated.attempts(),
                toJson(updated.output()),
                updated.errorCode(),
                updated.error(),
                updated.idempotencyKeyHash(),
                toTimestamp(updated.startedAt()),
                toTimestamp(updated.completedAt()),
                updated.runId(),
                updated.stepIndex(),
                expectedStatus.name()
            );
            return rows > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("update step " + updated.stepName(), e);
        }
    }

    @Override
    public Optional<StepRun> find(UUID runId, int stepIndex) {
        String sql = "SELECT * FROM run_steps WHERE run_id = ? AND step_index = ?";
        try {
            List<StepRun> results = jdbcTemplate.query(sql, rowMapper, runId, stepIndex);
            return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
        } catch (DataAccessException e) {
            throw new PersistenceException("find step " + stepIndex + " of run " + runId, e);
        }
    }

    @Override
    public List<StepRun> findByRun(UUID runId) {
        String sql = "SELECT * FROM run_steps WHERE run_id = ? ORDER BY step_index";
        try {
            return jdbcTemplate.query(sql, rowMapper, runId);
        } catch (DataAccessException e) {
            throw new PersistenceException("find steps of run " + runId, e);
        }
    }

    // ========== Helper Methods ==========

    private String toJson(JsonNode node) {
        if (node == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize step output", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class StepRunRowMapper implements RowMapper<StepRun> {
        @Override
        public StepRun mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                String output = rs.getString("output");
                return new StepRun(
                    UUID.fromString(rs.getString("run_id")),
                    rs.getInt("step_index"),
                    rs.getString("step_name"),
                    StepStatus.valueOf(rs.getString("status")),
                    rs.getInt("attempts"),
                    output == null ? null : objectMapper.readTree(output),
                    rs.getString("error_code"),
                    rs.getString("error"),
                    rs.getString("idempotency_key_hash"),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map step row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
