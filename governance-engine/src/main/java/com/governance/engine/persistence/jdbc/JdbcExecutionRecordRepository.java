package com.governance.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.governance.core.exception.PersistenceException;
import com.governance.core.model.policy.Decision;
import com.governance.core.model.policy.DenialReason;
import com.governance.core.model.policy.ExecutionRecord;
import com.governance.core.repository.ExecutionRecordRepository;
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
import java.util.function.Supplier;

/**
 * PostgreSQL-backed audit trail.
 * Both uniqueness rules live in the schema; {@code ON CONFLICT DO NOTHING} turns a lost race
 * into a zero row count instead of an error.
 */
public class JdbcExecutionRecordRepository implements ExecutionRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRecordRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final ExecutionRecordRowMapper rowMapper;

    public JdbcExecutionRecordRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new ExecutionRecordRowMapper();
    }

    @Override
    @Transactional
    public boolean insertIfAbsent(ExecutionRecord record) {
        String sql = """
            INSERT INTO execution_records (
                record_id, request_id, action_type, action_fingerprint,
                target_type, target_identifier, decision, reason_code, reason,
                idempotency_key, idempotency_key_hash, policy_name, enforcement_data,
                deployment_env, actor, approval_fingerprint, admission_sequence,
                next_allowed_at, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

        try {
            int rows = jdbcTemplate.update(sql,
                record.recordId(),
                record.requestId(),
                record.actionType(),
                record.actionFingerprint(),
                record.targetType(),
                record.targetIdentifier(),
                record.decision().name(),
                record.reasonCode().name(),
                record.reason(),
                record.idempotencyKey(),
                record.idempotencyKeyHash(),
                record.policyName(),
                toJson(record.enforcementData()),
                record.deploymentEnv(),
                record.actor(),
                record.approvalFingerprint(),
                record.admissionSequence(),
                toTimestamp(record.nextAllowedAt()),
                toTimestamp(record.createdAt())
            );

            if (rows == 0) {
                log.debug("Execution record for request {} lost the insert race", record.requestId());
            }
            return rows > 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("insert execution record " + record.requestId(), e);
        }
    }

    @Override
    public long countAllowedSince(String actionType, String targetIdentifier, Instant since) {
        String sql = """
            SELECT COUNT(*) FROM execution_records
            WHERE action_type = ? AND target_identifier = ? AND decision = 'ALLOWED' AND created_at >= ?
            """;
        return query(() -> jdbcTemplate.queryForObject(sql, Long.class, actionType, targetIdentifier,
            Timestamp.from(since)), "count allowed executions");
    }

    @Override
    public Optional<ExecutionRecord> findOldestAllowedSince(String actionType, String targetIdentifier,
                                                            Instant since) {
        String sql = """
            SELECT * FROM execution_records
            WHERE action_type = ? AND target_identifier = ? AND decision = 'ALLOWED' AND created_at >= ?
            ORDER BY created_at ASC
            LIMIT 1
            """;
        return first(query(() -> jdbcTemplate.query(sql, rowMapper, actionType, targetIdentifier,
            Timestamp.from(since)), "find oldest allowed execution"));
    }

    @Override
    public Optional<ExecutionRecord> findLastAllowed(String actionType, String targetIdentifier) {
        String sql = """
            SELECT * FROM execution_records
            WHERE action_type = ? AND target_identifier = ? AND decision = 'ALLOWED'
            ORDER BY created_at DESC
            LIMIT 1
            """;
        return first(query(() -> jdbcTemplate.query(sql, rowMapper, actionType, targetIdentifier),
            "find last allowed execution"));
    }

    @Override
    public long countAllowed(String actionType, String targetIdentifier) {
        String sql = """
            SELECT COUNT(*) FROM execution_records
            WHERE action_type = ? AND target_identifier = ? AND decision = 'ALLOWED'
            """;
        return query(() -> jdbcTemplate.queryForObject(sql, Long.class, actionType, targetIdentifier),
            "count admissions");
    }

    @Override
    public Optional<ExecutionRecord> findByRequestId(String requestId) {
        String sql = "SELECT * FROM execution_records WHERE request_id = ?";
        return first(query(() -> jdbcTemplate.query(sql, rowMapper, requestId), "find by request id"));
    }

    @Override
    public List<ExecutionRecord> findByTarget(String actionType, String targetIdentifier, int limit) {
        String sql = """
            SELECT * FROM execution_records
            WHERE action_type = ? AND target_identifier = ?
            ORDER BY created_at DESC
            LIMIT ?
            """;
        return query(() -> jdbcTemplate.query(sql, rowMapper, actionType, targetIdentifier, limit),
            "find execution history");
    }

    // ========== Helper Methods ==========

    private <T> T query(Supplier<T> operation, String description) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            throw new PersistenceException(description, e);
        }
    }

    private static <T> Optional<T> first(List<T> results) {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    private String toJson(JsonNode node) {
        if (node == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize enforcement data", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private class ExecutionRecordRowMapper implements RowMapper<ExecutionRecord> {
        @Override
        public ExecutionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                long sequence = rs.getLong("admission_sequence");
                Long admissionSequence = rs.wasNull() ? null : sequence;
                String data = rs.getString("enforcement_data");
                return new ExecutionRecord(
                    UUID.fromString(rs.getString("record_id")),
                    rs.getString("request_id"),
                    rs.getString("action_type"),
                    rs.getString("action_fingerprint"),
                    rs.getString("target_type"),
                    rs.getString("target_identifier"),
                    Decision.valueOf(rs.getString("decision")),
                    DenialReason.valueOf(rs.getString("reason_code")),
                    rs.getString("reason"),
                    rs.getString("idempotency_key"),
                    rs.getString("idempotency_key_hash"),
                    rs.getString("policy_name"),
                    data == null ? null : objectMapper.readTree(data),
                    rs.getString("deployment_env"),
                    rs.getString("actor"),
                    rs.getString("approval_fingerprint"),
                    admissionSequence,
                    toInstant(rs.getTimestamp("next_allowed_at")),
                    toInstant(rs.getTimestamp("created_at"))
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map execution record row", e);
            }
        }

        private Instant toInstant(Timestamp ts) {
            return ts != null ? ts.toInstant() : null;
        }
    }
}
