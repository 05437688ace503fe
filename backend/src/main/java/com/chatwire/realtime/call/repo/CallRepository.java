package com.chatwire.realtime.call.repo;

import com.chatwire.realtime.call.service.CallStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class CallRepository {

    public record CallRow(
            String id,
            String callerId,
            String receiverId,
            String callType,
            CallStatus status,
            Instant startedAt,
            Instant answeredAt,
            Instant endedAt,
            long durationSeconds
    ) {
        public boolean isParticipant(String userId) {
            return userId != null && (userId.equals(callerId) || userId.equals(receiverId));
        }
    }

    private static final String COLUMNS = """
            id, caller_id, receiver_id, call_type, status, started_at, answered_at, ended_at, duration_seconds
            """;

    private static final RowMapper<CallRow> ROW_MAPPER = (rs, rowNum) -> {
        var answeredAt = rs.getTimestamp("answered_at");
        var endedAt = rs.getTimestamp("ended_at");
        return new CallRow(
                rs.getString("id"),
                rs.getString("caller_id"),
                rs.getString("receiver_id"),
                rs.getString("call_type"),
                CallStatus.fromDb(rs.getString("status")),
                rs.getTimestamp("started_at").toInstant(),
                answeredAt == null ? null : answeredAt.toInstant(),
                endedAt == null ? null : endedAt.toInstant(),
                rs.getLong("duration_seconds")
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public CallRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public CallRow insertCall(String callerId, String receiverId, String callType) {
        var id = UUID.randomUUID().toString();
        var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var sql = """
                insert into call_session(id, caller_id, receiver_id, call_type, status, started_at, duration_seconds)
                values (?, ?, ?, ?, ?, ?, 0)
                """;
        jdbcTemplate.update(sql, id, callerId, receiverId, callType, CallStatus.INITIATED.dbValue(), Timestamp.from(now));
        return new CallRow(id, callerId, receiverId, callType, CallStatus.INITIATED, now, null, null, 0);
    }

    public Optional<CallRow> findById(String callId) {
        if (callId == null || callId.isBlank()) return Optional.empty();
        var sql = "select " + COLUMNS + " from call_session where id = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, callId).stream().findFirst();
    }

    /**
     * Compare-and-set on the current status. The caller computes the timestamps of the new state.
     *
     * @return rows updated; 0 when another writer moved the call first
     */
    public int updateStatus(
            String callId,
            CallStatus expected,
            CallStatus next,
            Instant answeredAt,
            Instant endedAt,
            long durationSeconds
    ) {
        var sql = """
                update call_session
                set status = ?,
                    answered_at = ?,
                    ended_at = ?,
                    duration_seconds = ?
                where id = ?
                  and status = ?
                """;
        return jdbcTemplate.update(sql,
                next.dbValue(),
                answeredAt == null ? null : Timestamp.from(answeredAt),
                endedAt == null ? null : Timestamp.from(endedAt),
                durationSeconds,
                callId,
                expected.dbValue()
        );
    }

    /**
     * Calls still {@code initiated} or {@code ringing} that started before {@code before}.
     */
    public List<CallRow> listStaleRinging(Instant before, int limit) {
        var sql = "select " + COLUMNS + """
                 from call_session
                where status in ('initiated', 'ringing')
                  and started_at < ?
                order by started_at asc
                limit ?
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(before), limit);
    }
}
