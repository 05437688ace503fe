package com.chatwire.realtime.chat.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ReactionRepository {

    public record ReactionRow(String messageId, String userId, String emoji, Instant createdAt) {
    }

    private final JdbcTemplate jdbcTemplate;

    public ReactionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ReactionRow> find(String messageId, String userId) {
        var sql = """
                select message_id, user_id, emoji, created_at
                from message_reaction
                where message_id = ?
                  and user_id = ?
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new ReactionRow(
                rs.getString("message_id"),
                rs.getString("user_id"),
                rs.getString("emoji"),
                rs.getTimestamp("created_at").toInstant()
        ), messageId, userId);
        return list.stream().findFirst();
    }

    public List<ReactionRow> listForMessage(String messageId) {
        var sql = """
                select message_id, user_id, emoji, created_at
                from message_reaction
                where message_id = ?
                order by created_at asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new ReactionRow(
                rs.getString("message_id"),
                rs.getString("user_id"),
                rs.getString("emoji"),
                rs.getTimestamp("created_at").toInstant()
        ), messageId);
    }

    public void insert(String messageId, String userId, String emoji) {
        var sql = "insert into message_reaction(message_id, user_id, emoji, created_at) values (?, ?, ?, ?)";
        jdbcTemplate.update(sql, messageId, userId, emoji, Timestamp.from(Instant.now()));
    }

    public int updateEmoji(String messageId, String userId, String emoji) {
        var sql = "update message_reaction set emoji = ?, created_at = ? where message_id = ? and user_id = ?";
        return jdbcTemplate.update(sql, emoji, Timestamp.from(Instant.now()), messageId, userId);
    }

    public int delete(String messageId, String userId) {
        var sql = "delete from message_reaction where message_id = ? and user_id = ?";
        return jdbcTemplate.update(sql, messageId, userId);
    }
}
