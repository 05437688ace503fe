package com.chatwire.realtime.chat.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public class NotificationRepository {

    public record NotificationRow(
            String id,
            String userId,
            String notificationType,
            String title,
            String body,
            String chatId,
            String messageId,
            String callId,
            boolean read,
            Instant createdAt
    ) {
    }

    private final JdbcTemplate jdbcTemplate;

    public NotificationRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public NotificationRow insert(
            String userId,
            String notificationType,
            String title,
            String body,
            String chatId,
            String messageId,
            String callId
    ) {
        var id = "n_" + UUID.randomUUID();
        var now = Instant.now();
        var sql = """
                insert into notification(
                        id, user_id, notification_type, title, body, chat_id, message_id, call_id, is_read, created_at
                ) values (?, ?, ?, ?, ?, ?, ?, ?, false, ?)
                """;
        jdbcTemplate.update(sql, id, userId, notificationType, title, body, chatId, messageId, callId, Timestamp.from(now));
        return new NotificationRow(id, userId, notificationType, title, body, chatId, messageId, callId, false, now);
    }

    public List<NotificationRow> listForUser(String userId, int limit) {
        var sql = """
                select id, user_id, notification_type, title, body, chat_id, message_id, call_id, is_read, created_at
                from notification
                where user_id = ?
                order by created_at desc
                limit ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new NotificationRow(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("notification_type"),
                rs.getString("title"),
                rs.getString("body"),
                rs.getString("chat_id"),
                rs.getString("message_id"),
                rs.getString("call_id"),
                rs.getBoolean("is_read"),
                rs.getTimestamp("created_at").toInstant()
        ), userId, limit);
    }
}
