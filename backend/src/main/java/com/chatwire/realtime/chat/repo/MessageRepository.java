package com.chatwire.realtime.chat.repo;

import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

@Repository
public class MessageRepository {

    public record MessageRow(
            String id,
            String chatId,
            String senderId,
            String messageType,
            String content,
            String replyToId,
            String clientMsgId,
            boolean deleted,
            boolean deletedForEveryone,
            Instant createdAt
    ) {
    }

    public record InsertResult(MessageRow row, boolean inserted) {
    }

    private static final String COLUMNS = """
            id, chat_id, sender_id, message_type, content, reply_to, client_msg_id, is_deleted, deleted_for_everyone, created_at
            """;

    private static final RowMapper<MessageRow> ROW_MAPPER = (rs, rowNum) -> new MessageRow(
            rs.getString("id"),
            rs.getString("chat_id"),
            rs.getString("sender_id"),
            rs.getString("message_type"),
            rs.getString("content"),
            rs.getString("reply_to"),
            rs.getString("client_msg_id"),
            rs.getBoolean("is_deleted"),
            rs.getBoolean("deleted_for_everyone"),
            rs.getTimestamp("created_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public MessageRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<MessageRow> findById(String messageId) {
        if (messageId == null || messageId.isBlank()) return Optional.empty();
        var sql = "select " + COLUMNS + " from message where id = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, messageId).stream().findFirst();
    }

    public Optional<MessageRow> findByClientMsgId(String senderId, String clientMsgId) {
        var sql = "select " + COLUMNS + " from message where sender_id = ? and client_msg_id = ?";
        return jdbcTemplate.query(sql, ROW_MAPPER, senderId, clientMsgId).stream().findFirst();
    }

    /**
     * Inserts a text message. A repeated {@code clientMsgId} from the same sender returns the stored row
     * with {@code inserted=false}.
     */
    public InsertResult insertTextMessage(
            String chatId,
            String senderId,
            String content,
            String replyToId,
            String clientMsgId
    ) {
        var id = UUID.randomUUID().toString();
        // Postgres keeps microseconds; truncate so the returned row matches what a re-read yields.
        var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var safeClientMsgId = (clientMsgId == null || clientMsgId.isBlank()) ? null : clientMsgId;

        var sql = """
                insert into message(
                        id, chat_id, sender_id, message_type, content, reply_to, client_msg_id,
                        is_deleted, deleted_for_everyone, created_at
                ) values (?, ?, ?, 'text', ?, ?, ?, false, false, ?)
                """;
        try {
            jdbcTemplate.update(sql, id, chatId, senderId, content, replyToId, safeClientMsgId, Timestamp.from(now));
        } catch (DuplicateKeyException dup) {
            if (safeClientMsgId != null) {
                var existing = findByClientMsgId(senderId, safeClientMsgId)
                        .orElseThrow(() -> dup);
                return new InsertResult(existing, false);
            }
            throw dup;
        }

        var row = new MessageRow(id, chatId, senderId, "text", content, replyToId, safeClientMsgId, false, false, now);
        return new InsertResult(row, true);
    }

    /**
     * Irreversibly replaces the content. Only the first call for a message updates a row.
     */
    public int tombstone(String messageId, String replacementText) {
        var sql = """
                update message
                set content = ?,
                    is_deleted = true,
                    deleted_for_everyone = true
                where id = ?
                  and deleted_for_everyone = false
                """;
        return jdbcTemplate.update(sql, replacementText, messageId);
    }

    /**
     * Delete-for-me marker.
     *
     * @return false if the user had already hidden the message
     */
    public boolean hideForUser(String messageId, String userId) {
        var sql = "insert into deleted_message(message_id, user_id, deleted_at) values (?, ?, ?)";
        try {
            jdbcTemplate.update(sql, messageId, userId, Timestamp.from(Instant.now()));
            return true;
        } catch (DuplicateKeyException dup) {
            return false;
        }
    }

    public boolean isHiddenForUser(String messageId, String userId) {
        var sql = "select count(1) from deleted_message where message_id = ? and user_id = ?";
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, messageId, userId);
        return count != null && count > 0;
    }
}
