package com.chatwire.realtime.chat.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class ChatRepository {

    public record ChatRow(String id, String chatType, String name, Instant createdAt) {
    }

    private final JdbcTemplate jdbcTemplate;

    public ChatRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ChatRow> findChat(String chatId) {
        var sql = "select id, chat_type, name, created_at from chat where id = ?";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new ChatRow(
                rs.getString("id"),
                rs.getString("chat_type"),
                rs.getString("name"),
                rs.getTimestamp("created_at").toInstant()
        ), chatId);
        return list.stream().findFirst();
    }

    public boolean isParticipant(String chatId, String userId) {
        var sql = """
                select count(1)
                from chat_participant
                where chat_id = ?
                  and user_id = ?
                """;
        Integer count = jdbcTemplate.queryForObject(sql, Integer.class, chatId, userId);
        return count != null && count > 0;
    }

    public List<String> listParticipantIds(String chatId) {
        var sql = """
                select user_id
                from chat_participant
                where chat_id = ?
                order by joined_at asc, user_id asc
                """;
        return jdbcTemplate.queryForList(sql, String.class, chatId);
    }

    public List<String> listChatIdsForUser(String userId) {
        var sql = """
                select chat_id
                from chat_participant
                where user_id = ?
                """;
        return jdbcTemplate.queryForList(sql, String.class, userId);
    }
}
