package com.chatwire.realtime.chat.repo;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

@Repository
public class UserPresenceRepository {

    public record PresenceRow(String userId, boolean online, Instant lastSeen) {
    }

    private final JdbcTemplate jdbcTemplate;

    public UserPresenceRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public int updatePresence(String userId, boolean online, Instant lastSeen) {
        var sql = "update users set is_online = ?, last_seen = ? where id = ?";
        return jdbcTemplate.update(sql, online, Timestamp.from(lastSeen), userId);
    }

    public Optional<PresenceRow> find(String userId) {
        var sql = "select id, is_online, last_seen from users where id = ?";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> {
            var lastSeen = rs.getTimestamp("last_seen");
            return new PresenceRow(
                    rs.getString("id"),
                    rs.getBoolean("is_online"),
                    lastSeen == null ? null : lastSeen.toInstant()
            );
        }, userId);
        return list.stream().findFirst();
    }

    public boolean exists(String userId) {
        Integer count = jdbcTemplate.queryForObject("select count(1) from users where id = ?", Integer.class, userId);
        return count != null && count > 0;
    }
}
