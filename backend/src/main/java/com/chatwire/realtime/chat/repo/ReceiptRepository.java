package com.chatwire.realtime.chat.repo;

import com.chatwire.realtime.chat.service.ReceiptStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class ReceiptRepository {

    public record ReceiptRow(
            String messageId,
            String userId,
            ReceiptStatus status,
            Instant deliveredAt,
            Instant readAt
    ) {
    }

    private static final RowMapper<ReceiptRow> ROW_MAPPER = (rs, rowNum) -> {
        var deliveredAt = rs.getTimestamp("delivered_at");
        var readAt = rs.getTimestamp("read_at");
        return new ReceiptRow(
                rs.getString("message_id"),
                rs.getString("user_id"),
                ReceiptStatus.fromDb(rs.getString("status")),
                deliveredAt == null ? null : deliveredAt.toInstant(),
                readAt == null ? null : readAt.toInstant()
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public ReceiptRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertSentReceipts(String messageId, List<String> userIds) {
        if (userIds == null || userIds.isEmpty()) return;
        var sql = "insert into message_receipt(message_id, user_id, status) values (?, ?, ?)";
        var args = new ArrayList<Object[]>(userIds.size());
        for (var userId : userIds) {
            args.add(new Object[]{messageId, userId, ReceiptStatus.SENT.dbValue()});
        }
        jdbcTemplate.batchUpdate(sql, args);
    }

    public Optional<ReceiptRow> find(String messageId, String userId) {
        var sql = """
                select message_id, user_id, status, delivered_at, read_at
                from message_receipt
                where message_id = ?
                  and user_id = ?
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, messageId, userId).stream().findFirst();
    }

    public List<ReceiptRow> listForMessage(String messageId) {
        var sql = """
                select message_id, user_id, status, delivered_at, read_at
                from message_receipt
                where message_id = ?
                order by user_id asc
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, messageId);
    }

    /**
     * Moves one receipt forward to {@code target}. The timestamp column of the target state is only
     * written if it is still null, and rows already at or past {@code target} are untouched.
     *
     * @return rows updated (0 or 1)
     */
    public int advance(String messageId, String userId, ReceiptStatus target, Instant at) {
        if (target == ReceiptStatus.SENT) return 0;
        var column = target == ReceiptStatus.READ ? "read_at" : "delivered_at";
        var from = target.predecessors();
        var placeholders = String.join(",", from.stream().map((x) -> "?").toList());
        var sql = "update message_receipt set status = ?, " + column + " = coalesce(" + column + ", ?)"
                + " where message_id = ? and user_id = ? and status in (" + placeholders + ")";

        var args = new ArrayList<Object>();
        args.add(target.dbValue());
        args.add(Timestamp.from(at));
        args.add(messageId);
        args.add(userId);
        for (var s : from) {
            args.add(s.dbValue());
        }
        return jdbcTemplate.update(sql, args.toArray());
    }

    public int advanceToDelivered(String messageId, String userId, Instant at) {
        return advance(messageId, userId, ReceiptStatus.DELIVERED, at);
    }

    public int advanceToRead(String messageId, String userId, Instant at) {
        return advance(messageId, userId, ReceiptStatus.READ, at);
    }

    /**
     * Unread (sent or delivered) receipts of {@code userId} in a chat, for messages the user did not send,
     * created at or before {@code upTo}.
     */
    public List<String> listUnreadMessageIds(String chatId, String userId, Instant upTo) {
        var sql = """
                select r.message_id
                from message_receipt r
                join message m on m.id = r.message_id
                where m.chat_id = ?
                  and m.sender_id <> ?
                  and m.created_at <= ?
                  and r.user_id = ?
                  and r.status in ('sent', 'delivered')
                order by m.created_at asc, m.id asc
                """;
        return jdbcTemplate.queryForList(sql, String.class, chatId, userId, Timestamp.from(upTo), userId);
    }

    /**
     * Marks the same receipts {@link #listUnreadMessageIds} selects as read, in one statement.
     * Receipts already read keep their {@code read_at}.
     *
     * @return rows updated
     */
    public int bulkMarkRead(String chatId, String userId, Instant upTo, Instant readAt) {
        var sql = """
                update message_receipt
                set status = 'read',
                    read_at = coalesce(read_at, ?)
                where user_id = ?
                  and status in ('sent', 'delivered')
                  and message_id in (
                      select m.id
                      from message m
                      where m.chat_id = ?
                        and m.sender_id <> ?
                        and m.created_at <= ?
                  )
                """;
        return jdbcTemplate.update(sql, Timestamp.from(readAt), userId, chatId, userId, Timestamp.from(upTo));
    }

    /**
     * Inserts the {@code sent} receipts a message is missing, one per participant other than the sender.
     * Safe to repeat.
     */
    public int reconcileMessage(String messageId) {
        var sql = """
                insert into message_receipt(message_id, user_id, status)
                select m.id, p.user_id, 'sent'
                from message m
                join chat_participant p on p.chat_id = m.chat_id
                where m.id = ?
                  and p.user_id <> m.sender_id
                  and not exists (
                      select 1 from message_receipt r
                      where r.message_id = m.id
                        and r.user_id = p.user_id
                  )
                """;
        return jdbcTemplate.update(sql, messageId);
    }

    /**
     * Same as {@link #reconcileMessage} for every message created after {@code since}.
     */
    public int reconcileMissing(Instant since) {
        var sql = """
                insert into message_receipt(message_id, user_id, status)
                select m.id, p.user_id, 'sent'
                from message m
                join chat_participant p on p.chat_id = m.chat_id
                where m.created_at >= ?
                  and p.user_id <> m.sender_id
                  and not exists (
                      select 1 from message_receipt r
                      where r.message_id = m.id
                        and r.user_id = p.user_id
                  )
                """;
        return jdbcTemplate.update(sql, Timestamp.from(since));
    }
}
