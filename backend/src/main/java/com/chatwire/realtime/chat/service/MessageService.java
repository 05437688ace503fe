package com.chatwire.realtime.chat.service;

import com.chatwire.realtime.chat.repo.ChatRepository;
import com.chatwire.realtime.chat.repo.MessageRepository;
import com.chatwire.realtime.chat.repo.ReceiptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    public static final String TOMBSTONE_TEXT = "This message was deleted";
    public static final int MAX_CONTENT_LENGTH = 4096;

    private final ChatRepository chatRepository;
    private final MessageRepository messageRepository;
    private final ReceiptRepository receiptRepository;
    private final Duration deleteForEveryoneWindow;

    public MessageService(
            ChatRepository chatRepository,
            MessageRepository messageRepository,
            ReceiptRepository receiptRepository,
            @Value("${app.message.delete-for-everyone-window-minutes:60}") long deleteWindowMinutes
    ) {
        this.chatRepository = chatRepository;
        this.messageRepository = messageRepository;
        this.receiptRepository = receiptRepository;
        this.deleteForEveryoneWindow = Duration.ofMinutes(Math.max(0, deleteWindowMinutes));
    }

    /**
     * @param recipientIds participants that received a {@code sent} receipt; empty for a replayed send
     */
    public record SendResult(MessageRepository.MessageRow message, boolean inserted, List<String> recipientIds) {
    }

    public record DeleteResult(String messageId, String chatId, boolean forEveryone) {
    }

    /**
     * Persists a text message and its receipts. The message commits on its own; receipt rows follow in one
     * batch, retried once through the reconcile statement and otherwise left to
     * {@link ReceiptReconcileScheduler}.
     *
     * @return empty if the sender is no longer a participant of the chat
     */
    public Optional<SendResult> sendText(
            String chatId,
            String senderId,
            String content,
            String replyToId,
            String clientMsgId
    ) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("missing_content");
        }
        if (content.length() > MAX_CONTENT_LENGTH) {
            throw new IllegalArgumentException("content_too_long");
        }
        if (!chatRepository.isParticipant(chatId, senderId)) {
            return Optional.empty();
        }

        var replyTo = resolveReplyTo(chatId, replyToId);
        var insert = messageRepository.insertTextMessage(chatId, senderId, content, replyTo, clientMsgId);
        if (!insert.inserted()) {
            return Optional.of(new SendResult(insert.row(), false, List.of()));
        }

        var messageId = insert.row().id();
        var recipients = chatRepository.listParticipantIds(chatId).stream()
                .filter(id -> !id.equals(senderId))
                .toList();
        try {
            receiptRepository.insertSentReceipts(messageId, recipients);
        } catch (DataAccessException ex) {
            log.warn("receipt_batch_failed messageId={} recipients={}", messageId, recipients.size(), ex);
            try {
                var fixed = receiptRepository.reconcileMessage(messageId);
                log.info("receipt_batch_reconciled messageId={} inserted={}", messageId, fixed);
            } catch (DataAccessException retryEx) {
                log.warn("receipt_reconcile_deferred messageId={}", messageId, retryEx);
            }
        }
        return Optional.of(new SendResult(insert.row(), true, recipients));
    }

    // A reply target outside this chat is dropped rather than rejected.
    private String resolveReplyTo(String chatId, String replyToId) {
        if (replyToId == null || replyToId.isBlank()) return null;
        return messageRepository.findById(replyToId)
                .filter(m -> chatId.equals(m.chatId()))
                .map(MessageRepository.MessageRow::id)
                .orElse(null);
    }

    /**
     * Delete for everyone: only the sender, only within the window, only once.
     * Delete for me: any participant, once per user.
     *
     * @return empty when nothing changed
     */
    public Optional<DeleteResult> deleteMessage(String chatId, String userId, String messageId, boolean forEveryone) {
        var message = messageRepository.findById(messageId)
                .filter(m -> m.chatId().equals(chatId))
                .orElse(null);
        if (message == null) return Optional.empty();

        if (forEveryone) {
            if (!message.senderId().equals(userId)) {
                log.debug("delete_rejected_not_sender messageId={} userId={}", messageId, userId);
                return Optional.empty();
            }
            if (!withinDeleteWindow(message.createdAt(), Instant.now())) {
                log.debug("delete_rejected_window messageId={} createdAt={}", messageId, message.createdAt());
                return Optional.empty();
            }
            if (messageRepository.tombstone(messageId, TOMBSTONE_TEXT) == 0) {
                return Optional.empty();
            }
            return Optional.of(new DeleteResult(messageId, chatId, true));
        }

        if (!chatRepository.isParticipant(chatId, userId)) return Optional.empty();
        if (!messageRepository.hideForUser(messageId, userId)) return Optional.empty();
        return Optional.of(new DeleteResult(messageId, chatId, false));
    }

    public boolean withinDeleteWindow(Instant createdAt, Instant now) {
        if (createdAt == null || now == null) return false;
        return Duration.between(createdAt, now).compareTo(deleteForEveryoneWindow) <= 0;
    }
}
