package com.chatwire.realtime.chat.service;

import com.chatwire.realtime.chat.repo.ChatRepository;
import com.chatwire.realtime.chat.repo.MessageRepository;
import com.chatwire.realtime.chat.repo.ReceiptRepository;
import com.chatwire.realtime.chat.ws.ChatEvents;
import com.chatwire.realtime.chat.ws.Topic;
import com.chatwire.realtime.chat.ws.TopicBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

@Service
public class ReceiptService {

    private static final Logger log = LoggerFactory.getLogger(ReceiptService.class);

    private final ChatRepository chatRepository;
    private final MessageRepository messageRepository;
    private final ReceiptRepository receiptRepository;
    private final TopicBroker broker;
    private final ChatEvents events;

    public ReceiptService(
            ChatRepository chatRepository,
            MessageRepository messageRepository,
            ReceiptRepository receiptRepository,
            TopicBroker broker,
            ChatEvents events
    ) {
        this.chatRepository = chatRepository;
        this.messageRepository = messageRepository;
        this.receiptRepository = receiptRepository;
        this.broker = broker;
        this.events = events;
    }

    public record OpenChatResult(String chatId, String userId, List<String> messageIds, Instant readAt) {
    }

    private void afterCommit(Runnable r) {
        if (r == null) return;
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    try {
                        r.run();
                    } catch (Exception ex) {
                        log.warn("after_commit_publish_failed", ex);
                    }
                }
            });
        } else {
            r.run();
        }
    }

    /**
     * Advances the user's receipt for a message of this chat to {@code read}.
     *
     * @return the receipt after the update; empty if the user has no receipt for that message
     */
    public Optional<ReceiptRepository.ReceiptRow> markRead(String chatId, String userId, String messageId) {
        if (!belongsToChat(chatId, messageId)) return Optional.empty();
        var existing = receiptRepository.find(messageId, userId);
        if (existing.isEmpty()) return Optional.empty();

        receiptRepository.advanceToRead(messageId, userId, Instant.now());
        return receiptRepository.find(messageId, userId);
    }

    /**
     * Advances a {@code sent} receipt to {@code delivered}. Never moves a read receipt back.
     *
     * @return the receipt only if this call performed the transition
     */
    public Optional<ReceiptRepository.ReceiptRow> markDelivered(String chatId, String userId, String messageId) {
        if (!belongsToChat(chatId, messageId)) return Optional.empty();
        var updated = receiptRepository.advanceToDelivered(messageId, userId, Instant.now());
        if (updated == 0) return Optional.empty();
        return receiptRepository.find(messageId, userId);
    }

    /**
     * Marks every unread receipt of {@code userId} in the chat as read in one transaction, then publishes a
     * single {@code messages_read} event after commit.
     *
     * @param beforeMessageId optional upper bound, inclusive, by creation time
     */
    @Transactional
    public OpenChatResult openChat(String chatId, String userId, String beforeMessageId) {
        chatRepository.findChat(chatId).orElseThrow(() -> new IllegalArgumentException("chat_not_found"));
        if (!chatRepository.isParticipant(chatId, userId)) {
            throw new IllegalArgumentException("forbidden");
        }

        var now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        var upTo = now;
        if (beforeMessageId != null && !beforeMessageId.isBlank()) {
            upTo = messageRepository.findById(beforeMessageId)
                    .filter(m -> m.chatId().equals(chatId))
                    .map(MessageRepository.MessageRow::createdAt)
                    .orElseThrow(() -> new IllegalArgumentException("message_not_found"));
        }

        var ids = receiptRepository.listUnreadMessageIds(chatId, userId, upTo);
        if (ids.isEmpty()) {
            return new OpenChatResult(chatId, userId, List.of(), now);
        }
        receiptRepository.bulkMarkRead(chatId, userId, upTo, now);

        var evt = events.messagesRead(chatId, userId, ids, now);
        afterCommit(() -> broker.publish(Topic.chat(chatId), evt, null));
        return new OpenChatResult(chatId, userId, ids, now);
    }

    private boolean belongsToChat(String chatId, String messageId) {
        if (messageId == null || messageId.isBlank()) return false;
        return messageRepository.findById(messageId)
                .map(m -> m.chatId().equals(chatId))
                .orElse(false);
    }
}
