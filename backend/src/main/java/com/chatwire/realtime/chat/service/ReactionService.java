package com.chatwire.realtime.chat.service;

import com.chatwire.realtime.chat.repo.MessageRepository;
import com.chatwire.realtime.chat.repo.ReactionRepository;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class ReactionService {

    public static final int MAX_EMOJI_LENGTH = 16;

    private final MessageRepository messageRepository;
    private final ReactionRepository reactionRepository;

    public ReactionService(MessageRepository messageRepository, ReactionRepository reactionRepository) {
        this.messageRepository = messageRepository;
        this.reactionRepository = reactionRepository;
    }

    public record ReactionChange(String messageId, String userId, String emoji, String action) {
    }

    /**
     * Same emoji again removes the reaction; a different emoji replaces it.
     */
    public Optional<ReactionChange> toggle(String chatId, String userId, String messageId, String emoji) {
        if (emoji == null || emoji.isBlank()) {
            throw new IllegalArgumentException("missing_emoji");
        }
        if (emoji.length() > MAX_EMOJI_LENGTH) {
            throw new IllegalArgumentException("invalid_emoji");
        }
        var message = messageRepository.findById(messageId)
                .filter(m -> m.chatId().equals(chatId))
                .orElse(null);
        if (message == null || message.deletedForEveryone()) return Optional.empty();

        var existing = reactionRepository.find(messageId, userId).orElse(null);
        if (existing == null) {
            try {
                reactionRepository.insert(messageId, userId, emoji);
                return Optional.of(new ReactionChange(messageId, userId, emoji, "added"));
            } catch (DuplicateKeyException dup) {
                // a concurrent frame from another device won the insert
                reactionRepository.updateEmoji(messageId, userId, emoji);
                return Optional.of(new ReactionChange(messageId, userId, emoji, "updated"));
            }
        }
        if (existing.emoji().equals(emoji)) {
            if (reactionRepository.delete(messageId, userId) == 0) return Optional.empty();
            return Optional.of(new ReactionChange(messageId, userId, emoji, "removed"));
        }
        reactionRepository.updateEmoji(messageId, userId, emoji);
        return Optional.of(new ReactionChange(messageId, userId, emoji, "updated"));
    }
}
