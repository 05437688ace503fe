package com.chatwire.realtime.chat.ws;

import com.chatwire.realtime.chat.service.MessageService;
import com.chatwire.realtime.chat.service.NotificationService;
import com.chatwire.realtime.chat.service.ReactionService;
import com.chatwire.realtime.chat.service.ReceiptService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies inbound chat frames of an ACTIVE connection. Events are published only after the store write
 * returned; store exceptions propagate to the handler.
 */
@Component
public class ChatFrameDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChatFrameDispatcher.class);

    private final MessageService messageService;
    private final ReceiptService receiptService;
    private final ReactionService reactionService;
    private final NotificationService notificationService;
    private final TopicBroker broker;
    private final ChatEvents events;

    public ChatFrameDispatcher(
            MessageService messageService,
            ReceiptService receiptService,
            ReactionService reactionService,
            NotificationService notificationService,
            TopicBroker broker,
            ChatEvents events
    ) {
        this.messageService = messageService;
        this.receiptService = receiptService;
        this.reactionService = reactionService;
        this.notificationService = notificationService;
        this.broker = broker;
        this.events = events;
    }

    public void dispatch(Connection connection, JsonNode root) {
        if (connection == null || !connection.isActive() || root == null) return;
        var type = ChatFrameType.fromWire(root.path("type").asText(null)).orElse(null);
        if (type == null) {
            log.debug("ws_unknown_frame connectionId={} type={}", connection.id(), root.path("type").asText(""));
            return;
        }

        switch (type) {
            case CHAT_MESSAGE -> handleChatMessage(connection, root);
            case TYPING -> handleTyping(connection, root);
            case READ_RECEIPT -> handleReadReceipt(connection, root);
            case DELIVERED -> handleDelivered(connection, root);
            case DELETE_MESSAGE -> handleDelete(connection, root);
            case REACTION -> handleReaction(connection, root);
        }
    }

    private void handleChatMessage(Connection connection, JsonNode root) {
        var chatId = connection.topic().id();
        var result = messageService.sendText(
                chatId,
                connection.userId(),
                root.path("content").asText(null),
                textOrNull(root, "reply_to"),
                textOrNull(root, "client_msg_id")
        ).orElse(null);
        if (result == null) {
            log.debug("ws_send_rejected connectionId={} userId={} chatId={}", connection.id(), connection.userId(), chatId);
            return;
        }
        if (!result.inserted()) {
            log.debug("ws_send_replayed messageId={} clientMsgId={}", result.message().id(), result.message().clientMsgId());
            return;
        }

        broker.publish(connection.topic(), events.chatMessage(result.message(), connection.displayName()), null);
        notificationService.notifyNewMessage(result.message(), connection.displayName(), result.recipientIds());
    }

    private void handleTyping(Connection connection, JsonNode root) {
        var typing = root.path("is_typing").asBoolean(false);
        var evt = events.typingIndicator(connection.userId(), connection.displayName(), typing);
        broker.publish(connection.topic(), evt, connection.id());
    }

    private void handleReadReceipt(Connection connection, JsonNode root) {
        var messageId = textOrNull(root, "message_id");
        if (messageId == null) return;
        receiptService.markRead(connection.topic().id(), connection.userId(), messageId)
                .ifPresent(r -> broker.publish(connection.topic(), events.readReceipt(messageId, r.userId(), r.readAt()), null));
    }

    private void handleDelivered(Connection connection, JsonNode root) {
        var messageId = textOrNull(root, "message_id");
        if (messageId == null) return;
        receiptService.markDelivered(connection.topic().id(), connection.userId(), messageId)
                .ifPresent(r -> broker.publish(
                        connection.topic(),
                        events.deliveryReceipt(messageId, r.userId(), r.deliveredAt()),
                        null
                ));
    }

    private void handleDelete(Connection connection, JsonNode root) {
        var messageId = textOrNull(root, "message_id");
        if (messageId == null) return;
        var forEveryone = root.path("delete_for_everyone").asBoolean(false);
        messageService.deleteMessage(connection.topic().id(), connection.userId(), messageId, forEveryone)
                .ifPresent(d -> broker.publish(
                        connection.topic(),
                        events.messageDeleted(d.messageId(), d.forEveryone(), connection.userId()),
                        null
                ));
    }

    private void handleReaction(Connection connection, JsonNode root) {
        var messageId = textOrNull(root, "message_id");
        if (messageId == null) return;
        reactionService.toggle(connection.topic().id(), connection.userId(), messageId, root.path("emoji").asText(null))
                .ifPresent(c -> broker.publish(
                        connection.topic(),
                        events.reaction(c.messageId(), c.userId(), c.emoji(), c.action()),
                        null
                ));
    }

    private static String textOrNull(JsonNode root, String field) {
        var node = root.get(field);
        if (node == null || node.isNull()) return null;
        var text = node.asText("");
        return text.isBlank() ? null : text;
    }
}
