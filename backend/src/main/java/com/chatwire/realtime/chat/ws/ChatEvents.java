package com.chatwire.realtime.chat.ws;

import com.chatwire.realtime.chat.repo.MessageRepository;
import com.chatwire.realtime.chat.repo.NotificationRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Builds outbound frames, one method per event type. Timestamps are ISO-8601 strings.
 */
@Component
public class ChatEvents {

    private final ObjectMapper objectMapper;

    public ChatEvents(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode chatMessage(MessageRepository.MessageRow row, String senderName) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put("id", row.id());
        message.put("chat_id", row.chatId());
        message.put("sender_id", row.senderId());
        message.put("sender_name", senderName == null ? "" : senderName);
        message.put("content", row.content());
        message.put("message_type", row.messageType());
        message.put("created_at", iso(row.createdAt()));
        if (row.replyToId() == null) {
            message.putNull("reply_to");
        } else {
            message.put("reply_to", row.replyToId());
        }
        if (row.clientMsgId() != null) {
            message.put("client_msg_id", row.clientMsgId());
        }

        ObjectNode evt = event(EventType.CHAT_MESSAGE);
        evt.set("message", message);
        return evt;
    }

    public ObjectNode typingIndicator(String userId, String userName, boolean typing) {
        ObjectNode evt = event(EventType.TYPING_INDICATOR);
        evt.put("user_id", userId);
        evt.put("user_name", userName == null ? "" : userName);
        evt.put("is_typing", typing);
        return evt;
    }

    public ObjectNode userStatus(String userId, boolean online, Instant lastSeen) {
        ObjectNode evt = event(EventType.USER_STATUS);
        evt.put("user_id", userId);
        evt.put("is_online", online);
        evt.put("last_seen", iso(lastSeen));
        return evt;
    }

    public ObjectNode readReceipt(String messageId, String userId, Instant readAt) {
        ObjectNode evt = event(EventType.READ_RECEIPT);
        evt.put("message_id", messageId);
        evt.put("user_id", userId);
        evt.put("read_at", iso(readAt));
        return evt;
    }

    public ObjectNode deliveryReceipt(String messageId, String userId, Instant deliveredAt) {
        ObjectNode evt = event(EventType.DELIVERY_RECEIPT);
        evt.put("message_id", messageId);
        evt.put("user_id", userId);
        evt.put("delivered_at", iso(deliveredAt));
        return evt;
    }

    public ObjectNode messagesRead(String chatId, String userId, List<String> messageIds, Instant readAt) {
        ObjectNode evt = event(EventType.MESSAGES_READ);
        evt.put("chat_id", chatId);
        evt.put("user_id", userId);
        var ids = evt.putArray("message_ids");
        for (var id : messageIds) {
            ids.add(id);
        }
        evt.put("read_at", iso(readAt));
        return evt;
    }

    public ObjectNode messageDeleted(String messageId, boolean forEveryone, String userId) {
        ObjectNode evt = event(EventType.MESSAGE_DELETED);
        evt.put("message_id", messageId);
        evt.put("delete_for_everyone", forEveryone);
        evt.put("user_id", userId);
        return evt;
    }

    public ObjectNode reaction(String messageId, String userId, String emoji, String action) {
        ObjectNode evt = event(EventType.REACTION);
        evt.put("message_id", messageId);
        evt.put("user_id", userId);
        evt.put("emoji", emoji);
        evt.put("action", action);
        return evt;
    }

    public ObjectNode notification(NotificationRepository.NotificationRow row) {
        ObjectNode n = objectMapper.createObjectNode();
        n.put("id", row.id());
        n.put("notification_type", row.notificationType());
        n.put("title", row.title());
        n.put("body", row.body());
        if (row.chatId() != null) n.put("chat_id", row.chatId());
        if (row.messageId() != null) n.put("message_id", row.messageId());
        if (row.callId() != null) n.put("call_id", row.callId());
        n.put("is_read", row.read());
        n.put("created_at", iso(row.createdAt()));

        ObjectNode evt = event(EventType.NOTIFICATION);
        evt.set("notification", n);
        return evt;
    }

    public ObjectNode error(String code, String rid) {
        ObjectNode evt = event(EventType.ERROR);
        evt.put("code", code);
        if (rid != null && !rid.isBlank()) {
            evt.put("rid", rid);
        }
        return evt;
    }

    private ObjectNode event(EventType type) {
        ObjectNode evt = objectMapper.createObjectNode();
        evt.put("type", type.wireName());
        return evt;
    }

    static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
