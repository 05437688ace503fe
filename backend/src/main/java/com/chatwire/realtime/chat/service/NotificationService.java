package com.chatwire.realtime.chat.service;

import com.chatwire.realtime.call.repo.CallRepository;
import com.chatwire.realtime.chat.repo.MessageRepository;
import com.chatwire.realtime.chat.repo.NotificationRepository;
import com.chatwire.realtime.chat.ws.ChatEvents;
import com.chatwire.realtime.chat.ws.Topic;
import com.chatwire.realtime.chat.ws.TopicBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Persists per-user notifications and pushes them to {@code user:<id>} topics.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private static final int PREVIEW_MAX = 100;

    private final NotificationRepository notificationRepository;
    private final TopicBroker broker;
    private final ChatEvents events;

    public NotificationService(NotificationRepository notificationRepository, TopicBroker broker, ChatEvents events) {
        this.notificationRepository = notificationRepository;
        this.broker = broker;
        this.events = events;
    }

    public int notifyNewMessage(MessageRepository.MessageRow message, String senderName, List<String> recipientIds) {
        if (message == null || recipientIds == null || recipientIds.isEmpty()) return 0;
        var title = "New message from " + (senderName == null || senderName.isBlank() ? "someone" : senderName);
        var body = preview(message.content());

        int created = 0;
        for (var userId : recipientIds) {
            try {
                var row = notificationRepository.insert(userId, "message", title, body, message.chatId(), message.id(), null);
                broker.publish(Topic.user(userId), events.notification(row), null);
                created++;
            } catch (DataAccessException ex) {
                log.warn("notification_create_failed userId={} messageId={}", userId, message.id(), ex);
            }
        }
        return created;
    }

    public boolean notifyIncomingCall(CallRepository.CallRow call, String callerName) {
        if (call == null) return false;
        var who = callerName == null || callerName.isBlank() ? "someone" : callerName;
        var title = "Incoming " + call.callType() + " call";
        var body = who + " is calling you";
        try {
            var row = notificationRepository.insert(call.receiverId(), "call", title, body, null, null, call.id());
            broker.publish(Topic.user(call.receiverId()), events.notification(row), null);
            return true;
        } catch (DataAccessException ex) {
            log.warn("notification_create_failed userId={} callId={}", call.receiverId(), call.id(), ex);
            return false;
        }
    }

    static String preview(String content) {
        if (content == null) return "";
        var trimmed = content.replaceAll("\\s+", " ").trim();
        if (trimmed.length() > PREVIEW_MAX) return trimmed.substring(0, PREVIEW_MAX);
        return trimmed;
    }
}
