package com.chatwire.realtime.chat.ws;

import com.chatwire.realtime.auth.service.jwt.JwtClaims;
import com.chatwire.realtime.auth.service.jwt.JwtService;
import com.chatwire.realtime.chat.repo.ChatRepository;
import com.chatwire.realtime.chat.service.PresenceService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Optional;

/**
 * {@code /ws/chat/{chat_id}}: participants of an existing chat only.
 */
@Component
public class ChatWsHandler extends TopicWsHandler {

    private final ChatRepository chatRepository;
    private final ChatFrameDispatcher dispatcher;

    public ChatWsHandler(
            ObjectMapper objectMapper,
            JwtService jwtService,
            TopicBroker broker,
            PresenceService presenceService,
            ChatEvents events,
            ChatRepository chatRepository,
            ChatFrameDispatcher dispatcher,
            @Value("${app.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.ws.send-buffer-size-limit:524288}") int bufferSizeLimit
    ) {
        super(objectMapper, jwtService, broker, presenceService, events, sendTimeLimitMs, bufferSizeLimit);
        this.chatRepository = chatRepository;
        this.dispatcher = dispatcher;
    }

    @Override
    protected Optional<Topic> authorize(WebSocketSession session, JwtClaims claims) {
        var chatId = lastPathSegment(session.getUri());
        if (chatId == null) return Optional.empty();
        if (chatRepository.findChat(chatId).isEmpty()) return Optional.empty();
        if (!chatRepository.isParticipant(chatId, claims.userId())) return Optional.empty();
        return Optional.of(Topic.chat(chatId));
    }

    @Override
    protected void onFrame(Connection connection, JsonNode root) {
        dispatcher.dispatch(connection, root);
    }
}
