package com.chatwire.realtime.chat.ws;

import com.chatwire.realtime.auth.service.jwt.JwtClaims;
import com.chatwire.realtime.auth.service.jwt.JwtService;
import com.chatwire.realtime.chat.service.PresenceService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Optional;

/**
 * {@code /ws/notifications}: the caller's own {@code user:<id>} topic. Outbound only.
 */
@Component
public class NotificationWsHandler extends TopicWsHandler {

    public NotificationWsHandler(
            ObjectMapper objectMapper,
            JwtService jwtService,
            TopicBroker broker,
            PresenceService presenceService,
            ChatEvents events,
            @Value("${app.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.ws.send-buffer-size-limit:524288}") int bufferSizeLimit
    ) {
        super(objectMapper, jwtService, broker, presenceService, events, sendTimeLimitMs, bufferSizeLimit);
    }

    @Override
    protected Optional<Topic> authorize(WebSocketSession session, JwtClaims claims) {
        return Optional.of(Topic.user(claims.userId()));
    }

    @Override
    protected void onFrame(Connection connection, JsonNode root) {
        // inbound frames are ignored
    }
}
