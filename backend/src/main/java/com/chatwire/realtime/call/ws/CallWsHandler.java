package com.chatwire.realtime.call.ws;

import com.chatwire.realtime.auth.service.jwt.JwtClaims;
import com.chatwire.realtime.auth.service.jwt.JwtService;
import com.chatwire.realtime.call.repo.CallRepository;
import com.chatwire.realtime.chat.service.PresenceService;
import com.chatwire.realtime.chat.ws.ChatEvents;
import com.chatwire.realtime.chat.ws.Connection;
import com.chatwire.realtime.chat.ws.Topic;
import com.chatwire.realtime.chat.ws.TopicBroker;
import com.chatwire.realtime.chat.ws.TopicWsHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

import java.util.Optional;

/**
 * {@code /ws/call/{call_id}}: the caller and the receiver only.
 */
@Component
public class CallWsHandler extends TopicWsHandler {

    private final CallRepository callRepository;
    private final CallSignalRelay relay;

    public CallWsHandler(
            ObjectMapper objectMapper,
            JwtService jwtService,
            TopicBroker broker,
            PresenceService presenceService,
            ChatEvents events,
            CallRepository callRepository,
            CallSignalRelay relay,
            @Value("${app.ws.send-time-limit-ms:5000}") int sendTimeLimitMs,
            @Value("${app.ws.send-buffer-size-limit:524288}") int bufferSizeLimit
    ) {
        super(objectMapper, jwtService, broker, presenceService, events, sendTimeLimitMs, bufferSizeLimit);
        this.callRepository = callRepository;
        this.relay = relay;
    }

    @Override
    protected Optional<Topic> authorize(WebSocketSession session, JwtClaims claims) {
        var callId = lastPathSegment(session.getUri());
        if (callId == null) return Optional.empty();
        return callRepository.findById(callId)
                .filter(call -> call.isParticipant(claims.userId()))
                .map(call -> Topic.call(call.id()));
    }

    @Override
    protected void onFrame(Connection connection, JsonNode root) {
        relay.relay(connection, root);
    }

    @Override
    protected void onClosed(Connection connection) {
        relay.userLeft(connection);
    }
}
