package com.chatwire.realtime.call.ws;

import com.chatwire.realtime.chat.ws.Connection;
import com.chatwire.realtime.chat.ws.TopicBroker;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Forwards signaling frames to the other members of a call topic. Payloads are neither inspected nor stored.
 */
@Component
public class CallSignalRelay {

    private static final Logger log = LoggerFactory.getLogger(CallSignalRelay.class);

    private final TopicBroker broker;
    private final CallEvents events;

    public CallSignalRelay(TopicBroker broker, CallEvents events) {
        this.broker = broker;
        this.events = events;
    }

    /**
     * @return subscribers reached, 0 for unknown frame types
     */
    public int relay(Connection connection, JsonNode root) {
        if (connection == null || !connection.isActive() || root == null) return 0;
        var type = SignalType.fromWire(root.path("type").asText(null)).orElse(null);
        if (type == null) {
            log.debug("call_unknown_frame connectionId={} type={}", connection.id(), root.path("type").asText(""));
            return 0;
        }

        var evt = switch (type) {
            case OFFER, ANSWER, ICE_CANDIDATE -> events.signal(type, connection.userId(), root.get("data"));
        };
        return broker.publish(connection.topic(), evt, connection.id());
    }

    public int userLeft(Connection connection) {
        if (connection == null) return 0;
        return broker.publish(connection.topic(), events.userLeft(connection.userId()), connection.id());
    }
}
