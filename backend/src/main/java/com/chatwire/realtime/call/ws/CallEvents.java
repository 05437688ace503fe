package com.chatwire.realtime.call.ws;

import com.chatwire.realtime.call.repo.CallRepository;
import com.chatwire.realtime.chat.ws.EventType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class CallEvents {

    private final ObjectMapper objectMapper;

    public CallEvents(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * {@code data} is forwarded as received.
     */
    public ObjectNode signal(SignalType type, String userId, JsonNode data) {
        ObjectNode evt = objectMapper.createObjectNode();
        evt.put("type", type.wireName());
        evt.put("user_id", userId);
        if (data == null || data.isMissingNode()) {
            evt.putNull("data");
        } else {
            evt.set("data", data);
        }
        return evt;
    }

    public ObjectNode userLeft(String userId) {
        ObjectNode evt = objectMapper.createObjectNode();
        evt.put("type", EventType.USER_LEFT.wireName());
        evt.put("user_id", userId);
        return evt;
    }

    public ObjectNode callStatus(CallRepository.CallRow call) {
        ObjectNode evt = objectMapper.createObjectNode();
        evt.put("type", EventType.CALL_STATUS.wireName());
        evt.put("call_id", call.id());
        evt.put("status", call.status().dbValue());
        evt.put("caller_id", call.callerId());
        evt.put("receiver_id", call.receiverId());
        evt.put("call_type", call.callType());
        evt.put("started_at", iso(call.startedAt()));
        evt.put("answered_at", iso(call.answeredAt()));
        evt.put("ended_at", iso(call.endedAt()));
        evt.put("duration", call.durationSeconds());
        return evt;
    }

    private static String iso(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
