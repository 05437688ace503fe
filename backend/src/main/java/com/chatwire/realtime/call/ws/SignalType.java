package com.chatwire.realtime.call.ws;

import java.util.Optional;

/**
 * WebRTC signaling frames relayed between call participants.
 */
public enum SignalType {
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice_candidate");

    private final String wireName;

    SignalType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SignalType> fromWire(String type) {
        if (type == null || type.isBlank()) return Optional.empty();
        for (var value : values()) {
            if (value.wireName.equals(type)) return Optional.of(value);
        }
        return Optional.empty();
    }
}
