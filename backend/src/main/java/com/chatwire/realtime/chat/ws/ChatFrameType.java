package com.chatwire.realtime.chat.ws;

import java.util.Optional;

/**
 * Inbound frame types accepted on a chat connection.
 */
public enum ChatFrameType {
    CHAT_MESSAGE("chat_message"),
    TYPING("typing"),
    READ_RECEIPT("read_receipt"),
    DELETE_MESSAGE("delete_message"),
    DELIVERED("delivered"),
    REACTION("reaction");

    private final String wireName;

    ChatFrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ChatFrameType> fromWire(String type) {
        if (type == null || type.isBlank()) return Optional.empty();
        for (var value : values()) {
            if (value.wireName.equals(type)) return Optional.of(value);
        }
        return Optional.empty();
    }
}
