package com.chatwire.realtime.chat.ws;

/**
 * Outbound frame types. Call signal frames reuse the inbound signal name instead.
 */
public enum EventType {
    CHAT_MESSAGE("chat_message"),
    TYPING_INDICATOR("typing_indicator"),
    USER_STATUS("user_status"),
    READ_RECEIPT("read_receipt"),
    DELIVERY_RECEIPT("delivery_receipt"),
    MESSAGES_READ("messages_read"),
    MESSAGE_DELETED("message_deleted"),
    REACTION("reaction"),
    NOTIFICATION("notification"),
    USER_LEFT("user_left"),
    CALL_STATUS("call_status"),
    ERROR("error");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
