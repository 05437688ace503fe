package com.chatwire.realtime.chat.ws;

public enum ConnectionState {
    CONNECTING,
    AUTHORIZED,
    ACTIVE,
    CLOSED
}
