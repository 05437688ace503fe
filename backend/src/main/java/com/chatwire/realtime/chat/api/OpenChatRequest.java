package com.chatwire.realtime.chat.api;

public record OpenChatRequest(String before_message_id) {
}
