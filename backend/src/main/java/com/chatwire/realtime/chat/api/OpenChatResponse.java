package com.chatwire.realtime.chat.api;

import java.util.List;

public record OpenChatResponse(
        String chat_id,
        List<String> message_ids,
        int marked_read,
        String read_at
) {
}
