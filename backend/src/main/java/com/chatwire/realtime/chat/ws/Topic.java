package com.chatwire.realtime.chat.ws;

/**
 * Fan-out channel key: {@code chat:<chat_id>}, {@code call:<call_id>} or {@code user:<user_id>}.
 */
public record Topic(Kind kind, String id) {

    public enum Kind {
        CHAT("chat"),
        CALL("call"),
        USER("user");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        public String prefix() {
            return prefix;
        }
    }

    public Topic {
        if (kind == null) throw new IllegalArgumentException("missing_topic_kind");
        if (id == null || id.isBlank()) throw new IllegalArgumentException("missing_topic_id");
    }

    public static Topic chat(String chatId) {
        return new Topic(Kind.CHAT, chatId);
    }

    public static Topic call(String callId) {
        return new Topic(Kind.CALL, callId);
    }

    public static Topic user(String userId) {
        return new Topic(Kind.USER, userId);
    }

    public String key() {
        return kind.prefix() + ":" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
