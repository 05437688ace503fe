package com.chatwire.realtime.chat.ws;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One live client connection. Holds identifiers only; the broker owns the topic to subscriber mapping.
 */
public final class Connection {

    private final String id;
    private final String userId;
    private final String displayName;
    private final Topic topic;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);

    public Connection(String id, String userId, String displayName, Topic topic) {
        this.id = id;
        this.userId = userId;
        this.displayName = displayName;
        this.topic = topic;
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    public String displayName() {
        return displayName;
    }

    public Topic topic() {
        return topic;
    }

    public ConnectionState state() {
        return state.get();
    }

    public boolean isActive() {
        return state.get() == ConnectionState.ACTIVE;
    }

    public boolean transition(ConnectionState from, ConnectionState to) {
        return state.compareAndSet(from, to);
    }

    /**
     * @return the state the connection was in before closing
     */
    public ConnectionState close() {
        return state.getAndSet(ConnectionState.CLOSED);
    }

    @Override
    public String toString() {
        return "Connection{" + id + ", user=" + userId + ", topic=" + topic + ", state=" + state.get() + "}";
    }
}
