package com.chatwire.realtime.chat.ws;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Live connections per user, reference counted. Only the first connection of a user reports
 * {@link Transition#ONLINE} and only the last one to leave reports {@link Transition#OFFLINE}.
 */
@Component
public class SessionRegistry {

    public enum Transition {
        ONLINE,
        OFFLINE,
        NONE
    }

    /**
     * @param sequence per-user counter stamped under the user's lock, used to discard stale transitions
     */
    public record PresenceChange(String userId, Transition transition, long sequence) {
        public boolean changed() {
            return transition != Transition.NONE;
        }
    }

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public PresenceChange register(String userId, Connection connection) {
        if (userId == null || userId.isBlank() || connection == null) {
            throw new IllegalArgumentException("invalid_connection");
        }
        connections.put(connection.id(), connection);

        var result = new PresenceChange[]{new PresenceChange(userId, Transition.NONE, 0)};
        userConnections.compute(userId, (uid, current) -> {
            var next = current == null ? ConcurrentHashMap.<String>newKeySet() : current;
            var wasEmpty = next.isEmpty();
            if (next.add(connection.id()) && wasEmpty) {
                result[0] = new PresenceChange(uid, Transition.ONLINE, sequence.incrementAndGet());
            }
            return next;
        });
        return result[0];
    }

    public PresenceChange unregister(Connection connection) {
        if (connection == null) return new PresenceChange(null, Transition.NONE, 0);
        var removed = connections.remove(connection.id());
        var userId = removed != null ? removed.userId() : connection.userId();
        if (userId == null) return new PresenceChange(null, Transition.NONE, 0);

        var result = new PresenceChange[]{new PresenceChange(userId, Transition.NONE, 0)};
        userConnections.computeIfPresent(userId, (uid, current) -> {
            if (current.remove(connection.id()) && current.isEmpty()) {
                result[0] = new PresenceChange(uid, Transition.OFFLINE, sequence.incrementAndGet());
            }
            return current.isEmpty() ? null : current;
        });
        return result[0];
    }

    public boolean isOnline(String userId) {
        if (userId == null) return false;
        var current = userConnections.get(userId);
        return current != null && !current.isEmpty();
    }

    public Set<Connection> connectionsFor(String userId) {
        if (userId == null) return Collections.emptySet();
        var current = userConnections.get(userId);
        if (current == null || current.isEmpty()) return Collections.emptySet();
        return current.stream()
                .map(connections::get)
                .filter(c -> c != null)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Optional<Connection> get(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(connections.get(connectionId));
    }

    public int onlineUserCount() {
        return userConnections.size();
    }
}
