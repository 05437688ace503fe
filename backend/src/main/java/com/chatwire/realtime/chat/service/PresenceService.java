package com.chatwire.realtime.chat.service;

import com.chatwire.realtime.chat.repo.ChatRepository;
import com.chatwire.realtime.chat.repo.UserPresenceRepository;
import com.chatwire.realtime.chat.ws.ChatEvents;
import com.chatwire.realtime.chat.ws.Connection;
import com.chatwire.realtime.chat.ws.SessionRegistry;
import com.chatwire.realtime.chat.ws.Topic;
import com.chatwire.realtime.chat.ws.TopicBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns registry transitions into persisted presence and {@code user_status} events.
 * <p>
 * Each user has a queue of pending transitions drained by one thread at a time, so a user's updates are
 * persisted and published in order. The per-user state is only touched inside {@code compute}; store calls
 * and publishes run outside it. A transition is skipped when a newer one was already applied, when the
 * registry no longer agrees with it, or when it repeats the last published state. State of a user who is
 * offline with nothing pending is dropped.
 * <p>
 * The registry stays authoritative: a failed persist is logged and the event is still published.
 */
@Service
public class PresenceService {

    private static final Logger log = LoggerFactory.getLogger(PresenceService.class);

    private static final class UserState {
        private final Deque<SessionRegistry.PresenceChange> pending = new ArrayDeque<>();
        private long appliedSequence;
        private boolean online;
        private boolean draining;
    }

    private record Update(String userId, boolean online, Instant at) {
    }

    private final SessionRegistry sessionRegistry;
    private final UserPresenceRepository presenceRepository;
    private final ChatRepository chatRepository;
    private final TopicBroker broker;
    private final ChatEvents events;

    private final Map<String, UserState> states = new ConcurrentHashMap<>();

    public PresenceService(
            SessionRegistry sessionRegistry,
            UserPresenceRepository presenceRepository,
            ChatRepository chatRepository,
            TopicBroker broker,
            ChatEvents events
    ) {
        this.sessionRegistry = sessionRegistry;
        this.presenceRepository = presenceRepository;
        this.chatRepository = chatRepository;
        this.broker = broker;
        this.events = events;
    }

    public SessionRegistry.PresenceChange connected(Connection connection) {
        var change = sessionRegistry.register(connection.userId(), connection);
        apply(change);
        return change;
    }

    /**
     * Safe to call more than once for the same connection.
     */
    public SessionRegistry.PresenceChange disconnected(Connection connection) {
        var change = sessionRegistry.unregister(connection);
        apply(change);
        return change;
    }

    public boolean isOnline(String userId) {
        return sessionRegistry.isOnline(userId);
    }

    int trackedUserCount() {
        return states.size();
    }

    private void apply(SessionRegistry.PresenceChange change) {
        if (change == null || !change.changed()) return;
        var userId = change.userId();

        var drainer = new boolean[1];
        states.compute(userId, (uid, current) -> {
            var state = current == null ? new UserState() : current;
            state.pending.add(change);
            if (!state.draining) {
                state.draining = true;
                drainer[0] = true;
            }
            return state;
        });
        // Another thread, or an outer frame of this one, is already draining this user.
        if (!drainer[0]) return;

        Update next;
        while ((next = takeNext(userId)) != null) {
            try {
                publish(next);
            } catch (RuntimeException ex) {
                log.warn("presence_publish_failed userId={} online={}", userId, next.online(), ex);
            }
        }
    }

    /**
     * @return the next update to publish, or null once the queue is empty and draining has stopped
     */
    private Update takeNext(String userId) {
        var result = new Update[1];
        states.compute(userId, (uid, state) -> {
            if (state == null) return null;
            SessionRegistry.PresenceChange change;
            while ((change = state.pending.poll()) != null) {
                var online = change.transition() == SessionRegistry.Transition.ONLINE;
                if (change.sequence() < state.appliedSequence) {
                    log.debug("presence_stale_transition userId={} seq={} applied={}", uid, change.sequence(), state.appliedSequence);
                    continue;
                }
                if (online != sessionRegistry.isOnline(uid)) {
                    // superseded; the later transition is queued or about to be
                    continue;
                }
                state.appliedSequence = change.sequence();
                if (online == state.online) continue;
                state.online = online;
                result[0] = new Update(uid, online, Instant.now());
                return state;
            }
            state.draining = false;
            return state.online ? state : null;
        });
        return result[0];
    }

    private void publish(Update update) {
        var userId = update.userId();
        try {
            presenceRepository.updatePresence(userId, update.online(), update.at());
        } catch (DataAccessException ex) {
            log.warn("presence_persist_failed userId={} online={}", userId, update.online(), ex);
        }

        List<String> chatIds;
        try {
            chatIds = chatRepository.listChatIdsForUser(userId);
        } catch (DataAccessException ex) {
            log.warn("presence_chats_lookup_failed userId={} online={}", userId, update.online(), ex);
            return;
        }

        var evt = events.userStatus(userId, update.online(), update.at());
        for (var chatId : chatIds) {
            broker.publish(Topic.chat(chatId), evt, null);
        }
    }
}
