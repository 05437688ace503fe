package com.chatwire.realtime.chat.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of events to topic subscribers.
 * <p>
 * Subscriber sets are only mutated inside {@code compute} on their topic key, which serializes
 * subscribe/unsubscribe per topic. {@link #publish} snapshots the set and writes outside the lock;
 * each subscriber keeps its own ordered send queue, so publishes from one thread arrive in order.
 * A failed write drops the subscriber from every topic, notifies the drop listeners and closes its transport.
 * The listeners run whether or not the transport still delivers a close callback.
 */
@Component
public class TopicBroker {

    private static final Logger log = LoggerFactory.getLogger(TopicBroker.class);

    private final ObjectMapper objectMapper;

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final Map<Topic, Map<String, Subscriber>> topicSubscribers = new ConcurrentHashMap<>();
    private final Map<String, Set<Topic>> connectionTopics = new ConcurrentHashMap<>();
    private final List<Consumer<String>> dropListeners = new CopyOnWriteArrayList<>();

    private final Counter deliveries;
    private final Counter droppedSubscribers;

    public TopicBroker(ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.objectMapper = objectMapper;

        // Low-cardinality metrics: never tag by topic or user.
        this.deliveries = Counter.builder("chatwire.broker.deliveries")
                .description("Frames written to subscribers")
                .register(meterRegistry);
        this.droppedSubscribers = Counter.builder("chatwire.broker.dropped_subscribers")
                .description("Subscribers dropped after a failed or closed write")
                .register(meterRegistry);
    }

    /**
     * Called with the connection id of every subscriber the broker drops on its own.
     */
    public void addDropListener(Consumer<String> listener) {
        if (listener == null) return;
        dropListeners.add(listener);
    }

    public void register(Subscriber subscriber) {
        if (subscriber == null) return;
        subscribers.put(subscriber.connectionId(), subscriber);
    }

    /**
     * Removes the connection from every topic it joined.
     *
     * @return the topics the connection was subscribed to
     */
    public Set<Topic> unregister(String connectionId) {
        if (connectionId == null) return Set.of();
        subscribers.remove(connectionId);
        var joined = connectionTopics.remove(connectionId);
        if (joined == null || joined.isEmpty()) return Set.of();
        for (var topic : joined) {
            removeFromTopic(topic, connectionId);
        }
        return Set.copyOf(joined);
    }

    public boolean subscribe(Topic topic, String connectionId) {
        if (topic == null || connectionId == null) return false;
        var subscriber = subscribers.get(connectionId);
        if (subscriber == null) return false;

        topicSubscribers.compute(topic, (t, current) -> {
            var next = current == null ? new ConcurrentHashMap<String, Subscriber>() : current;
            next.put(connectionId, subscriber);
            return next;
        });
        connectionTopics.computeIfAbsent(connectionId, k -> ConcurrentHashMap.newKeySet()).add(topic);
        return true;
    }

    public void unsubscribe(Topic topic, String connectionId) {
        if (topic == null || connectionId == null) return;
        var joined = connectionTopics.get(connectionId);
        if (joined != null) {
            joined.remove(topic);
        }
        removeFromTopic(topic, connectionId);
    }

    private void removeFromTopic(Topic topic, String connectionId) {
        topicSubscribers.computeIfPresent(topic, (t, current) -> {
            current.remove(connectionId);
            return current.isEmpty() ? null : current;
        });
    }

    /**
     * Delivers {@code event} to every subscriber of {@code topic} except {@code excludeConnectionId}.
     * Never throws on transport failure.
     *
     * @return number of subscribers the frame was written to
     */
    public int publish(Topic topic, JsonNode event, String excludeConnectionId) {
        if (topic == null || event == null) return 0;
        var current = topicSubscribers.get(topic);
        if (current == null || current.isEmpty()) return 0;

        var snapshot = new ArrayList<>(current.values());
        var frame = encode(event);
        if (frame == null) return 0;

        int delivered = 0;
        for (var subscriber : snapshot) {
            if (subscriber.connectionId().equals(excludeConnectionId)) continue;
            if (deliver(subscriber, frame, topic)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Writes directly to one connection, e.g. an error frame for the originating client.
     */
    public boolean sendTo(String connectionId, JsonNode event) {
        if (connectionId == null || event == null) return false;
        var subscriber = subscribers.get(connectionId);
        if (subscriber == null) return false;
        var frame = encode(event);
        return frame != null && deliver(subscriber, frame, null);
    }

    private boolean deliver(Subscriber subscriber, String frame, Topic topic) {
        if (!subscriber.isOpen()) {
            drop(subscriber, topic, null);
            return false;
        }
        try {
            subscriber.send(frame);
            deliveries.increment();
            return true;
        } catch (Exception ex) {
            drop(subscriber, topic, ex);
            return false;
        }
    }

    private boolean drop(Subscriber subscriber, Topic topic, Exception cause) {
        var connectionId = subscriber.connectionId();
        if (topic != null) {
            removeFromTopic(topic, connectionId);
        }
        if (!subscribers.remove(connectionId, subscriber)) {
            // already unregistered by a concurrent writer or the close callback
            return false;
        }
        if (cause != null) {
            log.debug("ws_delivery_failed connectionId={} topic={} error={}", connectionId, topic, cause.toString());
        }
        unregister(connectionId);
        droppedSubscribers.increment();
        for (var listener : dropListeners) {
            try {
                listener.accept(connectionId);
            } catch (RuntimeException ex) {
                log.warn("ws_drop_listener_failed connectionId={}", connectionId, ex);
            }
        }
        subscriber.close();
        return true;
    }

    /**
     * Lazily collects subscribers whose transport closed without a disconnect callback.
     *
     * @return number of subscribers removed
     */
    public int sweepClosed() {
        int removed = 0;
        for (var subscriber : new ArrayList<>(subscribers.values())) {
            if (subscriber.isOpen()) continue;
            if (drop(subscriber, null, null)) {
                removed++;
            }
        }
        return removed;
    }

    public Set<String> subscriberIds(Topic topic) {
        var current = topicSubscribers.get(topic);
        if (current == null) return Collections.emptySet();
        return Set.copyOf(current.keySet());
    }

    public Set<Topic> topicsOf(String connectionId) {
        var joined = connectionTopics.get(connectionId);
        if (joined == null) return Collections.emptySet();
        return Set.copyOf(joined);
    }

    public int topicCount() {
        return topicSubscribers.size();
    }

    public List<String> registeredConnectionIds() {
        return List.copyOf(subscribers.keySet());
    }

    private String encode(JsonNode event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            log.warn("ws_encode_failed type={}", event.path("type").asText(""), ex);
            return null;
        }
    }
}
