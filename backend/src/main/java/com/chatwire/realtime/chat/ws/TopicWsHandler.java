package com.chatwire.realtime.chat.ws;

import com.chatwire.realtime.auth.service.jwt.JwtClaims;
import com.chatwire.realtime.auth.service.jwt.JwtService;
import com.chatwire.realtime.chat.service.PresenceService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared connection lifecycle for topic-bound endpoints:
 * {@code CONNECTING -> AUTHORIZED -> ACTIVE -> CLOSED}.
 * <p>
 * The token comes from the {@code token} query parameter or an {@code Authorization: Bearer} header.
 * Authorization failures close with {@link CloseStatus#POLICY_VIOLATION} before anything is subscribed or
 * persisted. Subclasses resolve the topic and handle inbound frames.
 */
public abstract class TopicWsHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TopicWsHandler.class);

    protected final ObjectMapper objectMapper;
    protected final JwtService jwtService;
    protected final TopicBroker broker;
    protected final PresenceService presenceService;
    protected final ChatEvents events;

    private final int sendTimeLimitMs;
    private final int bufferSizeLimit;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    protected TopicWsHandler(
            ObjectMapper objectMapper,
            JwtService jwtService,
            TopicBroker broker,
            PresenceService presenceService,
            ChatEvents events,
            int sendTimeLimitMs,
            int bufferSizeLimit
    ) {
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.broker = broker;
        this.presenceService = presenceService;
        this.events = events;
        this.sendTimeLimitMs = Math.max(100, sendTimeLimitMs);
        this.bufferSizeLimit = Math.max(1024, bufferSizeLimit);
        broker.addDropListener(this::cleanup);
    }

    /**
     * @return the topic this user may join, or empty to reject the handshake
     */
    protected abstract Optional<Topic> authorize(WebSocketSession session, JwtClaims claims);

    protected abstract void onFrame(Connection connection, JsonNode root);

    protected void onClosed(Connection connection) {
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        var token = resolveToken(session).orElse(null);
        if (token == null) {
            log.debug("ws_handshake_rejected sessionId={} reason=missing_token", session.getId());
            closeQuietly(session, CloseStatus.POLICY_VIOLATION);
            return;
        }

        final JwtClaims claims;
        try {
            claims = jwtService.parse(token);
        } catch (JwtException | IllegalArgumentException ex) {
            log.debug("ws_handshake_rejected sessionId={} reason=invalid_token", session.getId());
            closeQuietly(session, CloseStatus.POLICY_VIOLATION);
            return;
        }

        final Topic topic;
        try {
            topic = authorize(session, claims).orElse(null);
        } catch (DataAccessException ex) {
            log.warn("ws_handshake_store_unavailable sessionId={} userId={}", session.getId(), claims.userId(), ex);
            closeQuietly(session, CloseStatus.SERVER_ERROR);
            return;
        }
        if (topic == null) {
            log.debug("ws_handshake_rejected sessionId={} userId={} reason=forbidden", session.getId(), claims.userId());
            closeQuietly(session, CloseStatus.POLICY_VIOLATION);
            return;
        }

        var connection = new Connection(session.getId(), claims.userId(), claims.label(), topic);
        connection.transition(ConnectionState.CONNECTING, ConnectionState.AUTHORIZED);
        connections.put(connection.id(), connection);

        broker.register(new WebSocketSubscriber(session, sendTimeLimitMs, bufferSizeLimit));
        broker.subscribe(topic, connection.id());
        presenceService.connected(connection);

        if (!connection.transition(ConnectionState.AUTHORIZED, ConnectionState.ACTIVE) || !session.isOpen()) {
            // closed while the handshake was in flight
            cleanup(session.getId());
            presenceService.disconnected(connection);
            return;
        }
        log.debug("ws_connected connectionId={} userId={} topic={}", connection.id(), connection.userId(), topic);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        var connection = connections.get(session.getId());
        if (connection == null || !connection.isActive()) return;

        final String rid = "ws_" + session.getId() + "_" + System.nanoTime();
        final JsonNode root;
        try {
            root = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            log.debug("ws_malformed_frame rid={} connectionId={}", rid, connection.id());
            return;
        }
        if (root == null || !root.isObject()) return;

        try {
            onFrame(connection, root);
        } catch (DataAccessException ex) {
            log.warn("ws_store_unavailable rid={} connectionId={} payload={}", rid, connection.id(), safeOneLine(message.getPayload()), ex);
            broker.sendTo(connection.id(), events.error("store_unavailable", rid));
        } catch (IllegalArgumentException ex) {
            broker.sendTo(connection.id(), events.error(ex.getMessage(), rid));
        } catch (Exception ex) {
            log.warn("ws_internal_error rid={} connectionId={} payload={}", rid, connection.id(), safeOneLine(message.getPayload()), ex);
            broker.sendTo(connection.id(), events.error("ws_internal_error", rid));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("ws_transport_error sessionId={} error={}", session.getId(), exception.toString());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        cleanup(session.getId());
    }

    private void cleanup(String connectionId) {
        broker.unregister(connectionId);
        var connection = connections.remove(connectionId);
        if (connection == null) return;
        var previous = connection.close();
        presenceService.disconnected(connection);
        if (previous == ConnectionState.ACTIVE) {
            onClosed(connection);
        }
    }

    public Optional<Connection> connection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public int activeConnectionCount() {
        return connections.size();
    }

    private Optional<String> resolveToken(WebSocketSession session) {
        var token = parseQueryParams(session.getUri()).get("token");
        if (token != null && !token.isBlank()) return Optional.of(token);
        var headers = session.getHandshakeHeaders();
        if (headers == null) return Optional.empty();
        return JwtService.extractBearerToken(headers.getFirst(HttpHeaders.AUTHORIZATION));
    }

    protected static String lastPathSegment(URI uri) {
        if (uri == null || uri.getPath() == null) return null;
        var path = uri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        var idx = path.lastIndexOf('/');
        var segment = idx < 0 ? path : path.substring(idx + 1);
        return segment.isBlank() ? null : urlDecode(segment);
    }

    static Map<String, String> parseQueryParams(URI uri) {
        if (uri == null || uri.getRawQuery() == null || uri.getRawQuery().isBlank()) {
            return Map.of();
        }
        var out = new HashMap<String, String>();
        for (var pair : uri.getRawQuery().split("&")) {
            if (pair == null || pair.isBlank()) continue;
            var idx = pair.indexOf('=');
            var key = urlDecode(idx < 0 ? pair : pair.substring(0, idx));
            var val = urlDecode(idx < 0 ? "" : pair.substring(idx + 1));
            if (key != null && !key.isBlank()) {
                out.put(key, val == null ? "" : val);
            }
        }
        return out;
    }

    private static String urlDecode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session != null && session.isOpen()) {
                session.close(status);
            }
        } catch (Exception ex) {
            log.debug("ws_close_failed sessionId={}", session.getId(), ex);
        }
    }

    private static String safeOneLine(String s) {
        if (s == null) return "";
        var x = s.replaceAll("[\\r\\n\\t]", " ");
        return x.length() > 500 ? x.substring(0, 500) + "..." : x;
    }
}
