package com.chatwire.realtime.chat.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * Wraps a socket in a bounded, ordered send queue. A send that exceeds the time or buffer limit
 * fails and the broker drops the subscriber.
 */
public class WebSocketSubscriber implements Subscriber {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSubscriber.class);

    private final WebSocketSession session;

    public WebSocketSubscriber(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(
                session,
                sendTimeLimitMs,
                bufferSizeLimit,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.TERMINATE
        );
    }

    @Override
    public String connectionId() {
        return session.getId();
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String frame) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("session_closed");
        }
        try {
            session.sendMessage(new TextMessage(frame));
        } catch (SessionLimitExceededException ex) {
            throw new IOException("send_limit_exceeded", ex);
        }
    }

    @Override
    public void close() {
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.SESSION_NOT_RELIABLE);
            }
        } catch (IOException ex) {
            log.debug("ws_close_failed sessionId={}", session.getId(), ex);
        }
    }
}
