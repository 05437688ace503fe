package com.chatwire.realtime.chat.ws;

import java.io.IOException;

/**
 * Outbound side of a connection as seen by the broker.
 * Implementations must keep frames sent from one thread in order.
 */
public interface Subscriber {

    String connectionId();

    boolean isOpen();

    void send(String frame) throws IOException;

    void close();
}
