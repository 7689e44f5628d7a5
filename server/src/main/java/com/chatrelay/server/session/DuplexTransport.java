package com.chatrelay.server.session;

import com.chatrelay.common.model.ChatMessage;
import com.chatrelay.common.transport.TransportWriteException;

/**
 * Send side of one duplex session. The receive side is pushed into the session's
 * {@link InboundPump} by whatever adapter owns the connection.
 */
public interface DuplexTransport {

    /** Writes one message. Called by a single pump thread at a time. */
    void send(ChatMessage message) throws TransportWriteException;

    boolean isOpen();

    /** Closes the underlying connection. Safe to call more than once. */
    void close();

    /** Peer description for log lines. */
    String describe();
}
