package com.chatrelay.server.ws;

import com.chatrelay.common.codec.MessageCodec;
import com.chatrelay.common.model.ChatMessage;
import com.chatrelay.common.transport.TransportWriteException;
import com.chatrelay.server.session.DuplexTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

/**
 * {@link DuplexTransport} over a Spring {@link WebSocketSession}, one JSON text frame per message.
 */
public class WebSocketTransport implements DuplexTransport {
    private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

    private final WebSocketSession session;
    private final MessageCodec codec;

    public WebSocketTransport(WebSocketSession session, MessageCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    @Override
    public void send(ChatMessage message) throws TransportWriteException {
        if (!session.isOpen()) {
            throw new TransportWriteException("session " + session.getId() + " is closed");
        }
        try {
            session.sendMessage(new TextMessage(codec.encode(message)));
        } catch (IOException | IllegalStateException e) {
            throw new TransportWriteException("send failed on session " + session.getId(), e);
        }
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void close() {
        if (!session.isOpen()) return;
        try {
            session.close(CloseStatus.NORMAL);
        } catch (IOException e) {
            log.warn("[WARN] close failed session={} {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public String describe() {
        return session.getRemoteAddress() == null ? session.getId() : String.valueOf(session.getRemoteAddress());
    }
}
