package com.chatrelay.server.ws;

import com.chatrelay.common.codec.MessageCodec;
import com.chatrelay.common.codec.MessageCodecException;
import com.chatrelay.common.model.ChatMessage;
import com.chatrelay.common.transport.TransportReadException;
import com.chatrelay.server.session.ChatSession;
import com.chatrelay.server.session.SessionManager;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Set;

/**
 * Bridges Spring WebSocket callbacks to the session engine:
 * - connection established: start a session and keep it in the socket attributes
 * - text frame: decode, validate, hand to the session's InboundPump
 * - end-of-stream frame: clean end of the inbound half; queued replies still go out
 * - transport error / close: end the inbound half (clean or faulted by close code)
 */
@Component
public class ChatHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(ChatHandler.class);

    static final String SESSION_ATTR = "chat.session";

    private final SessionManager sessions;
    private final MessageCodec codec;
    private final Validator validator;

    public ChatHandler(SessionManager sessions, MessageCodec codec, Validator validator) {
        this.sessions = sessions;
        this.codec = codec;
        this.validator = validator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession ws) {
        ChatSession session = sessions.startSession(new WebSocketTransport(ws, codec));
        ws.getAttributes().put(SESSION_ATTR, session);
    }

    @Override
    protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
        ChatSession session = sessionOf(ws);
        if (session == null) return;

        if (MessageCodec.isEndOfStream(message.getPayload())) {
            session.inbound().onEnd();
            return;
        }

        ChatMessage cm;
        try {
            cm = codec.decode(message.getPayload());
        } catch (MessageCodecException e) {
            log.warn("[WARN] conn={} {}", session.id(), e.getMessage());
            return;
        }

        Set<ConstraintViolation<ChatMessage>> violations = validator.validate(cm);
        if (!violations.isEmpty()) {
            log.warn("[WARN] conn={} validation failed: {}", session.id(), violations);
            return;
        }

        session.inbound().onMessage(cm);
    }

    @Override
    public void handleTransportError(WebSocketSession ws, Throwable exception) {
        ChatSession session = sessionOf(ws);
        if (session == null) return;
        session.inbound().onError(new TransportReadException("transport error", exception));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
        ChatSession session = sessionOf(ws);
        if (session == null) return;
        if (isCleanClose(status)) {
            session.inbound().onEnd();
        } else {
            session.inbound().onError(new TransportReadException("closed with status " + status));
        }
    }

    static boolean isCleanClose(CloseStatus status) {
        int code = status.getCode();
        return code == CloseStatus.NORMAL.getCode()
                || code == CloseStatus.GOING_AWAY.getCode()
                || code == CloseStatus.NO_STATUS_CODE.getCode();
    }

    private static ChatSession sessionOf(WebSocketSession ws) {
        Object s = ws.getAttributes().get(SESSION_ATTR);
        return s instanceof ChatSession cs ? cs : null;
    }
}
