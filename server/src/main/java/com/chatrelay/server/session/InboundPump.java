package com.chatrelay.server.session;

import com.chatrelay.common.mailbox.OfferResult;
import com.chatrelay.common.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes one connection's inbound stream. The transport adapter feeds it events in arrival
 * order; each message is answered on the same connection's mailbox.
 */
public class InboundPump {
    private static final Logger log = LoggerFactory.getLogger(InboundPump.class);

    static final String REPLY_PREFIX = "Server : ";

    private final ConnectionHandle handle;
    private final String serverIdentity;
    private final AtomicBoolean terminated = new AtomicBoolean();
    private final AtomicLong received = new AtomicLong();

    public InboundPump(ConnectionHandle handle, String serverIdentity) {
        this.handle = handle;
        this.serverIdentity = serverIdentity;
    }

    public void onMessage(ChatMessage msg) {
        if (terminated.get()) {
            log.debug("[IGNORED] conn={} message after end of stream", handle.id());
            return;
        }
        received.incrementAndGet();
        OfferResult r = handle.mailbox().offer(reply(msg, serverIdentity));
        log.info("[RECV] conn={} Received message: {} from {}", handle.id(), msg.message(), msg.from());
        if (r == OfferResult.DROPPED_FULL) {
            log.warn("[DROP] conn={} mailbox full, reply dropped", handle.id());
        } else if (r == OfferResult.CLOSED) {
            log.debug("[DROP] conn={} mailbox closed, reply discarded", handle.id());
        }
    }

    /** Clean end of stream. */
    public void onEnd() {
        if (!terminated.compareAndSet(false, true)) return;
        log.info("[END] conn={} Chat session ended, received={}", handle.id(), received.get());
        finish();
    }

    /** Faulted end of stream. Contained to this connection. */
    public void onError(Throwable error) {
        if (!terminated.compareAndSet(false, true)) return;
        log.warn("[ERROR] conn={} Error receiving message: {}", handle.id(), String.valueOf(error));
        finish();
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    public long received() {
        return received.get();
    }

    private void finish() {
        handle.beginClosing();
        // wakes the outbound pump, which drains what is left and then exits
        handle.mailbox().close();
        handle.pumpExited();
    }

    static ChatMessage reply(ChatMessage in, String serverIdentity) {
        return ChatMessage.of(REPLY_PREFIX + in.message(), serverIdentity);
    }
}
