package com.chatrelay.server.session;

import com.chatrelay.common.mailbox.Mailbox;
import com.chatrelay.common.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live duplex session: its outbound mailbox and lifecycle state.
 * Producers are the session's own InboundPump and the admin broadcast; the only consumer is
 * the session's OutboundPump.
 */
public class ConnectionHandle {
    private static final Logger log = LoggerFactory.getLogger(ConnectionHandle.class);

    static final int PUMPS = 2;

    private final String id;
    private final Mailbox<ChatMessage> mailbox;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.OPEN);
    private final AtomicInteger livePumps = new AtomicInteger(PUMPS);

    public ConnectionHandle(String id, int mailboxCapacity) {
        this(id, new Mailbox<>(mailboxCapacity));
    }

    public ConnectionHandle(String id, Mailbox<ChatMessage> mailbox) {
        this.id = id;
        this.mailbox = mailbox;
    }

    public String id() {
        return id;
    }

    public Mailbox<ChatMessage> mailbox() {
        return mailbox;
    }

    public ConnectionState state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    /** OPEN -> CLOSING. No-op in any other state. */
    public boolean beginClosing() {
        return state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSING);
    }

    /**
     * Called once by each pump as it exits. The second call marks the handle CLOSED and
     * releases whatever is still queued.
     */
    void pumpExited() {
        int left = livePumps.decrementAndGet();
        if (left > 0) {
            beginClosing();
            return;
        }
        if (left == 0) {
            state.set(ConnectionState.CLOSED);
            mailbox.close();
            int discarded = mailbox.clear();
            log.info("[CLOSED] conn={} discarded={}", id, discarded);
        }
    }

    @Override
    public String toString() {
        return "ConnectionHandle{" + id + ", " + state.get() + ", queued=" + mailbox.size() + "}";
    }
}
