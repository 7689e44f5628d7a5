package com.chatrelay.server.session;

import com.chatrelay.common.mailbox.Mailbox;
import com.chatrelay.common.model.ChatMessage;
import com.chatrelay.common.transport.TransportWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drains one connection's mailbox to its transport.
 * <p>
 * Runs as a task on the shared executor only while there is work: the mailbox signal schedules
 * it, and at most one run per connection is in flight, so writes leave in enqueue order. An idle
 * connection holds no thread.
 */
public class OutboundPump implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(OutboundPump.class);

    static final int MAX_BATCH = 32;

    private final ConnectionHandle handle;
    private final DuplexTransport transport;
    private final ConnectionRegistry registry;
    private final Executor executor;

    private final AtomicBoolean scheduled = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final AtomicLong written = new AtomicLong();

    public OutboundPump(ConnectionHandle handle,
                        DuplexTransport transport,
                        ConnectionRegistry registry,
                        Executor executor) {
        this.handle = handle;
        this.transport = transport;
        this.registry = registry;
        this.executor = executor;
    }

    public void start() {
        handle.mailbox().onSignal(this::signal);
        signal();
    }

    void signal() {
        if (finished.get()) return;
        if (!scheduled.compareAndSet(false, true)) return;
        try {
            executor.execute(this);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            log.warn("[WARN] conn={} outbound executor rejected task: {}", handle.id(), e.getMessage());
            finish("executor shut down");
        }
    }

    @Override
    public void run() {
        Mailbox<ChatMessage> mailbox = handle.mailbox();
        try {
            for (int n = 0; n < MAX_BATCH; n++) {
                ChatMessage msg = mailbox.poll();
                if (msg == null) break;
                if (!transport.isOpen()) {
                    int discarded = 1 + mailbox.clear();
                    log.info("[DISCARD] conn={} peer gone, {} queued message(s) dropped", handle.id(), discarded);
                    finish("peer gone");
                    return;
                }
                transport.send(msg);
                written.incrementAndGet();
            }
            if (mailbox.isDrained()) {
                finish("mailbox closed");
                return;
            }
        } catch (TransportWriteException e) {
            log.warn("[WARN] conn={} write failed: {}", handle.id(), e.getMessage());
            finish("write error");
            return;
        } catch (RuntimeException e) {
            log.error("[ERROR] conn={} outbound pump failed", handle.id(), e);
            finish("pump error");
            return;
        }

        scheduled.set(false);
        // an offer or close may have landed after the last poll
        if (!mailbox.isEmpty() || mailbox.isClosed()) {
            signal();
        }
    }

    public boolean isFinished() {
        return finished.get();
    }

    public long written() {
        return written.get();
    }

    private void finish(String reason) {
        if (!finished.compareAndSet(false, true)) return;
        registry.deregister(handle.id());
        handle.beginClosing();
        handle.mailbox().close();
        transport.close();
        log.info("[LEAVE] conn={} reason={} written={} remaining={}",
                handle.id(), reason, written.get(), registry.size());
        handle.pumpExited();
    }
}
