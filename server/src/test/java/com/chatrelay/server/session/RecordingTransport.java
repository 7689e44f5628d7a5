package com.chatrelay.server.session;

import com.chatrelay.common.model.ChatMessage;
import com.chatrelay.common.transport.TransportWriteException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

class RecordingTransport implements DuplexTransport {

    private final List<ChatMessage> sent = new ArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failWrites;
    private volatile int closeCalls;

    @Override
    public synchronized void send(ChatMessage message) throws TransportWriteException {
        if (failWrites) throw new TransportWriteException("broken pipe");
        sent.add(message);
        notifyAll();
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public synchronized void close() {
        open = false;
        closeCalls++;
        notifyAll();
    }

    @Override
    public String describe() {
        return "recording";
    }

    void failWrites() {
        failWrites = true;
    }

    /** Peer went away without us closing. */
    void drop() {
        open = false;
    }

    synchronized List<ChatMessage> sent() {
        return new ArrayList<>(sent);
    }

    int closeCalls() {
        return closeCalls;
    }

    synchronized boolean awaitSent(int n, long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (sent.size() < n) {
            long left = deadline - System.nanoTime();
            if (left <= 0) return false;
            TimeUnit.NANOSECONDS.timedWait(this, left);
        }
        return true;
    }

    synchronized boolean awaitClosed(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (open) {
            long left = deadline - System.nanoTime();
            if (left <= 0) return false;
            TimeUnit.NANOSECONDS.timedWait(this, left);
        }
        return true;
    }
}
