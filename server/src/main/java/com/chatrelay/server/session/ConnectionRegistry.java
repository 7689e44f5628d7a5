package com.chatrelay.server.session;

import com.chatrelay.common.mailbox.OfferResult;
import com.chatrelay.common.model.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks every live {@link ConnectionHandle}. Membership changes only at session start and end;
 * {@link #broadcast} works on a snapshot and never holds a lock while offering.
 */
@Component
public class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, ConnectionHandle> connections = new ConcurrentHashMap<>();

    public String register(ConnectionHandle handle) {
        ConnectionHandle prev = connections.putIfAbsent(handle.id(), handle);
        if (prev != null && prev != handle) {
            throw new IllegalStateException("connection id already registered: " + handle.id());
        }
        return handle.id();
    }

    /** @return true if the id was registered; deregistering an absent id is a no-op */
    public boolean deregister(String id) {
        if (id == null) return false;
        return connections.remove(id) != null;
    }

    public Optional<ConnectionHandle> lookup(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(connections.get(id));
    }

    public BroadcastReport broadcast(ChatMessage message) {
        List<ConnectionHandle> snapshot = new ArrayList<>(connections.values());
        int delivered = 0, dropped = 0, gone = 0;
        for (ConnectionHandle handle : snapshot) {
            OfferResult r = handle.mailbox().offer(message);
            switch (r) {
                case ACCEPTED -> delivered++;
                case DROPPED_FULL -> {
                    dropped++;
                    log.warn("[DROP] conn={} mailbox full, broadcast message dropped", handle.id());
                }
                case CLOSED -> {
                    gone++;
                    log.debug("[GONE] conn={} closed before broadcast delivery", handle.id());
                }
            }
        }
        return new BroadcastReport(snapshot.size(), delivered, dropped, gone);
    }

    public int size() {
        return connections.size();
    }

    public Set<String> ids() {
        return Set.copyOf(connections.keySet());
    }
}
