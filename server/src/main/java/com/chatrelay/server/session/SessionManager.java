package com.chatrelay.server.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Entry point for the transport layer: opens sessions on connect and tears them down on
 * administrative request.
 */
public class SessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private final ConnectionRegistry registry;
    private final Executor outboundExecutor;
    private final int mailboxCapacity;
    private final String serverIdentity;

    public SessionManager(ConnectionRegistry registry,
                          Executor outboundExecutor,
                          int mailboxCapacity,
                          String serverIdentity) {
        this.registry = registry;
        this.outboundExecutor = outboundExecutor;
        this.mailboxCapacity = mailboxCapacity;
        this.serverIdentity = serverIdentity;
    }

    public ChatSession startSession(DuplexTransport transport) {
        ConnectionHandle handle = new ConnectionHandle(UUID.randomUUID().toString(), mailboxCapacity);
        registry.register(handle);

        OutboundPump outbound = new OutboundPump(handle, transport, registry, outboundExecutor);
        InboundPump inbound = new InboundPump(handle, serverIdentity);
        outbound.start();

        log.info("[JOIN] conn={} peer={} total={}", handle.id(), transport.describe(), registry.size());
        return new ChatSession(handle, inbound, outbound);
    }

    /**
     * Closes the session's mailbox; its outbound pump drains what is queued, deregisters it and
     * closes the transport. Unknown ids are ignored.
     *
     * @return true if this call started the teardown
     */
    public boolean shutdownSession(String id) {
        Optional<ConnectionHandle> found = registry.lookup(id);
        if (found.isEmpty()) {
            log.debug("[SHUTDOWN] conn={} not registered", id);
            return false;
        }
        ConnectionHandle handle = found.get();
        handle.beginClosing();
        boolean closed = handle.mailbox().close();
        if (closed) {
            log.info("[SHUTDOWN] conn={} draining {} queued message(s)", id, handle.mailbox().size());
        }
        return closed;
    }

    public int activeSessions() {
        return registry.size();
    }

    public ConnectionRegistry registry() {
        return registry;
    }
}
