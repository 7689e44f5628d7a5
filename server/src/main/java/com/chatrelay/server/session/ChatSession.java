package com.chatrelay.server.session;

/**
 * What the transport layer gets back from {@link SessionManager#startSession}: the handle plus
 * the inbound pump it must feed.
 */
public record ChatSession(ConnectionHandle handle, InboundPump inbound, OutboundPump outbound) {

    public String id() {
        return handle.id();
    }
}
