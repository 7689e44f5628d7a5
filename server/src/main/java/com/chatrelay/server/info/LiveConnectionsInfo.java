package com.chatrelay.server.info;

import com.chatrelay.server.session.ConnectionRegistry;

public class LiveConnectionsInfo implements InfoProvider {

    private final ConnectionRegistry registry;

    public LiveConnectionsInfo(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String key() {
        return "Connections";
    }

    @Override
    public String value() {
        return String.valueOf(registry.size());
    }
}
