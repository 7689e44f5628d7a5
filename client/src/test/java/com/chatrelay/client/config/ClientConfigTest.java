package com.chatrelay.client.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClientConfigTest {

    @Test
    void defaultsWhenNoArgs() {
        ClientConfig cfg = ClientConfig.fromArgs(new String[0]);

        assertThat(cfg.url()).isEqualTo("ws://localhost:8080/chat");
        assertThat(cfg.sender()).isEqualTo("Client");
        assertThat(cfg.sentinel()).isEqualTo("exit");
        assertThat(cfg.mailboxCapacity()).isEqualTo(128);
        assertThat(cfg.connectTimeoutMs()).isEqualTo(5000L);
    }

    @Test
    void positionalArgsOverrideDefaults() {
        ClientConfig cfg = ClientConfig.fromArgs(new String[]{"ws://host:9000/chat", "alice", "quit", "16", "250"});

        assertThat(cfg).isEqualTo(new ClientConfig("ws://host:9000/chat", "alice", "quit", 16, 250L));
    }
}
