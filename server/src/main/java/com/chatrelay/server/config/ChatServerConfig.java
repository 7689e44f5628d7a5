package com.chatrelay.server.config;

import com.chatrelay.common.codec.MessageCodec;
import com.chatrelay.common.input.ConsoleOperatorInput;
import com.chatrelay.server.admin.AdminBroadcaster;
import com.chatrelay.server.admin.AdminConsole;
import com.chatrelay.server.info.CpuInfo;
import com.chatrelay.server.info.HostnameInfo;
import com.chatrelay.server.info.JavaRuntimeInfo;
import com.chatrelay.server.info.LiveConnectionsInfo;
import com.chatrelay.server.info.OsInfo;
import com.chatrelay.server.info.ServerInfo;
import com.chatrelay.server.session.ConnectionRegistry;
import com.chatrelay.server.session.SessionManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the session engine around the {@link ConnectionRegistry} component.
 */
@Configuration
public class ChatServerConfig {
    private static final Logger log = LoggerFactory.getLogger(ChatServerConfig.class);

    @Value("${chat.mailbox.capacity:128}")
    private int mailboxCapacity;

    @Value("${chat.server.identity:Server}")
    private String serverIdentity;

    @Value("${chat.admin.identity:Server Admin}")
    private String adminIdentity;

    @Value("${chat.admin.sentinel:exit}")
    private String adminSentinel;

    @Value("${chat.admin.console-enabled:true}")
    private boolean consoleEnabled;

    @Value("${chat.outbound.threads:4}")
    private int outboundThreads;

    @Bean(destroyMethod = "shutdown")
    public ExecutorService outboundExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(outboundThreads, r -> {
            Thread t = new Thread(r, "outbound-pump-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean
    public SessionManager sessionManager(ConnectionRegistry registry, ExecutorService outboundExecutor) {
        log.info("[BOOT] session engine mailbox={} outboundThreads={} identity={}",
                mailboxCapacity, outboundThreads, serverIdentity);
        return new SessionManager(registry, outboundExecutor, mailboxCapacity, serverIdentity);
    }

    @Bean
    public AdminBroadcaster adminBroadcaster(ConnectionRegistry registry) {
        return new AdminBroadcaster(registry, adminIdentity, adminSentinel);
    }

    @Bean
    public AdminConsole adminConsole(AdminBroadcaster broadcaster) {
        return new AdminConsole(broadcaster, ConsoleOperatorInput.stdin(), consoleEnabled);
    }

    @Bean
    public ServerInfo serverInfo(ConnectionRegistry registry) {
        ServerInfo info = new ServerInfo(List.of(
                new OsInfo(),
                new JavaRuntimeInfo(),
                new HostnameInfo(),
                new CpuInfo(),
                new LiveConnectionsInfo(registry)));
        info.lines().forEach(line -> log.info("[BOOT] {}", line));
        return info;
    }
}
