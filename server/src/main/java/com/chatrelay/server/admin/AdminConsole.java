package com.chatrelay.server.admin;

import com.chatrelay.common.input.OperatorInput;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@link AdminBroadcaster} loop over the server console on a daemon thread.
 */
public class AdminConsole {
    private static final Logger log = LoggerFactory.getLogger(AdminConsole.class);

    private final AdminBroadcaster broadcaster;
    private final OperatorInput input;
    private final boolean enabled;

    private Thread thread;

    public AdminConsole(AdminBroadcaster broadcaster, OperatorInput input, boolean enabled) {
        this.broadcaster = broadcaster;
        this.input = input;
        this.enabled = enabled;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("[BOOT] admin console disabled");
            return;
        }
        thread = new Thread(() -> {
            int n = broadcaster.run(input);
            log.info("[ADMIN] console loop ended after {} broadcast(s)", n);
        }, "admin-console");
        thread.setDaemon(true);
        thread.start();
        log.info("[BOOT] admin console started, lines are broadcast as '{}'", broadcaster.adminIdentity());
    }

    @PreDestroy
    public void stop() {
        if (thread != null) thread.interrupt();
    }
}
