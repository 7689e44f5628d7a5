package com.chatrelay.server.admin;

import com.chatrelay.common.input.OperatorInput;
import com.chatrelay.common.model.ChatMessage;
import com.chatrelay.server.session.BroadcastReport;
import com.chatrelay.server.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns operator lines into messages fanned out to every registered connection.
 * Independent of any single connection's lifecycle.
 */
public class AdminBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(AdminBroadcaster.class);

    private final ConnectionRegistry registry;
    private final String adminIdentity;
    private final String sentinel;

    public AdminBroadcaster(ConnectionRegistry registry, String adminIdentity, String sentinel) {
        this.registry = registry;
        this.adminIdentity = adminIdentity;
        this.sentinel = sentinel;
    }

    /**
     * Reads until the sentinel line or input exhaustion. Existing sessions are unaffected
     * either way.
     *
     * @return number of lines broadcast
     */
    public int run(OperatorInput input) {
        int count = 0;
        while (true) {
            String line;
            try {
                line = input.nextLine();
            } catch (IOException e) {
                log.warn("[ADMIN] operator input failed, broadcaster stopping: {}", e.getMessage());
                break;
            }
            if (line == null) {
                log.info("[ADMIN] operator input exhausted, broadcaster stopping");
                break;
            }
            if (OperatorInput.isSentinel(line, sentinel)) {
                log.info("[ADMIN] sentinel received, broadcaster stopping");
                break;
            }
            String text = line.trim();
            if (text.isEmpty()) continue;
            broadcast(text);
            count++;
        }
        return count;
    }

    public BroadcastReport broadcast(String text) {
        BroadcastReport report = registry.broadcast(ChatMessage.of(text, adminIdentity));
        log.info("[BROADCAST] targets={} delivered={} dropped={} gone={}",
                report.targets(), report.delivered(), report.dropped(), report.gone());
        return report;
    }

    public String adminIdentity() {
        return adminIdentity;
    }
}
