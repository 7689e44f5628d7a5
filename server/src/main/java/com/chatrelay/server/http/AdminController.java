package com.chatrelay.server.http;

import com.chatrelay.server.admin.AdminBroadcaster;
import com.chatrelay.server.info.ServerInfo;
import com.chatrelay.server.session.BroadcastReport;
import com.chatrelay.server.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * HTTP side of the administrative path: broadcast, session teardown and server info.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {
    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final AdminBroadcaster broadcaster;
    private final SessionManager sessions;
    private final ServerInfo serverInfo;

    public AdminController(AdminBroadcaster broadcaster, SessionManager sessions, ServerInfo serverInfo) {
        this.broadcaster = broadcaster;
        this.sessions = sessions;
        this.serverInfo = serverInfo;
    }

    @PostMapping("/broadcast")
    public ResponseEntity<BroadcastReport> broadcast(@RequestBody BroadcastRequest req) {
        if (req == null || req.getMessage() == null || req.getMessage().isBlank()) {
            log.warn("[WARN] empty broadcast rejected");
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(broadcaster.broadcast(req.getMessage().trim()));
    }

    @GetMapping("/sessions")
    public Set<String> sessions() {
        return sessions.registry().ids();
    }

    @DeleteMapping("/sessions/{id}")
    public ResponseEntity<Void> shutdown(@PathVariable("id") String id) {
        if (sessions.shutdownSession(id)) {
            return ResponseEntity.accepted().build();
        }
        return ResponseEntity.notFound().build();
    }

    @GetMapping("/info")
    public Map<String, String> info(@RequestParam(name = "keys", required = false) List<String> keys) {
        return serverInfo.snapshot(keys);
    }

    public static class BroadcastRequest {
        private String message;
        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }
}
