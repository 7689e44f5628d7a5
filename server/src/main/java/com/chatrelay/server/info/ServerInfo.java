package com.chatrelay.server.info;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ordered set of {@link InfoProvider}s. An empty key filter selects every provider.
 */
public class ServerInfo {

    private final List<InfoProvider> providers;

    public ServerInfo(List<InfoProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public Map<String, String> snapshot(Collection<String> keys) {
        Set<String> wanted = keys == null ? Set.of() : keys.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(String::toLowerCase)
                .collect(Collectors.toSet());

        Map<String, String> out = new LinkedHashMap<>();
        for (InfoProvider p : providers) {
            if (!wanted.isEmpty() && !wanted.contains(p.key().toLowerCase())) continue;
            out.put(p.key(), p.value());
        }
        return out;
    }

    public Map<String, String> snapshot() {
        return snapshot(null);
    }

    public List<String> lines() {
        return snapshot().entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .toList();
    }
}
