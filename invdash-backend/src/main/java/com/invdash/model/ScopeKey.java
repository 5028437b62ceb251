package com.invdash.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Normalized cache key: scope, target hosts and detail level.
 *
 * <p>Hosts are trimmed, lowercased, deduplicated and sorted on construction, so two requests for
 * the same logical data always produce equal keys regardless of ordering or casing.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScopeKey {
    public static final String DEFAULT_LEVEL = "summary";

    ScopeName scope;
    List<String> hosts;
    String level;

    public static ScopeKey of(ScopeName scope, Collection<String> hosts, String level) {
        Objects.requireNonNull(scope, "scope");
        TreeSet<String> normalized = new TreeSet<>();
        if (hosts != null) {
            for (String host : hosts) {
                String h = normalizeHost(host);
                if (!h.isEmpty()) {
                    normalized.add(h);
                }
            }
        }
        return new ScopeKey(scope, List.copyOf(normalized), normalizeLevel(level));
    }

    public static ScopeKey of(ScopeName scope, Collection<String> hosts) {
        return of(scope, hosts, DEFAULT_LEVEL);
    }

    public static String normalizeHost(String host) {
        return host == null ? "" : host.trim().toLowerCase(Locale.ROOT);
    }

    public static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return DEFAULT_LEVEL;
        }
        return level.trim().toLowerCase(Locale.ROOT);
    }

    public boolean containsHost(String host) {
        return hosts.contains(normalizeHost(host));
    }

    /**
     * Comma-joined host list used as the durable store key.
     */
    public String hostsKey() {
        return String.join(",", hosts);
    }

    public String asString() {
        return scope.getValue() + ":" + hostsKey() + ":" + level;
    }
}
