package com.invdash.collector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resolves inventory collectors by provider id.
 */
@Component
public class CollectorRegistry {
    private static final Logger log = LoggerFactory.getLogger(CollectorRegistry.class);

    private final Map<String, InventoryCollector> collectorsByProvider;

    /**
     * Builds the registry from every collector bean in the context; none is a valid setup.
     */
    @Autowired
    public CollectorRegistry(ObjectProvider<InventoryCollector> collectors) {
        this(collectors.orderedStream().toList());
    }

    /**
     * Builds the registry from an explicit collector list.
     *
     * @param collectors collectors to register
     * @throws IllegalStateException if two collectors claim the same provider
     */
    public CollectorRegistry(List<InventoryCollector> collectors) {
        Map<String, InventoryCollector> byProvider = new TreeMap<>();
        if (collectors != null) {
            for (InventoryCollector collector : collectors) {
                String provider = normalizeProvider(collector.provider());
                if (provider.isEmpty()) {
                    throw new IllegalArgumentException("Collector has no provider id: " + collector.getClass().getName());
                }
                InventoryCollector existing = byProvider.putIfAbsent(provider, collector);
                if (existing != null) {
                    throw new IllegalStateException("Ambiguous collectors for provider '" + provider + "': "
                            + existing.getClass().getName() + ", " + collector.getClass().getName());
                }
            }
        }
        this.collectorsByProvider = Collections.unmodifiableMap(byProvider);
        log.info("Registered {} inventory collectors: {}", byProvider.size(), byProvider.keySet());
    }

    public Optional<InventoryCollector> find(String provider) {
        return Optional.ofNullable(collectorsByProvider.get(normalizeProvider(provider)));
    }

    public Set<String> providers() {
        return collectorsByProvider.keySet();
    }

    public static String normalizeProvider(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }
}
