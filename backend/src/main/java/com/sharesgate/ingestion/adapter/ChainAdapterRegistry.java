package com.sharesgate.ingestion.adapter;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Enabled chain adapters by name. Duplicate names fail startup.
 */
@Component
public class ChainAdapterRegistry {

    private final Map<String, ChainAdapter> adaptersByName;

    public ChainAdapterRegistry(List<ChainAdapter> adapters) {
        Map<String, ChainAdapter> byName = new LinkedHashMap<>();
        for (ChainAdapter adapter : adapters) {
            ChainAdapter previous = byName.putIfAbsent(adapter.name(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate chain adapter name: " + adapter.name());
            }
        }
        this.adaptersByName = Collections.unmodifiableMap(byName);
    }

    public Optional<ChainAdapter> find(String chainType) {
        return chainType == null ? Optional.empty() : Optional.ofNullable(adaptersByName.get(chainType));
    }

    public Collection<ChainAdapter> all() {
        return adaptersByName.values();
    }
}
