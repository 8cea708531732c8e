package com.machina.provisioning.provider;

import com.machina.provisioning.entity.ProviderType;
import com.machina.provisioning.exception.UnsupportedProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches to the adapter registered for a provider type.
 */
@Component
@Slf4j
public class ProviderAdapterRegistry {

    private final Map<ProviderType, ProviderAdapter> adapters = new EnumMap<>(ProviderType.class);

    public ProviderAdapterRegistry(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = this.adapters.put(adapter.providerType(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider adapter for " + adapter.providerType());
            }
        }
        log.info("Registered provider adapters: {}", this.adapters.keySet());
    }

    public ProviderAdapter get(ProviderType providerType) {
        ProviderAdapter adapter = adapters.get(providerType);
        if (adapter == null) {
            throw new UnsupportedProviderException(providerType, "any operation");
        }
        return adapter;
    }

    /**
     * Adapter for lifecycle operations; fails with UNSUPPORTED_PROVIDER for catalog-only adapters.
     */
    public ProviderAdapter getSupported(ProviderType providerType) {
        ProviderAdapter adapter = get(providerType);
        if (!adapter.isSupported()) {
            throw new UnsupportedProviderException(providerType, "machine lifecycle operations");
        }
        return adapter;
    }

    public Collection<ProviderAdapter> all() {
        return Collections.unmodifiableCollection(adapters.values());
    }
}
