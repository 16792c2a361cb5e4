package com.openforge.convo.llm.provider;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * The adapters one session has used, at most one per provider.
 *
 * Adapters are created and initialized on first use and reused for every
 * later turn.  Closing the pool closes them all.
 */
@Slf4j
public class ProviderAdapters implements AutoCloseable {

    private final Function<ProviderId, ProviderAdapter> factory;
    private final Function<ProviderId, ProviderConfig>  configResolver;
    private final Map<ProviderId, ProviderAdapter>      adapters = new EnumMap<>(ProviderId.class);

    public ProviderAdapters(Function<ProviderId, ProviderAdapter> factory,
                            Function<ProviderId, ProviderConfig> configResolver) {
        this.factory        = factory;
        this.configResolver = configResolver;
    }

    public synchronized ProviderAdapter adapterFor(ProviderId providerId) {
        return adapters.computeIfAbsent(providerId, id -> {
            ProviderAdapter adapter = factory.apply(id);
            adapter.initialize(configResolver.apply(id));
            return adapter;
        });
    }

    @Override
    public synchronized void close() {
        for (ProviderAdapter adapter : adapters.values()) {
            try {
                adapter.close();
            } catch (RuntimeException e) {
                log.warn("[ProviderAdapters] Failed to close {} adapter: {}", adapter.providerId(), e.getMessage());
            }
        }
        adapters.clear();
    }
}
