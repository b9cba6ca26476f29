package com.govcomms.collector.service.fetch;

import com.govcomms.collector.entity.SourceKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ItemFetcherRegistry {

    private final Map<SourceKind, ItemFetcher> fetchers = new EnumMap<>(SourceKind.class);

    public ItemFetcherRegistry(List<ItemFetcher> fetchers) {
        for (ItemFetcher fetcher : fetchers) {
            ItemFetcher previous = this.fetchers.put(fetcher.kind(), fetcher);
            if (previous != null) {
                throw new IllegalStateException("Duplicate fetcher for kind " + fetcher.kind());
            }
        }
    }

    public ItemFetcher forKind(SourceKind kind) {
        ItemFetcher fetcher = fetchers.get(kind);
        if (fetcher == null) {
            throw new IllegalArgumentException("No fetcher registered for kind " + kind);
        }
        return fetcher;
    }
}
