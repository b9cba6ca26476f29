package com.govcomms.collector.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source exclusion tokens. At most one cycle writes a given source at a time.
 */
@Component
public class SourceLockRegistry {

    private final Set<Long> held = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(long sourceId) {
        return held.add(sourceId);
    }

    public void release(long sourceId) {
        held.remove(sourceId);
    }

    public boolean isHeld(long sourceId) {
        return held.contains(sourceId);
    }
}
