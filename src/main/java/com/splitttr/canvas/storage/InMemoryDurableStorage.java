package com.splitttr.canvas.storage;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local storage. Snapshots survive room eviction but not a restart.
 */
public class InMemoryDurableStorage implements DurableStorage {

    private final ConcurrentHashMap<String, byte[]> values = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(values.get(key)).map(byte[]::clone);
    }

    @Override
    public void put(String key, byte[] value) {
        values.put(key, value.clone());
    }

    public Set<String> keys() {
        return Set.copyOf(values.keySet());
    }
}
