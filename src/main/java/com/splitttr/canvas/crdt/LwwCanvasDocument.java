package com.splitttr.canvas.crdt;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Last-writer-wins map of canvas nodes keyed by node id, ordered by Lamport clock
 * with the replica id as tie breaker.
 */
public class LwwCanvasDocument implements CanvasDocument {

    private final String replicaId;
    // sorted so snapshots of equal states are byte-identical
    private final TreeMap<String, LwwEntry> entries = new TreeMap<>();
    private long clock;

    public LwwCanvasDocument() {
        this(UUID.randomUUID().toString());
    }

    public LwwCanvasDocument(String replicaId) {
        if (replicaId == null || replicaId.isEmpty()) {
            throw new IllegalArgumentException("replicaId required");
        }
        this.replicaId = replicaId;
    }

    @Override
    public void applyUpdate(byte[] update) {
        DeltaCodec.decode(update).forEach(this::merge);
    }

    @Override
    public byte[] encodeSnapshot() {
        return DeltaCodec.encode(entries.values());
    }

    @Override
    public void restore(byte[] snapshot) {
        applyUpdate(snapshot);
    }

    @Override
    public byte[] encodeDelta(byte[] priorSnapshot) {
        Map<String, LwwEntry> prior = new HashMap<>();
        for (LwwEntry entry : DeltaCodec.decode(priorSnapshot)) {
            if (entry.beats(prior.get(entry.key()))) {
                prior.put(entry.key(), entry);
            }
        }
        List<LwwEntry> missing = new ArrayList<>();
        for (LwwEntry entry : entries.values()) {
            if (entry.beats(prior.get(entry.key()))) {
                missing.add(entry);
            }
        }
        return DeltaCodec.encode(missing);
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Writes a node locally and returns the update to ship to other replicas.
     */
    public byte[] put(String key, JsonNode value) {
        if (value == null) {
            throw new IllegalArgumentException("value required, use remove() to delete " + key);
        }
        return commit(LwwEntry.write(key, tick(), replicaId, value.deepCopy()));
    }

    /**
     * Removes a node locally and returns the update to ship to other replicas.
     */
    public byte[] remove(String key) {
        return commit(LwwEntry.tombstone(key, tick(), replicaId));
    }

    public Optional<JsonNode> get(String key) {
        LwwEntry entry = entries.get(key);
        if (entry == null || entry.deleted()) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Live nodes in key order; tombstones are left out.
     */
    public Map<String, JsonNode> values() {
        Map<String, JsonNode> live = new LinkedHashMap<>();
        entries.forEach((key, entry) -> {
            if (!entry.deleted()) {
                live.put(key, entry.value());
            }
        });
        return Collections.unmodifiableMap(live);
    }

    private long tick() {
        if (clock >= LwwEntry.MAX_CLOCK) {
            throw new IllegalStateException("Lamport clock exhausted on replica " + replicaId);
        }
        return ++clock;
    }

    private byte[] commit(LwwEntry entry) {
        merge(entry);
        return DeltaCodec.encode(List.of(entry));
    }

    private void merge(LwwEntry incoming) {
        if (incoming.beats(entries.get(incoming.key()))) {
            entries.put(incoming.key(), incoming);
        }
        clock = Math.max(clock, incoming.clock());
    }
}
