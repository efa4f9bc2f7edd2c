package com.splitttr.canvas.crdt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Comparator;

/**
 * One register of the canvas map: the latest write for a node id. A removal is a
 * tombstone so it can win against concurrent writes it has seen.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LwwEntry(
    String key,
    long clock,
    String replica,
    boolean deleted,
    JsonNode value
) {

    // Highest clock a replica may issue or accept; keeps the successor of any merged clock representable.
    static final long MAX_CLOCK = Long.MAX_VALUE - 1;

    // Total order over writes to the same key; the greater entry wins.
    static final Comparator<LwwEntry> PRECEDENCE = Comparator
        .comparingLong(LwwEntry::clock)
        .thenComparing(LwwEntry::replica)
        .thenComparing(LwwEntry::deleted)
        .thenComparing(entry -> entry.value() == null ? "" : entry.value().toString());

    public static LwwEntry write(String key, long clock, String replica, JsonNode value) {
        return new LwwEntry(key, clock, replica, false, value);
    }

    public static LwwEntry tombstone(String key, long clock, String replica) {
        return new LwwEntry(key, clock, replica, true, null);
    }

    boolean beats(LwwEntry other) {
        return other == null || PRECEDENCE.compare(this, other) > 0;
    }
}
