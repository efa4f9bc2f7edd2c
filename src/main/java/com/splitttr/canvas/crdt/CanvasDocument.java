package com.splitttr.canvas.crdt;

/**
 * Opaque, state-based replicated canvas state. Merging is commutative, associative
 * and idempotent, so replicas that have seen the same set of updates hold equal
 * snapshots regardless of delivery order or duplication.
 *
 * <p>Implementations are not thread-safe; a room mutates its document only from
 * its own mailbox.
 */
public interface CanvasDocument {

    /**
     * Merges an update into local state. The whole update is decoded before any
     * entry is merged, so a malformed update leaves the document untouched.
     *
     * @throws MalformedUpdateException if the bytes are not a valid update
     */
    void applyUpdate(byte[] update);

    /**
     * Self-contained serialization of the current state, enough to initialize a
     * fresh replica. Equal states encode to equal bytes.
     */
    byte[] encodeSnapshot();

    /**
     * Initializes the document from a snapshot. Only used when a room is created,
     * before any session is admitted.
     */
    void restore(byte[] snapshot);

    /**
     * Encodes what this replica holds beyond {@code priorSnapshot}: the entries the
     * prior state is missing or would lose to.
     */
    byte[] encodeDelta(byte[] priorSnapshot);

    boolean isEmpty();
}
